package com.scholary.captions.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.service.CaptionJobService;
import com.scholary.captions.transcript.Segment;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(CaptionController.class)
class CaptionControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private CaptionJobService captionJobService;

  @TempDir Path tempDir;

  private static CaptionJob job(String id) {
    return new CaptionJob(id, new CaptionRequest("/data/episode.mp4", "srt", null, null, null));
  }

  @Test
  void createCaptions_shouldReturnJobIdAndStatusUrl() throws Exception {
    when(captionJobService.submit(any())).thenReturn(job("job-1"));

    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"/data/episode.mp4\", \"format\": \"vtt\"}"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-1"))
        .andExpect(jsonPath("$.statusUrl").value("/api/jobs/job-1"));
  }

  @Test
  void createCaptions_shouldRejectBlankSource() throws Exception {
    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Validation failed"))
        .andExpect(jsonPath("$.details.source").exists());

    verify(captionJobService, never()).submit(any());
  }

  @Test
  void createCaptions_shouldRejectNonPositiveChunkLength() throws Exception {
    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"/data/a.mp4\", \"chunkSeconds\": 0}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.details.chunkSeconds").exists());
  }

  @Test
  void createCaptions_shouldMapInvalidArgumentsToBadRequest() throws Exception {
    when(captionJobService.submit(any()))
        .thenThrow(new IllegalArgumentException("Unsupported caption format: ass"));

    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"/data/a.mp4\", \"format\": \"ass\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Unsupported caption format: ass"));
  }

  @Test
  void createCaptions_shouldReturnServiceUnavailableWhenQueueIsFull() throws Exception {
    when(captionJobService.submit(any())).thenThrow(new TaskRejectedException("queue full"));

    mockMvc
        .perform(
            post("/api/captions")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"source\": \"/data/a.mp4\"}"))
        .andExpect(status().isServiceUnavailable());
  }

  @Test
  void getJobStatus_shouldReturnStatusOrNotFound() throws Exception {
    CaptionJob job = job("job-1");
    job.markProcessing();
    job.updateProgress(40);
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(job));
    when(captionJobService.findJob("missing")).thenReturn(Optional.empty());

    mockMvc
        .perform(get("/api/jobs/job-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.progress").value(40));
    mockMvc.perform(get("/api/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void getCaptions_shouldServeCaptionFileOfCompletedJob() throws Exception {
    Path captions =
        Files.writeString(
            tempDir.resolve("captions.srt"), "1\n00:00:00,000 --> 00:00:01,000\nHi\n\n");
    CaptionJob job = job("job-1");
    job.complete(
        new CaptionResponse(
            List.of(Segment.speech("Hi", 0.0, 1.0)),
            "srt",
            captions.toString(),
            null,
            null,
            new CaptionResponse.Diagnostics(1, 0, 0, 0, false, 1.0),
            null));
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1/captions"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", "text/srt;charset=UTF-8"))
        .andExpect(content().string("1\n00:00:00,000 --> 00:00:01,000\nHi\n\n"));
  }

  @Test
  void getCaptions_shouldReturnNotFoundUntilCompleted() throws Exception {
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(job("job-1")));

    mockMvc.perform(get("/api/jobs/job-1/captions")).andExpect(status().isNotFound());
  }

  @Test
  void cancelJob_shouldReportConflictForFinishedJobs() throws Exception {
    CaptionJob running = job("job-1");
    CaptionJob failed = job("job-2");
    failed.fail("boom");
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(running));
    when(captionJobService.findJob("job-2")).thenReturn(Optional.of(failed));
    when(captionJobService.findJob("missing")).thenReturn(Optional.empty());
    when(captionJobService.cancel("job-1")).thenReturn(true);
    when(captionJobService.cancel("job-2")).thenReturn(false);

    mockMvc.perform(delete("/api/jobs/job-1")).andExpect(status().isOk());
    mockMvc
        .perform(delete("/api/jobs/job-2"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.status").value("FAILED"));
    mockMvc.perform(delete("/api/jobs/missing")).andExpect(status().isNotFound());
  }

  @Test
  void uploadCaptions_shouldSubmitUploadedFile() throws Exception {
    when(captionJobService.submitUpload(any(), eq("vtt"), eq(12.5), isNull(), eq(true)))
        .thenReturn(job("job-7"));
    MockMultipartFile file =
        new MockMultipartFile("file", "clip.mp4", "video/mp4", new byte[] {1, 2, 3});

    mockMvc
        .perform(
            multipart("/api/captions/upload")
                .file(file)
                .param("format", "vtt")
                .param("chunkSeconds", "12.5")
                .param("save", "true"))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value("job-7"))
        .andExpect(jsonPath("$.statusUrl").value("/api/jobs/job-7"));

    verify(captionJobService)
        .submitUpload(
            argThat(f -> "clip.mp4".equals(f.getOriginalFilename()) && f.getSize() == 3),
            eq("vtt"),
            eq(12.5),
            isNull(),
            eq(true));
  }

  @Test
  void uploadCaptions_shouldMapEmptyUploadToBadRequest() throws Exception {
    when(captionJobService.submitUpload(any(), any(), any(), any(), any()))
        .thenThrow(new IllegalArgumentException("Uploaded file is empty"));

    mockMvc
        .perform(
            multipart("/api/captions/upload")
                .file(new MockMultipartFile("file", "clip.mp4", "video/mp4", new byte[0])))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Uploaded file is empty"));
  }

  @Test
  void getVideo_shouldStreamCaptionedVideoOfCompletedJob() throws Exception {
    Path video = Files.write(tempDir.resolve("video_with_captions.mp4"), new byte[] {7, 8, 9});
    CaptionJob job = job("job-1");
    job.complete(completedResult(video.toString()));
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(job));

    mockMvc
        .perform(get("/api/jobs/job-1/video"))
        .andExpect(status().isOk())
        .andExpect(header().string("Content-Type", "video/mp4"))
        .andExpect(content().bytes(new byte[] {7, 8, 9}));
  }

  @Test
  void getVideo_shouldReturnNotFoundUntilCompletedOrWithoutVideo() throws Exception {
    CaptionJob running = job("job-1");
    running.markProcessing();
    CaptionJob audioOnly = job("job-2");
    audioOnly.complete(completedResult(null));
    CaptionJob fileGone = job("job-3");
    fileGone.complete(completedResult(tempDir.resolve("deleted.mp4").toString()));
    when(captionJobService.findJob("job-1")).thenReturn(Optional.of(running));
    when(captionJobService.findJob("job-2")).thenReturn(Optional.of(audioOnly));
    when(captionJobService.findJob("job-3")).thenReturn(Optional.of(fileGone));
    when(captionJobService.findJob("missing")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/jobs/job-1/video")).andExpect(status().isNotFound());
    mockMvc.perform(get("/api/jobs/job-2/video")).andExpect(status().isNotFound());
    mockMvc.perform(get("/api/jobs/job-3/video")).andExpect(status().isNotFound());
    mockMvc.perform(get("/api/jobs/missing/video")).andExpect(status().isNotFound());
  }

  private CaptionResponse completedResult(String videoPath) {
    return new CaptionResponse(
        List.of(Segment.speech("Hi", 0.0, 1.0)),
        "srt",
        tempDir.resolve("captions.srt").toString(),
        null,
        videoPath,
        new CaptionResponse.Diagnostics(1, 0, 0, 0, false, 1.0),
        null);
  }
}
