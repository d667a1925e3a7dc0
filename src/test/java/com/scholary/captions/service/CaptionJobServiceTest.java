package com.scholary.captions.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.JobStatusResponse.Status;
import com.scholary.captions.audio.AudioExtractor;
import com.scholary.captions.caption.CaptionFormatter;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.job.JobRepository;
import com.scholary.captions.media.AcquiredMedia;
import com.scholary.captions.media.MediaAcquirer;
import com.scholary.captions.media.MediaAcquisitionException;
import com.scholary.captions.media.MediaProperties;
import com.scholary.captions.media.MediaSource;
import com.scholary.captions.media.SubtitleMuxer;
import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreProperties;
import com.scholary.captions.support.AudioFixtures;
import com.scholary.captions.support.TestProperties;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.Transcript;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.mock.web.MockMultipartFile;

@ExtendWith(MockitoExtension.class)
class CaptionJobServiceTest {

  @Mock private MediaAcquirer mediaAcquirer;
  @Mock private AudioExtractor audioExtractor;
  @Mock private CaptionPipeline captionPipeline;
  @Mock private SubtitleMuxer subtitleMuxer;
  @Mock private ObjectStoreClient objectStoreClient;

  @TempDir Path tempDir;

  private JobRepository jobRepository;
  private CaptionJobService service;
  private Path outputRoot;
  private Path workRoot;
  private Path video;

  @BeforeEach
  void setUp() throws Exception {
    outputRoot = tempDir.resolve("output");
    workRoot = tempDir.resolve("work");
    video = Files.writeString(tempDir.resolve("episode.mp4"), "video");

    PipelineProperties defaults = TestProperties.pipeline();
    PipelineProperties pipelineProperties =
        new PipelineProperties(
            defaults.chunkDurationSeconds(),
            defaults.placeholderSeconds(),
            defaults.workerThreads(),
            defaults.jobThreads(),
            defaults.jobQueueSize(),
            outputRoot.toString(),
            defaults.gaps(),
            defaults.optimizer(),
            defaults.cache());
    MediaProperties mediaProperties =
        new MediaProperties("ffmpeg", "yt-dlp", 16000, workRoot.toString());
    ObjectStoreProperties objectStoreProperties =
        new ObjectStoreProperties(
            "http://localhost:9000", "admin", "admin123", "captions", "us-east-1", true);

    jobRepository = new JobRepository(100, 60);
    service =
        new CaptionJobService(
            mediaAcquirer,
            audioExtractor,
            captionPipeline,
            new CaptionFormatter(),
            new TranscriptWriter(new ObjectMapper(), objectStoreClient, objectStoreProperties),
            subtitleMuxer,
            jobRepository,
            pipelineProperties,
            mediaProperties,
            // runs submitted jobs on the calling thread
            new TaskExecutorAdapter(Runnable::run));
  }

  private void stubPipeline(Path media) {
    when(mediaAcquirer.acquire(any(), any())).thenReturn(new AcquiredMedia(media, "fp"));
    when(audioExtractor.extract(eq(media), any())).thenReturn(AudioFixtures.silence(65.0));
    stubPipelineRun();
  }

  private void stubPipelineRun() {
    Transcript transcript =
        new Transcript(
            List.of(
                Segment.speech("Hello world", 0.0, 30.0),
                Segment.speech("[Transcription unavailable 60.00s - 65.00s]", 60.0, 65.0)));
    when(captionPipeline.run(any(), anyDouble(), any(), any()))
        .thenReturn(new PipelineResult(transcript, 3, 1, 0, 0, false));
  }

  @Test
  void submit_shouldWriteCaptionsAndEmbedThemInVideo() throws Exception {
    stubPipeline(video);
    when(subtitleMuxer.mux(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));

    CaptionJob job =
        service.submit(new CaptionRequest(video.toString(), null, null, null, null));

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getProgress()).isEqualTo(100);
    Path outputDir = outputRoot.resolve(job.getJobId());
    Path captions = outputDir.resolve("captions.srt");
    assertThat(Files.readString(captions))
        .startsWith("1\n00:00:00,000 --> 00:00:30,000\nHello world\n\n2\n");
    assertThat(outputDir.resolve("transcript.json")).exists();
    verify(subtitleMuxer).mux(video, captions, outputDir.resolve("video_with_captions.mp4"));

    assertThat(job.getResult().format()).isEqualTo("srt");
    assertThat(job.getResult().videoPath())
        .isEqualTo(outputDir.resolve("video_with_captions.mp4").toString());
    assertThat(job.getResult().diagnostics().windows()).isEqualTo(3);
    assertThat(job.getResult().diagnostics().fallbackWindows()).isEqualTo(1);
    assertThat(job.getResult().diagnostics().durationSeconds()).isEqualTo(65.0);
    assertThat(job.getResult().storageInfo()).isNull();
    assertThat(workRoot.resolve(job.getJobId())).doesNotExist();
  }

  @Test
  void submit_shouldMuxSrtRenditionForVttJobs() throws Exception {
    stubPipeline(video);
    when(subtitleMuxer.mux(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));

    CaptionJob job =
        service.submit(new CaptionRequest(video.toString(), "vtt", null, true, false));

    Path outputDir = outputRoot.resolve(job.getJobId());
    assertThat(Files.readString(outputDir.resolve("captions.vtt"))).startsWith("WEBVTT\n\n");
    assertThat(outputDir.resolve("captions.srt")).exists();
    verify(subtitleMuxer)
        .mux(
            video,
            outputDir.resolve("captions.srt"),
            outputDir.resolve("video_with_captions.mp4"));
    assertThat(job.getResult().captionPath())
        .isEqualTo(outputDir.resolve("captions.vtt").toString());
  }

  @Test
  void submit_shouldSkipEmbeddingForAudioOnlySources() throws Exception {
    Path podcast = Files.writeString(tempDir.resolve("podcast.mp3"), "audio");
    stubPipeline(podcast);

    CaptionJob job =
        service.submit(new CaptionRequest(podcast.toString(), "srt", null, true, false));

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(job.getResult().videoPath()).isNull();
    verifyNoInteractions(subtitleMuxer);
  }

  @Test
  void submit_shouldPassChunkOverrideToPipeline() {
    stubPipeline(video);

    CaptionJob job =
        service.submit(new CaptionRequest(video.toString(), "srt", 10.0, false, false));

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    verify(captionPipeline).run(any(), eq(10.0), any(), any());
  }

  @Test
  void submit_shouldPublishOutputsWhenSaving() throws Exception {
    stubPipeline(video);
    when(objectStoreClient.presignGet(anyString(), anyString(), any(Duration.class)))
        .thenReturn(new URL("http://localhost:9000/captions/signed"));

    CaptionJob job =
        service.submit(new CaptionRequest(video.toString(), "srt", null, false, true));

    String prefix = "captions/" + job.getJobId() + "/";
    verify(objectStoreClient)
        .putObject(
            eq("captions"), eq(prefix + "captions.srt"), any(), eq("text/srt; charset=utf-8"));
    verify(objectStoreClient)
        .putObject(eq("captions"), eq(prefix + "transcript.json"), any(), eq("application/json"));
    assertThat(job.getResult().storageInfo().captionKey()).isEqualTo(prefix + "captions.srt");
    assertThat(job.getResult().storageInfo().captionUrl())
        .isEqualTo("http://localhost:9000/captions/signed");
  }

  @Test
  void submitUpload_shouldCaptionStoredFileAsLocalSource() throws Exception {
    AtomicReference<MediaSource> acquired = new AtomicReference<>();
    AtomicReference<String> uploadContent = new AtomicReference<>();
    when(mediaAcquirer.acquire(any(), any()))
        .thenAnswer(
            inv -> {
              MediaSource source = inv.getArgument(0);
              Path file = Path.of(source.location());
              acquired.set(source);
              uploadContent.set(Files.readString(file));
              return new AcquiredMedia(file, "fp");
            });
    when(audioExtractor.extract(any(), any())).thenReturn(AudioFixtures.silence(65.0));
    stubPipelineRun();
    when(subtitleMuxer.mux(any(), any(), any())).thenAnswer(inv -> inv.getArgument(2));
    MockMultipartFile upload =
        new MockMultipartFile(
            "file", "My Clip.MP4", "video/mp4", "video".getBytes(StandardCharsets.UTF_8));

    CaptionJob job = service.submitUpload(upload, "vtt", null, null, null);

    assertThat(job.getStatus()).isEqualTo(Status.COMPLETED);
    assertThat(acquired.get().type()).isEqualTo(MediaSource.Type.LOCAL);
    assertThat(Path.of(acquired.get().location()))
        .isEqualTo(workRoot.resolve(job.getJobId()).resolve("upload.mp4").toAbsolutePath());
    assertThat(uploadContent.get()).isEqualTo("video");
    assertThat(job.getResult().format()).isEqualTo("vtt");
    assertThat(job.getResult().videoPath()).endsWith("video_with_captions.mp4");
    // the upload goes away with the work directory
    assertThat(workRoot.resolve(job.getJobId())).doesNotExist();
  }

  @Test
  void submitUpload_shouldRejectEmptyFileAndBadOptions() {
    MockMultipartFile empty = new MockMultipartFile("file", "clip.mp4", "video/mp4", new byte[0]);
    MockMultipartFile clip =
        new MockMultipartFile("file", "clip.mp4", "video/mp4", new byte[] {1, 2, 3});

    assertThatThrownBy(() -> service.submitUpload(empty, "srt", null, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("empty");
    assertThatThrownBy(() -> service.submitUpload(clip, "srt", 0.0, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("chunkSeconds");
    assertThatThrownBy(() -> service.submitUpload(clip, "ass", null, null, null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported caption format");
    verifyNoInteractions(mediaAcquirer);
    assertThat(workRoot).doesNotExist();
  }

  @Test
  void submit_shouldRecordAcquisitionFailure() {
    when(mediaAcquirer.acquire(any(), any()))
        .thenThrow(new MediaAcquisitionException("Media file not found: /nope.mp4"));

    CaptionJob job = service.submit(new CaptionRequest("/nope.mp4", "srt", null, true, false));

    assertThat(job.getStatus()).isEqualTo(Status.FAILED);
    assertThat(job.getError()).contains("Media file not found");
    assertThat(service.findJob(job.getJobId())).containsSame(job);
    verifyNoInteractions(captionPipeline);
  }

  @Test
  void submit_shouldRejectUnsupportedFormat() {
    assertThatThrownBy(
            () -> service.submit(new CaptionRequest(video.toString(), "ass", null, null, null)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unsupported caption format");
    verifyNoInteractions(mediaAcquirer);
  }

  @Test
  void process_shouldMarkJobCancelledWhenPipelineIsInterrupted() {
    when(mediaAcquirer.acquire(any(), any())).thenReturn(new AcquiredMedia(video, "fp"));
    when(audioExtractor.extract(eq(video), any())).thenReturn(AudioFixtures.silence(65.0));
    when(captionPipeline.run(any(), anyDouble(), any(), any()))
        .thenThrow(new CancellationException("Caption pipeline interrupted"));

    CaptionJob job =
        service.submit(new CaptionRequest(video.toString(), "srt", null, true, false));

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    assertThat(outputRoot.resolve(job.getJobId()).resolve("captions.srt")).doesNotExist();
    verifyNoInteractions(subtitleMuxer);
  }

  @Test
  void cancel_shouldStopPendingJobBeforeItRuns() {
    CaptionJob job =
        new CaptionJob("job-1", new CaptionRequest(video.toString(), "srt", null, true, false));
    jobRepository.save(job);

    assertThat(service.cancel("job-1")).isTrue();
    service.process(job);

    assertThat(job.getStatus()).isEqualTo(Status.CANCELLED);
    assertThat(service.cancel("job-1")).isFalse();
    assertThat(service.cancel("unknown")).isFalse();
    verifyNoInteractions(mediaAcquirer);
  }
}
