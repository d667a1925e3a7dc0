package com.scholary.captions.api;

import com.scholary.captions.api.JobStatusResponse.Status;
import com.scholary.captions.caption.CaptionFormat;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.service.CaptionJobService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST API for caption generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a caption job for a media source or an uploaded file (returns job ID
 *       immediately)
 *   <li>Job status polling
 *   <li>Downloading the caption file or the captioned video of a completed job
 *   <li>Cancelling a job
 * </ul>
 */
@RestController
@Tag(name = "Captions", description = "Caption generation API")
public class CaptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionController.class);
  private static final MediaType VIDEO_MP4 = MediaType.parseMediaType("video/mp4");

  private final CaptionJobService captionJobService;

  public CaptionController(CaptionJobService captionJobService) {
    this.captionJobService = captionJobService;
  }

  /** Start an asynchronous caption job. */
  @PostMapping("/api/captions")
  @Operation(
      summary = "Start caption generation",
      description = "Start an asynchronous caption job and return its ID for status polling")
  public ResponseEntity<AsyncJobResponse> createCaptions(
      @Valid @RequestBody CaptionRequest request) {
    LOGGER.info("Caption request: source={}, format={}", request.source(), request.format());

    CaptionJob job = captionJobService.submit(request);
    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(job.getJobId(), "/api/jobs/" + job.getJobId()));
  }

  /** Upload a media file and start an asynchronous caption job for it. */
  @PostMapping(value = "/api/captions/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload media and start caption generation",
      description = "Store the uploaded file with the job and caption it like a local source")
  public ResponseEntity<AsyncJobResponse> uploadCaptions(
      @RequestPart("file") MultipartFile file,
      @RequestParam(value = "format", required = false) String format,
      @RequestParam(value = "chunkSeconds", required = false) Double chunkSeconds,
      @RequestParam(value = "embed", required = false) Boolean embed,
      @RequestParam(value = "save", required = false) Boolean save) {
    LOGGER.info(
        "Caption upload: name={}, bytes={}, format={}",
        file.getOriginalFilename(),
        file.getSize(),
        format);

    CaptionJob job = captionJobService.submitUpload(file, format, chunkSeconds, embed, save);
    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(job.getJobId(), "/api/jobs/" + job.getJobId()));
  }

  /** Get job status, including the result once completed. */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of a caption job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return captionJobService
        .findJob(id)
        .map(job -> ResponseEntity.ok(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  /** Download the caption file of a completed job. */
  @GetMapping("/api/jobs/{id}/captions")
  @Operation(
      summary = "Download captions",
      description = "Return the SRT or WebVTT file of a completed job")
  public ResponseEntity<String> getCaptions(@PathVariable String id) {
    Optional<CaptionJob> job = captionJobService.findJob(id);
    if (job.isEmpty() || job.get().getStatus() != Status.COMPLETED) {
      return ResponseEntity.notFound().build();
    }

    CaptionResponse result = job.get().getResult();
    CaptionFormat format = CaptionFormat.fromName(result.format());
    try {
      String body = Files.readString(Path.of(result.captionPath()), StandardCharsets.UTF_8);
      return ResponseEntity.ok()
          .contentType(MediaType.parseMediaType(format.mediaType() + ";charset=UTF-8"))
          .body(body);
    } catch (IOException e) {
      throw new UncheckedIOException("Caption file missing for job " + id, e);
    }
  }

  /** Download the video with embedded captions of a completed job. */
  @GetMapping("/api/jobs/{id}/video")
  @Operation(
      summary = "Download captioned video",
      description = "Return the video with the embedded subtitle stream of a completed job")
  public ResponseEntity<Resource> getVideo(@PathVariable String id) {
    Optional<CaptionJob> job = captionJobService.findJob(id);
    if (job.isEmpty() || job.get().getStatus() != Status.COMPLETED) {
      return ResponseEntity.notFound().build();
    }

    String videoPath = job.get().getResult().videoPath();
    if (videoPath == null || !Files.isRegularFile(Path.of(videoPath))) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok()
        .contentType(VIDEO_MP4)
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.inline().filename("video_with_captions.mp4").build().toString())
        .body(new FileSystemResource(videoPath));
  }

  /** Cancel a pending or running job. */
  @DeleteMapping("/api/jobs/{id}")
  @Operation(summary = "Cancel job", description = "Cancel a pending or running caption job")
  public ResponseEntity<JobStatusResponse> cancelJob(@PathVariable String id) {
    Optional<CaptionJob> job = captionJobService.findJob(id);
    if (job.isEmpty()) {
      return ResponseEntity.notFound().build();
    }
    if (!captionJobService.cancel(id)) {
      return ResponseEntity.status(HttpStatus.CONFLICT).body(toStatusResponse(job.get()));
    }
    return ResponseEntity.ok(toStatusResponse(job.get()));
  }

  private static JobStatusResponse toStatusResponse(CaptionJob job) {
    return new JobStatusResponse(
        job.getJobId(),
        job.getStatus(),
        job.getProgress(),
        job.getResult(),
        job.getError(),
        job.getCreatedAt(),
        job.getUpdatedAt());
  }
}
