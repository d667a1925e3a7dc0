package com.scholary.captions.service;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.CaptionResponse;
import com.scholary.captions.audio.AudioExtractor;
import com.scholary.captions.audio.AudioTrack;
import com.scholary.captions.caption.CaptionFormat;
import com.scholary.captions.caption.CaptionFormatter;
import com.scholary.captions.config.PipelineProperties;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.job.JobRepository;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.media.AcquiredMedia;
import com.scholary.captions.media.MediaAcquirer;
import com.scholary.captions.media.MediaProperties;
import com.scholary.captions.media.MediaSource;
import com.scholary.captions.media.SubtitleMuxer;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Runs caption jobs end to end.
 *
 * <p>A job acquires the media, decodes its audio, runs the caption pipeline, writes the caption
 * file and transcript JSON to {@code <outputDir>/<jobId>/}, optionally embeds the captions into a
 * copy of the video, and optionally publishes the outputs to the object store.
 *
 * <p>Jobs run on the job executor. Cancelling a job interrupts its thread; the pipeline then
 * cancels its in-flight windows and no caption file is written.
 */
@Service
public class CaptionJobService {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionJobService.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);
  private static final Pattern UPLOAD_EXTENSION = Pattern.compile("[A-Za-z0-9]{1,5}");

  private final MediaAcquirer mediaAcquirer;
  private final AudioExtractor audioExtractor;
  private final CaptionPipeline captionPipeline;
  private final CaptionFormatter captionFormatter;
  private final TranscriptWriter transcriptWriter;
  private final SubtitleMuxer subtitleMuxer;
  private final JobRepository jobRepository;
  private final PipelineProperties pipelineProperties;
  private final MediaProperties mediaProperties;
  private final AsyncTaskExecutor jobExecutor;

  private final Map<String, Future<?>> running = new ConcurrentHashMap<>();

  public CaptionJobService(
      MediaAcquirer mediaAcquirer,
      AudioExtractor audioExtractor,
      CaptionPipeline captionPipeline,
      CaptionFormatter captionFormatter,
      TranscriptWriter transcriptWriter,
      SubtitleMuxer subtitleMuxer,
      JobRepository jobRepository,
      PipelineProperties pipelineProperties,
      MediaProperties mediaProperties,
      @Qualifier("jobExecutor") AsyncTaskExecutor jobExecutor) {
    this.mediaAcquirer = mediaAcquirer;
    this.audioExtractor = audioExtractor;
    this.captionPipeline = captionPipeline;
    this.captionFormatter = captionFormatter;
    this.transcriptWriter = transcriptWriter;
    this.subtitleMuxer = subtitleMuxer;
    this.jobRepository = jobRepository;
    this.pipelineProperties = pipelineProperties;
    this.mediaProperties = mediaProperties;
    this.jobExecutor = jobExecutor;
  }

  /**
   * Validate a request and start it asynchronously.
   *
   * @return the created job, in PENDING state
   * @throws IllegalArgumentException if the format or source is invalid
   * @throws org.springframework.core.task.TaskRejectedException if the job queue is full
   */
  public CaptionJob submit(CaptionRequest request) {
    CaptionFormat.fromName(request.format());
    MediaSource.parse(request.source());
    return start(UUID.randomUUID().toString(), request);
  }

  /**
   * Store an uploaded media file in a new job's work directory and start captioning it.
   *
   * <p>The upload is removed together with the work directory when the job ends.
   *
   * @param file the uploaded media
   * @param format {@code srt} or {@code vtt}; null means {@code srt}
   * @param chunkSeconds window length override, or null
   * @param embed whether to mux the captions into a copy of the video; null means true
   * @param save whether to publish the outputs; null means false
   * @return the created job, in PENDING state
   * @throws IllegalArgumentException if the file is empty or an option is invalid
   * @throws org.springframework.core.task.TaskRejectedException if the job queue is full
   */
  public CaptionJob submitUpload(
      MultipartFile file, String format, Double chunkSeconds, Boolean embed, Boolean save) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    if (chunkSeconds != null && chunkSeconds <= 0) {
      throw new IllegalArgumentException("chunkSeconds must be positive");
    }
    if (format != null && !format.isBlank()) {
      CaptionFormat.fromName(format);
    }

    String jobId = UUID.randomUUID().toString();
    Path workDir = Path.of(mediaProperties.tempDir(), jobId);
    Path target = workDir.resolve("upload" + uploadExtension(file.getOriginalFilename()));
    try {
      Files.createDirectories(workDir);
      file.transferTo(target);
    } catch (IOException e) {
      deleteWorkDir(workDir);
      throw new UncheckedIOException("Failed to store upload for job " + jobId, e);
    }
    LOGGER.info(
        "Stored upload: jobId={}, name={}, bytes={}",
        jobId,
        file.getOriginalFilename(),
        file.getSize());

    CaptionRequest request =
        new CaptionRequest(target.toAbsolutePath().toString(), format, chunkSeconds, embed, save);
    try {
      return start(jobId, request);
    } catch (RuntimeException e) {
      deleteWorkDir(workDir);
      throw e;
    }
  }

  private CaptionJob start(String jobId, CaptionRequest request) {
    CaptionJob job = new CaptionJob(jobId, request);
    jobRepository.save(job);
    LOGGER.info("Created caption job: jobId={}, source={}", job.getJobId(), request.source());

    try {
      running.put(job.getJobId(), jobExecutor.submit(() -> process(job)));
      if (job.isTerminal()) {
        running.remove(job.getJobId());
      }
    } catch (RuntimeException e) {
      job.fail("Job could not be scheduled: " + e.getMessage());
      throw e;
    }
    return job;
  }

  public Optional<CaptionJob> findJob(String jobId) {
    return jobRepository.findById(jobId);
  }

  /**
   * Cancel a pending or running job.
   *
   * @return true if the job was cancelled, false if it was unknown or already finished
   */
  public boolean cancel(String jobId) {
    Optional<CaptionJob> job = jobRepository.findById(jobId);
    if (job.isEmpty() || !job.get().cancel()) {
      return false;
    }
    Future<?> future = running.remove(jobId);
    if (future != null) {
      future.cancel(true);
    }
    LOGGER.info("Cancelled caption job: jobId={}", jobId);
    return true;
  }

  /**
   * Run a job on the calling thread.
   *
   * <p>Failures are recorded on the job rather than thrown.
   */
  public void process(CaptionJob job) {
    String jobId = job.getJobId();
    CaptionRequest request = job.getRequest();
    StructuredLogger.setJobContext(jobId, request.source());
    Path workDir = Path.of(mediaProperties.tempDir(), jobId);

    try {
      if (!job.markProcessing()) {
        LOGGER.info("Job {} is no longer pending, skipping", jobId);
        return;
      }
      CaptionResponse response = execute(job, workDir);
      if (job.complete(response)) {
        STRUCTURED_LOGGER.logJobProgress(jobId, 0, 0, 100, "completed");
      }

    } catch (CancellationException e) {
      job.cancel();
      LOGGER.info("Caption job cancelled: jobId={}", jobId);

    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted() || job.isTerminal()) {
        job.cancel();
        LOGGER.info("Caption job stopped after cancellation: jobId={}", jobId);
      } else {
        LOGGER.error("Caption job failed: jobId={}", jobId, e);
        job.fail(e.getMessage());
      }

    } finally {
      running.remove(jobId);
      deleteWorkDir(workDir);
      StructuredLogger.clearJobContext();
    }
  }

  private CaptionResponse execute(CaptionJob job, Path workDir) {
    String jobId = job.getJobId();
    CaptionRequest request = job.getRequest();
    CaptionFormat format = CaptionFormat.fromName(request.format());
    MediaSource source = MediaSource.parse(request.source());
    double chunkSeconds =
        request.chunkSeconds() != null
            ? request.chunkSeconds()
            : pipelineProperties.chunkDurationSeconds();

    Path outputDir = Path.of(pipelineProperties.outputDir(), jobId);
    createDirectories(outputDir);
    createDirectories(workDir);

    progress(job, 5, "acquiring");
    AcquiredMedia media = mediaAcquirer.acquire(source, workDir);

    progress(job, 10, "extracting");
    AudioTrack track = audioExtractor.extract(media.file(), workDir);

    progress(job, 15, "transcribing");
    JobContext context = JobContext.create(jobId, outputDir, media.fingerprint());
    PipelineResult result =
        captionPipeline.run(
            track,
            chunkSeconds,
            context,
            (done, total) -> job.updateProgress(15 + (70 * done) / Math.max(1, total)));

    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Job cancelled before writing outputs");
    }

    progress(job, 90, "writing");
    String captions = captionFormatter.format(result.transcript(), format);
    Path captionFile = outputDir.resolve("captions." + format.extension());
    Path transcriptFile = outputDir.resolve("transcript.json");
    byte[] transcriptJson;
    try {
      transcriptJson = transcriptWriter.writeJson(result.transcript());
      Files.writeString(captionFile, captions, StandardCharsets.UTF_8);
      Files.write(transcriptFile, transcriptJson);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write caption outputs to " + outputDir, e);
    }

    Path video = null;
    if (Boolean.TRUE.equals(request.embed())) {
      if (media.hasVideo()) {
        progress(job, 95, "embedding");
        Path srt = srtFor(result, format, captionFile, outputDir);
        video = subtitleMuxer.mux(media.file(), srt, outputDir.resolve("video_with_captions.mp4"));
      } else {
        LOGGER.info("Source has no video stream, skipping caption embedding: {}", media.file());
      }
    }

    CaptionResponse.StorageInfo storage = null;
    if (Boolean.TRUE.equals(request.save())) {
      storage = transcriptWriter.saveOutputs(jobId, format, captions, transcriptJson);
    }

    CaptionResponse.Diagnostics diagnostics =
        new CaptionResponse.Diagnostics(
            result.windows(),
            result.fallbackWindows(),
            result.cachedWindows(),
            result.gapSegments(),
            result.optimizerApplied(),
            track.durationSeconds());

    return new CaptionResponse(
        result.transcript().segments(),
        format.extension(),
        captionFile.toString(),
        transcriptFile.toString(),
        video == null ? null : video.toString(),
        diagnostics,
        storage);
  }

  /** The muxer only takes SRT, so VTT jobs get an SRT rendition of the same transcript. */
  private Path srtFor(
      PipelineResult result, CaptionFormat format, Path captionFile, Path outputDir) {
    if (format == CaptionFormat.SRT) {
      return captionFile;
    }
    Path srt = outputDir.resolve("captions.srt");
    try {
      String rendition = captionFormatter.format(result.transcript(), CaptionFormat.SRT);
      Files.writeString(srt, rendition, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write SRT rendition " + srt, e);
    }
    return srt;
  }

  private void progress(CaptionJob job, int percent, String phase) {
    job.updateProgress(percent);
    STRUCTURED_LOGGER.logJobProgress(job.getJobId(), 0, 0, percent, phase);
  }

  /** Keeps a short alphanumeric extension so the media type can still be told from the name. */
  private static String uploadExtension(String originalFilename) {
    if (originalFilename == null) {
      return ".media";
    }
    int dot = originalFilename.lastIndexOf('.');
    if (dot < 0) {
      return ".media";
    }
    String extension = originalFilename.substring(dot + 1);
    return UPLOAD_EXTENSION.matcher(extension).matches()
        ? "." + extension.toLowerCase(Locale.ROOT)
        : ".media";
  }

  private static void createDirectories(Path dir) {
    try {
      Files.createDirectories(dir);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create directory " + dir, e);
    }
  }

  private static void deleteWorkDir(Path workDir) {
    try {
      FileSystemUtils.deleteRecursively(workDir);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete work directory {}: {}", workDir, e.getMessage());
    }
  }
}
