package com.scholary.captions.media;

import com.scholary.captions.objectstore.ObjectStoreClient;
import com.scholary.captions.objectstore.ObjectStoreException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HexFormat;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Makes a job's media available as a local file.
 *
 * <p>Local paths are used in place. YouTube URLs are fetched with yt-dlp, other URLs over HTTP and
 * {@code s3://} sources from the object store; downloads land in the job's work directory.
 */
@Component
public class MediaAcquirer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaAcquirer.class);

  private static final long YT_DLP_TIMEOUT_MINUTES = 15;

  private final MediaProperties properties;
  private final ObjectStoreClient objectStoreClient;
  private final HttpClient httpClient;

  public MediaAcquirer(MediaProperties properties, ObjectStoreClient objectStoreClient) {
    this.properties = properties;
    this.objectStoreClient = objectStoreClient;
    this.httpClient =
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(30))
            .build();
  }

  /**
   * Acquire the media of a source.
   *
   * @param source the parsed source
   * @param workDir the job's work directory, receives downloads
   * @return the local file and its content fingerprint
   * @throws MediaAcquisitionException if the media cannot be found or downloaded
   */
  public AcquiredMedia acquire(MediaSource source, Path workDir) {
    LOGGER.info("Acquiring media: type={}, location={}", source.type(), source.location());

    Path file;
    switch (source.type()) {
      case LOCAL:
        file = Path.of(source.location());
        if (!Files.isRegularFile(file)) {
          throw new MediaAcquisitionException("Media file not found: " + file);
        }
        break;
      case YOUTUBE:
        file = downloadYouTube(source.location(), workDir.resolve("source.mp4"), workDir);
        break;
      case HTTP:
        file = downloadHttp(source.location(), workDir.resolve("source" + extensionOf(source)));
        break;
      case OBJECT_STORE:
        file = downloadObject(source, workDir.resolve("source" + extensionOf(source)));
        break;
      default:
        throw new IllegalStateException("Unhandled source type: " + source.type());
    }

    String fingerprint = fingerprint(file);
    LOGGER.info("Media ready: file={}, fingerprint={}", file, fingerprint);
    return new AcquiredMedia(file, fingerprint);
  }

  private Path downloadYouTube(String url, Path target, Path workDir) {
    List<String> command =
        List.of(
            properties.ytDlpPath(),
            "--no-progress",
            "-f", "bv*[ext=mp4]+ba[ext=m4a]/b[ext=mp4]/b",
            "--merge-output-format", "mp4",
            "--no-playlist",
            "-o", target.toString(),
            url);

    Path logFile = workDir.resolve("yt-dlp.log");
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    pb.redirectOutput(logFile.toFile());

    Process process = null;
    try {
      process = pb.start();
      if (!process.waitFor(YT_DLP_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
        throw new MediaAcquisitionException(
            String.format("yt-dlp timed out after %d minutes for %s", YT_DLP_TIMEOUT_MINUTES, url));
      }
      int exitCode = process.exitValue();
      if (exitCode != 0 || !Files.isRegularFile(target)) {
        throw new MediaAcquisitionException(
            String.format(
                "yt-dlp failed with exit code %d for %s: %s", exitCode, url, readLog(logFile)));
      }
    } catch (IOException e) {
      throw new MediaAcquisitionException("Failed to run yt-dlp for " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaAcquisitionException("YouTube download interrupted", e);
    } finally {
      if (process != null && process.isAlive()) {
        LOGGER.info("Killing yt-dlp download: url={}", url);
        process.destroyForcibly();
      }
    }

    LOGGER.info("yt-dlp download complete: target={}", target);
    return target;
  }

  private Path downloadHttp(String url, Path target) {
    HttpRequest request =
        HttpRequest.newBuilder().uri(URI.create(url)).timeout(Duration.ofMinutes(30)).GET().build();
    try {
      HttpResponse<Path> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofFile(target));
      if (response.statusCode() / 100 != 2) {
        Files.deleteIfExists(target);
        throw new MediaAcquisitionException(
            String.format("Download of %s returned status %d", url, response.statusCode()));
      }
    } catch (IOException e) {
      throw new MediaAcquisitionException("Failed to download " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaAcquisitionException("Download interrupted", e);
    }
    LOGGER.info("HTTP download complete: target={}", target);
    return target;
  }

  private Path downloadObject(MediaSource source, Path target) {
    try (InputStream in = objectStoreClient.getObjectStream(source.bucket(), source.key())) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (ObjectStoreException e) {
      throw new MediaAcquisitionException(e.getMessage(), e);
    } catch (IOException e) {
      throw new MediaAcquisitionException("Failed to copy " + source.location(), e);
    }
    LOGGER.info("Object store download complete: target={}", target);
    return target;
  }

  private static String fingerprint(Path file) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      try (InputStream in = new DigestInputStream(Files.newInputStream(file), digest)) {
        in.transferTo(OutputStream.nullOutputStream());
      }
      return HexFormat.of().formatHex(digest.digest());
    } catch (IOException e) {
      throw new MediaAcquisitionException("Failed to read media file " + file, e);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static String extensionOf(MediaSource source) {
    String path = source.location();
    int query = path.indexOf('?');
    if (query >= 0) {
      path = path.substring(0, query);
    }
    int slash = path.lastIndexOf('/');
    int dot = path.lastIndexOf('.');
    if (dot > slash && path.length() - dot <= 6) {
      return path.substring(dot);
    }
    return ".media";
  }

  private static String readLog(Path logFile) {
    try {
      String log = Files.readString(logFile, StandardCharsets.UTF_8).trim();
      return log.length() > 4000 ? log.substring(log.length() - 4000) : log;
    } catch (IOException e) {
      LOGGER.debug("Could not read log {}", logFile, e);
      return "<no log>";
    }
  }
}
