package com.flamingo.ai.podcastcleaner.service.transcript;

import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.exception.TranscriptUnavailableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * {@link TranscriptExtractor} that downloads auto-generated subtitles with {@code yt-dlp} and
 * parses the resulting WebVTT file.
 *
 * <p>Each call works in its own temporary directory, removed afterwards. The process is killed
 * when it exceeds the configured timeout.
 */
@Service
@Slf4j
public class YtDlpTranscriptExtractor implements TranscriptExtractor {

  private static final int LOG_SNIPPET_MAX = 2_000;

  private final PipelineProperties.Transcript settings;
  private final VttTranscriptParser vttParser;

  public YtDlpTranscriptExtractor(
      PipelineProperties pipelineProperties, VttTranscriptParser vttParser) {
    this.settings = pipelineProperties.getTranscript();
    this.vttParser = vttParser;
  }

  @Override
  public String extractTranscript(String videoId, String sourceUrl) {
    Path workDir = null;
    try {
      workDir = Files.createTempDirectory("transcript-" + videoId + "-");
      List<String> command = buildCommand(downloadUrl(videoId, sourceUrl), workDir);
      ProcessResult result = runProcess(command, workDir.resolve("yt-dlp.log"));

      if (result.timedOut()) {
        throw new TranscriptUnavailableException(
            videoId,
            "Failed to extract transcript: yt-dlp timed out after "
                + settings.getTimeoutSeconds()
                + "s");
      }
      if (result.exitCode() != 0) {
        throw new TranscriptUnavailableException(
            videoId, "Failed to extract transcript: " + truncate(result.output()));
      }

      Path vttFile =
          findSubtitleFile(workDir)
              .orElseThrow(
                  () ->
                      new TranscriptUnavailableException(
                          videoId, "No transcript found for this video"));
      String transcript = vttParser.parse(Files.readString(vttFile, StandardCharsets.UTF_8));
      log.debug("Extracted {} characters of transcript for video {}", transcript.length(), videoId);
      return transcript;
    } catch (IOException e) {
      throw new TranscriptUnavailableException(
          videoId, "Failed to extract transcript: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TranscriptUnavailableException(videoId, "Transcript extraction interrupted", e);
    } finally {
      deleteQuietly(workDir);
    }
  }

  List<String> buildCommand(String url, Path workDir) {
    List<String> command =
        new ArrayList<>(
            List.of(
                settings.getYtdlpBin(),
                "--write-auto-sub",
                "--sub-lang",
                settings.getSubtitleLanguage(),
                "--skip-download",
                "--sub-format",
                "vtt"));
    if (settings.getProxy() != null && !settings.getProxy().isBlank()) {
      command.add("--proxy");
      command.add(settings.getProxy());
    }
    command.add("-o");
    command.add(workDir.resolve("%(id)s.%(ext)s").toString());
    command.add(url);
    return command;
  }

  /** Runs the command with output redirected to {@code logFile}. */
  protected ProcessResult runProcess(List<String> command, Path logFile)
      throws IOException, InterruptedException {
    Process process =
        new ProcessBuilder(command)
            .redirectErrorStream(true)
            .redirectOutput(logFile.toFile())
            .start();
    boolean finished = process.waitFor(settings.getTimeoutSeconds(), TimeUnit.SECONDS);
    if (!finished) {
      process.destroyForcibly();
      process.waitFor(5, TimeUnit.SECONDS);
    }
    String output = Files.exists(logFile) ? Files.readString(logFile, StandardCharsets.UTF_8) : "";
    return new ProcessResult(finished ? process.exitValue() : -1, output, !finished);
  }

  private String downloadUrl(String videoId, String sourceUrl) {
    String lower = sourceUrl.strip().toLowerCase(Locale.ROOT);
    if (lower.startsWith("http://") || lower.startsWith("https://")) {
      return sourceUrl.strip();
    }
    return "https://www.youtube.com/watch?v=" + videoId;
  }

  private Optional<Path> findSubtitleFile(Path workDir) throws IOException {
    try (Stream<Path> files = Files.list(workDir)) {
      return files
          .filter(path -> path.getFileName().toString().endsWith(".vtt"))
          .sorted()
          .findFirst();
    }
  }

  private String truncate(String output) {
    if (output == null || output.isBlank()) {
      return "<no output>";
    }
    String trimmed = output.strip();
    return trimmed.length() <= LOG_SNIPPET_MAX
        ? trimmed
        : trimmed.substring(trimmed.length() - LOG_SNIPPET_MAX);
  }

  private void deleteQuietly(Path workDir) {
    if (workDir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(workDir);
    } catch (IOException e) {
      log.warn("Failed to delete temporary directory {}: {}", workDir, e.getMessage());
    }
  }

  /** Outcome of an external process run. */
  protected record ProcessResult(int exitCode, String output, boolean timedOut) {}
}
