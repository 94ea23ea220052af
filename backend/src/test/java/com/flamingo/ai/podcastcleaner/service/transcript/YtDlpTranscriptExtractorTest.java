package com.flamingo.ai.podcastcleaner.service.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.exception.TranscriptUnavailableException;
import com.flamingo.ai.podcastcleaner.service.transcript.YtDlpTranscriptExtractor.ProcessResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("YtDlpTranscriptExtractor")
class YtDlpTranscriptExtractorTest {

  private static final String VIDEO_ID = "dQw4w9WgXcQ";
  private static final String VTT =
      "WEBVTT\n\n00:00:00.000 --> 00:00:02.000\nhello there\n\n"
          + "00:00:02.000 --> 00:00:04.000\ngeneral kenobi\n";

  private PipelineProperties pipelineProperties;

  @BeforeEach
  void setUp() {
    pipelineProperties = new PipelineProperties();
  }

  @Test
  @DisplayName("should parse the subtitle file yt-dlp writes")
  void shouldReturnTranscript_whenSubtitleFileWritten() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "ok", false), VTT);

    String transcript =
        extractor.extractTranscript(VIDEO_ID, "https://www.youtube.com/watch?v=" + VIDEO_ID);

    assertThat(transcript).isEqualTo("hello there general kenobi");
  }

  @Test
  @DisplayName("should build the watch URL when given a bare identifier")
  void shouldDownloadWatchUrl_whenReferenceIsBareId() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "ok", false), VTT);

    extractor.extractTranscript(VIDEO_ID, VIDEO_ID);

    List<String> command = extractor.commands.get(0);
    assertThat(command.get(command.size() - 1))
        .isEqualTo("https://www.youtube.com/watch?v=" + VIDEO_ID);
    assertThat(command)
        .containsSequence("--write-auto-sub", "--sub-lang", "en", "--skip-download")
        .containsSequence("--sub-format", "vtt");
  }

  @Test
  @DisplayName("should pass the proxy to yt-dlp when configured")
  void shouldAddProxyFlag_whenProxyConfigured() {
    pipelineProperties.getTranscript().setProxy("http://proxy.local:8080");
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "ok", false), VTT);

    extractor.extractTranscript(VIDEO_ID, VIDEO_ID);

    assertThat(extractor.commands.get(0)).containsSequence("--proxy", "http://proxy.local:8080");
  }

  @Test
  @DisplayName("should omit the proxy flag when none is configured")
  void shouldNotAddProxyFlag_whenProxyBlank() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "ok", false), VTT);

    extractor.extractTranscript(VIDEO_ID, VIDEO_ID);

    assertThat(extractor.commands.get(0)).doesNotContain("--proxy");
  }

  @Test
  @DisplayName("should fail with the process output when yt-dlp exits non-zero")
  void shouldThrowTranscriptUnavailable_whenProcessFails() {
    StubExtractor extractor =
        new StubExtractor(new ProcessResult(1, "ERROR: Video unavailable", false), null);

    assertThatThrownBy(() -> extractor.extractTranscript(VIDEO_ID, VIDEO_ID))
        .isInstanceOf(TranscriptUnavailableException.class)
        .hasMessageContaining("Video unavailable");
  }

  @Test
  @DisplayName("should fail when no subtitle file is produced")
  void shouldThrowTranscriptUnavailable_whenNoSubtitleFile() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "", false), null);

    assertThatThrownBy(() -> extractor.extractTranscript(VIDEO_ID, VIDEO_ID))
        .isInstanceOf(TranscriptUnavailableException.class)
        .hasMessage("No transcript found for this video");
  }

  @Test
  @DisplayName("should fail when the process times out")
  void shouldThrowTranscriptUnavailable_whenProcessTimesOut() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(-1, "", true), null);

    assertThatThrownBy(() -> extractor.extractTranscript(VIDEO_ID, VIDEO_ID))
        .isInstanceOf(TranscriptUnavailableException.class)
        .hasMessageContaining("timed out");
  }

  @Test
  @DisplayName("should remove its working directory afterwards")
  void shouldDeleteWorkDirectory_whenDone() {
    StubExtractor extractor = new StubExtractor(new ProcessResult(0, "ok", false), VTT);

    extractor.extractTranscript(VIDEO_ID, VIDEO_ID);

    assertThat(extractor.workDirs).hasSize(1);
    assertThat(Files.exists(extractor.workDirs.get(0))).isFalse();
  }

  /** Stands in for the yt-dlp process by writing the subtitle file itself. */
  private class StubExtractor extends YtDlpTranscriptExtractor {

    private final ProcessResult result;
    private final String vttContent;
    private final List<List<String>> commands = new ArrayList<>();
    private final List<Path> workDirs = new ArrayList<>();

    StubExtractor(ProcessResult result, String vttContent) {
      super(pipelineProperties, new VttTranscriptParser());
      this.result = result;
      this.vttContent = vttContent;
    }

    @Override
    protected ProcessResult runProcess(List<String> command, Path logFile) throws IOException {
      commands.add(command);
      String template = command.get(command.indexOf("-o") + 1);
      Path workDir = Paths.get(template).getParent();
      workDirs.add(workDir);
      if (vttContent != null) {
        Files.writeString(
            workDir.resolve(VIDEO_ID + ".en.vtt"), vttContent, StandardCharsets.UTF_8);
      }
      return result;
    }
  }
}
