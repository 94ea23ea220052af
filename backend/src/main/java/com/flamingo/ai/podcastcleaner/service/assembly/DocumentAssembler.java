package com.flamingo.ai.podcastcleaner.service.assembly;

import com.flamingo.ai.podcastcleaner.config.PipelineProperties;
import com.flamingo.ai.podcastcleaner.domain.TranscriptResult;
import com.flamingo.ai.podcastcleaner.domain.VideoInfo;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Builds the final markdown document and its download filename.
 *
 * <p>Section order is fixed: thumbnail, title, source link, takeaways, a horizontal rule, then the
 * full transcript, each separated by a blank line.
 */
@Component
public class DocumentAssembler {

  static final String DEFAULT_FILENAME_STEM = "transcript";

  private static final Pattern FORBIDDEN_FILENAME_CHARS =
      Pattern.compile("[<>:\"/\\\\|?*\\p{Cntrl}]");
  private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

  private final PipelineProperties.Assembly settings;

  public DocumentAssembler(PipelineProperties pipelineProperties) {
    this.settings = pipelineProperties.getAssembly();
  }

  public TranscriptResult assemble(
      VideoInfo videoInfo, String sourceUrl, String highlights, String cleanedTranscript) {
    String markdown = buildMarkdown(videoInfo, sourceUrl, highlights, cleanedTranscript);
    return new TranscriptResult(
        videoInfo.title(),
        sourceUrl,
        highlights,
        cleanedTranscript,
        markdown,
        filenameFor(videoInfo.title()));
  }

  String buildMarkdown(
      VideoInfo videoInfo, String sourceUrl, String highlights, String cleanedTranscript) {
    String thumbnailUrl = settings.getThumbnailUrl().replace("{videoId}", videoInfo.videoId());
    return String.join(
        "\n\n",
        "![Thumbnail](" + thumbnailUrl + ")",
        "# " + videoInfo.title(),
        "Source: " + sourceUrl,
        "## Top Takeaways",
        highlights.strip(),
        "---",
        "## Full Transcript",
        cleanedTranscript.strip());
  }

  /** Derives a filesystem-safe {@code .md} filename from a video title. */
  public String filenameFor(String title) {
    String stem = title == null ? "" : FORBIDDEN_FILENAME_CHARS.matcher(title).replaceAll("");
    stem = WHITESPACE_RUN.matcher(stem.strip()).replaceAll("_");
    int max = settings.getMaxFilenameLength();
    if (stem.codePointCount(0, stem.length()) > max) {
      stem = stem.substring(0, stem.offsetByCodePoints(0, max));
    }
    if (stem.isEmpty()) {
      stem = DEFAULT_FILENAME_STEM;
    }
    return stem + ".md";
  }
}
