package com.flamingo.ai.podcastcleaner.service.render.layout;

import com.flamingo.ai.podcastcleaner.service.render.markdown.RenderBlock;
import com.flamingo.ai.podcastcleaner.service.render.markdown.RenderDocument;
import com.flamingo.ai.podcastcleaner.service.render.markdown.TextRun;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * Lays out a {@link RenderDocument} top to bottom on a {@link PageCanvas}.
 *
 * <p>A vertical cursor tracks the next free baseline region; text is word-wrapped to the printable
 * width and a new page starts whenever the next line would cross the bottom margin. One engine
 * instance renders one document.
 */
@Slf4j
public class PageLayoutEngine {

  static final String BULLET_MARKER = "•";
  static final float UNDERLINE_THICKNESS = 0.75f;
  static final float RULE_THICKNESS = 0.5f;

  private final PageCanvas canvas;
  private final PageGeometry geometry;
  private final Typography typography;
  private final float maxImageWidthRatio;
  private final Function<String, Optional<BufferedImage>> imageLoader;

  private float cursorY;
  private int pageCount;

  public PageLayoutEngine(
      PageCanvas canvas,
      LayoutConfig config,
      Typography typography,
      float maxImageWidthRatio,
      Function<String, Optional<BufferedImage>> imageLoader) {
    this.canvas = canvas;
    this.geometry = config.pageGeometry();
    this.typography = typography;
    this.maxImageWidthRatio = maxImageWidthRatio;
    this.imageLoader = imageLoader;
  }

  /**
   * Paints every block of the document. Always leaves at least one page on the canvas.
   *
   * @return number of pages started
   */
  public int layout(RenderDocument document) throws IOException {
    startPage();
    boolean pendingBlank = false;
    for (RenderDocument.Entry entry : document.entries()) {
      boolean precededByBlank = pendingBlank || entry.precededByBlank();
      if (entry.block() instanceof RenderBlock.Image image) {
        boolean drawn = layoutImage(image, precededByBlank);
        // A skipped image hands its blank-line gap on to the next block
        pendingBlank = precededByBlank && !drawn;
        continue;
      }
      pendingBlank = false;
      if (precededByBlank) {
        blankLineGap();
      }
      layoutBlock(entry.block());
    }
    return pageCount;
  }

  float cursorY() {
    return cursorY;
  }

  private void layoutBlock(RenderBlock block) throws IOException {
    if (block instanceof RenderBlock.Heading heading) {
      layoutHeading(heading);
    } else if (block instanceof RenderBlock.Paragraph paragraph) {
      layoutText(paragraph.runs(), geometry.left(), typography.baseSize());
    } else if (block instanceof RenderBlock.BulletItem bullet) {
      layoutBullet(bullet);
    } else if (block instanceof RenderBlock.Rule) {
      layoutRule();
    }
  }

  private void blankLineGap() {
    if (!atTopOfPage()) {
      cursorY -= typography.baseLineHeight() / 2;
    }
  }

  private void layoutHeading(RenderBlock.Heading heading) throws IOException {
    float size = typography.headingSize(heading.level());
    if (!atTopOfPage()) {
      cursorY -= typography.baseLineHeight() * 0.5f;
    }
    layoutText(List.of(TextRun.bold(heading.text())), geometry.left(), size);
    if (heading.level() == 2 && !heading.text().isBlank()) {
      float y = cursorY + typography.lineHeight(size) - size * 1.2f;
      canvas.drawLine(geometry.left(), y, geometry.right(), y, UNDERLINE_THICKNESS);
    }
    cursorY -= typography.baseLineHeight() * 0.25f;
  }

  private void layoutBullet(RenderBlock.BulletItem bullet) throws IOException {
    float size = typography.baseSize();
    float indent = typography.bulletIndent();
    List<List<TextRun>> lines = wrap(bullet.runs(), size, geometry.printableWidth() - indent);
    for (int i = 0; i < lines.size(); i++) {
      float baseline = nextBaseline(size);
      if (i == 0) {
        String marker = sanitize(BULLET_MARKER, false);
        canvas.drawText(marker, geometry.left() + size * 0.4f, baseline, size, false);
      }
      drawLine(lines.get(i), geometry.left() + indent, baseline, size);
    }
  }

  private void layoutRule() throws IOException {
    float half = typography.baseLineHeight() / 2;
    ensureSpace(typography.baseLineHeight());
    cursorY -= half;
    canvas.drawLine(geometry.left(), cursorY, geometry.right(), cursorY, RULE_THICKNESS);
    cursorY -= half;
  }

  /**
   * Places a fetched image, preceded by the blank-line gap when asked for. Nothing is drawn and
   * the cursor stays put when the image cannot be fetched or converted.
   *
   * @return whether the image was drawn
   */
  private boolean layoutImage(RenderBlock.Image block, boolean precededByBlank) {
    Optional<BufferedImage> loaded = imageLoader.apply(block.url());
    if (loaded.isEmpty()) {
      return false;
    }
    BufferedImage image = loaded.get();
    if (image.getWidth() <= 0 || image.getHeight() <= 0) {
      log.warn("Skipping image with empty dimensions: {}", block.url());
      return false;
    }

    float maxWidth = geometry.printableWidth() * maxImageWidthRatio;
    float width = Math.min(image.getWidth(), maxWidth);
    float height = image.getHeight() * (width / image.getWidth());
    if (height > geometry.printableHeight()) {
      width *= geometry.printableHeight() / height;
      height = geometry.printableHeight();
    }

    PageCanvas.CanvasImage prepared;
    try {
      prepared = canvas.prepareImage(image);
    } catch (IOException | RuntimeException e) {
      log.warn("Skipping image {}: {}", block.url(), e.getMessage());
      return false;
    }

    float savedCursor = cursorY;
    int savedPageCount = pageCount;
    try {
      if (precededByBlank) {
        blankLineGap();
      }
      if (cursorY - height < geometry.bottom()) {
        startPage();
      }
      float x = geometry.left() + (geometry.printableWidth() - width) / 2;
      canvas.drawImage(prepared, x, cursorY - height, width, height);
      cursorY -= height + typography.baseLineHeight();
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn("Skipping image {}: {}", block.url(), e.getMessage());
      // A page started for the image stays; the cursor must belong to it
      cursorY = pageCount == savedPageCount ? savedCursor : geometry.top();
      return false;
    }
  }

  private void layoutText(List<TextRun> runs, float x, float size) throws IOException {
    for (List<TextRun> line : wrap(runs, size, geometry.printableWidth())) {
      drawLine(line, x, nextBaseline(size), size);
    }
  }

  private void drawLine(List<TextRun> line, float x, float baseline, float size)
      throws IOException {
    float offset = x;
    for (TextRun segment : line) {
      canvas.drawText(segment.text(), offset, baseline, size, segment.bold());
      offset += canvas.textWidth(segment.text(), size, segment.bold());
    }
  }

  /** Reserves one line of the given size and returns its baseline. */
  private float nextBaseline(float size) throws IOException {
    float lineHeight = typography.lineHeight(size);
    ensureSpace(lineHeight);
    float baseline = cursorY - size;
    cursorY -= lineHeight;
    return baseline;
  }

  private void ensureSpace(float height) throws IOException {
    if (cursorY - height < geometry.bottom() && !atTopOfPage()) {
      startPage();
    }
  }

  private void startPage() throws IOException {
    canvas.newPage();
    pageCount++;
    cursorY = geometry.top();
  }

  private boolean atTopOfPage() {
    return cursorY >= geometry.top();
  }

  /** Greedy word wrap; words wider than a whole line are broken between characters. */
  List<List<TextRun>> wrap(List<TextRun> runs, float size, float maxWidth) throws IOException {
    List<List<TextRun>> words = splitWords(runs);
    List<List<TextRun>> lines = new ArrayList<>();
    List<TextRun> line = new ArrayList<>();
    float lineWidth = 0;

    for (List<TextRun> word : words) {
      float wordWidth = width(word, size);
      if (line.isEmpty()) {
        if (wordWidth > maxWidth) {
          List<List<TextRun>> pieces = breakWord(word, size, maxWidth);
          lines.addAll(pieces.subList(0, pieces.size() - 1));
          line = new ArrayList<>(pieces.get(pieces.size() - 1));
          lineWidth = width(line, size);
        } else {
          line.addAll(word);
          lineWidth = wordWidth;
        }
        continue;
      }

      boolean spaceBold = line.get(line.size() - 1).bold();
      float spaceWidth = canvas.textWidth(" ", size, spaceBold);
      if (lineWidth + spaceWidth + wordWidth <= maxWidth) {
        line.add(new TextRun(" ", spaceBold));
        line.addAll(word);
        lineWidth += spaceWidth + wordWidth;
      } else {
        lines.add(merge(line));
        line = new ArrayList<>();
        lineWidth = 0;
        if (wordWidth > maxWidth) {
          List<List<TextRun>> pieces = breakWord(word, size, maxWidth);
          lines.addAll(pieces.subList(0, pieces.size() - 1));
          line.addAll(pieces.get(pieces.size() - 1));
          lineWidth = width(line, size);
        } else {
          line.addAll(word);
          lineWidth = wordWidth;
        }
      }
    }
    if (!line.isEmpty()) {
      lines.add(merge(line));
    }
    return lines;
  }

  private List<List<TextRun>> splitWords(List<TextRun> runs) {
    List<List<TextRun>> words = new ArrayList<>();
    List<TextRun> word = new ArrayList<>();
    for (TextRun run : runs) {
      String text = sanitize(run.text(), run.bold());
      StringBuilder buffer = new StringBuilder();
      for (int i = 0; i < text.length(); ) {
        int cp = text.codePointAt(i);
        i += Character.charCount(cp);
        if (Character.isWhitespace(cp)) {
          if (buffer.length() > 0) {
            word.add(new TextRun(buffer.toString(), run.bold()));
            buffer.setLength(0);
          }
          if (!word.isEmpty()) {
            words.add(word);
            word = new ArrayList<>();
          }
        } else {
          buffer.appendCodePoint(cp);
        }
      }
      if (buffer.length() > 0) {
        word.add(new TextRun(buffer.toString(), run.bold()));
      }
    }
    if (!word.isEmpty()) {
      words.add(word);
    }
    return words;
  }

  private List<List<TextRun>> breakWord(List<TextRun> word, float size, float maxWidth)
      throws IOException {
    List<List<TextRun>> pieces = new ArrayList<>();
    List<TextRun> piece = new ArrayList<>();
    float pieceWidth = 0;
    for (TextRun segment : word) {
      String text = segment.text();
      for (int i = 0; i < text.length(); ) {
        int cp = text.codePointAt(i);
        i += Character.charCount(cp);
        String ch = new String(Character.toChars(cp));
        float charWidth = canvas.textWidth(ch, size, segment.bold());
        if (pieceWidth + charWidth > maxWidth && !piece.isEmpty()) {
          pieces.add(merge(piece));
          piece = new ArrayList<>();
          pieceWidth = 0;
        }
        piece.add(new TextRun(ch, segment.bold()));
        pieceWidth += charWidth;
      }
    }
    pieces.add(merge(piece));
    return pieces;
  }

  private float width(List<TextRun> segments, float size) throws IOException {
    float total = 0;
    for (TextRun segment : segments) {
      total += canvas.textWidth(segment.text(), size, segment.bold());
    }
    return total;
  }

  private List<TextRun> merge(List<TextRun> segments) {
    List<TextRun> merged = new ArrayList<>();
    for (TextRun segment : segments) {
      int last = merged.size() - 1;
      if (last >= 0 && merged.get(last).bold() == segment.bold()) {
        merged.set(last, new TextRun(merged.get(last).text() + segment.text(), segment.bold()));
      } else {
        merged.add(segment);
      }
    }
    return merged;
  }

  private String sanitize(String text, boolean bold) {
    return TextSanitizer.sanitize(text, cp -> canvas.canEncode(cp, bold));
  }
}
