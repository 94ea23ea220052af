package com.flamingo.ai.podcastcleaner.service.render.markdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.commonmark.node.Code;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Link;
import org.commonmark.node.Node;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.springframework.stereotype.Component;

/**
 * Classifies markdown line by line into {@link RenderBlock}s.
 *
 * <p>Each line is tested in a fixed order: image, heading, horizontal rule, bullet, blank, and
 * anything else is a paragraph. Inline markup of paragraphs and bullets is parsed with commonmark
 * restricted to inline syntax, so a stray {@code >} or indentation never turns into a block.
 */
@Component
public class MarkdownBlockParser {

  static final int MAX_HEADING_LEVEL = 3;

  private static final Pattern IMAGE = Pattern.compile("^!\\[([^\\]]*)]\\(\\s*(\\S+?)\\s*\\)$");
  private static final Pattern HEADING = Pattern.compile("^(#{1,6})(?:\\s+(.*))?$");
  private static final Pattern RULE = Pattern.compile("^(?:-{3,}|\\*{3,}|_{3,})$");
  private static final Pattern BULLET = Pattern.compile("^[-*+]\\s+(.*)$");

  // Only inline parsing: every line becomes a single paragraph node
  private static final Parser INLINE_PARSER = Parser.builder().enabledBlockTypes(Set.of()).build();

  public RenderDocument parse(String markdown) {
    List<RenderDocument.Entry> entries = new ArrayList<>();
    if (markdown == null) {
      return new RenderDocument(entries);
    }

    boolean pendingBlank = false;
    for (String rawLine : markdown.split("\\R", -1)) {
      String line = rawLine.strip();
      RenderBlock block = classify(line);
      if (block == null) {
        pendingBlank = !entries.isEmpty();
        continue;
      }
      entries.add(new RenderDocument.Entry(block, pendingBlank));
      pendingBlank = false;
    }
    return new RenderDocument(entries);
  }

  /** Returns the block for one stripped line, or {@code null} for a blank line. */
  RenderBlock classify(String line) {
    Matcher image = IMAGE.matcher(line);
    if (image.matches()) {
      return new RenderBlock.Image(image.group(2));
    }

    Matcher heading = HEADING.matcher(line);
    if (heading.matches()) {
      int level = Math.min(heading.group(1).length(), MAX_HEADING_LEVEL);
      String text = heading.group(2) == null ? "" : plainText(heading.group(2));
      return new RenderBlock.Heading(level, text);
    }

    if (RULE.matcher(line).matches()) {
      return new RenderBlock.Rule();
    }

    Matcher bullet = BULLET.matcher(line);
    if (bullet.matches()) {
      return new RenderBlock.BulletItem(inlineRuns(bullet.group(1)));
    }

    if (line.isEmpty()) {
      return null;
    }
    return new RenderBlock.Paragraph(inlineRuns(line));
  }

  /** Parses inline markup into runs; text that yields nothing is kept verbatim. */
  List<TextRun> inlineRuns(String text) {
    List<TextRun> runs = new ArrayList<>();
    collectRuns(INLINE_PARSER.parse(text), false, runs);
    if (runs.stream().allMatch(run -> run.text().isBlank())) {
      return List.of(TextRun.plain(text));
    }
    return mergeAdjacent(runs);
  }

  private String plainText(String text) {
    StringBuilder sb = new StringBuilder();
    for (TextRun run : inlineRuns(text)) {
      sb.append(run.text());
    }
    return sb.toString().strip();
  }

  private void collectRuns(Node node, boolean bold, List<TextRun> runs) {
    if (node instanceof Text text) {
      runs.add(new TextRun(text.getLiteral(), bold));
    } else if (node instanceof Code code) {
      runs.add(new TextRun(code.getLiteral(), bold));
    } else if (node instanceof HtmlInline html) {
      runs.add(new TextRun(html.getLiteral(), bold));
    } else if (node instanceof SoftLineBreak || node instanceof HardLineBreak) {
      runs.add(new TextRun(" ", bold));
    } else {
      // Links keep only their display text, which is a child of the Link node
      boolean childBold = bold || node instanceof StrongEmphasis;
      if (node instanceof Link && node.getFirstChild() == null) {
        return;
      }
      Node child = node.getFirstChild();
      while (child != null) {
        collectRuns(child, childBold, runs);
        child = child.getNext();
      }
    }
  }

  private List<TextRun> mergeAdjacent(List<TextRun> runs) {
    List<TextRun> merged = new ArrayList<>();
    for (TextRun run : runs) {
      if (run.text().isEmpty()) {
        continue;
      }
      int last = merged.size() - 1;
      if (last >= 0 && merged.get(last).bold() == run.bold()) {
        merged.set(last, new TextRun(merged.get(last).text() + run.text(), run.bold()));
      } else {
        merged.add(run);
      }
    }
    return merged;
  }
}
