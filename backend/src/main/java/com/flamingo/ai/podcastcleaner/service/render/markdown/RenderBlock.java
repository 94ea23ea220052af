package com.flamingo.ai.podcastcleaner.service.render.markdown;

import java.util.List;

/** One typed block of a document, in source line order. */
public sealed interface RenderBlock {

  /** Heading with a level between 1 and 3; deeper markdown levels are clamped to 3. */
  record Heading(int level, String text) implements RenderBlock {}

  record Paragraph(List<TextRun> runs) implements RenderBlock {
    public Paragraph {
      runs = List.copyOf(runs);
    }
  }

  record BulletItem(List<TextRun> runs) implements RenderBlock {
    public BulletItem {
      runs = List.copyOf(runs);
    }
  }

  record Rule() implements RenderBlock {}

  record Image(String url) implements RenderBlock {}
}
