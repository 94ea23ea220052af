package com.flamingo.ai.podcastcleaner.service.render.markdown;

import java.util.List;

/**
 * Ordered blocks of a parsed document.
 *
 * @param entries blocks with their spacing flag, in source order
 */
public record RenderDocument(List<Entry> entries) {

  public RenderDocument {
    entries = List.copyOf(entries);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  public List<RenderBlock> blocks() {
    return entries.stream().map(Entry::block).toList();
  }

  /**
   * A block and whether one or more blank lines preceded it.
   *
   * @param precededByBlank adds half a base line of spacing above the block
   */
  public record Entry(RenderBlock block, boolean precededByBlank) {}
}
