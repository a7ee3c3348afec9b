package com.scrib.markup.model;

import java.util.Objects;

/**
 * Zero-width paragraph terminator carrying the attributes of the paragraph it ends.
 *
 * @param attributes the block attributes
 */
public record BlockMarker(BlockAttributes attributes) implements DocumentElement {

  public static final BlockMarker PARAGRAPH = new BlockMarker(BlockAttributes.NONE);

  public BlockMarker {
    Objects.requireNonNull(attributes, "attributes");
  }
}
