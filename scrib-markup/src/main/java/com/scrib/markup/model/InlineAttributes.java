package com.scrib.markup.model;

/**
 * Character formatting of a {@link StyledRun}.
 *
 * @param bold      bold
 * @param italic    italic
 * @param underline underline
 * @param strike    strikethrough
 * @param font      font family name, null for the document default
 * @param sizePt    font size in points, null for the document default
 */
public record InlineAttributes(boolean bold,
                               boolean italic,
                               boolean underline,
                               boolean strike,
                               String font,
                               Double sizePt) {

  public static final InlineAttributes NONE = new InlineAttributes(false, false, false, false, null, null);

  public InlineAttributes {
    if (sizePt != null && (sizePt.isNaN() || sizePt <= 0)) {
      throw new IllegalArgumentException("Font size must be positive: " + sizePt);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public boolean isEmpty() {
    return NONE.equals(this);
  }

  /**
   * Builder for {@link InlineAttributes}.
   */
  public static class Builder {
    private boolean bold;
    private boolean italic;
    private boolean underline;
    private boolean strike;
    private String font;
    private Double sizePt;

    public Builder bold(boolean bold) {
      this.bold = bold;
      return this;
    }

    public Builder italic(boolean italic) {
      this.italic = italic;
      return this;
    }

    public Builder underline(boolean underline) {
      this.underline = underline;
      return this;
    }

    public Builder strike(boolean strike) {
      this.strike = strike;
      return this;
    }

    public Builder font(String font) {
      this.font = font;
      return this;
    }

    public Builder sizePt(Double sizePt) {
      this.sizePt = sizePt;
      return this;
    }

    public InlineAttributes build() {
      return new InlineAttributes(bold, italic, underline, strike, font, sizePt);
    }
  }
}
