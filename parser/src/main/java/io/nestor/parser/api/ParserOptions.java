package io.nestor.parser.api;

/**
 * Options controlling a parse.
 *
 * @param maxDepth maximum number of simultaneously open regions; 0 means unlimited
 * @param coalesceLiterals whether consecutive literal chars are reported as one scanner event
 *     instead of one event per char
 * @param renderWidth width of the key column produced by {@link TreeRenderer}
 */
public record ParserOptions(int maxDepth, boolean coalesceLiterals, int renderWidth) {

  /** Unlimited depth, coalesced literals, 40 column wide rendering. */
  public static final ParserOptions DEFAULT = new ParserOptions(0, true, 40);

  public ParserOptions {
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
    }
    if (renderWidth < 1) {
      throw new IllegalArgumentException("renderWidth must be positive: " + renderWidth);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int maxDepth = DEFAULT.maxDepth();
    private boolean coalesceLiterals = DEFAULT.coalesceLiterals();
    private int renderWidth = DEFAULT.renderWidth();

    public Builder maxDepth(int value) {
      this.maxDepth = value;
      return this;
    }

    public Builder coalesceLiterals(boolean value) {
      this.coalesceLiterals = value;
      return this;
    }

    public Builder renderWidth(int value) {
      this.renderWidth = value;
      return this;
    }

    public ParserOptions build() {
      return new ParserOptions(maxDepth, coalesceLiterals, renderWidth);
    }
  }
}
