package com.scholary.summarizer.chunking;

/** Where a piece was cut, in order of preference. */
public enum Boundary {
  PARAGRAPH("\n\n"),
  LINE("\n"),
  WORD(" "),
  HARD(null),
  REMAINDER(null);

  private final String delimiter;

  Boundary(String delimiter) {
    this.delimiter = delimiter;
  }

  /** The delimiter searched for, or null for cuts that do not look for one. */
  public String delimiter() {
    return delimiter;
  }
}
