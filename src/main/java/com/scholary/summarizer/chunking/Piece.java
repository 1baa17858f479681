package com.scholary.summarizer.chunking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One slice of an oversized payload, sent as its own request.
 *
 * @param index 1-based position of this piece
 * @param totalPieces number of pieces in the job
 * @param text the slice of content
 * @param sourceName name of the file or transcript the content came from
 * @param metadata caller-supplied metadata, never null
 */
public record Piece(
    int index, int totalPieces, String text, String sourceName, Map<String, Object> metadata) {

  public Piece {
    if (index < 1 || index > totalPieces) {
      throw new IllegalArgumentException(
          String.format("piece index %d out of range 1..%d", index, totalPieces));
    }
    metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  /** Whether this piece belongs to a job that was split into several requests. */
  public boolean isPartOfSplit() {
    return totalPieces > 1;
  }
}
