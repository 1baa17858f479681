package com.scholary.summarizer.aggregate;

/**
 * Combined result of one chunking job.
 *
 * @param success true when content was obtained, or when nothing failed and the webhook is still
 *     processing
 * @param combinedText joined content of all pieces that returned some, or the pending-processing
 *     notice; null on failure
 * @param errorSummary failed pieces and their reasons; on success this is a warning note, null when
 *     no piece failed
 * @param contentPieces number of pieces that returned content
 * @param emptyPieces number of pieces accepted without content
 * @param failedPieces number of pieces that failed
 * @param totalPieces number of pieces the content was split into
 * @param cancelled true when the job stopped before sending every piece
 */
public record AggregateResult(
    boolean success,
    String combinedText,
    String errorSummary,
    int contentPieces,
    int emptyPieces,
    int failedPieces,
    int totalPieces,
    boolean cancelled) {

  /** Pieces that were never sent because the job was cancelled. */
  public int unsentPieces() {
    return totalPieces - contentPieces - emptyPieces - failedPieces;
  }

  public boolean hasContent() {
    return contentPieces > 0;
  }
}
