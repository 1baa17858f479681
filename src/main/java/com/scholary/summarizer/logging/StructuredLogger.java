package com.scholary.summarizer.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Every boundary choice and every response classification goes through here, so a log
 * aggregator can query them by {@code event_type} and {@code piece_index}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log where a piece was cut. */
  public void logPieceSplit(
      int pieceIndex, int totalPieces, int start, int end, String boundary) {
    try {
      MDC.put("event_type", "piece_split");
      MDC.put("piece_index", String.valueOf(pieceIndex));
      MDC.put("total_pieces", String.valueOf(totalPieces));
      MDC.put("start", String.valueOf(start));
      MDC.put("end", String.valueOf(end));
      MDC.put("boundary", boundary);

      logger.debug(
          "Piece split: index={}/{}, range=[{}-{}), chars={}, boundary={}",
          pieceIndex,
          totalPieces,
          start,
          end,
          end - start,
          boundary);
    } finally {
      clearEventFields();
    }
  }

  /** Log a piece about to be sent. */
  public void logPieceDispatched(int pieceIndex, int totalPieces, int chars, String endpoint) {
    try {
      MDC.put("event_type", "piece_dispatched");
      MDC.put("piece_index", String.valueOf(pieceIndex));
      MDC.put("total_pieces", String.valueOf(totalPieces));
      MDC.put("chars", String.valueOf(chars));

      logger.info(
          "Sending piece {}/{} ({} chars) to {}", pieceIndex, totalPieces, chars, endpoint);
    } finally {
      clearEventFields();
    }
  }

  /** Log how the response to a piece was classified. */
  public void logPieceClassified(
      int pieceIndex, int totalPieces, String outcome, String detail, long elapsedMs) {
    try {
      MDC.put("event_type", "piece_classified");
      MDC.put("piece_index", String.valueOf(pieceIndex));
      MDC.put("total_pieces", String.valueOf(totalPieces));
      MDC.put("outcome", outcome);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      if ("FAILED".equals(outcome)) {
        logger.error(
            "Piece {}/{} failed after {}ms: {}", pieceIndex, totalPieces, elapsedMs, detail);
      } else {
        logger.info(
            "Piece {}/{} classified as {} after {}ms: {}",
            pieceIndex,
            totalPieces,
            outcome,
            elapsedMs,
            detail);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, int itemsProcessed, int totalItems, int percentComplete, String phase) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("jobId", jobId);
      MDC.put("itemsProcessed", String.valueOf(itemsProcessed));
      MDC.put("totalItems", String.valueOf(totalItems));
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("phase", phase);

      logger.info(
          "Job progress: jobId={}, phase={}, items={}/{}, progress={}%",
          jobId,
          phase,
          itemsProcessed,
          totalItems,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String source) {
    MDC.put("jobId", jobId);
    MDC.put("source", source);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("source");
  }

  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("piece_index");
    MDC.remove("total_pieces");
    MDC.remove("start");
    MDC.remove("end");
    MDC.remove("boundary");
    MDC.remove("chars");
    MDC.remove("outcome");
    MDC.remove("elapsedMs");
    MDC.remove("itemsProcessed");
    MDC.remove("totalItems");
    MDC.remove("percentComplete");
    MDC.remove("phase");
  }
}
