package com.scholary.summarizer.aggregate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Combines per-piece outcomes into one result.
 *
 * <p>Precedence:
 *
 * <ul>
 *   <li>Any content wins: the texts are joined in piece order with one blank line between them,
 *       no headers or footers. Failed pieces are reported in the error summary but do not block
 *       success.
 *   <li>No content and no failure: the webhook accepted everything and is still working. This is
 *       a success carrying {@link #PENDING_NOTICE}.
 *   <li>No content and at least one failure: the job failed and every failed index is listed.
 * </ul>
 */
@Component
public class Aggregator {

  private static final Logger LOGGER = LoggerFactory.getLogger(Aggregator.class);

  public static final String PENDING_NOTICE =
      "[All chunks processed but no content returned - endpoint may still be processing]";

  static final String SEPARATOR = "\n\n";

  public AggregateResult combine(List<Outcome> outcomes, int totalCount) {
    return combine(outcomes, totalCount, false);
  }

  /**
   * Combine outcomes.
   *
   * @param outcomes one outcome per piece that was sent, in any order
   * @param totalCount number of pieces the content was split into
   * @param cancelled whether the job stopped before sending every piece
   * @return the aggregate result
   */
  public AggregateResult combine(List<Outcome> outcomes, int totalCount, boolean cancelled) {
    List<Outcome> ordered = new ArrayList<>(outcomes);
    ordered.sort(Comparator.comparingInt(Outcome::pieceIndex));

    List<String> contents = new ArrayList<>();
    List<Integer> emptyIndexes = new ArrayList<>();
    List<Outcome> failures = new ArrayList<>();
    for (Outcome outcome : ordered) {
      if (outcome.hasContent()) {
        contents.add(outcome.text());
      } else if (outcome.isFailure()) {
        failures.add(outcome);
      } else {
        emptyIndexes.add(outcome.pieceIndex());
      }
    }

    if (!emptyIndexes.isEmpty()) {
      LOGGER.info("Chunks with empty responses (async pattern): {}", emptyIndexes);
    }

    int contentCount = contents.size();
    int emptyCount = emptyIndexes.size();
    int failedCount = failures.size();
    int sent = ordered.size();

    if (contents.isEmpty()) {
      if (failures.isEmpty() && !cancelled) {
        LOGGER.warn("All {} chunks returned empty (endpoint still processing?)", totalCount);
        return new AggregateResult(
            true, PENDING_NOTICE, null, 0, emptyCount, 0, totalCount, false);
      }

      String error;
      if (failures.isEmpty()) {
        error =
            String.format(
                "Cancelled before any content was returned (%d of %d chunks sent)",
                sent, totalCount);
      } else if (totalCount == 1) {
        error = failures.get(0).reason();
      } else {
        error =
            String.format(
                "Failed to get content from chunks: %d failed, %d empty - %s",
                failedCount, emptyCount, describe(failures));
      }
      LOGGER.error(error);
      return new AggregateResult(
          false, null, error, 0, emptyCount, failedCount, totalCount, cancelled);
    }

    String note = null;
    if (!failures.isEmpty()) {
      note =
          String.format(
              "%d of %d chunks failed - %s", failedCount, totalCount, describe(failures));
      LOGGER.warn(note);
    }
    if (cancelled) {
      String cancelNote = String.format("Cancelled after %d of %d chunks", sent, totalCount);
      note = note == null ? cancelNote : note + "; " + cancelNote;
      LOGGER.warn(cancelNote);
    }

    String combined = contents.size() == 1 ? contents.get(0) : String.join(SEPARATOR, contents);
    if (contents.size() > 1) {
      LOGGER.info("Combined {} partial results into final output (no wrapper text)", contentCount);
    }
    LOGGER.info("Successfully extracted content from {}/{} chunks", contentCount, totalCount);

    return new AggregateResult(
        true, combined, note, contentCount, emptyCount, failedCount, totalCount, cancelled);
  }

  private static String describe(List<Outcome> failures) {
    return failures.stream()
        .map(f -> "Chunk " + f.pieceIndex() + ": " + f.reason())
        .collect(Collectors.joining(", "));
  }
}
