package com.scholary.summarizer.aggregate;

import java.util.Objects;

/**
 * Classified result of sending one piece.
 *
 * <p>Exactly one {@link Status} applies. {@code text} is set only for {@link
 * Status#CONTENT_RECEIVED}, {@code reason} only for {@link Status#FAILED}.
 *
 * @param pieceIndex 1-based index of the piece this outcome belongs to
 * @param status which kind of outcome this is
 * @param text content returned by the webhook
 * @param reason why the piece failed
 */
public record Outcome(int pieceIndex, Status status, String text, String reason) {

  public enum Status {
    /** The webhook answered with usable text. */
    CONTENT_RECEIVED,
    /** The webhook accepted the piece but returned nothing yet; processing continues remotely. */
    EMPTY_ACCEPTED,
    /** Transport failure or non-success status. */
    FAILED
  }

  public Outcome {
    Objects.requireNonNull(status, "status is required");
    if (status == Status.CONTENT_RECEIVED) {
      Objects.requireNonNull(text, "text is required for received content");
      reason = null;
    } else if (status == Status.FAILED) {
      Objects.requireNonNull(reason, "reason is required for a failure");
      text = null;
    } else {
      text = null;
      reason = null;
    }
  }

  public static Outcome contentReceived(int pieceIndex, String text) {
    return new Outcome(pieceIndex, Status.CONTENT_RECEIVED, text, null);
  }

  public static Outcome emptyAccepted(int pieceIndex) {
    return new Outcome(pieceIndex, Status.EMPTY_ACCEPTED, null, null);
  }

  public static Outcome failed(int pieceIndex, String reason) {
    return new Outcome(pieceIndex, Status.FAILED, null, reason);
  }

  public boolean hasContent() {
    return status == Status.CONTENT_RECEIVED;
  }

  public boolean isFailure() {
    return status == Status.FAILED;
  }
}
