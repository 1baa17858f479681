package com.scholary.summarizer.chunking;

import com.scholary.summarizer.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits text into pieces small enough for the webhook.
 *
 * <p>The number of pieces comes from the <em>original byte size</em> of the source, not from the
 * character count of the decoded text. The split itself works on characters: each piece gets
 * roughly {@code length / count} characters, and the cut is moved to the nearest paragraph break,
 * line break or space within a quarter of that target on either side.
 *
 * <p>Example with a 120,000 byte file and a 50 KB budget:
 *
 * <pre>
 * count  = ceil(120000 / 51200) = 3
 * target = ceil(length / 3) characters per piece
 * piece 1: [0, cut1)      cut1 = last "\n\n" (or "\n", or " ") near target
 * piece 2: [cut1, cut2)   same search around cut1 + target
 * piece 3: [cut2, length) remainder, no search
 * </pre>
 *
 * <p>Delimiters stay at the end of the earlier piece, so the pieces always concatenate back to
 * the input. A hard cut never falls between the two halves of a surrogate pair, so every piece is
 * valid UTF-16 on its own and survives UTF-8 encoding.
 */
public class ContentChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ContentChunker.class);
  private static final StructuredLogger STRUCTURED = new StructuredLogger(LOGGER);

  private static final Boundary[] SEARCH_ORDER = {
    Boundary.PARAGRAPH, Boundary.LINE, Boundary.WORD
  };

  private final int chunkSizeBytes;

  public ContentChunker(int chunkSizeBytes) {
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("chunk size must be positive: " + chunkSizeBytes);
    }
    this.chunkSizeBytes = chunkSizeBytes;
  }

  public int getChunkSizeBytes() {
    return chunkSizeBytes;
  }

  /**
   * Number of pieces needed for a source of the given size.
   *
   * @param originalByteSize size of the source in bytes
   * @return {@code ceil(originalByteSize / chunkSizeBytes)}, at least 1
   */
  public int calculateChunkCount(long originalByteSize) {
    long count = (Math.max(0, originalByteSize) + chunkSizeBytes - 1) / chunkSizeBytes;
    int chunkCount = (int) Math.max(1, Math.min(count, Integer.MAX_VALUE));

    LOGGER.debug(
        "File {} bytes ({} KB): {} chunks x {} KB",
        originalByteSize,
        String.format("%.1f", originalByteSize / 1024.0),
        chunkCount,
        chunkSizeBytes / 1024);
    return chunkCount;
  }

  /** Split without source name or metadata, mostly useful for previews. */
  public List<Piece> split(String text, long originalByteSize) {
    return split(text, originalByteSize, "", Map.of());
  }

  /**
   * Split text into ordered pieces.
   *
   * @param text the decoded content
   * @param originalByteSize size of the source in bytes, drives the piece count
   * @param sourceName name attached to every piece
   * @param metadata caller metadata attached to every piece
   * @return pieces numbered from 1, concatenating back to {@code text}
   */
  public List<Piece> split(
      String text, long originalByteSize, String sourceName, Map<String, Object> metadata) {
    String content = text == null ? "" : text;
    int length = content.length();
    int chunkCount = calculateChunkCount(originalByteSize);

    LOGGER.info(
        "Splitting content ({} chars from {} bytes) into {} chunks",
        length,
        originalByteSize,
        chunkCount);

    if (chunkCount == 1) {
      LOGGER.debug("Content fits in a single chunk");
      return List.of(new Piece(1, 1, content, sourceName, metadata));
    }

    int targetChars = (length + chunkCount - 1) / chunkCount;
    LOGGER.debug("Target: {} chars per chunk (total {} chars)", targetChars, length);

    List<Piece> pieces = new ArrayList<>(chunkCount);
    int start = 0;
    for (int index = 1; index <= chunkCount; index++) {
      int end;
      Boundary boundary;
      if (index == chunkCount) {
        end = length;
        boundary = Boundary.REMAINDER;
      } else {
        int proposedEnd = start + targetChars;
        int searchStart = Math.max(start, proposedEnd - targetChars / 4);
        int searchEnd = Math.min(length, proposedEnd + targetChars / 4);

        boundary = Boundary.HARD;
        end = Math.min(proposedEnd, length);
        // never split a surrogate pair, the lone half would be replaced when encoded
        if (end > start + 1 && end < length && splitsSurrogatePair(content, end)) {
          end--;
        }
        for (Boundary candidate : SEARCH_ORDER) {
          int cut = findCut(content, candidate.delimiter(), start, searchStart, searchEnd);
          if (cut >= 0) {
            boundary = candidate;
            end = cut;
            break;
          }
        }
      }

      pieces.add(new Piece(index, chunkCount, content.substring(start, end), sourceName, metadata));
      STRUCTURED.logPieceSplit(index, chunkCount, start, end, boundary.name());
      start = end;
    }

    LOGGER.info("Created {} chunks", pieces.size());
    return pieces;
  }

  private static boolean splitsSurrogatePair(String content, int index) {
    return Character.isHighSurrogate(content.charAt(index - 1))
        && Character.isLowSurrogate(content.charAt(index));
  }

  /**
   * Position just after the last {@code delimiter} lying entirely inside [searchStart,
   * searchEnd), or -1 if there is none after {@code start}.
   */
  private static int findCut(
      String content, String delimiter, int start, int searchStart, int searchEnd) {
    int found = content.lastIndexOf(delimiter, searchEnd - delimiter.length());
    if (found < searchStart || found <= start) {
      return -1;
    }
    return found + delimiter.length();
  }
}
