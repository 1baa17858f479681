package com.scholary.summarizer.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class ContentChunkerTest {

  private static final int MIN_BUDGET = ChunkConfig.MIN_CHUNK_SIZE_BYTES;

  @Test
  void calculateChunkCount_shouldRoundUp() {
    ContentChunker chunker = new ContentChunker(50_000);
    assertThat(chunker.calculateChunkCount(120_000)).isEqualTo(3);
    assertThat(chunker.calculateChunkCount(100_000)).isEqualTo(2);
    assertThat(chunker.calculateChunkCount(100_001)).isEqualTo(3);
  }

  @Test
  void calculateChunkCount_shouldNeverReturnLessThanOne() {
    ContentChunker chunker = new ContentChunker(50_000);
    assertThat(chunker.calculateChunkCount(0)).isEqualTo(1);
    assertThat(chunker.calculateChunkCount(1)).isEqualTo(1);
  }

  @Test
  void calculateChunkCount_shouldNotDecreaseWithSize() {
    ContentChunker chunker = new ContentChunker(MIN_BUDGET);
    int previous = 0;
    for (long size = 0; size < 100_000; size += 777) {
      int count = chunker.calculateChunkCount(size);
      assertThat(count).isGreaterThanOrEqualTo(previous);
      previous = count;
    }
  }

  @Test
  void constructor_shouldRejectNonPositiveBudget() {
    assertThatThrownBy(() -> new ContentChunker(0))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("positive");
  }

  @Test
  void split_shouldReturnContentUnchangedWhenWithinBudget() {
    String text = "short note\n\nwith two paragraphs";
    List<Piece> pieces =
        new ContentChunker(MIN_BUDGET).split(text, 40, "notes", Map.of("lang", "en"));

    assertThat(pieces).hasSize(1);
    Piece piece = pieces.get(0);
    assertThat(piece.text()).isSameAs(text);
    assertThat(piece.index()).isEqualTo(1);
    assertThat(piece.totalPieces()).isEqualTo(1);
    assertThat(piece.isPartOfSplit()).isFalse();
    assertThat(piece.sourceName()).isEqualTo("notes");
    assertThat(piece.metadata()).containsEntry("lang", "en");
  }

  @Test
  void split_shouldReturnOneEmptyPieceForEmptyText() {
    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split("", 0);
    assertThat(pieces).hasSize(1);
    assertThat(pieces.get(0).text()).isEmpty();
  }

  @Test
  void split_shouldTreatNullAsEmpty() {
    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(null, 0);
    assertThat(pieces).singleElement().extracting(Piece::text).isEqualTo("");
  }

  @Test
  void split_shouldPreferParagraphBreakOverLineBreak() {
    // 10,000 chars from 10,240 bytes -> 2 pieces, target 5,000, window [3750, 6250)
    StringBuilder text = new StringBuilder("x".repeat(10_000));
    text.setCharAt(4500, '\n');
    text.setCharAt(4501, '\n');
    text.setCharAt(5500, '\n');

    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text.toString(), 10_240);

    assertThat(pieces).hasSize(2);
    assertThat(pieces.get(0).text()).hasSize(4502).endsWith("\n\n");
    assertThat(pieces.get(1).text()).startsWith("x");
  }

  @Test
  void split_shouldFallBackToLineThenWord() {
    StringBuilder text = new StringBuilder("x".repeat(10_000));
    text.setCharAt(4000, ' ');
    text.setCharAt(5200, '\n');

    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text.toString(), 10_240);
    assertThat(pieces.get(0).text()).hasSize(5201).endsWith("\n");

    StringBuilder words = new StringBuilder("x".repeat(10_000));
    words.setCharAt(4000, ' ');
    words.setCharAt(5900, ' ');
    pieces = new ContentChunker(MIN_BUDGET).split(words.toString(), 10_240);
    assertThat(pieces.get(0).text()).hasSize(5901);
  }

  @Test
  void split_shouldIgnoreDelimitersOutsideWindow() {
    StringBuilder text = new StringBuilder("x".repeat(10_000));
    text.setCharAt(1000, '\n');
    text.setCharAt(1001, '\n');
    text.setCharAt(9000, ' ');

    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text.toString(), 10_240);

    assertThat(pieces.get(0).text()).hasSize(5000);
  }

  @Test
  void split_shouldReassembleToOriginal() {
    String text = randomProse(new Random(42), 60_000);
    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text, 60_000, "essay", null);

    assertThat(pieces).hasSize(12);
    assertThat(pieces.stream().map(Piece::text).collect(Collectors.joining())).isEqualTo(text);
    for (int i = 0; i < pieces.size(); i++) {
      Piece piece = pieces.get(i);
      assertThat(piece.index()).isEqualTo(i + 1);
      assertThat(piece.totalPieces()).isEqualTo(12);
      assertThat(piece.metadata()).isEmpty();
      if (piece.index() < pieces.size()) {
        // target 5,000 chars plus at most a quarter of it
        assertThat(piece.text().length()).isLessThanOrEqualTo(6250);
      }
    }
  }

  @Test
  void split_shouldCountPiecesFromBytesForMultiByteText() {
    String text = "€".repeat(3000);
    int bytes = text.getBytes(StandardCharsets.UTF_8).length;

    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text, bytes);

    assertThat(bytes).isEqualTo(9000);
    assertThat(pieces).hasSize(2);
    assertThat(pieces.get(0).text()).hasSize(1500);
    assertThat(pieces.get(0).text() + pieces.get(1).text()).isEqualTo(text);
  }

  @Test
  void split_shouldNotSplitSurrogatePairOnHardCut() {
    // 6,002 UTF-16 units from 12,004 bytes -> 3 pieces with an odd target of 2,001 units
    String text = "😀".repeat(3001);
    int bytes = text.getBytes(StandardCharsets.UTF_8).length;

    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split(text, bytes);

    assertThat(pieces).hasSize(3);
    assertThat(pieces.get(0).text()).hasSize(2000);
    StringBuilder overTheWire = new StringBuilder();
    for (Piece piece : pieces) {
      String encoded =
          new String(piece.text().getBytes(StandardCharsets.UTF_8), StandardCharsets.UTF_8);
      assertThat(encoded).isEqualTo(piece.text());
      assertThat(Character.isHighSurrogate(piece.text().charAt(piece.text().length() - 1)))
          .isFalse();
      overTheWire.append(encoded);
    }
    assertThat(overTheWire.toString()).isEqualTo(text);
  }

  @Test
  void split_shouldKeepMetadataWithNullValues() {
    Map<String, Object> metadata = new java.util.HashMap<>();
    metadata.put("speaker", null);
    List<Piece> pieces = new ContentChunker(MIN_BUDGET).split("abc", 3, "a", metadata);
    assertThat(pieces.get(0).metadata()).containsKey("speaker");
  }

  private static String randomProse(Random random, int length) {
    String[] words = {"summary", "webhook", "chunk", "the", "of", "meeting", "notes", "a"};
    StringBuilder text = new StringBuilder(length);
    while (text.length() < length) {
      text.append(words[random.nextInt(words.length)]);
      int r = random.nextInt(40);
      if (r == 0) {
        text.append("\n\n");
      } else if (r < 3) {
        text.append('\n');
      } else {
        text.append(' ');
      }
    }
    return text.substring(0, length);
  }
}
