package com.scholary.summarizer.api;

import com.scholary.summarizer.chunking.Piece;
import java.util.List;

/**
 * Response for chunk preview request.
 *
 * <p>Shows how the content will be split without actually sending it.
 */
public record ChunkPreviewResponse(int chunkSizeBytes, int chunkCount, List<PieceInfo> pieces) {

  private static final int EDGE_CHARS = 40;

  /**
   * @param index 1-based piece index
   * @param chars number of characters in the piece
   * @param head first characters of the piece
   * @param tail last characters of the piece, showing where it was cut
   */
  public record PieceInfo(int index, int chars, String head, String tail) {

    static PieceInfo of(Piece piece) {
      String text = piece.text();
      return new PieceInfo(
          piece.index(),
          text.length(),
          text.substring(0, Math.min(EDGE_CHARS, text.length())),
          text.substring(Math.max(0, text.length() - EDGE_CHARS)));
    }
  }

  public static ChunkPreviewResponse of(int chunkSizeBytes, List<Piece> pieces) {
    return new ChunkPreviewResponse(
        chunkSizeBytes, pieces.size(), pieces.stream().map(PieceInfo::of).toList());
  }
}
