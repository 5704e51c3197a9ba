package com.scholary.speech.gateway.chunking;

/** Thrown when audio submitted as a chunk is empty or has no decodable container header. */
public class ChunkInvalidException extends RuntimeException {

  private final int chunkNumber;

  public ChunkInvalidException(int chunkNumber, String reason) {
    super(String.format("Chunk %d is not decodable: %s", chunkNumber, reason));
    this.chunkNumber = chunkNumber;
  }

  public int getChunkNumber() {
    return chunkNumber;
  }
}
