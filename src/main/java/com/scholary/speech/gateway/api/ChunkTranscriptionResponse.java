package com.scholary.speech.gateway.api;

import java.util.List;

/**
 * Response for one posted chunk.
 *
 * <p>{@code text} is what the client appends to its transcript. It is empty while an earlier
 * chunk is still in flight, and then carries the text of every chunk released at once.
 */
public record ChunkTranscriptionResponse(
    String text,
    int chunkNumber,
    String status,
    String model,
    boolean degraded,
    String error,
    List<Integer> mergedChunks) {}
