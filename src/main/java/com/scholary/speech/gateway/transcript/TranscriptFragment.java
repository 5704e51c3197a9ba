package com.scholary.speech.gateway.transcript;

/**
 * Text recognized for one chunk.
 *
 * @param sourceModel the model that produced the text, which differs from the resolved model
 *     after a provider fallback
 */
public record TranscriptFragment(int sequenceNumber, String text, String sourceModel) {}
