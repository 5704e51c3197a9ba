package com.scholary.speech.gateway.chunking;

/** Creates one encoder per live session. */
@FunctionalInterface
public interface AudioEncoderFactory {

  AudioEncoder create();
}
