package com.scholary.captions.inference;

/** What an inference request is for. Used for logging and for routing in tests. */
public enum InferencePurpose {
  TRANSCRIPTION,
  GAP_CLASSIFICATION,
  TIMING_OPTIMIZATION
}
