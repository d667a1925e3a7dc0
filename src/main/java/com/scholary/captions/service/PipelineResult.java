package com.scholary.captions.service;

import com.scholary.captions.transcript.Transcript;

/** Output of one pipeline run: the final transcript plus counters for diagnostics. */
public record PipelineResult(
    Transcript transcript,
    int windows,
    int fallbackWindows,
    int cachedWindows,
    int gapSegments,
    boolean optimizerApplied) {}
