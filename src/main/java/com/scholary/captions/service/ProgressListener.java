package com.scholary.captions.service;

/** Receives window completion counts while a pipeline runs. Called from worker threads. */
@FunctionalInterface
public interface ProgressListener {

  ProgressListener NONE = (done, total) -> {};

  void windowsCompleted(int done, int total);
}
