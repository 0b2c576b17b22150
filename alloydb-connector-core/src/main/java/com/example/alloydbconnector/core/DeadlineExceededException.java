package com.example.alloydbconnector.core;

import java.util.concurrent.CancellationException;

/** Reported by a {@link RefreshContext} whose deadline passed before it was cancelled. */
public final class DeadlineExceededException extends CancellationException {

  private static final long serialVersionUID = 1L;

  public DeadlineExceededException() {
    super("context deadline exceeded");
  }
}
