package com.onthegomap.trailcover.util;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, handling interrupts and wrapping in a {@link FatalTrailcoverException} if checked.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalTrailcoverException(exception);
  }

  /**
   * Fatal exception that will result in the coverage run exiting early.
   */
  public static class FatalTrailcoverException extends RuntimeException {
    public FatalTrailcoverException(Throwable exception) {
      super(exception);
    }
  }
}
