/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;

/**
 * Signals a broken link invariant: a node about to be reclaimed is still
 * referenced from elsewhere in its log, or the {@code next}/{@code prev}
 * chains disagree. This is a bug, not a recoverable condition; the log
 * that raised it should be considered corrupt.
 */
@SuppressWarnings("serial")
public class DanglingLinkError extends AssertionError {

  public DanglingLinkError(String message) {
    super(message);
  }

}
