/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog.json;

/**
 * Unchecked exception for JSON input that is malformed or doesn't describe
 * a transaction log.
 */
@SuppressWarnings("serial")
public class JsonParsingException extends RuntimeException {

  public JsonParsingException(String message) {
    super(message);
  }

  public JsonParsingException(String message, Throwable cause) {
    super(message, cause);
  }

}
