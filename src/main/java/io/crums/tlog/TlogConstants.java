/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.tlog;


import java.lang.System.Logger;
import java.lang.System.Logger.Level;

/**
 * Constants and the shared logger.
 */
public class TlogConstants {

  private TlogConstants() {  }
  
  
  public final static String LOG_NAME = "io.crums.tlog";
  
  /**
   * Initial number of node slots allocated by a {@linkplain TransactionLog}
   * constructed without an explicit capacity.
   */
  public final static int DEFAULT_CAPACITY = 16;
  
  /**
   * Slot index standing for an absent link.
   */
  final static int NIL = -1;
  
  
  static Logger log() {
    return System.getLogger(LOG_NAME);
  }
  
  static void logError(String message) {
    log().log(Level.ERROR, message);
  }
  
  static void logDebug(String message) {
    log().log(Level.DEBUG, message);
  }

}
