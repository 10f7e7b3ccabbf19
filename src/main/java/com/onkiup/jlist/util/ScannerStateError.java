package com.onkiup.jlist.util;

import java.util.Arrays;

/**
 * Signals that the scanner reached a state it cannot represent or that the host grammar
 * asked for tokens the scanner cannot legally produce. Never a user-facing syntax error.
 */
public class ScannerStateError extends RuntimeException {

  private final int[] columns;

  public ScannerStateError(String msg, int[] columns) {
    super(msg);
    this.columns = columns == null ? new int[0] : columns.clone();
  }

  public ScannerStateError(String msg, int[] columns, Throwable cause) {
    super(msg, cause);
    this.columns = columns == null ? new int[0] : columns.clone();
  }

  /**
   * @return column stack (bottom to top) at the moment of failure
   */
  public int[] columns() {
    return columns.clone();
  }

  @Override
  public String toString() {
    return new StringBuilder(getClass().getSimpleName())
      .append(": ")
      .append(getMessage())
      .append("\n\tColumn stack: ")
      .append(Arrays.toString(columns))
      .toString();
  }
}
