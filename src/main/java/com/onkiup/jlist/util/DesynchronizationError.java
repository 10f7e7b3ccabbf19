package com.onkiup.jlist.util;

import com.onkiup.jlist.JListToken;

/**
 * The scanner had to emit a boundary token that the host grammar did not request
 */
public class DesynchronizationError extends ScannerStateError {

  private final JListToken required;
  private final int column;

  public DesynchronizationError(JListToken required, int column, int[] columns) {
    super("Grammar did not request " + required + " for a token at column " + column, columns);
    this.required = required;
    this.column = column;
  }

  public JListToken required() {
    return required;
  }

  public int column() {
    return column;
  }
}
