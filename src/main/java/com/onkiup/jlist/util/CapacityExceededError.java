package com.onkiup.jlist.util;

/**
 * The column stack or its serialized form cannot hold the requested state
 */
public class CapacityExceededError extends ScannerStateError {

  public CapacityExceededError(String msg, int[] columns) {
    super(msg, columns);
  }
}
