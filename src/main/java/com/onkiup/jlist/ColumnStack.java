package com.onkiup.jlist;

import java.util.Arrays;
import java.util.NoSuchElementException;

import com.onkiup.jlist.util.CapacityExceededError;

/**
 * Bounded stack of list columns, innermost last.
 * Serialized as one unsigned depth byte followed by little-endian 16-bit columns, bottom to top.
 */
public class ColumnStack {

  public static final int CAPACITY = 255;
  public static final int MAX_COLUMN = Short.MAX_VALUE;
  public static final int NONE = -1;
  public static final int COLUMN_BYTES = Short.BYTES;

  private final short[] columns = new short[CAPACITY];
  private int depth;

  /**
   * @param column column to push
   * @return false if the stack is full and nothing was pushed
   * @throws CapacityExceededError if the column does not fit into 15 bits
   */
  public boolean push(int column) {
    if (column < 0 || column > MAX_COLUMN) {
      throw new CapacityExceededError("Column " + column + " is outside of 0.." + MAX_COLUMN, toArray());
    }
    if (depth == CAPACITY) {
      return false;
    }
    columns[depth++] = (short) column;
    return true;
  }

  public int pop() {
    if (depth == 0) {
      throw new NoSuchElementException("Column stack is empty");
    }
    return columns[--depth];
  }

  /**
   * @return innermost column or {@link #NONE} when no list is open
   */
  public int peek() {
    return depth == 0 ? NONE : columns[depth - 1];
  }

  public int depth() {
    return depth;
  }

  public boolean isEmpty() {
    return depth == 0;
  }

  public void clear() {
    depth = 0;
  }

  public int[] toArray() {
    int[] result = new int[depth];
    for (int i = 0; i < depth; i++) {
      result[i] = columns[i];
    }
    return result;
  }

  public int encodedLength() {
    return 1 + depth * COLUMN_BYTES;
  }

  /**
   * Writes this stack into the buffer
   * @return number of bytes written
   */
  public int writeTo(byte[] buffer) {
    if (depth > CAPACITY) {
      throw new CapacityExceededError("Nesting depth " + depth + " exceeds " + CAPACITY, toArray());
    }
    int length = encodedLength();
    if (buffer.length < length) {
      throw new CapacityExceededError("Serialization buffer holds " + buffer.length + " bytes, " + length + " required", toArray());
    }
    buffer[0] = (byte) depth;
    for (int i = 0; i < depth; i++) {
      int offset = 1 + i * COLUMN_BYTES;
      buffer[offset] = (byte) columns[i];
      buffer[offset + 1] = (byte) (columns[i] >> 8);
    }
    return length;
  }

  /**
   * Replaces contents of this stack with the encoded one; zero length resets the stack
   * @param buffer encoded stack
   * @param length number of meaningful bytes in the buffer
   */
  public void readFrom(byte[] buffer, int length) {
    clear();
    if (length <= 0) {
      return;
    }
    int encodedDepth = buffer[0] & 0xFF;
    int required = 1 + encodedDepth * COLUMN_BYTES;
    if (length < required || buffer.length < required) {
      throw new CapacityExceededError("Encoded stack of depth " + encodedDepth + " needs " + required
          + " bytes, got " + Math.min(length, buffer.length), new int[0]);
    }
    for (int i = 0; i < encodedDepth; i++) {
      int offset = 1 + i * COLUMN_BYTES;
      short column = (short) ((buffer[offset] & 0xFF) | (buffer[offset + 1] << 8));
      if (column < 0) {
        depth = 0;
        throw new CapacityExceededError("Encoded column " + column + " at depth " + i + " is negative", new int[0]);
      }
      columns[i] = column;
    }
    depth = encodedDepth;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ColumnStack)) {
      return false;
    }
    return Arrays.equals(toArray(), ((ColumnStack) other).toArray());
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(toArray());
  }

  @Override
  public String toString() {
    return Arrays.toString(toArray());
  }
}
