package com.onkiup.jlist;

import static org.junit.Assert.*;

import java.util.NoSuchElementException;

import org.junit.Test;

import com.onkiup.jlist.util.CapacityExceededError;

public class ColumnStackTest {

  @Test
  public void testPushPop() {
    ColumnStack stack = new ColumnStack();
    assertTrue(stack.isEmpty());
    assertEquals(ColumnStack.NONE, stack.peek());

    assertTrue(stack.push(2));
    assertTrue(stack.push(6));
    assertEquals(6, stack.peek());
    assertEquals(2, stack.depth());
    assertArrayEquals(new int[] {2, 6}, stack.toArray());

    assertEquals(6, stack.pop());
    assertEquals(2, stack.peek());
    assertEquals(2, stack.pop());
    assertTrue(stack.isEmpty());
  }

  @Test(expected = NoSuchElementException.class)
  public void testPopEmpty() {
    new ColumnStack().pop();
  }

  @Test
  public void testCapacity() {
    ColumnStack stack = new ColumnStack();
    for (int i = 0; i < ColumnStack.CAPACITY; i++) {
      assertTrue(stack.push(i));
    }
    assertFalse(stack.push(ColumnStack.CAPACITY));
    assertEquals(ColumnStack.CAPACITY, stack.depth());
    assertEquals(ColumnStack.CAPACITY - 1, stack.peek());
  }

  @Test
  public void testColumnRange() {
    ColumnStack stack = new ColumnStack();
    assertTrue(stack.push(ColumnStack.MAX_COLUMN));
    try {
      stack.push(ColumnStack.MAX_COLUMN + 1);
      fail("Column above 15 bits was accepted");
    } catch (CapacityExceededError e) {
      assertArrayEquals(new int[] {ColumnStack.MAX_COLUMN}, e.columns());
    }
    try {
      stack.push(-1);
      fail("Negative column was accepted");
    } catch (CapacityExceededError e) {
      // expected
    }
    assertEquals(1, stack.depth());
  }

  @Test
  public void testEncoding() {
    ColumnStack stack = new ColumnStack();
    stack.push(2);
    stack.push(0x1234);

    byte[] buffer = new byte[16];
    assertEquals(5, stack.writeTo(buffer));
    assertEquals(2, buffer[0]);
    assertEquals(2, buffer[1]);
    assertEquals(0, buffer[2]);
    assertEquals(0x34, buffer[3]);
    assertEquals(0x12, buffer[4]);

    ColumnStack restored = new ColumnStack();
    restored.readFrom(buffer, 5);
    assertEquals(stack, restored);
  }

  @Test
  public void testFullDepthEncoding() {
    ColumnStack stack = new ColumnStack();
    for (int i = 0; i < ColumnStack.CAPACITY; i++) {
      stack.push(i * 128);
    }
    byte[] buffer = new byte[stack.encodedLength()];
    assertEquals(1 + 2 * ColumnStack.CAPACITY, stack.writeTo(buffer));
    assertEquals((byte) 255, buffer[0]);

    ColumnStack restored = new ColumnStack();
    restored.readFrom(buffer, buffer.length);
    assertEquals(stack, restored);
    assertEquals(254 * 128, restored.peek());
  }

  @Test
  public void testZeroLengthResets() {
    ColumnStack stack = new ColumnStack();
    stack.push(4);
    stack.readFrom(new byte[] {1, 9, 0}, 0);
    assertTrue(stack.isEmpty());
  }

  @Test(expected = CapacityExceededError.class)
  public void testSmallBuffer() {
    ColumnStack stack = new ColumnStack();
    stack.push(4);
    stack.writeTo(new byte[2]);
  }

  @Test
  public void testTruncatedInput() {
    ColumnStack stack = new ColumnStack();
    stack.push(4);
    try {
      stack.readFrom(new byte[] {2, 4, 0, 8}, 4);
      fail("Truncated input was accepted");
    } catch (CapacityExceededError e) {
      assertTrue(stack.isEmpty());
    }
  }

  @Test(expected = CapacityExceededError.class)
  public void testNegativeEncodedColumn() {
    new ColumnStack().readFrom(new byte[] {1, 0, (byte) 0x80}, 3);
  }
}
