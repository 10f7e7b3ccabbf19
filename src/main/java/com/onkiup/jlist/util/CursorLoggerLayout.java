package com.onkiup.jlist.util;

import java.util.function.Supplier;

import org.apache.log4j.Layout;
import org.apache.log4j.spi.LoggingEvent;

/**
 * Prefixes log lines with the source text preceding the cursor and the current column stack
 */
public class CursorLoggerLayout extends Layout {

  private static final int CONTEXT = 30;

  private final Layout parent;
  private final CharSequence buffer;
  private final Supplier<Integer> position;
  private final Supplier<Object> state;

  public CursorLoggerLayout(Layout parent, CharSequence buffer, Supplier<Integer> position, Supplier<Object> state) {
    this.parent = parent;
    this.buffer = buffer;
    this.position = position;
    this.state = state;
  }

  @Override
  public String format(LoggingEvent event) {
    int position = Math.min(this.position.get(), buffer.length());
    CharSequence preceding = escape(buffer.subSequence(Math.max(0, position - CONTEXT), position));
    return String.format("'%s' %-12s || %s :: %s\n", tail(preceding, CONTEXT), state.get(),
        tail(event.getLoggerName(), 40), event.getRenderedMessage());
  }

  @Override
  public boolean ignoresThrowable() {
    return parent == null || parent.ignoresThrowable();
  }

  @Override
  public void activateOptions() {
    if (parent != null) {
      parent.activateOptions();
    }
  }

  public Layout parent() {
    return parent;
  }

  /**
   * Replaces line breaks and tabs with their escape sequences so that a log entry stays on one line
   */
  public static String escape(CharSequence what) {
    if (what == null) {
      return "null";
    }
    StringBuilder result = new StringBuilder(what.length());
    for (int i = 0; i < what.length(); i++) {
      char character = what.charAt(i);
      switch (character) {
        case '\n':
          result.append("\\n");
          break;
        case '\r':
          result.append("\\r");
          break;
        case '\t':
          result.append("\\t");
          break;
        default:
          result.append(character);
      }
    }
    return result.toString();
  }

  /**
   * @return last {@code width} characters of the text, left-padded with spaces when it is shorter
   */
  public static String tail(CharSequence what, int width) {
    if (what.length() >= width) {
      return what.subSequence(what.length() - width, what.length()).toString();
    }
    StringBuilder result = new StringBuilder(width);
    for (int i = what.length(); i < width; i++) {
      result.append(' ');
    }
    return result.append(what).toString();
  }
}
