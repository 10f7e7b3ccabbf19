package com.onkiup.jlist.lexer;

import com.onkiup.jlist.ResultCursor;

/**
 * In-memory cursor with tree-sitter-like lexing semantics: skipped characters move the token start,
 * the token ends at the marked position (or at the current one if nothing was marked).
 * Columns count code points since the last line feed.
 */
public class StringCursor implements ResultCursor {

  public static final int NO_RESULT = -1;

  private final String name;
  private final CharSequence source;
  private int position, line, column;
  private int tokenStart;
  private int beginPosition, beginLine, beginColumn;
  private int markedEnd = -1;
  private int resultSymbol = NO_RESULT;

  public StringCursor(String name, CharSequence source) {
    this.name = name;
    this.source = source;
  }

  public StringCursor(CharSequence source) {
    this("unknown", source);
  }

  @Override
  public int lookahead() {
    if (position >= source.length()) {
      return END_OF_INPUT;
    }
    return Character.codePointAt(source, position);
  }

  @Override
  public void advance() {
    int character = lookahead();
    if (character == END_OF_INPUT) {
      return;
    }
    position += Character.charCount(character);
    if (character == '\n') {
      line++;
      column = 0;
    } else {
      column++;
    }
  }

  @Override
  public void skip() {
    advance();
    tokenStart = position;
  }

  @Override
  public void markEnd() {
    markedEnd = position;
  }

  @Override
  public int column() {
    return column;
  }

  @Override
  public void resultSymbol(int symbol) {
    this.resultSymbol = symbol;
  }

  public int resultSymbol() {
    return resultSymbol;
  }

  /**
   * Starts a new token at the current position
   */
  public void begin() {
    beginPosition = position;
    beginLine = line;
    beginColumn = column;
    tokenStart = position;
    markedEnd = -1;
    resultSymbol = NO_RESULT;
  }

  public int tokenStart() {
    return tokenStart;
  }

  public int tokenEnd() {
    return markedEnd < 0 ? position : markedEnd;
  }

  public int position() {
    return position;
  }

  public int line() {
    return line;
  }

  public CharSequence source() {
    return source;
  }

  /**
   * Moves the cursor to the given offset and starts a new token there
   */
  public void reset(int offset) {
    if (offset < 0 || offset > source.length()) {
      throw new IllegalArgumentException("Offset " + offset + " is outside of 0.." + source.length());
    }
    if (offset < position) {
      rewind(offset);
    }
    while (position < offset) {
      advance();
    }
    begin();
  }

  private void rewind(int offset) {
    if (offset == beginPosition) {
      position = beginPosition;
      line = beginLine;
      column = beginColumn;
      return;
    }
    for (int i = offset; i < position; i++) {
      if (source.charAt(i) == '\n') {
        line--;
      }
    }
    int lineStart = offset;
    while (lineStart > 0 && source.charAt(lineStart - 1) != '\n') {
      lineStart--;
    }
    column = Character.codePointCount(source, lineStart, offset);
    position = offset;
  }

  public SourceLocation location() {
    return new SourceLocation(name, position, line, column);
  }

  @Override
  public String toString() {
    return "StringCursor@" + location();
  }
}
