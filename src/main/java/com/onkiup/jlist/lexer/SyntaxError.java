package com.onkiup.jlist.lexer;

/**
 * Malformed source text found by {@link JListLexer}
 */
public class SyntaxError extends RuntimeException {

  private final SourceLocation location;

  public SyntaxError(String message, SourceLocation location) {
    super(message);
    this.location = location;
  }

  public SyntaxError(String message, SourceLocation location, Throwable cause) {
    super(message, cause);
    this.location = location;
  }

  public SourceLocation location() {
    return location;
  }

  @Override
  public String toString() {
    return new StringBuilder("Syntax error at ")
      .append(location)
      .append(": ")
      .append(getMessage())
      .toString();
  }
}
