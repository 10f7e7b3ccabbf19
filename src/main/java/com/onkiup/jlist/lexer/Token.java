package com.onkiup.jlist.lexer;

import java.util.Objects;

import com.onkiup.jlist.util.CursorLoggerLayout;

public class Token {

  private final TokenType type;
  private final String text;
  private final SourceLocation location;

  public Token(TokenType type, String text, SourceLocation location) {
    this.type = type;
    this.text = text;
    this.location = location;
  }

  public TokenType type() {
    return type;
  }

  public String text() {
    return text;
  }

  public SourceLocation location() {
    return location;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof Token)) {
      return false;
    }
    Token that = (Token) other;
    return type == that.type && Objects.equals(text, that.text)
        && location.position() == that.location.position();
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, text, location.position());
  }

  @Override
  public String toString() {
    if (type.isBoundary()) {
      return type.name() + "@" + location.line() + ':' + location.column();
    }
    return type.name() + "('" + CursorLoggerLayout.escape(text) + "')@" + location.line() + ':' + location.column();
  }
}
