package com.onkiup.jlist.lexer;

import com.onkiup.jlist.JListToken;

public enum TokenType {
  OPEN, CONTINUE, CLOSE, BULLET, IDENTIFIER, NUMBER, KEYWORD, OPERATOR, LEFT_DELIMITER, RIGHT_DELIMITER;

  public static TokenType of(JListToken token) {
    switch (token) {
      case OPEN:
        return OPEN;
      case CONTINUE:
        return CONTINUE;
      case CLOSE:
        return CLOSE;
      default:
        throw new IllegalArgumentException("Unsupported boundary token: " + token);
    }
  }

  public boolean isBoundary() {
    return this == OPEN || this == CONTINUE || this == CLOSE;
  }
}
