package com.onkiup.jlist;

/**
 * Character lookahead provided by the embedding parser
 */
public interface LexerCursor {

  /**
   * Code point returned by {@link #lookahead()} once the input is exhausted
   */
  int END_OF_INPUT = 0;

  /**
   * @return the next code point, or {@link #END_OF_INPUT}
   */
  int lookahead();

  /**
   * Consumes the lookahead into the current token
   */
  void advance();

  /**
   * Consumes the lookahead without including it into the current token
   */
  void skip();

  /**
   * Marks the current position as the end of the token being scanned
   */
  void markEnd();

  /**
   * @return zero-based column of the lookahead character
   */
  int column();

  default boolean hasNext() {
    return lookahead() != END_OF_INPUT;
  }
}
