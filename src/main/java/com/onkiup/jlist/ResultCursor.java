package com.onkiup.jlist;

/**
 * A {@link LexerCursor} that also accepts the symbol of the produced token
 */
public interface ResultCursor extends LexerCursor {

  void resultSymbol(int symbol);
}
