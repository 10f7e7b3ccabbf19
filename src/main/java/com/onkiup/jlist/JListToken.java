package com.onkiup.jlist;

import java.util.EnumSet;
import java.util.Set;

/**
 * Synthetic boundary tokens emitted by {@link JListScanner}.
 * Ordinals match the external symbol indices declared by the host grammar.
 */
public enum JListToken {
  /** starts a new nested conjunction list */
  OPEN,
  /** separates two items of the same list */
  CONTINUE,
  /** ends the innermost list */
  CLOSE;

  /**
   * @return symbol index of this token in the host grammar's external token table
   */
  public int symbol() {
    return ordinal();
  }

  public static JListToken forSymbol(int symbol) {
    JListToken[] tokens = values();
    if (symbol < 0 || symbol >= tokens.length) {
      throw new IllegalArgumentException("Unknown external symbol: " + symbol);
    }
    return tokens[symbol];
  }

  /**
   * Converts host-provided valid symbol flags into a set of requested tokens
   * @param validSymbols flags indexed by {@link #symbol()}; may be shorter than the token table
   * @return requested tokens
   */
  public static Set<JListToken> requested(boolean[] validSymbols) {
    EnumSet<JListToken> result = EnumSet.noneOf(JListToken.class);
    for (JListToken token : values()) {
      if (token.symbol() < validSymbols.length && validSymbols[token.symbol()]) {
        result.add(token);
      }
    }
    return result;
  }
}
