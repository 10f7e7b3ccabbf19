package com.onkiup.jlist;

import java.util.Optional;

/**
 * Entry points called by a generated parser runtime, one scanner instance per parser
 */
public final class ScannerBinding {

  private ScannerBinding() {
  }

  // Called once when the language is set on a parser
  public static JListScanner create() {
    return JListScanner.create();
  }

  // Called once the parser is deleted or another language is set
  public static void destroy(JListScanner scanner) {
    scanner.destroy();
  }

  // Called whenever the scanner recognizes a token
  public static int serialize(JListScanner scanner, byte[] buffer) {
    return scanner.serialize(buffer);
  }

  // Called when handling edits and ambiguities
  public static void deserialize(JListScanner scanner, byte[] buffer, int length) {
    scanner.deserialize(buffer, length);
  }

  public static boolean scan(JListScanner scanner, ResultCursor lexer, boolean[] validSymbols) {
    Optional<JListToken> token = scanner.scan(lexer, JListToken.requested(validSymbols));
    token.ifPresent(result -> lexer.resultSymbol(result.symbol()));
    return token.isPresent();
  }
}
