package com.onkiup.jlist.lexer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Enumeration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import org.apache.log4j.Appender;
import org.apache.log4j.Layout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.jlist.JListScanner;
import com.onkiup.jlist.JListToken;
import com.onkiup.jlist.util.CursorLoggerLayout;
import com.onkiup.jlist.util.DesynchronizationError;

/**
 * Drives a {@link JListScanner} over a whole text the way a generated parser does: the scanner is consulted
 * before every token with the boundary tokens the grammar accepts at that point; when it declines, the lexer
 * rewinds to the call position and reads an ordinary token.
 *
 * Scanner and lexer state is snapshotted before each scanner call, so {@link #reparse(CharSequence, int)} can
 * resume from an offset instead of rescanning the whole text.
 */
public class JListLexer {
  private static final Logger logger = LoggerFactory.getLogger(JListLexer.class);

  private static final Set<String> KEYWORDS = new HashSet<>(Arrays.asList(
      "IF", "THEN", "ELSE", "LET", "IN", "CASE", "OTHER"));

  // longest spelling first
  private static final List<String> OPERATORS = Arrays.asList(
      "<=>", "/\\", "\\/", "==", "=>", "<=", ">=", "/=", "->", "|->",
      "∧", "∨", "=", "#", "<", ">", "+", "-", "*", "/", "~", ",", ":", "'", ".", "!", "@", "|");

  private static final Map<String, String> DELIMITERS = new TreeMap<>();

  static {
    DELIMITERS.put("(", ")");
    DELIMITERS.put("[", "]");
    DELIMITERS.put("{", "}");
    DELIMITERS.put("<<", ">>");
  }

  private enum Expecting {
    OPERAND, BULLET, OPERATOR
  }

  private static class Delimiter {
    private final String closing;
    private final int depth;
    private final SourceLocation location;

    private Delimiter(String closing, int depth, SourceLocation location) {
      this.closing = closing;
      this.depth = depth;
      this.location = location;
    }
  }

  private static class Snapshot {
    private final byte[] columns;
    private final Expecting expecting;
    private final List<Delimiter> delimiters;
    private final int tokens;

    private Snapshot(byte[] columns, Expecting expecting, Deque<Delimiter> delimiters, int tokens) {
      this.columns = columns;
      this.expecting = expecting;
      this.delimiters = new ArrayList<>(delimiters);
      this.tokens = tokens;
    }
  }

  private final JListScanner scanner;
  private final TreeMap<Integer, Snapshot> snapshots = new TreeMap<>();
  private final List<Token> tokens = new ArrayList<>();
  private Deque<Delimiter> delimiters = new ArrayDeque<>();
  private Expecting expecting = Expecting.OPERAND;
  private String name = "unknown";
  private StringCursor cursor;

  public JListLexer() {
    this(JListScanner.create());
  }

  public JListLexer(JListScanner scanner) {
    this.scanner = scanner;
  }

  public List<Token> tokenize(CharSequence source) {
    return tokenize("unknown", source);
  }

  /**
   * Tokenizes the whole source from a fresh scanner state
   * @param name source name used in token locations
   * @param source text to tokenize
   * @return produced tokens, including zero-width OPEN / CONTINUE / CLOSE tokens
   * @throws SyntaxError on malformed source
   */
  public List<Token> tokenize(String name, CharSequence source) {
    this.name = name;
    snapshots.clear();
    tokens.clear();
    delimiters = new ArrayDeque<>();
    expecting = Expecting.OPERAND;
    scanner.deserialize(new byte[0]);
    cursor = new StringCursor(name, source);
    return run();
  }

  /**
   * Re-tokenizes a source edited at or after the given offset, reusing tokens and state recorded before it
   * @param source edited source; text before {@code offset} must be unchanged
   * @param offset offset of the first changed character
   * @return tokens of the edited source
   * @throws SyntaxError on malformed source
   */
  public List<Token> reparse(CharSequence source, int offset) {
    // tokens ending at the offset have looked at the changed character
    Map.Entry<Integer, Snapshot> entry = snapshots.floorEntry(offset - 1);
    if (entry == null || cursor == null) {
      return tokenize(name, source);
    }
    Snapshot snapshot = entry.getValue();
    logger.debug("Resuming at offset {} (requested {}) with {} reused tokens", entry.getKey(), offset, snapshot.tokens);
    snapshots.tailMap(entry.getKey(), false).clear();
    tokens.subList(snapshot.tokens, tokens.size()).clear();
    scanner.deserialize(snapshot.columns);
    expecting = snapshot.expecting;
    delimiters = new ArrayDeque<>(snapshot.delimiters);
    cursor = new StringCursor(name, source);
    cursor.reset(entry.getKey());
    return run();
  }

  /**
   * @return offsets from which {@link #reparse(CharSequence, int)} can resume without going back further
   */
  public Set<Integer> checkpoints() {
    return Collections.unmodifiableSet(snapshots.keySet());
  }

  public JListScanner scanner() {
    return scanner;
  }

  private List<Token> run() {
    setupLoggingLayouts();
    try {
      while (true) {
        int entry = cursor.position();
        snapshots.putIfAbsent(entry, new Snapshot(scanner.serialize(), expecting, delimiters, tokens.size()));
        cursor.begin();
        Optional<JListToken> boundary = scan();
        if (boundary.isPresent()) {
          cursor.reset(cursor.tokenEnd());
          onBoundary(boundary.get());
          continue;
        }

        cursor.reset(entry);
        while (Character.isWhitespace(cursor.lookahead())) {
          cursor.skip();
        }
        if (!cursor.hasNext()) {
          break;
        }
        readToken();
      }

      if (!delimiters.isEmpty()) {
        throw new SyntaxError("Unclosed '" + delimiters.peek().closing + "' delimiter", delimiters.peek().location);
      }
      if (scanner.depth() > 0) {
        throw new SyntaxError("Unterminated conjunction list at column " + scanner.currentColumn(), cursor.location());
      }
      return new ArrayList<>(tokens);
    } finally {
      restoreLoggingLayouts();
    }
  }

  /**
   * Runs the scanner at the cursor; a token the grammar approximation did not request means the source
   * does not fit the list layout (an empty item, an item ending in an operator)
   */
  private Optional<JListToken> scan() {
    try {
      return scanner.scan(cursor, requested());
    } catch (DesynchronizationError e) {
      cursor.reset(cursor.tokenEnd());
      throw new SyntaxError("Unexpected conjunction list boundary: expected an operand at column " + e.column(),
          cursor.location(), e);
    }
  }

  private Set<JListToken> requested() {
    switch (expecting) {
      case OPERAND:
        return EnumSet.of(JListToken.OPEN);
      case OPERATOR:
        return scanner.depth() == 0
            ? EnumSet.noneOf(JListToken.class)
            : EnumSet.of(JListToken.CONTINUE, JListToken.CLOSE);
      default:
        return EnumSet.noneOf(JListToken.class);
    }
  }

  private void onBoundary(JListToken boundary) {
    tokens.add(new Token(TokenType.of(boundary), "", cursor.location()));
    logger.debug("Boundary token {}", boundary);
    // a closed list is a complete operand
    expecting = boundary == JListToken.CLOSE ? Expecting.OPERATOR : Expecting.BULLET;
  }

  private void readToken() {
    SourceLocation location = cursor.location();
    CharSequence source = cursor.source();
    int start = cursor.position();
    int character = cursor.lookahead();

    if (expecting == Expecting.BULLET) {
      if (startsWith(source, start, "/\\") || startsWith(source, start, "∧")) {
        emit(TokenType.BULLET, startsWith(source, start, "∧") ? "∧" : "/\\", location, Expecting.OPERAND);
        return;
      }
      throw new SyntaxError("Expected a conjunction list bullet", location);
    }

    if (Character.isLetter(character) || character == '_') {
      StringBuilder word = new StringBuilder();
      while (Character.isLetterOrDigit(cursor.lookahead()) || cursor.lookahead() == '_') {
        word.appendCodePoint(cursor.lookahead());
        cursor.advance();
      }
      String text = word.toString();
      if (KEYWORDS.contains(text)) {
        addToken(TokenType.KEYWORD, text, location, Expecting.OPERAND);
      } else {
        addToken(TokenType.IDENTIFIER, text, location, Expecting.OPERATOR);
      }
      return;
    }

    if (Character.isDigit(character)) {
      StringBuilder number = new StringBuilder();
      while (Character.isDigit(cursor.lookahead())) {
        number.appendCodePoint(cursor.lookahead());
        cursor.advance();
      }
      addToken(TokenType.NUMBER, number.toString(), location, Expecting.OPERATOR);
      return;
    }

    for (Map.Entry<String, String> delimiter : DELIMITERS.entrySet()) {
      if (startsWith(source, start, delimiter.getKey())) {
        delimiters.push(new Delimiter(delimiter.getValue(), scanner.depth(), location));
        emit(TokenType.LEFT_DELIMITER, delimiter.getKey(), location, Expecting.OPERAND);
        return;
      }
      if (startsWith(source, start, delimiter.getValue())) {
        closeDelimiter(delimiter.getValue(), location);
        emit(TokenType.RIGHT_DELIMITER, delimiter.getValue(), location, Expecting.OPERATOR);
        return;
      }
    }

    for (String operator : OPERATORS) {
      if (startsWith(source, start, operator)) {
        // priming keeps the operand complete
        emit(TokenType.OPERATOR, operator, location, "'".equals(operator) ? Expecting.OPERATOR : Expecting.OPERAND);
        return;
      }
    }

    throw new SyntaxError("Unexpected character '" + CursorLoggerLayout.escape(new String(Character.toChars(character))) + "'", location);
  }

  private void closeDelimiter(String closing, SourceLocation location) {
    Delimiter opened = delimiters.peek();
    if (opened == null || !opened.closing.equals(closing)) {
      throw new SyntaxError("Unmatched '" + closing + "'", location);
    }
    if (scanner.depth() > opened.depth) {
      throw new SyntaxError("'" + closing + "' closes a delimiter opened before the conjunction list at column "
          + scanner.currentColumn(), location);
    }
    delimiters.pop();
  }

  private void emit(TokenType type, String text, SourceLocation location, Expecting next) {
    for (int i = 0; i < text.codePointCount(0, text.length()); i++) {
      cursor.advance();
    }
    addToken(type, text, location, next);
  }

  private void addToken(TokenType type, String text, SourceLocation location, Expecting next) {
    Token token = new Token(type, text, location);
    tokens.add(token);
    expecting = next;
    logger.debug("Token {}", token);
  }

  private static boolean startsWith(CharSequence source, int offset, String prefix) {
    if (source.length() - offset < prefix.length()) {
      return false;
    }
    for (int i = 0; i < prefix.length(); i++) {
      if (source.charAt(offset + i) != prefix.charAt(i)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Decorates log4j appenders with a {@link CursorLoggerLayout} for the duration of a run
   */
  private void setupLoggingLayouts() {
    final StringCursor current = cursor;
    Enumeration<Appender> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = appenders.nextElement();
      if (!(appender.getLayout() instanceof CursorLoggerLayout)) {
        appender.setLayout(new CursorLoggerLayout(appender.getLayout(), current.source(), current::position,
            () -> Arrays.toString(scanner.openColumns())));
      }
    }
  }

  private void restoreLoggingLayouts() {
    Enumeration<Appender> appenders = org.apache.log4j.Logger.getRootLogger().getAllAppenders();
    while (appenders.hasMoreElements()) {
      Appender appender = appenders.nextElement();
      Layout layout = appender.getLayout();
      if (layout instanceof CursorLoggerLayout) {
        appender.setLayout(((CursorLoggerLayout) layout).parent());
      }
    }
  }
}
