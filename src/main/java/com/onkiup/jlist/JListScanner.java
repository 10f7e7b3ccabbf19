package com.onkiup.jlist;

import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.onkiup.jlist.util.CapacityExceededError;
import com.onkiup.jlist.util.DesynchronizationError;

/**
 * Emits OPEN / CONTINUE / CLOSE tokens around conjunction lists whose items are aligned by column:
 * <pre>
 *   /\ a
 *   /\ /\ b
 *      /\ c
 *   /\ d
 * </pre>
 * Each open list is identified by the column of its first conjunction; columns of all open lists are kept
 * in a {@link ColumnStack}. Hosts that reparse from arbitrary offsets must {@link #serialize()} the state
 * after each token and {@link #deserialize(byte[])} the snapshot of the offset they resume from.
 */
public class JListScanner {
  private static final Logger logger = LoggerFactory.getLogger(JListScanner.class);

  public static final int CONJUNCTION = '∧';
  public static final int SLASH = '/';
  public static final int BACKSLASH = '\\';

  private final ColumnStack columns = new ColumnStack();
  private boolean destroyed;

  public static JListScanner create() {
    return new JListScanner();
  }

  protected JListScanner() {
  }

  /**
   * Drops scanner state. The instance cannot scan afterwards.
   */
  public void destroy() {
    columns.clear();
    destroyed = true;
  }

  ColumnStack columns() {
    return columns;
  }

  /**
   * @return number of currently open lists
   */
  public int depth() {
    return columns.depth();
  }

  /**
   * @return column of the innermost open list, or {@link ColumnStack#NONE}
   */
  public int currentColumn() {
    return columns.peek();
  }

  /**
   * @return copy of the open list columns, outermost first
   */
  public int[] openColumns() {
    return columns.toArray();
  }

  public byte[] serialize() {
    byte[] result = new byte[columns.encodedLength()];
    columns.writeTo(result);
    return result;
  }

  public int serialize(byte[] buffer) {
    return columns.writeTo(buffer);
  }

  public void deserialize(byte[] buffer) {
    deserialize(buffer, buffer == null ? 0 : buffer.length);
  }

  public void deserialize(byte[] buffer, int length) {
    columns.readFrom(buffer, buffer == null ? 0 : length);
    logger.debug("Restored column stack {}", columns);
  }

  /**
   * Looks at the next significant character and decides whether a list boundary is located there
   * @param lexer host cursor
   * @param requested boundary tokens the host grammar accepts at this point
   * @return emitted token, or empty if the host should tokenize this position on its own
   */
  public Optional<JListToken> scan(LexerCursor lexer, Set<JListToken> requested) {
    if (destroyed) {
      throw new IllegalStateException("Scanner has been destroyed");
    }
    if (!requested.contains(JListToken.OPEN) && !requested.contains(JListToken.CONTINUE)
        && !requested.contains(JListToken.CLOSE)) {
      return Optional.empty();
    }

    while (lexer.hasNext()) {
      int next = lexer.lookahead();
      switch (next) {
        case ' ':
        case '\t':
        case '\n':
        case '\r':
          lexer.skip();
          break;
        case CONJUNCTION: {
          int column = lexer.column();
          lexer.markEnd();
          return conjunction(requested, column);
        }
        case SLASH: {
          int column = lexer.column();
          lexer.markEnd();
          lexer.advance();
          if (lexer.lookahead() == BACKSLASH) {
            return conjunction(requested, column);
          }
          logger.debug("'/' at column {} does not start a conjunction", column);
          return Optional.empty();
        }
        default:
          return otherToken(requested, lexer.column());
      }
    }
    return Optional.empty();
  }

  private Optional<JListToken> conjunction(Set<JListToken> requested, int next) {
    int current = columns.peek();
    if (current < next) {
      if (!requested.contains(JListToken.OPEN)) {
        logger.debug("Infix conjunction at column {} (list column {})", next, current);
        return Optional.empty();
      }
      if (!columns.push(next)) {
        throw new CapacityExceededError("Conjunction lists nested deeper than " + ColumnStack.CAPACITY, columns.toArray());
      }
      return emit(JListToken.OPEN, next);
    } else if (current == next) {
      require(requested, JListToken.CONTINUE, next);
      return emit(JListToken.CONTINUE, next);
    } else {
      require(requested, JListToken.CLOSE, next);
      columns.pop();
      return emit(JListToken.CLOSE, next);
    }
  }

  /**
   * A non-conjunction token at or before the list column ends the list; anything further right
   * continues the expression of the current item:
   * <pre>
   *   /\ IF e THEN P
   *           ELSE Q
   *   /\ R
   * </pre>
   */
  private Optional<JListToken> otherToken(Set<JListToken> requested, int next) {
    int current = columns.peek();
    if (next <= current) {
      require(requested, JListToken.CLOSE, next);
      columns.pop();
      return emit(JListToken.CLOSE, next);
    }
    // TODO: close lists on right delimiters opened before the list and on new unit definitions
    return Optional.empty();
  }

  private void require(Set<JListToken> requested, JListToken token, int column) {
    if (!requested.contains(token)) {
      throw new DesynchronizationError(token, column, columns.toArray());
    }
  }

  private Optional<JListToken> emit(JListToken token, int column) {
    logger.debug("{} at column {}, columns: {}", token, column, columns);
    return Optional.of(token);
  }

  @Override
  public String toString() {
    return "JListScanner" + columns;
  }
}
