package com.onkiup.jlist.lexer;

import java.util.Objects;

public class SourceLocation {

  private final String name;
  private final int position, line, column;

  public SourceLocation(String name, int position, int line, int column) {
    if (position < 0) {
      throw new IllegalArgumentException("Position cannot be negative");
    }
    if (line < 0) {
      throw new IllegalArgumentException("Line cannot be negative");
    }
    if (column < 0) {
      throw new IllegalArgumentException("Column cannot be negative");
    }
    this.name = name;
    this.position = position;
    this.line = line;
    this.column = column;
  }

  public String name() {
    return name;
  }

  public int position() {
    return position;
  }

  public int line() {
    return line;
  }

  public int column() {
    return column;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof SourceLocation)) {
      return false;
    }
    SourceLocation that = (SourceLocation) other;
    return position == that.position && line == that.line && column == that.column
        && Objects.equals(name, that.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, position, line, column);
  }

  @Override
  public String toString() {
    return new StringBuilder()
      .append(name)
      .append(" - ")
      .append(line)
      .append(':')
      .append(column)
      .toString();
  }
}
