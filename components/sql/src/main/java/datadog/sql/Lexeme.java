package datadog.sql;

import javax.annotation.Nullable;

/** Token types whose text is read from the original buffer, and the value keywords. */
public enum Lexeme implements TokenType {
  BACKTICKED('`'),
  DOUBLE_QUOTED('"'),
  SINGLE_QUOTED('\''),
  NUMERIC,
  COMMENT,
  NUMBERED_PLACEHOLDER,
  NULL("NULL"),
  TRUE("TRUE"),
  FALSE("FALSE"),
  /** A single character the lexer has no rule for. */
  UNKNOWN;

  private final char delimiter;
  private final String text;

  Lexeme() {
    this((char) 0, null);
  }

  Lexeme(char delimiter) {
    this(delimiter, null);
  }

  Lexeme(String text) {
    this((char) 0, text);
  }

  Lexeme(char delimiter, String text) {
    this.delimiter = delimiter;
    this.text = text;
  }

  /** @return {@code true} for quoted tokens, whose slice excludes the delimiters. */
  public boolean isQuoted() {
    return this.delimiter != 0;
  }

  /** @return The quote delimiter, {@code 0} if the type is not quoted. */
  public char delimiter() {
    return this.delimiter;
  }

  @Override
  @Nullable
  public String text() {
    return this.text;
  }
}
