package datadog.sql;

import javax.annotation.Nullable;

/**
 * Prefixes marking the next token as a literal even though no operator precedes it, like {@code
 * DATE '2020-01-01'}, {@code x'42'} or {@code _utf8'text'}.
 */
public enum LiteralValueTypeIndicator implements TokenType {
  BINARY("BINARY"),
  DATE("DATE"),
  TIME("TIME"),
  TIMESTAMP("TIMESTAMP"),
  X("X"),
  ZERO_X("0X"),
  B("B"),
  ZERO_B("0B"),
  N("N"),
  /** A charset introducer, its slice holds the charset name without the leading underscore. */
  CHARSET(null);

  private final String text;

  LiteralValueTypeIndicator(String text) {
    this.text = text;
  }

  @Override
  @Nullable
  public String text() {
    return this.text;
  }
}
