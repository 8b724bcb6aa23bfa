package datadog.sql;

/**
 * Punctuation and whitespace tokens, and the tokens only introduced by the {@link SqlSanitizer}:
 * {@link #ELLIPSIS} and the {@link #REMOVED} tombstone. {@link #PLACEHOLDER} is both lexed from
 * {@code ?} and introduced in place of sanitized literals.
 */
public enum Symbol implements TokenType {
  SPACE(" "),
  NEWLINE("\n"),
  DOT("."),
  COMMA(","),
  WILDCARD("*"),
  PARENTHESE_OPEN("("),
  PARENTHESE_CLOSE(")"),
  SQUARE_BRACKET_OPEN("["),
  SQUARE_BRACKET_CLOSE("]"),
  COLON(":"),
  SEMICOLON(";"),
  PLACEHOLDER("?"),
  ELLIPSIS("..."),
  /** Marks a deleted token. Renders nothing and keeps the positions of the other tokens. */
  REMOVED("");

  private final String text;

  Symbol(String text) {
    this.text = text;
  }

  @Override
  public String text() {
    return this.text;
  }
}
