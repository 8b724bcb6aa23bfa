package datadog.sql;

import javax.annotation.Nullable;

/**
 * A token of a {@link TokenizedSql}. Tokens read by the {@link SqlLexer} reference the part of the
 * original buffer they were read from; tokens introduced by the {@link SqlSanitizer} have no slice.
 */
public final class Token {
  static final Token PLACEHOLDER = new Token(Symbol.PLACEHOLDER, null);
  static final Token ELLIPSIS = new Token(Symbol.ELLIPSIS, null);
  static final Token REMOVED = new Token(Symbol.REMOVED, null);

  private final TokenType type;
  @Nullable private final BufferSlice slice;

  Token(TokenType type, @Nullable BufferSlice slice) {
    if (type == null) {
      throw new IllegalArgumentException("type cannot be null");
    }
    this.type = type;
    this.slice = slice;
  }

  /**
   * Creates a token read from a buffer.
   *
   * @param type The token type.
   * @param start The first byte of the token.
   * @param end The byte after the token.
   * @return The token.
   */
  public static Token of(TokenType type, int start, int end) {
    return new Token(type, new BufferSlice(start, end));
  }

  /**
   * Creates a token without slice.
   *
   * @param type The token type.
   * @return The token.
   */
  public static Token synthetic(TokenType type) {
    return new Token(type, null);
  }

  public TokenType type() {
    return this.type;
  }

  /** @return The slice of the buffer the token was read from, {@code null} for synthetic tokens. */
  @Nullable
  public BufferSlice slice() {
    return this.slice;
  }

  public boolean is(TokenType type) {
    return this.type == type;
  }

  public boolean isRemoved() {
    return this.type == Symbol.REMOVED;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Token)) {
      return false;
    }
    Token that = (Token) o;
    return this.type == that.type
        && (this.slice == null ? that.slice == null : this.slice.equals(that.slice));
  }

  @Override
  public int hashCode() {
    return 31 * this.type.hashCode() + (this.slice == null ? 0 : this.slice.hashCode());
  }

  @Override
  public String toString() {
    return this.slice == null ? String.valueOf(this.type) : this.type + this.slice.toString();
  }
}
