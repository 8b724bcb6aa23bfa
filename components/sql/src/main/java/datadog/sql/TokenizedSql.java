package datadog.sql;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A SQL statement split into tokens. The UTF-8 buffer of the statement is never modified, only the
 * tokens are: the {@link SqlSanitizer} replaces them in place and never changes their order.
 */
public final class TokenizedSql {
  private final String sql;
  private final byte[] buffer;
  private final List<Token> tokens;

  TokenizedSql(String sql, byte[] buffer, List<Token> tokens) {
    this.sql = sql;
    this.buffer = buffer;
    this.tokens = new ArrayList<>(tokens);
  }

  /** @return The original SQL statement. */
  public String sql() {
    return this.sql;
  }

  /** @return The read-only view of the tokens, tombstones included. */
  public List<Token> tokens() {
    return Collections.unmodifiableList(this.tokens);
  }

  /** @return The size of the UTF-8 buffer in bytes. */
  public int bufferLength() {
    return this.buffer.length;
  }

  /**
   * Gets the text of the buffer covered by a slice.
   *
   * @param slice The slice to look up.
   * @return The text, or an empty string if the slice is {@code null}, inverted or out of bounds.
   */
  public String content(BufferSlice slice) {
    if (slice == null || !slice.isWithin(this.buffer.length)) {
      return "";
    }
    return new String(this.buffer, slice.start, slice.length(), UTF_8);
  }

  /**
   * Gets the text of the buffer a token was read from.
   *
   * @param token The token to look up.
   * @return The text, empty for synthetic tokens.
   */
  public String content(Token token) {
    return content(token.slice());
  }

  int size() {
    return this.tokens.size();
  }

  Token get(int index) {
    return this.tokens.get(index);
  }

  void replace(int index, Token token) {
    this.tokens.set(index, token);
  }

  void remove(int index) {
    this.tokens.set(index, Token.REMOVED);
  }

  /** Gets the byte at a position, {@code -1} when out of bounds. */
  int byteAt(int position) {
    return position >= 0 && position < this.buffer.length ? this.buffer[position] & 0xFF : -1;
  }

  void writeTo(ByteArrayOutputStream out, BufferSlice slice) {
    if (slice.isWithin(this.buffer.length)) {
      out.write(this.buffer, slice.start, slice.length());
    }
  }

  @Override
  public String toString() {
    return "TokenizedSql{tokens=" + this.tokens + '}';
  }
}
