package datadog.sql;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.io.ByteArrayOutputStream;
import javax.annotation.Nullable;

/**
 * Writes the tokens of a {@link TokenizedSql} back as text. Tokens read from the buffer are
 * written as they were read, so rendering a statement that was not sanitized gives back the
 * original statement.
 */
public final class SqlWriter {
  private static final int INITIAL_CAPACITY = 256;

  private final TokenizedSql sql;
  private final ByteArrayOutputStream outputStream;

  private SqlWriter(TokenizedSql sql) {
    this.sql = sql;
    this.outputStream =
        new ByteArrayOutputStream(Math.max(INITIAL_CAPACITY, sql.bufferLength()));
  }

  /**
   * Renders a tokenized statement.
   *
   * @param sql The tokenized statement.
   * @return The statement text.
   */
  public static String render(TokenizedSql sql) {
    if (sql == null) {
      throw new IllegalArgumentException("sql cannot be null");
    }
    SqlWriter writer = new SqlWriter(sql);
    for (Token token : sql.tokens()) {
      writer.write(token);
    }
    return writer.toString();
  }

  private void write(Token token) {
    TokenType type = token.type();
    BufferSlice slice = token.slice();
    if (type instanceof Lexeme) {
      writeLexeme((Lexeme) type, slice);
    } else if (type == LiteralValueTypeIndicator.CHARSET) {
      write('_');
      writeSlice(slice);
    } else if (slice != null) {
      // keywords and operators keep their original case
      writeSlice(slice);
    } else {
      writeText(type.text());
    }
  }

  private void writeLexeme(Lexeme type, @Nullable BufferSlice slice) {
    switch (type) {
      case BACKTICKED:
      case DOUBLE_QUOTED:
      case SINGLE_QUOTED:
        writeQuoted(type.delimiter(), slice);
        break;
      case NUMERIC:
      case COMMENT:
      case NUMBERED_PLACEHOLDER:
      case UNKNOWN:
        writeSlice(slice);
        break;
      case NULL:
      case TRUE:
      case FALSE:
        if (slice != null) {
          writeSlice(slice);
        } else {
          writeText(type.text());
        }
        break;
      default:
        throw new IllegalStateException("Unhandled token type " + type);
    }
  }

  private void writeQuoted(char delimiter, @Nullable BufferSlice slice) {
    write(delimiter);
    if (slice == null) {
      write(delimiter);
      return;
    }
    writeSlice(slice);
    // an unterminated quote runs up to the end of the buffer
    if (this.sql.byteAt(slice.end) == delimiter) {
      write(delimiter);
    }
  }

  private void writeSlice(@Nullable BufferSlice slice) {
    if (slice != null) {
      this.sql.writeTo(this.outputStream, slice);
    }
  }

  private void writeText(@Nullable String text) {
    if (text != null) {
      byte[] bytes = text.getBytes(UTF_8);
      this.outputStream.write(bytes, 0, bytes.length);
    }
  }

  private void write(char c) {
    this.outputStream.write(c);
  }

  @Override
  public String toString() {
    return new String(this.outputStream.toByteArray(), UTF_8);
  }
}
