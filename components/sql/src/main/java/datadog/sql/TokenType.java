package datadog.sql;

import javax.annotation.Nullable;

/**
 * The type of a {@link Token}. Implemented by the enums {@link Keyword}, {@link Operator}, {@link
 * LiteralValueTypeIndicator}, {@link Lexeme} and {@link Symbol}.
 */
public interface TokenType {
  /**
   * Gets the canonical text of tokens of this type.
   *
   * @return The fixed text, or {@code null} if the text only exists in the original buffer.
   */
  @Nullable
  String text();
}
