package datadog.sql;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Collections.unmodifiableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a SQL statement into {@link Token tokens} without parsing it. Lexing never fails: content
 * the lexer has no rule for becomes {@link Lexeme#UNKNOWN} tokens, and unterminated quotes or
 * comments run to the end of the statement.
 *
 * <p>The lexer walks the statement code point by code point, so slices never split a multi-byte
 * character, while slice offsets count the bytes of the UTF-8 encoding.
 */
public final class SqlLexer {
  private static final Logger log = LoggerFactory.getLogger(SqlLexer.class);

  private static final Map<String, TokenType> WORDS;
  private static final Map<String, Operator> SYMBOL_OPERATORS;

  static {
    Map<String, TokenType> words = new HashMap<>();
    for (Keyword keyword : Keyword.values()) {
      if (keyword != Keyword.OTHER) {
        words.put(keyword.text(), keyword);
      }
    }
    Map<String, Operator> symbolOperators = new HashMap<>();
    for (Operator operator : Operator.values()) {
      switch (operator.group()) {
        case LOGICAL:
          words.put(operator.text(), operator);
          break;
        case COMPARISON:
        case BITWISE:
        case JSON:
          symbolOperators.put(operator.text(), operator);
          break;
        default:
          // arithmetic operators are single characters dispatched directly
          break;
      }
    }
    for (LiteralValueTypeIndicator indicator :
        new LiteralValueTypeIndicator[] {
          LiteralValueTypeIndicator.BINARY,
          LiteralValueTypeIndicator.DATE,
          LiteralValueTypeIndicator.TIME,
          LiteralValueTypeIndicator.TIMESTAMP,
          LiteralValueTypeIndicator.X,
          LiteralValueTypeIndicator.B,
          LiteralValueTypeIndicator.N
        }) {
      words.put(indicator.text(), indicator);
    }
    words.put(Lexeme.NULL.text(), Lexeme.NULL);
    words.put(Lexeme.TRUE.text(), Lexeme.TRUE);
    words.put(Lexeme.FALSE.text(), Lexeme.FALSE);
    WORDS = unmodifiableMap(words);
    SYMBOL_OPERATORS = unmodifiableMap(symbolOperators);
  }

  private final String sql;
  private final byte[] buffer;
  private final int[] codePoints;
  /** Byte offset of each code point, with the buffer length as last element. */
  private final int[] offsets;

  private final int length;
  private final List<Token> tokens;
  private int position;
  private boolean pastSelect;

  private SqlLexer(String sql) {
    this.sql = sql;
    this.buffer = sql.getBytes(UTF_8);
    this.codePoints = sql.codePoints().toArray();
    this.length = this.codePoints.length;
    this.offsets = new int[this.length + 1];
    int offset = 0;
    for (int i = 0; i < this.length; i++) {
      this.offsets[i] = offset;
      offset += utf8Length(this.codePoints[i]);
    }
    this.offsets[this.length] = offset;
    this.tokens = new ArrayList<>(Math.max(16, this.length / 3));
    this.position = 0;
    this.pastSelect = false;
  }

  /**
   * Lexes a SQL statement.
   *
   * @param sql The SQL statement, any text is accepted.
   * @return The tokenized statement.
   */
  public static TokenizedSql lex(String sql) {
    if (sql == null) {
      throw new IllegalArgumentException("sql cannot be null");
    }
    return new SqlLexer(sql).lex();
  }

  private TokenizedSql lex() {
    while (this.position < this.length) {
      scanToken();
    }
    return new TokenizedSql(this.sql, this.buffer, this.tokens);
  }

  private void scanToken() {
    int c = this.codePoints[this.position];
    switch (c) {
      case '`':
        scanQuoted(Lexeme.BACKTICKED);
        break;
      case '\'':
        scanQuoted(Lexeme.SINGLE_QUOTED);
        break;
      case '"':
        scanQuoted(Lexeme.DOUBLE_QUOTED);
        break;
      case '#':
        if (peek(1) == '>') {
          scanOperator();
        } else {
          scanLineComment();
        }
        break;
      case '-':
        if (peek(1) == '-') {
          scanLineComment();
        } else if (isDigit(peek(1))) {
          scanNumber();
        } else {
          single(Operator.MINUS);
        }
        break;
      case '/':
        if (peek(1) == '*') {
          scanBlockComment();
        } else {
          single(Operator.DIVIDE);
        }
        break;
      case ' ':
        single(Symbol.SPACE);
        break;
      case '\n':
      case '\r':
        single(Symbol.NEWLINE);
        break;
      case '.':
        single(Symbol.DOT);
        break;
      case ',':
        single(Symbol.COMMA);
        break;
      case '(':
        single(Symbol.PARENTHESE_OPEN);
        break;
      case ')':
        single(Symbol.PARENTHESE_CLOSE);
        break;
      case '[':
        single(Symbol.SQUARE_BRACKET_OPEN);
        break;
      case ']':
        single(Symbol.SQUARE_BRACKET_CLOSE);
        break;
      case ':':
        single(Symbol.COLON);
        break;
      case ';':
        single(Symbol.SEMICOLON);
        break;
      case '?':
        single(Symbol.PLACEHOLDER);
        break;
      case '$':
        if (isDigit(peek(1))) {
          scanNumberedPlaceholder();
        } else {
          single(Lexeme.UNKNOWN);
        }
        break;
      case '*':
        single(this.pastSelect ? Symbol.WILDCARD : Operator.MULTIPLY);
        break;
      case '%':
        single(Operator.MODULO);
        break;
      case '+':
        single(Operator.PLUS);
        break;
      case '=':
      case '!':
      case '>':
      case '<':
      case '&':
      case '|':
        scanOperator();
        break;
      case '_':
        if (isLetterOrDigit(peek(1))) {
          scanCharset();
        } else {
          single(Lexeme.UNKNOWN);
        }
        break;
      default:
        if (Character.isAlphabetic(c)) {
          scanWord();
        } else if (isDigit(c)) {
          scanNumber();
        } else {
          single(Lexeme.UNKNOWN);
        }
        break;
    }
  }

  private void scanQuoted(Lexeme type) {
    int start = this.position;
    int delimiter = type.delimiter();
    int escapes = 0;
    this.position++;
    while (this.position < this.length) {
      int c = this.codePoints[this.position];
      if (c == delimiter && escapes % 2 == 0) {
        add(type, this.offsets[start] + 1, this.offsets[this.position]);
        this.position++;
        return;
      }
      escapes = c == '\\' ? escapes + 1 : 0;
      this.position++;
    }
    add(type, this.offsets[start] + 1, this.offsets[this.length]);
  }

  private void scanLineComment() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && !isNewline(this.codePoints[this.position])) {
      this.position++;
    }
    add(Lexeme.COMMENT, this.offsets[start], this.offsets[this.position]);
  }

  private void scanBlockComment() {
    int start = this.position;
    this.position += 2;
    // the closing */ must start after the opening /*
    while (this.position < this.length
        && !(this.position >= start + 4
            && this.codePoints[this.position - 2] == '*'
            && this.codePoints[this.position - 1] == '/')) {
      this.position++;
    }
    add(Lexeme.COMMENT, this.offsets[start], this.offsets[this.position]);
  }

  private void scanNumberedPlaceholder() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && isDigit(this.codePoints[this.position])) {
      this.position++;
    }
    add(Lexeme.NUMBERED_PLACEHOLDER, this.offsets[start], this.offsets[this.position]);
  }

  private void scanOperator() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && isOperatorPart(this.codePoints[this.position])) {
      this.position++;
    }
    String symbol = new String(this.codePoints, start, this.position - start);
    Operator operator = SYMBOL_OPERATORS.get(symbol);
    if (operator != null) {
      add(operator, this.offsets[start], this.offsets[this.position]);
      return;
    }
    log.debug("Unrecognized operator at byte offset {}, lexed as unknown", this.offsets[start]);
    for (int i = start; i < this.position; i++) {
      add(Lexeme.UNKNOWN, this.offsets[i], this.offsets[i + 1]);
    }
  }

  private void scanCharset() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && isLetterOrDigit(this.codePoints[this.position])) {
      this.position++;
    }
    add(LiteralValueTypeIndicator.CHARSET, this.offsets[start] + 1, this.offsets[this.position]);
  }

  private void scanWord() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && isWordPart(this.codePoints[this.position])) {
      this.position++;
    }
    TokenType type = lookupWord(new String(this.codePoints, start, this.position - start));
    if (type == Keyword.SELECT) {
      this.pastSelect = true;
    } else if (type == Keyword.FROM) {
      this.pastSelect = false;
    }
    add(type, this.offsets[start], this.offsets[this.position]);
  }

  private void scanNumber() {
    int start = this.position;
    this.position++;
    while (this.position < this.length && isNumberPart(this.codePoints[this.position])) {
      this.position++;
    }
    TokenType type = Lexeme.NUMERIC;
    if (this.position - start == 2 && this.codePoints[start] == '0') {
      int prefix = this.codePoints[start + 1];
      if (prefix == 'x' || prefix == 'X') {
        type = LiteralValueTypeIndicator.ZERO_X;
      } else if (prefix == 'b' || prefix == 'B') {
        type = LiteralValueTypeIndicator.ZERO_B;
      }
    }
    add(type, this.offsets[start], this.offsets[this.position]);
  }

  private void single(TokenType type) {
    add(type, this.offsets[this.position], this.offsets[this.position + 1]);
    this.position++;
  }

  private void add(TokenType type, int start, int end) {
    this.tokens.add(Token.of(type, start, end));
  }

  private int peek(int ahead) {
    int index = this.position + ahead;
    return index < this.length ? this.codePoints[index] : -1;
  }

  static TokenType lookupWord(String word) {
    for (int i = 0; i < word.length(); i++) {
      if (word.charAt(i) > 0x7F) {
        return Keyword.OTHER;
      }
    }
    TokenType type = WORDS.get(word.toUpperCase(Locale.ROOT));
    return type == null ? Keyword.OTHER : type;
  }

  private static int utf8Length(int codePoint) {
    if (codePoint < 0x80) {
      return 1;
    } else if (codePoint < 0x800) {
      return 2;
    } else if (codePoint <= 0xFFFF && Character.isSurrogate((char) codePoint)) {
      // unpaired surrogates are encoded as a single '?'
      return 1;
    } else if (codePoint < 0x10000) {
      return 3;
    }
    return 4;
  }

  /** Any numeric character, superscripts and vulgar fractions included. */
  private static boolean isDigit(int c) {
    if (c < 0) {
      return false;
    }
    switch (Character.getType(c)) {
      case Character.DECIMAL_DIGIT_NUMBER:
      case Character.LETTER_NUMBER:
      case Character.OTHER_NUMBER:
        return true;
      default:
        return false;
    }
  }

  private static boolean isLetterOrDigit(int c) {
    return c >= 0 && (Character.isAlphabetic(c) || isDigit(c));
  }

  private static boolean isNewline(int c) {
    return c == '\n' || c == '\r';
  }

  private static boolean isOperatorPart(int c) {
    return c == '=' || c == '!' || c == '>' || c == '<';
  }

  private static boolean isWordPart(int c) {
    return c == '_' || c == '-' || isLetterOrDigit(c);
  }

  private static boolean isNumberPart(int c) {
    return c == '.' || c == 'x' || c == 'X' || c == 'b' || c == 'B' || isDigit(c);
  }
}
