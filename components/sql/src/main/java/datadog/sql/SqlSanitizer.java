package datadog.sql;

/**
 * Replaces the literal values of a tokenized SQL statement by placeholders, so the statement can be
 * recorded without leaking the data it holds.
 *
 * <p>The sanitizer makes a single pass over the tokens, inferring from a single {@link State} what
 * the current token stands for. It never builds a syntax tree: a literal is only replaced when the
 * state tells it is a value, like after an operator, inside a function call or a {@code VALUES}
 * row. Tokens are replaced in place or marked {@link Symbol#REMOVED removed}, so positions never
 * shift during the pass.
 *
 * <pre>
 *   SELECT * FROM t WHERE id IN (1, 2, 3)        -&gt; SELECT * FROM t WHERE id IN (?)
 *   INSERT INTO t (a) VALUES ('x'), ('y'), ('z') -&gt; INSERT INTO t (a) VALUES (?), ...
 * </pre>
 */
public final class SqlSanitizer {
  enum State {
    DEFAULT,
    AFTER_OPERATOR,
    SCOPE_OPENED,
    INSERT_VALUES,
    INSERT_ROW_CLOSED,
    JOIN_ON_CLAUSE,
    OFFSET_CLAUSE,
    BETWEEN_CLAUSE,
    GENERIC_KEYWORD_SCOPE,
    GENERIC_KEYWORD_SCOPE_OPENED,
    ARRAY_CLAUSE,
    ARRAY_SCOPE_OPENED,
    LITERAL_TYPE_INDICATOR
  }

  private final TokenizedSql sql;
  /** Position of the closing parenthese of the last collapsed row, -1 before any. */
  private int lastCollapsedRow;

  private SqlSanitizer(TokenizedSql sql) {
    this.sql = sql;
    this.lastCollapsedRow = -1;
  }

  /**
   * Sanitizes the tokens of a SQL statement in place.
   *
   * @param sql The tokenized statement.
   * @return The same statement, with its literals replaced.
   */
  public static TokenizedSql sanitize(TokenizedSql sql) {
    if (sql == null) {
      throw new IllegalArgumentException("sql cannot be null");
    }
    new SqlSanitizer(sql).sanitize();
    return sql;
  }

  /**
   * Lexes, sanitizes and renders a SQL statement.
   *
   * @param sql The SQL statement.
   * @return The sanitized statement.
   */
  public static String sanitizeText(String sql) {
    return SqlWriter.render(sanitize(SqlLexer.lex(sql)));
  }

  private void sanitize() {
    State state = State.DEFAULT;
    for (int position = 0; position < this.sql.size(); position++) {
      TokenType type = this.sql.get(position).type();
      if (isSensitiveLiteral(type)) {
        position = sanitizeLiteral(position, state);
      } else if (type == Lexeme.COMMENT) {
        removeComment(position);
      } else if (type == Symbol.PARENTHESE_OPEN && state == State.INSERT_ROW_CLOSED) {
        // the next row starts, it is consumed up to its closing parenthese
        position = collapseRow(position);
        continue;
      }
      state = transition(state, type);
    }
  }

  /**
   * Computes the state following a token. Sensitive literals, comments and whitespace never change
   * the state.
   */
  static State transition(State state, TokenType type) {
    if (type instanceof Operator) {
      return state == State.JOIN_ON_CLAUSE ? fallback(state) : State.AFTER_OPERATOR;
    }
    if (type instanceof Keyword) {
      return keywordTransition(state, (Keyword) type);
    }
    if (type instanceof LiteralValueTypeIndicator) {
      return State.LITERAL_TYPE_INDICATOR;
    }
    if (type == Symbol.PARENTHESE_OPEN) {
      switch (state) {
        case AFTER_OPERATOR:
          return State.SCOPE_OPENED;
        case GENERIC_KEYWORD_SCOPE:
          return State.GENERIC_KEYWORD_SCOPE_OPENED;
        case INSERT_VALUES:
        case INSERT_ROW_CLOSED:
          return State.INSERT_VALUES;
        default:
          return fallback(state);
      }
    }
    if (type == Symbol.SQUARE_BRACKET_OPEN && state == State.ARRAY_CLAUSE) {
      return State.ARRAY_SCOPE_OPENED;
    }
    if (type == Symbol.PARENTHESE_CLOSE && state == State.INSERT_VALUES) {
      return State.INSERT_ROW_CLOSED;
    }
    if (type == Symbol.COMMA && state == State.INSERT_ROW_CLOSED) {
      return state;
    }
    if (type == Symbol.PARENTHESE_CLOSE || type == Symbol.SQUARE_BRACKET_CLOSE) {
      return State.DEFAULT;
    }
    if (type == Symbol.DOT && state == State.JOIN_ON_CLAUSE) {
      return state;
    }
    if (isSensitiveLiteral(type) || isTransparent(type)) {
      return state;
    }
    return fallback(state);
  }

  private static State keywordTransition(State state, Keyword keyword) {
    switch (keyword) {
      case VALUES:
        return State.INSERT_VALUES;
      case ON:
        return State.JOIN_ON_CLAUSE;
      case OFFSET:
        return State.OFFSET_CLAUSE;
      case BETWEEN:
        return State.BETWEEN_CLAUSE;
      case ARRAY:
        return State.ARRAY_CLAUSE;
      case AND:
        if (state == State.BETWEEN_CLAUSE) {
          return state;
        }
        if (state == State.GENERIC_KEYWORD_SCOPE) {
          return State.GENERIC_KEYWORD_SCOPE_OPENED;
        }
        break;
      case OR:
        if (state == State.GENERIC_KEYWORD_SCOPE) {
          return State.GENERIC_KEYWORD_SCOPE_OPENED;
        }
        break;
      case INSERT:
      case INTO:
        return state;
      default:
        break;
    }
    // any other word, function names included, may open an expression scope
    return state == State.GENERIC_KEYWORD_SCOPE_OPENED
        ? State.GENERIC_KEYWORD_SCOPE_OPENED
        : State.GENERIC_KEYWORD_SCOPE;
  }

  /** Column lists and function arguments keep their scope until closed. */
  private static State fallback(State state) {
    return state == State.INSERT_VALUES || state == State.GENERIC_KEYWORD_SCOPE_OPENED
        ? state
        : State.DEFAULT;
  }

  static boolean isSensitiveLiteral(TokenType type) {
    return type == Lexeme.SINGLE_QUOTED
        || type == Lexeme.DOUBLE_QUOTED
        || type == Lexeme.NUMERIC
        || type == Lexeme.NULL
        || type == Lexeme.TRUE
        || type == Lexeme.FALSE;
  }

  private static boolean isTransparent(TokenType type) {
    return type == Symbol.SPACE
        || type == Symbol.NEWLINE
        || type == Symbol.REMOVED
        || type == Lexeme.COMMENT;
  }

  private int sanitizeLiteral(int position, State state) {
    switch (state) {
      case AFTER_OPERATOR:
      case INSERT_VALUES:
      case OFFSET_CLAUSE:
      case GENERIC_KEYWORD_SCOPE_OPENED:
      case BETWEEN_CLAUSE:
      case LITERAL_TYPE_INDICATOR:
        if (!isQualifiedIdentifierPart(position)) {
          this.sql.replace(position, Token.PLACEHOLDER);
        }
        return position;
      case SCOPE_OPENED:
      case ARRAY_SCOPE_OPENED:
        return collapseScope(position);
      default:
        return position;
    }
  }

  /** Double quoted words around a dot, like {@code "table"."column"}, are identifiers. */
  private boolean isQualifiedIdentifierPart(int position) {
    if (!this.sql.get(position).is(Lexeme.DOUBLE_QUOTED)) {
      return false;
    }
    int previous = previousToken(position);
    return (previous >= 0 && this.sql.get(previous).is(Symbol.DOT))
        || (position + 1 < this.sql.size() && this.sql.get(position + 1).is(Symbol.DOT));
  }

  /**
   * Replaces the content of a list, from its first literal up to its closing bracket, by a single
   * placeholder.
   *
   * @return The position of the last replaced token.
   */
  private int collapseScope(int start) {
    int end = findClosingBracket(start);
    this.sql.replace(start, Token.PLACEHOLDER);
    for (int i = start + 1; i < end; i++) {
      this.sql.remove(i);
    }
    return end - 1;
  }

  /**
   * Replaces a row of a multi-row {@code VALUES} clause by an ellipsis. Rows following an ellipsis
   * are removed with their separator, so all the rows after the first render as a single {@code
   * ...}.
   *
   * @param start The position of the opening parenthese of the row.
   * @return The position of the closing parenthese of the row.
   */
  private int collapseRow(int start) {
    int end = Math.min(findClosingBracket(start + 1), this.sql.size() - 1);
    int first;
    if (followsCollapsedRow(start)) {
      // only the separators since the last collapsed row are left to remove
      first = this.lastCollapsedRow + 1;
    } else {
      this.sql.replace(start, Token.ELLIPSIS);
      first = start + 1;
    }
    for (int i = first; i <= end; i++) {
      this.sql.remove(i);
    }
    this.lastCollapsedRow = end;
    return end;
  }

  /** Checks whether only row separators lie between the last collapsed row and a position. */
  private boolean followsCollapsedRow(int start) {
    if (this.lastCollapsedRow < 0) {
      return false;
    }
    for (int i = start - 1; i > this.lastCollapsedRow; i--) {
      if (!isRowSeparator(this.sql.get(i).type())) {
        return false;
      }
    }
    return true;
  }

  private static boolean isRowSeparator(TokenType type) {
    return type == Symbol.COMMA
        || type == Symbol.SPACE
        || type == Symbol.NEWLINE
        || type == Symbol.REMOVED;
  }

  private void removeComment(int position) {
    this.sql.remove(position);
    int previous = previousToken(position);
    if (previous >= 0 && this.sql.get(previous).is(Symbol.SPACE)) {
      this.sql.remove(previous);
    }
  }

  /**
   * Finds the bracket closing the scope a position is in, skipping nested brackets.
   *
   * @return The position of the closing bracket, or the number of tokens if there is none.
   */
  private int findClosingBracket(int from) {
    int depth = 0;
    for (int i = from; i < this.sql.size(); i++) {
      TokenType type = this.sql.get(i).type();
      if (type == Symbol.PARENTHESE_OPEN || type == Symbol.SQUARE_BRACKET_OPEN) {
        depth++;
      } else if (type == Symbol.PARENTHESE_CLOSE || type == Symbol.SQUARE_BRACKET_CLOSE) {
        if (depth == 0) {
          return i;
        }
        depth--;
      }
    }
    return this.sql.size();
  }

  /** @return The position of the closest token before a position that was not removed, or -1. */
  private int previousToken(int position) {
    int previous = position - 1;
    while (previous >= 0 && this.sql.get(previous).isRemoved()) {
      previous--;
    }
    return previous;
  }
}
