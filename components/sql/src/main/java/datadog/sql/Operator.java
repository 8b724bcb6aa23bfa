package datadog.sql;

/** Operators recognized by the {@link SqlLexer}, partitioned in {@link Group groups}. */
public enum Operator implements TokenType {
  // Arithmetic
  MULTIPLY(Group.ARITHMETIC, "*"),
  DIVIDE(Group.ARITHMETIC, "/"),
  MODULO(Group.ARITHMETIC, "%"),
  PLUS(Group.ARITHMETIC, "+"),
  MINUS(Group.ARITHMETIC, "-"),
  // Logical
  IN(Group.LOGICAL, "IN"),
  NOT(Group.LOGICAL, "NOT"),
  LIKE(Group.LOGICAL, "LIKE"),
  ILIKE(Group.LOGICAL, "ILIKE"),
  RLIKE(Group.LOGICAL, "RLIKE"),
  GLOB(Group.LOGICAL, "GLOB"),
  MATCH(Group.LOGICAL, "MATCH"),
  REGEXP(Group.LOGICAL, "REGEXP"),
  THEN(Group.LOGICAL, "THEN"),
  ELSE(Group.LOGICAL, "ELSE"),
  // Comparison
  EQUAL(Group.COMPARISON, "="),
  EQUAL_2(Group.COMPARISON, "=="),
  NULL_SAFE_EQUAL(Group.COMPARISON, "<=>"),
  GREATER_THAN_OR_EQUAL(Group.COMPARISON, ">="),
  LESS_THAN_OR_EQUAL(Group.COMPARISON, "<="),
  EQUAL_OR_GREATER_THAN(Group.COMPARISON, "=>"),
  EQUAL_OR_LESS_THAN(Group.COMPARISON, "=<"),
  EQUAL_WITH_ARROWS(Group.COMPARISON, "<>"),
  NOT_EQUAL(Group.COMPARISON, "!="),
  GREATER_THAN(Group.COMPARISON, ">"),
  LESS_THAN(Group.COMPARISON, "<"),
  // Bitwise
  LEFT_SHIFT(Group.BITWISE, "<<"),
  RIGHT_SHIFT(Group.BITWISE, ">>"),
  BITWISE_AND(Group.BITWISE, "&"),
  BITWISE_OR(Group.BITWISE, "|"),
  // JSON path
  SPECIFIED_PATH(Group.JSON, "#>"),
  SPECIFIED_PATH_AS_TEXT(Group.JSON, "#>>");

  public enum Group {
    ARITHMETIC,
    LOGICAL,
    COMPARISON,
    BITWISE,
    JSON
  }

  private final Group group;
  private final String text;

  Operator(Group group, String text) {
    this.group = group;
    this.text = text;
  }

  public Group group() {
    return this.group;
  }

  @Override
  public String text() {
    return this.text;
  }
}
