package datadog.sql;

import javax.annotation.Nullable;

/**
 * Keywords recognized by the {@link SqlLexer}. Every other alphabetic word, function and table
 * names included, is lexed as {@link #OTHER}.
 */
public enum Keyword implements TokenType {
  SELECT("SELECT"),
  FROM("FROM"),
  WHERE("WHERE"),
  AND("AND"),
  OR("OR"),
  UPDATE("UPDATE"),
  SET("SET"),
  INSERT("INSERT"),
  INTO("INTO"),
  VALUES("VALUES"),
  INNER("INNER"),
  JOIN("JOIN"),
  ON("ON"),
  LIMIT("LIMIT"),
  OFFSET("OFFSET"),
  BETWEEN("BETWEEN"),
  ARRAY("ARRAY"),
  OTHER(null);

  private final String text;

  Keyword(String text) {
    this.text = text;
  }

  @Override
  @Nullable
  public String text() {
    return this.text;
  }
}
