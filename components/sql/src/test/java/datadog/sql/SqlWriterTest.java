package datadog.sql;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.Arrays.asList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SqlWriterTest {
  @ParameterizedTest
  @ValueSource(
      strings = {
        "",
        " ",
        "\n\r\n",
        "SELECT * FROM `table` WHERE `id` = 'secret' AND `other` = 'something';",
        "select \"t\".* from \"t\" where \"id\" = 18.0 and x in (1, 2, 3)",
        "INSERT INTO t (a, b) VALUES (1, 'a'),\n(2, 'b');",
        "SELECT 1 -- trailing comment",
        "SELECT /* block */ 1 # pound",
        "WHERE a = 'unterminated",
        "WHERE a = \"unterminated",
        "WHERE a = `unterminated",
        "WHERE a = 'it\\'s' AND b = 'ends with backslash\\\\'",
        "SELECT '日本', \"tæble\", '😀' FROM ø",
        "a ~ # b",
        "a !!= b <=> c << d #>> e",
        "x'1F' 0xFF 0b'1' _utf8'abc' N'n' DATE '2020-01-01'",
        "SELECT $1, ?, NULL, true, False",
        "_ $ ` ' \"",
        "''",
        "SELECT a.b:c[1] FROM t;"
      })
  void testRoundTrip(String text) {
    assertEquals(text, SqlWriter.render(SqlLexer.lex(text)));
  }

  @Test
  void testSyntheticTokens() {
    List<Token> tokens =
        asList(
            Token.synthetic(Keyword.SELECT),
            Token.synthetic(Symbol.SPACE),
            Token.synthetic(Symbol.PLACEHOLDER),
            Token.synthetic(Symbol.COMMA),
            Token.synthetic(Symbol.ELLIPSIS),
            Token.synthetic(Symbol.REMOVED),
            Token.synthetic(Symbol.SPACE),
            Token.synthetic(Operator.NULL_SAFE_EQUAL),
            Token.synthetic(Symbol.SPACE),
            Token.synthetic(Lexeme.SINGLE_QUOTED),
            Token.synthetic(Symbol.SPACE),
            Token.synthetic(Lexeme.NULL),
            Token.synthetic(Symbol.SEMICOLON));

    assertEquals("SELECT ?,... <=> '' NULL;", render("", tokens));
  }

  @Test
  void testReplacedTokens() {
    TokenizedSql sql = SqlLexer.lex("WHERE a = 'secret'");
    sql.replace(6, Token.PLACEHOLDER);
    sql.remove(5);

    assertEquals("WHERE a =?", SqlWriter.render(sql));
  }

  @Test
  void testSlicesOutOfBoundsAreSkipped() {
    List<Token> tokens =
        asList(
            Token.of(Keyword.OTHER, 0, 3),
            Token.of(Keyword.OTHER, 2, 1),
            Token.of(Lexeme.NUMERIC, 3, 99));

    assertEquals("abc", render("abcd", tokens));
  }

  @Test
  void testEveryTokenTypeRenders() {
    List<TokenType> types = new ArrayList<>();
    types.addAll(asList(Keyword.values()));
    types.addAll(asList(Operator.values()));
    types.addAll(asList(LiteralValueTypeIndicator.values()));
    types.addAll(asList(Lexeme.values()));
    types.addAll(asList(Symbol.values()));
    for (TokenType type : types) {
      List<Token> tokens = asList(Token.synthetic(type), Token.of(type, 0, 1));
      String expected = type.text() == null ? "" : type.text();
      String rendered = render("a", tokens);
      if (type instanceof Lexeme && ((Lexeme) type).isQuoted()) {
        char delimiter = ((Lexeme) type).delimiter();
        assertEquals("" + delimiter + delimiter + delimiter + "a", rendered, type.toString());
      } else if (type == LiteralValueTypeIndicator.CHARSET) {
        assertEquals("__a", rendered);
      } else {
        assertEquals(expected + "a", rendered, type.toString());
      }
    }
  }

  @Test
  void testNull() {
    assertThrows(IllegalArgumentException.class, () -> SqlWriter.render(null));
  }

  private static String render(String text, List<Token> tokens) {
    return SqlWriter.render(new TokenizedSql(text, text.getBytes(UTF_8), tokens));
  }
}
