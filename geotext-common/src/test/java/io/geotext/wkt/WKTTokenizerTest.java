package io.geotext.wkt;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

/**
 * Test {@link WKTTokenizer}
 */
public class WKTTokenizerTest {
  private static List<Token> tokenize(String str) throws WKTParseException {
    WKTTokenizer tokenizer = new WKTTokenizer(str);
    List<Token> result = new ArrayList<>();
    Token t;
    do {
      t = tokenizer.next();
      result.add(t);
    } while (t.getType() != TokenType.EOF);
    return result;
  }

  /**
   * Tokenize a simple geometry
   * @throws Exception if something goes wrong
   */
  @Test
  public void simple() throws Exception {
    List<Token> tokens = tokenize("point z (1 -2.5e3\t+.5)");
    assertEquals(8, tokens.size());
    assertEquals("point", tokens.get(0).getText());
    assertEquals(TokenType.WORD, tokens.get(1).getType());
    assertEquals("z", tokens.get(1).getText());
    assertSame(Token.BEGIN, tokens.get(2));
    assertEquals(1.0, tokens.get(3).getValue(), 0.0);
    assertEquals(-2500.0, tokens.get(4).getValue(), 0.0);
    assertEquals(0.5, tokens.get(5).getValue(), 0.0);
    assertSame(Token.END, tokens.get(6));
    assertSame(Token.EOF, tokens.get(7));
  }

  /**
   * Brackets and parentheses are interchangeable and punctuation does not
   * need whitespace around it
   * @throws Exception if something goes wrong
   */
  @Test
  public void punctuation() throws Exception {
    List<Token> tokens = tokenize("[1,2](3.)");
    assertSame(Token.BEGIN, tokens.get(0));
    assertEquals(TokenType.NUMBER, tokens.get(1).getType());
    assertSame(Token.COMMA, tokens.get(2));
    assertEquals(TokenType.NUMBER, tokens.get(3).getType());
    assertSame(Token.END, tokens.get(4));
    assertSame(Token.BEGIN, tokens.get(5));
    assertEquals(3.0, tokens.get(6).getValue(), 0.0);
    assertSame(Token.END, tokens.get(7));
    assertSame(Token.EOF, tokens.get(8));
  }

  /**
   * The end of the input is reported repeatedly
   * @throws Exception if something goes wrong
   */
  @Test
  public void endOfInput() throws Exception {
    WKTTokenizer tokenizer = new WKTTokenizer("   ");
    assertSame(Token.EOF, tokenizer.next());
    assertSame(Token.EOF, tokenizer.next());
  }

  /**
   * Sequences that are neither numbers nor words are rejected
   */
  @Test
  public void badTokens() {
    for (String str : new String[] { "2a", "1.2.3", "e5", "srid=4326;point", "x_y", "-" }) {
      try {
        tokenize(str);
        fail("Expected " + str + " to be rejected");
      } catch (WKTParseException e) {
        assertEquals("Bad token: \"" + str + "\"", e.getMessage());
      }
    }
  }

  /**
   * Check how tokens are presented in error messages
   */
  @Test
  public void tokenToString() {
    assertEquals("\"foo\"", Token.word("foo").toString());
    assertEquals("1.5", Token.number("1.5", 1.5).toString());
    assertEquals("')'", Token.END.toString());
    assertEquals("end of input", Token.EOF.toString());
  }
}
