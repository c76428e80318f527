package io.geotext.wkt;

import java.util.regex.Pattern;

/**
 * <p>Splits a lower-cased WKT string into tokens. The tokenizer only ever
 * looks at the next token, there is no backtracking.</p>
 * <p>Brackets and parentheses are interchangeable. Everything between
 * whitespace and punctuation is classified as a number first and as a word
 * second. Anything else is a bad token.</p>
 */
public class WKTTokenizer {
  private static final Pattern NUMBER = Pattern.compile(
      "[-+]?(\\d+(\\.\\d*)?|\\.\\d+)(e[-+]?\\d+)?");

  private final String input;
  private int pos;

  /**
   * Create a tokenizer
   * @param input the lower-cased string to tokenize
   */
  public WKTTokenizer(String input) {
    this.input = input;
  }

  /**
   * Read the next token
   * @return the token or {@link Token#EOF} if there is no more input
   * @throws WKTParseException if the input contains a character sequence
   * that is neither a number, nor a word, nor punctuation
   */
  public Token next() throws WKTParseException {
    int len = input.length();
    while (pos < len && Character.isWhitespace(input.charAt(pos))) {
      ++pos;
    }
    if (pos == len) {
      return Token.EOF;
    }

    char c = input.charAt(pos);
    switch (c) {
      case '(':
      case '[':
        ++pos;
        return Token.BEGIN;
      case ')':
      case ']':
        ++pos;
        return Token.END;
      case ',':
        ++pos;
        return Token.COMMA;
      default:
        break;
    }

    int start = pos;
    while (pos < len && !isDelimiter(input.charAt(pos))) {
      ++pos;
    }
    String text = input.substring(start, pos);

    if (NUMBER.matcher(text).matches()) {
      return Token.number(text, Double.parseDouble(text));
    }
    if (isWord(text)) {
      return Token.word(text);
    }
    throw new WKTParseException("Bad token: \"" + text + "\"");
  }

  private static boolean isDelimiter(char c) {
    return Character.isWhitespace(c) || c == '(' || c == ')' ||
        c == '[' || c == ']' || c == ',';
  }

  private static boolean isWord(String text) {
    for (int i = 0; i < text.length(); ++i) {
      char c = text.charAt(i);
      if (c < 'a' || c > 'z') {
        return false;
      }
    }
    return true;
  }
}
