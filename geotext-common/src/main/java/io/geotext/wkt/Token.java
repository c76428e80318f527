package io.geotext.wkt;

/**
 * A token read by {@link WKTTokenizer}
 */
public final class Token {
  public static final Token BEGIN = new Token(TokenType.BEGIN, "(", 0);
  public static final Token END = new Token(TokenType.END, ")", 0);
  public static final Token COMMA = new Token(TokenType.COMMA, ",", 0);
  public static final Token EOF = new Token(TokenType.EOF, "", 0);

  private final TokenType type;
  private final String text;
  private final double value;

  private Token(TokenType type, String text, double value) {
    this.type = type;
    this.text = text;
    this.value = value;
  }

  /**
   * Create a number token
   * @param text the text the number was parsed from
   * @param value the number
   * @return the token
   */
  public static Token number(String text, double value) {
    return new Token(TokenType.NUMBER, text, value);
  }

  /**
   * Create a word token
   * @param text the word
   * @return the token
   */
  public static Token word(String text) {
    return new Token(TokenType.WORD, text, 0);
  }

  /**
   * @return the token's type
   */
  public TokenType getType() {
    return type;
  }

  /**
   * @return the token's text as it appeared in the (lower-cased) input
   */
  public String getText() {
    return text;
  }

  /**
   * @return the numeric value of a {@link TokenType#NUMBER} token
   */
  public double getValue() {
    return value;
  }

  /**
   * Check if this token is the given word
   * @param word the word
   * @return true if the token is a {@link TokenType#WORD} with the given text
   */
  public boolean isWord(String word) {
    return type == TokenType.WORD && text.equals(word);
  }

  @Override
  public String toString() {
    switch (type) {
      case NUMBER:
        return text;
      case WORD:
        return "\"" + text + "\"";
      case EOF:
        return "end of input";
      default:
        return "'" + text + "'";
    }
  }
}
