package io.geotext.wkt;

/**
 * Kinds of tokens produced by {@link WKTTokenizer}
 */
public enum TokenType {
  NUMBER("Number"),
  WORD("Word"),
  BEGIN("'('"),
  END("')'"),
  COMMA("','"),
  EOF("End of input");

  private final String description;

  TokenType(String description) {
    this.description = description;
  }

  /**
   * @return a human-readable description used in error messages
   */
  public String getDescription() {
    return description;
  }
}
