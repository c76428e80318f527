package io.geotext.wkt;

/**
 * An exception that will be thrown if a WKT string could not be parsed
 */
public class WKTParseException extends Exception {
  private static final long serialVersionUID = 4207391785113349710L;

  /**
   * Create a new exception
   * @param message the error message
   */
  public WKTParseException(String message) {
    super(message);
  }

  /**
   * Create a new exception
   * @param message the error message
   * @param cause the exception that caused this one
   */
  public WKTParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
