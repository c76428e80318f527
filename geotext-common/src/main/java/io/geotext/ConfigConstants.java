package io.geotext;

/**
 * Configuration constants
 */
@SuppressWarnings("javadoc")
public final class ConfigConstants {
  public static final String WKT_SUPPORT_EWKT = "geotext.wkt.supportEwkt";
  public static final String WKT_SUPPORT_WKT12 = "geotext.wkt.supportWkt12";
  public static final String WKT_STRICT_WKT11 = "geotext.wkt.strictWkt11";
  public static final String WKT_IGNORE_EXTRA_TOKENS = "geotext.wkt.ignoreExtraTokens";

  public static final String JTS_SUPPORT_Z = "geotext.jts.supportZ";
  public static final String JTS_SUPPORT_M = "geotext.jts.supportM";

  public static final boolean DEFAULT_WKT_SUPPORT_EWKT = false;
  public static final boolean DEFAULT_WKT_SUPPORT_WKT12 = false;
  public static final boolean DEFAULT_WKT_STRICT_WKT11 = false;
  public static final boolean DEFAULT_WKT_IGNORE_EXTRA_TOKENS = false;

  public static final boolean DEFAULT_JTS_SUPPORT_Z = true;
  public static final boolean DEFAULT_JTS_SUPPORT_M = true;

  private ConfigConstants() {
    // hidden constructor
  }
}
