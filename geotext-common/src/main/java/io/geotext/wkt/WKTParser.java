package io.geotext.wkt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import io.geotext.ConfigConstants;
import io.geotext.geom.FactoryCapabilities;
import io.geotext.geom.FactoryGenerator;
import io.geotext.geom.GeometryFactory;
import io.vertx.core.json.JsonObject;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * <p>Parses geometries from Well-Known Text (WKT). The parser optionally
 * understands PostGIS EWKT extensions (an <code>SRID=...;</code> prefix and
 * type tags with an appended <code>M</code> such as <code>POINTM</code>)
 * and SFS 1.2 extensions (a separate <code>Z</code>, <code>M</code> or
 * <code>ZM</code> token after the type tag).</p>
 * <p>The dimensionality of the coordinates is fixed for a whole parse. It
 * is either declared by the first type tag carrying a dimension marker or
 * inferred from the number of values in the first coordinate tuple. In the
 * latter case a single extra value is always treated as Z.</p>
 * <p>Geometries are created by a {@link GeometryFactory}. If a
 * {@link FactoryGenerator} is configured, it is asked for a factory once
 * per parse as soon as one is needed. Otherwise the default factory is
 * used.</p>
 * <p>The parser keeps no state between calls to {@link #parse(String)}, so
 * an instance may be reused and shared between threads as long as its
 * configuration is not modified concurrently.</p>
 * @param <G> the type of the geometries created
 */
public class WKTParser<G> {
  private static final Logger log = LoggerFactory.getLogger(WKTParser.class);

  private static final Pattern SRID_PREFIX = Pattern.compile("srid=(\\d+);");
  private static final Pattern DIMENSION_MARKER = Pattern.compile("z?m?");

  private GeometryFactory<G> defaultFactory;
  private FactoryGenerator<G> factoryGenerator;
  private boolean supportEwkt;
  private boolean supportWkt12;
  private boolean strictWkt11;
  private boolean ignoreExtraTokens;

  /**
   * Create a parser for plain WKT
   * @param defaultFactory the factory used to create geometries if there
   * is no factory generator
   */
  public WKTParser(GeometryFactory<G> defaultFactory) {
    setDefaultFactory(defaultFactory);
  }

  /**
   * Create a parser configured by the given object. See
   * {@link ConfigConstants} for the recognized keys.
   * @param <G> the type of the geometries created
   * @param defaultFactory the factory used to create geometries if there
   * is no factory generator
   * @param config the configuration
   * @return the parser
   */
  public static <G> WKTParser<G> fromConfig(GeometryFactory<G> defaultFactory,
      JsonObject config) {
    WKTParser<G> parser = new WKTParser<>(defaultFactory);
    parser.setSupportEwkt(config.getBoolean(ConfigConstants.WKT_SUPPORT_EWKT,
        ConfigConstants.DEFAULT_WKT_SUPPORT_EWKT));
    parser.setSupportWkt12(config.getBoolean(ConfigConstants.WKT_SUPPORT_WKT12,
        ConfigConstants.DEFAULT_WKT_SUPPORT_WKT12));
    parser.setStrictWkt11(config.getBoolean(ConfigConstants.WKT_STRICT_WKT11,
        ConfigConstants.DEFAULT_WKT_STRICT_WKT11));
    parser.setIgnoreExtraTokens(config.getBoolean(
        ConfigConstants.WKT_IGNORE_EXTRA_TOKENS,
        ConfigConstants.DEFAULT_WKT_IGNORE_EXTRA_TOKENS));
    return parser;
  }

  /**
   * @return the factory used if there is no factory generator or if the
   * generator does not return a factory
   */
  public GeometryFactory<G> getDefaultFactory() {
    return defaultFactory;
  }

  /**
   * Set the factory used if there is no factory generator or if the
   * generator does not return a factory
   * @param defaultFactory the factory
   */
  public void setDefaultFactory(GeometryFactory<G> defaultFactory) {
    if (defaultFactory == null) {
      throw new IllegalArgumentException("Default factory must not be null");
    }
    this.defaultFactory = defaultFactory;
  }

  /**
   * @return the factory generator or null if there is none
   */
  public FactoryGenerator<G> getFactoryGenerator() {
    return factoryGenerator;
  }

  /**
   * Set a generator that selects a factory based on the SRID and the
   * dimensions found in the input
   * @param factoryGenerator the generator (may be null)
   */
  public void setFactoryGenerator(FactoryGenerator<G> factoryGenerator) {
    this.factoryGenerator = factoryGenerator;
  }

  /**
   * @return true if PostGIS EWKT extensions are recognized
   */
  public boolean isSupportEwkt() {
    return supportEwkt;
  }

  /**
   * Enable or disable PostGIS EWKT extensions (SRID prefix and type tags
   * with an appended M)
   * @param supportEwkt true if the extensions should be recognized
   */
  public void setSupportEwkt(boolean supportEwkt) {
    this.supportEwkt = supportEwkt;
  }

  /**
   * @return true if SFS 1.2 dimension markers are recognized
   */
  public boolean isSupportWkt12() {
    return supportWkt12;
  }

  /**
   * Enable or disable SFS 1.2 dimension markers (Z, M or ZM after the
   * type tag)
   * @param supportWkt12 true if the markers should be recognized
   */
  public void setSupportWkt12(boolean supportWkt12) {
    this.supportWkt12 = supportWkt12;
  }

  /**
   * @return true if only X and Y are allowed. Always false if EWKT or
   * SFS 1.2 extensions are enabled.
   */
  public boolean isStrictWkt11() {
    return strictWkt11 && !supportEwkt && !supportWkt12;
  }

  /**
   * Enable or disable strict SFS 1.1 mode, which only allows X and Y
   * coordinates. This setting has no effect if EWKT or SFS 1.2 extensions
   * are enabled.
   * @param strictWkt11 true if only X and Y should be allowed
   */
  public void setStrictWkt11(boolean strictWkt11) {
    this.strictWkt11 = strictWkt11;
  }

  /**
   * @return true if tokens after the geometry are ignored
   */
  public boolean isIgnoreExtraTokens() {
    return ignoreExtraTokens;
  }

  /**
   * Specify if tokens after the geometry should be ignored
   * @param ignoreExtraTokens true if they should be ignored, false if
   * they should lead to a parse error
   */
  public void setIgnoreExtraTokens(boolean ignoreExtraTokens) {
    this.ignoreExtraTokens = ignoreExtraTokens;
  }

  /**
   * Parse a geometry
   * @param wkt the WKT string (case-insensitive)
   * @return the geometry
   * @throws WKTParseException if the string could not be parsed or if the
   * factory could not create the geometry
   */
  public G parse(String wkt) throws WKTParseException {
    String str = wkt.toLowerCase(Locale.ENGLISH);

    Integer srid = null;
    if (supportEwkt) {
      Matcher m = SRID_PREFIX.matcher(str);
      if (m.lookingAt()) {
        srid = parseSrid(m.group(1));
        str = str.substring(m.end());
        log.trace("Found SRID " + srid);
      }
    }

    try (ParseContext<G> ctx = new ParseContext<>(defaultFactory,
        factoryGenerator, srid, new WKTTokenizer(str))) {
      ctx.nextToken();
      G result = parseTypeTag(ctx, false);
      if (ctx.token().getType() != TokenType.EOF && !ignoreExtraTokens) {
        throw new WKTParseException("Extra tokens beginning with " +
            ctx.token() + ".");
      }
      return result;
    } catch (IllegalArgumentException e) {
      throw new WKTParseException("Could not create geometry: " +
          e.getMessage(), e);
    }
  }

  private static Integer parseSrid(String digits) throws WKTParseException {
    try {
      return Integer.valueOf(digits);
    } catch (NumberFormatException e) {
      throw new WKTParseException("Invalid SRID: " + digits, e);
    }
  }

  /**
   * Parse a type tag with an optional dimension marker and the geometry
   * following it. With SFS 1.2 markers enabled, a collection member without
   * a marker is treated as 2D once dimensions have been declared, so
   * <code>GEOMETRYCOLLECTION Z (POINT (1 2 3))</code> is rejected.
   * @param ctx the parse context
   * @param contained true if the geometry is a member of a collection
   * @return the geometry
   * @throws WKTParseException if the input is invalid
   */
  private G parseTypeTag(ParseContext<G> ctx, boolean contained)
      throws WKTParseException {
    ctx.expect(TokenType.WORD);
    String tag = ctx.token().getText();
    String type = tag;
    String zm = "";
    if (supportEwkt && tag.length() > 1 && tag.endsWith("m")) {
      type = tag.substring(0, tag.length() - 1);
      zm = "m";
    }
    ctx.nextToken();

    if (zm.isEmpty() && supportWkt12 && ctx.token().getType() == TokenType.WORD &&
        DIMENSION_MARKER.matcher(ctx.token().getText()).matches()) {
      zm = ctx.token().getText();
      ctx.nextToken();
    }

    // in SFS 1.2 a member without marker inside a declared collection is 2D
    boolean undeclaredMember = contained && supportWkt12 && ctx.isDeclared();
    if (!zm.isEmpty() || isStrictWkt11() || undeclaredMember) {
      ctx.declareDimensions(zm.startsWith("z"), zm.endsWith("m"));
    }

    switch (type) {
      case "point":
        return parsePoint(ctx, true);
      case "linestring":
        return parseLineString(ctx);
      case "polygon":
        return parsePolygon(ctx);
      case "geometrycollection":
        return parseGeometryCollection(ctx);
      case "multipoint":
        return parseMultiPoint(ctx);
      case "multilinestring":
        return parseMultiLineString(ctx);
      case "multipolygon":
        return parseMultiPolygon(ctx);
      default:
        throw new WKTParseException("Unknown type tag: \"" + tag + "\".");
    }
  }

  /**
   * Parse a coordinate tuple and create a point from it
   * @param ctx the parse context
   * @return the point
   * @throws WKTParseException if the input is invalid
   */
  private G parseCoordinates(ParseContext<G> ctx) throws WKTParseException {
    double x = ctx.nextNumber();
    double y = ctx.nextNumber();

    if (ctx.getExpectZ() == null) {
      List<Double> extra = new ArrayList<>();
      while (ctx.token().getType() == TokenType.NUMBER) {
        extra.add(ctx.token().getValue());
        ctx.nextToken();
      }
      ctx.inferDimensions(extra.size());
      return ctx.resolveFactory().point(x, y, toArray(extra));
    }

    FactoryCapabilities capabilities = ctx.capabilities();
    List<Double> extra = new ArrayList<>(2);
    double z = 0;
    if (ctx.getExpectZ()) {
      z = ctx.nextNumber();
    }
    if (capabilities.supportsZ()) {
      extra.add(z);
    }
    double m = 0;
    if (ctx.getExpectM()) {
      m = ctx.nextNumber();
    }
    if (capabilities.supportsM()) {
      extra.add(m);
    }
    return ctx.resolveFactory().point(x, y, toArray(extra));
  }

  private static double[] toArray(List<Double> values) {
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; ++i) {
      result[i] = values.get(i);
    }
    return result;
  }

  /**
   * Parse a point
   * @param ctx the parse context
   * @param convertEmpty true if <code>EMPTY</code> is allowed. An empty
   * point is returned as an empty multi point.
   * @return the point
   * @throws WKTParseException if the input is invalid
   */
  private G parsePoint(ParseContext<G> ctx, boolean convertEmpty)
      throws WKTParseException {
    G point;
    if (convertEmpty && ctx.token().isWord("empty")) {
      point = ctx.resolveFactory().multiPoint(new ArrayList<>());
    } else {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      point = parseCoordinates(ctx);
      ctx.expect(TokenType.END);
    }
    ctx.nextToken();
    return point;
  }

  private G parseLineString(ParseContext<G> ctx) throws WKTParseException {
    List<G> points = new ArrayList<>();
    if (!ctx.token().isWord("empty")) {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      // a line string without points is degenerate but allowed
      while (ctx.token().getType() != TokenType.END) {
        points.add(parseCoordinates(ctx));
        if (ctx.token().getType() == TokenType.END) {
          break;
        }
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
        ctx.expect(TokenType.NUMBER);
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().lineString(points);
  }

  private G parsePolygon(ParseContext<G> ctx) throws WKTParseException {
    G outerRing;
    List<G> holes = new ArrayList<>();
    if (ctx.token().isWord("empty")) {
      outerRing = ctx.resolveFactory().linearRing(new ArrayList<>());
    } else {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      outerRing = parseLineString(ctx);
      while (ctx.token().getType() != TokenType.END) {
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
        holes.add(parseLineString(ctx));
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().polygon(outerRing, holes);
  }

  private G parseGeometryCollection(ParseContext<G> ctx) throws WKTParseException {
    List<G> geometries = new ArrayList<>();
    if (!ctx.token().isWord("empty")) {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      while (true) {
        geometries.add(parseTypeTag(ctx, true));
        if (ctx.token().getType() == TokenType.END) {
          break;
        }
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().collection(geometries);
  }

  /**
   * Parse a multi point. Members may either be enclosed in parentheses
   * or be bare coordinate tuples.
   * @param ctx the parse context
   * @return the multi point
   * @throws WKTParseException if the input is invalid
   */
  private G parseMultiPoint(ParseContext<G> ctx) throws WKTParseException {
    List<G> points = new ArrayList<>();
    if (!ctx.token().isWord("empty")) {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      while (true) {
        if (ctx.token().getType() == TokenType.NUMBER) {
          points.add(parseCoordinates(ctx));
        } else {
          points.add(parsePoint(ctx, false));
        }
        if (ctx.token().getType() == TokenType.END) {
          break;
        }
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().multiPoint(points);
  }

  private G parseMultiLineString(ParseContext<G> ctx) throws WKTParseException {
    List<G> lineStrings = new ArrayList<>();
    if (!ctx.token().isWord("empty")) {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      while (true) {
        lineStrings.add(parseLineString(ctx));
        if (ctx.token().getType() == TokenType.END) {
          break;
        }
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().multiLineString(lineStrings);
  }

  private G parseMultiPolygon(ParseContext<G> ctx) throws WKTParseException {
    List<G> polygons = new ArrayList<>();
    if (!ctx.token().isWord("empty")) {
      ctx.expect(TokenType.BEGIN);
      ctx.nextToken();
      while (true) {
        polygons.add(parsePolygon(ctx));
        if (ctx.token().getType() == TokenType.END) {
          break;
        }
        ctx.expect(TokenType.COMMA);
        ctx.nextToken();
      }
    }
    ctx.nextToken();
    return ctx.resolveFactory().multiPolygon(polygons);
  }
}
