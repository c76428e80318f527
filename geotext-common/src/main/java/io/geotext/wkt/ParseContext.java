package io.geotext.wkt;

import io.geotext.geom.FactoryCapabilities;
import io.geotext.geom.FactoryGenerator;
import io.geotext.geom.GeometryFactory;
import io.vertx.core.logging.Logger;
import io.vertx.core.logging.LoggerFactory;

/**
 * <p>State of a single call to {@link WKTParser#parse(String)}. Holds the
 * tokenizer, the current token, the SRID, the Z and M expectations and the
 * geometry factory negotiated for this call.</p>
 * <p>{@link #getExpectZ()} and {@link #getExpectM()} return null as long as
 * the dimensionality is unknown. Once set they never change again, and the
 * factory never changes once it has been resolved.</p>
 * @param <G> the type of the geometries being built
 */
final class ParseContext<G> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ParseContext.class);

  private final GeometryFactory<G> defaultFactory;
  private final FactoryGenerator<G> factoryGenerator;
  private final Integer srid;

  private WKTTokenizer tokenizer;
  private Token token;

  private GeometryFactory<G> factory;
  private FactoryCapabilities capabilities;
  private Boolean expectZ;
  private Boolean expectM;
  private boolean declared;

  /**
   * Create a context
   * @param defaultFactory the factory to use if there is no generator or
   * if the generator does not return a factory
   * @param factoryGenerator the generator (may be null)
   * @param srid the SRID from the EWKT prefix (may be null)
   * @param tokenizer the tokenizer reading the input
   */
  ParseContext(GeometryFactory<G> defaultFactory,
      FactoryGenerator<G> factoryGenerator, Integer srid,
      WKTTokenizer tokenizer) {
    this.defaultFactory = defaultFactory;
    this.factoryGenerator = factoryGenerator;
    this.srid = srid;
    this.tokenizer = tokenizer;
    if (factoryGenerator == null) {
      // the default factory is the only candidate
      setFactory(defaultFactory);
    }
  }

  /**
   * @return the current token
   */
  Token token() {
    return token;
  }

  /**
   * Advance to the next token
   * @return the new current token
   * @throws WKTParseException if the next token could not be read
   */
  Token nextToken() throws WKTParseException {
    token = tokenizer.next();
    return token;
  }

  /**
   * Make sure the current token is of the given type
   * @param type the expected type
   * @throws WKTParseException if the current token has another type
   */
  void expect(TokenType type) throws WKTParseException {
    if (token.getType() != type) {
      throw new WKTParseException(type.getDescription() + " expected but " +
          token + " found.");
    }
  }

  /**
   * Consume a number
   * @return the number
   * @throws WKTParseException if the current token is not a number
   */
  double nextNumber() throws WKTParseException {
    expect(TokenType.NUMBER);
    double value = token.getValue();
    nextToken();
    return value;
  }

  /**
   * @return the SRID or null if the input did not specify one
   */
  Integer getSrid() {
    return srid;
  }

  /**
   * @return true if the input has Z coordinates, false if it has none,
   * or null if this is not known yet
   */
  Boolean getExpectZ() {
    return expectZ;
  }

  /**
   * @return true if the input has M coordinates, false if it has none,
   * or null if this is not known yet
   */
  Boolean getExpectM() {
    return expectM;
  }

  /**
   * @return true if the dimensionality was declared by a type tag rather
   * than inferred from coordinates
   */
  boolean isDeclared() {
    return declared;
  }

  /**
   * Get the factory, resolve it if necessary. The factory generator is
   * called at most once per context.
   * @return the factory
   * @throws WKTParseException if the factory cannot represent the
   * coordinates the input calls for
   */
  GeometryFactory<G> resolveFactory() throws WKTParseException {
    if (factory == null) {
      GeometryFactory<G> generated = factoryGenerator.generate(srid, expectZ, expectM);
      if (generated == null) {
        log.debug("Factory generator did not return a factory. "
            + "Falling back to default factory.");
        generated = defaultFactory;
      }
      setFactory(generated);
      if (expectZ != null) {
        checkCapabilities();
      }
    }
    return factory;
  }

  private void setFactory(GeometryFactory<G> factory) {
    this.factory = factory;
    this.capabilities = factory.getCapabilities();
    if (log.isDebugEnabled()) {
      log.debug("Resolved geometry factory with capabilities " + capabilities +
          " (SRID: " + srid + ", Z: " + expectZ + ", M: " + expectM + ")");
    }
  }

  /**
   * @return the capabilities of the resolved factory
   * @throws WKTParseException if the factory had to be resolved and
   * cannot represent the coordinates the input calls for
   */
  FactoryCapabilities capabilities() throws WKTParseException {
    resolveFactory();
    return capabilities;
  }

  /**
   * Make sure the resolved factory supports the axes the input calls for
   * @throws WKTParseException if it does not
   */
  void checkCapabilities() throws WKTParseException {
    if (Boolean.TRUE.equals(expectZ) && !capabilities.supportsZ()) {
      throw new WKTParseException("Geometry calls for Z coordinate but " +
          "factory doesn't support it.");
    }
    if (Boolean.TRUE.equals(expectM) && !capabilities.supportsM()) {
      throw new WKTParseException("Geometry calls for M coordinate but " +
          "factory doesn't support it.");
    }
  }

  /**
   * Apply the dimensions declared by a type tag. The first declaration
   * establishes the expectations for the whole parse and triggers the
   * capability check. Subsequent declarations must match.
   * @param z true if the tag declares Z coordinates
   * @param m true if the tag declares M coordinates
   * @throws WKTParseException if the declaration contradicts the
   * established expectations or the factory's capabilities
   */
  void declareDimensions(boolean z, boolean m) throws WKTParseException {
    boolean establishing = expectZ == null;
    if (expectZ == null) {
      expectZ = z;
    } else if (expectZ != z) {
      throw mismatch("Z", expectZ);
    }
    if (expectM == null) {
      expectM = m;
    } else if (expectM != m) {
      throw mismatch("M", expectM);
    }
    declared = true;

    if (establishing) {
      if (factory != null) {
        checkCapabilities();
      } else {
        resolveFactory();
      }
    }
  }

  private static WKTParseException mismatch(String axis, boolean surrounding) {
    if (surrounding) {
      return new WKTParseException("Surrounding collection has " + axis +
          " but contained geometry doesn't.");
    }
    return new WKTParseException("Contained geometry has " + axis +
        " but surrounding collection doesn't.");
  }

  /**
   * Infer the dimensions from the number of values following X and Y in
   * the first coordinate tuple of an undeclared input. A single extra
   * value is always Z. A second one is M. Only axes the factory supports
   * are taken into account if the factory is already known.
   * @param extras the number of values after X and Y
   * @throws WKTParseException if there are more values than can be
   * assigned to axes
   */
  void inferDimensions(int extras) throws WKTParseException {
    boolean canZ = factory == null || capabilities.supportsZ();
    boolean canM = factory == null || capabilities.supportsM();
    int remaining = extras;
    expectZ = remaining > 0 && canZ;
    if (expectZ) {
      --remaining;
    }
    expectM = expectZ && remaining > 0 && canM;
    if (expectM) {
      --remaining;
    }
    if (remaining > 0) {
      throw new WKTParseException("Found " + (extras + 2) + " coordinates, " +
          "which is too many for this factory.");
    }
  }

  @Override
  public void close() {
    tokenizer = null;
    token = null;
  }
}
