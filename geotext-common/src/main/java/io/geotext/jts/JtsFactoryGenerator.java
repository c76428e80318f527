package io.geotext.jts;

import org.locationtech.jts.geom.Geometry;

import io.geotext.ConfigConstants;
import io.geotext.geom.FactoryCapabilities;
import io.geotext.geom.FactoryGenerator;
import io.geotext.geom.GeometryFactory;
import io.vertx.core.json.JsonObject;

/**
 * Generates a {@link JtsGeometryFactory} for the SRID and the axes a parser
 * found in its input. Axes that are not known yet are enabled or disabled
 * according to the generator's defaults.
 */
public class JtsFactoryGenerator implements FactoryGenerator<Geometry> {
  private final boolean defaultSupportZ;
  private final boolean defaultSupportM;

  /**
   * Create a generator that enables Z and M if they are not known yet
   */
  public JtsFactoryGenerator() {
    this(ConfigConstants.DEFAULT_JTS_SUPPORT_Z, ConfigConstants.DEFAULT_JTS_SUPPORT_M);
  }

  /**
   * Create a generator
   * @param defaultSupportZ true if Z should be enabled if it is not known
   * yet whether the geometry has Z coordinates
   * @param defaultSupportM true if M should be enabled if it is not known
   * yet whether the geometry has M coordinates
   */
  public JtsFactoryGenerator(boolean defaultSupportZ, boolean defaultSupportM) {
    this.defaultSupportZ = defaultSupportZ;
    this.defaultSupportM = defaultSupportM;
  }

  /**
   * Create a generator configured by the given object
   * @param config the configuration
   * @return the generator
   * @see ConfigConstants#JTS_SUPPORT_Z
   * @see ConfigConstants#JTS_SUPPORT_M
   */
  public static JtsFactoryGenerator fromConfig(JsonObject config) {
    return new JtsFactoryGenerator(
        config.getBoolean(ConfigConstants.JTS_SUPPORT_Z,
            ConfigConstants.DEFAULT_JTS_SUPPORT_Z),
        config.getBoolean(ConfigConstants.JTS_SUPPORT_M,
            ConfigConstants.DEFAULT_JTS_SUPPORT_M));
  }

  @Override
  public GeometryFactory<Geometry> generate(Integer srid, Boolean supportZ,
      Boolean supportM) {
    boolean z = supportZ != null ? supportZ : defaultSupportZ;
    boolean m = supportM != null ? supportM : defaultSupportM;
    return new JtsGeometryFactory(srid != null ? srid : 0,
        FactoryCapabilities.of(z, m));
  }
}
