package io.geotext.geom;

/**
 * Selects a {@link GeometryFactory} based on the spatial reference system
 * and the dimensions a parser found in its input
 * @param <G> the type of the geometries the generated factories create
 */
@FunctionalInterface
public interface FactoryGenerator<G> {
  /**
   * Generate a factory. Each argument may be null if the information is
   * not available (yet) when the factory is needed.
   * @param srid the spatial reference system identifier
   * @param supportZ true if the geometry has Z coordinates, false if it
   * has none
   * @param supportM true if the geometry has M coordinates, false if it
   * has none
   * @return the factory or null if the caller should fall back to its
   * default factory
   */
  GeometryFactory<G> generate(Integer srid, Boolean supportZ, Boolean supportM);
}
