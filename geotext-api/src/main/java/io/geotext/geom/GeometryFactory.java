package io.geotext.geom;

import java.util.List;

/**
 * <p>Creates geometry objects from coordinates and other geometries. Parsers
 * use a factory to build their output without knowing anything about the
 * geometry model behind it.</p>
 * <p>Implementations decide if they validate their input (for example,
 * whether linear rings are closed). They may throw an
 * {@link IllegalArgumentException} if a geometry cannot be created.</p>
 * @param <G> the type of the geometries this factory creates
 */
public interface GeometryFactory<G> {
  /**
   * @return the coordinate axes this factory can represent
   */
  FactoryCapabilities getCapabilities();

  /**
   * Create a point. The optional extra values are interpreted according
   * to the factory's capabilities: the first one is the Z coordinate if
   * Z is supported, the next one is the M coordinate if M is supported.
   * @param x the X coordinate
   * @param y the Y coordinate
   * @param extra the Z and/or M coordinates (may be empty)
   * @return the point
   */
  G point(double x, double y, double... extra);

  /**
   * Create a line string
   * @param points the points (created by this factory)
   * @return the line string
   */
  G lineString(List<G> points);

  /**
   * Create a linear ring
   * @param points the points (created by this factory)
   * @return the linear ring
   */
  G linearRing(List<G> points);

  /**
   * Create a polygon
   * @param outerRing the outer ring (a line string or linear ring created
   * by this factory)
   * @param holes the inner rings (may be empty)
   * @return the polygon
   */
  G polygon(G outerRing, List<G> holes);

  /**
   * Create a multi point
   * @param points the points (may be empty)
   * @return the multi point
   */
  G multiPoint(List<G> points);

  /**
   * Create a multi line string
   * @param lineStrings the line strings (may be empty)
   * @return the multi line string
   */
  G multiLineString(List<G> lineStrings);

  /**
   * Create a multi polygon
   * @param polygons the polygons (may be empty)
   * @return the multi polygon
   */
  G multiPolygon(List<G> polygons);

  /**
   * Create a geometry collection
   * @param geometries the geometries (may be empty)
   * @return the geometry collection
   */
  G collection(List<G> geometries);
}
