package io.geotext.jts;

import java.util.List;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.CoordinateXYM;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;

import io.geotext.geom.FactoryCapabilities;
import io.geotext.geom.GeometryFactory;

/**
 * <p>A {@link GeometryFactory} creating JTS geometries. All geometries get
 * the SRID this factory has been created with.</p>
 * <p>Points always carry the axes the factory supports. Values the caller
 * does not provide are set to {@link Double#NaN}. Rings are validated by
 * JTS, which throws an {@link IllegalArgumentException} if they are not
 * closed.</p>
 */
public class JtsGeometryFactory implements GeometryFactory<Geometry> {
  private final org.locationtech.jts.geom.GeometryFactory factory;
  private final FactoryCapabilities capabilities;

  /**
   * Create a factory
   * @param srid the SRID to assign to all geometries
   * @param capabilities the axes the created points should have
   */
  public JtsGeometryFactory(int srid, FactoryCapabilities capabilities) {
    this.factory = new org.locationtech.jts.geom.GeometryFactory(
        new PrecisionModel(), srid);
    this.capabilities = capabilities;
  }

  /**
   * @return a factory for two-dimensional cartesian geometries without
   * an SRID
   */
  public static JtsGeometryFactory cartesian() {
    return new JtsGeometryFactory(0, FactoryCapabilities.XY);
  }

  /**
   * @return the wrapped JTS geometry factory
   */
  public org.locationtech.jts.geom.GeometryFactory getJtsFactory() {
    return factory;
  }

  @Override
  public FactoryCapabilities getCapabilities() {
    return capabilities;
  }

  @Override
  public Geometry point(double x, double y, double... extra) {
    return factory.createPoint(makeCoordinate(x, y, extra));
  }

  private Coordinate makeCoordinate(double x, double y, double[] extra) {
    int i = 0;
    double z = Double.NaN;
    if (capabilities.supportsZ() && i < extra.length) {
      z = extra[i++];
    }
    double m = Double.NaN;
    if (capabilities.supportsM() && i < extra.length) {
      m = extra[i];
    }

    if (capabilities.supportsZ() && capabilities.supportsM()) {
      return new CoordinateXYZM(x, y, z, m);
    }
    if (capabilities.supportsZ()) {
      return new Coordinate(x, y, z);
    }
    if (capabilities.supportsM()) {
      return new CoordinateXYM(x, y, m);
    }
    return new CoordinateXY(x, y);
  }

  private static Coordinate[] toCoordinates(List<Geometry> points) {
    Coordinate[] result = new Coordinate[points.size()];
    for (int i = 0; i < result.length; ++i) {
      result[i] = ((Point)points.get(i)).getCoordinate().copy();
    }
    return result;
  }

  private LinearRing toRing(Geometry ring) {
    if (ring instanceof LinearRing) {
      return (LinearRing)ring;
    }
    return factory.createLinearRing(((LineString)ring).getCoordinateSequence());
  }

  @Override
  public Geometry lineString(List<Geometry> points) {
    return factory.createLineString(toCoordinates(points));
  }

  @Override
  public Geometry linearRing(List<Geometry> points) {
    return factory.createLinearRing(toCoordinates(points));
  }

  @Override
  public Geometry polygon(Geometry outerRing, List<Geometry> holes) {
    LinearRing[] holeRings = new LinearRing[holes.size()];
    for (int i = 0; i < holeRings.length; ++i) {
      holeRings[i] = toRing(holes.get(i));
    }
    return factory.createPolygon(toRing(outerRing), holeRings);
  }

  @Override
  public Geometry multiPoint(List<Geometry> points) {
    return factory.createMultiPoint(points.toArray(new Point[0]));
  }

  @Override
  public Geometry multiLineString(List<Geometry> lineStrings) {
    return factory.createMultiLineString(lineStrings.toArray(new LineString[0]));
  }

  @Override
  public Geometry multiPolygon(List<Geometry> polygons) {
    return factory.createMultiPolygon(polygons.toArray(new Polygon[0]));
  }

  @Override
  public Geometry collection(List<Geometry> geometries) {
    return factory.createGeometryCollection(geometries.toArray(new Geometry[0]));
  }
}
