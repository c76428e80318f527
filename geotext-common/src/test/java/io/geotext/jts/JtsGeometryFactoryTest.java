package io.geotext.jts;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.CoordinateXYM;
import org.locationtech.jts.geom.CoordinateXYZM;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import io.geotext.geom.FactoryCapabilities;

/**
 * Test {@link JtsGeometryFactory}
 */
public class JtsGeometryFactoryTest {
  /**
   * Points carry exactly the axes the factory supports
   */
  @Test
  public void pointAxes() {
    Coordinate xy = ((Point)new JtsGeometryFactory(0, FactoryCapabilities.XY)
        .point(1, 2)).getCoordinate();
    assertTrue(xy instanceof CoordinateXY);

    Coordinate xyz = ((Point)new JtsGeometryFactory(0, FactoryCapabilities.XYZ)
        .point(1, 2, 3)).getCoordinate();
    assertEquals(3.0, xyz.getZ(), 0.0);

    Coordinate xym = ((Point)new JtsGeometryFactory(0, FactoryCapabilities.XYM)
        .point(1, 2, 4)).getCoordinate();
    assertTrue(xym instanceof CoordinateXYM);
    assertEquals(4.0, xym.getM(), 0.0);

    Coordinate xyzm = ((Point)new JtsGeometryFactory(0, FactoryCapabilities.XYZM)
        .point(1, 2, 3, 4)).getCoordinate();
    assertTrue(xyzm instanceof CoordinateXYZM);
    assertEquals(3.0, xyzm.getZ(), 0.0);
    assertEquals(4.0, xyzm.getM(), 0.0);
  }

  /**
   * Values that are not provided become NaN
   */
  @Test
  public void missingValues() {
    Coordinate c = ((Point)new JtsGeometryFactory(0, FactoryCapabilities.XYZM)
        .point(1, 2, 3)).getCoordinate();
    assertEquals(3.0, c.getZ(), 0.0);
    assertTrue(Double.isNaN(c.getM()));
  }

  /**
   * Polygons can be created from line strings
   */
  @Test
  public void polygonFromLineStrings() {
    JtsGeometryFactory f = new JtsGeometryFactory(31467, FactoryCapabilities.XY);
    Geometry outer = f.lineString(Arrays.asList(f.point(0, 0), f.point(4, 0),
        f.point(4, 4), f.point(0, 0)));
    Geometry p = f.polygon(outer, Collections.emptyList());
    assertTrue(p instanceof Polygon);
    assertEquals(4, ((Polygon)p).getExteriorRing().getNumPoints());
    assertEquals(31467, p.getSRID());
  }

  /**
   * Unclosed rings are rejected by JTS
   */
  @Test(expected = IllegalArgumentException.class)
  public void unclosedRing() {
    JtsGeometryFactory f = JtsGeometryFactory.cartesian();
    f.linearRing(Arrays.asList(f.point(0, 0), f.point(4, 0),
        f.point(4, 4), f.point(0, 4)));
  }
}
