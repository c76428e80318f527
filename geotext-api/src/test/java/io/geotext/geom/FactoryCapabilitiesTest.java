package io.geotext.geom;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

/**
 * Test {@link FactoryCapabilities}
 */
public class FactoryCapabilitiesTest {
  /**
   * Check that {@link FactoryCapabilities#of(boolean, boolean)} returns
   * the shared constants
   */
  @Test
  public void of() {
    assertSame(FactoryCapabilities.XY, FactoryCapabilities.of(false, false));
    assertSame(FactoryCapabilities.XYZ, FactoryCapabilities.of(true, false));
    assertSame(FactoryCapabilities.XYM, FactoryCapabilities.of(false, true));
    assertSame(FactoryCapabilities.XYZM, FactoryCapabilities.of(true, true));
  }

  /**
   * Check the axis flags
   */
  @Test
  public void axes() {
    assertTrue(FactoryCapabilities.XYZ.supportsZ());
    assertFalse(FactoryCapabilities.XYZ.supportsM());
    assertFalse(FactoryCapabilities.XYM.supportsZ());
    assertTrue(FactoryCapabilities.XYM.supportsM());
    assertEquals("XYZM", FactoryCapabilities.XYZM.toString());
    assertEquals("XY", FactoryCapabilities.XY.toString());
  }
}
