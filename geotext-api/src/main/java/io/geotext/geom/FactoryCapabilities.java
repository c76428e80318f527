package io.geotext.geom;

/**
 * Describes which coordinate axes beyond X and Y a {@link GeometryFactory}
 * is able to represent
 */
public final class FactoryCapabilities {
  /**
   * Capabilities of a factory that only supports X and Y
   */
  public static final FactoryCapabilities XY = new FactoryCapabilities(false, false);

  /**
   * Capabilities of a factory that supports Z but not M
   */
  public static final FactoryCapabilities XYZ = new FactoryCapabilities(true, false);

  /**
   * Capabilities of a factory that supports M but not Z
   */
  public static final FactoryCapabilities XYM = new FactoryCapabilities(false, true);

  /**
   * Capabilities of a factory that supports both Z and M
   */
  public static final FactoryCapabilities XYZM = new FactoryCapabilities(true, true);

  private final boolean supportsZ;
  private final boolean supportsM;

  private FactoryCapabilities(boolean supportsZ, boolean supportsM) {
    this.supportsZ = supportsZ;
    this.supportsM = supportsM;
  }

  /**
   * Get the capabilities for the given combination of axes
   * @param supportsZ true if the factory supports Z coordinates
   * @param supportsM true if the factory supports M coordinates
   * @return the capabilities
   */
  public static FactoryCapabilities of(boolean supportsZ, boolean supportsM) {
    if (supportsZ) {
      return supportsM ? XYZM : XYZ;
    }
    return supportsM ? XYM : XY;
  }

  /**
   * @return true if Z coordinates are supported
   */
  public boolean supportsZ() {
    return supportsZ;
  }

  /**
   * @return true if M coordinates are supported
   */
  public boolean supportsM() {
    return supportsM;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    FactoryCapabilities other = (FactoryCapabilities)o;
    return supportsZ == other.supportsZ && supportsM == other.supportsM;
  }

  @Override
  public int hashCode() {
    return (supportsZ ? 2 : 0) + (supportsM ? 1 : 0);
  }

  @Override
  public String toString() {
    return "XY" + (supportsZ ? "Z" : "") + (supportsM ? "M" : "");
  }
}
