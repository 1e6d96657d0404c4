package io.crswkt.model;

/**
 * Base class for all coordinate system nodes (GEOGCS, PROJCS, GEOCCS,
 * VERT_CS, LOCAL_CS and COMPD_CS)
 */
public abstract class CoordinateSystem extends IdentifiableNode {
  protected CoordinateSystem(NodeKind kind, String name, Authority authority) {
    super(kind, name, authority);
  }
}
