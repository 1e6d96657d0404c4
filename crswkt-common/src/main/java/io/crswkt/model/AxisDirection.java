package io.crswkt.model;

/**
 * Directions an {@link Axis} may point to
 */
public enum AxisDirection {
  NORTH, SOUTH, EAST, WEST, UP, DOWN, OTHER
}
