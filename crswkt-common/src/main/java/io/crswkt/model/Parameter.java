package io.crswkt.model;

import java.math.BigInteger;

/**
 * A projection PARAMETER node. Its value keeps the type of the literal
 * it was read from: integral literals are stored as {@link Long} (or
 * {@link BigInteger} if they do not fit), all others as {@link Double}.
 */
public class Parameter extends IdentifiableNode {
  private final Number value;

  public Parameter(String name, Number value) {
    super(NodeKind.PARAMETER, name, null);
    this.value = value;
  }

  /**
   * @return the parameter's value
   */
  public Number getValue() {
    return value;
  }

  /**
   * @return true if the value was given as an integral literal
   */
  public boolean isInteger() {
    return value instanceof Long || value instanceof BigInteger;
  }

  @Override
  public <T> T accept(CrsNodeVisitor<T> visitor) {
    return visitor.visitParameter(this);
  }
}
