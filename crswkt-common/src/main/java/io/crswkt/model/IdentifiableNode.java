package io.crswkt.model;

/**
 * A node that may be identified by an {@link Authority}. Every node kind
 * except AUTHORITY itself is identifiable.
 */
public abstract class IdentifiableNode extends CrsNode {
  private final Authority authority;

  /**
   * Constructs a node
   * @param kind the node's kind
   * @param name the node's name
   * @param authority the authority identifying the node (may be null)
   */
  protected IdentifiableNode(NodeKind kind, String name, Authority authority) {
    super(kind, name);
    this.authority = authority;
  }

  /**
   * @return the authority identifying this node or null if there is none
   */
  public Authority getAuthority() {
    return authority;
  }
}
