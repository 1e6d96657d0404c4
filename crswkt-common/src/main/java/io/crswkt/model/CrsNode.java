package io.crswkt.model;

/**
 * Base class of all nodes in a parsed CRS WKT tree. Nodes are immutable
 * and never refer to their parent.
 */
public abstract class CrsNode {
  /**
   * The name of nodes that do not carry a quoted label in WKT
   */
  public static final String UNSPECIFIED_NAME = "unspecified";

  private final NodeKind kind;
  private final String name;

  /**
   * Constructs a node
   * @param kind the node's kind
   * @param name the node's name (may be null if the node has no label)
   */
  protected CrsNode(NodeKind kind, String name) {
    this.kind = kind;
    this.name = name == null ? UNSPECIFIED_NAME : name;
  }

  /**
   * @return the node's kind
   */
  public NodeKind getKind() {
    return kind;
  }

  /**
   * @return the node's name (never null)
   */
  public String getName() {
    return name;
  }

  /**
   * Dispatch this node to the matching method of the given visitor
   * @param <T> the visitor's result type
   * @param visitor the visitor
   * @return the visitor's result
   */
  public abstract <T> T accept(CrsNodeVisitor<T> visitor);

  @Override
  public String toString() {
    return kind + "[\"" + name + "\"]";
  }
}
