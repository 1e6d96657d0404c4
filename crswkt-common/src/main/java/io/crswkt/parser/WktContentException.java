package io.crswkt.parser;

import io.crswkt.model.NodeKind;

/**
 * Raised if a CRS WKT string is syntactically valid but violates a
 * structural rule, e.g. a child node that is not allowed in its parent or
 * a wrong number of axes
 */
public class WktContentException extends WktException {
  private static final long serialVersionUID = -4905630744722771953L;

  private final NodeKind parentKind;
  private final NodeKind offendingKind;

  /**
   * Constructs a new exception
   * @param message the detail message
   * @param parentKind the kind of the node whose definition is invalid
   * @param offendingKind the kind of the child node that caused the error
   * (may be null if the error is not caused by a single child)
   */
  public WktContentException(String message, NodeKind parentKind,
      NodeKind offendingKind) {
    super(message);
    this.parentKind = parentKind;
    this.offendingKind = offendingKind;
  }

  /**
   * @return the kind of the node whose definition is invalid
   */
  public NodeKind getParentKind() {
    return parentKind;
  }

  /**
   * @return the kind of the child node that caused the error (may be null)
   */
  public NodeKind getOffendingKind() {
    return offendingKind;
  }
}
