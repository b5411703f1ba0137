package com.codeheadsystems.relman.server.storage;

/**
 * The caller is authenticated but not allowed to do this. Maps to HTTP 403.
 */
public class AccessDeniedException extends SecurityException {

  /**
   * Why access was denied.
   */
  public enum Reason {
    /** The caller does not hold the requested capability level. */
    INSUFFICIENT_PRIVILEGE,
    /** The caller holds the level but does not own the target. */
    FORBIDDEN
  }

  private final Reason reason;

  public AccessDeniedException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
