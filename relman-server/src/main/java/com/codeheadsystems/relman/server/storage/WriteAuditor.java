package com.codeheadsystems.relman.server.storage;

/**
 * Hook invoked by a storage session before every mutation it performs.
 */
@FunctionalInterface
public interface WriteAuditor {

  /**
   * Does nothing.
   */
  WriteAuditor NO_OP = (uid, operation, target) -> {
  };

  /**
   * Observes a mutation about to be applied.
   *
   * @param uid       acting user, null for a public session
   * @param operation what is being done, e.g. {@code "link-key"}
   * @param target    what it is being done to
   */
  void audit(String uid, String operation, String target);
}
