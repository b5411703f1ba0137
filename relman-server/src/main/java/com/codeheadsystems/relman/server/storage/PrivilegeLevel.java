package com.codeheadsystems.relman.server.storage;

/**
 * Capability levels in increasing order of privilege.
 */
public enum PrivilegeLevel {
  GENERAL_PUBLIC,
  FOUNDATION_COMMITTER,
  COMMITTEE_PARTICIPANT,
  COMMITTEE_MEMBER;

  /**
   * Whether a holder of this level may do everything a holder of {@code other} may do.
   *
   * @param other the level to compare against
   * @return true if this level is at least {@code other}
   */
  public boolean includes(PrivilegeLevel other) {
    return compareTo(other) >= 0;
  }
}
