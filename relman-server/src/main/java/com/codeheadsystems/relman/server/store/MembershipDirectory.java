package com.codeheadsystems.relman.server.store;

import java.util.SortedSet;

/**
 * Source of truth for who holds which role. Privilege is always derived from here at the time
 * a capability is requested, never cached on the caller.
 */
public interface MembershipDirectory {

  boolean isAdministrator(String uid);

  /**
   * Whether the user is a foundation committer. Committer status is global.
   */
  boolean isCommitter(String uid);

  /**
   * Whether the user sits on the committee.
   */
  boolean isMember(String uid, String committee);

  /**
   * Whether the user may contribute to the committee's projects, as a member or a committer.
   */
  boolean isParticipant(String uid, String committee);

  boolean committeeExists(String committee);

  /**
   * All committee names, sorted.
   */
  SortedSet<String> committees();
}
