package com.codeheadsystems.relman.server.store;

import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * {@link MembershipDirectory} over a fixed roster, typically loaded from configuration.
 */
public class StaticMembershipDirectory implements MembershipDirectory {

  /**
   * One committee's roster.
   *
   * @param members   committee members
   * @param committers committers on the committee's projects
   */
  public record Roster(Set<String> members, Set<String> committers) {

    public Roster {
      members = members == null ? Set.of() : Set.copyOf(members);
      committers = committers == null ? Set.of() : Set.copyOf(committers);
    }
  }

  private final Set<String> administrators;
  private final Set<String> committers;
  private final Map<String, Roster> committees;

  /**
   * Creates the directory.
   *
   * @param administrators foundation administrators
   * @param committers     foundation committers not otherwise listed in a roster
   * @param committees     rosters by committee name
   */
  public StaticMembershipDirectory(Set<String> administrators, Set<String> committers,
                                   Map<String, Roster> committees) {
    this.administrators = Set.copyOf(administrators);
    this.committers = Set.copyOf(committers);
    this.committees = new TreeMap<>(committees);
  }

  @Override
  public boolean isAdministrator(String uid) {
    return administrators.contains(uid);
  }

  @Override
  public boolean isCommitter(String uid) {
    if (administrators.contains(uid) || committers.contains(uid)) {
      return true;
    }
    return committees.values().stream()
        .anyMatch(roster -> roster.members().contains(uid) || roster.committers().contains(uid));
  }

  @Override
  public boolean isMember(String uid, String committee) {
    Roster roster = committees.get(committee);
    return roster != null && roster.members().contains(uid);
  }

  @Override
  public boolean isParticipant(String uid, String committee) {
    Roster roster = committees.get(committee);
    return roster != null && (roster.members().contains(uid) || roster.committers().contains(uid));
  }

  @Override
  public boolean committeeExists(String committee) {
    return committees.containsKey(committee);
  }

  @Override
  public SortedSet<String> committees() {
    return new TreeSet<>(committees.keySet());
  }
}
