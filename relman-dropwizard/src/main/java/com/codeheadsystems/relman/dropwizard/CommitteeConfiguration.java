package com.codeheadsystems.relman.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Set;

/**
 * Roster of one committee in the application's YAML config.
 */
public class CommitteeConfiguration {

  private Set<String> members = Set.of();

  private Set<String> committers = Set.of();

  /**
   * Gets members.
   *
   * @return the committee members
   */
  @JsonProperty
  public Set<String> getMembers() {
    return members;
  }

  /**
   * Sets members.
   *
   * @param members the committee members
   */
  @JsonProperty
  public void setMembers(Set<String> members) {
    this.members = members;
  }

  /**
   * Gets committers.
   *
   * @return committers on the committee's projects who are not members
   */
  @JsonProperty
  public Set<String> getCommitters() {
    return committers;
  }

  /**
   * Sets committers.
   *
   * @param committers the committers
   */
  @JsonProperty
  public void setCommitters(Set<String> committers) {
    this.committers = committers;
  }
}
