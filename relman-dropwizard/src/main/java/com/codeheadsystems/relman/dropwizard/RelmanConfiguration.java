package com.codeheadsystems.relman.dropwizard;

import com.codeheadsystems.relman.server.store.MembershipDirectory;
import com.codeheadsystems.relman.server.store.StaticMembershipDirectory;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Dropwizard configuration for the relman server.
 * <p>
 * There is no setting for the session token signing secret: a fresh one is
 * generated at every start, so restarting the server invalidates every outstanding session
 * token. Personal access tokens are unaffected.
 */
public class RelmanConfiguration extends Configuration {

  /**
   * Value of the {@code iss} claim in issued session tokens.
   */
  @NotEmpty
  private String jwtIssuer = "relman";

  /**
   * Directory under which committee KEYS files are published, one subdirectory per committee.
   */
  @NotEmpty
  private String keysDirectory = "keys";

  /**
   * Foundation administrators. Administrators may act as a member of every committee.
   */
  @NotNull
  private Set<String> administrators = Set.of();

  /**
   * Foundation committers not listed on any committee roster.
   */
  @NotNull
  private Set<String> committers = Set.of();

  /**
   * Committee rosters by committee name.
   */
  @Valid
  @NotNull
  private Map<String, CommitteeConfiguration> committees = new LinkedHashMap<>();

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets keys directory.
   *
   * @return the keys directory
   */
  @JsonProperty
  public String getKeysDirectory() {
    return keysDirectory;
  }

  /**
   * Sets keys directory.
   *
   * @param keysDirectory the keys directory
   */
  @JsonProperty
  public void setKeysDirectory(String keysDirectory) {
    this.keysDirectory = keysDirectory;
  }

  /**
   * Gets administrators.
   *
   * @return the administrators
   */
  @JsonProperty
  public Set<String> getAdministrators() {
    return administrators;
  }

  /**
   * Sets administrators.
   *
   * @param administrators the administrators
   */
  @JsonProperty
  public void setAdministrators(Set<String> administrators) {
    this.administrators = administrators;
  }

  /**
   * Gets committers.
   *
   * @return the committers
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

  /**
   * Gets committees.
   *
   * @return the committee rosters
   */
  @JsonProperty
  public Map<String, CommitteeConfiguration> getCommittees() {
    return committees;
  }

  /**
   * Sets committees.
   *
   * @param committees the committee rosters
   */
  @JsonProperty
  public void setCommittees(Map<String, CommitteeConfiguration> committees) {
    this.committees = committees;
  }

  /**
   * Builds the membership directory described by this configuration.
   *
   * @return the directory
   */
  public MembershipDirectory buildMembershipDirectory() {
    Map<String, StaticMembershipDirectory.Roster> rosters = new LinkedHashMap<>();
    committees.forEach((name, roster) ->
        rosters.put(name, new StaticMembershipDirectory.Roster(roster.getMembers(), roster.getCommitters())));
    return new StaticMembershipDirectory(administrators, committers, rosters);
  }
}
