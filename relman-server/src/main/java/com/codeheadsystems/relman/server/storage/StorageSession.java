package com.codeheadsystems.relman.server.storage;

import com.codeheadsystems.relman.server.auth.FoundationPrincipal;
import com.codeheadsystems.relman.server.auth.TokenException;
import com.codeheadsystems.relman.server.store.ArtifactTransaction;
import com.codeheadsystems.relman.server.store.MembershipDirectory;
import com.codeheadsystems.relman.server.store.StorageTransaction;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One unit of work against the record store and the artifact store.
 * <p>
 * Capabilities are obtained from the {@code asXxx} factories, which check the caller's
 * eligibility against the {@link MembershipDirectory} every time. Every change made through a
 * capability passes through {@link #mutate}. Closing a session that was not committed rolls it
 * back. Not thread-safe.
 */
public final class StorageSession implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(StorageSession.class);

  private enum State { OPEN, COMMITTED, ROLLED_BACK }

  private final StorageManager manager;
  private final FoundationPrincipal principal;
  private final StorageTransaction records;
  private final ArtifactTransaction artifacts;
  private final boolean readOnly;
  private State state = State.OPEN;

  StorageSession(StorageManager manager, FoundationPrincipal principal, StorageTransaction records,
                 ArtifactTransaction artifacts, boolean readOnly) {
    this.manager = manager;
    this.principal = principal;
    this.records = records;
    this.artifacts = artifacts;
    this.readOnly = readOnly;
  }

  public Optional<FoundationPrincipal> principal() {
    return Optional.ofNullable(principal);
  }

  public boolean isOpen() {
    return state == State.OPEN;
  }

  public boolean isReadOnly() {
    return readOnly;
  }

  /**
   * Read access for anyone.
   *
   * @return the capability
   */
  public GeneralPublic asGeneralPublic() {
    checkOpen();
    return new GeneralPublicAccess(this);
  }

  /**
   * Access for a foundation committer.
   *
   * @return the capability
   * @throws TokenException        UNAUTHENTICATED in a public session
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE when the caller is not a committer
   */
  public FoundationCommitter asFoundationCommitter() {
    checkOpen();
    FoundationPrincipal caller = requirePrincipal();
    if (!directory().isCommitter(caller.uid())) {
      throw denied(caller, PrivilegeLevel.FOUNDATION_COMMITTER, null);
    }
    return committerAccess(caller);
  }

  /**
   * Access for a member or committer of a committee.
   *
   * @param committee committee name
   * @return the capability
   * @throws NotFoundException     when there is no such committee
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE when the caller does not take part in it
   */
  public CommitteeParticipant asCommitteeParticipant(String committee) {
    checkOpen();
    FoundationPrincipal caller = requirePrincipal();
    requireCommittee(committee);
    MembershipDirectory directory = directory();
    if (!directory.isParticipant(caller.uid(), committee) && !directory.isAdministrator(caller.uid())) {
      throw denied(caller, PrivilegeLevel.COMMITTEE_PARTICIPANT, committee);
    }
    return new CommitteeParticipantAccess(this, committee, committerAccess(caller));
  }

  /**
   * Access for a committee member. Administrators are eligible for every committee.
   *
   * @param committee committee name
   * @return the capability
   * @throws NotFoundException     when there is no such committee
   * @throws AccessDeniedException INSUFFICIENT_PRIVILEGE when the caller is not a member
   */
  public CommitteeMember asCommitteeMember(String committee) {
    checkOpen();
    FoundationPrincipal caller = requirePrincipal();
    requireCommittee(committee);
    MembershipDirectory directory = directory();
    if (!directory.isMember(caller.uid(), committee) && !directory.isAdministrator(caller.uid())) {
      throw denied(caller, PrivilegeLevel.COMMITTEE_MEMBER, committee);
    }
    return new CommitteeMemberAccess(
        new CommitteeParticipantAccess(this, committee, committerAccess(caller)));
  }

  /**
   * Makes every change durable: records first, then artifacts.
   *
   * @throws IllegalStateException when the session is closed or read-only
   */
  public void commit() {
    checkOpen();
    if (readOnly) {
      throw new IllegalStateException("Read-only session cannot commit");
    }
    try {
      records.commit();
    } catch (RuntimeException e) {
      state = State.ROLLED_BACK;
      artifacts.rollback();
      throw e;
    }
    state = State.COMMITTED;
    try {
      artifacts.commit();
    } catch (RuntimeException e) {
      log.error("Records committed but artifacts were not published; regenerate KEYS files to recover", e);
      throw e;
    }
  }

  /**
   * Rolls back unless already committed.
   */
  @Override
  public void close() {
    if (state != State.OPEN) {
      return;
    }
    state = State.ROLLED_BACK;
    try {
      records.rollback();
    } finally {
      artifacts.rollback();
    }
  }

  /**
   * The single chokepoint for changes to stored state.
   *
   * @param operation what is being done
   * @param target    what it is being done to
   * @param action    the change
   * @param <T>       the result type
   * @return what the action returned
   */
  <T> T mutate(String operation, String target, Supplier<T> action) {
    checkOpen();
    if (readOnly) {
      throw new IllegalStateException("Read-only session cannot " + operation);
    }
    manager.auditor().audit(principal == null ? null : principal.uid(), operation, target);
    log.debug("{} {}", operation, target);
    return action.get();
  }

  void checkOpen() {
    if (state != State.OPEN) {
      throw new IllegalStateException("Storage session is closed");
    }
  }

  StorageTransaction records() {
    return records;
  }

  ArtifactTransaction artifacts() {
    return artifacts;
  }

  StorageManager manager() {
    return manager;
  }

  MembershipDirectory directory() {
    return manager.directory();
  }

  private FoundationCommitterAccess committerAccess(FoundationPrincipal caller) {
    return new FoundationCommitterAccess(this, caller, new GeneralPublicAccess(this));
  }

  private FoundationPrincipal requirePrincipal() {
    if (principal == null) {
      throw new TokenException(TokenException.Reason.UNAUTHENTICATED, "Authentication required");
    }
    return principal;
  }

  private void requireCommittee(String committee) {
    if (committee == null || !directory().committeeExists(committee)) {
      throw new NotFoundException("No such committee: " + committee);
    }
  }

  private static AccessDeniedException denied(FoundationPrincipal caller, PrivilegeLevel level, String committee) {
    String scope = committee == null ? "" : " of " + committee;
    log.debug("Denied {} to {}{}", level, caller.uid(), scope);
    return new AccessDeniedException(AccessDeniedException.Reason.INSUFFICIENT_PRIVILEGE,
        caller.uid() + " is not eligible for " + level + scope);
  }
}
