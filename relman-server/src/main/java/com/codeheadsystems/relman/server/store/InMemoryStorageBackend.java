package com.codeheadsystems.relman.server.store;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link StorageBackend}.
 * <p>
 * Each transaction works on a private copy of the state and journals its mutations; commit
 * replays the journal on the shared state under a lock, so readers never observe a partial
 * commit. Token usage and revocation are journaled as field updates against the committed
 * record, not as whole-record writes. All data is lost on restart. Suitable for development and testing only.
 */
public class InMemoryStorageBackend implements StorageBackend {

  private static final Logger log = LoggerFactory.getLogger(InMemoryStorageBackend.class);

  private final Object lock = new Object();
  private final State live = new State();

  public InMemoryStorageBackend() {
    log.warn("InMemoryStorageBackend in use: all keys and tokens are lost on restart");
  }

  @Override
  public StorageTransaction begin() {
    synchronized (lock) {
      return new Transaction(live.copy());
    }
  }

  private static final class State {
    private final Map<String, PublicSigningKey> keys = new TreeMap<>();
    private final Map<String, TreeSet<String>> links = new TreeMap<>();
    private final Map<String, PersonalAccessToken> pats = new LinkedHashMap<>();

    State copy() {
      State copy = new State();
      copy.keys.putAll(keys);
      links.forEach((committee, fingerprints) -> copy.links.put(committee, new TreeSet<>(fingerprints)));
      copy.pats.putAll(pats);
      return copy;
    }

    boolean link(String committee, String fingerprint) {
      return links.computeIfAbsent(committee, c -> new TreeSet<>()).add(fingerprint);
    }

    boolean unlink(String committee, String fingerprint) {
      TreeSet<String> fingerprints = links.get(committee);
      if (fingerprints == null || !fingerprints.remove(fingerprint)) {
        return false;
      }
      if (fingerprints.isEmpty()) {
        links.remove(committee);
      }
      return true;
    }

    boolean deleteKey(String fingerprint) {
      boolean existed = keys.remove(fingerprint) != null;
      links.values().forEach(fingerprints -> fingerprints.remove(fingerprint));
      links.values().removeIf(TreeSet::isEmpty);
      return existed;
    }
  }

  private final class Transaction implements StorageTransaction {

    private final State working;
    private final List<Consumer<State>> journal = new ArrayList<>();
    private boolean finished;

    private Transaction(State working) {
      this.working = working;
    }

    private void apply(Consumer<State> mutation) {
      checkActive();
      mutation.accept(working);
      journal.add(mutation);
    }

    private void checkActive() {
      if (finished) {
        throw new IllegalStateException("Transaction already finished");
      }
    }

    @Override
    public Optional<PublicSigningKey> loadKey(String fingerprint) {
      checkActive();
      return Optional.ofNullable(working.keys.get(fingerprint));
    }

    @Override
    public List<PublicSigningKey> allKeys() {
      checkActive();
      return List.copyOf(working.keys.values());
    }

    @Override
    public void storeKey(PublicSigningKey key) {
      apply(state -> state.keys.put(key.fingerprint(), key));
    }

    @Override
    public boolean deleteKey(String fingerprint) {
      checkActive();
      boolean existed = working.keys.containsKey(fingerprint);
      apply(state -> state.deleteKey(fingerprint));
      return existed;
    }

    @Override
    public SortedSet<String> committeeFingerprints(String committee) {
      checkActive();
      return new TreeSet<>(working.links.getOrDefault(committee, new TreeSet<>()));
    }

    @Override
    public SortedSet<String> keyCommittees(String fingerprint) {
      checkActive();
      TreeSet<String> committees = new TreeSet<>();
      working.links.forEach((committee, fingerprints) -> {
        if (fingerprints.contains(fingerprint)) {
          committees.add(committee);
        }
      });
      return committees;
    }

    @Override
    public boolean link(String committee, String fingerprint) {
      checkActive();
      if (working.links.getOrDefault(committee, new TreeSet<>()).contains(fingerprint)) {
        return false;
      }
      apply(state -> state.link(committee, fingerprint));
      return true;
    }

    @Override
    public boolean unlink(String committee, String fingerprint) {
      checkActive();
      if (!working.links.getOrDefault(committee, new TreeSet<>()).contains(fingerprint)) {
        return false;
      }
      apply(state -> state.unlink(committee, fingerprint));
      return true;
    }

    @Override
    public void storePat(PersonalAccessToken pat) {
      apply(state -> state.pats.put(pat.id(), pat));
    }

    @Override
    public boolean markPatUsed(String id, Instant when) {
      checkActive();
      if (!working.pats.containsKey(id)) {
        return false;
      }
      apply(state -> state.pats.computeIfPresent(id, (key, pat) -> pat.withLastUsed(when)));
      return true;
    }

    @Override
    public boolean revokePat(String id) {
      checkActive();
      if (!working.pats.containsKey(id)) {
        return false;
      }
      apply(state -> state.pats.computeIfPresent(id, (key, pat) -> pat.asRevoked()));
      return true;
    }

    @Override
    public Optional<PersonalAccessToken> loadPat(String id) {
      checkActive();
      return Optional.ofNullable(working.pats.get(id));
    }

    @Override
    public Optional<PersonalAccessToken> findPatByHash(String tokenHash) {
      checkActive();
      return working.pats.values().stream()
          .filter(pat -> pat.tokenHash().equals(tokenHash))
          .findFirst();
    }

    @Override
    public List<PersonalAccessToken> patsFor(String uid) {
      checkActive();
      return working.pats.values().stream()
          .filter(pat -> pat.uid().equals(uid))
          .sorted(Comparator.comparing(PersonalAccessToken::created))
          .toList();
    }

    @Override
    public void commit() {
      checkActive();
      finished = true;
      synchronized (lock) {
        journal.forEach(mutation -> mutation.accept(live));
      }
      log.debug("Committed {} mutation(s)", journal.size());
    }

    @Override
    public void rollback() {
      checkActive();
      finished = true;
      log.debug("Rolled back {} mutation(s)", journal.size());
    }
  }
}
