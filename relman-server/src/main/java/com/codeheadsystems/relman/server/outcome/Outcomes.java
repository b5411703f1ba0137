package com.codeheadsystems.relman.server.outcome;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Ordered outcomes of a batch operation, one per input item.
 * <p>
 * Entries are keyed by an item key (for instance the position of a key block in an uploaded
 * KEYS file) and kept in insertion order. A key can be appended only once, so a batch that
 * appends once per input item reports on every item and silently drops none.
 * <p>
 * Not thread-safe; an instance belongs to the operation that builds it.
 *
 * @param <T> the result type
 */
public final class Outcomes<T> {

  private final LinkedHashMap<String, Outcome<T>> entries = new LinkedHashMap<>();

  /**
   * Appends the outcome for one item.
   *
   * @param key     the item key
   * @param outcome the item's outcome
   * @return this
   * @throws IllegalArgumentException if the key was already appended
   */
  public Outcomes<T> append(String key, Outcome<T> outcome) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(outcome, "outcome");
    if (entries.putIfAbsent(key, outcome) != null) {
      throw new IllegalArgumentException("Duplicate outcome key: " + key);
    }
    return this;
  }

  /**
   * Appends a success.
   *
   * @param key   the item key
   * @param value the result
   * @return this
   */
  public Outcomes<T> appendResult(String key, T value) {
    return append(key, Outcome.success(value));
  }

  /**
   * Appends a failure.
   *
   * @param key   the item key
   * @param cause the failure
   * @return this
   */
  public Outcomes<T> appendFailure(String key, Exception cause) {
    return append(key, Outcome.failure(cause));
  }

  /**
   * Looks up one item.
   *
   * @param key the item key
   * @return the item's outcome
   */
  public Optional<Outcome<T>> get(String key) {
    return Optional.ofNullable(entries.get(key));
  }

  /**
   * Read-only view of all entries in insertion order.
   *
   * @return the entries
   */
  public Map<String, Outcome<T>> asMap() {
    return Collections.unmodifiableMap(entries);
  }

  /**
   * Visits every entry in insertion order.
   *
   * @param consumer the visitor
   */
  public void forEach(BiConsumer<String, Outcome<T>> consumer) {
    entries.forEach(consumer);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Number of items with a value (successes and warnings).
   *
   * @return the count
   */
  public int successCount() {
    return (int) entries.values().stream().filter(Outcome::ok).count();
  }

  /**
   * Number of items that succeeded with a warning.
   *
   * @return the count
   */
  public int warningCount() {
    return (int) entries.values().stream().filter(o -> o instanceof Outcome.Warning).count();
  }

  public int failureCount() {
    return size() - successCount();
  }

  public boolean anyFailed() {
    return failureCount() > 0;
  }

  /**
   * Values of all successful items, in order.
   *
   * @return the results
   */
  public List<T> results() {
    List<T> results = new ArrayList<>();
    entries.values().forEach(o -> o.result().ifPresent(results::add));
    return results;
  }

  /**
   * Causes of all failed items, in order. Warnings are not included.
   *
   * @return the causes
   */
  public List<Exception> causes() {
    return new ArrayList<>(causesByKey().values());
  }

  /**
   * Causes of all failed items by item key.
   *
   * @return the causes
   */
  public Map<String, Exception> causesByKey() {
    Map<String, Exception> causes = new LinkedHashMap<>();
    entries.forEach((key, outcome) -> {
      if (!outcome.ok()) {
        outcome.cause().ifPresent(cause -> causes.put(key, cause));
      }
    });
    return causes;
  }

  /**
   * Counts successful items whose value matches.
   *
   * @param predicate the test
   * @return the count
   */
  public int resultPredicateCount(Predicate<? super T> predicate) {
    return (int) results().stream().filter(predicate).count();
  }

  /**
   * Applies a function to successful items only. Failed items are carried over with their
   * cause (their partial result is dropped); a function that throws turns its item into a
   * failure.
   *
   * @param mapper the function
   * @param <R>    the new result type
   * @return a new aggregate with the same keys in the same order
   */
  public <R> Outcomes<R> mapResults(Function<? super T, ? extends R> mapper) {
    Outcomes<R> mapped = new Outcomes<>();
    entries.forEach((key, outcome) -> {
      if (outcome.ok()) {
        mapped.append(key, outcome.map(mapper));
      } else {
        mapped.append(key, Outcome.failure(outcome.cause().orElseThrow()));
      }
    });
    return mapped;
  }

  /**
   * Fail-fast access to all values.
   *
   * @return the results when nothing failed
   * @throws RuntimeException the first failure's cause, as in {@link Outcome#resultOrThrow()}
   */
  public List<T> resultsOrThrow() {
    List<T> results = new ArrayList<>();
    entries.values().forEach(o -> results.add(o.resultOrThrow()));
    return results;
  }

  @Override
  public String toString() {
    return "Outcomes[size=" + size() + ", failures=" + failureCount() + "]";
  }
}
