package com.codeheadsystems.relman.server.outcome;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Result of one operation step.
 * <p>
 * Closed set of three shapes:
 * <ul>
 *   <li>{@link Success} - the step produced a value</li>
 *   <li>{@link Warning} - the step produced a value, but something non-fatal went wrong
 *       along the way</li>
 *   <li>{@link Failure} - the step failed; any value produced before the failure is kept as
 *       the partial result</li>
 * </ul>
 * Writer operations return outcomes instead of throwing; the caller decides whether to
 * raise or aggregate. Use {@link #fold} when every shape must be handled.
 *
 * @param <T> the result type
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Warning, Outcome.Failure {

  /**
   * Successful outcome.
   *
   * @param value the result
   * @param <T>   the result type
   * @return the outcome
   */
  static <T> Outcome<T> success(T value) {
    return new Success<>(value);
  }

  /**
   * Successful outcome carrying a non-fatal cause.
   *
   * @param value the result
   * @param cause what went wrong
   * @param <T>   the result type
   * @return the outcome
   */
  static <T> Outcome<T> warning(T value, Exception cause) {
    return new Warning<>(value, cause);
  }

  /**
   * Failed outcome without partial result.
   *
   * @param cause the failure
   * @param <T>   the result type
   * @return the outcome
   */
  static <T> Outcome<T> failure(Exception cause) {
    return new Failure<>(cause, null);
  }

  /**
   * Failed outcome that keeps the progress made before the failure.
   *
   * @param cause   the failure
   * @param partial the value accumulated before the failure, may be null
   * @param <T>     the result type
   * @return the outcome
   */
  static <T> Outcome<T> failure(Exception cause, T partial) {
    return new Failure<>(cause, partial);
  }

  /**
   * Runs a step and captures whatever it throws.
   *
   * @param step the step
   * @param <T>  the result type
   * @return success with the step's value, or failure with the thrown exception
   */
  static <T> Outcome<T> attempt(Callable<T> step) {
    try {
      return success(step.call());
    } catch (Exception e) {
      return failure(e);
    }
  }

  /**
   * Whether a value is available, i.e. success or warning.
   *
   * @return true unless this is a failure
   */
  boolean ok();

  /**
   * The value for success and warning, empty for failure (even with a partial result).
   *
   * @return the result
   */
  Optional<T> result();

  /**
   * The warning cause or failure cause.
   *
   * @return the cause, empty for success
   */
  Optional<Exception> cause();

  /**
   * Fail-fast access to the value.
   *
   * @return the value for success and warning
   * @throws RuntimeException  the captured cause itself when it is unchecked
   * @throws OutcomeException  wrapping the captured cause when it is checked
   */
  default T resultOrThrow() {
    if (this instanceof Failure<T> failure) {
      Exception cause = failure.error();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw new OutcomeException(cause);
    }
    return result().orElse(null);
  }

  /**
   * Handles each shape.
   *
   * @param onSuccess called with the value of a success
   * @param onWarning called with the value and cause of a warning
   * @param onFailure called with the cause and partial result of a failure
   * @param <R>       the return type
   * @return what the selected function returned
   */
  default <R> R fold(Function<? super T, ? extends R> onSuccess,
                     BiFunction<? super T, Exception, ? extends R> onWarning,
                     BiFunction<Exception, Optional<T>, ? extends R> onFailure) {
    if (this instanceof Success<T> success) {
      return onSuccess.apply(success.value());
    }
    if (this instanceof Warning<T> warning) {
      return onWarning.apply(warning.value(), warning.warning());
    }
    Failure<T> failure = (Failure<T>) this;
    return onFailure.apply(failure.error(), failure.partialResult());
  }

  /**
   * Transforms the value, keeping the shape. An exception thrown by the mapper turns the
   * outcome into a failure. A failure's partial result is mapped as well when present.
   *
   * @param mapper the transformation
   * @param <R>    the new result type
   * @return the mapped outcome
   */
  default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
    return fold(
        value -> attempt(() -> mapper.apply(value)),
        (value, cause) -> {
          Outcome<R> mapped = attempt(() -> mapper.apply(value));
          return mapped.ok() ? warning(mapped.result().orElse(null), cause) : mapped;
        },
        (cause, partial) -> {
          R mappedPartial = null;
          if (partial.isPresent()) {
            try {
              mappedPartial = mapper.apply(partial.get());
            } catch (RuntimeException e) {
              cause.addSuppressed(e);
            }
          }
          return failure(cause, mappedPartial);
        });
  }

  /**
   * A value.
   *
   * @param value the result
   * @param <T>   the result type
   */
  record Success<T>(T value) implements Outcome<T> {

    @Override
    public boolean ok() {
      return true;
    }

    @Override
    public Optional<T> result() {
      return Optional.ofNullable(value);
    }

    @Override
    public Optional<Exception> cause() {
      return Optional.empty();
    }
  }

  /**
   * A value plus a non-fatal cause.
   *
   * @param value   the result
   * @param warning what went wrong
   * @param <T>     the result type
   */
  record Warning<T>(T value, Exception warning) implements Outcome<T> {

    public Warning {
      Objects.requireNonNull(warning, "warning");
    }

    @Override
    public boolean ok() {
      return true;
    }

    @Override
    public Optional<T> result() {
      return Optional.ofNullable(value);
    }

    @Override
    public Optional<Exception> cause() {
      return Optional.of(warning);
    }
  }

  /**
   * A failure, optionally after partial progress.
   *
   * @param error   the failure
   * @param partial value produced before the failure, or null
   * @param <T>     the result type
   */
  record Failure<T>(Exception error, T partial) implements Outcome<T> {

    public Failure {
      Objects.requireNonNull(error, "error");
    }

    /**
     * Progress made before the failure.
     *
     * @return the partial result, if any
     */
    public Optional<T> partialResult() {
      return Optional.ofNullable(partial);
    }

    @Override
    public boolean ok() {
      return false;
    }

    @Override
    public Optional<T> result() {
      return Optional.empty();
    }

    @Override
    public Optional<Exception> cause() {
      return Optional.of(error);
    }
  }
}
