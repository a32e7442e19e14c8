/* (C)2026 Christian Schnapka / Macstab GmbH */
package com.macstab.oss.redis.resp.result;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

import com.macstab.oss.redis.resp.exception.ErrorKind;
import com.macstab.oss.redis.resp.exception.RespException;

/**
 * Outcome of a client call as a value: either a result or a typed {@link RespException}.
 *
 * <p>Loops that must survive failures ("poll forever, reconnect on I/O errors") branch on {@link
 * #errorKind()} instead of wrapping each call in try/catch:
 *
 * <pre>{@code
 * final var result = client.tryExecute("INCR", "counter");
 * if (result.isSuccess()) {
 *   log.info("counter = {}", result.value().asLong());
 * } else if (result.errorKind().isTransport()) {
 *   reconnect();
 * } else {
 *   throw result.error();
 * }
 * }</pre>
 *
 * <p>A null reply (e.g. {@code *-1} from a timed-out {@code XREAD BLOCK}) is a <em>success</em>
 * holding {@code ArrayReply.NULL}. Only exceptions become failures.
 *
 * @param <T> value type
 */
public sealed interface RespResult<T> permits RespResult.Success, RespResult.Failure {

  static <T> RespResult<T> success(final T value) {
    return new Success<>(value);
  }

  static <T> RespResult<T> failure(final RespException error) {
    return new Failure<>(error);
  }

  /**
   * Runs the call and captures a {@link RespException} as failure. Other exceptions propagate.
   *
   * @param call client call
   * @return success with the call's value, or failure with its exception
   */
  static <T> RespResult<T> of(final Supplier<T> call) {
    try {
      return success(call.get());
    } catch (final RespException e) {
      return failure(e);
    }
  }

  boolean isSuccess();

  /**
   * Value of a success.
   *
   * @throws IllegalStateException on a failure
   */
  T value();

  /**
   * Exception of a failure.
   *
   * @throws IllegalStateException on a success
   */
  RespException error();

  /**
   * Failure category.
   *
   * @return kind of {@link #error()}, {@code null} on a success
   */
  default ErrorKind errorKind() {
    return isSuccess() ? null : error().kind();
  }

  /**
   * Returns the value or rethrows the captured exception unchanged.
   *
   * @return value of a success
   */
  default T orElseThrow() {
    if (isSuccess()) {
      return value();
    }
    throw error();
  }

  @SuppressWarnings("unchecked")
  default <R> RespResult<R> map(final Function<? super T, ? extends R> mapper) {
    if (isSuccess()) {
      return of(() -> mapper.apply(value()));
    }
    return (RespResult<R>) this;
  }

  /** Successful call. */
  record Success<T>(T value) implements RespResult<T> {

    @Override
    public boolean isSuccess() {
      return true;
    }

    @Override
    public RespException error() {
      throw new IllegalStateException("Success has no error");
    }
  }

  /** Failed call. */
  record Failure<T>(RespException error) implements RespResult<T> {

    public Failure {
      Objects.requireNonNull(error, "error must not be null");
    }

    @Override
    public boolean isSuccess() {
      return false;
    }

    @Override
    public T value() {
      throw new IllegalStateException("Failure has no value: " + error.getMessage(), error);
    }
  }
}
