/*
 * Copyright 2024 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.whispersystems.keymanager.util;

import java.util.concurrent.CompletionException;
import java.util.function.Function;

public final class ExceptionUtils {

  private ExceptionUtils() {
    // utility class
  }

  /**
   * Strips any {@link CompletionException} layers from the given throwable and returns the first cause that is not a
   * {@code CompletionException}, or the innermost {@code CompletionException} if it has no cause.
   */
  public static Throwable unwrap(Throwable throwable) {
    while (throwable instanceof CompletionException e && throwable.getCause() != null) {
      throwable = e.getCause();
    }
    return throwable;
  }

  /**
   * Wraps the given throwable in a {@link CompletionException} unless it already is one.
   */
  public static CompletionException wrap(final Throwable throwable) {
    return throwable instanceof CompletionException completionException
        ? completionException
        : new CompletionException(throwable);
  }

  /**
   * Creates a handler for {@link java.util.concurrent.CompletionStage#exceptionally} that only handles one exception
   * type (wrapped or not) and rethrows everything else.
   */
  public static <T, E extends Throwable> Function<Throwable, ? extends T> exceptionallyHandler(
      final Class<E> exceptionType,
      final Function<E, ? extends T> fn) {
    return anyException -> {
      final Throwable unwrapped = unwrap(anyException);
      if (exceptionType.isInstance(unwrapped)) {
        return fn.apply(exceptionType.cast(unwrapped));
      }
      throw wrap(anyException);
    };
  }

  /**
   * Creates a handler for {@link java.util.concurrent.CompletionStage#exceptionally} that converts one exception type
   * into another, e.g. a raw {@link java.util.concurrent.TimeoutException} into a domain-specific failure.
   */
  public static <T, E extends Throwable, F extends Throwable> Function<Throwable, ? extends T> marshal(
      final Class<E> exceptionType,
      final Function<E, F> fn) {
    return exceptionallyHandler(exceptionType, e -> {
      throw wrap(fn.apply(e));
    });
  }
}
