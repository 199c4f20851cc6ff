package ca.gc.cra.errors.domain;

import java.util.Optional;

/**
 * Hook consulted by {@link Errors#as(Throwable, Class)} when an error can present itself as another type.
 *
 * @since 0.1.0
 */
public interface HasAs {
  /**
   * Attempts to view this error as {@code type}.
   *
   * @param type requested type; never {@code null}
   * @param <T> requested type
   * @return the matching view, or empty
   */
  <T extends Throwable> Optional<T> as(Class<T> type);
}
