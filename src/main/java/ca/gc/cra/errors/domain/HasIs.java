package ca.gc.cra.errors.domain;

/**
 * Hook consulted by {@link Errors#is(Throwable, Throwable)} when walking a cause chain.
 *
 * @since 0.1.0
 */
public interface HasIs {
  /**
   * Reports whether this error should be treated as {@code target} for matching purposes.
   *
   * @param target error being searched for; may be {@code null}
   * @return {@code true} on a match
   */
  boolean is(Throwable target);
}
