package ca.gc.cra.errors.domain;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Generic inspection utilities that walk cause chains the way error-matching code expects.
 * <p><strong>Why:</strong> Lets callers match, extract and merge errors without special-casing the taxonomy;
 * {@link Canonical}, {@link Group} and its cursor participate through {@link HasIs}, {@link HasAs} and
 * {@link Throwable#getCause()}.</p>
 * <p><strong>Role:</strong> Entry points shared by the domain types and their callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Match an error against a target anywhere in its cause chain.</li>
 *   <li>Extract the first link of a requested type.</li>
 *   <li>Join several failures into a single {@link Group}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Linear in the chain length; each walk allocates one identity set.</p>
 * <p><strong>Observability:</strong> No logs or metrics.</p>
 *
 * @implNote Walks stop when a link repeats, mirroring {@link Throwable#printStackTrace()} cycle handling.
 * @since 0.1.0
 */
public final class Errors {

  private Errors() {
    // Utility
  }

  /**
   * Reports whether {@code err} or any of its causes matches {@code target}.
   *
   * <p>A link matches when it is equal to {@code target} or, implementing {@link HasIs}, claims the match.</p>
   *
   * @param err error to inspect; may be {@code null}
   * @param target error searched for; may be {@code null}
   * @return {@code true} on a match; two {@code null}s match each other
   */
  public static boolean is(Throwable err, Throwable target) {
    if (err == null || target == null) {
      return err == target;
    }
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable link = err; link != null && seen.add(link); link = link.getCause()) {
      if (link.equals(target)) {
        return true;
      }
      if (link instanceof HasIs hook && hook.is(target)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Finds the first link of {@code err}'s cause chain that is, or presents itself as, a {@code type}.
   *
   * @param err error to inspect; may be {@code null}
   * @param type requested type; must not be {@code null}
   * @param <T> requested type
   * @return matching link, or empty
   * @throws NullPointerException if {@code type} is {@code null}
   */
  public static <T extends Throwable> Optional<T> as(Throwable err, Class<T> type) {
    Objects.requireNonNull(type, "type");
    Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    for (Throwable link = err; link != null && seen.add(link); link = link.getCause()) {
      if (type.isInstance(link)) {
        return Optional.of(type.cast(link));
      }
      if (link instanceof HasAs hook) {
        Optional<T> view = hook.as(type);
        if (view.isPresent()) {
          return view;
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the next link of the cause chain.
   *
   * @param err error to unwrap; may be {@code null}
   * @return the cause, or empty when {@code err} is absent or terminal
   */
  public static Optional<Throwable> unwrap(Throwable err) {
    return err == null ? Optional.empty() : Optional.ofNullable(err.getCause());
  }

  /**
   * Returns the textual rendering of any error: its message, or {@link Throwable#toString()} when it has none.
   *
   * @param err error to render; must not be {@code null}
   * @return rendered text
   */
  public static String render(Throwable err) {
    String message = err.getMessage();
    return message != null ? message : err.toString();
  }

  /**
   * Classifies an error as foreign, classified, or aggregate.
   *
   * @param err error to classify; must not be {@code null}
   * @return the variant
   * @see ErrorVariant#classify(Throwable)
   */
  public static ErrorVariant classify(Throwable err) {
    return ErrorVariant.classify(err);
  }

  /**
   * Joins failures into a single group.
   *
   * <p>When {@code err} classifies as an aggregate (a {@link Group}, or any error whose cause chain holds one),
   * {@code errs} are appended to that group and it is returned; otherwise a new group holding {@code err} followed
   * by {@code errs} is created. Groups among {@code errs} are flattened and {@code null}s are ignored.</p>
   *
   * @param err existing failure or group; may be {@code null}
   * @param errs additional failures; may contain {@code null}
   * @return group holding every failure
   */
  public static Group join(Throwable err, Throwable... errs) {
    if (err != null && classify(err) instanceof ErrorVariant.Aggregate aggregate) {
      Group group = aggregate.error();
      group.append(errs);
      return group;
    }
    Group group = Group.of(new Throwable[] {err});
    group.append(errs);
    return group;
  }
}
