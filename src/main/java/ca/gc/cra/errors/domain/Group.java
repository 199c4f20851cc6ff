package ca.gc.cra.errors.domain;

import java.io.IOException;
import java.io.ObjectInputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered, auto-flattening collection of {@link Canonical} errors reported as one failure.
 * <p><strong>Why:</strong> Batch and parallel operations gather every failure and report them together without
 * losing the identity of any single one.</p>
 * <p><strong>Role:</strong> Aggregate error. Accumulate with {@link #append(Throwable...)}, finish with
 * {@link #errorOrEmpty()}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Preserve insertion order; never nest a group inside a group.</li>
 *   <li>Classify foreign errors as {@link Canonical#UNKNOWN} on the way in.</li>
 *   <li>Expose members one at a time through {@link #getCause()} for cause-walking utilities.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. {@link #append(Throwable...)} mutates the member list; callers
 * feeding one group from several threads must serialise their appends.</p>
 * <p><strong>Performance:</strong> Appends are amortised O(1); {@link #getCause()} copies the member list once per
 * call.</p>
 * <p><strong>Observability:</strong> Rendered through its {@link GroupFormatter}; no logs.</p>
 *
 * @since 0.1.0
 */
public final class Group extends RuntimeException implements Iterable<Canonical> {
  private static final long serialVersionUID = 1L;

  private final List<Canonical> errors = new ArrayList<>();
  private transient GroupFormatter formatter;

  private Group(GroupFormatter formatter) {
    super(null, null, false, false);
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  /**
   * Creates a group using {@link GroupFormatter#DEFAULT}, seeded with {@code errs}.
   *
   * @param errs initial failures; {@code null} entries are ignored
   * @return new group
   */
  public static Group of(Throwable... errs) {
    return withFormatter(GroupFormatter.DEFAULT, errs);
  }

  /**
   * Creates a group with a custom formatter, seeded with {@code errs}.
   *
   * @param formatter renders the members; must not be {@code null}
   * @param errs initial failures; {@code null} entries are ignored
   * @return new group
   */
  public static Group withFormatter(GroupFormatter formatter, Throwable... errs) {
    Group group = new Group(formatter);
    group.append(errs);
    return group;
  }

  /**
   * Appends failures in order.
   *
   * <p>An error with a group anywhere in its cause chain contributes that group's members, never itself or its
   * wrappers. A classified error is appended as is; a foreign error is wrapped with {@link Canonical#UNKNOWN}.
   * {@code null}s are skipped.</p>
   *
   * @param errs failures to append; the array and its entries may be {@code null}
   */
  public void append(Throwable... errs) {
    if (errs == null) {
      return;
    }
    for (Throwable err : errs) {
      if (err == null) {
        continue;
      }
      ErrorVariant variant = ErrorVariant.classify(err);
      if (variant instanceof ErrorVariant.Aggregate aggregate) {
        append(aggregate.error().slice().toArray(new Throwable[0]));
      } else if (variant instanceof ErrorVariant.Classified classified) {
        errors.add(classified.error());
      } else {
        errors.add(Canonical.UNKNOWN.wrap(variant.error()));
      }
    }
  }

  /**
   * Reports whether the group holds no members.
   *
   * @return {@code true} when empty
   */
  public boolean isEmpty() {
    return errors.isEmpty();
  }

  /**
   * Resolves the accumulated failures.
   *
   * @return this group when it holds at least one member, otherwise empty
   */
  public Optional<Group> errorOrEmpty() {
    return errors.isEmpty() ? Optional.empty() : Optional.of(this);
  }

  /**
   * Returns the members as plain errors.
   *
   * @return unmodifiable snapshot in insertion order; later appends do not show through
   */
  public List<Throwable> slice() {
    return List.copyOf(errors);
  }

  /**
   * Returns a live, read-only view of the members.
   *
   * @return unmodifiable view in current order
   */
  public List<Canonical> errors() {
    return Collections.unmodifiableList(errors);
  }

  /**
   * Returns the next error for cause-walking utilities.
   *
   * @return empty for no members, the sole member for one, otherwise a cursor over a snapshot of the members
   */
  public Optional<Throwable> unwrap() {
    return Optional.ofNullable(getCause());
  }

  /**
   * Cause hook: {@code null} for no members, the member itself for a singleton, otherwise a cursor whose own causes
   * visit every member in insertion order.
   */
  @Override
  public Throwable getCause() {
    switch (errors.size()) {
      case 0:
        return null;
      case 1:
        return errors.get(0);
      default:
        return new Chain(List.copyOf(errors));
    }
  }

  /** Number of members. */
  public int size() {
    return errors.size();
  }

  /**
   * Orders two members by their single-line rendering.
   *
   * @param i index of the first member
   * @param j index of the second member
   * @return {@code true} when member {@code i} sorts before member {@code j}
   */
  public boolean less(int i, int j) {
    return errors.get(i).getMessage().compareTo(errors.get(j).getMessage()) < 0;
  }

  /**
   * Exchanges two members.
   *
   * @param i index of the first member
   * @param j index of the second member
   */
  public void swap(int i, int j) {
    Collections.swap(errors, i, j);
  }

  /** Sorts members in place by their single-line rendering. */
  public void sort() {
    errors.sort(Comparator.comparing(Canonical::getMessage));
  }

  @Override
  public Iterator<Canonical> iterator() {
    return errors().iterator();
  }

  /** Delegates to the group's {@link GroupFormatter}. */
  @Override
  public String getMessage() {
    return formatter.format(errors());
  }

  @Override
  public String toString() {
    return getMessage();
  }

  /** Formatters are behaviour and are not serialised; a deserialised group renders with the default one. */
  private void readObject(ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    formatter = GroupFormatter.DEFAULT;
  }
}
