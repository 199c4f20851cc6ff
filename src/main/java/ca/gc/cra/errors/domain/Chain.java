package ca.gc.cra.errors.domain;

import java.util.List;
import java.util.Optional;

/**
 * Cursor over the members of a {@link Group} that have not been visited yet.
 *
 * <p>Matching and extraction look at the current member only; {@link #getCause()} yields a cursor advanced by one,
 * so a flat list of N errors reads as N single-cause steps. The backing list is an immutable snapshot and is shared
 * between cursors.</p>
 */
final class Chain extends RuntimeException implements HasIs, HasAs {
  private static final long serialVersionUID = 1L;

  private final List<Canonical> members;
  private final int index;

  Chain(List<Canonical> members) {
    this(members, 0);
  }

  private Chain(List<Canonical> members, int index) {
    super(null, null, false, false);
    this.members = members;
    this.index = index;
  }

  int remaining() {
    return Math.max(0, members.size() - index);
  }

  @Override
  public String getMessage() {
    return remaining() == 0 ? "" : members.get(index).getMessage();
  }

  // Terminal once at most one member is left.
  @Override
  public Throwable getCause() {
    return remaining() <= 1 ? null : new Chain(members, index + 1);
  }

  @Override
  public boolean is(Throwable target) {
    return remaining() > 0 && Errors.is(members.get(index), target);
  }

  @Override
  public <T extends Throwable> Optional<T> as(Class<T> type) {
    return remaining() == 0 ? Optional.empty() : Errors.as(members.get(index), type);
  }

  @Override
  public String toString() {
    return getMessage();
  }
}
