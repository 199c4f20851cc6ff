package ca.gc.cra.errors.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Closed view of any error as foreign, classified, or aggregate.
 * <p><strong>Why:</strong> {@link Group#append(Throwable...)} and {@link Canonical#wrap(Throwable)} decide once, at
 * the boundary, how an incoming error is treated; consumers branch on the variant instead of probing types.</p>
 * <p><strong>Thread-safety:</strong> Variants are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface ErrorVariant
    permits ErrorVariant.Foreign, ErrorVariant.Classified, ErrorVariant.Aggregate {

  /**
   * Returns the error carried by this variant.
   *
   * @return the foreign error, the classified {@link Canonical}, or the {@link Group}
   */
  Throwable error();

  /**
   * Classifies an error by searching its cause chain. A {@link Group} anywhere in the chain makes the error an
   * aggregate, even when a {@link Canonical} wraps that group; otherwise the first {@link Canonical} makes it
   * classified. Anything else is foreign.
   *
   * @param err error to classify; must not be {@code null}
   * @return the variant describing {@code err}
   * @throws NullPointerException if {@code err} is {@code null}
   */
  static ErrorVariant classify(Throwable err) {
    Objects.requireNonNull(err, "err");
    Optional<Group> group = Errors.as(err, Group.class);
    if (group.isPresent()) {
      return new Aggregate(group.get());
    }
    Optional<Canonical> nested = Errors.as(err, Canonical.class);
    if (nested.isPresent()) {
      return new Classified(nested.get());
    }
    return new Foreign(err);
  }

  /**
   * Error that was not produced by the taxonomy and only exposes its text.
   *
   * @param error foreign error; never {@code null}
   */
  record Foreign(Throwable error) implements ErrorVariant {
    public Foreign {
      Objects.requireNonNull(error, "error");
    }
  }

  /**
   * Error recognised as a taxonomy kind.
   *
   * @param error classified error; never {@code null}
   */
  record Classified(Canonical error) implements ErrorVariant {
    public Classified {
      Objects.requireNonNull(error, "error");
    }
  }

  /**
   * Error standing in for zero or more failures.
   *
   * @param error aggregate; never {@code null}
   */
  record Aggregate(Group error) implements ErrorVariant {
    public Aggregate {
      Objects.requireNonNull(error, "error");
    }
  }
}
