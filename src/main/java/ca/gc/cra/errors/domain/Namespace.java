package ca.gc.cra.errors.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Machine-readable identifier of the logical domain (service, library) an error originates from.
 *
 * @param value opaque identifier; never {@code null}, may be empty for the zero value
 * @since 0.1.0
 */
public record Namespace(String value) implements Serializable {
  /** Empty namespace carried by {@link Canonical#ZERO}. */
  public static final Namespace NONE = new Namespace("");

  public Namespace {
    Objects.requireNonNull(value, "namespace");
  }

  /**
   * Wraps a raw identifier.
   *
   * @param value identifier text
   * @return namespace instance
   */
  public static Namespace of(String value) {
    return value == null || value.isEmpty() ? NONE : new Namespace(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
