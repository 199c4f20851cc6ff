package ca.gc.cra.errors.domain;

import java.io.Serializable;
import java.util.Objects;

/**
 * Machine-readable identifier of an error kind, unique within a {@link Namespace}.
 *
 * @param value opaque identifier; never {@code null}, may be empty for the zero value
 * @since 0.1.0
 */
public record Code(String value) implements Serializable {
  /** Empty code carried by {@link Canonical#ZERO}. */
  public static final Code NONE = new Code("");

  /**
   * Validates the component.
   *
   * @throws NullPointerException if {@code value} is {@code null}
   */
  public Code {
    Objects.requireNonNull(value, "code");
  }

  /**
   * Wraps a raw identifier.
   *
   * @param value identifier text
   * @return code instance
   */
  public static Code of(String value) {
    return value == null || value.isEmpty() ? NONE : new Code(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
