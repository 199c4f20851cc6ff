package ca.gc.cra.errors.domain;

import java.io.Serializable;

/**
 * <strong>What:</strong> Eight-bit classification mask attached to every {@link Canonical} error.
 * <p><strong>Why:</strong> Lets callers ask cross-cutting questions (retry? deadline?) without parsing messages.</p>
 * <p><strong>Role:</strong> Domain value object composed by {@link Canonical}; bits above {@link #TIMEOUT} are
 * reserved for extension.</p>
 * <p><strong>Thread-safety:</strong> Immutable; every operation returns a new instance.</p>
 * <p><strong>Performance:</strong> Single {@code int} field; constant-time bit operations.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders the mask in base 2 for logs and the wire format.</p>
 *
 * @since 0.1.0
 */
public final class Flags implements Serializable {
  private static final long serialVersionUID = 1L;

  /** No classification bits set. */
  public static final Flags NONE = new Flags(0);
  /** Error was not produced by the taxonomy; a foreign error passed through unclassified. */
  public static final Flags UNKNOWN = new Flags(1);
  /** Failed operation may be safely retried. */
  public static final Flags RETRYABLE = new Flags(1 << 1);
  /** Failure was caused by a deadline or timeout. */
  public static final Flags TIMEOUT = new Flags(1 << 2);

  private static final int MASK = 0xFF;

  private final int bits;

  private Flags(int bits) {
    this.bits = bits;
  }

  /**
   * Creates a mask from its numeric value.
   *
   * @param value unsigned mask in {@code [0,255]}
   * @return flags carrying exactly {@code value}
   * @throws IllegalArgumentException if {@code value} does not fit in eight bits
   */
  public static Flags of(int value) {
    if ((value & ~MASK) != 0) {
      throw new IllegalArgumentException("flags must be within [0,255]: " + value);
    }
    return switch (value) {
      case 0 -> NONE;
      case 1 -> UNKNOWN;
      case 2 -> RETRYABLE;
      case 4 -> TIMEOUT;
      default -> new Flags(value);
    };
  }

  /**
   * Parses the base-2 rendering produced by {@link #toString()}.
   *
   * @param binary digits {@code 0}/{@code 1}, no prefix; must not be {@code null}
   * @return parsed flags
   * @throws IllegalArgumentException if the text is not a binary number within eight bits
   */
  public static Flags parse(String binary) {
    if (binary == null || binary.isEmpty()) {
      throw new IllegalArgumentException("flags text must not be empty");
    }
    for (int i = 0; i < binary.length(); i++) {
      char c = binary.charAt(i);
      if (c != '0' && c != '1') {
        throw new IllegalArgumentException("flags must only contain the digits 0 and 1: " + binary);
      }
    }
    try {
      return of(Integer.parseInt(binary, 2));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("flags must be a base-2 number: " + binary, ex);
    }
  }

  /**
   * Returns the numeric mask.
   *
   * @return unsigned value in {@code [0,255]}
   */
  public int value() {
    return bits;
  }

  /**
   * Checks whether any of the given bits are set.
   *
   * @param other bits to test; must not be {@code null}
   * @return {@code true} when the masks overlap
   */
  public boolean has(Flags other) {
    return (bits & other.bits) != 0;
  }

  /** Returns a copy with {@code other} bits switched on. */
  public Flags set(Flags other) {
    return of(bits | other.bits);
  }

  /** Returns a copy with {@code other} bits switched off. */
  public Flags clear(Flags other) {
    return of(bits & ~other.bits);
  }

  /** Returns a copy with {@code other} bits flipped. */
  public Flags toggle(Flags other) {
    return of(bits ^ other.bits);
  }

  /**
   * Reports whether no bits are set.
   *
   * @return {@code true} for the zero mask
   */
  public boolean isEmpty() {
    return bits == 0;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Flags other && other.bits == bits;
  }

  @Override
  public int hashCode() {
    return bits;
  }

  private Object readResolve() {
    return of(bits);
  }

  /**
   * Renders the mask in base 2 without prefix or padding, e.g. {@code 110} for retryable and timeout.
   */
  @Override
  public String toString() {
    return Integer.toBinaryString(bits);
  }
}
