package ca.gc.cra.errors.domain;

import java.util.Collections;
import java.util.Formattable;
import java.util.FormattableFlags;
import java.util.Formatter;
import java.util.IdentityHashMap;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable classified failure: code, namespace, message, flags, extras and an optional
 * wrapped cause.
 * <p><strong>Why:</strong> Gives callers a machine-readable identity for failures so they can compare errors by kind
 * and react to classification bits rather than message text.</p>
 * <p><strong>Role:</strong> Central domain type. Taxonomy authors declare sentinels (see {@link #builder()});
 * call sites specialise them per failure with {@link #wrap(Throwable)} and the {@code with*} builders.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Identity by code, message, namespace, flags and extras; the wrapped cause never takes part.</li>
 *   <li>Copy-on-write construction; the receiver is never mutated.</li>
 *   <li>Terse single-line rendering, and a verbose rendering that unrolls the whole cause chain.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; stack trace capture and suppression are disabled so no
 * {@link Throwable} state changes after construction. Safe to share between threads.</p>
 * <p><strong>Performance:</strong> Builders allocate one instance; rendering walks the cause chain on demand.</p>
 * <p><strong>Observability:</strong> {@link #getMessage()} never includes a stack trace; use {@code %#s} for the
 * full chain.</p>
 *
 * @since 0.1.0
 * @see Group
 */
public final class Canonical extends RuntimeException implements HasIs, Formattable {
  private static final long serialVersionUID = 1L;

  /** Namespace of the kinds declared by this library. */
  public static final String DEFAULT_NAMESPACE = "cra/errors";

  /** Zero value: every field empty. Wrapping a classified error with it yields a copy of that error. */
  public static final Canonical ZERO =
      new Canonical(Code.NONE, Namespace.NONE, "", Flags.NONE, Extras.EMPTY, null);

  /** Kind used for foreign errors that were wrapped without an explicit classification. */
  public static final Canonical UNKNOWN = builder()
      .code("unknown")
      .namespace(DEFAULT_NAMESPACE)
      .message("wrapped error is unknown")
      .flags(Flags.UNKNOWN)
      .build();

  private final Code code;
  private final Namespace namespace;
  private final String text;
  private final Flags flags;
  private final Extras extras;
  private final Throwable wrapped;

  private Canonical(
      Code code, Namespace namespace, String text, Flags flags, Extras extras, Throwable wrapped) {
    super(null, wrapped, false, false);
    this.code = Objects.requireNonNull(code, "code");
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    this.text = Objects.requireNonNull(text, "message");
    this.flags = Objects.requireNonNull(flags, "flags");
    this.extras = Objects.requireNonNull(extras, "extras");
    this.wrapped = wrapped;
  }

  /**
   * Starts a builder for declaring an error kind.
   *
   * @return empty builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Computes the key that uniquely identifies an error kind.
   *
   * @param namespace namespace of the kind
   * @param code code of the kind
   * @return {@code "<namespace>/<code>"}
   */
  public static String key(Namespace namespace, Code code) {
    return namespace.value() + "/" + code.value();
  }

  /** Machine-readable code. */
  public Code code() {
    return code;
  }

  /** Namespace the error belongs to. */
  public Namespace namespace() {
    return namespace;
  }

  /** Human-readable message, without the namespace/code prefix or cause. */
  public String message() {
    return text;
  }

  /** Classification bits. */
  public Flags flags() {
    return flags;
  }

  /** Diagnostic payload. */
  public Extras extras() {
    return extras;
  }

  /**
   * Returns the wrapped cause.
   *
   * @return the cause given to {@link #wrap(Throwable)}, or empty
   */
  public Optional<Throwable> wrapped() {
    return Optional.ofNullable(wrapped);
  }

  /**
   * Returns the unique identity of this error's kind.
   *
   * @return {@code "<namespace>/<code>"}
   */
  public String key() {
    return key(namespace, code);
  }

  /**
   * Reports whether every field, the cause included, is at its zero value.
   *
   * @return {@code true} for a value equivalent to {@link #ZERO}
   */
  public boolean isZero() {
    return wrapped == null && sameKind(ZERO);
  }

  /** Returns {@code true} when the {@link Flags#RETRYABLE} bit is set. */
  public boolean isRetryable() {
    return flags.has(Flags.RETRYABLE);
  }

  /** Returns {@code true} when the {@link Flags#TIMEOUT} bit is set. */
  public boolean isTimeout() {
    return flags.has(Flags.TIMEOUT);
  }

  /**
   * Reports whether the failure is transient.
   *
   * @return {@code true} when the {@link Flags#UNKNOWN} bit is set
   * @implNote Tests the unknown bit; there is no dedicated transient bit.
   */
  public boolean isTransient() {
    return flags.has(Flags.UNKNOWN);
  }

  /**
   * Compares this error with another by kind.
   *
   * <p>{@code other} is first resolved to a {@link Canonical} through {@link Errors#as(Throwable, Class)}; code,
   * message, namespace, flags and extras must then match. Wrapped causes are ignored.</p>
   *
   * @param other error to compare; may be {@code null}
   * @return {@code true} when both describe the same kind
   */
  public boolean equal(Throwable other) {
    return Errors.as(other, Canonical.class).map(this::sameKind).orElse(false);
  }

  /**
   * Matching hook used by {@link Errors#is(Throwable, Throwable)}; equivalent to {@link #equal(Throwable)}.
   */
  @Override
  public boolean is(Throwable target) {
    return equal(target);
  }

  /**
   * Returns a deep copy: a wrapped {@link Canonical} is copied recursively, a foreign cause is shared.
   *
   * @return independent copy equal to this error
   */
  public Canonical copy() {
    Throwable cause = wrapped instanceof Canonical nested ? nested.copy() : wrapped;
    return new Canonical(code, namespace, text, flags, extras, cause);
  }

  /**
   * Wraps {@code err} in this error's classification.
   *
   * <p>{@code null} returns this error unchanged. When this error {@link #isZero() is zero} and {@code err} resolves
   * to a {@link Canonical}, a {@link #copy()} of that error is returned instead, so call sites can wrap uniformly
   * whether or not {@code err} is already classified.</p>
   *
   * @param err cause to wrap; may be {@code null}
   * @return new error wrapping {@code err}
   */
  public Canonical wrap(Throwable err) {
    if (err == null) {
      return this;
    }
    if (isZero()) {
      Optional<Canonical> classified = Errors.as(err, Canonical.class);
      if (classified.isPresent()) {
        return classified.get().copy();
      }
    }
    return new Canonical(code, namespace, text, flags, extras, err);
  }

  /**
   * Wraps a new error whose message is {@code String.format(format, args)}.
   *
   * <p>When the last argument is a {@link Throwable} it becomes the cause of the formatted error.</p>
   *
   * @param format format string; must not be {@code null}
   * @param args format arguments
   * @return new error wrapping the formatted error
   */
  public Canonical wrapf(String format, Object... args) {
    Objects.requireNonNull(format, "format");
    Throwable cause = null;
    if (args != null && args.length > 0 && args[args.length - 1] instanceof Throwable last) {
      cause = last;
    }
    return wrap(new RuntimeException(String.format(Locale.ROOT, format, args), cause));
  }

  /**
   * Returns a copy carrying {@code newExtras} in place of the current extras.
   *
   * @param newExtras replacement extras; must not be {@code null}
   * @return new error; cause preserved
   */
  public Canonical withExtras(Extras newExtras) {
    return new Canonical(code, namespace, text, flags, newExtras, wrapped);
  }

  /**
   * Returns a copy with {@code more} flags set in addition to the current ones.
   *
   * @param more flags to set; must not be {@code null}
   * @return new error; cause preserved
   */
  public Canonical withFlags(Flags more) {
    return new Canonical(code, namespace, text, flags.set(more), extras, wrapped);
  }

  /**
   * Returns a copy whose extras carry {@code tags} appended to the existing tags.
   *
   * @param tags tags to append
   * @return new error; cause preserved
   */
  public Canonical withTags(String... tags) {
    return new Canonical(code, namespace, text, flags, extras.withTags(tags), wrapped);
  }

  /**
   * Collects this error and every link of its cause chain into a group.
   *
   * <p>The walk follows classified links; a foreign terminal cause is included once (classified as
   * {@link #UNKNOWN} by the group) and ends the walk.</p>
   *
   * @return group whose first member is this error, followed by its causes in wrap order
   */
  public Group asGroup() {
    Group group = Group.of(this);
    Set<Canonical> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Canonical link = this;
    while (link.wrapped != null && seen.add(link)) {
      group.append(link.wrapped);
      Optional<Canonical> next = Errors.as(link.wrapped, Canonical.class);
      if (next.isEmpty()) {
        break;
      }
      link = next.get();
    }
    return group;
  }

  /**
   * Renders {@code "[<namespace>:<code>] <message>"}, followed by {@code "\n-> <cause>"} when a cause is present.
   */
  @Override
  public String getMessage() {
    StringBuilder sb = new StringBuilder();
    sb.append('[').append(namespace.value()).append(':').append(code.value()).append("] ").append(text);
    if (wrapped != null) {
      sb.append("\n-> ").append(Errors.render(wrapped));
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return getMessage();
  }

  /**
   * Supports {@code %s} (single line) and {@code %#s} (the whole {@link #asGroup()} chain). Width, precision,
   * {@code -} and upper-case conversions are honoured.
   */
  @Override
  public void formatTo(Formatter formatter, int flagBits, int width, int precision) {
    boolean verbose = (flagBits & FormattableFlags.ALTERNATE) == FormattableFlags.ALTERNATE;
    String rendered = verbose ? asGroup().getMessage() : getMessage();
    if (precision >= 0 && rendered.length() > precision) {
      rendered = rendered.substring(0, precision);
    }
    if ((flagBits & FormattableFlags.UPPERCASE) == FormattableFlags.UPPERCASE) {
      rendered = rendered.toUpperCase(formatter.locale() == null ? Locale.ROOT : formatter.locale());
    }
    if (width > rendered.length()) {
      String padding = " ".repeat(width - rendered.length());
      boolean left = (flagBits & FormattableFlags.LEFT_JUSTIFY) == FormattableFlags.LEFT_JUSTIFY;
      rendered = left ? rendered + padding : padding + rendered;
    }
    formatter.format("%s", rendered);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Canonical other && sameKind(other);
  }

  @Override
  public int hashCode() {
    return Objects.hash(code, text, namespace, flags, extras);
  }

  private boolean sameKind(Canonical other) {
    return code.equals(other.code)
        && text.equals(other.text)
        && namespace.equals(other.namespace)
        && flags.equals(other.flags)
        && extras.equals(other.extras);
  }

  /**
   * Builder for declaring error kinds; unset fields keep their zero values.
   *
   * <p><strong>Thread-safety:</strong> Not thread-safe; confine to one thread.</p>
   */
  public static final class Builder {
    private Code code = Code.NONE;
    private Namespace namespace = Namespace.NONE;
    private String message = "";
    private Flags flags = Flags.NONE;
    private Extras extras = Extras.EMPTY;
    private Throwable wrapped;

    private Builder() {}

    public Builder code(String value) {
      this.code = Code.of(value);
      return this;
    }

    public Builder code(Code value) {
      this.code = Objects.requireNonNull(value, "code");
      return this;
    }

    public Builder namespace(String value) {
      this.namespace = Namespace.of(value);
      return this;
    }

    public Builder namespace(Namespace value) {
      this.namespace = Objects.requireNonNull(value, "namespace");
      return this;
    }

    public Builder message(String value) {
      this.message = value == null ? "" : value;
      return this;
    }

    public Builder flags(Flags value) {
      this.flags = Objects.requireNonNull(value, "flags");
      return this;
    }

    public Builder extras(Extras value) {
      this.extras = Objects.requireNonNull(value, "extras");
      return this;
    }

    public Builder wrapped(Throwable value) {
      this.wrapped = value;
      return this;
    }

    /**
     * Creates the error.
     *
     * @return new immutable error
     */
    public Canonical build() {
      return new Canonical(code, namespace, message, flags, extras, wrapped);
    }
  }
}
