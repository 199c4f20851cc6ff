package ca.gc.cra.errors.config;

import ca.gc.cra.errors.domain.Canonical;
import ca.gc.cra.errors.domain.Code;
import ca.gc.cra.errors.domain.Errors;
import ca.gc.cra.errors.domain.Namespace;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable catalogue of the error kinds declared for one namespace.
 * <p><strong>Why:</strong> Lets taxonomy authors keep kinds in configuration and look them up by code at runtime.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction; safe to share.</p>
 *
 * @since 0.1.0
 * @see TaxonomyLoader
 */
public final class Taxonomy {
  private final Namespace namespace;
  private final Map<String, Canonical> kinds;

  /**
   * Creates a catalogue.
   *
   * @param namespace namespace shared by every kind; must not be {@code null}
   * @param kinds kinds keyed by code, in declaration order; must not be {@code null}
   * @throws IllegalArgumentException if a kind's code or namespace disagrees with its entry
   */
  public Taxonomy(Namespace namespace, Map<String, Canonical> kinds) {
    this.namespace = Objects.requireNonNull(namespace, "namespace");
    Map<String, Canonical> copy = new LinkedHashMap<>();
    for (Map.Entry<String, Canonical> entry : Objects.requireNonNull(kinds, "kinds").entrySet()) {
      Canonical kind = Objects.requireNonNull(entry.getValue(), entry.getKey());
      if (!kind.code().value().equals(entry.getKey()) || !kind.namespace().equals(namespace)) {
        throw new IllegalArgumentException("kind " + kind.key() + " does not belong under "
            + Canonical.key(namespace, kind.code()));
      }
      copy.put(entry.getKey(), kind);
    }
    this.kinds = Collections.unmodifiableMap(copy);
  }

  /** Namespace of every kind in the catalogue. */
  public Namespace namespace() {
    return namespace;
  }

  /**
   * Looks a kind up by code.
   *
   * @param code error code
   * @return the declared kind, or empty
   */
  public Optional<Canonical> kind(String code) {
    return Optional.ofNullable(kinds.get(code));
  }

  /**
   * Looks a kind up by code, failing when it is not declared.
   *
   * @param code error code
   * @return the declared kind
   * @throws IllegalArgumentException if no kind uses {@code code}
   */
  public Canonical require(String code) {
    return kind(code).orElseThrow(() ->
        new IllegalArgumentException("Unknown error code " + Canonical.key(namespace, Code.of(code))));
  }

  /** Declared kinds in declaration order. */
  public Collection<Canonical> kinds() {
    return kinds.values();
  }

  /** Number of declared kinds. */
  public int size() {
    return kinds.size();
  }

  /**
   * Reports whether {@code err}, or any of its causes, matches one of the declared kinds.
   *
   * @param err error to test; may be {@code null}
   * @return {@code true} on a match
   */
  public boolean contains(Throwable err) {
    if (err == null) {
      return false;
    }
    for (Canonical kind : kinds.values()) {
      if (Errors.is(err, kind)) {
        return true;
      }
    }
    return false;
  }
}
