package ca.gc.cra.errors.domain;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Optional diagnostic payload attached to an error instance.
 * <p><strong>Why:</strong> Carries the context operators need (retry delay, runbook links, stack trace, labels)
 * without widening the identity of the error kind.</p>
 * <p><strong>Role:</strong> Domain value object composed by {@link Canonical}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a retry {@link Duration}, ordered links, a stack trace string and ordered tags.</li>
 *   <li>Produce modified copies through {@code with*} builders; links and tags only grow.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; lists are copied on construction and exposed unmodifiable.</p>
 * <p><strong>Performance:</strong> Each builder copies at most one list.</p>
 * <p><strong>Observability:</strong> Serialised under {@code extras} by the JSON codec; no logging.</p>
 *
 * @since 0.1.0
 */
public final class Extras implements Serializable {
  private static final long serialVersionUID = 1L;

  /** Extras with every field at its zero value. */
  public static final Extras EMPTY = new Extras(Duration.ZERO, List.of(), "", List.of());

  private final Duration delay;
  private final List<String> links;
  private final String stackTrace;
  private final List<String> tags;

  private Extras(Duration delay, List<String> links, String stackTrace, List<String> tags) {
    this.delay = delay == null ? Duration.ZERO : delay;
    this.links = List.copyOf(links);
    this.stackTrace = stackTrace == null ? "" : stackTrace;
    this.tags = List.copyOf(tags);
  }

  /**
   * Creates extras from explicit values.
   *
   * @param delay retry delay; {@code null} means {@link Duration#ZERO}
   * @param links documentation links; must not be {@code null} nor contain {@code null}
   * @param stackTrace captured stack trace; {@code null} means empty
   * @param tags free-form labels; must not be {@code null} nor contain {@code null}
   * @return new extras
   * @throws NullPointerException if a list or one of its elements is {@code null}
   */
  public static Extras of(Duration delay, List<String> links, String stackTrace, List<String> tags) {
    return new Extras(delay, Objects.requireNonNull(links, "links"), stackTrace,
        Objects.requireNonNull(tags, "tags"));
  }

  /** Duration to wait before retrying the failed operation; {@link Duration#ZERO} when unset. */
  public Duration delay() {
    return delay;
  }

  /** Links to documentation about the error, in insertion order. */
  public List<String> links() {
    return links;
  }

  /** Stack trace text; empty when unset. */
  public String stackTrace() {
    return stackTrace;
  }

  /** Labels used to categorise the error, in insertion order. */
  public List<String> tags() {
    return tags;
  }

  /**
   * Returns a copy with the retry delay replaced.
   *
   * @param newDelay delay to carry; {@code null} resets to zero
   * @return new extras; the receiver is unchanged
   */
  public Extras withDelay(Duration newDelay) {
    return new Extras(newDelay, links, stackTrace, tags);
  }

  /**
   * Returns a copy with the stack trace replaced.
   *
   * @param trace stack trace text; {@code null} resets to empty
   * @return new extras; the receiver is unchanged
   */
  public Extras withStackTrace(String trace) {
    return new Extras(delay, links, trace, tags);
  }

  /**
   * Returns a copy with {@code more} appended to the links.
   *
   * @param more links to append; elements must not be {@code null}
   * @return new extras; the receiver is unchanged
   */
  public Extras withLinks(String... more) {
    return new Extras(delay, append(links, more), stackTrace, tags);
  }

  /**
   * Returns a copy with {@code more} appended to the tags.
   *
   * @param more tags to append; elements must not be {@code null}
   * @return new extras; the receiver is unchanged
   */
  public Extras withTags(String... more) {
    return new Extras(delay, links, stackTrace, append(tags, more));
  }

  /**
   * Reports whether every field holds its zero value.
   *
   * @return {@code true} when equal to {@link #EMPTY}
   */
  public boolean isEmpty() {
    return delay.isZero() && links.isEmpty() && stackTrace.isEmpty() && tags.isEmpty();
  }

  private static List<String> append(List<String> base, String[] more) {
    if (more == null || more.length == 0) {
      return base;
    }
    List<String> merged = new ArrayList<>(base.size() + more.length);
    merged.addAll(base);
    merged.addAll(Arrays.asList(more));
    return merged;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Extras other)) {
      return false;
    }
    return delay.equals(other.delay)
        && links.equals(other.links)
        && stackTrace.equals(other.stackTrace)
        && tags.equals(other.tags);
  }

  @Override
  public int hashCode() {
    return Objects.hash(delay, links, stackTrace, tags);
  }

  @Override
  public String toString() {
    return "Extras{delay=" + delay + ", links=" + links + ", stackTrace=" + (stackTrace.isEmpty() ? "" : "<present>")
        + ", tags=" + tags + '}';
  }
}
