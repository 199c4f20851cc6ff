package ca.gc.cra.errors.logging;

import ca.gc.cra.errors.domain.Canonical;
import ca.gc.cra.errors.domain.ErrorVariant;
import ca.gc.cra.errors.domain.Errors;
import ca.gc.cra.errors.domain.Group;
import java.util.Objects;
import org.slf4j.Logger;

/**
 * <strong>What:</strong> Emits errors through an SLF4J logger as stable key/value lines.
 * <p><strong>Why:</strong> Operators filter on error keys and flags; the message alone is not machine-friendly.</p>
 * <p><strong>Role:</strong> Adapter used by callers at the edge of an operation; the domain types never log.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Log classified errors at WARN with key, flags, classification booleans, message and cause.</li>
 *   <li>Log foreign errors as {@link Canonical#UNKNOWN} wrappers, and groups member by member.</li>
 *   <li>At DEBUG, add the verbose cause chain and the (truncated) stack trace from extras.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; thread-safety follows the supplied logger.</p>
 * <p><strong>Performance:</strong> Verbose rendering only happens when DEBUG is enabled.</p>
 *
 * @since 0.1.0
 * @see Logs
 */
public final class ErrorLogs {
  /** Byte budget applied to stack traces when none is given. */
  public static final int DEFAULT_STACK_TRACE_BYTES = 4096;

  private ErrorLogs() {
    // Utility
  }

  /**
   * Logs an error using {@link #DEFAULT_STACK_TRACE_BYTES}.
   *
   * @param logger destination; must not be {@code null}
   * @param err error to log; {@code null} is ignored
   */
  public static void log(Logger logger, Throwable err) {
    log(logger, err, DEFAULT_STACK_TRACE_BYTES);
  }

  /**
   * Logs an error.
   *
   * @param logger destination; must not be {@code null}
   * @param err error to log; {@code null} is ignored
   * @param maxStackTraceBytes UTF-8 budget for stack traces carried in extras; must be positive
   * @throws IllegalArgumentException if {@code maxStackTraceBytes} is not positive
   */
  public static void log(Logger logger, Throwable err, int maxStackTraceBytes) {
    Objects.requireNonNull(logger, "logger");
    if (maxStackTraceBytes <= 0) {
      throw new IllegalArgumentException("maxStackTraceBytes must be positive");
    }
    if (err == null) {
      return;
    }
    ErrorVariant variant = ErrorVariant.classify(err);
    if (variant instanceof ErrorVariant.Aggregate aggregate) {
      Group group = aggregate.error();
      logger.warn("error.group size={}", group.size());
      for (Canonical member : group) {
        logCanonical(logger, member, maxStackTraceBytes);
      }
    } else if (variant instanceof ErrorVariant.Classified classified) {
      logCanonical(logger, classified.error(), maxStackTraceBytes);
    } else {
      logCanonical(logger, Canonical.UNKNOWN.wrap(variant.error()), maxStackTraceBytes);
    }
  }

  private static void logCanonical(Logger logger, Canonical error, int maxStackTraceBytes) {
    String cause = error.wrapped().map(Errors::render).orElse("");
    logger.warn("error key={} flags={} retryable={} timeout={} message={} cause={}",
        error.key(), error.flags(), error.isRetryable(), error.isTimeout(), error.message(), cause);
    if (!logger.isDebugEnabled()) {
      return;
    }
    logger.debug("error.chain key={} chain={}", error.key(), String.format("%#s", error));
    String trace = error.extras().stackTrace();
    if (!trace.isEmpty()) {
      logger.debug("error.stack key={} trace={}", error.key(), Logs.truncate(trace, maxStackTraceBytes));
    }
  }
}
