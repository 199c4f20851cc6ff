/**
 * <strong>Purpose:</strong> Emits classified errors through SLF4J with stable key/value fields.
 * <p><strong>Role:</strong> Adapter between the error taxonomy and whatever logging backend the host binds
 * (Logback in this build's tests).
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe when invoked from concurrent callers.
 * <p><strong>Security:</strong> Stack traces from extras are truncated before emission.
 *
 * @since 0.1.0
 */
package ca.gc.cra.errors.logging;
