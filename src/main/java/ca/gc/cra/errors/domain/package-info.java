/**
 * <strong>Purpose:</strong> Canonical error taxonomy: classified errors, their flags and extras, and groups that
 * aggregate many failures into one.
 * <p><strong>Role:</strong> Domain layer with no dependencies beyond the JDK; adapters in
 * {@code ca.gc.cra.errors.config}, {@code ca.gc.cra.errors.infrastructure.json} and
 * {@code ca.gc.cra.errors.logging} build on it.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.errors.domain.Canonical}, {@link ca.gc.cra.errors.domain.Flags}
 * and {@link ca.gc.cra.errors.domain.Extras} are immutable; {@link ca.gc.cra.errors.domain.Group} expects a single
 * accumulating owner.
 * <p><strong>Observability:</strong> Nothing here logs, retries or terminates; classification is advisory metadata.
 *
 * @since 0.1.0
 */
package ca.gc.cra.errors.domain;
