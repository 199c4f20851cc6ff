/**
 * <strong>Purpose:</strong> Declarative error taxonomies loaded from YAML catalogues.
 * <p><strong>Role:</strong> Configuration layer that turns catalogue entries into
 * {@link ca.gc.cra.errors.domain.Canonical} sentinels grouped in a {@link ca.gc.cra.errors.config.Taxonomy}.
 * <p><strong>Concurrency:</strong> Loading is single-threaded; loaded taxonomies are immutable.
 * <p><strong>Observability:</strong> Loader logs catalogue sources and kind counts at DEBUG via SLF4J.
 *
 * @since 0.1.0
 */
package ca.gc.cra.errors.config;
