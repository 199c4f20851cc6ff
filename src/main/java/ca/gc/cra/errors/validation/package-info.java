/**
 * Identifier checks applied while loading taxonomy catalogues.
 *
 * @since 0.1.0
 */
package ca.gc.cra.errors.validation;
