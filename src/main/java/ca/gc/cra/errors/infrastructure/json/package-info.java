/**
 * JSON wire format for canonical errors and groups, written with the Jackson streaming API.
 * <p><strong>Concurrency:</strong> Codec instances are stateless and safe to share.
 * <p><strong>Security:</strong> Wrapped causes are never serialised; extras may carry stack traces, so payloads
 * leaving a trust boundary should be reviewed by the caller.
 */
package ca.gc.cra.errors.infrastructure.json;
