/**
 * Error taxonomy of the core.
 *
 * <p>
 * Validation and not-found errors are surfaced to the caller immediately;
 * collaborator errors are absorbed at the call site and counted; lock timeouts
 * fail fast instead of blocking ingestion.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.error;
