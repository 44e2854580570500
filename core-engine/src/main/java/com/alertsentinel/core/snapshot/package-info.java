/**
 * Export and import of the full in-memory state for backup and restore.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.snapshot;
