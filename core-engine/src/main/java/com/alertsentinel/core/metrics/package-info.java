/**
 * Bounded in-memory storage of metric samples and their descriptive
 * statistics.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.metrics;
