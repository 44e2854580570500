/**
 * Security incident lifecycle, per-subject history and summaries.
 *
 * <p>
 * {@link com.alertsentinel.core.incident.IncidentRegistry} is the single
 * owner of incident state; other components change incidents only through
 * its methods.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.incident;
