/**
 * Domain model of the alerting and incident-response core.
 *
 * <p>
 * Telemetry side:
 * </p>
 * <ul>
 * <li>{@link com.alertsentinel.core.model.MetricSample}: one numeric
 * observation</li>
 * <li>{@link com.alertsentinel.core.model.AlertRule}: threshold rule with
 * anti-spam settings</li>
 * <li>{@link com.alertsentinel.core.model.Alert}: de-duplicated alert</li>
 * </ul>
 * <p>
 * Incident side:
 * </p>
 * <ul>
 * <li>{@link com.alertsentinel.core.model.SecurityIncident}: tracked incident
 * and its lifecycle</li>
 * <li>{@link com.alertsentinel.core.model.ResponseRule}: incident-to-actions
 * mapping</li>
 * <li>{@link com.alertsentinel.core.model.ResponseRecord}: one executed
 * action</li>
 * <li>{@link com.alertsentinel.core.model.EscalationPolicy}: per-severity
 * escalation settings</li>
 * </ul>
 *
 * <p>
 * String-valued types (comparators, actions, kinds, severities) are closed
 * enums resolved when configuration is loaded.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.model;
