/**
 * Threshold evaluation with cooldown, hourly cap, debounce and adaptive
 * thresholds.
 *
 * <p>
 * The entry point is {@link com.alertsentinel.core.alerting.AlertRuleEngine}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.alerting;
