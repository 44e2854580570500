/**
 * Alerting and incident-response core.
 *
 * <p>
 * {@link com.alertsentinel.core.SentinelCore} is the facade used by hosts;
 * the sub-packages hold the individual components.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertsentinel.core;
