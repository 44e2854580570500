/**
 * Timer-driven escalation of open incidents and stale alerts.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.escalation;
