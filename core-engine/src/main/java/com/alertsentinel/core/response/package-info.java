/**
 * Rule-matched automatic response to security incidents and the escalation
 * action shared with the scheduler.
 *
 * @since 1.0.0
 */
package com.alertsentinel.core.response;
