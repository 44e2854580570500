/**
 * Kafka egress for fired alerts and notification requests.
 */
package com.alertsentinel.service.publish;
