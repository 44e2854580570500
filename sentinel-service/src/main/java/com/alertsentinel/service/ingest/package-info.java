/**
 * Kafka ingress: telemetry samples and detection reports decoded from JSON.
 */
package com.alertsentinel.service.ingest;
