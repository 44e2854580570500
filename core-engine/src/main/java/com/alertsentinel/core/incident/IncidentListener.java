package com.alertsentinel.core.incident;

import com.alertsentinel.core.model.SecurityIncident;

/**
 * Notified synchronously after an incident is created, once the registry
 * lock is released.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface IncidentListener {

    void onIncidentCreated(SecurityIncident incident);
}
