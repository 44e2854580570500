package com.alertsentinel.core.response;

import com.alertsentinel.core.error.CollaboratorException;
import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.SecurityIncident;

/**
 * Boundary to whatever actually isolates a device, quarantines a file or
 * blocks a sender.
 *
 * @since 1.0.0
 */
public interface EnforcementGateway {

    /**
     * @param action   one of {@code ISOLATE}, {@code QUARANTINE},
     *                 {@code BLOCK}
     * @param incident incident the action is taken for
     * @return {@code true} if the side effect was applied
     * @throws CollaboratorException if the gateway failed
     */
    boolean apply(ResponseAction action, SecurityIncident incident);
}
