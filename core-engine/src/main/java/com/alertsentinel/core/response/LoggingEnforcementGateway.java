package com.alertsentinel.core.response;

import com.alertsentinel.core.model.ResponseAction;
import com.alertsentinel.core.model.SecurityIncident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gateway that records the requested enforcement in the log and reports
 * success.
 *
 * @since 1.0.0
 */
public class LoggingEnforcementGateway implements EnforcementGateway {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingEnforcementGateway.class);

    @Override
    public boolean apply(ResponseAction action, SecurityIncident incident) {
        LOG.info("Enforcement {} requested for incident {} (subjects={})",
                action.wireName(), incident.getIncidentId(), incident.getAffectedSubjects());
        return true;
    }
}
