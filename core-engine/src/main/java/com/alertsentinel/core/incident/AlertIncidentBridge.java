package com.alertsentinel.core.incident;

import com.alertsentinel.core.alerting.AlertCallback;
import com.alertsentinel.core.alerting.AlertRuleEngine;
import com.alertsentinel.core.error.NotFoundException;
import com.alertsentinel.core.model.Alert;
import com.alertsentinel.core.model.AlertRule;
import com.alertsentinel.core.model.SecurityIncident;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns alerts of rules that name an incident kind into incidents.
 *
 * <p>
 * The first alert of such a rule opens an incident whose source is
 * {@code alert-rule:<ruleId>}. While that incident stays open, later alerts
 * of the same rule are attached to it as evidence. The subject comes from
 * the {@value #SUBJECT_TAG} and {@value #SUBJECT_ROLE_TAG} sample tags.
 * Calls are serialised so two concurrent alerts of one rule cannot open two
 * incidents.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertIncidentBridge implements AlertCallback {

    private static final Logger LOG = LoggerFactory.getLogger(AlertIncidentBridge.class);

    public static final String SUBJECT_TAG = "subject";
    public static final String SUBJECT_ROLE_TAG = "subject_role";
    public static final String SOURCE_PREFIX = "alert-rule:";

    private final AlertRuleEngine alertEngine;
    private final IncidentRegistry registry;

    public AlertIncidentBridge(AlertRuleEngine alertEngine, IncidentRegistry registry) {
        this.alertEngine = Objects.requireNonNull(alertEngine, "alertEngine must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    @Override
    public synchronized void onAlert(Alert alert) {
        AlertRule rule;
        try {
            rule = alertEngine.getRule(alert.getRuleId());
        } catch (NotFoundException e) {
            LOG.debug("Rule {} was removed before its alert {} was bridged", alert.getRuleId(), alert.getAlertId());
            return;
        }
        if (rule.getIncidentKind() == null) {
            return;
        }

        String source = SOURCE_PREFIX + rule.getRuleId();
        String evidence = "alert " + alert.getAlertId() + ": " + alert.getMessage();
        Optional<SecurityIncident> open = registry.findOpenBySource(source);
        if (open.isPresent()) {
            registry.addEvidence(open.get().getIncidentId(), evidence);
            LOG.debug("Alert {} linked to open incident {}", alert.getAlertId(), open.get().getIncidentId());
            return;
        }

        String subject = alert.getTags().get(SUBJECT_TAG);
        IncidentRequest request = IncidentRequest.builder()
                .kind(rule.getIncidentKind())
                .severity(alert.getSeverity().toIncidentSeverity())
                .title(rule.getName() + " on " + alert.getMetricName())
                .description(alert.getMessage())
                .source(source)
                .affectedSubjects(subject != null ? List.of(subject) : List.of())
                .subjectId(subject)
                .subjectRole(alert.getTags().get(SUBJECT_ROLE_TAG))
                .evidence(List.of(evidence))
                .build();
        SecurityIncident created = registry.create(request);
        LOG.info("Alert {} opened incident {}", alert.getAlertId(), created.getIncidentId());
    }
}
