package com.alertsentinel.core.incident;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Input to {@link IncidentRegistry#create(IncidentRequest)}: a detection
 * reported by a producer.
 *
 * @since 1.0.0
 */
public final class IncidentRequest {

    private final IncidentKind kind;
    private final IncidentSeverity severity;
    private final String title;
    private final String description;
    private final String source;
    private final Set<String> affectedSubjects;
    private final String subjectId;
    private final String subjectRole;
    private final List<String> evidence;

    private IncidentRequest(Builder b) {
        this.kind = b.kind;
        this.severity = b.severity;
        this.title = b.title;
        this.description = b.description;
        this.source = b.source;
        this.affectedSubjects = new LinkedHashSet<>(b.affectedSubjects);
        this.subjectId = b.subjectId;
        this.subjectRole = b.subjectRole;
        this.evidence = List.copyOf(b.evidence);
    }

    public static Builder builder() {
        return new Builder();
    }

    public IncidentKind getKind() {
        return kind;
    }

    public IncidentSeverity getSeverity() {
        return severity;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getSource() {
        return source;
    }

    public Set<String> getAffectedSubjects() {
        return Collections.unmodifiableSet(affectedSubjects);
    }

    public String getSubjectId() {
        return subjectId;
    }

    public String getSubjectRole() {
        return subjectRole;
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public static final class Builder {
        private IncidentKind kind;
        private IncidentSeverity severity;
        private String title;
        private String description;
        private String source;
        private Set<String> affectedSubjects = new LinkedHashSet<>();
        private String subjectId;
        private String subjectRole;
        private List<String> evidence = new ArrayList<>();

        public Builder kind(IncidentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder severity(IncidentSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder affectedSubjects(Iterable<String> affectedSubjects) {
            this.affectedSubjects = new LinkedHashSet<>();
            if (affectedSubjects != null) {
                affectedSubjects.forEach(this.affectedSubjects::add);
            }
            return this;
        }

        public Builder subjectId(String subjectId) {
            this.subjectId = subjectId;
            return this;
        }

        public Builder subjectRole(String subjectRole) {
            this.subjectRole = subjectRole;
            return this;
        }

        public Builder evidence(List<String> evidence) {
            this.evidence = evidence != null ? new ArrayList<>(evidence) : new ArrayList<>();
            return this;
        }

        /**
         * @throws ValidationException if kind, severity or title is missing
         */
        public IncidentRequest build() {
            List<String> errors = new ArrayList<>();
            if (kind == null) {
                errors.add("'kind' is required");
            }
            if (severity == null) {
                errors.add("'severity' is required");
            }
            if (title == null || title.isBlank()) {
                errors.add("'title' is required");
            }
            if (affectedSubjects.contains(null) || evidence.contains(null)) {
                errors.add("affected subjects and evidence must not contain null");
            }
            if (!errors.isEmpty()) {
                throw new ValidationException("Invalid incident report: " + String.join("; ", errors));
            }
            return new IncidentRequest(this);
        }
    }
}
