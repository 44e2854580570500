package com.alertsentinel.service.ingest;

import com.alertsentinel.core.error.ValidationException;
import com.alertsentinel.core.incident.IncidentRequest;
import com.alertsentinel.core.model.IncidentKind;
import com.alertsentinel.core.model.IncidentSeverity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wire shape of one detection report on the detection topic.
 *
 * <pre>
 * {"kind":"malware","severity":"high","title":"Trojan found","source":"av-scanner",
 *  "subjectId":"device-7","subjectRole":"child","affectedSubjects":["device-7"],
 *  "evidence":["hash=abc"]}
 * </pre>
 *
 * @since 1.0.0
 */
public class DetectionMessage {

    private String kind;
    private String severity;
    private String title;
    private String description;
    private String source;
    private String subjectId;
    private String subjectRole;
    private Set<String> affectedSubjects = new LinkedHashSet<>();
    private List<String> evidence = new ArrayList<>();

    /**
     * @throws ValidationException if kind or severity is unknown, or a
     *                             required field is missing
     */
    public IncidentRequest toRequest() {
        return IncidentRequest.builder()
                .kind(IncidentKind.parse(kind))
                .severity(IncidentSeverity.parse(severity))
                .title(title)
                .description(description)
                .source(source)
                .subjectId(subjectId)
                .subjectRole(subjectRole)
                .affectedSubjects(affectedSubjects)
                .evidence(evidence)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters / Setters (Jackson)
    // ---------------------------------------------------------------

    public String getKind() {
        return kind;
    }

    public void setKind(String kind) {
        this.kind = kind;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getSubjectId() {
        return subjectId;
    }

    public void setSubjectId(String subjectId) {
        this.subjectId = subjectId;
    }

    public String getSubjectRole() {
        return subjectRole;
    }

    public void setSubjectRole(String subjectRole) {
        this.subjectRole = subjectRole;
    }

    public Set<String> getAffectedSubjects() {
        return affectedSubjects;
    }

    public void setAffectedSubjects(Set<String> affectedSubjects) {
        this.affectedSubjects = affectedSubjects != null ? new LinkedHashSet<>(affectedSubjects)
                : new LinkedHashSet<>();
    }

    public List<String> getEvidence() {
        return evidence;
    }

    public void setEvidence(List<String> evidence) {
        this.evidence = evidence != null ? new ArrayList<>(evidence) : new ArrayList<>();
    }
}
