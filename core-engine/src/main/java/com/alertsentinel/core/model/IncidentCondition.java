package com.alertsentinel.core.model;

import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Condition predicate of a {@link ResponseRule}, evaluated against incident
 * fields. All clauses must hold; an empty condition always holds.
 *
 * <p>
 * Supported clauses:
 * </p>
 * <ul>
 * <li>{@code source}: incident source equals the value</li>
 * <li>{@code subjectRole}: subject role equals the value (case-insensitive)</li>
 * <li>{@code subjectId}: subject id equals the value</li>
 * <li>{@code titleContains}: title contains the value (case-insensitive)</li>
 * <li>{@code minAffectedSubjects}: at least this many affected subjects</li>
 * <li>{@code evidenceRequired}: when {@code true}, at least one evidence item</li>
 * </ul>
 *
 * <p>
 * Clauses are parsed when the rule is loaded; an unknown clause or a value of
 * the wrong type is a {@link ValidationException}.
 * </p>
 *
 * @since 1.0.0
 */
public final class IncidentCondition implements Predicate<SecurityIncident> {

    private static final IncidentCondition ALWAYS = new IncidentCondition(Collections.emptyMap(), List.of());

    private final Map<String, Object> clauses;
    private final List<Predicate<SecurityIncident>> predicates;

    private IncidentCondition(Map<String, Object> clauses, List<Predicate<SecurityIncident>> predicates) {
        this.clauses = clauses;
        this.predicates = predicates;
    }

    public static IncidentCondition always() {
        return ALWAYS;
    }

    /**
     * Parse a clause map.
     *
     * @param raw clause name to expected value; {@code null} or empty means
     *            always true
     * @return the parsed condition
     * @throws ValidationException on an unknown clause or ill-typed value
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static IncidentCondition parse(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return ALWAYS;
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        List<Predicate<SecurityIncident>> predicates = new ArrayList<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            predicates.add(clause(key, value));
            copy.put(key, value);
        }
        return new IncidentCondition(Collections.unmodifiableMap(copy), List.copyOf(predicates));
    }

    @Override
    public boolean test(SecurityIncident incident) {
        for (Predicate<SecurityIncident> p : predicates) {
            if (!p.test(incident)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the clause map this condition was parsed from
     */
    @JsonValue
    public Map<String, Object> getClauses() {
        return clauses;
    }

    private static Predicate<SecurityIncident> clause(String key, Object value) {
        String normalised = key == null ? "" : key.replace("_", "").toLowerCase(Locale.ROOT);
        return switch (normalised) {
            case "source" -> {
                String expected = requireString(key, value);
                yield incident -> expected.equals(incident.getSource());
            }
            case "subjectrole" -> {
                String expected = requireString(key, value);
                yield incident -> expected.equalsIgnoreCase(incident.getSubjectRole());
            }
            case "subjectid" -> {
                String expected = requireString(key, value);
                yield incident -> expected.equals(incident.getSubjectId());
            }
            case "titlecontains" -> {
                String expected = requireString(key, value).toLowerCase(Locale.ROOT);
                yield incident -> incident.getTitle() != null
                        && incident.getTitle().toLowerCase(Locale.ROOT).contains(expected);
            }
            case "minaffectedsubjects" -> {
                if (!(value instanceof Number n) || n.intValue() < 0) {
                    throw new ValidationException(
                            "Condition '" + key + "' requires a non-negative number, got: " + value);
                }
                int min = n.intValue();
                yield incident -> incident.getAffectedSubjects().size() >= min;
            }
            case "evidencerequired" -> {
                if (!(value instanceof Boolean required)) {
                    throw new ValidationException("Condition '" + key + "' requires a boolean, got: " + value);
                }
                yield incident -> !required || !incident.getEvidence().isEmpty();
            }
            default -> throw new ValidationException("Unknown condition '" + key
                    + "'. Supported: source, subjectRole, subjectId, titleContains, "
                    + "minAffectedSubjects, evidenceRequired");
        };
    }

    private static String requireString(String key, Object value) {
        if (!(value instanceof String s) || s.isBlank()) {
            throw new ValidationException("Condition '" + key + "' requires a non-blank string, got: " + value);
        }
        return s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof IncidentCondition that))
            return false;
        return clauses.equals(that.clauses);
    }

    @Override
    public int hashCode() {
        return Objects.hash(clauses);
    }

    @Override
    public String toString() {
        return "IncidentCondition" + clauses;
    }
}
