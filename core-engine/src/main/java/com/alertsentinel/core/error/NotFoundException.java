package com.alertsentinel.core.error;

/**
 * Operation addressed an unknown rule, alert or incident id.
 *
 * @since 1.0.0
 */
public class NotFoundException extends SentinelException {

    private static final long serialVersionUID = 1L;

    private final String kind;
    private final String id;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
        this.kind = kind;
        this.id = id;
    }

    /**
     * @return what was looked up, e.g. {@code "incident"}
     */
    public String getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }
}
