package com.alertsentinel.core.snapshot;

import com.alertsentinel.core.error.SentinelException;
import com.alertsentinel.core.error.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding of {@link StateSnapshot}s.
 *
 * <p>
 * Instants are written as ISO-8601 strings, so a snapshot round-trips
 * losslessly and stays readable.
 * </p>
 *
 * @since 1.0.0
 */
public final class SnapshotCodec {

    private final ObjectMapper mapper;

    public SnapshotCodec() {
        this.mapper = newObjectMapper();
    }

    /**
     * @return a mapper configured the way every JSON surface of the project
     *         expects
     */
    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    public byte[] encode(StateSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
        } catch (JsonProcessingException e) {
            throw new SentinelException("Failed to encode state snapshot", e);
        }
    }

    /**
     * @throws ValidationException if the bytes are not a snapshot of a
     *                             supported version
     */
    public StateSnapshot decode(byte[] json) {
        Objects.requireNonNull(json, "json must not be null");
        StateSnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, StateSnapshot.class);
        } catch (IOException e) {
            throw new ValidationException("Malformed state snapshot: " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new ValidationException("Empty state snapshot");
        }
        if (snapshot.getVersion() != StateSnapshot.CURRENT_VERSION) {
            throw new ValidationException("Unsupported snapshot version " + snapshot.getVersion()
                    + ", expected " + StateSnapshot.CURRENT_VERSION);
        }
        return snapshot;
    }
}
