package com.alertsentinel.core.snapshot;

import java.util.Optional;

/**
 * Durable home of the latest {@link StateSnapshot}.
 *
 * @since 1.0.0
 */
public interface SnapshotStore {

    void save(StateSnapshot snapshot);

    /**
     * @return the last saved snapshot, or empty if none was saved yet
     */
    Optional<StateSnapshot> load();
}
