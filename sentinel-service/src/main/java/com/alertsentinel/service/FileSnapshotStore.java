package com.alertsentinel.service;

import com.alertsentinel.core.error.SentinelException;
import com.alertsentinel.core.snapshot.SnapshotCodec;
import com.alertsentinel.core.snapshot.SnapshotStore;
import com.alertsentinel.core.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SnapshotStore} backed by a single JSON file.
 *
 * <p>
 * A save writes to a sibling temporary file first and then moves it over the
 * target, so a crash mid-write leaves the previous snapshot intact.
 * </p>
 *
 * @since 1.0.0
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotStore.class);

    private final Path path;
    private final SnapshotCodec codec;

    public FileSnapshotStore(Path path) {
        this(path, new SnapshotCodec());
    }

    public FileSnapshotStore(Path path, SnapshotCodec codec) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    @Override
    public void save(StateSnapshot snapshot) {
        byte[] json = codec.encode(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Path parent = path.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(tmp, json);
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new SentinelException("Failed to write snapshot to " + path, e);
        }
        LOG.info("Snapshot written to {} ({} bytes)", path, json.length);
    }

    /**
     * @throws com.alertsentinel.core.error.ValidationException if the file
     *                                                         holds no valid
     *                                                         snapshot
     */
    @Override
    public Optional<StateSnapshot> load() {
        if (!Files.exists(path)) {
            LOG.info("No snapshot at {}", path);
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(Files.readAllBytes(path)));
        } catch (IOException e) {
            throw new SentinelException("Failed to read snapshot from " + path, e);
        }
    }

    public Path getPath() {
        return path;
    }
}
