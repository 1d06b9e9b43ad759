package com.phillippitts.liveagent.service.vision;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the latest snapshot of one session. Updates replace the whole value atomically.
 */
public final class VisionSnapshotStore {

    private final AtomicReference<VisionSnapshot> latest = new AtomicReference<>();

    public void update(VisionSnapshot snapshot) {
        latest.set(Objects.requireNonNull(snapshot, "snapshot"));
    }

    public Optional<VisionSnapshot> latest() {
        return Optional.ofNullable(latest.get());
    }
}
