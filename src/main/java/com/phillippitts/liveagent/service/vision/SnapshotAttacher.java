package com.phillippitts.liveagent.service.vision;

import com.phillippitts.liveagent.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Turns the latest snapshot into an inline image URL if it is fresh enough.
 */
public final class SnapshotAttacher {

    private static final Logger LOG = LogManager.getLogger(SnapshotAttacher.class);

    private final VisionSnapshotStore store;
    private final long maxAgeNanos;
    private final SnapshotEncoder encoder;
    private final LongSupplier nanoClock;

    /**
     * @param maxAge snapshots older than this are rejected; zero accepts any age
     */
    public SnapshotAttacher(VisionSnapshotStore store, Duration maxAge, SnapshotEncoder encoder,
                            LongSupplier nanoClock) {
        this.store = Objects.requireNonNull(store, "store");
        this.maxAgeNanos = maxAge.toNanos();
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
    }

    public Attachment resolve() {
        Optional<VisionSnapshot> latest = store.latest();
        if (latest.isEmpty()) {
            return Attachment.none(AttachmentOutcome.NO_SNAPSHOT);
        }
        VisionSnapshot snapshot = latest.get();
        long ageNanos = snapshot.ageNanos(nanoClock.getAsLong());
        if (maxAgeNanos > 0 && ageNanos > maxAgeNanos) {
            LOG.debug("Snapshot is {} ms old (max {} ms); turn stays text-only",
                    TimeUtils.nanosToMillis(ageNanos), TimeUtils.nanosToMillis(maxAgeNanos));
            return Attachment.none(AttachmentOutcome.STALE);
        }
        return encoder.encodeDataUrl(snapshot)
                .map(url -> new Attachment(AttachmentOutcome.ATTACHED, url))
                .orElseGet(() -> Attachment.none(AttachmentOutcome.ENCODE_FAILED));
    }

    /**
     * @param outcome  resolution result
     * @param imageUrl data URL when {@code outcome} is {@link AttachmentOutcome#ATTACHED}, otherwise {@code null}
     */
    public record Attachment(AttachmentOutcome outcome, String imageUrl) {

        static Attachment none(AttachmentOutcome outcome) {
            return new Attachment(outcome, null);
        }

        public boolean attached() {
            return imageUrl != null;
        }
    }
}
