package com.phillippitts.liveagent.service.vision;

import com.phillippitts.liveagent.domain.PixelFormat;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class SnapshotAttacherTest {

    private static final long SECOND = 1_000_000_000L;

    private final AtomicLong clock = new AtomicLong(100 * SECOND);
    private final VisionSnapshotStore store = new VisionSnapshotStore();
    private final SnapshotEncoder encoder = new SnapshotEncoder(Runnable::run, 64, 65, Duration.ofSeconds(2));

    private void capture(long atNanos) {
        store.update(new VisionSnapshot(new byte[4 * 4 * 3], PixelFormat.RGB, 4, 4, atNanos));
    }

    @Test
    void noSnapshotYet() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ofSeconds(5), encoder, clock::get);

        assertThat(attacher.resolve().outcome()).isEqualTo(AttachmentOutcome.NO_SNAPSHOT);
    }

    @Test
    void freshSnapshotIsAttachedAsDataUrl() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ofSeconds(5), encoder, clock::get);
        capture(clock.get() - 2 * SECOND);

        SnapshotAttacher.Attachment attachment = attacher.resolve();

        assertThat(attachment.outcome()).isEqualTo(AttachmentOutcome.ATTACHED);
        assertThat(attachment.attached()).isTrue();
        assertThat(attachment.imageUrl()).startsWith("data:image/jpeg;base64,");
    }

    @Test
    void snapshotOlderThanMaxAgeIsRejected() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ofSeconds(5), encoder, clock::get);
        capture(clock.get() - 6 * SECOND);

        SnapshotAttacher.Attachment attachment = attacher.resolve();

        assertThat(attachment.outcome()).isEqualTo(AttachmentOutcome.STALE);
        assertThat(attachment.attached()).isFalse();
    }

    @Test
    void snapshotExactlyAtMaxAgeIsStillAttached() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ofSeconds(5), encoder, clock::get);
        capture(clock.get() - 5 * SECOND);

        assertThat(attacher.resolve().outcome()).isEqualTo(AttachmentOutcome.ATTACHED);

        clock.incrementAndGet();
        assertThat(attacher.resolve().outcome()).isEqualTo(AttachmentOutcome.STALE);
    }

    @Test
    void zeroMaxAgeAcceptsAnyAge() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ZERO, encoder, clock::get);
        capture(0L);

        assertThat(attacher.resolve().outcome()).isEqualTo(AttachmentOutcome.ATTACHED);
    }

    @Test
    void encodeFailureIsReported() {
        SnapshotAttacher attacher = new SnapshotAttacher(store, Duration.ZERO, encoder, clock::get);
        store.update(new VisionSnapshot(new byte[1], PixelFormat.RGB, 4, 4, clock.get()));

        assertThat(attacher.resolve().outcome()).isEqualTo(AttachmentOutcome.ENCODE_FAILED);
    }
}
