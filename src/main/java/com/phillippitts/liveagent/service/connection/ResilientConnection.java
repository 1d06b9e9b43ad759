package com.phillippitts.liveagent.service.connection;

import com.phillippitts.liveagent.exception.ConnectionException;
import com.phillippitts.liveagent.service.connection.event.ConnectionAttemptFailedEvent;
import com.phillippitts.liveagent.service.connection.event.ConnectionExhaustedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.DoubleSupplier;

/**
 * Serializes connection attempts to one streaming dependency and retries with backoff.
 *
 * <p>Callers that find the connection open return without touching the lock. Everyone else
 * queues on a single lock, re-checks inside it (a previous holder may have just connected), and
 * only then makes one connect call per attempt. A connection storm against a rate-limited
 * endpoint therefore collapses into one sequence of spaced attempts.
 *
 * <p><b>State Transitions</b> (only under the lock):
 * <pre>
 * IDLE/FAILED/OPEN → CONNECTING → OPEN
 * CONNECTING → FAILED (attempts exhausted)
 * </pre>
 *
 * <p>One instance per connection owner; the lock is never shared across sessions.
 */
public class ResilientConnection {

    private static final Logger LOG = LogManager.getLogger(ResilientConnection.class);

    private final StreamingConnection connection;
    private final BackoffPolicy policy;
    private final Sleeper sleeper;
    private final DoubleSupplier random;
    private final ApplicationEventPublisher publisher;
    private final ReentrantLock lock = new ReentrantLock();

    private volatile ConnectionState state = ConnectionState.IDLE;
    private volatile int lastAttemptCount;

    public ResilientConnection(StreamingConnection connection, BackoffPolicy policy,
                               ApplicationEventPublisher publisher) {
        this(connection, policy, Sleeper.THREAD, () -> ThreadLocalRandom.current().nextDouble(), publisher);
    }

    public ResilientConnection(StreamingConnection connection, BackoffPolicy policy, Sleeper sleeper,
                               DoubleSupplier random, ApplicationEventPublisher publisher) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
    }

    /**
     * Returns once the connection reports open.
     *
     * @throws ConnectionException when every attempt failed or the caller was interrupted
     */
    public void ensureConnected() {
        if (connection.isOpen()) {
            return;
        }
        lock.lock();
        try {
            if (connection.isOpen()) {
                state = ConnectionState.OPEN;
                return;
            }
            connectWithBackoff();
        } finally {
            lock.unlock();
        }
    }

    private void connectWithBackoff() {
        String name = connection.connectionName();
        String lastError = "not open after connect";
        Exception lastCause = null;

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            state = ConnectionState.CONNECTING;
            lastAttemptCount = attempt;
            try {
                connection.connect();
                if (connection.isOpen()) {
                    state = ConnectionState.OPEN;
                    if (attempt > 1) {
                        LOG.info("Connected to {} after {} attempts", name, attempt);
                    }
                    return;
                }
                lastError = "not open after connect";
                lastCause = null;
            } catch (InterruptedException e) {
                throw interrupted(name, attempt, e);
            } catch (Exception e) {
                lastError = e.toString();
                lastCause = e;
            }

            if (attempt == policy.maxAttempts()) {
                break;
            }
            Duration delay = policy.jittered(policy.baseDelay(attempt), random.getAsDouble());
            LOG.warn("Connect attempt {}/{} to {} failed: {}; retrying in {}ms",
                    attempt, policy.maxAttempts(), name, lastError, delay.toMillis());
            publisher.publishEvent(new ConnectionAttemptFailedEvent(name, attempt, lastError, Instant.now()));
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                throw interrupted(name, attempt, e);
            }
        }

        state = ConnectionState.FAILED;
        LOG.error("Giving up on {} after {} attempts: {}", name, policy.maxAttempts(), lastError);
        publisher.publishEvent(new ConnectionExhaustedEvent(name, policy.maxAttempts(), lastError, Instant.now()));
        if (lastCause != null) {
            throw new ConnectionException(name, policy.maxAttempts(), "Connection failed", lastCause);
        }
        throw new ConnectionException(name, policy.maxAttempts(), "Connection failed: " + lastError);
    }

    private ConnectionException interrupted(String name, int attempt, InterruptedException e) {
        Thread.currentThread().interrupt();
        state = ConnectionState.FAILED;
        return new ConnectionException(name, attempt, "Interrupted while connecting", e);
    }

    public ConnectionState state() {
        return state;
    }

    /** Attempts made by the most recent connect sequence. */
    public int lastAttemptCount() {
        return lastAttemptCount;
    }

    public String name() {
        return connection.connectionName();
    }
}
