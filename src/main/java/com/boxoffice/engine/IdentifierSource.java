package com.boxoffice.engine;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * A virtual roll of tickets: issues the identifiers 1, 2, 3, ... up to a fixed
 * capacity, each exactly once.
 * </p>
 *
 * <p>
 * A background producer pushes the identifiers in order into a small bounded
 * queue and consumers pull them with {@link #take()}. Since every queue
 * element is handed to exactly one consumer, {@link #take()} may be called
 * from any number of threads without further locking.
 * </p>
 *
 * <p>
 * Once the capacity is used up, or after {@link #close()}, every pending and
 * future {@link #take()} fails with an {@link ExhaustedSourceException}.
 * </p>
 */
public class IdentifierSource implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(IdentifierSource.class);

    /**
     * Small buffer to keep the response time of {@link #take()} low.
     */
    public static final int DEFAULT_BUFFER_SIZE = 5;

    /**
     * Marks the end of the roll. Identifiers start at 1, so 0 is free.
     */
    private static final int END_OF_ROLL = 0;

    /**
     * Number of identifiers this source issues.
     */
    private final int capacity;

    /**
     * Identifiers ready to be taken.
     */
    private final BlockingQueue<Integer> roll;

    /**
     * Thread running the producer.
     */
    private final Thread producer;

    private volatile boolean started = false;
    private volatile boolean closed = false;

    /**
     * Constructs a new {@link IdentifierSource} with the default buffer size.
     *
     * @param capacity Number of identifiers to issue.
     */
    public IdentifierSource(final int capacity) {
        this(capacity, DEFAULT_BUFFER_SIZE);
    }

    /**
     * Constructs a new {@link IdentifierSource}.
     *
     * @param capacity   Number of identifiers to issue.
     * @param bufferSize Number of identifiers produced ahead of demand.
     */
    public IdentifierSource(final int capacity, final int bufferSize) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative");
        }
        this.capacity = capacity;
        this.roll = new ArrayBlockingQueue<>(bufferSize);
        this.producer = new Thread(this::produce, "identifier-source");
        this.producer.setDaemon(true);
    }

    /**
     * Starts the background producer. Must be called exactly once.
     */
    public synchronized void start() {
        if (this.started) {
            throw new IllegalStateException("Identifier source already started!");
        }
        this.started = true;
        this.producer.start();
    }

    /**
     * Returns the number of identifiers this source issues.
     *
     * @return Capacity of the source.
     */
    public int getCapacity() {
        return this.capacity;
    }

    /**
     * Returns whether the source has been closed.
     *
     * @return Whether {@link #close()} has been called.
     */
    public boolean isClosed() {
        return this.closed;
    }

    /**
     * Pushes the identifiers onto the roll, then the end marker.
     */
    private void produce() {
        try {
            for (var id = 1; id <= this.capacity && !this.closed; id++) {
                this.roll.put(id);
            }
            if (!this.closed) {
                this.roll.put(END_OF_ROLL);
                LOG.debug("All {} ticket numbers have been produced", this.capacity);
            }
        } catch (InterruptedException error) {
            // Interrupted by close(), which takes care of waking up consumers.
            LOG.debug("Identifier producer interrupted after close");
        }
    }

    /**
     * <p>
     * Takes the next identifier, waiting for the producer if none is ready.
     * </p>
     *
     * @return The next identifier, which no other caller ever receives.
     * @throws ExhaustedSourceException When the capacity is used up or the
     *                                  source has been closed.
     * @throws InterruptedException     The calling thread has been interrupted.
     */
    public int take() throws ExhaustedSourceException, InterruptedException {
        if (!this.started) {
            throw new IllegalStateException("Identifier source has not been started!");
        }
        if (this.closed) {
            throw new ExhaustedSourceException(this.capacity, true);
        }
        final int id = this.roll.take();
        if (id == END_OF_ROLL || this.closed) {
            // Put the marker back so that the next consumer sees it as well.
            this.roll.offer(END_OF_ROLL);
            throw new ExhaustedSourceException(this.capacity, this.closed);
        }
        return id;
    }

    /**
     * Closes the source and stops the producer. Idempotent.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (this.closed) {
                return;
            }
            this.closed = true;
        }
        this.producer.interrupt();
        this.roll.clear();
        this.roll.offer(END_OF_ROLL);
        if (this.started) {
            try {
                this.producer.join(TimeUnit.SECONDS.toMillis(1));
            } catch (InterruptedException error) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
