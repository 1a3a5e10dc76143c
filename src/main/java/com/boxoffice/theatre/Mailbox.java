package com.boxoffice.theatre;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * <p>
 * A channel for messages of type {@code M} with two priorities.
 * </p>
 *
 * <p>
 * High priority messages are always received before low priority ones;
 * messages of the same priority are received in the order they were sent.
 * After {@link #close()} no further messages are accepted, but messages
 * already sent can still be received.
 * </p>
 *
 * @param <M> Message type.
 */
public class Mailbox<M> {
    private final Deque<M> highPriority = new ArrayDeque<>();
    private final Deque<M> lowPriority = new ArrayDeque<>();

    /**
     * Guarded by {@code this}.
     */
    private boolean closed = false;

    /**
     * Constructs a new empty {@link Mailbox}.
     */
    public Mailbox() {
    }

    /**
     * Returns whether the mailbox is empty.
     *
     * @return Whether the mailbox is empty.
     */
    public synchronized boolean isEmpty() {
        return this.highPriority.isEmpty() && this.lowPriority.isEmpty();
    }

    /**
     * Tries to send a message with low priority.
     *
     * @param message The message.
     * @return Indicates whether the message has been sent.
     */
    public boolean sendLowPriority(final M message) {
        return this.send(this.lowPriority, message);
    }

    /**
     * Tries to send a message with high priority.
     *
     * @param message The message.
     * @return Indicates whether the message has been sent.
     */
    public boolean sendHighPriority(final M message) {
        return this.send(this.highPriority, message);
    }

    private synchronized boolean send(final Deque<M> queue, final M message) {
        if (this.closed) {
            return false;
        }
        queue.addLast(message);
        this.notifyAll();
        return true;
    }

    /**
     * Receives a message blocking the receiving thread.
     *
     * @return The received message.
     * @throws InterruptedException The thread has been interrupted.
     */
    public synchronized M recv() throws InterruptedException {
        while (this.isEmpty()) {
            this.wait();
        }
        return this.tryRecv();
    }

    /**
     * Tries to receive a message without blocking.
     *
     * @return The received message or {@code null} in case the {@link Mailbox} is empty.
     */
    public synchronized M tryRecv() {
        if (!this.highPriority.isEmpty()) {
            return this.highPriority.removeFirst();
        }
        return this.lowPriority.pollFirst();
    }

    /**
     * Stops accepting messages.
     */
    public synchronized void close() {
        this.closed = true;
    }

    /**
     * Returns whether the mailbox has been closed.
     *
     * @return Whether the mailbox has been closed.
     */
    public synchronized boolean isClosed() {
        return this.closed;
    }
}
