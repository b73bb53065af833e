package com.questrail.statechart.runtime;

import com.questrail.statechart.api.EnqueueOutcome;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.api.FatalFaultException;
import com.questrail.statechart.api.Fault;
import com.questrail.statechart.api.FaultKind;
import com.questrail.statechart.model.OverflowPolicy;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * BoundedEventQueue
 * -----------------------------------------------------------------------------
 * Fixed-capacity FIFO of events and timer expiries, shared between producers
 * on any thread and the owning instance.
 *
 * <h2>Storage</h2>
 * A ring of preallocated {@link QueuedEvent} slots sized at creation. Offers
 * copy into a slot and polls copy out of it, so no allocation happens after
 * construction.
 *
 * <h2>Overflow</h2>
 * <ul>
 *   <li>{@code DROP_OLDEST}: the head is discarded, the new event stored</li>
 *   <li>{@code DROP_NEWEST}: the new event is discarded</li>
 *   <li>{@code ERROR}: the new event is rejected and the caller reports a fault</li>
 *   <li>{@code ASSERT}: {@link FatalFaultException}</li>
 * </ul>
 *
 * All methods synchronize on the queue.
 */
public final class BoundedEventQueue
{
    private final String owner;
    private final OverflowPolicy policy;
    private final QueuedEvent[] ring;
    private int head;
    private int size;

    BoundedEventQueue(String owner, int capacity, OverflowPolicy policy, int width) {
        this.owner = Objects.requireNonNull(owner, "owner");
        this.policy = Objects.requireNonNull(policy, "policy");
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.ring = new QueuedEvent[capacity];
        for (int i = 0; i < capacity; i++) {
            ring[i] = new QueuedEvent(width);
        }
    }

    public int capacity() {
        return ring.length;
    }

    public OverflowPolicy policy() {
        return policy;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized boolean isEmpty() {
        return size == 0;
    }

    synchronized EnqueueOutcome offer(int event, long[] args, int width) {
        EnqueueOutcome outcome = makeRoom();
        if (outcome.stored()) {
            tail().setEvent(event, args, width);
            size++;
            notifyAll();
        }
        return outcome;
    }

    synchronized EnqueueOutcome offer(int event, Event source) {
        EnqueueOutcome outcome = makeRoom();
        if (outcome.stored()) {
            tail().setEvent(event, source);
            size++;
            notifyAll();
        }
        return outcome;
    }

    synchronized EnqueueOutcome offerTimer(long handle, boolean rearmed) {
        EnqueueOutcome outcome = makeRoom();
        if (outcome.stored()) {
            tail().setTimer(handle, rearmed);
            size++;
            notifyAll();
        }
        return outcome;
    }

    /**
     * Re-inserts a released deferred event ahead of everything queued.
     *
     * When full, {@code DROP_OLDEST} discards the re-inserted event itself
     * (it is the oldest) and {@code DROP_NEWEST} evicts the tail.
     */
    synchronized EnqueueOutcome pushFront(QueuedEvent e) {
        if (size == ring.length) {
            switch (policy) {
                case DROP_OLDEST:
                    return EnqueueOutcome.DROPPED;
                case DROP_NEWEST:
                    size--;
                    break;
                case ERROR:
                    return EnqueueOutcome.REJECTED;
                default:
                    throw overflow();
            }
        }
        head = (head - 1 + ring.length) % ring.length;
        ring[head].copyFrom(e);
        size++;
        notifyAll();
        return EnqueueOutcome.ACCEPTED;
    }

    /** Copies the head into {@code into} and removes it; {@code false} if empty. */
    synchronized boolean poll(QueuedEvent into) {
        if (size == 0) {
            return false;
        }
        into.copyFrom(ring[head]);
        head = (head + 1) % ring.length;
        size--;
        return true;
    }

    /** Blocks until an entry is present or the timeout elapses. */
    synchronized boolean awaitNonEmpty(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (size == 0) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    synchronized void wakeUp() {
        notifyAll();
    }

    private EnqueueOutcome makeRoom() {
        if (size < ring.length) {
            return EnqueueOutcome.ACCEPTED;
        }
        switch (policy) {
            case DROP_OLDEST:
                head = (head + 1) % ring.length;
                size--;
                return EnqueueOutcome.ACCEPTED_DROPPED_OLDEST;
            case DROP_NEWEST:
                return EnqueueOutcome.DROPPED;
            case ERROR:
                return EnqueueOutcome.REJECTED;
            default:
                throw overflow();
        }
    }

    private QueuedEvent tail() {
        return ring[(head + size) % ring.length];
    }

    private FatalFaultException overflow() {
        return new FatalFaultException(new Fault(FaultKind.QUEUE_ASSERTION, owner,
                "Event queue full (capacity " + ring.length + ")"));
    }

    @Override
    public synchronized String toString() {
        return "BoundedEventQueue[" + owner + ", " + size + "/" + ring.length + ", " + policy + "]";
    }
}
