package com.gridcalc.wiring;

import com.gridcalc.api.Address;
import com.gridcalc.api.EditException;
import com.gridcalc.grid.Grid;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;

import lombok.extern.log4j.Log4j2;

/**
 * Serializes edits to a {@link Grid} from any number of producer threads.
 *
 * <p>
 * Producers claim a slot in an LMAX Disruptor ring buffer and return at once.
 * A single consumer thread owns the grid and applies the edits one at a time,
 * in sequence order, so the grid itself never sees concurrent calls. The
 * outcome of every edit (including rejections) is reported to the
 * {@link EditOutcomeCallback} on the consumer thread.
 *
 * <p>
 * While the publisher is running, read the grid only from the callback.
 */
@Log4j2
public final class EditPublisher implements AutoCloseable {
    public static final int DEFAULT_BUFFER_SIZE = 1024;

    private final Grid grid;
    private final Disruptor<EditEvent> disruptor;
    private volatile RingBuffer<EditEvent> ringBuffer;
    private volatile EditOutcomeCallback callback;
    private volatile boolean closed;

    public EditPublisher(Grid grid) {
        this(grid, DEFAULT_BUFFER_SIZE);
    }

    /** @param bufferSize ring size, a power of two */
    public EditPublisher(Grid grid, int bufferSize) {
        this.grid = grid;
        this.disruptor = new Disruptor<>(
                EditEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        EventHandler<EditEvent> handler = this::onEvent;
        disruptor.handleEventsWith(handler);
    }

    public void setOutcomeCallback(EditOutcomeCallback callback) {
        this.callback = callback;
    }

    public synchronized EditPublisher start() {
        if (ringBuffer != null)
            throw new IllegalStateException("Already started");
        ringBuffer = disruptor.start();
        log.info("Edit publisher started (buffer size {})", ringBuffer.getBufferSize());
        return this;
    }

    /** Queues {@code setCell(address, raw)}. Blocks only while the ring is full. */
    public long publishSet(Address address, String raw) {
        RingBuffer<EditEvent> rb = requireRunning();
        long sequence = rb.next();
        try {
            rb.get(sequence).setCell(address, raw, sequence);
        } finally {
            rb.publish(sequence);
        }
        return sequence;
    }

    /** Queues {@code clearCell(address)}. */
    public long publishClear(Address address) {
        RingBuffer<EditEvent> rb = requireRunning();
        long sequence = rb.next();
        try {
            rb.get(sequence).clearCell(address, sequence);
        } finally {
            rb.publish(sequence);
        }
        return sequence;
    }

    /**
     * Applies one edit. Runs on the consumer thread.
     *
     * @param endOfBatch unused: every edit recalculates on its own, as a
     *                   later edit in the batch may be rejected
     */
    void onEvent(EditEvent event, long sequence, boolean endOfBatch) {
        Address address = event.address();
        String raw = event.raw();
        Exception failure = null;
        try {
            if (event.kind() == EditEvent.Kind.CLEAR)
                grid.clearCell(address);
            else
                grid.setCell(address, raw);
        } catch (EditException e) {
            failure = e;
        } catch (RuntimeException e) {
            log.error("Edit #{} on {} failed", sequence, address, e);
            failure = e;
        } finally {
            event.clear();
        }

        EditOutcomeCallback cb = callback;
        if (cb != null)
            cb.onEditApplied(sequence, address, raw, failure);
    }

    /** Drains queued edits, then stops the consumer thread. */
    @Override
    public synchronized void close() {
        if (closed || ringBuffer == null)
            return;
        closed = true;
        disruptor.shutdown();
        log.info("Edit publisher stopped after {} edits", ringBuffer.getCursor() + 1);
    }

    private RingBuffer<EditEvent> requireRunning() {
        RingBuffer<EditEvent> rb = ringBuffer;
        if (rb == null || closed)
            throw new IllegalStateException("Edit publisher is not running");
        return rb;
    }

    /** Outcome of an applied edit. */
    @FunctionalInterface
    public interface EditOutcomeCallback {
        /**
         * @param sequence ring sequence returned by the publish call
         * @param raw      input for a set, null for a clear
         * @param error    null if the edit was applied; otherwise the rejection
         */
        void onEditApplied(long sequence, Address address, String raw, Exception error);
    }
}
