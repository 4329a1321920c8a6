package com.yoursp.offload.modules.worker;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Message channel between the pool and one worker incarnation.
 * <p>
 * Only JSON text travels over it. The pool writes tasks with
 * {@link #post(String)}; the worker reads them with {@link #receive()} and
 * answers through {@link #emit(String)}, which forwards to the pool's
 * {@link Listener}. {@link #exit(int)} is delivered at most once.
 * </p>
 */
public class WorkerChannel {

    /**
     * Pool-side callbacks. Both are invoked on the worker's thread and must
     * only hand the message over, never process it inline.
     */
    public interface Listener {

        void onMessage(String json);

        void onExit(int exitCode);
    }

    private final BlockingQueue<String> inbound = new LinkedBlockingQueue<>();
    private final Listener listener;
    private final AtomicBoolean exited = new AtomicBoolean();
    private volatile boolean terminating;

    public WorkerChannel(Listener listener) {
        this.listener = listener;
    }

    /**
     * Deliver a task to the worker.
     *
     * @return false if the channel is closed or closing
     */
    public boolean post(String json) {
        if (terminating || exited.get()) {
            return false;
        }
        return inbound.offer(json);
    }

    /**
     * Block until the next task arrives.
     *
     * @return the task JSON, or {@code null} once termination was requested
     */
    public String receive() throws InterruptedException {
        String message = inbound.take();
        return terminating ? null : message;
    }

    public void emit(String json) {
        if (!exited.get()) {
            listener.onMessage(json);
        }
    }

    /**
     * Ask the worker to stop after its current task. Tasks still queued on
     * the channel are discarded.
     */
    public void terminate() {
        terminating = true;
        // wake a blocked receive()
        inbound.offer("");
    }

    public void exit(int exitCode) {
        if (exited.compareAndSet(false, true)) {
            listener.onExit(exitCode);
        }
    }

    public boolean isOpen() {
        return !terminating && !exited.get();
    }
}
