package com.yoursp.offload.modules.pool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.yoursp.offload.config.OffloadProperties;
import com.yoursp.offload.exception.PoolOverloadedException;
import com.yoursp.offload.exception.PoolShuttingDownException;
import com.yoursp.offload.exception.TaskFailedException;
import com.yoursp.offload.exception.TaskTimeoutException;
import com.yoursp.offload.exception.WorkerCrashedException;
import com.yoursp.offload.modules.primitive.CryptoPrimitives;
import com.yoursp.offload.modules.protocol.EnvelopeCodec;
import com.yoursp.offload.modules.protocol.ErrorCode;
import com.yoursp.offload.modules.protocol.MalformedEnvelopeException;
import com.yoursp.offload.modules.protocol.ResultEnvelope;
import com.yoursp.offload.modules.protocol.TaskEnvelope;
import com.yoursp.offload.modules.protocol.WorkerAction;
import com.yoursp.offload.modules.worker.CryptoWorker;
import com.yoursp.offload.modules.worker.WorkerChannel;
import com.yoursp.offload.modules.worker.WorkerStatus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fixed-size pool of {@link CryptoWorker}s.
 * <p>
 * All pool state ({@code pending}, the FIFO wait queue and the worker slots)
 * is owned by a single dispatcher thread that consumes {@link PoolEvent}s.
 * Callers, workers and the timeout scheduler only enqueue events, so no
 * two state changes ever interleave.
 * </p>
 * <ul>
 * <li>Assignment: round-robin over idle workers; FIFO queue when none is idle.</li>
 * <li>Correlation: results are matched to callers by task id only; results
 * for unknown ids (timed out, already rejected) are dropped with a warning.</li>
 * <li>Timeout: rejects the caller, leaves the worker running.</li>
 * <li>Crash: rejects the task the dead worker held and respawns the slot.</li>
 * </ul>
 */
@Slf4j
@Component
public class WorkerPoolManager {

    private final OffloadProperties.Pool poolProperties;
    private final OffloadProperties.Password passwordProperties;
    private final CryptoPrimitives primitives;
    private final EnvelopeCodec codec;
    private final TaskScheduler timeoutScheduler;

    private final BlockingQueue<PoolEvent> events = new LinkedBlockingQueue<>();
    private final Map<String, PendingTask> pending = new ConcurrentHashMap<>();
    private final Deque<PendingTask> queue = new ArrayDeque<>();
    private final List<WorkerSlot> slots;
    private final CountDownLatch initialized;
    private final Object lifecycleLock = new Object();

    private volatile boolean started;
    private volatile boolean shuttingDown;
    private volatile int queuedCount;
    private volatile long completedTasks;
    private volatile long respawns;

    private boolean running = true;
    private int nextSlot;

    public WorkerPoolManager(OffloadProperties properties, CryptoPrimitives primitives, EnvelopeCodec codec,
            @Qualifier("offloadTimeoutScheduler") TaskScheduler timeoutScheduler) {
        this.poolProperties = properties.getPool();
        this.passwordProperties = properties.getPassword();
        this.primitives = primitives;
        this.codec = codec;
        this.timeoutScheduler = timeoutScheduler;

        List<WorkerSlot> created = new ArrayList<>();
        for (int i = 0; i < poolProperties.getSize(); i++) {
            created.add(new WorkerSlot(i));
        }
        this.slots = Collections.unmodifiableList(created);
        this.initialized = new CountDownLatch(slots.size());
        log.info("Worker pool created with {} workers", slots.size());
    }

    /**
     * Start the dispatcher and all workers, then wait for their readiness
     * signals. A partial start is logged, not fatal: tasks queue until a
     * worker becomes ready.
     */
    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (started || shuttingDown) {
                return;
            }
            started = true;
            log.info("Initializing worker pool...");

            Thread dispatcher = new Thread(this::dispatchLoop, "offload-pool-dispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();
            events.offer(new PoolEvent.Start());
        }

        Duration initTimeout = poolProperties.getInitTimeout();
        try {
            if (initialized.await(initTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.info("Worker pool initialized with {}/{} workers", slots.size(), slots.size());
            } else {
                long ready = slots.size() - initialized.getCount();
                log.warn("Only {}/{} workers reported ready after {}ms; tasks will queue until more are available",
                        ready, slots.size(), initTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for workers to initialize");
        }
    }

    /**
     * Submit a task. The returned future completes on the dispatcher thread,
     * so dependent stages must not block.
     *
     * @param action  what to execute
     * @param payload action-specific arguments
     * @param timeout how long to wait for the result; null for the configured default
     * @return the primitive's result, or an exceptional completion with an
     *         {@link com.yoursp.offload.exception.OffloadException}
     */
    public CompletableFuture<JsonNode> submit(WorkerAction action, JsonNode payload, Duration timeout) {
        Objects.requireNonNull(action, "action");
        String id = UUID.randomUUID().toString();
        Duration effective = timeout != null ? timeout : poolProperties.getDefaultTimeout();
        PendingTask task = new PendingTask(id, action,
                codec.encodeTask(TaskEnvelope.of(id, action, payload)), effective, Instant.now());

        // a Submit must never be enqueued behind the Shutdown event
        synchronized (lifecycleLock) {
            if (shuttingDown) {
                return CompletableFuture.failedFuture(new PoolShuttingDownException());
            }
            if (!started) {
                return CompletableFuture.failedFuture(new IllegalStateException("Worker pool is not started"));
            }
            events.offer(new PoolEvent.Submit(task));
        }
        return task.getFuture();
    }

    /**
     * Reject everything pending, stop accepting work and terminate all
     * workers. Blocks up to the configured shutdown timeout.
     */
    @PreDestroy
    public void shutdown() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        synchronized (lifecycleLock) {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            if (!started) {
                return;
            }
            events.offer(new PoolEvent.Shutdown(done));
        }
        log.info("Terminating all workers...");

        long deadline = System.nanoTime() + poolProperties.getShutdownTimeout().toNanos();
        try {
            done.get(remainingMillis(deadline), TimeUnit.MILLISECONDS);
            for (WorkerSlot slot : slots) {
                Thread thread = slot.getThread();
                if (thread != null) {
                    thread.join(Math.max(1, remainingMillis(deadline)));
                    if (thread.isAlive()) {
                        log.warn("Worker {} did not stop within the shutdown timeout", slot.getIndex());
                    }
                }
            }
            log.info("All workers terminated");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while terminating workers");
        } catch (ExecutionException | TimeoutException e) {
            log.error("Error terminating workers: {}", e.getMessage(), e);
        }
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    public PoolStats stats() {
        int starting = 0;
        int idle = 0;
        int busy = 0;
        int error = 0;
        int alive = 0;
        List<PoolStats.WorkerInfo> details = new ArrayList<>();
        for (WorkerSlot slot : slots) {
            PoolStats.WorkerInfo info = slot.snapshot();
            details.add(info);
            switch (info.status()) {
                case STARTING -> starting++;
                case IDLE -> idle++;
                case BUSY -> busy++;
                case ERROR -> error++;
                default -> {
                }
            }
            if (info.status() != WorkerStatus.TERMINATED) {
                alive++;
            }
        }
        return new PoolStats(alive, slots.size(), starting, idle, busy, error,
                completedTasks, pending.size(), queuedCount, respawns, details);
    }

    // ================================================================
    // Dispatcher thread
    // ================================================================

    private void dispatchLoop() {
        while (running) {
            PoolEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            try {
                handle(event);
            } catch (RuntimeException e) {
                log.error("Error handling pool event {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        log.debug("Pool dispatcher stopped");
    }

    private void handle(PoolEvent event) {
        if (event instanceof PoolEvent.Submit submit) {
            onSubmit(submit.task());
        } else if (event instanceof PoolEvent.WorkerMessage message) {
            onWorkerMessage(message);
        } else if (event instanceof PoolEvent.WorkerExit exit) {
            onWorkerExit(exit);
        } else if (event instanceof PoolEvent.Timeout timeout) {
            onTimeout(timeout.taskId());
        } else if (event instanceof PoolEvent.Start) {
            slots.forEach(this::spawn);
        } else if (event instanceof PoolEvent.Shutdown shutdown) {
            onShutdown(shutdown.done());
        }
    }

    private void onSubmit(PendingTask task) {
        if (shuttingDown) {
            task.reject(new PoolShuttingDownException());
            return;
        }

        WorkerSlot slot = nextIdleSlot();
        int maxQueue = poolProperties.getMaxQueueLength();
        if (slot == null && maxQueue > 0 && queue.size() >= maxQueue) {
            log.warn("Rejecting task {} ({}): {} tasks already queued", task.getId(), task.getAction(), queue.size());
            task.reject(new PoolOverloadedException(maxQueue));
            return;
        }

        pending.put(task.getId(), task);
        task.armTimeout(timeoutScheduler.schedule(
                () -> events.offer(new PoolEvent.Timeout(task.getId())), task.getDeadline()));

        if (slot == null || !assign(slot, task)) {
            queue.addLast(task);
            queuedCount = queue.size();
            log.debug("No idle worker, task {} ({}) queued at position {}", task.getId(), task.getAction(), queue.size());
        }
    }

    private void onWorkerMessage(PoolEvent.WorkerMessage message) {
        WorkerSlot slot = slots.get(message.slot());
        if (message.generation() != slot.getGeneration()) {
            log.debug("Ignoring message from superseded worker {} (generation {})", slot.getIndex(), message.generation());
            return;
        }

        ResultEnvelope result;
        try {
            result = codec.decodeResult(message.json());
        } catch (MalformedEnvelopeException e) {
            log.error("Worker {} sent an undecodable message: {}", slot.getIndex(), e.getMessage());
            return;
        }

        if (result.isInit()) {
            if (slot.markReady()) {
                initialized.countDown();
            }
            log.debug("Worker {} initialized successfully", slot.getIndex());
            drainQueue();
            return;
        }

        if (result.isFatal()) {
            onWorkerError(slot, result);
            return;
        }

        if (Objects.equals(result.id(), slot.getCurrentTaskId())) {
            slot.completeTask();
        }

        PendingTask task = pending.remove(result.id());
        if (task == null) {
            log.warn("Dropping result from worker {} for unknown or expired task {}", slot.getIndex(), result.id());
        } else {
            completedTasks++;
            if (result.success()) {
                task.resolve(result.result() != null ? result.result() : NullNode.getInstance());
            } else {
                String errorMessage = result.error() != null ? result.error().message() : null;
                ErrorCode code = result.error() != null ? result.error().errorCode() : ErrorCode.PRIMITIVE_FAILURE;
                log.debug("Worker {} task {} failed: {}", slot.getIndex(), task.getId(), errorMessage);
                task.reject(new TaskFailedException(task.getId(), code, errorMessage,
                        result.error() != null ? result.error().stack() : null));
            }
        }
        drainQueue();
    }

    private void onWorkerError(WorkerSlot slot, ResultEnvelope result) {
        String errorMessage = result.error() != null ? result.error().message() : "unknown error";
        if (result.error() != null && result.error().errorCode() == ErrorCode.WORKER_FATAL) {
            log.error("Worker {} error: {}", slot.getIndex(), errorMessage);
            slot.markError();
        } else {
            log.warn("Worker {} rejected an uncorrelated message: {}", slot.getIndex(), errorMessage);
        }
    }

    private void onWorkerExit(PoolEvent.WorkerExit exit) {
        WorkerSlot slot = slots.get(exit.slot());
        if (exit.generation() != slot.getGeneration()) {
            return;
        }
        if (shuttingDown) {
            slot.markTerminated();
            return;
        }

        log.warn("Worker {} exited with code {}", slot.getIndex(), exit.exitCode());
        String taskId = slot.getCurrentTaskId();
        if (taskId != null) {
            PendingTask task = pending.remove(taskId);
            if (task != null) {
                task.reject(new WorkerCrashedException(taskId, slot.getIndex(), exit.exitCode()));
            }
        }

        respawns++;
        spawn(slot);
        drainQueue();
    }

    private void onTimeout(String taskId) {
        PendingTask task = pending.remove(taskId);
        if (task == null) {
            return;
        }
        if (queue.remove(task)) {
            queuedCount = queue.size();
        }
        log.warn("Task {} ({}) timed out after {}ms", taskId, task.getAction(), task.getTimeout().toMillis());
        task.reject(new TaskTimeoutException(taskId, task.getAction().name(), task.getTimeout()));
    }

    private void onShutdown(CompletableFuture<Void> done) {
        try {
            PoolShuttingDownException error = new PoolShuttingDownException();
            pending.values().forEach(task -> task.reject(error));
            if (!pending.isEmpty()) {
                log.info("Rejected {} pending task(s) on shutdown", pending.size());
            }
            pending.clear();
            queue.clear();
            queuedCount = 0;

            for (WorkerSlot slot : slots) {
                WorkerChannel channel = slot.getChannel();
                if (channel != null) {
                    channel.terminate();
                }
                Thread thread = slot.getThread();
                if (thread != null) {
                    thread.interrupt();
                }
                slot.markTerminated();
            }
        } finally {
            running = false;
            done.complete(null);
        }
    }

    // ================================================================
    // Helpers (dispatcher thread only)
    // ================================================================

    private void spawn(WorkerSlot slot) {
        int generation = slot.nextGeneration();
        int index = slot.getIndex();
        WorkerChannel channel = new WorkerChannel(new WorkerChannel.Listener() {
            @Override
            public void onMessage(String json) {
                events.offer(new PoolEvent.WorkerMessage(index, generation, json));
            }

            @Override
            public void onExit(int exitCode) {
                events.offer(new PoolEvent.WorkerExit(index, generation, exitCode));
            }
        });
        slot.attach(generation, channel);

        CryptoWorker worker = new CryptoWorker(String.valueOf(index), channel, codec, primitives,
                passwordProperties.getAlgorithm(), passwordProperties.getBcryptRounds());
        slot.started(worker.start("offload-worker-" + index));
        log.debug("Creating worker {} (generation {})", index, generation);
    }

    private boolean assign(WorkerSlot slot, PendingTask task) {
        if (!slot.getChannel().post(task.getMessage())) {
            return false;
        }
        slot.markBusy(task.getId());
        log.debug("Task {} ({}) assigned to worker {}", task.getId(), task.getAction(), slot.getIndex());
        return true;
    }

    private void drainQueue() {
        while (!queue.isEmpty()) {
            WorkerSlot slot = nextIdleSlot();
            if (slot == null) {
                break;
            }
            PendingTask task = queue.pollFirst();
            if (!pending.containsKey(task.getId())) {
                continue;
            }
            if (!assign(slot, task)) {
                queue.addFirst(task);
                break;
            }
        }
        queuedCount = queue.size();
    }

    private WorkerSlot nextIdleSlot() {
        for (int i = 0; i < slots.size(); i++) {
            WorkerSlot slot = slots.get((nextSlot + i) % slots.size());
            if (slot.isIdle()) {
                nextSlot = (slot.getIndex() + 1) % slots.size();
                return slot;
            }
        }
        return null;
    }

    private static long remainingMillis(long deadlineNanos) {
        return Math.max(0, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
    }
}
