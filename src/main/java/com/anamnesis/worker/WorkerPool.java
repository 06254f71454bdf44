package com.anamnesis.worker;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-size set of channels to workers of one kind. A checked-out channel is held by one caller
 * until checked in. Workers that die are replaced in the background while the restart budget for the
 * sliding window allows; past that the pool is exhausted until {@link #reset()}.
 */
public class WorkerPool implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final WorkerKind kind;
    private final WorkerChannelFactory factory;
    private final int size;
    private final int maxRestarts;
    private final Duration restartWindow;
    private final Clock clock;
    private final ExecutorService respawner;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Set<WorkerChannel> members = new LinkedHashSet<>();
    private final Deque<WorkerChannel> idle = new ArrayDeque<>();
    private final Deque<Instant> restarts = new ArrayDeque<>();
    private int spawning;
    private boolean exhausted;
    private boolean closed;

    public WorkerPool(WorkerKind kind, WorkerChannelFactory factory, int size, int maxRestarts, Duration restartWindow) {
        this(kind, factory, size, maxRestarts, restartWindow, Clock.systemUTC());
    }

    WorkerPool(WorkerKind kind, WorkerChannelFactory factory, int size, int maxRestarts, Duration restartWindow, Clock clock) {
        if (size < 1) {
            throw new IllegalArgumentException("pool size must be >= 1");
        }
        if (maxRestarts < 0) {
            throw new IllegalArgumentException("maxRestarts must be >= 0");
        }
        this.kind = kind;
        this.factory = factory;
        this.size = size;
        this.maxRestarts = maxRestarts;
        this.restartWindow = restartWindow;
        this.clock = clock;
        this.respawner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "worker-pool-" + kind.label() + "-respawn");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Spawns the initial workers. A spawn failure here is fatal and closes whatever was started.
     */
    public void start() throws IOException {
        try {
            for (int i = 0; i < size; i++) {
                register(factory.open(kind));
            }
        } catch (IOException | RuntimeException e) {
            close();
            throw e;
        }
        log.info("pool.started kind={} size={} maxRestarts={} window={}", kind.label(), size, maxRestarts, restartWindow);
    }

    /**
     * Waits up to {@code timeout} for a free channel.
     *
     * @throws PoolExhaustedException when the pool is closed or exhausted, or none became free in time
     */
    public WorkerChannel checkout(Duration timeout) throws PoolExhaustedException, InterruptedException {
        long remaining = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (true) {
                if (closed) {
                    throw new PoolExhaustedException(kind, "pool is closed");
                }
                if (exhausted) {
                    throw new PoolExhaustedException(kind, "more than " + maxRestarts + " restarts within " + restartWindow);
                }
                WorkerChannel channel = idle.pollFirst();
                if (channel != null) {
                    if (channel.isOpen()) {
                        return channel;
                    }
                    continue;
                }
                if (remaining <= 0) {
                    throw new PoolExhaustedException(kind, "no worker became free within " + timeout.toMillis() + "ms");
                }
                remaining = available.awaitNanos(remaining);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a channel obtained from {@link #checkout}. Closed channels are dropped; their replacement
     * is already under way.
     */
    public void checkin(WorkerChannel channel) {
        lock.lock();
        try {
            if (!members.contains(channel)) {
                if (channel.isOpen() && !closed) {
                    throw new IllegalArgumentException(channel + " does not belong to the " + kind.label() + " pool");
                }
                return;
            }
            if (channel.isOpen() && !idle.contains(channel)) {
                idle.addLast(channel);
                available.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the exhausted state and the restart history, then tops the pool back up to its size.
     */
    public void reset() throws IOException {
        int missing;
        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException(kind.label() + " pool is closed");
            }
            exhausted = false;
            restarts.clear();
            missing = size - members.size() - spawning;
            spawning += Math.max(missing, 0);
        } finally {
            lock.unlock();
        }
        log.info("pool.reset kind={} respawning={}", kind.label(), Math.max(missing, 0));
        for (int i = 0; i < missing; i++) {
            WorkerChannel channel;
            try {
                channel = factory.open(kind);
            } catch (IOException | RuntimeException e) {
                // the spawns this loop will no longer attempt are still reserved
                releaseSpawns(missing - i);
                throw e;
            }
            spawnFinished();
            register(channel);
        }
    }

    public WorkerKind kind() {
        return kind;
    }

    public int size() {
        return size;
    }

    public int liveCount() {
        lock.lock();
        try {
            return members.size();
        } finally {
            lock.unlock();
        }
    }

    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isExhausted() {
        lock.lock();
        try {
            return exhausted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<WorkerChannel> toClose;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(members);
            members.clear();
            idle.clear();
            available.signalAll();
        } finally {
            lock.unlock();
        }
        respawner.shutdownNow();
        toClose.forEach(WorkerChannel::close);
        log.info("pool.closed kind={} workers={}", kind.label(), toClose.size());
    }

    private void register(WorkerChannel channel) {
        lock.lock();
        try {
            if (closed) {
                channel.close();
                return;
            }
            members.add(channel);
            idle.addLast(channel);
            available.signal();
        } finally {
            lock.unlock();
        }
        channel.onClose(this::workerClosed);
    }

    private void workerClosed(WorkerChannel channel) {
        lock.lock();
        try {
            if (!members.remove(channel)) {
                return;
            }
            idle.remove(channel);
        } finally {
            lock.unlock();
        }
        log.warn("pool.worker.died kind={} channel={} reason={}", kind.label(), channel.name(), channel.closeReason());
        scheduleReplacement();
    }

    private void scheduleReplacement() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            Instant now = clock.instant();
            Instant windowStart = now.minus(restartWindow);
            while (!restarts.isEmpty() && restarts.peekFirst().isBefore(windowStart)) {
                restarts.pollFirst();
            }
            if (restarts.size() >= maxRestarts) {
                exhausted = true;
                available.signalAll();
                log.error("pool.exhausted kind={} restarts={} window={}", kind.label(), restarts.size(), restartWindow);
                return;
            }
            restarts.addLast(now);
            spawning++;
        } finally {
            lock.unlock();
        }
        try {
            respawner.execute(this::respawn);
        } catch (RejectedExecutionException e) {
            spawnFinished();
        }
    }

    private void respawn() {
        WorkerChannel channel;
        try {
            channel = factory.open(kind);
        } catch (IOException | RuntimeException e) {
            spawnFinished();
            log.warn("pool.respawn.failed kind={} reason={}", kind.label(), e.getMessage());
            scheduleReplacement();
            return;
        }
        spawnFinished();
        register(channel);
        log.info("pool.respawned kind={} channel={}", kind.label(), channel.name());
    }

    private void spawnFinished() {
        releaseSpawns(1);
    }

    private void releaseSpawns(int count) {
        lock.lock();
        try {
            spawning -= count;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return "WorkerPool{" +
                "kind=" + kind.label() +
                ", size=" + size +
                ", maxRestarts=" + maxRestarts +
                ", restartWindow=" + restartWindow +
                '}';
    }
}
