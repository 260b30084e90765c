package com.tyron.multicode.core.sync.async;

import com.tyron.multicode.api.sync.SyncException;
import com.tyron.multicode.api.sync.SyncMessage;
import com.tyron.multicode.api.sync.SyncResult;
import com.tyron.multicode.core.sync.SyncEngine;
import com.tyron.multicode.core.sync.SyncSettings;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Feeds a {@link SyncEngine} from any number of threads.
 *
 * Messages go through a bounded queue to a single sync thread, which is the only thread that touches the
 * engine. The first message after an idle period opens a debounce window; everything arriving inside the
 * window forms one batch, applied in arrival order.
 *
 * While paused, messages are kept and applied as one batch on resume. A pause that arrives while a batch is
 * still collecting discards that batch. Shutting down applies whatever was collected or kept, then stops the
 * thread. A message accepted by {@link #send} is always applied before the thread stops.
 */
public final class AsyncManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(AsyncManager.class.getName());

    private interface Command {
    }

    private record Apply(SyncMessage message) implements Command {
    }

    private enum Control implements Command {
        PAUSE, RESUME, SHUTDOWN
    }

    private final SyncEngine engine;
    private final Duration debounce;
    private final BlockingQueue<Command> queue = new LinkedBlockingQueue<>();
    private final Semaphore capacity;
    // read: enqueueing, write: shutting down
    private final ReadWriteLock lifecycle = new ReentrantReadWriteLock();
    private final Thread worker;
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private final AtomicReference<SyncResult> latest = new AtomicReference<>();
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean paused;

    public AsyncManager(SyncEngine engine) {
        this(engine, engine.getSettings());
    }

    public AsyncManager(SyncEngine engine, SyncSettings settings) {
        this.engine = engine;
        this.debounce = settings.getDebounce();
        this.capacity = new Semaphore(settings.getQueueCapacity());
        this.worker = new Thread(new Worker(), "Multicode-Sync-Thread");
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Queues a message, blocking only while {@link SyncSettings#getQueueCapacity()} messages are waiting.
     *
     * @return false if the manager is shut down or the caller was interrupted. When true, the message will be
     * applied.
     */
    public boolean send(SyncMessage message) {
        return enqueue(new Apply(message));
    }

    public void pause() {
        if (enqueue(Control.PAUSE)) {
            paused = true;
        }
    }

    public void resume() {
        if (enqueue(Control.RESUME)) {
            paused = false;
        }
    }

    /**
     * @return whether {@link #pause()} was called more recently than {@link #resume()}
     */
    public boolean isPaused() {
        return paused;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * @return the result of the most recent successfully applied message
     */
    public Optional<SyncResult> latestResult() {
        return Optional.ofNullable(latest.get());
    }

    public void addBatchListener(BatchListener listener) {
        listeners.add(listener);
    }

    public void removeBatchListener(BatchListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies pending messages and stops the sync thread. Waits for it unless called from the sync thread
     * itself. Further calls do nothing.
     */
    public void shutdown() {
        lifecycle.writeLock().lock();
        try {
            if (shutdown.compareAndSet(false, true)) {
                queue.add(Control.SHUTDOWN);
            }
        } finally {
            lifecycle.writeLock().unlock();
        }
        if (Thread.currentThread() == worker) {
            return;
        }
        try {
            worker.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private boolean enqueue(Command command) {
        if (shutdown.get()) {
            return false;
        }
        boolean bounded = command instanceof Apply;
        if (bounded) {
            try {
                capacity.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        lifecycle.readLock().lock();
        try {
            if (shutdown.get()) {
                if (bounded) {
                    capacity.release();
                }
                return false;
            }
            queue.add(command);
            return true;
        } finally {
            lifecycle.readLock().unlock();
        }
    }

    private Command dequeued(Command command) {
        if (command instanceof Apply) {
            capacity.release();
        }
        return command;
    }

    private void apply(List<SyncMessage> batch) {
        if (batch.isEmpty()) {
            return;
        }
        SyncResult last = null;
        List<SyncException> failures = new ArrayList<>();
        for (SyncMessage message : batch) {
            try {
                last = engine.handle(message);
            } catch (SyncException e) {
                LOG.log(Level.WARNING, "Sync message rejected", e);
                failures.add(e);
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Sync engine failed on " + message.getClass().getSimpleName(), e);
                failures.add(new SyncException("Engine failure", e));
            }
        }
        if (last != null) {
            latest.set(last);
        }
        AppliedBatch applied = new AppliedBatch(batch, last, failures);
        for (BatchListener listener : listeners) {
            try {
                listener.batchApplied(applied);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Batch listener failed", e);
            }
        }
    }

    /**
     * State here is confined to the sync thread.
     */
    private final class Worker implements Runnable {
        private boolean workerPaused;
        private final List<SyncMessage> held = new ArrayList<>();

        @Override
        public void run() {
            try {
                while (true) {
                    Command command = dequeued(queue.take());
                    if (command == Control.SHUTDOWN) {
                        apply(drainHeld());
                        return;
                    }
                    if (command == Control.PAUSE) {
                        workerPaused = true;
                    } else if (command == Control.RESUME) {
                        workerPaused = false;
                        if (!held.isEmpty() && collect(drainHeld())) {
                            return;
                        }
                    } else if (command instanceof Apply applyCommand) {
                        if (workerPaused) {
                            held.add(applyCommand.message());
                        } else {
                            List<SyncMessage> batch = new ArrayList<>();
                            batch.add(applyCommand.message());
                            if (collect(batch)) {
                                return;
                            }
                        }
                    }
                }
            } catch (InterruptedException e) {
                LOG.fine("Sync thread interrupted, " + held.size() + " held messages dropped");
                Thread.currentThread().interrupt();
            }
        }

        /**
         * Extends {@code batch} until the debounce window closes, then applies it.
         *
         * @return true if a shutdown arrived and the thread should stop
         */
        private boolean collect(List<SyncMessage> batch) throws InterruptedException {
            long deadline = System.nanoTime() + debounce.toNanos();
            while (true) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    break;
                }
                Command next = queue.poll(remaining, TimeUnit.NANOSECONDS);
                if (next == null) {
                    break;
                }
                dequeued(next);
                if (next instanceof Apply applyCommand) {
                    batch.add(applyCommand.message());
                } else if (next == Control.PAUSE) {
                    LOG.fine("Paused while collecting, discarding " + batch.size() + " messages");
                    workerPaused = true;
                    return false;
                } else if (next == Control.SHUTDOWN) {
                    apply(batch);
                    return true;
                }
            }
            apply(batch);
            return false;
        }

        private List<SyncMessage> drainHeld() {
            List<SyncMessage> drained = new ArrayList<>(held);
            held.clear();
            return drained;
        }
    }
}
