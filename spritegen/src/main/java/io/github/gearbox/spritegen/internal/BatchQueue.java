/*
 * SPDX-FileCopyrightText: 2025 Stanio <stanio AT yahoo DOT com>
 * SPDX-License-Identifier: 0BSD
 */
package io.github.gearbox.spritegen.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs independent tasks (one per input file) concurrently.  A failing
 * task doesn't cancel or affect the others: its exception is recorded,
 * and reported from {@link #await()}.
 */
public class BatchQueue {

    private static final Logger log = Logger.getLogger(BatchQueue.class.getName());

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }


    public static final class Failure {

        public final String name;
        public final Throwable error;

        Failure(String name, Throwable error) {
            this.name = name;
            this.error = error;
        }

        @Override
        public String toString() {
            return name + ": " + error;
        }

    } // class Failure


    private static final class DefaultExecutor {
        static final Executor instance;
        static {
            int parallelism = Integer.getInteger("spritegen.parallelism",
                    Runtime.getRuntime().availableProcessors());
            instance = Executors.newFixedThreadPool(Math
                    .max(1, Math.min(0x7FFF, parallelism)), daemonThreadFactory());
        }
    }

    private final Executor executor;

    private final Lock sync = new ReentrantLock();

    private final Condition taskComplete = sync.newCondition();

    private final List<Failure> failures = new ArrayList<>();

    private int pending;

    public BatchQueue() {
        this(DefaultExecutor.instance);
    }

    public BatchQueue(Executor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public void submit(String name, Task task) {
        sync.lock();
        try {
            pending++;
        } finally {
            sync.unlock();
        }

        try {
            executor.execute(() -> run(name, task));
        } catch (RuntimeException e) {
            complete(name, e);
        }
    }

    private void run(String name, Task task) {
        Throwable error = null;
        try {
            task.run();
        } catch (Exception | Error e) {
            log.log(Level.WARNING, e, () -> "Failed: " + name);
            error = e;
        }
        complete(name, error);
    }

    private void complete(String name, Throwable error) {
        sync.lock();
        try {
            if (error != null) {
                failures.add(new Failure(name, error));
            }
            pending--;
            taskComplete.signalAll();
        } finally {
            sync.unlock();
        }
    }

    /**
     * Waits for all submitted tasks to complete.
     *
     * @return  failures of the completed tasks, in completion order;
     *          empty if all succeeded
     * @throws  InterruptedException  if interrupted while waiting
     */
    public List<Failure> await() throws InterruptedException {
        sync.lock();
        try {
            while (pending > 0) {
                taskComplete.await();
            }
            return Collections.unmodifiableList(new ArrayList<>(failures));
        } finally {
            sync.unlock();
        }
    }

    static ThreadFactory daemonThreadFactory() {
        ThreadFactory dtf = Executors.defaultThreadFactory();
        return r -> {
            Thread th = dtf.newThread(r);
            th.setDaemon(true);
            return th;
        };
    }

}
