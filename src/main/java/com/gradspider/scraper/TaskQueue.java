package com.gradspider.scraper;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closable FIFO backlog of {@link DiscoveryTask}s shared by all Harvesters of a run.
 * <p>
 * {@link #pop()} blocks while the queue is empty but still open, and returns
 * {@link Optional#empty()} once it is closed and drained, so workers never wait forever.
 *
 * @author Grad Program Scraper Team
 * @since 1.0
 */
public class TaskQueue {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<DiscoveryTask> tasks = new ArrayDeque<>();
    private boolean closed;

    /**
     * Appends a task.
     * @throws IllegalStateException if the queue was already closed
     */
    public void push(DiscoveryTask task) {
        if (task == null) throw new IllegalArgumentException("Task cannot be null");
        lock.lock();
        try {
            if (closed) throw new IllegalStateException("Task queue is closed");
            tasks.addLast(task);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    public void pushAll(Collection<DiscoveryTask> batch) {
        for (DiscoveryTask task : batch) push(task);
    }

    /**
     * Takes the oldest task, blocking while the queue is open and empty.
     * @return the task, or empty once the queue is closed and has nothing left
     */
    public Optional<DiscoveryTask> pop() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (tasks.isEmpty() && !closed) {
                notEmpty.await();
            }
            return Optional.ofNullable(tasks.pollFirst());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks that no more tasks will be pushed and wakes every blocked consumer.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return tasks.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every task nobody took, in order. Used to report work abandoned by a cancelled run.
     */
    public List<DiscoveryTask> drainRemaining() {
        lock.lock();
        try {
            List<DiscoveryTask> rest = new ArrayList<>(tasks);
            tasks.clear();
            return rest;
        } finally {
            lock.unlock();
        }
    }
}
