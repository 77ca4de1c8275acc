package org.janelia.diffraction.batch;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.janelia.diffraction.fit.FitGrainJob;

/**
 * Thread safe queue of grain jobs with completion tracking.
 *
 * Workers poll with {@link #tryGet()} and acknowledge each dequeued job with {@link #taskDone()}
 * after its result has been handed to the {@link ResultCollector}.
 * {@link #awaitCompletion()} blocks until every job that was put has been acknowledged.
 */
public class JobQueue {

    private final Queue<FitGrainJob> jobs;
    private final ReentrantLock lock;
    private final Condition allDone;
    private int unfinishedCount;

    public JobQueue() {
        this.jobs = new ConcurrentLinkedQueue<>();
        this.lock = new ReentrantLock();
        this.allDone = lock.newCondition();
        this.unfinishedCount = 0;
    }

    /**
     * Adds a job without blocking.
     */
    public void put(final FitGrainJob job) {
        lock.lock();
        try {
            unfinishedCount++;
        } finally {
            lock.unlock();
        }
        jobs.add(job);
    }

    /**
     * @return the next job or null if the queue is empty (the worker termination signal).
     */
    public FitGrainJob tryGet() {
        return jobs.poll();
    }

    /**
     * Acknowledges that one previously dequeued job has been completely processed.
     *
     * @throws IllegalStateException
     *   if more jobs are acknowledged than were put.
     */
    public void taskDone()
            throws IllegalStateException {
        lock.lock();
        try {
            if (unfinishedCount <= 0) {
                throw new IllegalStateException("taskDone called more times than jobs were put");
            }
            unfinishedCount--;
            if (unfinishedCount == 0) {
                allDone.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Blocks until every job that was put has been acknowledged.
     */
    public void awaitCompletion()
            throws InterruptedException {
        lock.lock();
        try {
            while (unfinishedCount > 0) {
                allDone.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        return jobs.size();
    }

    public int getUnfinishedCount() {
        lock.lock();
        try {
            return unfinishedCount;
        } finally {
            lock.unlock();
        }
    }
}
