package com.example.vexreport.infrastructure.concurrency;

import com.example.vexreport.infrastructure.exception.JobDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * Runs independent jobs either sequentially on the calling thread or on a fixed set of worker threads.
 * <p>
 * The mode is fixed at construction: a concurrency of 1 disables threading, a concurrency of N &gt; 1 starts
 * exactly N workers up front and 0 resolves to the number of available processors. Jobs carry no result;
 * they report their own outcome. {@link #close()} stops accepting jobs and blocks until every queued job has run,
 * so the dispatcher is meant to be used in a try-with-resources block.
 */
public final class JobDispatcher implements AutoCloseable {

    /**
     * Upper bound for the job count, also used to clamp the processor count.
     */
    public static final int MAX_JOBS = 255;

    private static final Logger log = LoggerFactory.getLogger(JobDispatcher.class);
    private static final String WORKER_NAME_PREFIX = "report-worker-";

    private final int jobCount;
    private final ThreadPoolExecutor workers;

	/**
	 * Creates a dispatcher for the requested concurrency level.
	 *
	 * @param concurrency 0 for all available processors, 1 for sequential mode, N for N workers
	 * @throws IllegalArgumentException when {@code concurrency} is negative or above {@link #MAX_JOBS}
	 * @throws JobDispatchException     when 0 is requested and the processor count cannot be determined
	 */
    public JobDispatcher(int concurrency) {
        this(concurrency, () -> Runtime.getRuntime().availableProcessors());
    }

    JobDispatcher(int concurrency, IntSupplier availableProcessors) {
        this.jobCount = resolveJobCount(concurrency, availableProcessors);
        if (jobCount == 1) {
            this.workers = null;
        } else {
            this.workers = new ThreadPoolExecutor(jobCount, jobCount, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), new WorkerThreadFactory());
            workers.prestartAllCoreThreads();
        }
    }

	/**
	 * Resolves the requested concurrency into the effective job count.
	 *
	 * @param concurrency         requested level
	 * @param availableProcessors source of the processor count, consulted only for 0
	 * @return job count between 1 and {@link #MAX_JOBS}
	 */
    static int resolveJobCount(int concurrency, IntSupplier availableProcessors) {
        if (concurrency < 0 || concurrency > MAX_JOBS) {
            throw new IllegalArgumentException(
                    "Job count must be between 0 and " + MAX_JOBS + " but was " + concurrency);
        }
        if (concurrency != 0) {
            return concurrency;
        }
        int processors = availableProcessors.getAsInt();
        if (processors < 1) {
            throw new JobDispatchException(
                    "Unable to find any threads to run with. Possible system-side restrictions or limitations.");
        }
        return Math.min(processors, MAX_JOBS);
    }

	/**
	 * Runs or enqueues a job.
	 * In sequential mode the job has finished when this method returns and anything it throws propagates to
	 * the caller. In threaded mode the method returns as soon as the job is queued; a runtime exception thrown
	 * by the job is logged by the worker, which then moves on to the next job.
	 *
	 * @param job job to run
	 * @throws JobDispatchException when the dispatcher is already closed
	 */
    public void execute(Runnable job) {
        if (job == null) {
            throw new IllegalArgumentException("job is required");
        }
        if (isSequential()) {
            job.run();
            return;
        }
        try {
            workers.execute(() -> runOnWorker(job));
        } catch (RejectedExecutionException ex) {
            throw new JobDispatchException("Attempted to send a job after the dispatcher was closed.", ex);
        }
    }

    public boolean isSequential() {
        return workers == null;
    }

    public int jobCount() {
        return jobCount;
    }

    boolean isTerminated() {
        return workers == null || workers.isTerminated();
    }

	/**
	 * Stops accepting jobs, then waits for every worker to finish the queued and running ones.
	 * There is no timeout. Closing a sequential dispatcher, or closing twice, does nothing.
	 *
	 * @throws JobDispatchException when interrupted while waiting for the workers
	 */
    @Override
    public void close() {
        if (workers == null || workers.isTerminated()) {
            return;
        }
        log.debug("Shutting down {} workers", jobCount);
        workers.shutdown();
        try {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
                log.debug("Still waiting for {} active workers", workers.getActiveCount());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new JobDispatchException("Interrupted while waiting for the workers to finish.", ex);
        }
    }

    @Override
    public String toString() {
        if (isSequential()) {
            return "Concurrency disabled: running all jobs sequentially in the calling thread";
        }
        return "Concurrency enabled: running with " + jobCount + " jobs";
    }

    private static void runOnWorker(Runnable job) {
        String worker = Thread.currentThread().getName();
        log.debug("{} got a job; executing.", worker);
        try {
            job.run();
        } catch (RuntimeException ex) {
            log.error("{} caught an exception escaping its job", worker, ex);
        }
    }

    /**
     * Names workers {@code report-worker-1..N} and logs when one exits.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger nextId = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            String name = WORKER_NAME_PREFIX + nextId.getAndIncrement();
            Thread thread = new Thread(() -> {
                try {
                    runnable.run();
                } finally {
                    log.debug("{} disconnected; shutting down.", name);
                }
            }, name);
            thread.setDaemon(true);
            return thread;
        }
    }
}
