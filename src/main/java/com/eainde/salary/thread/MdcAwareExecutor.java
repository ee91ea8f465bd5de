package com.eainde.salary.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-per-task worker pool that carries the submitting thread's MDC (run id)
 * into each task, so provider logs stay correlated with their pipeline run.
 *
 * <p>The pool is unbounded: a task never waits behind a slow one, so a branch
 * deadline only ever measures the provider call itself. Idle threads are
 * reclaimed after a minute.</p>
 */
public class MdcAwareExecutor implements Executor {

    private final ExecutorService delegate =
            Executors.newCachedThreadPool(new NamedDaemonThreadFactory("salary-worker-"));

    @Override
    public void execute(Runnable command) {
        delegate.execute(withMdc(command));
    }

    /**
     * Like {@link #execute}, but returns a handle that can interrupt the task.
     */
    public Future<?> submit(Runnable command) {
        return delegate.submit(withMdc(command));
    }

    private static Runnable withMdc(Runnable command) {
        // Capture MDC context from the calling (parent) thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        return () -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        };
    }

    public void shutdown() {
        delegate.shutdown();
        try {
            if (!delegate.awaitTermination(5, TimeUnit.SECONDS)) {
                delegate.shutdownNow();
            }
        } catch (InterruptedException e) {
            delegate.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedDaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
