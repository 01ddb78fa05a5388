package com.eainde.diagnosis.thread;

import org.slf4j.MDC;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs tasks on a cached pool of daemon threads, carrying the caller's MDC
 * (request id) into the worker so reviewer logs stay correlated.
 */
public class MdcAwareExecutor implements Executor, AutoCloseable {

    private final ExecutorService delegate;

    public MdcAwareExecutor(String threadNamePrefix) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, threadNamePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        this.delegate = Executors.newCachedThreadPool(factory);
    }

    @Override
    public void execute(Runnable command) {
        // captured on the calling thread
        Map<String, String> parentMdc = MDC.getCopyOfContextMap();

        delegate.execute(() -> {
            if (parentMdc != null) {
                MDC.setContextMap(parentMdc);
            }
            try {
                command.run();
            } finally {
                MDC.clear();
            }
        });
    }

    @Override
    public void close() {
        delegate.shutdownNow();
    }
}
