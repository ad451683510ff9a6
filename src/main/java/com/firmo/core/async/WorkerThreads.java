package com.firmo.core.async;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for parallel branches and time-bounded case bodies. Threads are daemons.
 */
public final class WorkerThreads {

    private WorkerThreads() {}

    public static ExecutorService newCachedPool(String prefix) {
        return Executors.newCachedThreadPool(daemonFactory(prefix));
    }

    static ThreadFactory daemonFactory(String prefix) {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
