package com.couchtv.core.cache;

/**
 * Starts a fire-and-forget worker. Workers are never joined, tracked or cancelled.
 */
@FunctionalInterface
public interface WorkerLauncher {

    void launch(String workerName, Runnable work);

    /**
     * One new daemon thread per cache miss.
     */
    static WorkerLauncher daemonThreads() {
        return (workerName, work) -> {
            Thread t = new Thread(work, workerName);
            t.setDaemon(true);
            t.start();
        };
    }
}
