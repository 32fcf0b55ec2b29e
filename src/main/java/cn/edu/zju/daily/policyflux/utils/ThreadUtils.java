package cn.edu.zju.daily.policyflux.utils;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ThreadUtils {

    public static Thread.UncaughtExceptionHandler getUncaughtExceptionHandler() {
        return (th, ex) -> LOG.error("Uncaught exception in thread {}", th.getName(), ex);
    }

    /** Starts a daemon thread that logs instead of silently dying on uncaught exceptions. */
    public static Thread startDaemon(String name, Runnable runnable) {
        Thread thread = new Thread(runnable, name);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(getUncaughtExceptionHandler());
        thread.start();
        return thread;
    }
}
