package com.example.fileorganizer;

import com.example.fileorganizer.exception.ClassificationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs per-file work under a deadline. On expiry the future is cancelled and a
 * {@link ClassificationTimeoutException} is thrown; work already running finishes on its
 * daemon thread and its result is discarded.
 */
public final class FileTimeouts {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileTimeouts.class);

    private static final ExecutorService EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "file-timeout-executor");
        t.setDaemon(true);
        return t;
    });

    private FileTimeouts() {
    }

    @FunctionalInterface
    public interface IoTask<T> {
        T call() throws IOException;
    }

    /**
     * Runs the task directly when {@code timeout} is null, zero or negative.
     */
    public static <T> T call(String operation, Duration timeout, IoTask<T> task) throws IOException {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return task.call();
        }
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> {
            try {
                return task.call();
            } catch (IOException e) {
                throw new CompletionException(e);
            }
        }, EXECUTOR);

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warn("Operation '{}' timed out after {} ms", operation, timeout.toMillis());
            throw new ClassificationTimeoutException(operation, timeout, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ClassificationTimeoutException(operation, timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Operation '" + operation + "' failed", cause);
        }
    }
}
