package com.clausescan.processing;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

final class AnalysisFutures {

    private AnalysisFutures() {
    }

    /**
     * Joins a future, rethrowing the original unchecked failure of the analysis task.
     */
    static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }
}
