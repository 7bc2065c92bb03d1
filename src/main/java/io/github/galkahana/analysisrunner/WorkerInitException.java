package io.github.galkahana.analysisrunner;

/**
 * Workers could not be spawned or did not report ready in time.
 */
public class WorkerInitException extends RuntimeException {

    public WorkerInitException(String message) {
        super(message);
    }

    public WorkerInitException(String message, Throwable cause) {
        super(message, cause);
    }
}
