package io.github.galkahana.analysisrunner.pool;

public enum WorkerStatus {
    IDLE,
    BUSY,
    RESTARTING
}
