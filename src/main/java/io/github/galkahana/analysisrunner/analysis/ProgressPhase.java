package io.github.galkahana.analysisrunner.analysis;

public enum ProgressPhase {
    COLLECT_FILES("collectFiles"),
    RUN_DETECTORS("runDetectors"),
    COMPLETE("complete");

    private final String label;

    ProgressPhase(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
