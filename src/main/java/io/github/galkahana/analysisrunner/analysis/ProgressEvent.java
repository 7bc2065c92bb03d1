package io.github.galkahana.analysisrunner.analysis;

import java.util.List;

/**
 * Progress notification emitted by {@link TaskGenerator}.
 *
 * @param phase Current phase
 * @param total Total units of work in the phase, null when not known
 * @param completed Completed units of work, null when not applicable
 * @param message Optional human readable detail
 * @param detectorsSkipped Routines skipped because no relevant file changed
 */
public record ProgressEvent(ProgressPhase phase, Integer total, Integer completed, String message,
                            List<String> detectorsSkipped) {

    public ProgressEvent {
        detectorsSkipped = detectorsSkipped == null ? List.of() : List.copyOf(detectorsSkipped);
    }

    static ProgressEvent message(ProgressPhase phase, String message) {
        return new ProgressEvent(phase, null, null, message, List.of());
    }
}
