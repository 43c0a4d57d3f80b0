package com.safepocket.anomaly.detector;

import com.safepocket.anomaly.model.DetectorFinding;
import java.util.List;
import java.util.Objects;

/**
 * Result of one detector run. Only {@link Status#COMPLETED} runs take part in ensemble voting.
 */
public record DetectorOutcome(
        String detector,
        Status status,
        List<DetectorFinding> findings,
        String reason,
        Throwable cause
) {
    public enum Status {
        COMPLETED,
        SKIPPED,
        FAILED
    }

    public DetectorOutcome {
        Objects.requireNonNull(detector, "detector");
        Objects.requireNonNull(status, "status");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }

    public static DetectorOutcome completed(String detector, List<DetectorFinding> findings) {
        return new DetectorOutcome(detector, Status.COMPLETED, findings, null, null);
    }

    public static DetectorOutcome skipped(String detector, String reason) {
        return new DetectorOutcome(detector, Status.SKIPPED, List.of(), reason, null);
    }

    public static DetectorOutcome failed(String detector, String reason, Throwable cause) {
        return new DetectorOutcome(detector, Status.FAILED, List.of(), reason, cause);
    }

    public boolean completed() {
        return status == Status.COMPLETED;
    }
}
