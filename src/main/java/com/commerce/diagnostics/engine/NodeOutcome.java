package com.commerce.diagnostics.engine;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Transition returned by a node executor.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NodeOutcome {

    public enum Status {
        SUCCESS,
        DONE,
        SUPPRESSED,
        DEFERRED
    }

    private Status status;
    private String next;
    private String reason;

    public static NodeOutcome success(String next) {
        return new NodeOutcome(Status.SUCCESS, next, null);
    }

    public static NodeOutcome done() {
        return new NodeOutcome(Status.DONE, null, null);
    }

    public static NodeOutcome suppressed(String reason) {
        return new NodeOutcome(Status.SUPPRESSED, null, reason);
    }

    public static NodeOutcome deferred(String reason) {
        return new NodeOutcome(Status.DEFERRED, null, reason);
    }
}
