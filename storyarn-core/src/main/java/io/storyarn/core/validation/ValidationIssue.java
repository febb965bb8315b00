package io.storyarn.core.validation;

import java.util.Objects;

/// A problem found by {@link FlowValidator}.
///
/// @param severity how serious the problem is, not null
/// @param flowId flow concerned, not null
/// @param nodeId node concerned, null for flow-level problems
/// @param message description, not null
public record ValidationIssue(Severity severity, String flowId, String nodeId, String message) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(flowId, "flowId must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    static ValidationIssue error(String flowId, String nodeId, String message) {
        return new ValidationIssue(Severity.ERROR, flowId, nodeId, message);
    }

    static ValidationIssue warning(String flowId, String nodeId, String message) {
        return new ValidationIssue(Severity.WARNING, flowId, nodeId, message);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + flowId + (nodeId != null ? "/" + nodeId : "") + ": " + message;
    }
}
