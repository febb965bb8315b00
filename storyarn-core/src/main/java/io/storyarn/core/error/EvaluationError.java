package io.storyarn.core.error;

import java.util.Objects;

/// A problem found while evaluating a condition, an instruction or a node.
///
/// @param kind classification, not null
/// @param reference what the error concerns (a `sheet.variable` reference or node id), may be null
/// @param message human-readable description, not null
public record EvaluationError(ErrorKind kind, String reference, String message) {

    public EvaluationError {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static EvaluationError undefinedVariable(String reference) {
        return new EvaluationError(
                ErrorKind.UNDEFINED_VARIABLE_REFERENCE,
                reference,
                "Variable " + reference + " is not defined");
    }

    public static EvaluationError typeMismatch(String reference, String message) {
        return new EvaluationError(ErrorKind.TYPE_MISMATCH, reference, message);
    }

    public static EvaluationError missingTarget(String nodeId, String message) {
        return new EvaluationError(ErrorKind.MISSING_TARGET_NODE, nodeId, message);
    }

    @Override
    public String toString() {
        return kind + (reference != null ? " [" + reference + "]" : "") + ": " + message;
    }
}
