package io.storyarn.core.execution;

/// Result of {@link FlowEngine#step(DebugSession)}.
///
/// @param session session after the step, not null
/// @param snapshotPushed whether an undo point was recorded (false when nothing was stepped)
public record StepResult(DebugSession session, boolean snapshotPushed) {}
