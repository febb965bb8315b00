package io.storyarn.core.execution.log;

/// A node visited during the session.
///
/// @param step step count at which the node became current
/// @param flowId flow containing the node, not null
/// @param nodeId node visited, not null
/// @param depth call stack depth at the time
public record PathEntry(int step, String flowId, String nodeId, int depth) {}
