package io.storyarn.core.flow;

import java.util.List;
import java.util.Optional;

/// Source of flow definitions for the engine.
///
/// The engine only reads from the repository; flows are loaded by collaborators (the
/// JSON reader, a test, an editor) before a session starts.
///
/// ### Idempotent Operations
/// {@link #save} overwrites a flow with the same id.
///
/// @see InMemoryFlowRepository for the default implementation
public interface FlowRepository {

    /// Saves a flow definition (idempotent).
    ///
    /// @param flow the flow to store, not null
    /// @throws NullPointerException if flow is null
    void save(Flow flow);

    /// Finds a flow by id.
    ///
    /// @param flowId the flow identifier, not null
    /// @return the flow if found, empty otherwise
    Optional<Flow> findById(String flowId);

    /// @return all flows, never null (may be empty)
    List<Flow> findAll();

    boolean exists(String flowId);

    /// @return true if the flow was deleted, false if not found
    boolean delete(String flowId);

    int count();
}
