package io.storyarn.core.flow;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// In-memory flow repository (default implementation).
///
/// @implNote Uses ConcurrentHashMap for thread-safety. Iteration order of
/// {@link #findAll()} is unspecified.
/// @see FlowRepository for contract
public final class InMemoryFlowRepository implements FlowRepository {

    private final Map<String, Flow> storage = new ConcurrentHashMap<>();

    public InMemoryFlowRepository() {}

    /// Creates a repository pre-populated with `flows`.
    ///
    /// @param flows flows to save, not null
    public InMemoryFlowRepository(Collection<Flow> flows) {
        flows.forEach(this::save);
    }

    public static InMemoryFlowRepository of(Flow... flows) {
        return new InMemoryFlowRepository(List.of(flows));
    }

    @Override
    public void save(Flow flow) {
        Objects.requireNonNull(flow, "flow must not be null");
        storage.put(flow.getId(), flow);
    }

    @Override
    public Optional<Flow> findById(String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        return Optional.ofNullable(storage.get(flowId));
    }

    @Override
    public List<Flow> findAll() {
        return List.copyOf(storage.values());
    }

    @Override
    public boolean exists(String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        return storage.containsKey(flowId);
    }

    @Override
    public boolean delete(String flowId) {
        Objects.requireNonNull(flowId, "flowId must not be null");
        return storage.remove(flowId) != null;
    }

    @Override
    public int count() {
        return storage.size();
    }
}
