package io.storyarn.core.state;

import java.util.Objects;

/// Where to continue after a called flow returns.
///
/// A frame without `returnNodeId` comes from a call that has nowhere to come back to (an
/// `exit` in flow mode, or a subflow node without outgoing edge). Returning through such a
/// frame keeps unwinding to the next frame.
///
/// @param returnFlowId flow of the caller, not null
/// @param returnNodeId node to resume in the caller, may be null
/// @param callerNodeId node that made the call, not null
public record CallFrame(String returnFlowId, String returnNodeId, String callerNodeId) {

    public CallFrame {
        Objects.requireNonNull(returnFlowId, "returnFlowId must not be null");
        Objects.requireNonNull(callerNodeId, "callerNodeId must not be null");
    }

    public boolean hasReturnNode() {
        return returnNodeId != null;
    }
}
