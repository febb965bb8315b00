package io.storyarn.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.variable.VariableStore;
import io.storyarn.serialization.mixin.FlowBuilderMixin;
import io.storyarn.serialization.mixin.FlowMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Storyarn serialization configuration in one
/// place.
///
/// **Custom serializer/deserializer pairs**:
/// - `Node` - `NodeSerializer` / `NodeDeserializer`, discriminator: `"type"`
/// - `ConditionTree` - block form out; block, legacy rule-list and string forms in
/// - `Assignment` - discriminator: `"value_type"`
/// - `VariableStore` - sheet array
/// - `ProjectDocument` - variables, flows and start flow
/// - `ExecutionState` - serializer only, for exporting a session
///
/// **Mixin/builder pairs**:
/// - `Flow` + `Flow.Builder`
///
/// @see FlowSerializer for the convenience factory API
public class StoryarnJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3364092257718405216L;

    public StoryarnJacksonModule() {
        super("StoryarnJacksonModule");

        addSerializer(Node.class, new NodeSerializer());
        addDeserializer(Node.class, new NodeDeserializer());

        addSerializer(ConditionTree.class, new ConditionTreeSerializer());
        addDeserializer(ConditionTree.class, new ConditionTreeDeserializer());

        addSerializer(Assignment.class, new AssignmentSerializer());
        addDeserializer(Assignment.class, new AssignmentDeserializer());

        addSerializer(VariableStore.class, new VariableStoreSerializer());
        addDeserializer(VariableStore.class, new VariableStoreDeserializer());

        addSerializer(ProjectDocument.class, new ProjectDocumentSerializer());
        addDeserializer(ProjectDocument.class, new ProjectDocumentDeserializer());

        addSerializer(ExecutionState.class, new ExecutionStateSerializer());
    }

    /// Applies mixin annotations to builder-pattern domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(Flow.class, FlowMixin.class);
        context.setMixInAnnotations(Flow.Builder.class, FlowBuilderMixin.class);
    }
}
