package io.storyarn.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.storyarn.core.execution.DebugSession;
import io.storyarn.core.execution.ExecutionListener;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.execution.evaluator.EvaluationContext;
import io.storyarn.core.execution.evaluator.NodeEvaluator;
import io.storyarn.core.execution.evaluator.NodeOutcome;
import io.storyarn.core.execution.log.LogKind;
import io.storyarn.core.execution.transition.Transition;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.InMemoryFlowRepository;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.SceneNode;
import io.storyarn.core.state.ExecutionState;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.variable.VariableStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@DisplayName("StoryarnFactory")
@ExtendWith(MockitoExtension.class)
class StoryarnFactoryTest {

    @Mock private ExecutionListener listener;

    private final Flow flow =
            Flow.builder()
                    .id("intro")
                    .node(EntryNode.builder().id("entry").next("scene").build())
                    .node(SceneNode.builder().id("scene").location("Tavern").next("end").build())
                    .node(ExitNode.builder().id("end").build())
                    .build();

    @Nested
    @DisplayName("builder")
    class Builder {

        @Test
        @DisplayName("plays a flow to completion with defaults")
        void shouldPlayFlowWithDefaults() throws Exception {
            FlowEngine engine = StoryarnFactory.createEngine(InMemoryFlowRepository.of(flow));

            DebugSession session = engine.run(engine.start("intro", VariableStore.empty()));

            assertThat(session.state().getStatus()).isEqualTo(ExecutionStatus.FINISHED);
            assertThat(session.state().getStepCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("notifies the listener of every node and the finish")
        void shouldNotifyListener() throws Exception {
            // Given
            FlowEngine engine =
                    StoryarnFactory.builder()
                            .flowRepository(InMemoryFlowRepository.of(flow))
                            .listener(listener)
                            .build();

            // When
            engine.run(engine.start("intro", VariableStore.empty()));

            // Then
            InOrder order = inOrder(listener);
            order.verify(listener).onNodeStart(argThat(n -> n.getId().equals("entry")), any());
            order.verify(listener).onNodeStart(argThat(n -> n.getId().equals("scene")), any());
            order.verify(listener).onNodeStart(argThat(n -> n.getId().equals("end")), any());
            order.verify(listener)
                    .onFinish(argThat(s -> s.getStatus() == ExecutionStatus.FINISHED));
            verify(listener, times(3)).onNodeComplete(any(), any());
            verify(listener, never()).onPause(any());
        }

        @Test
        @DisplayName("notifies the listener when the step limit pauses a session")
        void shouldNotifyPause() throws Exception {
            FlowEngine engine =
                    StoryarnFactory.builder()
                            .config(StoryarnConfig.builder().maxSteps(1).build())
                            .flowRepository(InMemoryFlowRepository.of(flow))
                            .listener(listener)
                            .build();

            engine.run(engine.start("intro", VariableStore.empty()));

            verify(listener).onPause(argThat(s -> s.getStepCount() == 1));
            verify(listener, never()).onFinish(any());
        }

        @Test
        @DisplayName("replaces a built-in evaluator")
        void shouldUseCustomEvaluator() throws Exception {
            // Given
            NodeEvaluator<SceneNode> skipScenes =
                    new NodeEvaluator<>() {
                        @Override
                        public Class<SceneNode> getNodeType() {
                            return SceneNode.class;
                        }

                        @Override
                        public NodeOutcome evaluate(SceneNode node, EvaluationContext context) {
                            return NodeOutcome.builder(context.getState().getVariables())
                                    .note(LogKind.INFO, "custom scene")
                                    .build(Transition.finished("scenes end the story"));
                        }
                    };
            FlowEngine engine =
                    StoryarnFactory.builder()
                            .flowRepository(InMemoryFlowRepository.of(flow))
                            .evaluator(skipScenes)
                            .build();

            // When
            DebugSession session = engine.run(engine.start("intro", VariableStore.empty()));

            // Then
            ExecutionState state = session.state();
            assertThat(state.getCurrentNodeId()).isEqualTo("scene");
            assertThat(state.getStatus()).isEqualTo(ExecutionStatus.FINISHED);
            assertThat(state.getLog())
                    .anySatisfy(e -> assertThat(e.message()).isEqualTo("custom scene"));
        }

        @Test
        @DisplayName("applies the configuration")
        void shouldApplyConfig() {
            StoryarnConfig config = StoryarnConfig.builder().maxCallDepth(4).build();

            FlowEngine engine = StoryarnFactory.createEngine(config, new InMemoryFlowRepository());

            assertThat(engine.getConfig().getMaxCallDepth()).isEqualTo(4);
        }
    }
}
