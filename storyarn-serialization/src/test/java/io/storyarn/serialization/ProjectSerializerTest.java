package io.storyarn.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.storyarn.core.StoryarnFactory;
import io.storyarn.core.execution.DebugSession;
import io.storyarn.core.execution.FlowEngine;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.state.ExecutionStatus;
import io.storyarn.core.variable.Value;
import io.storyarn.core.variable.VariableConstraints;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableType;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProjectSerializerTest {

    private String tavernJson;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/projects/tavern.json")) {
            tavernJson = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Nested
    class Reading {

        @Test
        void shouldReadFlowsAndStartFlow() {
            // When
            ProjectDocument project = ProjectSerializer.fromJson(tavernJson);

            // Then
            assertThat(project.startFlowId()).isEqualTo("tavern");
            assertThat(project.flows())
                    .extracting(Flow::getId)
                    .containsExactly("tavern", "cellar");
            assertThat(project.repository().count()).isEqualTo(2);
        }

        @Test
        void shouldReadTypedVariables() {
            // When
            ProjectDocument project = ProjectSerializer.fromJson(tavernJson);

            // Then
            assertThat(project.variables().size()).isEqualTo(7);
            assertThat(project.variables().get("mc.jaime", "gold")).isEqualTo(Value.number(10));
            assertThat(project.variables().get("mc.jaime", "class"))
                    .isEqualTo(Value.select("rogue"));
            assertThat(project.variables().get("mc.jaime", "traits"))
                    .isEqualTo(Value.multiSelect("brave", "curious"));
            assertThat(project.variables().get("quests", "started_on")).isEqualTo(Value.UNDEFINED);
            assertThat(project.variables().find(VariableKey.parse("mc.jaime.gold")))
                    .get()
                    .satisfies(
                            v -> {
                                assertThat(v.type()).isEqualTo(VariableType.NUMBER);
                                assertThat(v.constraints())
                                        .isEqualTo(
                                                VariableConstraints.range(
                                                        BigDecimal.ZERO, new BigDecimal("999")));
                            });
        }

        @Test
        void shouldDefaultStartFlowToFirstFlow() {
            // Given
            String json =
                    """
                    {"flows": [
                      {"id": "first", "nodes": [{"id": "e", "type": "entry"}]},
                      {"id": "second", "nodes": [{"id": "e", "type": "entry"}]}
                    ]}
                    """;

            // When
            ProjectDocument project = ProjectSerializer.fromJson(json);

            // Then
            assertThat(project.startFlowId()).isEqualTo("first");
            assertThat(project.variables().isEmpty()).isTrue();
        }

        @Test
        void shouldReadFromFile(@TempDir Path dir) throws IOException {
            // Given
            Path file = dir.resolve("tavern.json");
            Files.writeString(file, tavernJson);

            // When
            ProjectDocument project = ProjectSerializer.read(file);

            // Then
            assertThat(project.flows()).hasSize(2);
        }

        @Test
        void shouldWriteAndReadBackSameDocument() {
            // Given
            ProjectDocument project = ProjectSerializer.fromJson(tavernJson);

            // When
            String json = ProjectSerializer.toJson(project);
            ProjectDocument restored = ProjectSerializer.fromJson(json);

            // Then
            assertThat(restored.variables()).isEqualTo(project.variables());
            assertThat(ProjectSerializer.toJson(restored)).isEqualTo(json);
        }
    }

    @Nested
    class Failures {

        @Test
        void shouldRejectMissingFile(@TempDir Path dir) {
            assertThatThrownBy(() -> ProjectSerializer.read(dir.resolve("missing.json")))
                    .isInstanceOf(UncheckedIOException.class)
                    .hasMessageContaining("missing.json");
        }

        @Test
        void shouldRejectUnknownStartFlow() {
            String json =
                    "{\"start_flow\": \"nowhere\", \"flows\": [{\"id\": \"a\", \"nodes\": []}]}";

            assertThatThrownBy(() -> ProjectSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nowhere");
        }

        @Test
        void shouldRejectDuplicateFlowIds() {
            String json =
                    """
                    {"flows": [{"id": "a", "nodes": []}, {"id": "a", "nodes": []}]}
                    """;

            assertThatThrownBy(() -> ProjectSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate flow id a");
        }

        @Test
        void shouldRejectValueNotMatchingDeclaredType() {
            String json =
                    """
                    {"variables": [{"shortcut": "s", "variables": [
                      {"name": "age", "type": "number", "value": "old"}
                    ]}], "flows": []}
                    """;

            assertThatThrownBy(() -> ProjectSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("'old' is not a valid number value");
        }

        @Test
        void shouldRejectUnknownVariableType() {
            String json =
                    """
                    {"variables": [{"shortcut": "s", "variables": [
                      {"name": "pos", "type": "vector"}
                    ]}], "flows": []}
                    """;

            assertThatThrownBy(() -> ProjectSerializer.fromJson(json))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("unknown type vector");
        }
    }

    @Nested
    class Export {

        private final ObjectMapper mapper = new ObjectMapper();

        @Test
        void shouldExportPendingChoices() throws Exception {
            // Given
            ProjectDocument project = ProjectSerializer.fromJson(tavernJson);
            FlowEngine engine = StoryarnFactory.createEngine(project.repository());
            DebugSession session =
                    engine.run(engine.start(project.startFlowId(), project.variables()));

            // When
            JsonNode exported = mapper.readTree(ProjectSerializer.exportState(session.state()));

            // Then
            assertThat(exported.get("status").asText()).isEqualTo("awaiting_choice");
            assertThat(exported.get("current_node_id").asText()).isEqualTo("greet");
            assertThat(exported.get("pending_choices")).hasSize(2);
            assertThat(exported.get("pending_choices").get(0).get("valid").asBoolean()).isTrue();
            assertThat(exported.get("variables").get("quests.met_keeper").asBoolean()).isTrue();
            assertThat(exported.get("variables").get("quests.started_on").isNull()).isTrue();
        }

        @Test
        void shouldExportFinishedSessionWithHistoryAndPath() throws Exception {
            // Given
            ProjectDocument project = ProjectSerializer.fromJson(tavernJson);
            FlowEngine engine = StoryarnFactory.createEngine(project.repository());
            DebugSession session =
                    engine.run(engine.start(project.startFlowId(), project.variables()));
            session = engine.run(engine.selectChoice(session, "ale"));

            // When
            JsonNode exported = mapper.readTree(ProjectSerializer.exportState(session.state()));

            // Then
            assertThat(session.state().getStatus()).isEqualTo(ExecutionStatus.FINISHED);
            assertThat(exported.get("status").asText()).isEqualTo("finished");
            assertThat(exported.get("variables").get("mc.jaime.gold").intValue()).isEqualTo(8);
            assertThat(exported.get("variables").get("mc.jaime.traits"))
                    .extracting(JsonNode::asText)
                    .containsExactly("brave", "curious");
            assertThat(exported.get("call_stack")).isEmpty();
            assertThat(exported.get("history")).isNotEmpty();
            assertThat(exported.get("path").findValuesAsText("node_id")).contains("dark");
            assertThat(exported.has("error")).isFalse();
        }
    }
}
