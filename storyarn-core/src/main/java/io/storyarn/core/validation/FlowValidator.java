package io.storyarn.core.validation;

import io.storyarn.core.condition.ConditionTree;
import io.storyarn.core.condition.Rule;
import io.storyarn.core.flow.Flow;
import io.storyarn.core.flow.FlowRepository;
import io.storyarn.core.flow.node.ConditionNode;
import io.storyarn.core.flow.node.DialogueNode;
import io.storyarn.core.flow.node.EntryNode;
import io.storyarn.core.flow.node.ExitMode;
import io.storyarn.core.flow.node.ExitNode;
import io.storyarn.core.flow.node.HubNode;
import io.storyarn.core.flow.node.InstructionNode;
import io.storyarn.core.flow.node.JumpNode;
import io.storyarn.core.flow.node.Node;
import io.storyarn.core.flow.node.Response;
import io.storyarn.core.flow.node.SubflowNode;
import io.storyarn.core.flow.node.SwitchCase;
import io.storyarn.core.instruction.Assignment;
import io.storyarn.core.instruction.AssignmentValue;
import io.storyarn.core.variable.VariableKey;
import io.storyarn.core.variable.VariableStore;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Static checks over the flows of a project.
///
/// ### Errors
/// - flow without entry node, or with more than one
/// - edge to a node that does not exist in the flow
/// - jump to an unknown hub
/// - subflow or flow-mode exit to an unknown flow
///
/// ### Warnings
/// - nodes not reachable from the entry
/// - dialogues without text
/// - flows that call each other in a cycle
/// - rules and assignments naming variables the given store does not declare
///
/// Issues are returned in flow id order, then in node order.
public class FlowValidator {

    /// Validates every flow of `repository` without variable checks.
    ///
    /// @param repository flows to check, not null
    /// @return issues found, never null
    public List<ValidationIssue> validate(FlowRepository repository) {
        return validate(repository, null);
    }

    /// Validates every flow of `repository`.
    ///
    /// @param repository flows to check, not null
    /// @param variables declared variables, or null to skip variable reference checks
    /// @return issues found, never null
    public List<ValidationIssue> validate(FlowRepository repository, VariableStore variables) {
        List<Flow> flows = new ArrayList<>(repository.findAll());
        flows.sort(Comparator.comparing(Flow::getId));

        List<ValidationIssue> issues = new ArrayList<>();
        for (Flow flow : flows) {
            checkEntry(flow, issues);
            checkEdges(flow, repository, issues);
            checkReachability(flow, issues);
            checkDialogues(flow, issues);
            if (variables != null) {
                checkVariableReferences(flow, variables, issues);
            }
        }
        checkCircularSubflows(flows, issues);
        return issues;
    }

    private static void checkEntry(Flow flow, List<ValidationIssue> issues) {
        int entries = flow.getEntryNodes().size();
        if (entries == 0) {
            issues.add(
                    ValidationIssue.error(
                            flow.getId(),
                            null,
                            "Flow \"" + flow.getName() + "\" has no entry node"));
        } else if (entries > 1) {
            issues.add(
                    ValidationIssue.error(
                            flow.getId(),
                            null,
                            "Flow \"" + flow.getName() + "\" has " + entries + " entry nodes"));
        }
    }

    private static void checkEdges(
            Flow flow, FlowRepository repository, List<ValidationIssue> issues) {
        for (Node node : flow.getNodes().values()) {
            for (String target : node.getTargets()) {
                if (!flow.hasNode(target)) {
                    issues.add(
                            ValidationIssue.error(
                                    flow.getId(),
                                    node.getId(),
                                    "Connects to unknown node " + target));
                }
            }
            if (node instanceof JumpNode jump && flow.findHub(jump.getTargetHubId()).isEmpty()) {
                issues.add(
                        ValidationIssue.error(
                                flow.getId(),
                                node.getId(),
                                "Jump targets unknown hub '" + jump.getTargetHubId() + "'"));
            }
            String calledFlow = calledFlow(node);
            if (calledFlow != null && !repository.exists(calledFlow)) {
                issues.add(
                        ValidationIssue.error(
                                flow.getId(), node.getId(), "Calls unknown flow " + calledFlow));
            }
            if ((node instanceof SubflowNode || isFlowExit(node)) && calledFlow == null) {
                issues.add(
                        ValidationIssue.error(flow.getId(), node.getId(), "No target flow set"));
            }
        }
    }

    private static void checkReachability(Flow flow, List<ValidationIssue> issues) {
        Optional<EntryNode> entry = flow.findEntry();
        if (entry.isEmpty()) {
            return;
        }
        Set<String> reached = new HashSet<>();
        Deque<String> pending = new ArrayDeque<>();
        pending.push(entry.get().getId());
        while (!pending.isEmpty()) {
            String id = pending.pop();
            if (!reached.add(id)) {
                continue;
            }
            flow.findNode(id)
                    .ifPresent(
                            node -> {
                                node.getTargets().forEach(pending::push);
                                if (node instanceof JumpNode jump) {
                                    flow.findHub(jump.getTargetHubId())
                                            .map(HubNode::getId)
                                            .ifPresent(pending::push);
                                }
                            });
        }
        for (Node node : flow.getNodes().values()) {
            if (!reached.contains(node.getId())) {
                issues.add(
                        ValidationIssue.warning(
                                flow.getId(), node.getId(), "Not reachable from the entry node"));
            }
        }
    }

    private static void checkDialogues(Flow flow, List<ValidationIssue> issues) {
        for (Node node : flow.getNodes().values()) {
            if (node instanceof DialogueNode dialogue && dialogue.getText().isBlank()) {
                issues.add(
                        ValidationIssue.warning(
                                flow.getId(), node.getId(), "Dialogue has no text"));
            }
        }
    }

    private static void checkVariableReferences(
            Flow flow, VariableStore variables, List<ValidationIssue> issues) {
        for (Node node : flow.getNodes().values()) {
            Set<VariableKey> referenced = new LinkedHashSet<>();
            if (node instanceof ConditionNode condition) {
                collect(condition.getCondition(), referenced);
                for (SwitchCase switchCase : condition.getCases()) {
                    collect(switchCase.condition(), referenced);
                }
            } else if (node instanceof DialogueNode dialogue) {
                collect(dialogue.getInputCondition(), referenced);
                collect(dialogue.getOutputInstruction(), referenced);
                for (Response response : dialogue.getResponses()) {
                    collect(response.condition(), referenced);
                    collect(response.assignments(), referenced);
                }
            } else if (node instanceof InstructionNode instruction) {
                collect(instruction.getAssignments(), referenced);
            }
            for (VariableKey key : referenced) {
                if (!variables.contains(key)) {
                    issues.add(
                            ValidationIssue.warning(
                                    flow.getId(),
                                    node.getId(),
                                    "References unknown variable " + key.ref()));
                }
            }
        }
    }

    private static void checkCircularSubflows(List<Flow> flows, List<ValidationIssue> issues) {
        Map<String, Set<String>> calls = new LinkedHashMap<>();
        for (Flow flow : flows) {
            Set<String> targets = new LinkedHashSet<>();
            for (Node node : flow.getNodes().values()) {
                String called = calledFlow(node);
                if (called != null) {
                    targets.add(called);
                }
            }
            calls.put(flow.getId(), targets);
        }
        for (String flowId : calls.keySet()) {
            List<String> cycle = findCycle(flowId, calls);
            if (!cycle.isEmpty()) {
                issues.add(
                        ValidationIssue.warning(
                                flowId,
                                null,
                                "Circular subflow chain: " + String.join(" -> ", cycle)));
            }
        }
    }

    /// Returns a path from `start` back to itself, or an empty list.
    private static List<String> findCycle(String start, Map<String, Set<String>> calls) {
        Deque<List<String>> pending = new ArrayDeque<>();
        pending.push(List.of(start));
        Set<String> expanded = new HashSet<>();
        while (!pending.isEmpty()) {
            List<String> path = pending.pop();
            String last = path.get(path.size() - 1);
            for (String next : calls.getOrDefault(last, Set.of())) {
                List<String> extended = new ArrayList<>(path);
                extended.add(next);
                if (next.equals(start)) {
                    return extended;
                }
                if (expanded.add(next)) {
                    pending.push(extended);
                }
            }
        }
        return List.of();
    }

    private static String calledFlow(Node node) {
        String target = null;
        if (node instanceof SubflowNode subflow) {
            target = subflow.getTargetFlowId();
        } else if (node instanceof ExitNode exit && exit.getMode() == ExitMode.FLOW) {
            target = exit.getTargetFlowId();
        }
        return target == null || target.isBlank() ? null : target;
    }

    private static boolean isFlowExit(Node node) {
        return node instanceof ExitNode exit && exit.getMode() == ExitMode.FLOW;
    }

    private static void collect(ConditionTree tree, Set<VariableKey> keys) {
        for (Rule rule : tree.rules()) {
            keys.add(rule.key());
        }
    }

    private static void collect(List<Assignment> assignments, Set<VariableKey> keys) {
        for (Assignment assignment : assignments) {
            keys.add(assignment.key());
            if (assignment.value() instanceof AssignmentValue.Reference ref) {
                keys.add(ref.key());
            }
        }
    }
}
