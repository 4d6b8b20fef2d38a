package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.model.BranchRule;
import com.commerce.diagnostics.model.DefaultRoute;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Static structural check of a workflow graph. Stateless and side-effect free:
 * validating the same workflow twice gives the same answer.
 *
 * Checks run in a fixed order and the first violation is reported:
 * <ol>
 *   <li>non-empty node list</li>
 *   <li>node count within {@code engine.max-nodes}</li>
 *   <li>every node has a unique id and a known type</li>
 *   <li>start node resolvable</li>
 *   <li>every successor pointer resolves</li>
 *   <li>no cycle and no path deeper than {@code engine.max-depth} from the start node</li>
 * </ol>
 */
@Component
public class WorkflowValidator {

    private final EngineConfig engineConfig;

    public WorkflowValidator(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    /**
     * @return the resolved start node id
     * @throws WorkflowValidationException on the first violation found
     */
    public String validate(Workflow workflow) {
        if (workflow == null) {
            throw new WorkflowValidationException("Workflow must be an object");
        }
        List<WorkflowNode> nodes = workflow.getNodes();
        if (nodes == null) {
            throw new WorkflowValidationException("Workflow \"nodes\" must be an array");
        }
        if (nodes.isEmpty()) {
            throw new WorkflowValidationException("Workflow must have at least one node");
        }
        if (nodes.size() > engineConfig.getMaxNodes()) {
            throw new WorkflowValidationException(
                    "Workflow exceeds maximum node limit of " + engineConfig.getMaxNodes());
        }

        Map<String, WorkflowNode> nodeMap = new LinkedHashMap<>();
        for (WorkflowNode node : nodes) {
            if (node == null || node.getId() == null || node.getId().isBlank()) {
                throw new WorkflowValidationException("All nodes must have an \"id\" property");
            }
            if (nodeMap.containsKey(node.getId())) {
                throw new WorkflowValidationException("Duplicate node id \"" + node.getId() + "\"");
            }
            if (node.getType() == null) {
                throw new WorkflowValidationException("Node \"" + node.getId() + "\" missing \"type\"");
            }
            if (node.getNodeType() == null) {
                throw new WorkflowValidationException(
                        "Node \"" + node.getId() + "\" has invalid type \"" + node.getType() + "\"");
            }
            nodeMap.put(node.getId(), node);
        }

        String startNodeId = resolveStartNode(workflow, nodeMap);

        for (WorkflowNode node : nodes) {
            checkPointers(node, nodeMap);
        }

        int depth = new PathWalker(nodeMap).longestPathFrom(startNodeId);
        if (depth > engineConfig.getMaxDepth()) {
            throw new WorkflowValidationException("Max workflow depth exceeded: longest path from \""
                    + startNodeId + "\" has " + depth + " steps (max " + engineConfig.getMaxDepth() + ")");
        }
        return startNodeId;
    }

    private String resolveStartNode(Workflow workflow, Map<String, WorkflowNode> nodeMap) {
        String startNodeId = workflow.getStartNode();
        if (startNodeId == null || startNodeId.isBlank()) {
            List<String> validationNodes = new ArrayList<>();
            for (WorkflowNode node : nodeMap.values()) {
                if (node.getNodeType() == NodeType.VALIDATION) {
                    validationNodes.add(node.getId());
                }
            }
            if (validationNodes.isEmpty()) {
                throw new WorkflowValidationException(
                        "Missing \"start_node\" and no \"validation\" node found");
            }
            if (validationNodes.size() > 1) {
                throw new WorkflowValidationException(
                        "Missing \"start_node\" and multiple \"validation\" nodes found: " + validationNodes);
            }
            startNodeId = validationNodes.get(0);
        }
        if (!nodeMap.containsKey(startNodeId)) {
            throw new WorkflowValidationException("Start node \"" + startNodeId + "\" not found in nodes");
        }
        return startNodeId;
    }

    private void checkPointers(WorkflowNode node, Map<String, WorkflowNode> nodeMap) {
        String id = node.getId();
        if (node.getNext() != null && !nodeMap.containsKey(node.getNext())) {
            throw new WorkflowValidationException(
                    "Node \"" + id + "\" points to non-existent next node \"" + node.getNext() + "\"");
        }

        if (node.getNodeType() == NodeType.BRANCH) {
            if (node.getRules() != null) {
                for (BranchRule rule : node.getRules()) {
                    if (rule == null || rule.getNext() == null || !nodeMap.containsKey(rule.getNext())) {
                        throw new WorkflowValidationException("Branch node \"" + id
                                + "\" points to non-existent route \"" + (rule == null ? null : rule.getNext()) + "\"");
                    }
                }
            }
            if (node.getRoutes() != null) {
                for (Map.Entry<String, String> route : node.getRoutes().entrySet()) {
                    if (route.getValue() == null || !nodeMap.containsKey(route.getValue())) {
                        throw new WorkflowValidationException("Branch node \"" + id + "\" route \""
                                + route.getKey() + "\" points to non-existent node \"" + route.getValue() + "\"");
                    }
                }
            }
            DefaultRoute defaultNext = node.getDefaultNext();
            if (defaultNext != null && !defaultNext.isTerminate()
                    && (defaultNext.getNodeId() == null || !nodeMap.containsKey(defaultNext.getNodeId()))) {
                throw new WorkflowValidationException("Branch node \"" + id
                        + "\" points to non-existent default route \"" + defaultNext.getNodeId() + "\"");
            }
        }

        if (node.getNodeType() == NodeType.COMPOSITE) {
            String entry = compositeEntry(node);
            if (entry == null) {
                throw new WorkflowValidationException(
                        "Composite node \"" + id + "\" declares neither \"start_node_id\" nor \"steps\"");
            }
            if (node.getStartNodeId() != null && !nodeMap.containsKey(node.getStartNodeId())) {
                throw new WorkflowValidationException("Composite node \"" + id
                        + "\" points to non-existent start node \"" + node.getStartNodeId() + "\"");
            }
            if (node.getSteps() != null) {
                for (String step : node.getSteps()) {
                    if (!nodeMap.containsKey(step)) {
                        throw new WorkflowValidationException("Composite node \"" + id
                                + "\" points to non-existent step \"" + step + "\"");
                    }
                }
            }
        }
    }

    /**
     * Entry point of a composite sub-graph: its explicit start node, else the first step.
     */
    public static String compositeEntry(WorkflowNode node) {
        if (node.getStartNodeId() != null && !node.getStartNodeId().isBlank()) {
            return node.getStartNodeId();
        }
        if (node.getSteps() != null && !node.getSteps().isEmpty()) {
            return node.getSteps().get(0);
        }
        return null;
    }

    /**
     * Outgoing edges of a node as followed at run time.
     */
    static List<String> successors(WorkflowNode node) {
        List<String> edges = new ArrayList<>();
        if (node.getNext() != null) {
            edges.add(node.getNext());
        }
        if (node.getNodeType() == NodeType.BRANCH) {
            if (node.getRules() != null) {
                for (BranchRule rule : node.getRules()) {
                    edges.add(rule.getNext());
                }
            }
            if (node.getRoutes() != null) {
                edges.addAll(node.getRoutes().values());
            }
            DefaultRoute defaultNext = node.getDefaultNext();
            if (defaultNext != null && !defaultNext.isTerminate()) {
                edges.add(defaultNext.getNodeId());
            }
        }
        if (node.getNodeType() == NodeType.COMPOSITE) {
            edges.add(compositeEntry(node));
        }
        return edges;
    }

    /**
     * Longest-path search over the reachable sub-graph. Each node's longest remaining path
     * is computed once, so the result does not depend on edge order.
     */
    private static final class PathWalker {

        private final Map<String, WorkflowNode> nodeMap;
        private final Map<String, Integer> longestFrom = new HashMap<>();
        private final Set<String> onPath = new HashSet<>();

        PathWalker(Map<String, WorkflowNode> nodeMap) {
            this.nodeMap = nodeMap;
        }

        /**
         * @return number of edges on the longest path starting at the node
         * @throws WorkflowValidationException if a cycle is reachable from the node
         */
        int longestPathFrom(String nodeId) {
            if (onPath.contains(nodeId)) {
                throw new WorkflowValidationException("Cycle detected involving node \"" + nodeId + "\"");
            }
            Integer known = longestFrom.get(nodeId);
            if (known != null) {
                return known;
            }
            onPath.add(nodeId);
            int longest = 0;
            for (String successor : successors(nodeMap.get(nodeId))) {
                longest = Math.max(longest, 1 + longestPathFrom(successor));
            }
            onPath.remove(nodeId);
            longestFrom.put(nodeId, longest);
            return longest;
        }
    }
}
