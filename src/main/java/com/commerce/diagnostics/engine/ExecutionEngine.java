package com.commerce.diagnostics.engine;

import com.commerce.diagnostics.config.EngineConfig;
import com.commerce.diagnostics.config.MetricsConfig;
import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.Brand;
import com.commerce.diagnostics.model.NodeType;
import com.commerce.diagnostics.model.RunErrorType;
import com.commerce.diagnostics.model.RunResult;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowNode;
import com.commerce.diagnostics.query.DataFetchException;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives a validated workflow from its start node to a terminal result.
 * Uses the Strategy pattern: each NodeType is handled by a registered NodeExecutor.
 *
 * A run never throws. Validation failures, fatal execution errors and data fetch
 * failures are all reported as an error {@link RunResult}.
 */
@Component
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final WorkflowValidator validator;
    private final Map<NodeType, NodeExecutor> executorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;
    private final EngineConfig engineConfig;

    public ExecutionEngine(WorkflowValidator validator, List<NodeExecutor> executors,
                           Tracer tracer, MetricsConfig metricsConfig, EngineConfig engineConfig) {
        this.validator = validator;
        this.executorMap = new EnumMap<>(NodeType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;
        this.engineConfig = engineConfig;

        for (NodeExecutor executor : executors) {
            executorMap.put(executor.getSupportedNodeType(), executor);
            log.info("Registered node executor: {} -> {}",
                    executor.getSupportedNodeType(), executor.getClass().getSimpleName());
        }
    }

    /**
     * Execute a workflow for one alert.
     *
     * @param alert    the triggering alert
     * @param brand    the tenant the alert belongs to
     * @param workflow the workflow graph, validated again before running
     * @return the terminal run result
     */
    @Observed(name = "workflow.execute", contextualName = "execute-workflow")
    public RunResult execute(Alert alert, Brand brand, Workflow workflow) {
        long startTime = System.currentTimeMillis();
        RunResult result = run(alert, brand, workflow);
        metricsConfig.recordRun(result.getStatus().toJson(), System.currentTimeMillis() - startTime);
        return result;
    }

    private RunResult run(Alert alert, Brand brand, Workflow workflow) {
        String startNodeId;
        try {
            startNodeId = validator.validate(workflow);
        } catch (WorkflowValidationException e) {
            log.warn("Workflow rejected before execution: {}", e.getMessage());
            return RunResult.error(RunErrorType.WORKFLOW_VALIDATION_ERROR, e.getMessage());
        }

        ExecutionContext context = ExecutionContext.create(alert, brand, workflow);
        Map<String, WorkflowNode> nodesById = new HashMap<>();
        for (WorkflowNode node : workflow.getNodes()) {
            nodesById.put(node.getId(), node);
        }

        log.info("Starting workflow {} v{} for brand {} (trace {})", workflow.getId(), workflow.getVersion(),
                context.getBrand().getBrandId(), context.getMetadata().getTraceId());

        try {
            return loop(startNodeId, nodesById, context);
        } catch (DataFetchException e) {
            log.error("Data fetch failed in workflow {} (trace {}): {}",
                    workflow.getId(), context.getMetadata().getTraceId(), e.getMessage(), e);
            return RunResult.error(RunErrorType.DATA_FETCH_ERROR, e.getMessage());
        } catch (Exception e) {
            log.error("Execution failed in workflow {} (trace {}): {}",
                    workflow.getId(), context.getMetadata().getTraceId(), e.getMessage(), e);
            return RunResult.error(RunErrorType.EXECUTION_ERROR, e.getMessage());
        }
    }

    private RunResult loop(String startNodeId, Map<String, WorkflowNode> nodesById, ExecutionContext context) {
        int maxSteps = engineConfig.getMaxSteps();
        String currentNodeId = startNodeId;
        int steps = 0;

        while (true) {
            if (steps >= maxSteps) {
                throw new WorkflowExecutionException("Workflow execution exceeded max steps (" + maxSteps + ")");
            }

            WorkflowNode node = nodesById.get(currentNodeId);
            if (node == null) {
                throw new WorkflowExecutionException("Node " + currentNodeId + " not found in workflow");
            }
            NodeType type = node.getNodeType();
            NodeExecutor executor = type != null ? executorMap.get(type) : null;
            if (executor == null) {
                throw new WorkflowExecutionException("No executor for node type " + node.getType());
            }

            NodeOutcome outcome = executeNode(node, type, executor, context);
            steps++;

            NodeOutcome.Status status = outcome != null ? outcome.getStatus() : null;
            if (status == null) {
                throw new WorkflowExecutionException("Unknown result status from node " + node.getId());
            }

            if (status == NodeOutcome.Status.SUCCESS) {
                if (outcome.getNext() == null) {
                    throw new WorkflowExecutionException(
                            "Node " + node.getId() + " has no successor and did not finish the run");
                }
                currentNodeId = outcome.getNext();
            } else if (status == NodeOutcome.Status.DONE) {
                return finish(context, steps);
            } else if (status == NodeOutcome.Status.SUPPRESSED) {
                log.warn("Run {} suppressed at node {}: {}",
                        context.getMetadata().getTraceId(), node.getId(), outcome.getReason());
                return RunResult.suppressed(outcome.getReason());
            } else if (status == NodeOutcome.Status.DEFERRED) {
                log.warn("Run {} deferred at node {}: {}",
                        context.getMetadata().getTraceId(), node.getId(), outcome.getReason());
                return RunResult.deferred(outcome.getReason());
            } else {
                throw new WorkflowExecutionException("Unknown result status from node " + node.getId() + ": " + status);
            }
        }
    }

    private NodeOutcome executeNode(WorkflowNode node, NodeType type, NodeExecutor executor,
                                    ExecutionContext context) {
        Span nodeSpan = tracer.nextSpan()
                .name("node.execute." + type.getWireName())
                .tag("node.id", node.getId())
                .tag("node.type", type.getWireName())
                .tag("workflow.trace_id", context.getMetadata().getTraceId())
                .start();

        try (Tracer.SpanInScope ws = tracer.withSpan(nodeSpan)) {
            log.debug("Executing node {} ({})", node.getId(), type.getWireName());
            NodeOutcome outcome = executor.execute(node, context);
            metricsConfig.recordNodeExecuted(type.getWireName());
            if (outcome != null && outcome.getStatus() != null) {
                nodeSpan.tag("node.outcome", outcome.getStatus().name());
            }
            return outcome;
        } catch (RuntimeException e) {
            nodeSpan.error(e);
            throw e;
        } finally {
            nodeSpan.end();
        }
    }

    private RunResult finish(ExecutionContext context, int steps) {
        if (context.getFinalInsight() == null) {
            throw new WorkflowExecutionException("Workflow finished without generating insight");
        }
        log.info("Run {} finished after {} steps: {}", context.getMetadata().getTraceId(), steps,
                context.getFinalInsight().getClassification());
        return RunResult.success(context.getFinalInsight(), context.getBrand().getBrandId(),
                context.getAlert().getMetric(), context.getMetadata());
    }
}
