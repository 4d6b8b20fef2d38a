package com.commerce.diagnostics.controller;

import com.commerce.diagnostics.engine.WorkflowValidationException;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowExecutionRecord;
import com.commerce.diagnostics.model.WorkflowRunRequest;
import com.commerce.diagnostics.model.WorkflowRunResponse;
import com.commerce.diagnostics.service.WorkflowRunService;
import com.commerce.diagnostics.service.WorkflowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/workflows")
@Tag(name = "Workflows", description = "Store versioned diagnostic workflows and run them against alerts")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowService workflowService;
    private final WorkflowRunService workflowRunService;

    public WorkflowController(WorkflowService workflowService, WorkflowRunService workflowRunService) {
        this.workflowService = workflowService;
        this.workflowRunService = workflowRunService;
    }

    @Operation(summary = "Create a workflow version",
            description = "Validates the graph and stores it as the next version for its brand and workflow id. "
                    + "brand_id may be given at the top level or inside context.")
    @PostMapping
    public ResponseEntity<Map<String, Object>> createWorkflow(@RequestBody Workflow workflow) {
        try {
            Workflow created = workflowService.createWorkflow(workflow);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "success");
            body.put("workflow_id", created.getId());
            body.put("version", created.getVersion());
            return ResponseEntity.ok(body);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(error(e.getMessage()));
        } catch (WorkflowValidationException e) {
            return ResponseEntity.badRequest().body(error("Invalid workflow: " + e.getMessage()));
        }
    }

    @Operation(summary = "Get the latest active version of a workflow")
    @GetMapping("/{brandId}/{workflowId}")
    public ResponseEntity<Workflow> getWorkflow(
            @Parameter(description = "Brand id", example = "42") @PathVariable Long brandId,
            @Parameter(description = "Workflow id", example = "cvr_drop_rca") @PathVariable String workflowId) {
        Workflow workflow = workflowService.getLatestActive(brandId, workflowId);
        if (workflow == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(workflow);
    }

    @Operation(summary = "Archive a workflow version",
            description = "Archived versions are skipped when resolving the latest active version.")
    @PostMapping("/{brandId}/{workflowId}/versions/{version}/archive")
    public ResponseEntity<Void> archiveWorkflow(
            @Parameter(description = "Brand id", example = "42") @PathVariable Long brandId,
            @Parameter(description = "Workflow id", example = "cvr_drop_rca") @PathVariable String workflowId,
            @Parameter(description = "Version to archive", example = "2") @PathVariable int version) {
        if (!workflowService.archive(brandId, workflowId, version)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Run a stored workflow",
            description = "Loads the latest active version, runs it against the alert and records the execution. "
                    + "The run outcome (success, suppressed, deferred or error) is in analysis_result.")
    @PostMapping("/run")
    public ResponseEntity<?> runWorkflow(@RequestBody WorkflowRunRequest request) {
        if (request.getBrandId() == null || request.getWorkflowId() == null || request.getAlertPayload() == null) {
            return ResponseEntity.badRequest()
                    .body(error("Missing required fields: brand_id, workflow_id, alert_payload"));
        }
        try {
            WorkflowRunResponse response = workflowRunService.runStored(request);
            if (response == null) {
                return ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(error("Workflow not found or not active"));
            }
            return ResponseEntity.ok(response);
        } catch (IllegalStateException e) {
            log.error("Cannot run workflow {} for brand {}: {}",
                    request.getWorkflowId(), request.getBrandId(), e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error(e.getMessage()));
        }
    }

    @Operation(summary = "List recent executions of a workflow", description = "Newest first.")
    @GetMapping("/{brandId}/{workflowId}/executions")
    public ResponseEntity<List<WorkflowExecutionRecord>> listExecutions(
            @Parameter(description = "Brand id", example = "42") @PathVariable Long brandId,
            @Parameter(description = "Workflow id", example = "cvr_drop_rca") @PathVariable String workflowId,
            @Parameter(description = "Maximum records to return") @RequestParam(defaultValue = "20") int limit) {
        return ResponseEntity.ok(workflowRunService.getExecutions(brandId, workflowId, limit));
    }

    @Operation(summary = "Get one execution record")
    @GetMapping("/executions/{executionId}")
    public ResponseEntity<WorkflowExecutionRecord> getExecution(@PathVariable String executionId) {
        WorkflowExecutionRecord record = workflowRunService.getExecution(executionId);
        if (record == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(record);
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", message);
        return body;
    }
}
