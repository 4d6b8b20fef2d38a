package com.commerce.diagnostics.service;

import com.commerce.diagnostics.engine.ExecutionEngine;
import com.commerce.diagnostics.engine.WorkflowValidationException;
import com.commerce.diagnostics.engine.WorkflowValidator;
import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.Brand;
import com.commerce.diagnostics.model.RunResult;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowExecutionRecord;
import com.commerce.diagnostics.model.WorkflowRunRequest;
import com.commerce.diagnostics.model.WorkflowRunResponse;
import com.commerce.diagnostics.repository.WorkflowExecutionRepository;
import com.commerce.diagnostics.repository.WorkflowRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Runs workflows for alerts.
 *
 * Flow for a stored workflow:
 * 1. Load the latest active version for the brand
 * 2. Re-validate it
 * 3. Execute it against the alert
 * 4. Persist an execution record with duration and outcome
 */
@Service
public class WorkflowRunService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRunService.class);

    static final String DEFAULT_RUN_BY = "system";

    private final WorkflowRepository workflowRepository;
    private final WorkflowExecutionRepository executionRepository;
    private final WorkflowValidator workflowValidator;
    private final ExecutionEngine executionEngine;

    public WorkflowRunService(WorkflowRepository workflowRepository,
                              WorkflowExecutionRepository executionRepository,
                              WorkflowValidator workflowValidator,
                              ExecutionEngine executionEngine) {
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.workflowValidator = workflowValidator;
        this.executionEngine = executionEngine;
    }

    /**
     * Run the latest active version of a stored workflow.
     *
     * @return the run response, or null if no active version exists
     * @throws IllegalStateException if the stored workflow no longer validates
     */
    @Observed(name = "workflow.run_stored", contextualName = "run-stored-workflow")
    public WorkflowRunResponse runStored(WorkflowRunRequest request) {
        Workflow workflow = workflowRepository.findLatestActive(request.getBrandId(), request.getWorkflowId());
        if (workflow == null) {
            return null;
        }
        log.info("Running workflow {} v{} for brand {}", workflow.getId(), workflow.getVersion(), request.getBrandId());

        try {
            workflowValidator.validate(workflow);
        } catch (WorkflowValidationException e) {
            throw new IllegalStateException("Stored workflow is invalid: " + e.getMessage(), e);
        }

        long startTime = System.currentTimeMillis();
        RunResult result = executionEngine.execute(request.getAlertPayload(),
                Brand.builder().brandId(request.getBrandId()).build(), workflow);
        long duration = System.currentTimeMillis() - startTime;

        WorkflowExecutionRecord record = WorkflowExecutionRecord.builder()
                .executionId(UUID.randomUUID().toString())
                .workflowId(workflow.getId())
                .workflowVersion(workflow.getVersion())
                .brandId(request.getBrandId())
                .alertPayload(request.getAlertPayload())
                .result(result)
                .executedBy(request.getRunBy() != null ? request.getRunBy() : DEFAULT_RUN_BY)
                .executedAt(startTime)
                .executionTimeMs(duration)
                .status(result.getStatus())
                .build();
        executionRepository.save(record);

        if (result.isError()) {
            log.warn("Workflow {} v{} ended in error for brand {}: {}",
                    workflow.getId(), workflow.getVersion(), request.getBrandId(), result.getMessage());
        }

        return WorkflowRunResponse.builder()
                .status("success")
                .workflowId(workflow.getId())
                .version(workflow.getVersion())
                .executionId(record.getExecutionId())
                .analysisResult(result)
                .build();
    }

    /**
     * Run an inline workflow without storing it or logging the execution.
     */
    @Observed(name = "workflow.run_inline", contextualName = "run-inline-workflow")
    public RunResult runInline(Alert alert, Brand brand, Workflow workflow) {
        log.info("Received direct analysis request for brand {}", brand.getBrandId());
        return executionEngine.execute(alert, brand, workflow);
    }

    public List<WorkflowExecutionRecord> getExecutions(Long brandId, String workflowId, int limit) {
        return executionRepository.findByWorkflow(brandId, workflowId, limit);
    }

    public WorkflowExecutionRecord getExecution(String executionId) {
        return executionRepository.findById(executionId);
    }
}
