package com.commerce.diagnostics.service;

import com.commerce.diagnostics.engine.WorkflowValidator;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowStatus;
import com.commerce.diagnostics.repository.WorkflowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Authoring side of workflows: validates a graph and stores it as a new version.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    static final String DEFAULT_CREATED_BY = "api_user";

    private final WorkflowRepository workflowRepository;
    private final WorkflowValidator workflowValidator;

    public WorkflowService(WorkflowRepository workflowRepository, WorkflowValidator workflowValidator) {
        this.workflowRepository = workflowRepository;
        this.workflowValidator = workflowValidator;
    }

    /**
     * Validate and store a workflow as the next version for its brand and id.
     * A missing top-level brand id is taken from {@code context.brand_id}.
     *
     * @throws IllegalArgumentException if brand id, workflow id or nodes are missing
     * @throws com.commerce.diagnostics.engine.WorkflowValidationException if the graph is invalid
     */
    public Workflow createWorkflow(Workflow workflow) {
        if (workflow.getBrandId() == null) {
            workflow.setBrandId(brandIdFromContext(workflow.getContext()));
        }
        if (workflow.getCreatedBy() == null || workflow.getCreatedBy().isBlank()) {
            workflow.setCreatedBy(DEFAULT_CREATED_BY);
        }
        if (workflow.getBrandId() == null || workflow.getId() == null || workflow.getId().isBlank()
                || workflow.getNodes() == null || workflow.getNodes().isEmpty()) {
            log.info("Rejected workflow with missing fields: brand_id={}, workflow_id={}, has_nodes={}",
                    workflow.getBrandId(), workflow.getId(), workflow.getNodes() != null);
            throw new IllegalArgumentException("Missing required fields: brand_id, workflow_id, nodes");
        }

        workflowValidator.validate(workflow);

        workflow.setStatus(WorkflowStatus.ACTIVE);
        workflow.setCreatedAt(System.currentTimeMillis());
        int version = workflowRepository.save(workflow);
        log.info("Created workflow {} v{} for brand {}", workflow.getId(), version, workflow.getBrandId());
        return workflow;
    }

    public Workflow getLatestActive(Long brandId, String workflowId) {
        return workflowRepository.findLatestActive(brandId, workflowId);
    }

    public boolean archive(Long brandId, String workflowId, int version) {
        boolean updated = workflowRepository.updateStatus(brandId, workflowId, version, WorkflowStatus.ARCHIVED);
        if (updated) {
            log.info("Archived workflow {} v{} for brand {}", workflowId, version, brandId);
        }
        return updated;
    }

    private static Long brandIdFromContext(Map<String, Object> context) {
        if (context == null) return null;
        Object value = context.get("brand_id");
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
