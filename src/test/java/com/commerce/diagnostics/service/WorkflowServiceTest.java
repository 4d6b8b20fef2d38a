package com.commerce.diagnostics.service;

import com.commerce.diagnostics.engine.WorkflowValidationException;
import com.commerce.diagnostics.engine.WorkflowValidator;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowStatus;
import com.commerce.diagnostics.repository.WorkflowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static com.commerce.diagnostics.testutil.TestDataFactory.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    @Mock private WorkflowRepository workflowRepository;

    private WorkflowService workflowService;

    @BeforeEach
    void setUp() {
        workflowService = new WorkflowService(workflowRepository, new WorkflowValidator(createEngineConfig()));
    }

    private Workflow simpleWorkflow() {
        return createWorkflow("cvr_drop_rca",
                validation("validate", "confidence", 10.0),
                confidence("confidence", "insight"),
                insight("insight"));
    }

    @Test
    void createWorkflow_valid_savedActiveWithDefaults() {
        Workflow workflow = simpleWorkflow();
        when(workflowRepository.save(any(Workflow.class))).thenAnswer(inv -> {
            inv.getArgument(0, Workflow.class).setVersion(3);
            return 3;
        });

        Workflow created = workflowService.createWorkflow(workflow);

        assertThat(created.getVersion()).isEqualTo(3);
        assertThat(created.getStatus()).isEqualTo(WorkflowStatus.ACTIVE);
        assertThat(created.getCreatedBy()).isEqualTo("api_user");
        assertThat(created.getCreatedAt()).isPositive();
    }

    @Test
    void createWorkflow_brandIdFromContext() {
        Workflow workflow = simpleWorkflow();
        workflow.setBrandId(null);
        workflow.setContext(Map.of("brand_id", "77"));
        when(workflowRepository.save(any(Workflow.class))).thenReturn(1);

        Workflow created = workflowService.createWorkflow(workflow);

        assertThat(created.getBrandId()).isEqualTo(77L);
    }

    @Test
    void createWorkflow_missingBrand_rejected() {
        Workflow workflow = simpleWorkflow();
        workflow.setBrandId(null);

        assertThatThrownBy(() -> workflowService.createWorkflow(workflow))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing required fields: brand_id, workflow_id, nodes");
        verifyNoInteractions(workflowRepository);
    }

    @Test
    void createWorkflow_invalidGraph_notSaved() {
        Workflow workflow = createWorkflow("broken", validation("validate", "ghost", null));

        assertThatThrownBy(() -> workflowService.createWorkflow(workflow))
                .isInstanceOf(WorkflowValidationException.class);
        verify(workflowRepository, never()).save(any());
    }

    @Test
    void archive_delegatesStatusChange() {
        when(workflowRepository.updateStatus(BRAND_ID, "cvr_drop_rca", 2, WorkflowStatus.ARCHIVED)).thenReturn(true);

        assertThat(workflowService.archive(BRAND_ID, "cvr_drop_rca", 2)).isTrue();
    }
}
