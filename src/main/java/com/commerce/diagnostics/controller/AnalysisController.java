package com.commerce.diagnostics.controller;

import com.commerce.diagnostics.model.AnalyzeRequest;
import com.commerce.diagnostics.model.RunResult;
import com.commerce.diagnostics.service.WorkflowRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/analyze")
@Tag(name = "Analysis", description = "Run an inline workflow against an alert without storing anything")
public class AnalysisController {

    private final WorkflowRunService workflowRunService;

    public AnalysisController(WorkflowRunService workflowRunService) {
        this.workflowRunService = workflowRunService;
    }

    @Operation(summary = "Analyze an alert with an inline workflow",
            description = "Returns the run result directly. Failures inside the run are reported "
                    + "as status=error in the body, not as HTTP errors.")
    @PostMapping
    public ResponseEntity<?> analyze(@RequestBody AnalyzeRequest request) {
        if (request.getAlert() == null || request.getBrand() == null || request.getWorkflow() == null) {
            return ResponseEntity.badRequest()
                    .body(Map.of("error", "Missing alert, brand, or workflow in request body"));
        }
        RunResult result = workflowRunService.runInline(request.getAlert(), request.getBrand(), request.getWorkflow());
        return ResponseEntity.ok(result);
    }
}
