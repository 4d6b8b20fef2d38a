package com.commerce.diagnostics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.commerce.diagnostics.config.AerospikeConfig;
import com.commerce.diagnostics.model.Alert;
import com.commerce.diagnostics.model.RunResult;
import com.commerce.diagnostics.model.RunStatus;
import com.commerce.diagnostics.model.WorkflowExecutionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Audit log of stored-workflow runs.
 */
@Repository
public class WorkflowExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public WorkflowExecutionRepository(AerospikeClient client,
                                       @Qualifier("aerospikeNamespace") String namespace,
                                       @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                       @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public void save(WorkflowExecutionRecord execution) {
        Key key = new Key(namespace, AerospikeConfig.SET_WORKFLOW_EXECUTIONS, execution.getExecutionId());

        client.put(writePolicy, key,
                new Bin("executionId", execution.getExecutionId()),
                new Bin("workflowId", execution.getWorkflowId()),
                new Bin("version", execution.getWorkflowVersion()),
                new Bin("brandId", execution.getBrandId()),
                new Bin("alert", toJson(execution.getAlertPayload())),
                new Bin("result", toJson(execution.getResult())),
                new Bin("executedBy", execution.getExecutedBy()),
                new Bin("executedAt", execution.getExecutedAt()),
                new Bin("execTimeMs", execution.getExecutionTimeMs()),
                new Bin("status", execution.getStatus().name()));
    }

    public WorkflowExecutionRecord findById(String executionId) {
        Key key = new Key(namespace, AerospikeConfig.SET_WORKFLOW_EXECUTIONS, executionId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Most recent runs of a workflow for a brand, newest first.
     */
    public List<WorkflowExecutionRecord> findByWorkflow(Long brandId, String workflowId, int limit) {
        List<WorkflowExecutionRecord> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WORKFLOW_EXECUTIONS,
                (key, record) -> {
                    try {
                        if (!Long.valueOf(record.getLong("brandId")).equals(brandId)
                                || !workflowId.equals(record.getString("workflowId"))) {
                            return;
                        }
                        synchronized (results) {
                            results.add(mapRecord(record));
                        }
                    } catch (Exception e) {
                        log.warn("Failed to read workflow execution record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(WorkflowExecutionRecord::getExecutedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private WorkflowExecutionRecord mapRecord(Record record) {
        return WorkflowExecutionRecord.builder()
                .executionId(record.getString("executionId"))
                .workflowId(record.getString("workflowId"))
                .workflowVersion(record.getInt("version"))
                .brandId(record.getLong("brandId"))
                .alertPayload(fromJson(record.getString("alert"), Alert.class))
                .result(fromJson(record.getString("result"), RunResult.class))
                .executedBy(record.getString("executedBy"))
                .executedAt(record.getLong("executedAt"))
                .executionTimeMs(record.getLong("execTimeMs"))
                .status(RunStatus.valueOf(record.getString("status")))
                .build();
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize execution field: " + e.getMessage(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize execution field: " + e.getMessage(), e);
        }
    }
}
