package com.commerce.diagnostics.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Operation;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.commerce.diagnostics.config.AerospikeConfig;
import com.commerce.diagnostics.model.Workflow;
import com.commerce.diagnostics.model.WorkflowNode;
import com.commerce.diagnostics.model.WorkflowStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Versioned workflow store.
 *
 * Every saved version is its own record keyed {@code brandId:workflowId:version} and is never
 * overwritten. A head record per {@code brandId:workflowId} holds the latest version number,
 * incremented atomically on save.
 */
@Repository
public class WorkflowRepository {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRepository.class);

    private static final String BIN_LATEST_VERSION = "latestVer";

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public WorkflowRepository(AerospikeClient client,
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

    /**
     * Store the workflow as a new version. The version field of the argument is ignored
     * and overwritten with the assigned one.
     *
     * @return the assigned version
     */
    public int save(Workflow workflow) {
        int version = nextVersion(workflow.getBrandId(), workflow.getId());
        workflow.setVersion(version);

        Key key = versionKey(workflow.getBrandId(), workflow.getId(), version);

        // versions are immutable: fail rather than overwrite
        WritePolicy createOnly = new WritePolicy(writePolicy);
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;

        client.put(createOnly, key,
                new Bin("workflowId", workflow.getId()),
                new Bin("version", version),
                new Bin("brandId", workflow.getBrandId()),
                new Bin("workflowType", workflow.getWorkflowType()),
                new Bin("description", workflow.getDescription()),
                new Bin("trigger", toJson(workflow.getTrigger())),
                new Bin("context", toJson(workflow.getContext())),
                new Bin("startNode", workflow.getStartNode()),
                new Bin("nodes", toJson(workflow.getNodes())),
                new Bin("status", workflow.getStatus().name()),
                new Bin("createdBy", workflow.getCreatedBy()),
                new Bin("createdAt", workflow.getCreatedAt()));

        log.info("Saved workflow {} v{} for brand {}", workflow.getId(), version, workflow.getBrandId());
        return version;
    }

    public Workflow findByVersion(Long brandId, String workflowId, int version) {
        Record record = client.get(readPolicy, versionKey(brandId, workflowId, version));
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Highest version of the workflow whose status is active, or null.
     */
    public Workflow findLatestActive(Long brandId, String workflowId) {
        Record head = client.get(readPolicy, headKey(brandId, workflowId));
        if (head == null) return null;

        for (int version = head.getInt(BIN_LATEST_VERSION); version > 0; version--) {
            Workflow workflow = findByVersion(brandId, workflowId, version);
            if (workflow != null && workflow.getStatus() == WorkflowStatus.ACTIVE) {
                return workflow;
            }
        }
        return null;
    }

    public boolean updateStatus(Long brandId, String workflowId, int version, WorkflowStatus status) {
        Key key = versionKey(brandId, workflowId, version);
        if (!client.exists(readPolicy, key)) {
            return false;
        }
        WritePolicy updateOnly = new WritePolicy(writePolicy);
        updateOnly.recordExistsAction = RecordExistsAction.UPDATE_ONLY;
        client.put(updateOnly, key, new Bin("status", status.name()));
        return true;
    }

    private int nextVersion(Long brandId, String workflowId) {
        Record head = client.operate(writePolicy, headKey(brandId, workflowId),
                Operation.add(new Bin(BIN_LATEST_VERSION, 1)),
                Operation.get(BIN_LATEST_VERSION));
        return head.getInt(BIN_LATEST_VERSION);
    }

    private Key versionKey(Long brandId, String workflowId, int version) {
        return new Key(namespace, AerospikeConfig.SET_WORKFLOWS, brandId + ":" + workflowId + ":" + version);
    }

    private Key headKey(Long brandId, String workflowId) {
        return new Key(namespace, AerospikeConfig.SET_WORKFLOW_HEADS, brandId + ":" + workflowId);
    }

    private Workflow mapRecord(Record record) {
        return Workflow.builder()
                .id(record.getString("workflowId"))
                .version(record.getInt("version"))
                .brandId(record.getLong("brandId"))
                .workflowType(record.getString("workflowType"))
                .description(record.getString("description"))
                .trigger(fromJson(record.getString("trigger"), new TypeReference<Map<String, Object>>() {}))
                .context(fromJson(record.getString("context"), new TypeReference<Map<String, Object>>() {}))
                .startNode(record.getString("startNode"))
                .nodes(nodesFromJson(record.getString("nodes")))
                .status(WorkflowStatus.valueOf(record.getString("status")))
                .createdBy(record.getString("createdBy"))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private List<WorkflowNode> nodesFromJson(String json) {
        List<WorkflowNode> nodes = fromJson(json, new TypeReference<List<WorkflowNode>>() {});
        return nodes != null ? nodes : new ArrayList<>();
    }

    private String toJson(Object value) {
        if (value == null) return null;
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow field: " + e.getMessage(), e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isEmpty()) return null;
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize workflow field: " + e.getMessage(), e);
        }
    }
}
