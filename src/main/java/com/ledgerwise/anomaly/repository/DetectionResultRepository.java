package com.ledgerwise.anomaly.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledgerwise.anomaly.config.AerospikeConfig;
import com.ledgerwise.anomaly.model.AnomalyDetectionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stores detection results in the {@code detection_results} set, one record per request.
 * The full result is kept as JSON; a few bins are duplicated for filtering.
 */
@Repository
public class DetectionResultRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectionResultRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;
    private final ObjectMapper objectMapper;

    public DetectionResultRepository(AerospikeClient client,
                                     @Qualifier("aerospikeNamespace") String namespace,
                                     @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                     @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
        // records may carry java.time values inside context data points
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Persist a result. Failures are logged and never propagated to the caller.
     */
    public void save(AnomalyDetectionResult result) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RESULTS, result.getRequestId());

            Bin requestIdBin = new Bin("requestId", result.getRequestId());
            Bin orgBin = new Bin("organizationId", result.getOrganizationId());
            Bin sourceBin = new Bin("sourceId", result.getSourceId());
            Bin statusBin = new Bin("status", result.getStatus().name());
            Bin countBin = new Bin("anomalyCount", result.getAnomalies().size());
            Bin detectedAtBin = new Bin("detectedAt", result.getDetectionTimestamp());
            Bin jsonBin = new Bin("resultJson", objectMapper.writeValueAsString(result));

            client.put(writePolicy, key,
                    requestIdBin, orgBin, sourceBin, statusBin, countBin, detectedAtBin, jsonBin);
        } catch (Exception e) {
            log.error("Failed to persist detection result {}: {}", result.getRequestId(), e.getMessage(), e);
        }
    }

    public AnomalyDetectionResult findByRequestId(String requestId) {
        Key key = new Key(namespace, AerospikeConfig.SET_DETECTION_RESULTS, requestId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    /**
     * Most recent results for a data source, newest first.
     */
    public List<AnomalyDetectionResult> findBySource(String organizationId, String sourceId, int limit) {
        List<Record> matches = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_DETECTION_RESULTS,
                (key, record) -> {
                    if (organizationId.equals(record.getString("organizationId"))
                            && (sourceId == null || sourceId.equals(record.getString("sourceId")))) {
                        synchronized (matches) {
                            matches.add(record);
                        }
                    }
                });

        matches.sort(Comparator.comparingLong((Record r) -> r.getLong("detectedAt")).reversed());
        List<AnomalyDetectionResult> results = new ArrayList<>();
        for (Record record : matches) {
            if (results.size() >= limit) break;
            AnomalyDetectionResult result = mapRecord(record);
            if (result != null) results.add(result);
        }
        return results;
    }

    private AnomalyDetectionResult mapRecord(Record record) {
        String json = record.getString("resultJson");
        if (json == null) return null;
        try {
            return objectMapper.readValue(json, AnomalyDetectionResult.class);
        } catch (Exception e) {
            log.error("Failed to deserialize detection result {}", record.getString("requestId"), e);
            return null;
        }
    }
}
