package com.ledgerwise.anomaly.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Who is asking and on whose behalf. Feeds stakeholders, alert business context and text enrichment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionContext {

    @Builder.Default
    private UserRole userRole = UserRole.ASSOCIATE;

    private String businessUnit;

    @Builder.Default
    private Map<String, Object> clientContext = new HashMap<>();

    // upper bound for the external text call; engine default when null
    private Long enrichmentTimeoutMs;
}
