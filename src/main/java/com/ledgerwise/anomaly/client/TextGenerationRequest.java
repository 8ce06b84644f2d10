package com.ledgerwise.anomaly.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TextGenerationRequest {

    private String prompt;

    private String userRole;

    private String businessContext;
}
