package com.lawgraph.dto.request;

import jakarta.validation.constraints.NotEmpty;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BatchExtractionRequest {

    /**
     * Law id to statute XML.
     */
    @NotEmpty
    @Builder.Default
    private Map<String, String> documents = new LinkedHashMap<>();
}
