package com.lawgraph.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExtractionRequest {

    @NotBlank
    private String lawId;

    /**
     * e-Gov statute XML. Takes precedence over {@code text}.
     */
    private String xml;

    /**
     * Free text, read as article 1 paragraph 1 of the law.
     */
    private String text;

    private Boolean includeCitations;
}
