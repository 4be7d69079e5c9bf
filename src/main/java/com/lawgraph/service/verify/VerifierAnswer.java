package com.lawgraph.service.verify;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * JSON answer expected from the chat model.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record VerifierAnswer(String lawName, String article, Integer paragraph) {
}
