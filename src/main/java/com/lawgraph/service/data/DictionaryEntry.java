package com.lawgraph.service.data;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * One row of the law dictionary file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DictionaryEntry(String id, String name, List<String> aliases, String promulgationNumber) {
}
