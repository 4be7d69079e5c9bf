package com.lawgraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Location of the law dictionary.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "law-graph.dictionary")
public class DictionaryConfig {

    /**
     * Spring resource location of the dictionary JSON, e.g. classpath:data/law-dictionary.json
     * or file:/srv/law-graph/dictionary.json.
     */
    private String path = "classpath:data/law-dictionary.json";

    /**
     * Fail startup when the dictionary cannot be read, instead of running with an empty one.
     */
    private boolean failOnError = false;
}
