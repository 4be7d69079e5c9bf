package com.lawgraph.service.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lawgraph.config.DictionaryConfig;
import com.lawgraph.exception.DictionaryLoadException;
import com.lawgraph.model.law.LawDictionary;
import com.lawgraph.model.law.LawIdentity;
import com.lawgraph.service.resolve.LawIdentityResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Loads the law dictionary once at startup and shares it read-only.
 *
 * <p>A reload builds a complete new dictionary and swaps the reference in one
 * step, so a document being processed keeps the resolver it started with.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DictionaryLoaderService {

    private final DictionaryConfig dictionaryConfig;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final AtomicReference<LawIdentityResolver> resolver =
            new AtomicReference<>(new LawIdentityResolver(LawDictionary.empty()));

    @PostConstruct
    public void init() {
        log.info("\n{}", "=".repeat(70));
        log.info("LOADING LAW DICTIONARY");
        log.info("{}\n", "=".repeat(70));

        try {
            reload();
        } catch (DictionaryLoadException e) {
            if (dictionaryConfig.isFailOnError()) {
                throw e;
            }
            log.error("Law dictionary unavailable, continuing with an empty one: {}", e.getMessage());
        }
    }

    /**
     * Read the dictionary again and swap it in. On failure the current one stays.
     *
     * @return number of laws in the new dictionary
     */
    public synchronized int reload() {
        LawDictionary dictionary = load(dictionaryConfig.getPath());
        resolver.set(new LawIdentityResolver(dictionary));
        log.info("Law dictionary loaded: {} laws from {}", dictionary.size(), dictionaryConfig.getPath());
        return dictionary.size();
    }

    public LawIdentityResolver getResolver() {
        return resolver.get();
    }

    public LawDictionary getDictionary() {
        return resolver.get().getDictionary();
    }

    public Map<String, Object> getStatistics() {
        LawDictionary dictionary = getDictionary();
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("laws", dictionary.size());
        stats.put("aliases", dictionary.aliasTable().size());
        stats.put("path", dictionaryConfig.getPath());
        return stats;
    }

    // ============================================================
    // Private Helper Methods
    // ============================================================

    private LawDictionary load(String path) {
        Resource resource = resourceLoader.getResource(path);
        if (!resource.exists()) {
            throw new DictionaryLoadException("Law dictionary not found: " + path);
        }

        List<DictionaryEntry> entries;
        try (InputStream in = resource.getInputStream()) {
            entries = objectMapper.readValue(in, new TypeReference<List<DictionaryEntry>>() {});
        } catch (Exception e) {
            throw new DictionaryLoadException("Failed to read law dictionary: " + path, e);
        }

        List<LawIdentity> identities = new ArrayList<>(entries.size());
        for (DictionaryEntry entry : entries) {
            if (entry.id() == null || entry.id().isBlank() || entry.name() == null || entry.name().isBlank()) {
                log.warn("Skipping dictionary entry without id or name: {}", entry);
                continue;
            }
            identities.add(LawIdentity.builder()
                    .id(entry.id())
                    .name(entry.name())
                    .aliases(entry.aliases() == null ? List.of() : entry.aliases())
                    .promulgationNumber(entry.promulgationNumber())
                    .build());
        }

        return LawDictionary.of(identities);
    }
}
