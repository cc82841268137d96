package com.mtsa.findings.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import com.mtsa.findings.model.CombinationKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns raw (tool, sources, language) requests into {@link CombinationKey}s.
 * <p>
 * The canonical form is a JSON object with the fields in fixed order and the sources sorted, so
 * request order and duplicates never change the key. The hash is the full SHA-256 of that text.
 */
@Service
public class CombinationKeyFactory {

    private static final Logger logger = LoggerFactory.getLogger(CombinationKeyFactory.class);

    private final CombinationCatalog catalog;
    private final ObjectMapper objectMapper;

    public CombinationKeyFactory(CombinationCatalog catalog, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.objectMapper = objectMapper;
    }

    /**
     * Normalizes and validates a request.
     *
     * @throws InvalidCombinationException for an empty source set or any value outside the catalog
     */
    public CombinationKey canonicalize(String tool, Collection<String> sources, String language) {
        String normalizedTool = CombinationCatalog.normalize(tool);
        if (!catalog.isKnownTool(normalizedTool)) {
            throw new InvalidCombinationException("Unknown tool: " + tool);
        }
        String normalizedLanguage = CombinationCatalog.normalize(language);
        if (!catalog.isKnownLanguage(normalizedLanguage)) {
            throw new InvalidCombinationException("Unsupported language: " + language);
        }
        if (sources == null || sources.isEmpty()) {
            throw new InvalidCombinationException("At least one source is required");
        }
        TreeSet<String> normalizedSources = new TreeSet<>();
        for (String source : sources) {
            String normalized = CombinationCatalog.normalize(source);
            if (normalized.isEmpty()) {
                continue;
            }
            if (!catalog.isKnownSource(normalized)) {
                throw new InvalidCombinationException("Unknown source: " + source);
            }
            normalizedSources.add(normalized);
        }
        if (normalizedSources.isEmpty()) {
            throw new InvalidCombinationException("At least one source is required");
        }
        List<String> sortedSources = List.copyOf(normalizedSources);
        String canonical = canonicalForm(normalizedTool, sortedSources, normalizedLanguage);
        return new CombinationKey(normalizedTool, sortedSources, normalizedLanguage, canonical, sha256(canonical));
    }

    /**
     * Every valid combination: each tool with each non-empty source subset in each language.
     */
    public List<CombinationKey> enumerateAll() {
        Set<Set<String>> subsets = Sets.powerSet(ImmutableSet.copyOf(catalog.sourceIds()));
        List<CombinationKey> keys = new ArrayList<>();
        for (String tool : catalog.toolIds()) {
            for (Set<String> subset : subsets) {
                if (subset.isEmpty()) {
                    continue;
                }
                for (String language : catalog.languageIds()) {
                    keys.add(canonicalize(tool, subset, language));
                }
            }
        }
        logger.debug("Enumerated {} combinations", keys.size());
        return keys;
    }

    private String canonicalForm(String tool, List<String> sources, String language) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("tool", tool);
        ArrayNode sourceArray = node.putArray("sources");
        sources.forEach(sourceArray::add);
        node.put("language", language);
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize combination key", e);
        }
    }

    private static String sha256(String content) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] encoded = digest.digest(content.getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder(2 * encoded.length);
        for (byte b : encoded) {
            String h = Integer.toHexString(0xff & b);
            if (h.length() == 1) {
                hex.append('0');
            }
            hex.append(h);
        }
        return hex.toString();
    }
}
