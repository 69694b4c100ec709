package com.ukdataalerts.coronavirus.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * The dashboard's published metric manifest: identifier to opaque metadata.
 *
 * Serialises as a flat JSON object so that a written baseline reads back equal.
 */
@EqualsAndHashCode
@ToString
public class MetricDefinitions {

    private final Map<String, JsonNode> entries = new LinkedHashMap<>();

    public MetricDefinitions() {
    }

    public static MetricDefinitions empty() {
        return new MetricDefinitions();
    }

    @JsonAnySetter
    public void put(String identifier, JsonNode metadata) {
        entries.put(identifier, metadata);
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getEntries() {
        return Collections.unmodifiableMap(entries);
    }

    public Set<String> identifiers() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }
}
