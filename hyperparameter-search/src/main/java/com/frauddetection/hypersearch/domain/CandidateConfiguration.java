package com.frauddetection.hypersearch.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One concrete set of parameter values to try in a single training attempt.
 * Insertion order follows the catalog order of the sampled parameters.
 */
@EqualsAndHashCode
@ToString
public final class CandidateConfiguration {

    private final Map<String, Object> values;

    public CandidateConfiguration(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    @JsonValue
    public Map<String, Object> values() {
        return values;
    }

    public Object get(String name) {
        return values.get(name);
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Set<String> names() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }
}
