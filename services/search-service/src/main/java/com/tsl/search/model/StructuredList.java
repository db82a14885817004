package com.tsl.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class StructuredList extends ProfileSection {
    private final List<Map<String, String>> entries;

    @JsonCreator
    public StructuredList(@JsonProperty("entries") List<Map<String, String>> entries) {
        List<Map<String, String>> copy = new ArrayList<>();
        if (entries != null) {
            for (Map<String, String> entry : entries) {
                if (entry != null && !entry.isEmpty()) {
                    copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(entry)));
                }
            }
        }
        this.entries = List.copyOf(copy);
    }

    public List<Map<String, String>> getEntries() {
        return entries;
    }

    @Override
    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String format(List<String> fields) {
        List<String> rendered = new ArrayList<>();
        for (Map<String, String> entry : entries) {
            List<String> parts = new ArrayList<>();
            if (fields == null || fields.isEmpty()) {
                for (String value : entry.values()) {
                    addPart(parts, value);
                }
            } else {
                for (String field : fields) {
                    addPart(parts, entry.get(field));
                }
            }
            if (!parts.isEmpty()) {
                rendered.add(String.join(" - ", parts));
            }
        }
        return String.join("; ", rendered);
    }

    private static void addPart(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StructuredList)) {
            return false;
        }
        return entries.equals(((StructuredList) o).entries);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries);
    }

    @Override
    public String toString() {
        return "StructuredList" + entries;
    }
}
