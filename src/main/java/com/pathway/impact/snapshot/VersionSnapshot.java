package com.pathway.impact.snapshot;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Versions of every upstream source consulted by one analysis, keyed by source name.
 * A source that did not report a version is recorded as {@code "unknown"}, never left out.
 */
public record VersionSnapshot(Map<String, String> sources) {

    public static final String UNKNOWN = "unknown";

    public VersionSnapshot {
        sources = sources != null ? Collections.unmodifiableMap(new TreeMap<>(sources)) : Map.of();
    }

    public String versionOf(String source) {
        return sources.getOrDefault(source, UNKNOWN);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> sources = new TreeMap<>();

        public Builder record(String source, Optional<String> version) {
            return record(source, version.orElse(null));
        }

        public Builder record(String source, String version) {
            sources.put(source, version != null && !version.isBlank() ? version : UNKNOWN);
            return this;
        }

        public VersionSnapshot build() {
            return new VersionSnapshot(sources);
        }
    }
}
