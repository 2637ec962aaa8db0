package com.pathway.impact.fixtures;

import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.identity.CompoundRecord;
import com.pathway.impact.identity.IdentityProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory compound search. Matches loosely on lower-cased names and synonyms, the way a
 * real search index over-matches; switch {@link #down} on to simulate an outage.
 */
public class FakeIdentityProvider implements IdentityProvider {

    public static final String SOURCE = "chembl-search";

    private final List<CompoundRecord> records = new ArrayList<>();
    private final AtomicInteger searchCalls = new AtomicInteger();
    private volatile boolean down;

    public FakeIdentityProvider add(CompoundRecord record) {
        records.add(record);
        return this;
    }

    public void setDown(boolean down) {
        this.down = down;
    }

    public int searchCalls() {
        return searchCalls.get();
    }

    @Override
    public String sourceName() {
        return SOURCE;
    }

    @Override
    public Optional<String> sourceVersion() {
        return Optional.of("34");
    }

    @Override
    public boolean ping() {
        return !down;
    }

    @Override
    public List<CompoundRecord> search(String normalizedQuery) {
        searchCalls.incrementAndGet();
        if (down) {
            throw new UpstreamUnavailableException(SOURCE, "connection refused");
        }
        List<CompoundRecord> hits = new ArrayList<>();
        for (CompoundRecord record : records) {
            boolean match = record.displayName().toLowerCase(Locale.ROOT).contains(normalizedQuery)
                    || record.synonyms().stream().anyMatch(s -> s.toLowerCase(Locale.ROOT).contains(normalizedQuery));
            if (match) {
                hits.add(record);
            }
        }
        return hits;
    }

    @Override
    public Optional<CompoundRecord> findByStructureKey(String structureKey) {
        if (down) {
            throw new UpstreamUnavailableException(SOURCE, "connection refused");
        }
        return records.stream().filter(r -> structureKey.equals(r.structureKey())).findFirst();
    }
}
