package com.pathway.impact.identity;

import com.pathway.impact.cache.IdentityCache;
import com.pathway.impact.core.model.CompoundIdentity;
import com.pathway.impact.core.model.MatchKind;
import com.pathway.impact.core.model.ResolutionCandidate;
import com.pathway.impact.core.model.ResolutionOutcome;
import com.pathway.impact.error.ConfigurationException;
import com.pathway.impact.error.UpstreamUnavailableException;
import com.pathway.impact.error.ValidationException;
import com.pathway.impact.metrics.MetricsService;
import com.pathway.impact.rules.NormalizationEngine;
import com.pathway.impact.upstream.RetryingInvoker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonicalizes a free-text query into a compound identity or a ranked set of candidates.
 *
 * <p>Matching precedence: an exact display-name hit, then a synonym hit, then a substring
 * hit. Exact and synonym hits shadow substring hits entirely. If the winning group names
 * more than one canonical parent (a free base and its salt, say) the outcome is
 * {@code AMBIGUOUS}; the resolver never picks one arbitrarily.</p>
 *
 * <p>The resolver is a pure lookup plus a cache fill. When the search provider stays
 * unavailable after retries, the last outcome cached for the same normalized query is
 * served instead, marked {@code fromCache}.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final String NOVEL_PREFIX = "novel:";

    private final IdentityProvider provider;
    private final StructureStandardizer standardizer;
    private final NormalizationEngine normalizer;
    private final IdentityCache cache;
    private final RetryingInvoker invoker;
    private final MetricsService metrics;

    public IdentityResolver(IdentityProvider provider, StructureStandardizer standardizer,
                            NormalizationEngine normalizer, IdentityCache cache,
                            RetryingInvoker invoker, MetricsService metrics) {
        this.provider = provider;
        this.standardizer = standardizer;
        this.normalizer = normalizer;
        this.cache = cache;
        this.invoker = invoker;
        this.metrics = metrics;
    }

    public IdentityProvider getProvider() {
        return provider;
    }

    public ResolutionOutcome resolve(String query) {
        return resolve(query, null);
    }

    /**
     * Resolves a query.
     *
     * @param resolutionChoice canonical id the caller already picked, or null; it must be
     *                         one of the candidates the query produces
     * @throws ValidationException          for malformed input or a choice outside the candidates
     * @throws UpstreamUnavailableException when the provider is down and nothing is cached
     */
    public ResolutionOutcome resolve(String query, String resolutionChoice) {
        String sanitized = QuerySanitizer.sanitize(query);
        String normalized = normalizer.normalize(sanitized);
        if (normalized.length() < QuerySanitizer.MIN_LENGTH) {
            throw new ValidationException("Query '" + sanitized + "' is empty after normalization");
        }

        List<CompoundRecord> records;
        try {
            records = invoker.call(provider.sourceName(), () -> provider.search(normalized));
        } catch (UpstreamUnavailableException e) {
            return fromCacheOrThrow(normalized, resolutionChoice, e);
        }

        Map<String, CompoundRecord> byId = new LinkedHashMap<>();
        List<ResolutionCandidate> candidates = rankCandidates(normalized, records, byId);
        ResolutionOutcome outcome = decide(sanitized, normalized, candidates, byId, resolutionChoice);

        metrics.incrementResolution(outcome.status());
        if (outcome.resolved()) {
            cache.put(outcome.identity());
        }
        if (resolutionChoice == null) {
            cache.putOutcome(normalized, outcome);
        }
        log.debug("identity.resolved query='{}' status={} candidates={}",
                normalized, outcome.status(), outcome.candidates().size());
        return outcome;
    }

    /**
     * Resolves a structure (for compounds the search index may not know).
     * The structure key is looked up in the cache, then in the provider; an unknown
     * structure yields a novel identity {@code novel:<structureKey>}.
     */
    public ResolutionOutcome resolveStructure(String structureText) {
        if (structureText == null || structureText.isBlank()) {
            throw new ValidationException("Structure is required");
        }
        if (standardizer == null) {
            throw new ConfigurationException("No structure standardizer is configured");
        }
        String structureKey = invoker.call(standardizer.sourceName(), () -> standardizer.standardize(structureText));
        if (structureKey == null || structureKey.isBlank()) {
            throw new ValidationException("Structure could not be standardized");
        }

        Optional<CompoundIdentity> cached = cache.findByStructureKey(structureKey);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return ResolutionOutcome.resolved(structureText, structureKey, cached.get(), List.of());
        }
        metrics.recordCacheMiss();

        Optional<CompoundRecord> known = invoker.call(provider.sourceName(),
                () -> provider.findByStructureKey(structureKey));
        CompoundIdentity identity = known.map(CompoundRecord::toIdentity)
                .orElseGet(() -> new CompoundIdentity(NOVEL_PREFIX + structureKey, structureText.strip(),
                        structureKey, List.of(), null, null, true));
        cache.put(identity);
        log.debug("identity.structure key={} canonicalId={} novel={}",
                structureKey, identity.canonicalId(), identity.novel());
        return ResolutionOutcome.resolved(structureText, structureKey, identity, List.of());
    }

    /**
     * Returns up to {@code limit} display names for type-ahead, best matches first.
     */
    public List<String> suggest(String prefix, int limit) {
        if (limit < 1 || limit > 50) {
            throw new ValidationException("limit must be between 1 and 50");
        }
        String normalized = normalizer.normalize(QuerySanitizer.sanitize(prefix));
        List<CompoundRecord> records = invoker.call(provider.sourceName(), () -> provider.search(normalized));
        Set<String> names = new LinkedHashSet<>();
        for (ResolutionCandidate candidate : rankCandidates(normalized, records, new LinkedHashMap<>())) {
            names.add(candidate.displayName());
            if (names.size() == limit) {
                break;
            }
        }
        return new ArrayList<>(names);
    }

    List<ResolutionCandidate> rankCandidates(String normalizedQuery, List<CompoundRecord> records,
                                             Map<String, CompoundRecord> byId) {
        Map<String, ResolutionCandidate> best = new LinkedHashMap<>();
        for (CompoundRecord record : records) {
            ResolutionCandidate candidate = match(normalizedQuery, record);
            if (candidate == null) {
                continue;
            }
            ResolutionCandidate existing = best.get(record.canonicalId());
            if (existing == null || candidate.matchKind().compareTo(existing.matchKind()) < 0) {
                best.put(record.canonicalId(), candidate);
                byId.put(record.canonicalId(), record);
            }
        }
        List<ResolutionCandidate> ranked = new ArrayList<>(best.values());
        ranked.sort(ResolutionCandidate.RANKING);
        return ranked;
    }

    private ResolutionCandidate match(String normalizedQuery, CompoundRecord record) {
        String name = normalizer.normalize(record.displayName());
        MatchKind kind = null;
        List<String> reasons = new ArrayList<>();
        if (name.equals(normalizedQuery)) {
            kind = MatchKind.EXACT_NAME;
            reasons.add(MatchKind.EXACT_NAME.reason());
        }
        for (String synonym : record.synonyms()) {
            String normalizedSynonym = normalizer.normalize(synonym);
            if (normalizedSynonym.equals(normalizedQuery)) {
                if (kind == null) {
                    kind = MatchKind.SYNONYM;
                }
                reasons.add(MatchKind.SYNONYM.reason() + ":" + synonym);
                break;
            }
        }
        if (kind == null) {
            boolean substring = name.contains(normalizedQuery)
                    || record.synonyms().stream().map(normalizer::normalize).anyMatch(s -> s.contains(normalizedQuery));
            if (!substring) {
                return null;
            }
            kind = MatchKind.SUBSTRING;
            reasons.add(MatchKind.SUBSTRING.reason());
        }
        return new ResolutionCandidate(record.canonicalId(), record.displayName(), record.structureKey(), kind, reasons);
    }

    private ResolutionOutcome decide(String query, String normalized, List<ResolutionCandidate> candidates,
                                     Map<String, CompoundRecord> byId, String resolutionChoice) {
        if (resolutionChoice != null) {
            CompoundRecord chosen = byId.get(resolutionChoice);
            if (chosen == null) {
                throw new ValidationException("Resolution choice '" + resolutionChoice
                        + "' is not a candidate for query '" + query + "'", candidates);
            }
            return ResolutionOutcome.resolved(query, normalized, chosen.toIdentity(), candidates);
        }
        if (candidates.isEmpty()) {
            return ResolutionOutcome.notFound(query, normalized);
        }
        boolean anyDirect = candidates.stream().anyMatch(c -> c.matchKind().isDirect());
        List<ResolutionCandidate> winners = candidates.stream()
                .filter(c -> c.matchKind().isDirect() == anyDirect)
                .toList();
        if (winners.size() == 1) {
            CompoundRecord record = byId.get(winners.get(0).canonicalId());
            return ResolutionOutcome.resolved(query, normalized, record.toIdentity(), candidates);
        }
        return ResolutionOutcome.ambiguous(query, normalized, candidates);
    }

    private ResolutionOutcome fromCacheOrThrow(String normalized, String resolutionChoice,
                                               UpstreamUnavailableException failure) {
        Optional<ResolutionOutcome> cached = cache.getOutcome(normalized);
        if (cached.isEmpty()) {
            metrics.recordCacheMiss();
            throw failure;
        }
        metrics.recordCacheHit();
        ResolutionOutcome outcome = cached.get();
        if (resolutionChoice != null) {
            boolean known = outcome.candidates().stream().anyMatch(c -> c.canonicalId().equals(resolutionChoice));
            Optional<CompoundIdentity> identity = cache.get(resolutionChoice);
            if (!known || identity.isEmpty()) {
                throw failure;
            }
            outcome = ResolutionOutcome.resolved(outcome.query(), normalized, identity.get(), outcome.candidates());
        }
        log.warn("identity.served_from_cache query='{}' status={} cause={}",
                normalized, outcome.status(), failure.getMessage());
        return outcome.servedFromCache();
    }
}
