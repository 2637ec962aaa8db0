package com.pathway.impact.snapshot;

import com.pathway.impact.api.AnalysisResult;
import com.pathway.impact.audit.AuditAction;
import com.pathway.impact.audit.AuditService;
import com.pathway.impact.error.DataIntegrityException;
import com.pathway.impact.error.ValidationException;
import com.pathway.impact.export.AnalysisJson;
import com.pathway.impact.logging.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Freezes stored analyses into shares and reads them back.
 *
 * <p>A share holds the canonical JSON bytes of the analysis as it was at share time.
 * Every read deserializes a fresh copy, so nothing a reader does can reach the stored
 * bytes, and later re-runs of the same compound produce new analyses rather than touching
 * existing shares. There is no recomputation path.</p>
 */
public class ShareManager {
    private static final Logger log = LoggerFactory.getLogger(ShareManager.class);

    private final AnalysisRepository analyses;
    private final ShareRepository shares;
    private final AnalysisJson json;
    private final AuditService auditService;
    private final Clock clock;

    public ShareManager(AnalysisRepository analyses, ShareRepository shares, AnalysisJson json,
                        AuditService auditService, Clock clock) {
        this.analyses = analyses;
        this.shares = shares;
        this.json = json;
        this.auditService = auditService;
        this.clock = clock;
    }

    /**
     * @throws ValidationException when no analysis with that id is stored
     */
    public ShareSnapshot share(String analysisId) {
        AnalysisResult result = analyses.findById(analysisId)
                .orElseThrow(() -> new ValidationException("Unknown analysis '" + analysisId + "'"));
        ShareSnapshot snapshot = new ShareSnapshot(LogContext.newId(), analysisId, clock.instant(),
                json.toBytes(result));
        shares.insert(snapshot);
        auditService.record(AuditAction.SHARE_CREATED, snapshot.shareId(), null,
                Map.of("analysisId", analysisId, "bytes", snapshot.payload().length));
        log.info("share.created shareId={} analysisId={}", snapshot.shareId(), analysisId);
        return snapshot;
    }

    /**
     * Returns a fresh copy of the shared analysis, or empty for an unknown share id.
     */
    public Optional<AnalysisResult> read(String shareId) {
        return shares.findById(shareId).map(this::thaw);
    }

    public Optional<ShareSnapshot> readSnapshot(String shareId) {
        return shares.findById(shareId);
    }

    private AnalysisResult thaw(ShareSnapshot snapshot) {
        try {
            return json.fromBytes(snapshot.payload(), AnalysisResult.class);
        } catch (IOException e) {
            throw new DataIntegrityException(snapshot.shareId(), "share payload unreadable", e);
        }
    }
}
