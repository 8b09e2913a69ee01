package com.goldtracker.pricing;

import com.goldtracker.acquisition.AcquisitionException;
import com.goldtracker.acquisition.AcquisitionOrchestrator;
import com.goldtracker.acquisition.QuoteCurator;
import com.goldtracker.api.model.RawQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Builds the quote snapshot: acquire, curate, normalize, then price the Vietnam premium.
 */
public final class QuoteSnapshotService {
    private static final Logger logger = LoggerFactory.getLogger(QuoteSnapshotService.class);

    private final AcquisitionOrchestrator orchestrator;
    private final NormalizationEngine engine;

    public QuoteSnapshotService(AcquisitionOrchestrator orchestrator, NormalizationEngine engine) {
        this.orchestrator = orchestrator;
        this.engine = engine;
    }

    public QuoteSnapshot buildSnapshot() throws AcquisitionException {
        var result = QuoteCurator.curate(orchestrator.acquireAll());
        var normalization = engine.normalize(result.allQuotes(), result.rates());

        var raw = new LinkedHashMap<String, List<RawQuote>>();
        result.quotes().forEach((market, quotes) -> raw.put(market.displayName().toLowerCase(), quotes));

        var premium = PremiumCalculator.vietnamPremium(result);
        premium.ifPresentOrElse(
            p -> logger.info("Vietnam premium {}% over benchmark", String.format("%.2f", p.premiumPercent())),
            () -> logger.warn("Vietnam premium unavailable"));

        var warnings = new ArrayList<>(result.warnings());
        warnings.addAll(normalization.warnings());

        return new QuoteSnapshot(result.fetchedAt(), normalization.quotes(), raw, result.rates(),
            premium.orElse(null), warnings);
    }
}
