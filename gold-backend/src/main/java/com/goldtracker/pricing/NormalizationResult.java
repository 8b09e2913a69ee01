package com.goldtracker.pricing;

import java.util.List;

/**
 * Normalized quotes plus one warning per dropped quote.
 */
public record NormalizationResult(List<NormalizedQuote> quotes, List<String> warnings) {

    public NormalizationResult {
        quotes = List.copyOf(quotes);
        warnings = List.copyOf(warnings);
    }
}
