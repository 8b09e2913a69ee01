package com.goldtracker.api.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RawQuote Tests")
class RawQuoteTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @Test
    @DisplayName("Rejects a quote without any price field")
    void requiresPrice() {
        assertThatThrownBy(() -> new RawQuote("x", "Vietnam", "VND", null, null, null, null, null, NOW))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("no price field");
    }

    @Test
    @DisplayName("Ounce quotes derive their gram price")
    void perOunceDerivesGram() {
        var quote = RawQuote.perOunce("FreeGoldAPI", "International", "USD", 3110.35, NOW);

        assertThat(quote.pricePerGram()).isCloseTo(100.0, within(1e-9));
        assertThat(quote.pricePerOunce()).isEqualTo(3110.35);
    }

    @Test
    @DisplayName("Dealer quotes use the sell price as the tael price")
    void buySell() {
        var quote = RawQuote.buySell("SJC Miếng", "Vietnam", "VND", 80_000_000, 82_000_000, NOW);

        assertThat(quote.pricePerTael()).isEqualTo(82_000_000.0);
        assertThat(quote.buyPrice()).isEqualTo(80_000_000.0);
    }

    @Nested
    @DisplayName("Shape resolution")
    class Shape {

        @Test
        @DisplayName("Per-gram wins over every other field")
        void gramFirst() {
            var quote = new RawQuote("x", "Vietnam", "VND", 2_000_000.0, null, 75_000_000.0, null, 80_000_000.0, NOW);

            assertThat(quote.shape()).containsInstanceOf(QuoteShape.PerGram.class);
            assertThat(quote.shape().orElseThrow().pricePerGram()).isEqualTo(2_000_000.0);
        }

        @Test
        @DisplayName("Tael price divides by 37.5")
        void tael() {
            var quote = RawQuote.perTael("x", "Vietnam", "VND", 75_000_000, NOW);

            assertThat(quote.shape().orElseThrow().pricePerGram()).isEqualTo(2_000_000.0);
        }

        @Test
        @DisplayName("Sell price is the last resort")
        void sellOnly() {
            var quote = new RawQuote("x", "Vietnam", "VND", null, null, null, 70_000_000.0, 75_000_000.0, NOW);

            assertThat(quote.shape()).containsInstanceOf(QuoteShape.BuySell.class);
            assertThat(quote.shape().orElseThrow().pricePerGram()).isEqualTo(2_000_000.0);
        }

        @Test
        @DisplayName("Ounce-only and non-positive quotes have no usable shape")
        void unusable() {
            var ounceOnly = new RawQuote("x", "International", "USD", null, 2000.0, null, null, null, NOW);
            var zeroGram = RawQuote.perGram("x", "Vietnam", "VND", 0, NOW);

            assertThat(ounceOnly.shape()).isEmpty();
            assertThat(zeroGram.shape()).isEmpty();
        }
    }
}
