package com.goldtracker.api.sources;

import com.goldtracker.api.HttpFetcher;
import com.goldtracker.api.model.RawQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Vietnam Source Tests")
class VietnamSourcesTest {

    @Mock
    private HttpFetcher fetcher;

    @Nested
    @DisplayName("giavang.org")
    class GiaVang {

        private static final String PAGE = """
            <html><body>
            <h2>Giá vàng Miếng SJC hôm nay</h2>
            <table>
              <tr><th>Loại</th><th>Mua vào</th><th>Bán ra</th></tr>
              <tr><td>SJC 1L, 10L</td><td>80.000</td><td>82.000</td></tr>
              <tr><td>SJC 5 chỉ</td><td>80.000</td><td>82.000</td></tr>
              <tr><td>PNJ</td><td>70.000</td><td>71.000</td></tr>
            </table>
            <h2>Giá vàng Nhẫn</h2>
            <table>
              <tr><td>Nhẫn SJC 99,99</td><td>78,500</td><td>80,000</td></tr>
              <tr><td>SJC lẻ</td><td>--</td><td>--</td></tr>
            </table>
            </body></html>
            """;

        @Test
        @DisplayName("Reads SJC rows per heading, in VND per tael")
        void parsesTables() throws Exception {
            when(fetcher.get(anyString(), anyMap())).thenReturn(PAGE);

            var quotes = new GiaVangSource(fetcher).fetch().data();

            assertThat(quotes).extracting(RawQuote::source).containsExactly("SJC Miếng", "SJC Nhẫn");
            assertThat(quotes.get(0).buyPrice()).isEqualTo(80_000_000.0);
            assertThat(quotes.get(0).sellPrice()).isEqualTo(82_000_000.0);
            assertThat(quotes.get(1).buyPrice()).isEqualTo(78_500_000.0);
            assertThat(quotes.get(1).currency()).isEqualTo("VND");
        }

        @Test
        @DisplayName("Page without SJC rows is a failure")
        void emptyPage() throws Exception {
            when(fetcher.get(anyString(), anyMap())).thenReturn("<html><body><p>Bảo trì</p></body></html>");

            var result = new GiaVangSource(fetcher).fetch();

            assertThat(result.error()).isEqualTo("No price data from giavang.org");
        }

        @Test
        @DisplayName("Thousands separators are stripped")
        void parseThousands() {
            assertThat(GiaVangSource.parseThousands("175.300")).isEqualTo(175_300.0);
            assertThat(GiaVangSource.parseThousands("175,300")).isEqualTo(175_300.0);
            assertThat(GiaVangSource.parseThousands("n/a")).isZero();
        }
    }

    @Test
    @DisplayName("goldprice.org page yields gram, ounce and embedded quotes")
    void goldPriceOrg() throws Exception {
        when(fetcher.get(anyString(), anyMap())).thenReturn("""
            <html><body>
            <div>Gold price today: 2,100,000 VND per gram, 65,300,000 VND / ounce</div>
            <script>var data = {"price": 65400000.5};</script>
            </body></html>
            """);

        var quotes = new GoldPriceOrgVietnamSource(fetcher).fetch().data();

        assertThat(quotes).extracting(RawQuote::source)
            .containsExactly("GoldPriceOrg-VN", "GoldPriceOrg-VN-Oz", "GoldPriceOrg-Embedded");
        assertThat(quotes.get(0).pricePerGram()).isEqualTo(2_100_000.0);
        assertThat(quotes.get(1).pricePerOunce()).isEqualTo(65_300_000.0);
    }

    @Test
    @DisplayName("goldpricez keeps plausible per-gram values once")
    void goldPricez() throws Exception {
        when(fetcher.get(anyString(), anyMap())).thenReturn("""
            <html><body>
            <div class="price-box">2,150,000 ₫</div>
            <span class="gold-rate">2,150,000 VND</span>
            <div class="price">999 VND</div>
            </body></html>
            """);

        var quotes = new GoldPricezSource(fetcher).fetch().data();

        assertThat(quotes).hasSize(1);
        assertThat(quotes.get(0).pricePerGram()).isEqualTo(2_150_000.0);
    }

    @Nested
    @DisplayName("VNAppMob")
    class VnAppMob {

        @Test
        @DisplayName("Unavailable without a key")
        void needsKey() {
            assertThat(new VnAppMobSource(fetcher, Optional.empty()).isAvailable()).isFalse();
        }

        @Test
        @DisplayName("Reads the first result with bearer auth")
        void parses() throws Exception {
            when(fetcher.get(anyString(), anyMap()))
                .thenReturn("{\"results\": [{\"buy_1l\": \"80000000.0\", \"sell_1l\": \"82000000.0\"}]}");

            var quote = new VnAppMobSource(fetcher, Optional.of("token")).fetch().data().get(0);

            assertThat(quote.source()).isEqualTo("VNAppMob SJC");
            assertThat(quote.sellPrice()).isEqualTo(82_000_000.0);
            verify(fetcher).get(eq(VnAppMobSource.URL), argThat(h -> "Bearer token".equals(h.get("Authorization"))));
        }

        @Test
        @DisplayName("Empty results are a failure")
        void empty() throws Exception {
            when(fetcher.get(anyString(), anyMap())).thenReturn("{\"results\": []}");

            assertThat(new VnAppMobSource(fetcher, Optional.of("token")).fetch().error())
                .isEqualTo("No data in response");
        }
    }
}
