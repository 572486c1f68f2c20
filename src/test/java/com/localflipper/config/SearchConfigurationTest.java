package com.localflipper.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchConfigurationTest {

    @Test
    void fromConfigShouldUseDefaults() {
        SearchConfiguration search = SearchConfiguration.fromConfig(Config.fromMap(Path.of("."), Map.of()));

        assertEquals("redding", search.getCraigslistSite());
        assertEquals("96001", search.getPostalCode());
        assertEquals(50, search.getRadiusMiles());
        assertEquals("ps5", search.getKeyword());
        assertEquals(50, search.getMaxResultsPerSource());
        assertNull(search.getPriceCeiling());
        assertEquals(22.0, search.getFuelEconomyMpg(), 1e-9);
        assertEquals(4.50, search.getFuelPricePerGallon(), 1e-9);
        assertFalse(search.isIncludeFacebook());
        assertTrue(search.isRawMode());
    }

    @Test
    void fromConfigShouldApplyOverrides() {
        Config config = Config.fromMap(Path.of("."), Map.of(
                "search.craigslist_site", "SacRamento",
                "search.query", "  steam deck ",
                "search.max_price", "300",
                "filter.min_profit", "40",
                "search.include_facebook", "yes"
        ));

        SearchConfiguration search = SearchConfiguration.fromConfig(config);

        assertEquals("sacramento", search.getCraigslistSite());
        assertEquals("steam deck", search.getKeyword());
        assertEquals(300.0, search.getPriceCeiling(), 1e-9);
        assertEquals(40.0, search.getMinProfit(), 1e-9);
        assertTrue(search.isIncludeFacebook());
        assertFalse(search.isRawMode());
    }

    @Test
    void zeroCeilingShouldMeanNoCeiling() {
        assertNull(valid().priceCeiling(0.0).build().getPriceCeiling());
        assertNull(SearchConfiguration.fromConfig(
                Config.fromMap(Path.of("."), Map.of("search.max_price", "0"))).getPriceCeiling());
    }

    @Test
    void negativeCeilingFromConfigShouldBeRejected() {
        Config config = Config.fromMap(Path.of("."), Map.of("search.max_price", "-5"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SearchConfiguration.fromConfig(config));
        assertTrue(e.getMessage().contains("price ceiling"), e.getMessage());
    }

    @Test
    void invalidValuesShouldBeRejected() {
        assertInvalid(valid().keyword(" "), "keyword");
        assertInvalid(valid().radiusMiles(-1), "radius");
        assertInvalid(valid().maxResultsPerSource(0), "max results");
        assertInvalid(valid().priceCeiling(-5.0), "price ceiling");
        assertInvalid(valid().minProfit(-1.0), "minimum profit");
        assertInvalid(valid().minMarginPct(Double.NaN), "minimum margin");
        assertInvalid(valid().fuelEconomyMpg(0.0), "fuel economy");
        assertInvalid(valid().fuelPricePerGallon(-2.0), "fuel price");
    }

    @Test
    void withKeywordShouldKeepEverythingElse() {
        SearchConfiguration base = valid().priceCeiling(200.0).minMarginPct(15.0).build();

        SearchConfiguration other = base.withKeyword("switch");

        assertEquals("switch", other.getKeyword());
        assertEquals(base.getPriceCeiling(), other.getPriceCeiling());
        assertEquals(base.getMinMarginPct(), other.getMinMarginPct(), 1e-9);
        assertEquals(base.getPostalCode(), other.getPostalCode());
        assertEquals("ps5", base.getKeyword());
    }

    private static void assertInvalid(SearchConfiguration.SearchConfigurationBuilder builder, String fragment) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().startsWith("invalid search config:"), e.getMessage());
        assertTrue(e.getMessage().contains(fragment), e.getMessage());
    }

    private static SearchConfiguration.SearchConfigurationBuilder valid() {
        return SearchConfiguration.builder()
                .craigslistSite("redding")
                .postalCode("96001")
                .radiusMiles(25)
                .keyword("ps5")
                .maxResultsPerSource(10)
                .fuelEconomyMpg(22.0)
                .fuelPricePerGallon(4.5);
    }
}
