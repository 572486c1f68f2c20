package com.localflipper.pipeline;

import com.localflipper.config.SearchConfiguration;
import com.localflipper.core.RunTelemetry;
import com.localflipper.core.diagnostics.Outcome;
import com.localflipper.model.ConditionLabel;
import com.localflipper.model.DealRow;
import com.localflipper.model.MarketPriceEstimate;
import com.localflipper.model.RankedResultSet;
import com.localflipper.model.RawListing;
import com.localflipper.pricing.MarketPriceService;
import com.localflipper.source.MarketplaceAdapter;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SearchRunnerTest {

    @Test
    void singleListingWithoutPriceDataShouldStillRank() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 console good condition", 250.0));
        SearchRunner runner = new SearchRunner(craigslist, null, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5"));

        assertEquals(RankedResultSet.MODE_SINGLE, results.mode);
        assertEquals(1, results.size());
        DealRow row = results.rows.get(0);
        assertEquals("", row.getSearchTerm());
        assertEquals("craigslist", row.source());
        assertEquals(0.0, row.getCandidate().estimate.averageSoldPrice, 1e-9);
        assertEquals(0.0, row.getCandidate().estimatedProfit, 1e-9);
        assertEquals(0.0, row.getCandidate().profitMarginPct, 1e-9);
        assertEquals(ConditionLabel.GOOD, row.getConditionLabel());
        assertTrue(row.getTravelCost() > 0.0);
        assertEquals(20.4545, row.getTravelCost(), 1e-4);
        assertEquals(312.50, row.getRuleMarketValue(), 1e-9);
        assertEquals(62.50, row.getRuleProfit(), 1e-9);
        assertEquals(42.05, row.getEffectiveProfit(), 1e-9);
    }

    @Test
    void twoSavedTermsShouldMergeIntoTaggedRows() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 console good condition", 250.0))
                .add("switch", listing("Nintendo Switch like new", 180.0));
        SearchRunner runner = new SearchRunner(craigslist, null, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.runAll(search("ps5"), List.of("ps5", "switch"));

        assertEquals(RankedResultSet.MODE_SAVED, results.mode);
        assertEquals(List.of("ps5", "switch"), results.terms);
        assertEquals(2, results.size());
        Map<String, String> termByTitle = new HashMap<>();
        for (DealRow row : results.rows) {
            termByTitle.put(row.title(), row.getSearchTerm());
        }
        assertEquals("ps5", termByTitle.get("PS5 console good condition"));
        assertEquals("switch", termByTitle.get("Nintendo Switch like new"));
        DealRow first = results.rows.get(0);
        DealRow second = results.rows.get(1);
        assertTrue(first.getDemandScore() > second.getDemandScore()
                || (first.getDemandScore().equals(second.getDemandScore())
                && first.getEffectiveProfit() >= second.getEffectiveProfit()));
    }

    @Test
    void listingWithoutPriceShouldNeverAppear() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 no price", null))
                .add("ps5", listing("PS5 priced", 300.0));
        SearchRunner runner = new SearchRunner(craigslist, null, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5"));

        assertEquals(1, results.size());
        assertEquals("PS5 priced", results.rows.get(0).title());
    }

    @Test
    void failedLookupShouldDegradeOnlyThatListing() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 disc", 300.0))
                .add("ps5", listing("PS5 digital", 280.0));
        StubPriceService prices = new StubPriceService()
                .price("PS5 disc", new MarketPriceEstimate(420.0, 8))
                .fail("PS5 digital");
        SearchRunner runner = new SearchRunner(craigslist, null, prices, new DealEnricher(), 4, 5);

        RankedResultSet results = runner.run(search("ps5"));

        assertEquals(2, results.size());
        DealRow disc = find(results, "PS5 disc");
        DealRow digital = find(results, "PS5 digital");
        assertEquals(120.0, disc.getCandidate().estimatedProfit, 1e-9);
        assertEquals(40.0, disc.getCandidate().profitMarginPct, 1e-9);
        assertEquals(0, digital.getCandidate().estimate.sampleSize);
        assertEquals(0.0, digital.getCandidate().estimatedProfit, 1e-9);
        assertNotNull(digital.getDemandScore());
    }

    @Test
    void failingAdapterShouldNotAbortTheRun() {
        StubAdapter craigslist = new StubAdapter("craigslist").failWith(new IllegalStateException("HTTP 403"));
        StubAdapter facebook = new StubAdapter("facebook").add("ps5", listing("PS5 slim", 350.0));
        SearchRunner runner = new SearchRunner(craigslist, facebook, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5").toBuilder().includeFacebook(true).build());

        assertEquals(1, results.size());
        assertEquals("facebook", results.rows.get(0).source());
    }

    @Test
    void facebookShouldOnlyBeQueriedWhenEnabled() {
        StubAdapter craigslist = new StubAdapter("craigslist");
        StubAdapter facebook = new StubAdapter("facebook").add("ps5", listing("PS5 slim", 350.0));
        SearchRunner runner = new SearchRunner(craigslist, facebook, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5"));

        assertTrue(results.isEmpty());
        assertEquals(0, facebook.calls.get());
        assertEquals(1, craigslist.calls.get());
    }

    @Test
    void adapterBoundaryShouldRetagSourceAndApplyCeiling() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", new RawListing("unknown", "PS5 cheap", 200.0, "", "", null))
                .add("ps5", new RawListing("unknown", "PS5 pricey", 900.0, "", "", null));
        SearchRunner runner = new SearchRunner(craigslist, null, new StubPriceService(), new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5").toBuilder().priceCeiling(500.0).build());

        assertEquals(1, results.size());
        assertEquals("craigslist", results.rows.get(0).source());
        assertEquals("PS5 cheap", results.rows.get(0).title());
    }

    @Test
    void thresholdsShouldDropUnprofitableCandidates() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 disc", 300.0))
                .add("ps5", listing("PS5 digital", 280.0));
        StubPriceService prices = new StubPriceService()
                .price("PS5 disc", new MarketPriceEstimate(420.0, 8))
                .price("PS5 digital", new MarketPriceEstimate(290.0, 8));
        SearchRunner runner = new SearchRunner(craigslist, null, prices, new DealEnricher(), 2, 5);

        RankedResultSet results = runner.run(search("ps5").toBuilder().minProfit(50.0).build());

        assertEquals(1, results.size());
        assertEquals("PS5 disc", results.rows.get(0).title());
    }

    @Test
    void lookupResultsShouldFollowListingIndexNotCompletionOrder() {
        List<RawListing> listings = new ArrayList<>();
        StubPriceService prices = new StubPriceService();
        for (int i = 0; i < 12; i++) {
            String title = "item " + i;
            listings.add(listing(title, 100.0));
            prices.price(title, new MarketPriceEstimate(100.0 + i, i + 1));
        }
        prices.slowFirst = true;
        SearchRunner runner = new SearchRunner(null, null, prices, new DealEnricher(), 4, 10);

        List<Outcome<MarketPriceEstimate>> estimates = runner.lookupAll(listings);

        for (int i = 0; i < 12; i++) {
            assertEquals(100.0 + i, estimates.get(i).value.averageSoldPrice, 1e-9);
            assertEquals(i + 1, estimates.get(i).value.sampleSize);
        }
    }

    @Test
    void collectRowsShouldFeedTelemetry() {
        StubAdapter craigslist = new StubAdapter("craigslist")
                .add("ps5", listing("PS5 console good condition", 250.0))
                .add("ps5", listing("PS5 no price", null));
        SearchRunner runner = new SearchRunner(craigslist, null, new StubPriceService(), new DealEnricher(), 2, 5);
        RunTelemetry telemetry = new RunTelemetry("single", "ps5", Instant.now());

        runner.collectRows(search("ps5"), telemetry);

        assertEquals(2, telemetry.listingsRaw());
        assertEquals(1, telemetry.candidates());
        String summary = telemetry.getSummary();
        assertTrue(summary.contains(RunTelemetry.STEP_ADAPTER_FETCH));
        assertTrue(summary.contains("invalid_listings=1"));
        assertTrue(summary.contains("raw_mode"));
    }

    private static DealRow find(RankedResultSet results, String title) {
        return results.rows.stream().filter(r -> r.title().equals(title)).findFirst().orElseThrow();
    }

    private static SearchConfiguration search(String keyword) {
        return SearchConfiguration.builder()
                .craigslistSite("redding")
                .postalCode("96001")
                .radiusMiles(50)
                .keyword(keyword)
                .maxResultsPerSource(50)
                .fuelEconomyMpg(22.0)
                .fuelPricePerGallon(4.50)
                .build();
    }

    private static RawListing listing(String title, Double price) {
        return new RawListing("", title, price, "Redding", "https://example.test/" + title.hashCode(), null);
    }

    private static final class StubAdapter implements MarketplaceAdapter {
        private final String source;
        private final Map<String, List<RawListing>> byTerm = new HashMap<>();
        private final AtomicInteger calls = new AtomicInteger();
        private Exception failure;

        private StubAdapter(String source) {
            this.source = source;
        }

        StubAdapter add(String term, RawListing listing) {
            byTerm.computeIfAbsent(term, ignored -> new ArrayList<>()).add(listing);
            return this;
        }

        StubAdapter failWith(Exception e) {
            this.failure = e;
            return this;
        }

        @Override
        public String source() {
            return source;
        }

        @Override
        public List<RawListing> search(SearchConfiguration search, String term) throws Exception {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return byTerm.getOrDefault(term, List.of());
        }
    }

    private static final class StubPriceService implements MarketPriceService {
        private final Map<String, MarketPriceEstimate> prices = new ConcurrentHashMap<>();
        private final Map<String, Boolean> failures = new ConcurrentHashMap<>();
        private volatile boolean slowFirst;

        StubPriceService price(String title, MarketPriceEstimate estimate) {
            prices.put(title, estimate);
            return this;
        }

        StubPriceService fail(String title) {
            failures.put(title, Boolean.TRUE);
            return this;
        }

        @Override
        public MarketPriceEstimate lookup(String title) throws Exception {
            if (slowFirst && "item 0".equals(title)) {
                Thread.sleep(150L);
            }
            if (failures.containsKey(title)) {
                throw new IllegalStateException("HTTP 500");
            }
            return prices.getOrDefault(title, MarketPriceEstimate.EMPTY);
        }
    }
}
