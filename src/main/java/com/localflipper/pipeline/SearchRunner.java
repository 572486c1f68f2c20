package com.localflipper.pipeline;

import com.localflipper.config.Config;
import com.localflipper.config.SearchConfiguration;
import com.localflipper.core.RunTelemetry;
import com.localflipper.core.diagnostics.CauseCode;
import com.localflipper.core.diagnostics.Outcome;
import com.localflipper.model.DealCandidate;
import com.localflipper.model.DealRow;
import com.localflipper.model.MarketPriceEstimate;
import com.localflipper.model.RankedResultSet;
import com.localflipper.model.RawListing;
import com.localflipper.pricing.EbaySoldPriceService;
import com.localflipper.pricing.MarketPriceService;
import com.localflipper.scoring.ConditionExtractor;
import com.localflipper.scoring.DemandScorer;
import com.localflipper.scoring.ReasonJsonBuilder;
import com.localflipper.scoring.RuleBasedValuator;
import com.localflipper.scoring.SellerTrustScorer;
import com.localflipper.scoring.TravelCostModel;
import com.localflipper.source.CraigslistClient;
import com.localflipper.source.FacebookMarketplaceClient;
import com.localflipper.source.MarketplaceAdapter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 模块说明：SearchRunner（class）。
 * 主要职责：执行单个搜索词的完整流程：抓取列表、并发查询成交价、构建候选、过滤、增强、排序。
 * 使用建议：适配器失败与单条价格查询失败只做降级处理；只有配置错误会在构造 {@link SearchConfiguration} 时提前终止。
 */
public final class SearchRunner {
    private static final Logger LOG = LogManager.getLogger(SearchRunner.class);

    private final MarketplaceAdapter craigslist;
    private final MarketplaceAdapter facebook;
    private final MarketPriceService priceService;
    private final DealCandidateBuilder candidateBuilder;
    private final DealEnricher enricher;
    private final RankingAggregator aggregator;
    private final TravelCostModel travelCostModel;
    private final int lookupThreads;
    private final int lookupTimeoutSec;

    public SearchRunner(
            MarketplaceAdapter craigslist,
            MarketplaceAdapter facebook,
            MarketPriceService priceService,
            DealEnricher enricher,
            int lookupThreads,
            int lookupTimeoutSec
    ) {
        this.craigslist = craigslist;
        this.facebook = facebook;
        this.priceService = priceService;
        this.candidateBuilder = new DealCandidateBuilder();
        this.enricher = enricher == null ? new DealEnricher() : enricher;
        this.aggregator = new RankingAggregator();
        this.travelCostModel = new TravelCostModel();
        this.lookupThreads = Math.max(1, lookupThreads);
        this.lookupTimeoutSec = Math.max(1, lookupTimeoutSec);
    }

    public static SearchRunner fromConfig(Config config) {
        DealEnricher enricher = new DealEnricher(
                new ConditionExtractor(),
                new SellerTrustScorer(),
                new RuleBasedValuator(config),
                new DemandScorer(config),
                new ReasonJsonBuilder()
        );
        return new SearchRunner(
                new CraigslistClient(config),
                new FacebookMarketplaceClient(config),
                new EbaySoldPriceService(config),
                enricher,
                config.getInt("search.lookup_threads", 4),
                config.getInt("search.lookup_timeout_sec", 30)
        );
    }

    public RankedResultSet run(SearchConfiguration search) {
        RunTelemetry telemetry = new RunTelemetry(RankedResultSet.MODE_SINGLE, search.getKeyword(), Instant.now());
        List<DealRow> rows = aggregator.rank(collectRows(search, telemetry));
        finish(telemetry, rows);
        return new RankedResultSet(RankedResultSet.MODE_SINGLE, List.of(search.getKeyword()), rows);
    }

    /**
     * Runs the pipeline for one term up to, but not including, the final sort. The returned rows carry no
     * search-term tag.
     */
    public List<DealRow> collectRows(SearchConfiguration search, RunTelemetry telemetry) {
        String term = search.getKeyword();

        telemetry.startStep(RunTelemetry.STEP_ADAPTER_FETCH);
        List<RawListing> listings = new ArrayList<>();
        int adapterErrors = 0;
        for (MarketplaceAdapter adapter : activeAdapters(search)) {
            Outcome<List<RawListing>> fetched = fetch(adapter, search, term);
            if (!fetched.success) {
                adapterErrors++;
            }
            listings.addAll(fetched.valueOr(List.of()));
        }
        telemetry.endStep(RunTelemetry.STEP_ADAPTER_FETCH, activeAdapters(search).size(), listings.size(), adapterErrors);

        telemetry.startStep(RunTelemetry.STEP_PRICE_LOOKUP);
        List<Outcome<MarketPriceEstimate>> estimates = lookupAll(listings);
        long lookupErrors = estimates.stream().filter(o -> o.causeCode == CauseCode.PRICE_LOOKUP_FAILED).count();
        telemetry.endStep(RunTelemetry.STEP_PRICE_LOOKUP, listings.size(), estimates.size() - lookupErrors, lookupErrors);

        telemetry.startStep(RunTelemetry.STEP_CANDIDATE_BUILD);
        List<DealCandidate> candidates = new ArrayList<>();
        int invalid = 0;
        for (int i = 0; i < listings.size(); i++) {
            Optional<DealCandidate> candidate = candidateBuilder.build(listings.get(i), estimates.get(i).value);
            if (candidate.isPresent()) {
                candidates.add(candidate.get());
            } else {
                invalid++;
                LOG.debug("listing skipped cause={} title={}", CauseCode.INVALID_LISTING, listings.get(i).title);
            }
        }
        telemetry.endStep(RunTelemetry.STEP_CANDIDATE_BUILD, listings.size(), candidates.size(), 0L,
                invalid > 0 ? "invalid_listings=" + invalid : "");

        telemetry.startStep(RunTelemetry.STEP_FILTER);
        DealFilter filter = new DealFilter(search.getMinProfit(), search.getMinMarginPct());
        List<DealCandidate> passing = filter.apply(candidates);
        telemetry.endStep(RunTelemetry.STEP_FILTER, candidates.size(), passing.size(), 0L,
                filter.isPassThrough() ? "raw_mode" : "");

        telemetry.startStep(RunTelemetry.STEP_ENRICH);
        double travelCost = travelCostModel.roundTripCost(search);
        List<DealRow> rows = enricher.enrichAll(passing, term, travelCost);
        long degraded = rows.stream().filter(DealRow::isDegraded).count();
        telemetry.endStep(RunTelemetry.STEP_ENRICH, passing.size(), rows.size(), degraded);

        telemetry.setCounts(listings.size(), candidates.size(), rows.size(), (int) degraded);
        return rows;
    }

    /**
     * Runs every term with the same base configuration, tags each row with its term and ranks the union once.
     */
    public RankedResultSet runAll(SearchConfiguration base, List<String> terms) {
        List<String> cleaned = new ArrayList<>();
        if (terms != null) {
            for (String term : terms) {
                if (term != null && !term.isBlank() && !cleaned.contains(term.trim())) {
                    cleaned.add(term.trim());
                }
            }
        }
        if (cleaned.isEmpty()) {
            return RankedResultSet.empty(RankedResultSet.MODE_SAVED, List.of());
        }
        RunTelemetry telemetry = new RunTelemetry(RankedResultSet.MODE_SAVED, String.join(",", cleaned), Instant.now());
        Map<String, List<DealRow>> byTerm = new LinkedHashMap<>();
        int listingsRaw = 0;
        int candidates = 0;
        int degraded = 0;
        for (String term : cleaned) {
            RunTelemetry termTelemetry = new RunTelemetry(RankedResultSet.MODE_SAVED, term, Instant.now());
            List<DealRow> rows = collectRows(base.withKeyword(term), termTelemetry);
            byTerm.put(term, rows);
            listingsRaw += termTelemetry.listingsRaw();
            candidates += termTelemetry.candidates();
            degraded += termTelemetry.degradedRows();
            for (RunTelemetry.StepRecord step : termTelemetry.stepRecords()) {
                telemetry.absorbStep(step, "term=" + term);
            }
        }
        telemetry.startStep(RunTelemetry.STEP_RANK);
        List<DealRow> merged = aggregator.merge(byTerm);
        telemetry.endStep(RunTelemetry.STEP_RANK, merged.size(), merged.size(), 0L);
        telemetry.setCounts(listingsRaw, candidates, merged.size(), degraded);
        telemetry.finish();
        LOG.info(telemetry.getSummary());
        return new RankedResultSet(RankedResultSet.MODE_SAVED, cleaned, merged);
    }

    private void finish(RunTelemetry telemetry, List<DealRow> rows) {
        telemetry.startStep(RunTelemetry.STEP_RANK);
        telemetry.endStep(RunTelemetry.STEP_RANK, rows.size(), rows.size(), 0L);
        telemetry.finish();
        LOG.info(telemetry.getSummary());
    }

    private List<MarketplaceAdapter> activeAdapters(SearchConfiguration search) {
        List<MarketplaceAdapter> out = new ArrayList<>();
        if (craigslist != null) {
            out.add(craigslist);
        }
        if (search.isIncludeFacebook() && facebook != null) {
            out.add(facebook);
        }
        return out;
    }

    private Outcome<List<RawListing>> fetch(MarketplaceAdapter adapter, SearchConfiguration search, String term) {
        String owner = "adapter." + adapter.source();
        try {
            List<RawListing> raw = adapter.search(search, term);
            if (raw == null || raw.isEmpty()) {
                return Outcome.success(List.of(), owner);
            }
            List<RawListing> out = new ArrayList<>();
            for (RawListing listing : raw) {
                if (listing == null) {
                    continue;
                }
                if (search.getPriceCeiling() != null && listing.price != null && listing.price > search.getPriceCeiling()) {
                    continue;
                }
                if (search.getMaxResultsPerSource() > 0 && out.size() >= search.getMaxResultsPerSource()) {
                    break;
                }
                out.add(listing.withSource(adapter.source()));
            }
            return Outcome.success(out, owner);
        } catch (Exception e) {
            LOG.warn("adapter fetch failed source={} term={} err={}", adapter.source(), term, e.getMessage());
            return Outcome.degraded(List.of(), CauseCode.ADAPTER_FAILED, owner, Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    /**
     * Looks up every listing that has a usable price. Results are stored by listing index, so the order in
     * which lookups complete never reaches the output.
     */
    List<Outcome<MarketPriceEstimate>> lookupAll(List<RawListing> listings) {
        int total = listings.size();
        Outcome<MarketPriceEstimate> noData =
                Outcome.degraded(MarketPriceEstimate.EMPTY, CauseCode.NO_PRICE_DATA, "price", Map.of());
        List<Outcome<MarketPriceEstimate>> results = new ArrayList<>(Collections.nCopies(total, noData));
        if (total == 0 || priceService == null) {
            return results;
        }

        int poolSize = Math.max(1, Math.min(lookupThreads, total));
        ExecutorService pool = Executors.newFixedThreadPool(poolSize);
        CompletionService<IndexedEstimate> completion = new ExecutorCompletionService<>(pool);
        int submitted = 0;
        for (int i = 0; i < total; i++) {
            RawListing listing = listings.get(i);
            if (!listing.hasUsablePrice()) {
                continue;
            }
            final int index = i;
            completion.submit(() -> new IndexedEstimate(index, lookupOne(listing.title)));
            submitted++;
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(lookupTimeoutSec);
        try {
            for (int i = 0; i < submitted; i++) {
                long remaining = deadline - System.nanoTime();
                Future<IndexedEstimate> future = completion.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
                if (future == null) {
                    LOG.warn("price lookups timed out after {}s, pending={}", lookupTimeoutSec, submitted - i);
                    markTimedOut(results, listings);
                    break;
                }
                try {
                    IndexedEstimate result = future.get();
                    results.set(result.index, result.estimate);
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    LOG.warn("price lookup task failed err={}", cause.getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            pool.shutdownNow();
        }
        return results;
    }

    private Outcome<MarketPriceEstimate> lookupOne(String title) {
        try {
            MarketPriceEstimate estimate = MarketPriceEstimate.orEmpty(priceService.lookup(title));
            if (!estimate.hasData()) {
                return Outcome.degraded(estimate, CauseCode.NO_PRICE_DATA, "price", Map.of("title", title));
            }
            return Outcome.success(estimate, "price");
        } catch (Exception e) {
            LOG.warn("price lookup failed title={} err={}", title, e.getMessage());
            return Outcome.degraded(
                    MarketPriceEstimate.EMPTY,
                    CauseCode.PRICE_LOOKUP_FAILED,
                    "price",
                    Map.of("title", title, "error", String.valueOf(e.getMessage()))
            );
        }
    }

    private static void markTimedOut(List<Outcome<MarketPriceEstimate>> results, List<RawListing> listings) {
        for (int i = 0; i < results.size(); i++) {
            Outcome<MarketPriceEstimate> current = results.get(i);
            if (current.causeCode == CauseCode.NO_PRICE_DATA && current.details.isEmpty()
                    && listings.get(i).hasUsablePrice()) {
                results.set(i, Outcome.degraded(
                        MarketPriceEstimate.EMPTY,
                        CauseCode.PRICE_LOOKUP_FAILED,
                        "price",
                        Map.of("error", "timeout")
                ));
            }
        }
    }

    private record IndexedEstimate(int index, Outcome<MarketPriceEstimate> estimate) {
    }
}
