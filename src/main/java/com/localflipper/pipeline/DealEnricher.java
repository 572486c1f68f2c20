package com.localflipper.pipeline;

import com.localflipper.core.diagnostics.CauseCode;
import com.localflipper.model.ConditionAssessment;
import com.localflipper.model.DealCandidate;
import com.localflipper.model.DealRow;
import com.localflipper.model.DemandScore;
import com.localflipper.model.RuleValuation;
import com.localflipper.model.SellerRating;
import com.localflipper.scoring.ConditionExtractor;
import com.localflipper.scoring.DemandScorer;
import com.localflipper.scoring.ReasonJsonBuilder;
import com.localflipper.scoring.RuleBasedValuator;
import com.localflipper.scoring.SellerTrustScorer;
import com.localflipper.utils.SellerTextCleaner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：DealEnricher（class）。
 * 主要职责：按固定顺序为每个候选追加成色、卖家信誉、规则估值、出行成本后利润、需求分等派生字段。
 * 使用建议：单条记录某一阶段失败只跳过该阶段及其依赖阶段，不影响其他记录与整体运行。
 */
public class DealEnricher {
    public static final String STAGE_CONDITION = "condition";
    public static final String STAGE_SELLER = "seller";
    public static final String STAGE_VALUATION = "valuation";
    public static final String STAGE_EFFECTIVE_PROFIT = "effective_profit";
    public static final String STAGE_DEMAND = "demand";
    public static final String STAGE_REASONS = "reasons";

    private static final Logger LOG = LogManager.getLogger(DealEnricher.class);

    private final ConditionExtractor conditionExtractor;
    private final SellerTrustScorer sellerTrustScorer;
    private final RuleBasedValuator valuator;
    private final DemandScorer demandScorer;
    private final ReasonJsonBuilder reasonJsonBuilder;

    public DealEnricher() {
        this(new ConditionExtractor(), new SellerTrustScorer(), new RuleBasedValuator(), new DemandScorer(), new ReasonJsonBuilder());
    }

    public DealEnricher(
            ConditionExtractor conditionExtractor,
            SellerTrustScorer sellerTrustScorer,
            RuleBasedValuator valuator,
            DemandScorer demandScorer,
            ReasonJsonBuilder reasonJsonBuilder
    ) {
        this.conditionExtractor = conditionExtractor;
        this.sellerTrustScorer = sellerTrustScorer;
        this.valuator = valuator;
        this.demandScorer = demandScorer;
        this.reasonJsonBuilder = reasonJsonBuilder;
    }

    public List<DealRow> enrichAll(List<DealCandidate> candidates, String categoryHint, double travelCost) {
        List<DealRow> out = new ArrayList<>();
        if (candidates == null) {
            return out;
        }
        for (DealCandidate candidate : candidates) {
            out.add(enrich(candidate, categoryHint, travelCost));
        }
        return out;
    }

    /**
     * Builds one enriched row. The travel cost is computed once per run by the caller and passed in unchanged.
     */
    public DealRow enrich(DealCandidate candidate, String categoryHint, double travelCost) {
        String title = candidate.listing.title;
        String text = SellerTextCleaner.clean(joinText(title, candidate.listing.body));
        DealRow.DealRowBuilder row = DealRow.of(candidate).toBuilder().travelCost(travelCost);
        List<String> degraded = new ArrayList<>();

        ConditionAssessment condition = null;
        try {
            condition = conditionExtractor.extract(text);
            row.conditionLabel(condition.label).conditionScore(condition.score);
        } catch (RuntimeException e) {
            degrade(degraded, STAGE_CONDITION, candidate, e);
        }

        SellerRating seller = null;
        try {
            seller = sellerTrustScorer.rate(text);
            row.sellerRating(seller.score);
        } catch (RuntimeException e) {
            degrade(degraded, STAGE_SELLER, candidate, e);
        }

        RuleValuation valuation = null;
        if (condition != null) {
            try {
                valuation = valuator.valuate(candidate.localPrice(), condition.score);
                row.ruleMarketValue(valuation.marketValue).ruleProfit(valuation.profit);
            } catch (RuntimeException e) {
                degrade(degraded, STAGE_VALUATION, candidate, e);
            }
        } else {
            degraded.add(STAGE_VALUATION);
        }

        if (valuation != null) {
            row.effectiveProfit(round2(valuation.profit - travelCost));
        } else {
            degraded.add(STAGE_EFFECTIVE_PROFIT);
        }

        DemandScore demand = null;
        if (condition != null && valuation != null) {
            try {
                demand = demandScorer.score(title, categoryHint, condition.score, valuation.profit);
                row.demandScore(demand.score);
            } catch (RuntimeException e) {
                degrade(degraded, STAGE_DEMAND, candidate, e);
            }
        } else {
            degraded.add(STAGE_DEMAND);
        }

        try {
            row.reasonsJson(reasonJsonBuilder.buildReasonsJson(
                    condition,
                    seller,
                    demand,
                    candidate.estimate.hasData(),
                    degraded
            ));
        } catch (RuntimeException e) {
            degrade(degraded, STAGE_REASONS, candidate, e);
        }
        return row.degradedStages(degraded).build();
    }

    private void degrade(List<String> degraded, String stage, DealCandidate candidate, RuntimeException e) {
        degraded.add(stage);
        LOG.warn("enrichment stage={} cause={} title={} err={}", stage, CauseCode.ENRICHMENT_FAILED, candidate.listing.title, e.getMessage());
    }

    private static String joinText(String title, String body) {
        String t = title == null ? "" : title.trim();
        String b = body == null ? "" : body.trim();
        if (b.isEmpty()) {
            return t;
        }
        return t.isEmpty() ? b : t + "\n" + b;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
