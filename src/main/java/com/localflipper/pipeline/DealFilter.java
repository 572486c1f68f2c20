package com.localflipper.pipeline;

import com.localflipper.model.DealCandidate;

import java.util.ArrayList;
import java.util.List;

/**
 * 模块说明：DealFilter（class）。
 * 主要职责：按最低利润与最低利润率筛选候选交易；阈值为 0 时直接放行（原始模式）。
 * 使用建议：阈值语义为 ≥，调整时注意保持零阈值下的恒等行为。
 */
public final class DealFilter {
    private final double minProfit;
    private final double minMarginPct;

    public DealFilter(double minProfit, double minMarginPct) {
        this.minProfit = minProfit;
        this.minMarginPct = minMarginPct;
    }

    public List<DealCandidate> apply(List<DealCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        List<DealCandidate> out = new ArrayList<>(candidates.size());
        for (DealCandidate candidate : candidates) {
            if (passes(candidate)) {
                out.add(candidate);
            }
        }
        return out;
    }

    /**
     * A threshold at or below zero disables its check.
     */
    public boolean passes(DealCandidate candidate) {
        if (candidate == null) {
            return false;
        }
        if (minProfit > 0.0 && candidate.estimatedProfit < minProfit) {
            return false;
        }
        return !(minMarginPct > 0.0 && candidate.profitMarginPct < minMarginPct);
    }

    public boolean isPassThrough() {
        return minProfit <= 0.0 && minMarginPct <= 0.0;
    }
}
