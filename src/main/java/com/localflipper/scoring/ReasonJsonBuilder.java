package com.localflipper.scoring;

import com.localflipper.model.ConditionAssessment;
import com.localflipper.model.DemandScore;
import com.localflipper.model.SellerRating;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.List;

/**
 * Explains a row's scores as compact JSON: which phrases fired and how the demand score was assembled.
 */
public final class ReasonJsonBuilder {

    public String buildReasonsJson(
            ConditionAssessment condition,
            SellerRating seller,
            DemandScore demand,
            boolean marketData,
            List<String> degradedStages
    ) {
        JSONObject root = new JSONObject();
        root.put("market_data", marketData);
        if (condition != null) {
            root.put("condition_label", condition.label.displayName());
            root.put("condition_phrases", new JSONArray(condition.matchedPhrases));
        }
        if (seller != null) {
            root.put("seller_score", seller.score);
            root.put("seller_red_flags", new JSONArray(seller.redFlags));
            root.put("seller_green_flags", new JSONArray(seller.greenFlags));
        }
        if (demand != null) {
            root.put("demand_breakdown", new JSONObject(demand.breakdown));
        }
        root.put("degraded", new JSONArray(degradedStages == null ? List.of() : degradedStages));
        return root.toString();
    }
}
