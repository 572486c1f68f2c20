package com.localflipper.pricing;

import com.localflipper.config.Config;
import com.localflipper.model.MarketPriceEstimate;
import com.localflipper.source.HttpClientEx;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Average sold price from the eBay Finding API ({@code findCompletedItems}, sold items only). Without an app id
 * the service stays offline and answers every lookup with the empty estimate.
 */
public final class EbaySoldPriceService implements MarketPriceService {
    public static final String DEFAULT_FINDING_URL = "https://svcs.ebay.com/services/search/FindingService/v1";
    private static final Logger LOG = LogManager.getLogger(EbaySoldPriceService.class);
    private static final String SOLD_STATE = "EndedWithSales";

    private final HttpClientEx http;
    private final String appId;
    private final String findingUrl;
    private final int timeoutSec;
    private final int maxEntries;

    public EbaySoldPriceService(Config config) {
        this(new HttpClientEx(), config);
    }

    public EbaySoldPriceService(HttpClientEx http, Config config) {
        this.http = http;
        this.appId = config.getString("ebay.app_id", "").trim();
        this.findingUrl = config.getString("ebay.finding_url", DEFAULT_FINDING_URL);
        this.timeoutSec = Math.max(3, config.getInt("ebay.request_timeout_sec", 15));
        this.maxEntries = Math.max(1, Math.min(100, config.getInt("ebay.max_entries", 50)));
    }

    public boolean isEnabled() {
        return !appId.isEmpty();
    }

    @Override
    public MarketPriceEstimate lookup(String title) throws Exception {
        if (!isEnabled() || title == null || title.isBlank()) {
            return MarketPriceEstimate.EMPTY;
        }
        String body = http.getText(buildUrl(title), timeoutSec);
        return parse(body);
    }

    String buildUrl(String title) {
        return findingUrl
                + "?OPERATION-NAME=findCompletedItems"
                + "&SERVICE-VERSION=1.13.0"
                + "&SECURITY-APPNAME=" + encode(appId)
                + "&RESPONSE-DATA-FORMAT=JSON"
                + "&REST-PAYLOAD"
                + "&keywords=" + encode(title.trim())
                + "&itemFilter(0).name=SoldItemsOnly&itemFilter(0).value=true"
                + String.format(Locale.US, "&paginationInput.entriesPerPage=%d", maxEntries);
    }

    /**
     * Averages the current price of every item whose selling state is {@code EndedWithSales}. Anything that
     * cannot be read counts as no data.
     */
    public static MarketPriceEstimate parse(String json) {
        if (json == null || json.isBlank()) {
            return MarketPriceEstimate.EMPTY;
        }
        JSONObject root;
        try {
            root = new JSONObject(json);
        } catch (JSONException e) {
            LOG.warn("unreadable eBay response err={}", e.getMessage());
            return MarketPriceEstimate.EMPTY;
        }
        JSONObject response = first(root.optJSONArray("findCompletedItemsResponse"));
        if (response == null) {
            return MarketPriceEstimate.EMPTY;
        }
        String ack = firstString(response.optJSONArray("ack"));
        if (!"Success".equalsIgnoreCase(ack) && !"Warning".equalsIgnoreCase(ack)) {
            return MarketPriceEstimate.EMPTY;
        }
        JSONObject searchResult = first(response.optJSONArray("searchResult"));
        JSONArray items = searchResult == null ? null : searchResult.optJSONArray("item");
        if (items == null) {
            return MarketPriceEstimate.EMPTY;
        }
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < items.length(); i++) {
            JSONObject item = items.optJSONObject(i);
            JSONObject status = item == null ? null : first(item.optJSONArray("sellingStatus"));
            if (status == null || !SOLD_STATE.equals(firstString(status.optJSONArray("sellingState")))) {
                continue;
            }
            JSONObject price = first(status.optJSONArray("currentPrice"));
            double value = price == null ? Double.NaN : price.optDouble("__value__", Double.NaN);
            if (!Double.isFinite(value) || value <= 0.0) {
                continue;
            }
            sum += value;
            count++;
        }
        if (count == 0) {
            return MarketPriceEstimate.EMPTY;
        }
        return new MarketPriceEstimate(Math.round(sum / count * 100.0) / 100.0, count);
    }

    private static JSONObject first(JSONArray array) {
        return array == null || array.isEmpty() ? null : array.optJSONObject(0);
    }

    private static String firstString(JSONArray array) {
        return array == null || array.isEmpty() ? "" : array.optString(0, "");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
