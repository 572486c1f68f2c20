package com.localflipper.output;

import com.localflipper.model.DealRow;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 模块说明：DealRecordSchema（class）。
 * 主要职责：固定导出记录的字段顺序与取值方式，CSV、XLSX、HTML 三种输出共用同一份列定义。
 * 使用建议：下游依赖列顺序做差异比对，新增列只能追加在末尾。
 */
public final class DealRecordSchema {
    public static final String EBAY_SEARCH_PREFIX = "https://www.ebay.com/sch/i.html?_nkw=";

    public enum Kind {
        TEXT,
        MONEY,
        DECIMAL,
        INTEGER
    }

    public enum Column {
        SEARCH_TERM("Search Term", Kind.TEXT),
        SOURCE("Source", Kind.TEXT),
        TITLE("Title", Kind.TEXT),
        LOCATION("Location", Kind.TEXT),
        LOCAL_PRICE("Local Price", Kind.MONEY),
        EBAY_AVG_SOLD("eBay Avg Sold", Kind.MONEY),
        EST_PROFIT_EBAY("Est Profit (eBay)", Kind.MONEY),
        PROFIT_PCT_EBAY("Profit % (eBay)", Kind.DECIMAL),
        SAMPLES("Samples", Kind.INTEGER),
        CONDITION_GUESS("Condition Guess", Kind.TEXT),
        CONDITION_SCORE("Condition Score", Kind.DECIMAL),
        SELLER_RATING("Seller Rating", Kind.INTEGER),
        RULE_MARKET_VALUE("Rule Market Value", Kind.MONEY),
        RULE_PROFIT("Rule Profit Est", Kind.MONEY),
        TRAVEL_COST("Travel Cost Est", Kind.MONEY),
        EFFECTIVE_PROFIT("Effective Profit (Rule)", Kind.MONEY),
        DEMAND_SCORE("Demand Score", Kind.DECIMAL),
        LISTING_LINK("Listing Link", Kind.TEXT),
        EBAY_SEARCH("eBay Search", Kind.TEXT);

        public final String header;
        public final Kind kind;

        Column(String header, Kind kind) {
            this.header = header;
            this.kind = kind;
        }
    }

    private static final List<Column> COLUMNS = Collections.unmodifiableList(Arrays.asList(Column.values()));

    private DealRecordSchema() {
    }

    public static List<Column> columns() {
        return COLUMNS;
    }

    public static String[] headers() {
        String[] out = new String[COLUMNS.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = COLUMNS.get(i).header;
        }
        return out;
    }

    /**
     * Flat text record in column order. Missing values become empty strings.
     */
    public static String[] toRecord(DealRow row) {
        String[] out = new String[COLUMNS.size()];
        for (int i = 0; i < out.length; i++) {
            Column column = COLUMNS.get(i);
            out[i] = format(column.kind, value(row, column));
        }
        return out;
    }

    public static Object value(DealRow row, Column column) {
        switch (column) {
            case SEARCH_TERM:
                return row.getSearchTerm();
            case SOURCE:
                return row.source();
            case TITLE:
                return row.title();
            case LOCATION:
                return row.listing().location;
            case LOCAL_PRICE:
                return row.localPrice();
            case EBAY_AVG_SOLD:
                return row.getCandidate().estimate.averageSoldPrice;
            case EST_PROFIT_EBAY:
                return row.getCandidate().estimatedProfit;
            case PROFIT_PCT_EBAY:
                return row.getCandidate().profitMarginPct;
            case SAMPLES:
                return row.getCandidate().estimate.sampleSize;
            case CONDITION_GUESS:
                return row.getConditionLabel() == null ? null : row.getConditionLabel().displayName();
            case CONDITION_SCORE:
                return row.getConditionScore();
            case SELLER_RATING:
                return row.getSellerRating();
            case RULE_MARKET_VALUE:
                return row.getRuleMarketValue();
            case RULE_PROFIT:
                return row.getRuleProfit();
            case TRAVEL_COST:
                return row.getTravelCost();
            case EFFECTIVE_PROFIT:
                return row.getEffectiveProfit();
            case DEMAND_SCORE:
                return row.getDemandScore();
            case LISTING_LINK:
                return row.listing().url;
            case EBAY_SEARCH:
                return ebaySearchUrl(row.title());
            default:
                throw new IllegalStateException("unhandled column " + column);
        }
    }

    public static String ebaySearchUrl(String title) {
        return EBAY_SEARCH_PREFIX + URLEncoder.encode(title == null ? "" : title.trim(), StandardCharsets.UTF_8);
    }

    static String format(Kind kind, Object value) {
        if (value == null) {
            return "";
        }
        switch (kind) {
            case MONEY:
                return String.format(Locale.US, "%.2f", ((Number) value).doubleValue());
            case DECIMAL:
                return String.format(Locale.US, "%.2f", ((Number) value).doubleValue());
            case INTEGER:
                return String.valueOf(((Number) value).longValue());
            default:
                return String.valueOf(value);
        }
    }
}
