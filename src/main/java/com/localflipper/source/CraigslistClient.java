package com.localflipper.source;

import com.localflipper.config.Config;
import com.localflipper.config.SearchConfiguration;
import com.localflipper.model.RawListing;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Searches a Craigslist region through its static search page and parses the result list with jsoup.
 */
public final class CraigslistClient implements MarketplaceAdapter {
    public static final String SOURCE = "craigslist";

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public CraigslistClient(Config config) {
        this(new HttpClientEx(), config);
    }

    public CraigslistClient(HttpClientEx http, Config config) {
        this.http = http;
        this.baseUrl = config.getString("craigslist.base_url", "https://%s.craigslist.org/search/sss");
        this.timeoutSec = Math.max(3, config.getInt("craigslist.request_timeout_sec", 20));
    }

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public List<RawListing> search(SearchConfiguration search, String term) throws Exception {
        String url = buildSearchUrl(search, term);
        String html = http.getText(url, timeoutSec);
        return parse(html, url, search.getMaxResultsPerSource());
    }

    String buildSearchUrl(SearchConfiguration search, String term) {
        StringBuilder url = new StringBuilder(String.format(Locale.US, baseUrl, search.getCraigslistSite()));
        url.append("?query=").append(encode(term));
        if (!search.getPostalCode().isEmpty()) {
            url.append("&postal=").append(encode(search.getPostalCode()));
            url.append("&search_distance=").append(search.getRadiusMiles());
        }
        if (search.getPriceCeiling() != null) {
            url.append("&max_price=").append((long) Math.floor(search.getPriceCeiling()));
        }
        return url.toString();
    }

    /**
     * Parses a search result page. Entries without a title are skipped; a missing or unreadable price is kept
     * as null so the candidate builder can exclude it.
     */
    public static List<RawListing> parse(String html, String pageUrl, int maxResults) {
        List<RawListing> out = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return out;
        }
        Document doc = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        for (Element item : doc.select("li.cl-static-search-result")) {
            if (maxResults > 0 && out.size() >= maxResults) {
                break;
            }
            String title = item.attr("title");
            Element titleEl = item.selectFirst(".title");
            if (titleEl != null && !titleEl.text().isBlank()) {
                title = titleEl.text();
            }
            if (title == null || title.isBlank()) {
                continue;
            }
            Element priceEl = item.selectFirst(".price");
            Element locationEl = item.selectFirst(".location");
            Element link = item.selectFirst("a[href]");
            out.add(new RawListing(
                    SOURCE,
                    title.trim(),
                    priceEl == null ? null : parsePrice(priceEl.text()),
                    locationEl == null ? "" : locationEl.text().trim(),
                    link == null ? "" : link.absUrl("href"),
                    null
            ));
        }
        return out;
    }

    /**
     * "$1,250" -> 1250.0; null when no number can be read.
     */
    static Double parsePrice(String raw) {
        if (raw == null) {
            return null;
        }
        String digits = raw.replaceAll("[^0-9.]", "");
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Double.parseDouble(digits);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
