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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 模块说明：FacebookMarketplaceClient（class）。
 * 主要职责：抓取 Marketplace 公开搜索页，从商品卡片链接中解析标题、价格与所在地。
 * 使用建议：页面结构随时可能变化，解析失败时返回空列表即可，由上层按适配器失败处理。
 */
public final class FacebookMarketplaceClient implements MarketplaceAdapter {
    public static final String SOURCE = "facebook";

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public FacebookMarketplaceClient(Config config) {
        this(new HttpClientEx(), config);
    }

    public FacebookMarketplaceClient(HttpClientEx http, Config config) {
        this.http = http;
        this.baseUrl = config.getString("facebook.base_url", "https://www.facebook.com/marketplace/%s/search");
        this.timeoutSec = Math.max(3, config.getInt("facebook.request_timeout_sec", 20));
    }

    @Override
    public String source() {
        return SOURCE;
    }

    @Override
    public List<RawListing> search(SearchConfiguration search, String term) throws Exception {
        String location = search.getPostalCode().isEmpty() ? search.getCraigslistSite() : search.getPostalCode();
        StringBuilder url = new StringBuilder(String.format(Locale.US, baseUrl, encode(location)));
        url.append("?query=").append(encode(term));
        url.append("&radius=").append(search.getRadiusMiles());
        if (search.getPriceCeiling() != null) {
            url.append("&maxPrice=").append((long) Math.floor(search.getPriceCeiling()));
        }
        String html = http.getText(url.toString(), timeoutSec);
        return parse(html, url.toString(), search.getMaxResultsPerSource());
    }

    /**
     * Each item card is an anchor to {@code /marketplace/item/<id>}; its text lines read price, title, location.
     */
    public static List<RawListing> parse(String html, String pageUrl, int maxResults) {
        List<RawListing> out = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return out;
        }
        Document doc = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        Set<String> seen = new LinkedHashSet<>();
        for (Element card : doc.select("a[href*=/marketplace/item/]")) {
            if (maxResults > 0 && out.size() >= maxResults) {
                break;
            }
            String href = card.absUrl("href");
            String key = stripQuery(href.isEmpty() ? card.attr("href") : href);
            if (!seen.add(key)) {
                continue;
            }
            List<String> lines = new ArrayList<>();
            for (Element span : card.select("span")) {
                if (span.children().isEmpty() && !span.text().isBlank()) {
                    lines.add(span.text().trim());
                }
            }
            Double price = null;
            String title = "";
            String location = "";
            for (String line : lines) {
                if (price == null && line.startsWith("$")) {
                    price = CraigslistClient.parsePrice(line);
                } else if (line.equalsIgnoreCase("free") && price == null) {
                    price = 0.0;
                } else if (title.isEmpty()) {
                    title = line;
                } else if (location.isEmpty()) {
                    location = line;
                }
            }
            if (title.isEmpty()) {
                continue;
            }
            out.add(new RawListing(SOURCE, title, price, location, key, null));
        }
        return out;
    }

    private static String stripQuery(String url) {
        int q = url.indexOf('?');
        return q < 0 ? url : url.substring(0, q);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8);
    }
}
