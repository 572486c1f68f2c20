package com.localflipper.model;

/**
 * One listing as returned by a marketplace adapter. Immutable; {@link #withSource(String)} returns a re-tagged copy.
 */
public final class RawListing {
    public final String source;
    public final String title;
    /** Asking price, null when the listing does not state one. */
    public final Double price;
    public final String location;
    public final String url;
    /** Free-text body, null when the adapter did not fetch it. */
    public final String body;

    public RawListing(String source, String title, Double price, String location, String url, String body) {
        this.source = source == null ? "" : source;
        this.title = title == null ? "" : title;
        this.price = price;
        this.location = location == null ? "" : location;
        this.url = url == null ? "" : url;
        this.body = body;
    }

    public RawListing withSource(String newSource) {
        return new RawListing(newSource, title, price, location, url, body);
    }

    public boolean hasUsablePrice() {
        return price != null && Double.isFinite(price) && price >= 0.0;
    }

    @Override
    public String toString() {
        return "RawListing{source=" + source + ", title=" + title + ", price=" + price + ", url=" + url + '}';
    }
}
