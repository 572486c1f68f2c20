package com.localflipper.source;

import com.localflipper.config.SearchConfiguration;
import com.localflipper.model.RawListing;

import java.util.List;

/**
 * A local marketplace that can be searched for listings. Implementations may throw on network or parse
 * failures; the runner treats a failing adapter as having returned nothing.
 */
public interface MarketplaceAdapter {

    /** Source tag stamped on every listing this adapter returns. */
    String source();

    List<RawListing> search(SearchConfiguration search, String term) throws Exception;
}
