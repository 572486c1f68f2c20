package com.localflipper.core.diagnostics;

public enum CauseCode {
    NONE,
    NO_PRICE_DATA,
    PRICE_LOOKUP_FAILED,
    INVALID_LISTING,
    ADAPTER_FAILED,
    ENRICHMENT_FAILED
}
