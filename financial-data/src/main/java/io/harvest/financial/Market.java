package io.harvest.financial;

/**
 * Listing markets. {@code listingId} is the market id used by the market-cap listing pages.
 */
public enum Market {
    KOSPI(0, ".KS", "yahoo_meta_kospi.csv"),
    KOSDAQ(1, ".KQ", "yahoo_meta_kosdaq.csv");

    private final int listingId;
    private final String symbolSuffix;
    private final String metaFileName;

    Market(int listingId, String symbolSuffix, String metaFileName) {
        this.listingId = listingId;
        this.symbolSuffix = symbolSuffix;
        this.metaFileName = metaFileName;
    }

    public int listingId() { return listingId; }
    public String symbolSuffix() { return symbolSuffix; }
    public String metaFileName() { return metaFileName; }
}
