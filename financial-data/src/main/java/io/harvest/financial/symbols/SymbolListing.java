package io.harvest.financial.symbols;

import io.harvest.financial.Market;

import java.util.Objects;

/** One listed instrument as scraped from the market-cap pages. */
public record SymbolListing(String code, Market market, String name) {
    public SymbolListing {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(market, "market");
        if (!code.matches("\\d{6}")) throw new IllegalArgumentException("code must be six digits: " + code);
        name = name == null ? "" : name;
    }

    /** Chart symbol, e.g. {@code 005930.KS}. */
    public String symbol() {
        return code + market.symbolSuffix();
    }
}
