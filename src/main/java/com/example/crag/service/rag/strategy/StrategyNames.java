package com.example.crag.service.rag.strategy;

/** Strategy and recommended-action labels as they appear in audit trails. */
public final class StrategyNames {

    public static final String EXPAND_TOP_K = "expand_top_k";
    public static final String AGGRESSIVE_HYBRID = "aggressive_hybrid";
    public static final String MULTI_QUERY = "multi_query";
    public static final String HYDE = "hyde";
    public static final String AGGRESSIVE_MULTI_QUERY = "aggressive_multi_query";
    public static final String EXPAND_SOURCES = "expand_sources";

    private StrategyNames() {
    }
}
