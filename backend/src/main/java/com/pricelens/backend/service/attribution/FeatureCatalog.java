package com.pricelens.backend.service.attribution;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

public final class FeatureCatalog {

    public static final String RAW_MATERIAL_COST = "raw_material_cost";
    public static final String DEMAND_INDEX = "demand_index";
    public static final String INVENTORY_LEVEL = "inventory_level";
    public static final String COMPETITOR_PRICE_AVG = "competitor_price_avg";

    public static final String UNKNOWN_SOURCE = "unknown";

    private static final Map<String, String> DATA_SOURCES = Map.of(
            RAW_MATERIAL_COST, "supplier_invoices",
            DEMAND_INDEX, "sales_forecast_model",
            INVENTORY_LEVEL, "warehouse_system",
            COMPETITOR_PRICE_AVG, "market_scraper"
    );

    private static final Map<String, String> FRIENDLY_NAMES = Map.of(
            RAW_MATERIAL_COST, "Raw Material Costs",
            DEMAND_INDEX, "Market Demand",
            INVENTORY_LEVEL, "Inventory Availability",
            COMPETITOR_PRICE_AVG, "Competitor Pricing"
    );

    private FeatureCatalog() {
    }

    public static String dataSource(String feature) {
        return DATA_SOURCES.getOrDefault(feature, UNKNOWN_SOURCE);
    }

    public static String friendlyName(String feature) {
        String known = FRIENDLY_NAMES.get(feature);
        if (known != null) {
            return known;
        }
        return Arrays.stream(feature.split("_"))
                .filter(part -> !part.isEmpty())
                .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1).toLowerCase(Locale.ROOT))
                .collect(Collectors.joining(" "));
    }
}
