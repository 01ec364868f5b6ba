package com.pricelens.backend.service.pricing;

import com.pricelens.backend.model.PricingState;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

import static com.pricelens.backend.service.attribution.FeatureCatalog.COMPETITOR_PRICE_AVG;
import static com.pricelens.backend.service.attribution.FeatureCatalog.DEMAND_INDEX;
import static com.pricelens.backend.service.attribution.FeatureCatalog.INVENTORY_LEVEL;
import static com.pricelens.backend.service.attribution.FeatureCatalog.RAW_MATERIAL_COST;

/**
 * Stand-in for a live pricing feed: moves one or two inputs per step and re-prices through the model.
 */
@Slf4j
public class MarketSimulator {

    public enum MarketMove {
        COST_HIKE,
        DEMAND_SURGE,
        INVENTORY_DROP,
        COMPETITOR_MOVE,
        MIXED
    }

    private final PricingModel model;
    private final Random random;

    private Map<String, Double> currentInputs;
    private double currentPrice;

    public MarketSimulator(PricingModel model, Map<String, Double> initialInputs, Random random) {
        this.model = model;
        this.random = random;
        this.currentInputs = new LinkedHashMap<>(initialInputs);
        this.currentPrice = model.predict(currentInputs);
    }

    public PricingState currentState() {
        return new PricingState(currentPrice, currentInputs);
    }

    public PricingState step() {
        MarketMove[] moves = MarketMove.values();
        return apply(moves[random.nextInt(moves.length)]);
    }

    public PricingState apply(MarketMove move) {
        Map<String, Double> next = new LinkedHashMap<>(currentInputs);
        switch (move) {
            case COST_HIKE -> scale(next, RAW_MATERIAL_COST, 1.062);
            case DEMAND_SURGE -> scale(next, DEMAND_INDEX, 1.098);
            case INVENTORY_DROP -> next.computeIfPresent(INVENTORY_LEVEL, (k, v) -> Math.floor(v * 0.879));
            case COMPETITOR_MOVE -> scale(next, COMPETITOR_PRICE_AVG, 1.031);
            case MIXED -> {
                scale(next, RAW_MATERIAL_COST, 1.02);
                scale(next, COMPETITOR_PRICE_AVG, 0.98);
            }
        }
        currentInputs = next;
        currentPrice = model.predict(next);
        log.debug("Market move {} repriced to {}", move, currentPrice);
        return currentState();
    }

    private static void scale(Map<String, Double> inputs, String feature, double factor) {
        inputs.computeIfPresent(feature, (k, v) -> v * factor);
    }
}
