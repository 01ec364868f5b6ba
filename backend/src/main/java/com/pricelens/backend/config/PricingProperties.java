package com.pricelens.backend.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "pricing")
@Data
@Validated
public class PricingProperties {

    @NotBlank
    private String modelVersion = "pricing_linear_v1";

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceScore = 0.92;

    private double intercept = 380.0;

    // Insertion order is the model's feature order.
    private Map<String, Double> coefficients = defaultCoefficients();

    // Background point the explainer measures contributions against.
    private Map<String, Double> referenceInputs = defaultReferenceInputs();

    private Map<String, Double> initialInputs = defaultInitialInputs();

    private Monitor monitor = new Monitor();

    @Data
    public static class Monitor {
        private boolean enabled = false;

        @Positive
        private long intervalMillis = 2000;

        // 0 runs until shutdown
        @Min(0)
        private int maxCycles = 0;

        private Long seed;
    }

    private static Map<String, Double> defaultCoefficients() {
        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put("raw_material_cost", 0.9);
        coefficients.put("demand_index", 1.5);
        coefficients.put("inventory_level", -0.02);
        coefficients.put("competitor_price_avg", 0.3);
        return coefficients;
    }

    private static Map<String, Double> defaultReferenceInputs() {
        Map<String, Double> reference = new LinkedHashMap<>();
        reference.put("raw_material_cost", 400.0);
        reference.put("demand_index", 100.0);
        reference.put("inventory_level", 5000.0);
        reference.put("competitor_price_avg", 1050.0);
        return reference;
    }

    private static Map<String, Double> defaultInitialInputs() {
        return defaultReferenceInputs();
    }
}
