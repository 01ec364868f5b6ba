package com.pricelens.backend.service.pricing;

import com.pricelens.backend.exception.ExplainabilityUnavailableException;
import com.pricelens.backend.model.ModelMetadata;
import com.pricelens.backend.service.attribution.ExplainabilityCapability;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LinearPricingModelTest {

    private static final ModelMetadata METADATA = new ModelMetadata("pricing_linear_v1", 0.92);

    private final LinearPricingModel model = new LinearPricingModel(380.0, coefficients(), reference(), METADATA);

    @Test
    void predictsInterceptPlusWeightedInputs() {
        assertThat(model.predict(reference())).isEqualTo(1105.0);
    }

    @Test
    void missingInputsCountAsZero() {
        assertThat(model.predict(Map.of("raw_material_cost", 100.0))).isEqualTo(470.0);
    }

    @Test
    void explainerMeasuresEachFeatureAgainstReference() {
        ExplainabilityCapability explainer = model.explainer();
        Map<String, Double> inputs = new LinkedHashMap<>(reference());
        inputs.put("raw_material_cost", 424.8);
        inputs.put("inventory_level", 4395.0);

        double[] contributions = explainer.explain(inputs);

        assertThat(explainer.featureNames())
                .containsExactly("raw_material_cost", "demand_index", "inventory_level", "competitor_price_avg");
        assertThat(contributions[0]).isCloseTo(22.32, within(1e-9));
        assertThat(contributions[1]).isEqualTo(0.0);
        assertThat(contributions[2]).isCloseTo(12.1, within(1e-9));
        assertThat(contributions[3]).isEqualTo(0.0);
    }

    @Test
    void contributionsAddUpToThePriceDifferenceFromReference() {
        Map<String, Double> inputs = Map.of(
                "raw_material_cost", 431.0,
                "demand_index", 109.8,
                "inventory_level", 4700.0,
                "competitor_price_avg", 1020.0);

        double total = Arrays.stream(model.explainer().explain(inputs)).sum();

        assertThat(total).isCloseTo(model.predict(inputs) - model.predict(reference()), within(0.01));
    }

    @Test
    void modelWithoutCoefficientsCannotExplain() {
        LinearPricingModel empty = new LinearPricingModel(1000.0, Map.of(), Map.of(), METADATA);

        assertThatThrownBy(empty::explainer).isInstanceOf(ExplainabilityUnavailableException.class);
    }

    @Test
    void modelWithoutReferencePointCannotExplain() {
        LinearPricingModel partial = new LinearPricingModel(0, coefficients(), Map.of("demand_index", 100.0), METADATA);

        assertThatThrownBy(partial::explainer)
                .isInstanceOf(ExplainabilityUnavailableException.class)
                .hasMessageContaining("raw_material_cost");
    }

    private static Map<String, Double> coefficients() {
        Map<String, Double> coefficients = new LinkedHashMap<>();
        coefficients.put("raw_material_cost", 0.9);
        coefficients.put("demand_index", 1.5);
        coefficients.put("inventory_level", -0.02);
        coefficients.put("competitor_price_avg", 0.3);
        return coefficients;
    }

    private static Map<String, Double> reference() {
        Map<String, Double> reference = new LinkedHashMap<>();
        reference.put("raw_material_cost", 400.0);
        reference.put("demand_index", 100.0);
        reference.put("inventory_level", 5000.0);
        reference.put("competitor_price_avg", 1050.0);
        return reference;
    }
}
