package com.pricelens.backend.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "explainability")
@Data
@Validated
public class ExplainabilityProperties {

    @NotBlank
    private String acceptedMethod = "SHAP";

    @NotBlank
    private String productId = "SKU-123";

    @NotBlank
    private String currency = "INR";

    @Positive
    private double materialityThreshold = 0.01;

    @PositiveOrZero
    private double minContribution = 0.001;

    @Positive
    private double sumTolerance = 0.001;

    @Min(0)
    private int windowDays = 7;

    private boolean explainerEnabled = true;

    // false keeps the observed behaviour: a rejected state still becomes the next baseline
    private boolean retainBaselineOnRejection = false;

    private Safety safety = new Safety();
    private Audit audit = new Audit();

    @Data
    public static class Safety {
        private boolean hideExactCosts = true;
        private boolean hideSupplierNames = true;
        private List<String> supplierNames = new ArrayList<>();
    }

    @Data
    public static class Audit {
        private boolean fileEnabled = true;

        @NotBlank
        private String logFile = "audit_log.jsonl";
    }
}
