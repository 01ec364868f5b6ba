package com.pricelens.backend.service.explain;

import com.pricelens.backend.model.Audience;
import com.pricelens.backend.model.Evidence;
import com.pricelens.backend.model.ExplanationResult;
import com.pricelens.backend.model.FeatureAttribution;
import com.pricelens.backend.service.attribution.FeatureCatalog;
import com.pricelens.backend.service.evidence.EvidenceValidator;
import com.pricelens.backend.util.DecimalUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders evidence as a five-section explanation: title, price change summary,
 * attribution narrative, confidence and methodology, disclaimer.
 * Output is unfiltered; callers pass it through {@link SafetyFilter}.
 */
@Component
@RequiredArgsConstructor
public class ExplanationRenderer {

    private static final Map<String, String> CURRENCY_GLYPHS = Map.of(
            "INR", "₹",
            "USD", "$",
            "EUR", "€",
            "GBP", "£",
            "JPY", "¥"
    );

    private final EvidenceValidator validator;

    public String render(Evidence evidence, Audience audience) {
        if (!validator.validate(evidence) || !validator.checkAttributionSum(evidence.featuresUsed())) {
            return ExplanationResult.REFUSAL_TEXT;
        }
        boolean regulator = audience == Audience.REGULATOR;

        StringBuilder text = new StringBuilder();
        text.append("# Price Change Explanation")
                .append(regulator ? " (Regulatory Audit)" : " (Customer Summary)")
                .append("\n\n");
        appendSummary(text, evidence, regulator);
        text.append('\n');
        appendAttribution(text, evidence, regulator);
        text.append('\n');
        appendConfidence(text, evidence, regulator);
        text.append('\n');
        appendDisclaimer(text, regulator);
        return text.toString();
    }

    public static String confidenceLabel(double score) {
        if (score >= 0.80) {
            return "High confidence";
        }
        if (score >= 0.50) {
            return "Medium confidence";
        }
        return "Low confidence";
    }

    static List<FeatureAttribution> byImpact(List<FeatureAttribution> features) {
        // sorted() is stable on an ordered stream, so equal magnitudes keep evidence order
        return features.stream()
                .sorted(Comparator.comparingDouble((FeatureAttribution f) -> Math.abs(f.attribution())).reversed())
                .toList();
    }

    private void appendSummary(StringBuilder text, Evidence evidence, boolean regulator) {
        String currency = CURRENCY_GLYPHS.getOrDefault(evidence.currency(), evidence.currency());
        text.append("**Price Change Summary**\n");
        text.append("• Price: ").append(currency).append(formatPrice(evidence.oldPrice()))
                .append(" → ").append(currency).append(formatPrice(evidence.newPrice())).append('\n');
        text.append("• Time Window: ").append(evidence.timeWindow().from())
                .append(" to ").append(evidence.timeWindow().to()).append('\n');
        if (regulator) {
            text.append("• ML Model: ").append(evidence.modelVersion()).append('\n');
        }
    }

    private void appendAttribution(StringBuilder text, Evidence evidence, boolean regulator) {
        text.append("**Machine Learning–Based Feature Attribution**\n");
        if (regulator) {
            String direction = evidence.newPrice() > evidence.oldPrice() ? "increase" : "decrease";
            text.append("The model detected a price ").append(direction)
                    .append(" driven by the following factors:\n");
        } else {
            text.append("We adjusted the price due to the following main factors:\n");
        }

        for (FeatureAttribution feature : byImpact(evidence.featuresUsed())) {
            int impactPct = (int) DecimalUtils.round(feature.attribution() * 100, 0);
            if (regulator) {
                text.append("• ").append(feature.name()).append(": ").append(impactPct)
                        .append("% attribution (Input change: ").append(feature.valueChangePct()).append("%)\n");
            } else {
                text.append("• ").append(FeatureCatalog.friendlyName(feature.name())).append(": ≈").append(impactPct)
                        .append("% impact (Factor ").append(customerDirection(feature)).append(")\n");
            }
        }
    }

    private void appendConfidence(StringBuilder text, Evidence evidence, boolean regulator) {
        double score = evidence.confidenceScore();
        text.append("**Confidence Score & Methodology**\n");
        text.append("• Confidence Level: ").append(confidenceLabel(score)).append(" (").append(score).append(")\n");
        text.append("• Methodology: Feature importance calculated using ").append(evidence.xaiMethod()).append(".\n");
        if (regulator) {
            text.append("• Traceability: All values derived from Model ").append(evidence.modelVersion())
                    .append(" via ").append(evidence.xaiMethod()).append(".\n");
        }
    }

    private void appendDisclaimer(StringBuilder text, boolean regulator) {
        text.append("**Disclaimer**\n");
        text.append("This explanation is generated automatically based on model inputs. ");
        text.append("It does not constitute a legal or binding commitment.");
        if (!regulator) {
            text.append(" Please contact support for detailed inquiries.");
        }
    }

    private static String customerDirection(FeatureAttribution feature) {
        if (FeatureCatalog.COMPETITOR_PRICE_AVG.equals(feature.name())) {
            return "fluctuation";
        }
        return feature.valueChangePct() > 0 ? "increased" : "decreased";
    }

    private static String formatPrice(double price) {
        return String.format(Locale.ROOT, "%.2f", price);
    }
}
