package com.pricelens.backend.service.explain;

import com.pricelens.backend.config.ExplainabilityProperties;
import com.pricelens.backend.model.Evidence;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mandatory redaction applied to every rendered text, whatever the audience.
 * Redacted tokens carry a trailing {@code ~}, which is also what makes filtering idempotent.
 */
@Component
public class SafetyFilter {

    static final String SUPPLIER_PLACEHOLDER = "[supplier]";

    private static final Pattern CURRENCY_GLYPH = Pattern.compile("([₹$€£¥])(?!~)");
    private static final Pattern CURRENCY_CODE = codePattern("INR|USD|EUR|GBP|JPY");

    private final List<Pattern> supplierNames;

    public SafetyFilter(ExplainabilityProperties properties) {
        this.supplierNames = properties.getSafety().getSupplierNames().stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> Pattern.compile(Pattern.quote(name.trim()), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                .toList();
    }

    public String filter(String text, Evidence.SafetyFlags flags) {
        return filter(text, flags, null);
    }

    /**
     * Same as {@link #filter(String, Evidence.SafetyFlags)}, additionally marking the evidence's own
     * currency code, which may be one the filter does not otherwise know.
     */
    public String filter(String text, Evidence.SafetyFlags flags, String currency) {
        if (text == null || flags == null) {
            return text;
        }
        String filtered = text;
        if (flags.hideExactCosts()) {
            filtered = CURRENCY_GLYPH.matcher(filtered).replaceAll("$1~");
            filtered = CURRENCY_CODE.matcher(filtered).replaceAll("$1~");
            if (currency != null && !currency.isBlank()) {
                filtered = codePattern(Pattern.quote(currency.trim())).matcher(filtered).replaceAll("$1~");
            }
        }
        if (flags.hideSupplierNames()) {
            for (Pattern supplier : supplierNames) {
                filtered = redact(filtered, supplier);
            }
        }
        return filtered;
    }

    // A code glued to a digit still counts; a code inside a longer word does not.
    private static Pattern codePattern(String codes) {
        return Pattern.compile("(?<![A-Za-z])(" + codes + ")(?![A-Za-z~])");
    }

    private static String redact(String text, Pattern supplier) {
        Matcher matcher = supplier.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            if (!insidePlaceholder(text, matcher.start(), matcher.end())) {
                matcher.appendReplacement(out, Matcher.quoteReplacement(SUPPLIER_PLACEHOLDER));
            }
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static boolean insidePlaceholder(String text, int start, int end) {
        int from = Math.max(0, end - SUPPLIER_PLACEHOLDER.length());
        for (int at = text.indexOf(SUPPLIER_PLACEHOLDER, from); at >= 0 && at <= start;
             at = text.indexOf(SUPPLIER_PLACEHOLDER, at + 1)) {
            if (at + SUPPLIER_PLACEHOLDER.length() >= end) {
                return true;
            }
        }
        return false;
    }
}
