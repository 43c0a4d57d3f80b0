package com.safepocket.anomaly.explain;

import com.safepocket.anomaly.model.DetectorFinding;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders the human-readable {@code reason} of an anomaly. Ratios, margins and rates are
 * printed as plain decimals; everything else as whole-dollar amounts.
 */
@Component
public class ExplanationFormatter {

    public String describe(DetectorFinding finding) {
        String metric = finding.metric();
        String value = formatAmount(metric, finding.value());
        String expected = formatAmount(metric, finding.expectedMean());
        return String.format(Locale.US,
                "%s shows an unusual %s to %s, deviating %.1f%% from the expected %s. "
                        + "This warrants investigation for data quality or business event.",
                displayName(metric),
                finding.direction().label(),
                value,
                Math.abs(finding.deviationPct()),
                expected);
    }

    public String withConsensus(String reason, int votes, int total) {
        double confidencePct = total > 0 ? (double) votes / total * 100 : 0d;
        return String.format(Locale.US, "%s [Confidence: %.0f%% - %d/%d detection algorithms flagged this anomaly]",
                reason, confidencePct, votes, total);
    }

    /**
     * {@code profit_margin} becomes {@code Profit Margin}; a letter starts a word when it does
     * not follow another letter.
     */
    public static String displayName(String metric) {
        if (metric == null) {
            return "";
        }
        String spaced = metric.replace('_', ' ');
        StringBuilder out = new StringBuilder(spaced.length());
        boolean previousLetter = false;
        for (int i = 0; i < spaced.length(); i++) {
            char c = spaced.charAt(i);
            if (Character.isLetter(c)) {
                out.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                out.append(c);
                previousLetter = false;
            }
        }
        return out.toString();
    }

    static boolean isRelativeMetric(String metric) {
        String normalized = metric == null ? "" : metric.toLowerCase(Locale.ROOT);
        return normalized.contains("rate") || normalized.contains("ratio") || normalized.contains("margin");
    }

    private static String formatAmount(String metric, double amount) {
        if (isRelativeMetric(metric)) {
            return String.format(Locale.US, "%.2f", amount);
        }
        return String.format(Locale.US, "$%,.0f", amount);
    }
}
