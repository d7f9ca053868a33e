// functions/eto-enhancer/src/main/java/dev/devanks/agronomy/eto/service/ValidationReportFormatter.java
package dev.devanks.agronomy.eto.service;

import dev.devanks.agronomy.eto.model.ProviderId;
import dev.devanks.agronomy.eto.model.ValidationStats;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

import static dev.devanks.agronomy.eto.calculation.UnitConversions.round;

/**
 * Plain-text reports for provider validation, fixed-width so they read well in logs and emails.
 */
@Component
public class ValidationReportFormatter {

    private static final String TABLE_RULE = "+------------------+----------+----------+---------+---------+";
    private static final double EXAMPLE_API_ETO = 5.5;

    public String comparisonReport(List<ValidationStats> validations, ProviderId best,
                                   double latitude, double longitude, int stationDays) {
        StringBuilder report = new StringBuilder();
        report.append("Weather Provider Comparison\n");
        report.append("=".repeat(70)).append("\n\n");
        report.append(String.format(Locale.ROOT, "Location: %.4f, %.4f\n", latitude, longitude));
        report.append(String.format(Locale.ROOT, "Station Data: %d days\n\n", stationDays));

        report.append("Results:\n");
        report.append(TABLE_RULE).append('\n');
        report.append("| Provider         | Bias (%) | RMSE     | R2      | Rating  |\n");
        report.append(TABLE_RULE).append('\n');
        for (ValidationStats v : validations) {
            if (!v.hasSamples()) {
                report.append(String.format(Locale.ROOT, "| %-16s | %8s | %8s | %7s | %-7s |\n",
                        v.getProvider().getTag(), "n/a", "n/a", "n/a", "no data"));
                continue;
            }
            String bias = String.format(Locale.ROOT, "%+.1f", v.getMeanBiasPercent());
            String rating = rating(v.getRmse(), v.getR2()) + (v.getProvider() == best ? " <" : "");
            report.append(String.format(Locale.ROOT, "| %-16s | %8s | %8.2f | %7.3f | %-7s |\n",
                    v.getProvider().getTag(), bias, v.getRmse(), v.getR2(), rating));
        }
        report.append(TABLE_RULE).append("\n\n");

        report.append("Best Provider: ").append(best.getTag()).append("\n\n");
        report.append("Recommendations by Use Case:\n");
        report.append(useCaseRecommendations(validations, best));
        return report.toString();
    }

    public String validationReport(ValidationStats stats, double correctionFactor) {
        StringBuilder report = new StringBuilder();
        report.append("Validation Report: ").append(stats.getProvider().getTag()).append('\n');
        report.append("=".repeat(50)).append("\n\n");
        report.append(String.format(Locale.ROOT, "Sample Size: %d days\n\n", stats.getSampleSize()));
        if (!stats.hasSamples()) {
            report.append("Recommendation:\n  ").append(stats.getRecommendation()).append('\n');
            return report.toString();
        }

        report.append("Accuracy Metrics:\n");
        report.append(String.format(Locale.ROOT, "  Mean Bias:     %+.2f mm/day (%+.1f%%)\n", stats.getMeanBias(), stats.getMeanBiasPercent()));
        report.append(String.format(Locale.ROOT, "  RMSE:          %.2f mm/day\n", stats.getRmse()));
        report.append(String.format(Locale.ROOT, "  MAE:           %.2f mm/day\n", stats.getMae()));
        report.append(String.format(Locale.ROOT, "  R2:            %.3f\n\n", stats.getR2()));

        report.append("Interpretation:\n");
        if (stats.getMeanBias() > 0) {
            report.append(String.format(Locale.ROOT, "  API OVERESTIMATES ETo by average %.2f mm/day\n", stats.getMeanBias()));
            report.append("  Risk of over-irrigation if used without correction\n\n");
        } else {
            report.append(String.format(Locale.ROOT, "  API UNDERESTIMATES ETo by average %.2f mm/day\n", Math.abs(stats.getMeanBias())));
            report.append("  Risk of crop water stress if used without correction\n\n");
        }

        report.append(String.format(Locale.ROOT, "Recommended Correction Factor: %.3f\n", correctionFactor));
        report.append(String.format(Locale.ROOT, "  Usage: correctedETo = apiETo x %.3f\n\n", correctionFactor));
        report.append("Example:\n");
        report.append(String.format(Locale.ROOT, "  API ETo:       %.1f mm/day\n", EXAMPLE_API_ETO));
        report.append(String.format(Locale.ROOT, "  Corrected ETo: %.1f mm/day\n\n", round(EXAMPLE_API_ETO * correctionFactor, 2)));

        report.append("Recommendation:\n  ").append(stats.getRecommendation()).append('\n');
        return report.toString();
    }

    /**
     * Five-star scale on RMSE (mm/day) and R².
     */
    static String rating(double rmse, double r2) {
        if (rmse < 0.5 && r2 > 0.95) {
            return "*****";
        }
        if (rmse < 1.0 && r2 > 0.90) {
            return "****";
        }
        if (rmse < 1.5 && r2 > 0.80) {
            return "***";
        }
        if (rmse < 2.0 && r2 > 0.70) {
            return "**";
        }
        return "*";
    }

    private static String useCaseRecommendations(List<ValidationStats> validations, ProviderId best) {
        StringBuilder rec = new StringBuilder();
        validations.stream()
                .filter(v -> v.getProvider() == ProviderId.OPEN_METEO && v.hasSamples())
                .findFirst()
                .ifPresent(v -> rec.append(String.format(Locale.ROOT, "  - Free Option: Use %s (RMSE: %.2f mm/day)\n",
                        v.getProvider().getTag(), v.getRmse())));

        validations.stream()
                .filter(v -> v.getProvider() == best)
                .findFirst()
                .ifPresent(v -> rec.append(String.format(Locale.ROOT, "  - Best Accuracy: Use %s (RMSE: %.2f mm/day)\n",
                        v.getProvider().getTag(), v.getRmse())));

        String precise = validations.stream()
                .filter(v -> v.hasSamples() && v.getRmse() < 1.0)
                .map(v -> v.getProvider().getTag())
                .collect(Collectors.joining(" or "));
        if (precise.isEmpty()) {
            rec.append("  - Precision Irrigation: Use local weather station (all APIs show RMSE > 1.0)\n");
        } else {
            rec.append("  - Precision Irrigation: ").append(precise).append('\n');
        }
        return rec.toString();
    }
}
