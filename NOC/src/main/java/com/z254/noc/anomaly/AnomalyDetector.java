package com.z254.noc.anomaly;

import com.z254.noc.config.NocProperties;
import com.z254.noc.domain.model.Anomaly;
import com.z254.noc.domain.model.Sample;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flags samples that lie at least {@code thresholdSigma} sample standard deviations
 * from the window mean.
 * <p>
 * Fewer than two samples or a flat series yield no anomalies, so a constant but
 * wrong value is never flagged.
 */
@Component
public class AnomalyDetector {

    private final double thresholdSigma;

    public AnomalyDetector(NocProperties nocProperties) {
        this.thresholdSigma = nocProperties.getAnalysis().getThresholdSigma();
    }

    public List<Anomaly> detect(List<Sample> samples) {
        if (samples == null || samples.size() < 2) {
            return List.of();
        }

        double mean = mean(samples);
        double std = sampleStdDev(samples, mean);
        if (std == 0.0) {
            return List.of();
        }

        double threshold = thresholdSigma * std;
        List<Anomaly> anomalies = new ArrayList<>();
        for (Sample sample : samples) {
            double distance = Math.abs(sample.getValue() - mean);
            if (distance >= threshold) {
                anomalies.add(Anomaly.builder()
                        .timestamp(sample.getTimestamp())
                        .value(sample.getValue())
                        .deviation(distance / std)
                        .threshold(threshold)
                        .build());
            }
        }
        return anomalies;
    }

    // ========== Private Methods ==========

    private static double mean(List<Sample> samples) {
        double sum = 0.0;
        for (Sample sample : samples) {
            sum += sample.getValue();
        }
        return sum / samples.size();
    }

    // Bessel-corrected (n - 1)
    private static double sampleStdDev(List<Sample> samples, double mean) {
        double squares = 0.0;
        for (Sample sample : samples) {
            double d = sample.getValue() - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / (samples.size() - 1));
    }
}
