package com.chartsignal.backend.service.util;

import com.chartsignal.backend.model.Candle;
import org.apache.commons.math3.stat.StatUtils;

import java.util.List;

/**
 * Small statistical helpers shared by the analysis services.
 */
public final class TechnicalAnalysisUtil {

    private TechnicalAnalysisUtil() {
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return StatUtils.mean(values);
    }

    /**
     * Population standard deviation (divides by n, not n - 1).
     */
    public static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        return Math.sqrt(StatUtils.populationVariance(values));
    }

    /**
     * Population standard deviation of simple close-to-close returns.
     *
     * @param candles series in ascending time order
     * @return volatility as a fraction (0.02 means 2%), 0 when fewer than two candles
     */
    public static double returnVolatility(List<Candle> candles) {
        if (candles.size() < 2) {
            return 0.0;
        }
        double[] returns = new double[candles.size() - 1];
        for (int i = 1; i < candles.size(); i++) {
            double previous = candles.get(i - 1).getClose();
            returns[i - 1] = (candles.get(i).getClose() - previous) / previous;
        }
        return standardDeviation(returns);
    }

    public static double[] closes(List<Candle> candles) {
        double[] closes = new double[candles.size()];
        for (int i = 0; i < candles.size(); i++) {
            closes[i] = candles.get(i).getClose();
        }
        return closes;
    }

    public static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static Candle last(List<Candle> candles) {
        return candles.get(candles.size() - 1);
    }
}
