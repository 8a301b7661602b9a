package com.frauddetection.hypersearch.engine;

import com.frauddetection.hypersearch.domain.ConvergenceAnalysis;
import com.frauddetection.hypersearch.domain.ConvergencePoint;
import com.frauddetection.hypersearch.domain.ExperimentRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Calculator for post-hoc analysis of an experiment log.
 * Only completed experiments are considered; categorical parameters are skipped and
 * booleans count as 1/0.
 */
public final class SearchAnalysis {

    public static final int MIN_EXPERIMENTS_FOR_CORRELATION = 3;
    public static final int CONVERGENCE_WINDOW = 5;
    public static final double CONVERGENCE_THRESHOLD = 0.01;

    private SearchAnalysis() {
    }

    /**
     * Best completed experiments by descending score. Ties keep log order.
     */
    public static List<ExperimentRecord> topExperiments(List<ExperimentRecord> experiments, int count) {
        if (count <= 0) {
            return List.of();
        }
        return experiments.stream()
                .filter(ExperimentRecord::isCompleted)
                .sorted(Comparator.comparingDouble(ExperimentRecord::getScore).reversed())
                .limit(count)
                .toList();
    }

    /**
     * Absolute Pearson correlation between each parameter and the score.
     */
    public static Map<String, Double> parameterImportance(List<ExperimentRecord> experiments) {
        List<ExperimentRecord> completed = completed(experiments);
        Map<String, Double> importance = new LinkedHashMap<>();
        if (completed.size() < MIN_EXPERIMENTS_FOR_CORRELATION) {
            return importance;
        }

        for (String name : numericParameterNames(completed)) {
            List<double[]> pairs = new ArrayList<>();
            for (ExperimentRecord record : completed) {
                Double value = numericValue(record.getParameters().get(name));
                if (value != null) {
                    pairs.add(new double[]{value, record.getScore()});
                }
            }
            if (pairs.size() >= MIN_EXPERIMENTS_FOR_CORRELATION) {
                importance.put(name, Math.abs(correlation(pairs)));
            }
        }
        return importance;
    }

    /**
     * Pairwise Pearson correlation between parameters.
     */
    public static Map<String, Map<String, Double>> parameterCorrelations(List<ExperimentRecord> experiments) {
        List<ExperimentRecord> completed = completed(experiments);
        Map<String, Map<String, Double>> correlations = new LinkedHashMap<>();
        if (completed.size() < MIN_EXPERIMENTS_FOR_CORRELATION) {
            return correlations;
        }

        List<String> names = new ArrayList<>(numericParameterNames(completed));
        for (String first : names) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (String second : names) {
                if (first.equals(second)) {
                    continue;
                }
                List<double[]> pairs = new ArrayList<>();
                for (ExperimentRecord record : completed) {
                    Double x = numericValue(record.getParameters().get(first));
                    Double y = numericValue(record.getParameters().get(second));
                    if (x != null && y != null) {
                        pairs.add(new double[]{x, y});
                    }
                }
                if (pairs.size() >= MIN_EXPERIMENTS_FOR_CORRELATION) {
                    row.put(second, correlation(pairs));
                }
            }
            correlations.put(first, row);
        }
        return correlations;
    }

    /**
     * Stability of the best score over the last {@link #CONVERGENCE_WINDOW} points.
     */
    public static ConvergenceAnalysis convergenceAnalysis(List<ConvergencePoint> convergence) {
        if (convergence.size() < CONVERGENCE_WINDOW) {
            return ConvergenceAnalysis.insufficientData();
        }

        List<ConvergencePoint> recent = convergence.subList(convergence.size() - CONVERGENCE_WINDOW,
                convergence.size());
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        double sum = 0.0;
        for (ConvergencePoint point : recent) {
            max = Math.max(max, point.getBestScore());
            min = Math.min(min, point.getBestScore());
            sum += point.getBestScore();
        }

        double mean = sum / recent.size();
        double sumSquaredDiff = 0.0;
        for (ConvergencePoint point : recent) {
            sumSquaredDiff += Math.pow(point.getBestScore() - mean, 2);
        }
        double stdDev = Math.sqrt(sumSquaredDiff / recent.size());

        return new ConvergenceAnalysis(max - min < CONVERGENCE_THRESHOLD, 1 - stdDev / Math.max(mean, 0.001));
    }

    /**
     * Pearson correlation of (x, y) pairs, 0 when either side has no variance.
     */
    static double correlation(List<double[]> pairs) {
        int n = pairs.size();
        double sumX = 0, sumY = 0, sumXY = 0, sumX2 = 0, sumY2 = 0;
        for (double[] pair : pairs) {
            sumX += pair[0];
            sumY += pair[1];
            sumXY += pair[0] * pair[1];
            sumX2 += pair[0] * pair[0];
            sumY2 += pair[1] * pair[1];
        }

        double numerator = n * sumXY - sumX * sumY;
        double denominator = Math.sqrt((n * sumX2 - sumX * sumX) * (n * sumY2 - sumY * sumY));
        if (denominator == 0 || Double.isNaN(denominator)) {
            return 0.0;
        }
        return numerator / denominator;
    }

    private static List<ExperimentRecord> completed(List<ExperimentRecord> experiments) {
        return experiments.stream().filter(ExperimentRecord::isCompleted).toList();
    }

    private static Set<String> numericParameterNames(List<ExperimentRecord> experiments) {
        Set<String> names = new LinkedHashSet<>();
        for (ExperimentRecord record : experiments) {
            for (String name : record.getParameters().names()) {
                if (numericValue(record.getParameters().get(name)) != null) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private static Double numericValue(Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        return null;
    }
}
