package com.frauddetection.hypersearch.sampling;

import com.frauddetection.hypersearch.domain.CandidateConfiguration;
import com.frauddetection.hypersearch.domain.ParameterDefinition;
import com.frauddetection.hypersearch.domain.ParameterRange;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Draws one random candidate configuration from the enabled part of a parameter space.
 * Every parameter is drawn independently and uniformly; cross-parameter constraints
 * are left to the training service.
 */
@Slf4j
public class ParameterSpaceSampler {

    private static final int FLOAT_SCALE = 3;

    private final Random random;

    public ParameterSpaceSampler(Random random) {
        this.random = random;
    }

    public ParameterSpaceSampler() {
        this(new Random());
    }

    public CandidateConfiguration sample(List<ParameterDefinition> definitions, Map<String, ParameterRange> ranges) {
        Map<String, Object> values = new LinkedHashMap<>();

        for (ParameterDefinition definition : definitions) {
            ParameterRange range = ranges.get(definition.getName());
            if (range == null || !range.isEnabled()) {
                continue;
            }

            Object value = draw(definition, range);
            if (value != null) {
                values.put(definition.getName(), value);
            }
        }

        return new CandidateConfiguration(values);
    }

    private Object draw(ParameterDefinition definition, ParameterRange range) {
        return switch (definition.getType()) {
            case INT -> drawInt(definition.getName(), range);
            case FLOAT -> drawFloat(definition.getName(), range);
            case BOOLEAN -> random.nextBoolean();
            case CATEGORICAL -> drawCategorical(definition, range);
        };
    }

    private Integer drawInt(String name, ParameterRange range) {
        long low = (long) Math.ceil(range.getMin());
        long high = (long) Math.floor(range.getMax());
        if (low > high) {
            log.warn("Parameter {} has no integer in [{}, {}], skipping", name, range.getMin(), range.getMax());
            return null;
        }
        if (low < Integer.MIN_VALUE || high > Integer.MAX_VALUE) {
            log.warn("Parameter {} range [{}, {}] exceeds int limits, skipping", name, range.getMin(), range.getMax());
            return null;
        }
        return Math.toIntExact(nextLongInclusive(low, high));
    }

    private long nextLongInclusive(long min, long max) {
        if (max == min) {
            return min;
        }
        return min + nextLongBounded(max - min + 1);
    }

    // same rejection scheme as Random#nextInt(bound), widened to long
    private long nextLongBounded(long bound) {
        long m = bound - 1;
        long r = random.nextLong();
        if ((bound & m) == 0L) {
            return r & m;
        }
        long u = r >>> 1;
        while (u + m - (u % bound) < 0L) {
            u = random.nextLong() >>> 1;
        }
        return u % bound;
    }

    private Double drawFloat(String name, ParameterRange range) {
        double min = range.getMin();
        double max = range.getMax();
        double raw = min + random.nextDouble() * (max - min);

        double rounded = BigDecimal.valueOf(raw)
                .setScale(FLOAT_SCALE, RoundingMode.HALF_UP)
                .doubleValue();

        // rounding may step just outside bounds that carry more than three decimals
        if (rounded < min || rounded > max) {
            log.debug("Clamping rounded value {} of {} to [{}, {}]", rounded, name, min, max);
            return Math.min(max, Math.max(min, rounded));
        }
        return rounded;
    }

    private Object drawCategorical(ParameterDefinition definition, ParameterRange range) {
        List<Object> choices = range.getAllowedValues();
        if (choices == null || choices.isEmpty()) {
            choices = definition.getAllowedValues();
        }
        if (choices == null || choices.isEmpty()) {
            log.warn("Categorical parameter {} has no allowed values, skipping", definition.getName());
            return null;
        }
        return choices.get(random.nextInt(choices.size()));
    }
}
