package com.frauddetection.hypersearch.catalog;

import com.frauddetection.hypersearch.domain.ModelFamily;
import com.frauddetection.hypersearch.domain.ParameterDefinition;
import com.frauddetection.hypersearch.domain.ParameterRange;
import com.frauddetection.hypersearch.domain.ParameterType;
import com.frauddetection.hypersearch.domain.Sensitivity;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static registry of tunable parameters per model family.
 * Adding a parameter is a catalog edit: bump {@link #VERSION} when the lists change.
 */
@Component
public class ParameterCatalog {

    public static final int VERSION = 1;

    private static final Map<ModelFamily, List<ParameterDefinition>> DEFINITIONS;

    static {
        Map<ModelFamily, List<ParameterDefinition>> definitions = new EnumMap<>(ModelFamily.class);

        definitions.put(ModelFamily.LIGHTGBM, List.of(
                numeric("numberOfTrees", "Number of Trees", ParameterType.INT, 100, 2000, 100, Sensitivity.HIGH,
                        "Number of boosted trees. More trees fit better but risk overfitting"),
                numeric("learningRate", "Learning Rate", ParameterType.FLOAT, 0.001, 0.3, 0.001, Sensitivity.HIGH,
                        "Shrinkage applied at each boosting step. Smaller is slower but safer"),
                numeric("numberOfLeaves", "Number of Leaves", ParameterType.INT, 16, 512, 16, Sensitivity.MEDIUM,
                        "Maximum leaves per tree. Controls model complexity"),
                numeric("featureFraction", "Feature Fraction", ParameterType.FLOAT, 0.5, 1.0, 0.05, Sensitivity.MEDIUM,
                        "Share of features sampled for each tree"),
                numeric("l1Regularization", "L1 Regularization", ParameterType.FLOAT, 0, 1, 0.01, Sensitivity.MEDIUM,
                        "L1 penalty on leaf weights"),
                numeric("l2Regularization", "L2 Regularization", ParameterType.FLOAT, 0, 1, 0.01, Sensitivity.MEDIUM,
                        "L2 penalty on leaf weights"),
                flag("useClassWeights", "Class Weights", Sensitivity.HIGH,
                        "Reweight classes automatically for imbalanced data")));

        definitions.put(ModelFamily.PCA, List.of(
                numeric("componentCount", "Component Count", ParameterType.INT, 5, 50, 5, Sensitivity.HIGH,
                        "Number of principal components kept"),
                numeric("anomalyThreshold", "Anomaly Threshold", ParameterType.FLOAT, 1.0, 4.0, 0.1, Sensitivity.HIGH,
                        "Reconstruction error threshold. Lower is more sensitive"),
                flag("standardizeInput", "Standardize Input", Sensitivity.MEDIUM,
                        "Standardize features before projection")));

        definitions.put(ModelFamily.ENSEMBLE, List.of(
                numeric("lightgbmWeight", "LightGBM Weight", ParameterType.FLOAT, 0.1, 0.9, 0.05, Sensitivity.HIGH,
                        "Weight of the gradient-boosted model in the final score"),
                numeric("pcaWeight", "PCA Weight", ParameterType.FLOAT, 0.1, 0.9, 0.05, Sensitivity.HIGH,
                        "Weight of the PCA detector in the final score"),
                numeric("threshold", "Decision Threshold", ParameterType.FLOAT, 0.1, 0.9, 0.05, Sensitivity.HIGH,
                        "Minimum combined score for a fraud decision"),
                flag("enableCrossValidation", "Cross Validation", Sensitivity.MEDIUM,
                        "Apply k-fold cross validation while fitting"),
                ParameterDefinition.builder()
                        .name("votingStrategy")
                        .displayName("Voting Strategy")
                        .type(ParameterType.CATEGORICAL)
                        .allowedValues(List.of("weighted", "majority", "soft"))
                        .sensitivity(Sensitivity.MEDIUM)
                        .description("How member predictions are combined")
                        .build()));

        DEFINITIONS = Collections.unmodifiableMap(definitions);
    }

    /**
     * All definitions of a model family, in catalog order.
     */
    public List<ParameterDefinition> definitionsFor(ModelFamily modelFamily) {
        return DEFINITIONS.getOrDefault(modelFamily, List.of());
    }

    public Optional<ParameterDefinition> definition(ModelFamily modelFamily, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return definitionsFor(modelFamily).stream()
                .filter(d -> d.getName().equals(name))
                .findFirst();
    }

    /**
     * One enabled range per definition, carrying the definition's own bounds.
     */
    public Map<String, ParameterRange> defaultRanges(ModelFamily modelFamily) {
        Map<String, ParameterRange> ranges = new LinkedHashMap<>();
        for (ParameterDefinition definition : definitionsFor(modelFamily)) {
            ranges.put(definition.getName(), ParameterRange.from(definition));
        }
        return ranges;
    }

    private static ParameterDefinition numeric(String name, String displayName, ParameterType type,
                                               double min, double max, double step,
                                               Sensitivity sensitivity, String description) {
        return ParameterDefinition.builder()
                .name(name)
                .displayName(displayName)
                .type(type)
                .min(min)
                .max(max)
                .step(step)
                .sensitivity(sensitivity)
                .description(description)
                .build();
    }

    private static ParameterDefinition flag(String name, String displayName,
                                            Sensitivity sensitivity, String description) {
        return ParameterDefinition.builder()
                .name(name)
                .displayName(displayName)
                .type(ParameterType.BOOLEAN)
                .sensitivity(sensitivity)
                .description(description)
                .build();
    }
}
