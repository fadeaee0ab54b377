package com.bank.p2pfraud.engine.model;

import com.bank.p2pfraud.config.ModelConfig;
import com.bank.p2pfraud.model.ModelStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;

/**
 * Random forest fraud scorer trained once, on first use, on synthetic data.
 * The trained scaler and forest are kept for the lifetime of the process.
 */
@Component
public class RandomForestFraudScorer implements FraudScorer {

    private static final Logger log = LoggerFactory.getLogger(RandomForestFraudScorer.class);

    private final ModelConfig config;
    private final Clock clock;

    private volatile TrainedModel model;

    public RandomForestFraudScorer(ModelConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public double predict(double[] features) {
        TrainedModel current = ensureTrained();
        double[] scaled = current.scaler().transform(features);
        double probability = current.forest().predictProbability(scaled);
        return Math.max(0.0, Math.min(1.0, probability));
    }

    @Override
    public ModelStatus getStatus() {
        TrainedModel current = model;
        if (current == null) {
            return ModelStatus.builder()
                    .trained(false)
                    .numTrees(config.getNumTrees())
                    .featureImportance(Collections.emptyMap())
                    .build();
        }

        double[] importances = current.forest().featureImportances();
        Map<String, Double> byName = new LinkedHashMap<>();
        for (int i = 0; i < importances.length; i++) {
            byName.put(FeatureExtractor.FEATURE_NAMES[i], importances[i]);
        }

        return ModelStatus.builder()
                .trained(true)
                .numTrees(current.forest().getTrees().size())
                .trainingSamples(current.trainingSamples())
                .trainingAccuracy(current.trainingAccuracy())
                .trainedAt(current.trainedAt())
                .featureImportance(byName)
                .build();
    }

    public boolean isTrained() {
        return model != null;
    }

    private TrainedModel ensureTrained() {
        TrainedModel current = model;
        if (current == null) {
            synchronized (this) {
                current = model;
                if (current == null) {
                    current = train();
                    model = current;
                }
            }
        }
        return current;
    }

    private TrainedModel train() {
        long start = System.currentTimeMillis();
        Random random = new Random(config.getSeed());

        SyntheticTrainingData.TrainingSet data = SyntheticTrainingData.generate(
                config.getNormalSamples(), config.getFraudSamples(), random);

        StandardScaler scaler = new StandardScaler();
        scaler.fit(data.features());
        double[][] scaled = scaler.transformAll(data.features());

        RandomForest forest = new RandomForest();
        forest.train(scaled, data.labels(), config.getNumTrees(), config.getMaxDepth(),
                config.getMinSamplesLeaf(), config.getSeed());

        int correct = 0;
        for (int i = 0; i < scaled.length; i++) {
            int predicted = forest.predictProbability(scaled[i]) >= 0.5 ? 1 : 0;
            if (predicted == data.labels()[i]) correct++;
        }
        double accuracy = (double) correct / scaled.length;

        log.info("Fraud model trained: {} trees on {} samples, training accuracy={}, took {}ms",
                config.getNumTrees(), data.size(), String.format("%.3f", accuracy),
                System.currentTimeMillis() - start);

        return new TrainedModel(scaler, forest, data.size(), accuracy, clock.millis());
    }

    private record TrainedModel(StandardScaler scaler, RandomForest forest,
                                int trainingSamples, double trainingAccuracy, long trainedAt) {}
}
