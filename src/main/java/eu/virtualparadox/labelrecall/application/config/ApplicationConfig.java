package eu.virtualparadox.labelrecall.application.config;

import eu.virtualparadox.labelrecall.classify.model.VotingConfig;
import eu.virtualparadox.labelrecall.classify.model.VotingStrategy;
import eu.virtualparadox.labelrecall.classify.model.WeightingScheme;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.IndexBackend;
import eu.virtualparadox.labelrecall.rag.index.IndexConfig;
import eu.virtualparadox.labelrecall.train.SimilarityMode;
import eu.virtualparadox.labelrecall.train.model.TrainingConfig;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "labelrecall")
@Getter @Setter
public class ApplicationConfig {

    private Path root;
    private Path output;

    private Data data = new Data();
    private Encoder encoder = new Encoder();
    private Training training = new Training();
    private Index index = new Index();
    private Voting voting = new Voting();
    private Evaluation evaluation = new Evaluation();

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (root != null) Files.createDirectories(root);
        if (output != null) Files.createDirectories(output);
    }

    /**
     * Input files; every step whose file is unset is skipped.
     */
    @Getter @Setter
    public static class Data {
        private Path corpus;
        private Path train;
        private Path eval;
        private Path predict;
    }

    @Getter @Setter
    public static class Encoder {
        /** {@code hashing} (trainable) or {@code onnx} (frozen pretrained model). */
        private String type = "hashing";
        private int dimension = 128;
        private int buckets = 50_000;
        private int minGram = 1;
        private int maxGram = 3;
        private boolean normalize = true;
        private long seed = 42L;
        /** Folder holding {@code model.onnx} and {@code tokenizer.json}. */
        private Path model;
    }

    @Getter @Setter
    public static class Training {
        private int epochs = 3;
        private int batchSize = 32;
        private float learningRate = 0.05f;
        private float margin = TrainingConfig.DEFAULT_MARGIN;
        private float scale = TrainingConfig.DEFAULT_SCALE;
        private SimilarityMode similarity = SimilarityMode.COSINE;
        private boolean symmetric = false;
        private long seed = 42L;
        private int workers = 1;
        private int maxConsecutiveNumericFailures = 5;

        public TrainingConfig toTrainingConfig() {
            return new TrainingConfig(epochs, batchSize, learningRate, margin, scale, similarity, symmetric,
                    seed, workers, maxConsecutiveNumericFailures);
        }
    }

    @Getter @Setter
    public static class Index {
        private IndexBackend backend = IndexBackend.HNSW;
        private DistanceMetric metric = DistanceMetric.COSINE;
        private int m = IndexConfig.DEFAULT_M;
        private int efConstruction = IndexConfig.DEFAULT_EF_CONSTRUCTION;
        private int efSearch = 64;
        private long seed = IndexConfig.DEFAULT_SEED;
        /** Per-query graph walk budget; zero or negative disables it. */
        private Duration queryTimeout = Duration.ofMillis(500);
        private int embedBatchSize = 64;
        private int queryThreads = 4;

        public IndexConfig toIndexConfig() {
            return new IndexConfig(backend, metric, m, efConstruction, seed);
        }
    }

    @Getter @Setter
    public static class Voting {
        private VotingStrategy strategy = VotingStrategy.VOTE;
        private WeightingScheme weighting = WeightingScheme.SIMILARITY;
        private int groupingDepth = 0;
        private double rankDecay = 1.0;
        /** Unset means every prediction is kept. */
        private Double minConfidence;
        private int topK = 10;

        public VotingConfig toVotingConfig() {
            return new VotingConfig(strategy, weighting, groupingDepth, rankDecay,
                    minConfidence == null ? Double.NEGATIVE_INFINITY : minConfidence);
        }
    }

    @Getter @Setter
    public static class Evaluation {
        private int recallK = 50;
        private List<Integer> cutoffs = new ArrayList<>(List.of(1, 5, 10, 20, 50));
        private int comparisonDepth = 0;
    }
}
