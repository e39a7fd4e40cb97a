package eu.virtualparadox.labelrecall.rag.embed;

import ai.djl.huggingface.tokenizers.Encoding;
import ai.djl.huggingface.tokenizers.HuggingFaceTokenizer;
import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import eu.virtualparadox.labelrecall.util.OrtInitializer;
import eu.virtualparadox.labelrecall.util.VectorMath;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Frozen encoder backed by a pretrained ONNX sentence-embedding model.
 * <p>
 * Expects {@code model.onnx} and {@code tokenizer.json} under the configured model root.
 * Token vectors are mean-pooled over the attention mask and L2-normalized. The weights
 * cannot be updated, so the contrastive trainer skips training when this encoder is
 * active and the pipeline goes straight to indexing.
 */
@Slf4j
public final class OnnxTextEncoder implements TextEncoder {

    private static final int MAX_LEN = 512;
    private static final int BATCH_SIZE = 16;

    private final Path modelPath;
    private final Path tokenizerPath;

    private OrtEnvironment env;
    private OrtSession session;
    private HuggingFaceTokenizer tokenizer;
    private int dimension;

    public OnnxTextEncoder(final Path modelRoot) {
        this.modelPath = modelRoot.resolve("model.onnx");
        this.tokenizerPath = modelRoot.resolve("tokenizer.json");
    }

    @PostConstruct
    public void init() throws IOException, OrtException {
        this.env = OrtEnvironment.getEnvironment();
        final OrtSession.SessionOptions options = OrtInitializer.initializeOrt();

        this.session = env.createSession(modelPath.toString(), options);
        this.tokenizer = HuggingFaceTokenizer.newInstance(tokenizerPath);

        // one warm-up call yields the output width
        this.dimension = encode("warm-up").length;

        log.info("Loaded ONNX embedding model: {} (dim={})", modelPath, dimension);
        log.info("Model expects inputs: {}", session.getInputNames());
    }

    @PreDestroy
    public void cleanup() throws OrtException {
        if (session != null) {
            session.close();
        }
        if (tokenizer != null) {
            tokenizer.close();
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String name() {
        return "onnx:" + modelPath.getParent().getFileName();
    }

    @Override
    public float[] encode(final String text) {
        return embedBatch(List.of(text)).get(0);
    }

    @Override
    public List<float[]> encodeBatch(final List<String> texts) {
        final List<float[]> result = new ArrayList<>(texts.size());
        for (int from = 0; from < texts.size(); from += BATCH_SIZE) {
            result.addAll(embedBatch(texts.subList(from, Math.min(texts.size(), from + BATCH_SIZE))));
        }
        return result;
    }

    private List<float[]> embedBatch(final List<String> texts) {
        try {
            final List<Encoding> encodings = new ArrayList<>();
            int maxLen = 0;

            for (final String text : texts) {
                final Encoding e = tokenizer.encode(text);
                encodings.add(e);
                maxLen = Math.max(maxLen, e.getIds().length);
            }
            maxLen = Math.min(maxLen, MAX_LEN);

            final int batchSize = encodings.size();
            final long[][] inputIdArr = new long[batchSize][maxLen];
            final long[][] attnMaskArr = new long[batchSize][maxLen];
            final long[][] tokenTypeArr = new long[batchSize][maxLen];

            for (int i = 0; i < batchSize; i++) {
                final long[] ids = encodings.get(i).getIds();
                final long[] mask = encodings.get(i).getAttentionMask();
                final int len = Math.min(ids.length, maxLen);

                System.arraycopy(ids, 0, inputIdArr[i], 0, len);
                System.arraycopy(mask, 0, attnMaskArr[i], 0, len);
            }

            try (OnnxTensor inputIds = OnnxTensor.createTensor(env, inputIdArr);
                 OnnxTensor attentionMask = OnnxTensor.createTensor(env, attnMaskArr);
                 OnnxTensor tokenTypeTensor = OnnxTensor.createTensor(env, tokenTypeArr)) {

                final Map<String, OnnxTensor> inputs = new HashMap<>();
                if (session.getInputNames().contains("input_ids")) {
                    inputs.put("input_ids", inputIds);
                }
                if (session.getInputNames().contains("attention_mask")) {
                    inputs.put("attention_mask", attentionMask);
                }
                if (session.getInputNames().contains("token_type_ids")) {
                    inputs.put("token_type_ids", tokenTypeTensor);
                }

                try (OrtSession.Result result = session.run(inputs)) {
                    final float[][][] embeddings = (float[][][]) result.get(0).getValue();

                    final List<float[]> out = new ArrayList<>(batchSize);
                    for (int i = 0; i < batchSize; i++) {
                        out.add(VectorMath.normalize(meanPool(embeddings[i], attnMaskArr[i])));
                    }
                    return out;
                }
            }
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to embed batch of " + texts.size() + " texts", e);
        }
    }

    private float[] meanPool(final float[][] tokenVectors, final long[] attentionMask) {
        final int hiddenDim = tokenVectors[0].length;
        final float[] pooled = new float[hiddenDim];

        int validCount = 0;
        for (int i = 0; i < tokenVectors.length; i++) {
            if (attentionMask[i] == 1) {
                final float[] tokenVec = tokenVectors[i];
                for (int j = 0; j < hiddenDim; j++) {
                    pooled[j] += tokenVec[j];
                }
                validCount++;
            }
        }

        if (validCount > 0) {
            for (int j = 0; j < hiddenDim; j++) {
                pooled[j] /= validCount;
            }
        }
        return pooled;
    }
}
