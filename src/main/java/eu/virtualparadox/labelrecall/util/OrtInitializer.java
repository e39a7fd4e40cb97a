package eu.virtualparadox.labelrecall.util;

import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OrtInitializer {

    private OrtInitializer() {
        // Prevent instantiation
    }

    /**
     * Creates session options sized to the machine: all but one core for intra-op work,
     * a single inter-op thread.
     */
    public static OrtSession.SessionOptions initializeOrt() {
        try {
            final OrtSession.SessionOptions opts = new OrtSession.SessionOptions();

            // leave one core free for index building and query threads
            final int intraThreads = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);

            opts.setIntraOpNumThreads(intraThreads);
            opts.setInterOpNumThreads(1);

            log.info("Intra-op threads: {}, Inter-op threads: {}", intraThreads, 1);
            return opts;
        } catch (final OrtException e) {
            throw new IllegalStateException("Failed to initialize ONNX Runtime", e);
        }
    }
}
