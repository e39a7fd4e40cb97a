package eu.virtualparadox.labelrecall.application.config;

import eu.virtualparadox.labelrecall.rag.embed.HashingProjectionEncoder;
import eu.virtualparadox.labelrecall.rag.embed.OnnxTextEncoder;
import eu.virtualparadox.labelrecall.rag.embed.TextEncoder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the single encoder shared by training, corpus embedding and querying.
 */
@Configuration
public class EncoderConfig {

    @Bean
    @ConditionalOnProperty(prefix = "labelrecall.encoder", name = "type", havingValue = "hashing", matchIfMissing = true)
    public TextEncoder hashingEncoder(final ApplicationConfig config) {
        final ApplicationConfig.Encoder encoder = config.getEncoder();
        return new HashingProjectionEncoder(encoder.getDimension(), encoder.getBuckets(), encoder.getMinGram(),
                encoder.getMaxGram(), encoder.isNormalize(), encoder.getSeed());
    }

    @Bean
    @ConditionalOnProperty(prefix = "labelrecall.encoder", name = "type", havingValue = "onnx")
    public TextEncoder onnxEncoder(final ApplicationConfig config) {
        if (config.getEncoder().getModel() == null) {
            throw new IllegalStateException("labelrecall.encoder.model must point to the ONNX model folder");
        }
        return new OnnxTextEncoder(config.getEncoder().getModel());
    }
}
