package eu.virtualparadox.labelrecall.rag.embed;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.Embedding;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Embeds labeled corpus examples with the shared {@link TextEncoder}.
 * <p>
 * Pure with respect to the encoder weights: the same corpus and weights always give the
 * same entries. Entry ids are positions in the input list, which is what the index
 * builders expect.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CorpusEmbedder {

    private final TextEncoder encoder;
    private final ApplicationConfig applicationConfig;

    public List<CorpusEntry> embedCorpus(final List<Example> corpus) {
        return embedCorpus(corpus, applicationConfig.getIndex().getEmbedBatchSize());
    }

    /**
     * @param batchSize texts handed to {@link TextEncoder#encodeBatch(List)} at once
     * @throws DimensionMismatchException if the encoder returns a vector of the wrong width
     */
    public List<CorpusEntry> embedCorpus(final List<Example> corpus, final int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        final long start = System.nanoTime();
        final List<CorpusEntry> entries = new ArrayList<>(corpus.size());

        for (int from = 0; from < corpus.size(); from += batchSize) {
            final List<Example> batch = corpus.subList(from, Math.min(corpus.size(), from + batchSize));
            final List<float[]> vectors = encoder.encodeBatch(batch.stream().map(Example::text).toList());

            for (int i = 0; i < batch.size(); i++) {
                final int id = from + i;
                final float[] vector = vectors.get(i);
                DimensionMismatchException.check(encoder.dimension(), vector.length, "corpus entry " + id);

                final Example example = batch.get(i);
                entries.add(new CorpusEntry(id, example.text(), new Embedding("entry-" + id, vector),
                        example.labelPath()));
            }
        }

        log.info("Embedded {} corpus entries with {} in {} ms", entries.size(), encoder.name(),
                (System.nanoTime() - start) / 1_000_000);
        return entries;
    }
}
