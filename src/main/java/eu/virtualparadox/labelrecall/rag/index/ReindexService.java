package eu.virtualparadox.labelrecall.rag.index;

import eu.virtualparadox.labelrecall.application.config.ApplicationConfig;
import eu.virtualparadox.labelrecall.ingest.model.Example;
import eu.virtualparadox.labelrecall.rag.embed.CorpusEmbedder;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Orchestrates a full index rebuild:
 * <ol>
 *     <li>Embed every corpus example with the current encoder weights</li>
 *     <li>Build a fresh index with the backend named in the {@link IndexConfig}</li>
 *     <li>Activate it in the {@link ActiveIndexRegistry}, retiring the previous index</li>
 * </ol>
 * <p>
 * Rebuild after every training run: vectors from older weights live in a different space.
 */
@Slf4j
@Service
public class ReindexService {

    private final CorpusEmbedder corpusEmbedder;
    private final ActiveIndexRegistry registry;
    private final ApplicationConfig applicationConfig;
    private final Map<IndexBackend, VectorIndexBuilder> builders = new EnumMap<>(IndexBackend.class);

    public ReindexService(final CorpusEmbedder corpusEmbedder,
                          final ActiveIndexRegistry registry,
                          final ApplicationConfig applicationConfig,
                          final List<VectorIndexBuilder> builders) {
        this.corpusEmbedder = corpusEmbedder;
        this.registry = registry;
        this.applicationConfig = applicationConfig;
        for (final VectorIndexBuilder builder : builders) {
            this.builders.put(builder.backend(), builder);
        }
    }

    public VectorIndex reindex(final List<Example> corpus) {
        return reindex(corpus, applicationConfig.getIndex().toIndexConfig());
    }

    /**
     * Rebuilds and activates the index.
     *
     * @return the newly active index
     * @throws IllegalStateException if embedding or building fails
     */
    public VectorIndex reindex(final List<Example> corpus, final IndexConfig config) {
        final VectorIndexBuilder builder = builders.get(config.backend());
        if (builder == null) {
            throw new IllegalStateException("No index builder registered for backend " + config.backend());
        }
        try {
            final List<CorpusEntry> entries = corpusEmbedder.embedCorpus(corpus);
            final VectorIndex index = builder.build(entries, config);
            registry.activate(index);
            return index;
        } catch (final DimensionMismatchException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new IllegalStateException("Reindex failed for corpus of " + corpus.size() + " entries", e);
        }
    }
}
