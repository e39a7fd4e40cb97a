package eu.virtualparadox.labelrecall.rag.index.lucene;

import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.IndexBackend;
import eu.virtualparadox.labelrecall.rag.index.IndexConfig;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.VectorIndexBuilder;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.lucene99.Lucene99Codec;
import org.apache.lucene.codecs.lucene99.Lucene99HnswVectorsFormat;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static eu.virtualparadox.labelrecall.util.LuceneConstants.FIELD_ENTRY_ID;
import static eu.virtualparadox.labelrecall.util.LuceneConstants.FIELD_VECTOR;

/**
 * Builds a Lucene HNSW index over corpus entries in a private in-memory directory.
 * <p>
 * Every build writes a fresh {@link ByteBuffersDirectory}, commits once and opens a
 * reader on it; the writer is closed before the index is handed out, so the result is
 * read-only like the in-process graph.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code entryId} – {@link StoredField}: position of the entry in the corpus</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField}: dense vector (HNSW indexed)</li>
 * </ul>
 */
@Slf4j
@Component
public final class LuceneVectorIndexBuilder implements VectorIndexBuilder {

    /** Lucene caps graph fan-out at this value. */
    private static final int LUCENE_MAX_CONN = 512;
    private static final int LUCENE_MAX_BEAM_WIDTH = 3200;

    @Override
    public IndexBackend backend() {
        return IndexBackend.LUCENE;
    }

    @Override
    public VectorIndex build(final List<CorpusEntry> entries, final IndexConfig config) {
        final Directory directory = new ByteBuffersDirectory();
        try {
            final int dim = entries.isEmpty() ? 0 : entries.get(0).embedding().dim();
            final IndexWriterConfig cfg = new IndexWriterConfig()
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                    .setCodec(codecFor(config));

            try (IndexWriter writer = new IndexWriter(directory, cfg)) {
                for (int i = 0; i < entries.size(); i++) {
                    final CorpusEntry entry = entries.get(i);
                    if (entry.id() != i) {
                        throw new IllegalArgumentException("Entry at position " + i + " has id " + entry.id());
                    }
                    DimensionMismatchException.check(dim, entry.embedding().dim(), "Lucene build (entry " + i + ")");
                    if (!config.metric().supports(entry.vector())) {
                        throw new IllegalArgumentException("Lucene " + config.metric()
                                + " index cannot hold the zero vector of entry " + i);
                    }
                    writer.addDocument(buildLuceneDocument(entry, config));
                }
                writer.commit();
            }

            final DirectoryReader reader = DirectoryReader.open(directory);
            log.info("Built Lucene HNSW index: {} entries, dim={}, metric={}", entries.size(), dim, config.metric());
            return new LuceneVectorIndex(directory, reader, entries, dim, config.metric());
        } catch (final IOException e) {
            closeQuietly(directory);
            throw new UncheckedIOException("Failed to build Lucene vector index", e);
        } catch (final RuntimeException e) {
            closeQuietly(directory);
            throw e;
        }
    }

    private Document buildLuceneDocument(final CorpusEntry entry, final IndexConfig config) {
        final Document d = new Document();
        d.add(new StoredField(FIELD_ENTRY_ID, entry.id()));
        d.add(new KnnFloatVectorField(FIELD_VECTOR, entry.vector(), config.metric().luceneFunction()));
        return d;
    }

    private static Lucene99Codec codecFor(final IndexConfig config) {
        final int maxConn = Math.min(config.m(), LUCENE_MAX_CONN);
        final int beamWidth = Math.min(Math.max(config.efConstruction(), maxConn), LUCENE_MAX_BEAM_WIDTH);
        return new Lucene99Codec() {
            @Override
            public KnnVectorsFormat getKnnVectorsFormatForField(final String field) {
                return new Lucene99HnswVectorsFormat(maxConn, beamWidth);
            }
        };
    }

    private static void closeQuietly(final Directory directory) {
        try {
            directory.close();
        } catch (final IOException e) {
            log.error("Unable to close Lucene directory", e);
        }
    }
}
