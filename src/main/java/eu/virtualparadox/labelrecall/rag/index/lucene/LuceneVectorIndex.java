package eu.virtualparadox.labelrecall.rag.index.lucene;

import eu.virtualparadox.labelrecall.rag.index.DimensionMismatchException;
import eu.virtualparadox.labelrecall.rag.index.DistanceMetric;
import eu.virtualparadox.labelrecall.rag.index.VectorIndex;
import eu.virtualparadox.labelrecall.rag.index.model.CorpusEntry;
import eu.virtualparadox.labelrecall.rag.index.model.SearchHit;
import eu.virtualparadox.labelrecall.rag.index.model.SearchResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static eu.virtualparadox.labelrecall.util.LuceneConstants.FIELD_ENTRY_ID;
import static eu.virtualparadox.labelrecall.util.LuceneConstants.FIELD_VECTOR;

/**
 * Read-only {@link VectorIndex} answering queries with {@link KnnFloatVectorQuery}.
 * <p>
 * Lucene scores are metric-specific, so hits are re-scored with the configured
 * {@link DistanceMetric} against the entry vectors; results are therefore directly
 * comparable with the in-process HNSW backend. Lucene bounds the walk by its own
 * visit limits, so the query timeout is not applied here and responses are always
 * reported complete.
 */
@Slf4j
final class LuceneVectorIndex implements VectorIndex {

    private final Directory directory;
    private final DirectoryReader reader;
    private final IndexSearcher searcher;
    private final List<CorpusEntry> entries;
    private final int dimension;
    private final DistanceMetric metric;

    LuceneVectorIndex(final Directory directory,
                      final DirectoryReader reader,
                      final List<CorpusEntry> entries,
                      final int dimension,
                      final DistanceMetric metric) {
        this.directory = directory;
        this.reader = reader;
        this.searcher = new IndexSearcher(reader);
        this.entries = List.copyOf(entries);
        this.dimension = dimension;
        this.metric = metric;
    }

    @Override
    public List<SearchHit> search(final float[] query, final int k, final int efSearch) {
        if (isEmpty() || k <= 0) {
            return List.of();
        }
        DimensionMismatchException.check(dimension, query.length, "Lucene search");
        if (!metric.supports(query)) {
            // every entry is equally far from a directionless query
            final List<SearchHit> hits = new ArrayList<>();
            for (int id = 0; id < Math.min(k, entries.size()); id++) {
                hits.add(new SearchHit(id, metric.distance(query, entries.get(id).vector())));
            }
            return hits;
        }

        final int candidates = Math.max(k, efSearch);
        try {
            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, query, candidates);
            final TopDocs topDocs = searcher.search(knn, candidates);
            final StoredFields storedFields = searcher.storedFields();

            final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                final int entryId = doc.getField(FIELD_ENTRY_ID).numericValue().intValue();
                hits.add(new SearchHit(entryId, metric.distance(query, entries.get(entryId).vector())));
            }
            hits.sort(Comparator.comparingDouble(SearchHit::distance).thenComparingInt(SearchHit::entryId));
            return hits.size() > k ? List.copyOf(hits.subList(0, k)) : hits;
        } catch (final IOException e) {
            throw new UncheckedIOException("Lucene k-NN search failed", e);
        }
    }

    @Override
    public SearchResponse search(final float[] query, final int k, final int efSearch, final Duration timeout) {
        return new SearchResponse(search(query, k, efSearch), true);
    }

    @Override
    public CorpusEntry entry(final int entryId) {
        return entries.get(entryId);
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public DistanceMetric metric() {
        return metric;
    }

    /**
     * Ensures Lucene resources are closed cleanly.
     */
    @Override
    public void close() {
        try {
            reader.close();
        } catch (final IOException e) {
            log.error("Unable to close DirectoryReader", e);
        }

        try {
            directory.close();
        } catch (final IOException e) {
            log.error("Unable to close Directory", e);
        }
    }
}
