package eu.virtualparadox.labelrecall.query;

import eu.virtualparadox.labelrecall.classify.model.Prediction;
import eu.virtualparadox.labelrecall.rag.retriever.model.QueryResult;

import java.util.List;

/**
 * Outcome of a batch prediction, aligned with the input texts.
 *
 * @param texts        the (cleaned) query texts
 * @param predictions  one prediction per text
 * @param recalls      the neighbours each prediction was voted from
 * @param unclassified predictions without a label
 * @param timedOut     queries whose index search hit the timeout
 */
public record BatchReport(List<String> texts,
                          List<Prediction> predictions,
                          List<QueryResult> recalls,
                          int unclassified,
                          int timedOut) {

    public BatchReport {
        texts = List.copyOf(texts);
        predictions = List.copyOf(predictions);
        recalls = List.copyOf(recalls);
    }

    public int size() {
        return predictions.size();
    }
}
