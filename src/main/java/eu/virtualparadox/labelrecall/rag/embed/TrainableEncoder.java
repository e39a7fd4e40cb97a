package eu.virtualparadox.labelrecall.rag.embed;

/**
 * A {@link TextEncoder} whose weights can be updated by gradient descent.
 * <p>
 * The trainer drives it in three phases per step: {@link #forward(String)} for every
 * text of the batch, {@link #backward(ForwardPass, float[], SparseGradient)} with the
 * loss gradient of each output, then a single {@link #apply(SparseGradient, float)}.
 * Forward and backward only read weights and may run on several threads at once;
 * {@code apply} is atomic with respect to concurrent encoding.
 */
public interface TrainableEncoder extends TextEncoder {

    /**
     * Encodes a text and keeps what the backward pass needs.
     */
    ForwardPass forward(final String text);

    /**
     * Accumulates {@code dL/dW} for one output into {@code gradient}.
     *
     * @param pass           the forward pass that produced the output
     * @param outputGradient {@code dL/d(output)}, length {@link #dimension()}
     * @param gradient       accumulator created by {@link #newGradient()}
     */
    void backward(final ForwardPass pass, final float[] outputGradient, final SparseGradient gradient);

    /**
     * Applies one SGD update {@code W -= learningRate * gradient}.
     */
    void apply(final SparseGradient gradient, final float learningRate);

    SparseGradient newGradient();

    /**
     * Cached activations of one forward call.
     */
    interface ForwardPass {

        /**
         * @return the encoder output for the text
         */
        float[] output();
    }
}
