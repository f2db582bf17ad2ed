package org.javai.orderflow.inference;

/**
 * Seam to the language model. One call is one model round: the model either answers with text
 * or asks for tool calls.
 */
@FunctionalInterface
public interface InferenceClient {

	/**
	 * @throws org.javai.orderflow.OrderingException with
	 *         {@link org.javai.orderflow.ErrorKind#INFERENCE_UNAVAILABLE} when the model cannot be reached
	 */
	InferenceResponse infer(InferenceRequest request);
}
