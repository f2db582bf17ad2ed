package org.javai.orderflow.context;

/**
 * Counts model tokens in a piece of text.
 */
@FunctionalInterface
public interface TokenEstimator {

	int count(String text);
}
