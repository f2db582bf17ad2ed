package org.javai.orderflow.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * In-memory vector index over catalog items backed by a Spring AI {@link EmbeddingModel}.
 *
 * <p>Each item gets two vectors: one for its name alone and one for name, description and
 * category together. Vectors are L2-normalized at build time so inner product equals cosine
 * similarity. An item's score is the better of its two vectors.</p>
 *
 * <p>The index is built eagerly in the constructor and is immutable afterwards.</p>
 */
public final class EmbeddingSimilarityIndex implements SimilarityIndex {

	private static final Logger logger = LoggerFactory.getLogger(EmbeddingSimilarityIndex.class);

	private final EmbeddingModel embeddingModel;
	private final List<CatalogItem> items;
	private final List<float[]> nameVectors;
	private final List<float[]> fullVectors;

	public EmbeddingSimilarityIndex(EmbeddingModel embeddingModel, CatalogIndex catalog) {
		this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel must not be null");
		Objects.requireNonNull(catalog, "catalog must not be null");
		this.items = catalog.items();
		List<String> names = new ArrayList<>(items.size());
		List<String> fullTexts = new ArrayList<>(items.size());
		for (CatalogItem item : items) {
			names.add(TextNormalizer.normalize(item.name()));
			fullTexts.add(TextNormalizer.normalize(item.name() + " " + item.description() + " " + item.category()));
		}
		this.nameVectors = embedAll(names);
		this.fullVectors = embedAll(fullTexts);
		logger.info("Built similarity index over {} catalog items", items.size());
	}

	@Override
	public List<ScoredItem> search(String query, int topK) {
		if (query == null || query.isBlank() || items.isEmpty() || topK <= 0) {
			return List.of();
		}
		float[] queryVector = l2Normalize(embeddingModel.embed(TextNormalizer.normalize(query)));
		List<ScoredItem> scored = new ArrayList<>(items.size());
		for (int i = 0; i < items.size(); i++) {
			double score = Math.max(dot(queryVector, nameVectors.get(i)), dot(queryVector, fullVectors.get(i)));
			scored.add(new ScoredItem(items.get(i), score));
		}
		// stable sort keeps catalog order among equal scores
		scored.sort(Comparator.comparingDouble(ScoredItem::score).reversed());
		List<ScoredItem> top = scored.subList(0, Math.min(topK, scored.size()));
		logger.debug("Similarity search '{}' best score {}", query, top.isEmpty() ? 0.0 : top.get(0).score());
		return List.copyOf(top);
	}

	private List<float[]> embedAll(List<String> texts) {
		if (texts.isEmpty()) {
			return List.of();
		}
		List<float[]> vectors = embeddingModel.embed(texts);
		if (vectors.size() != texts.size()) {
			throw new IllegalStateException("Embedding model returned " + vectors.size()
					+ " vectors for " + texts.size() + " inputs");
		}
		return vectors.stream().map(EmbeddingSimilarityIndex::l2Normalize).toList();
	}

	static float[] l2Normalize(float[] vector) {
		double norm = 0.0;
		for (float v : vector) {
			norm += v * v;
		}
		norm = Math.sqrt(norm);
		if (norm == 0.0) {
			return vector.clone();
		}
		float[] normalized = new float[vector.length];
		for (int i = 0; i < vector.length; i++) {
			normalized[i] = (float) (vector[i] / norm);
		}
		return normalized;
	}

	static double dot(float[] a, float[] b) {
		int length = Math.min(a.length, b.length);
		double sum = 0.0;
		for (int i = 0; i < length; i++) {
			sum += a[i] * b[i];
		}
		return sum;
	}
}
