package org.javai.orderflow.catalog;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a catalog search.
 *
 * @param stage pipeline stage that produced the hit
 * @param items matched items, best first; empty when not found
 * @param confidence 1.0 for exact, 0.8 for keyword, best similarity score otherwise
 * @param lowConfidence true when the caller must confirm the match with the customer
 * @param suggestions categories to offer when nothing matched
 */
public record SearchResult(
		MatchStage stage,
		List<CatalogItem> items,
		double confidence,
		boolean lowConfidence,
		List<String> suggestions
) {

	public enum MatchStage {
		EXACT,
		KEYWORD,
		SIMILARITY,
		NOT_FOUND
	}

	public SearchResult {
		Objects.requireNonNull(stage, "stage must not be null");
		items = items != null ? List.copyOf(items) : List.of();
		suggestions = suggestions != null ? List.copyOf(suggestions) : List.of();
		if (stage == MatchStage.NOT_FOUND && !items.isEmpty()) {
			throw new IllegalArgumentException("NOT_FOUND result must not carry items");
		}
	}

	public static SearchResult exact(CatalogItem item) {
		return new SearchResult(MatchStage.EXACT, List.of(item), 1.0, false, List.of());
	}

	public static SearchResult keyword(List<CatalogItem> items, double confidence, boolean lowConfidence) {
		return new SearchResult(MatchStage.KEYWORD, items, confidence, lowConfidence, List.of());
	}

	public static SearchResult similarity(List<CatalogItem> items, double bestScore, boolean lowConfidence) {
		return new SearchResult(MatchStage.SIMILARITY, items, bestScore, lowConfidence, List.of());
	}

	public static SearchResult notFound(List<String> suggestions) {
		return new SearchResult(MatchStage.NOT_FOUND, List.of(), 0.0, false, suggestions);
	}

	public boolean found() {
		return stage != MatchStage.NOT_FOUND;
	}

	/**
	 * True when the result is a single confident item the caller can use without asking.
	 */
	public boolean isUnambiguous() {
		return found() && items.size() == 1 && !lowConfidence;
	}
}
