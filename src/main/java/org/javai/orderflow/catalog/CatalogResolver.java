package org.javai.orderflow.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.orderflow.OrderingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves free-text menu queries to catalog items.
 *
 * <p>Three stages run in order and the first stage with a hit wins:</p>
 * <ol>
 *   <li><b>Exact</b> – the normalized query equals a normalized item name (directly or by its
 *   phonetic form), or is contained in exactly one item name. Confidence 1.0.</li>
 *   <li><b>Keyword</b> – any query token longer than two characters occurs in an item's
 *   name, description or category. Confidence 0.8, catalog order, at most {@code topK}. A
 *   single hit is used as is. Several hits defer to the similarity stage when an index is
 *   configured; if that finds nothing, or there is no index, the keyword hits are returned
 *   flagged low-confidence so the caller asks the customer to pick one.</li>
 *   <li><b>Similarity</b> – semantic search through the {@link SimilarityIndex}. Scores below
 *   the not-found threshold yield {@link SearchResult.MatchStage#NOT_FOUND}; scores between the
 *   not-found and high thresholds are flagged low-confidence.</li>
 * </ol>
 *
 * <p>Unavailable items never appear in search results; they can still be looked up by id.</p>
 */
public class CatalogResolver {

	private static final Logger logger = LoggerFactory.getLogger(CatalogResolver.class);

	public static final double EXACT_CONFIDENCE = 1.0;
	public static final double KEYWORD_CONFIDENCE = 0.8;

	private final CatalogIndex catalog;
	private final SimilarityIndex similarityIndex;
	private final Options options;

	/**
	 * Search tuning.
	 *
	 * @param topK maximum number of items returned by keyword and similarity stages
	 * @param minScore similarity hits below this score are discarded
	 * @param notFoundThreshold best similarity score below this means not found
	 * @param highThreshold best similarity score at or above this needs no confirmation
	 */
	public record Options(int topK, double minScore, double notFoundThreshold, double highThreshold) {

		public Options {
			if (topK < 1) {
				throw new IllegalArgumentException("topK must be >= 1");
			}
			if (!(minScore <= notFoundThreshold && notFoundThreshold <= highThreshold)) {
				throw new IllegalArgumentException("thresholds must satisfy minScore <= notFound <= high");
			}
		}

		public static Options defaults() {
			return new Options(5, 0.30, 0.55, 0.75);
		}
	}

	public CatalogResolver(CatalogIndex catalog) {
		this(catalog, null, Options.defaults());
	}

	/**
	 * @param catalog the catalog to search
	 * @param similarityIndex semantic index; null disables the similarity stage
	 * @param options search tuning
	 */
	public CatalogResolver(CatalogIndex catalog, SimilarityIndex similarityIndex, Options options) {
		this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
		this.similarityIndex = similarityIndex;
		this.options = options != null ? options : Options.defaults();
	}

	public CatalogIndex catalog() {
		return catalog;
	}

	public SearchResult search(String query) {
		String normalized = TextNormalizer.normalize(query);
		if (normalized.isEmpty()) {
			return SearchResult.notFound(catalog.categories());
		}

		SearchResult exact = exactStage(normalized);
		if (exact != null) {
			logger.debug("Exact match for '{}': {}", query, exact.items().get(0).id());
			return exact;
		}

		List<CatalogItem> keywordHits = keywordStage(query);
		if (keywordHits.size() == 1) {
			logger.debug("Keyword match for '{}': {}", query, keywordHits.get(0).id());
			return SearchResult.keyword(keywordHits, KEYWORD_CONFIDENCE, false);
		}
		if (!keywordHits.isEmpty()) {
			if (similarityIndex != null) {
				SearchResult similar = similarityStage(query);
				if (similar.found()) {
					logger.debug("{} keyword hits for '{}', similarity stage returned {} item(s)",
							keywordHits.size(), query, similar.items().size());
					return similar;
				}
			}
			logger.debug("Keyword match for '{}' is ambiguous: {} items", query, keywordHits.size());
			return SearchResult.keyword(keywordHits, KEYWORD_CONFIDENCE, true);
		}

		SearchResult similar = similarityStage(query);
		logger.debug("Similarity stage for '{}' returned {}", query, similar.stage());
		return similar;
	}

	/**
	 * Direct lookup by id, independent of availability.
	 *
	 * @throws OrderingException of kind ITEM_NOT_FOUND if absent
	 */
	public CatalogItem getById(String id) {
		return catalog.getById(id);
	}

	private SearchResult exactStage(String normalizedQuery) {
		String phoneticQuery = TextNormalizer.phonetic(normalizedQuery);
		CatalogItem phoneticHit = null;
		List<CatalogItem> containing = new ArrayList<>();
		List<CatalogItem> items = catalog.items();
		for (int i = 0; i < items.size(); i++) {
			CatalogItem item = items.get(i);
			if (!item.available()) {
				continue;
			}
			String name = catalog.normalizedName(i);
			if (name.equals(normalizedQuery)) {
				return SearchResult.exact(item);
			}
			if (phoneticHit == null && catalog.phoneticName(i).equals(phoneticQuery)) {
				phoneticHit = item;
			}
			if (name.contains(normalizedQuery)) {
				containing.add(item);
			}
		}
		if (phoneticHit != null) {
			return SearchResult.exact(phoneticHit);
		}
		if (containing.size() == 1) {
			return SearchResult.exact(containing.get(0));
		}
		return null;
	}

	private List<CatalogItem> keywordStage(String query) {
		List<String> tokens = TextNormalizer.significantTokens(query);
		if (tokens.isEmpty()) {
			return List.of();
		}
		List<CatalogItem> hits = new ArrayList<>();
		List<CatalogItem> items = catalog.items();
		for (int i = 0; i < items.size() && hits.size() < options.topK(); i++) {
			CatalogItem item = items.get(i);
			if (!item.available()) {
				continue;
			}
			String text = catalog.normalizedText(i);
			if (tokens.stream().anyMatch(text::contains)) {
				hits.add(item);
			}
		}
		return hits;
	}

	private SearchResult similarityStage(String query) {
		if (similarityIndex == null) {
			return SearchResult.notFound(catalog.categories());
		}
		List<SimilarityIndex.ScoredItem> hits = similarityIndex.search(query, options.topK() * 2).stream()
				.filter(hit -> hit.item().available())
				.filter(hit -> hit.score() >= options.minScore())
				.limit(options.topK())
				.toList();
		if (hits.isEmpty() || hits.get(0).score() < options.notFoundThreshold()) {
			return SearchResult.notFound(catalog.categories());
		}
		double best = hits.get(0).score();
		if (best >= options.highThreshold()) {
			List<CatalogItem> confident = hits.stream()
					.filter(hit -> hit.score() >= options.highThreshold())
					.map(SimilarityIndex.ScoredItem::item)
					.toList();
			return SearchResult.similarity(confident, best, false);
		}
		List<CatalogItem> candidates = hits.stream().map(SimilarityIndex.ScoredItem::item).toList();
		return SearchResult.similarity(candidates, best, true);
	}
}
