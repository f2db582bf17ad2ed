package org.javai.orderflow.catalog;

import java.util.List;

/**
 * Semantic lookup over catalog items, used as the last stage of a search.
 *
 * <p>Implementations may block (embedding calls); callers invoke them synchronously.</p>
 */
public interface SimilarityIndex {

	/**
	 * Returns the best matches for a query, highest score first.
	 *
	 * @param query raw customer text
	 * @param topK maximum number of hits
	 * @return scored hits, possibly empty
	 */
	List<ScoredItem> search(String query, int topK);

	/**
	 * A catalog item with its similarity score (inner product of normalized embeddings).
	 */
	record ScoredItem(CatalogItem item, double score) {
	}
}
