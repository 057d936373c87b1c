package org.springaicommunity.gitea.migrator;

import java.util.List;

/**
 * Provider capability behind a {@link PagedSequence}: returns the items of one page.
 *
 * @param <T> the item type
 */
@FunctionalInterface
public interface PageFetcher<T> {

	/**
	 * Fetch a single page.
	 * @param page the 1-based page number
	 * @return the items of the page, empty when there are no more items
	 */
	List<T> fetchPage(int page);

}
