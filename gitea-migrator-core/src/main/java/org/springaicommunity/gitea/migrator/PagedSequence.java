package org.springaicommunity.gitea.migrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Forward-only, lazily fetched sequence over a paginated remote listing.
 *
 * <p>
 * Pages are requested one at a time in increasing page order, and only once the items of
 * the previous page have been consumed. An empty page is the only termination signal; no
 * total count or "has more" flag is consulted, because some providers never return one.
 *
 * <p>
 * A sequence can be iterated once. Errors thrown by the {@link PageFetcher} propagate to
 * the caller and end the iteration.
 *
 * <pre>
 * {@code
 * PagedSequence<Label> labels = PagedSequence.of(page -> restService.listLabels(projectId, page, 100));
 * for (Label label : labels) {
 *     ...
 * }
 * }
 * </pre>
 *
 * @param <T> the item type
 */
public final class PagedSequence<T> implements Iterable<T> {

	private static final Logger logger = LoggerFactory.getLogger(PagedSequence.class);

	private final PageFetcher<T> fetcher;

	private final int startPage;

	private boolean iterated;

	private int requestCount;

	private PagedSequence(PageFetcher<T> fetcher, int startPage) {
		if (startPage < 1) {
			throw new IllegalArgumentException("Page numbering starts at 1 (got: " + startPage + ")");
		}
		this.fetcher = fetcher;
		this.startPage = startPage;
	}

	/**
	 * Create a sequence starting at page 1.
	 * @param fetcher the page provider
	 * @param <T> the item type
	 * @return a new sequence
	 */
	public static <T> PagedSequence<T> of(PageFetcher<T> fetcher) {
		return new PagedSequence<>(fetcher, 1);
	}

	/**
	 * Create a sequence resuming at the given page.
	 * @param startPage the first page to request (1-based)
	 * @param fetcher the page provider
	 * @param <T> the item type
	 * @return a new sequence
	 */
	public static <T> PagedSequence<T> startingAt(int startPage, PageFetcher<T> fetcher) {
		return new PagedSequence<>(fetcher, startPage);
	}

	/**
	 * Number of page requests issued so far, including the final empty page.
	 */
	public int getRequestCount() {
		return requestCount;
	}

	@Override
	public Iterator<T> iterator() {
		if (iterated) {
			throw new IllegalStateException("A paged sequence can only be iterated once");
		}
		iterated = true;
		return new PageIterator();
	}

	/**
	 * Drain the whole sequence into a list.
	 * @return all items in page order
	 */
	public List<T> toList() {
		List<T> items = new ArrayList<>();
		for (T item : this) {
			items.add(item);
		}
		return items;
	}

	/**
	 * Drain the whole sequence into a lookup table. When two items share a key the last one
	 * wins.
	 * @param keyExtractor function producing the identity key of an item
	 * @return table in page order
	 */
	public Map<String, T> toTable(Function<T, String> keyExtractor) {
		Map<String, T> table = new LinkedHashMap<>();
		for (T item : this) {
			table.put(keyExtractor.apply(item), item);
		}
		return table;
	}

	private final class PageIterator implements Iterator<T> {

		private List<T> page = List.of();

		private int position;

		private int nextPage = startPage;

		private boolean exhausted;

		@Override
		public boolean hasNext() {
			while (!exhausted && position >= page.size()) {
				page = fetcher.fetchPage(nextPage);
				requestCount++;
				logger.debug("Fetched page {} ({} items)", nextPage, page.size());
				nextPage++;
				position = 0;
				if (page.isEmpty()) {
					exhausted = true;
				}
			}
			return !exhausted;
		}

		@Override
		public T next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return page.get(position++);
		}

	}

}
