package tech.idmirror.platform.common;

import java.util.List;
import java.util.function.Function;

/**
 * Cursor-based page of results.
 *
 * <pre>{@code
 * Page<AuditEventRecord> page = auditEvents.findPage(orgId, null, 50);
 * while (page.hasMore()) {
 *     process(page.items());
 *     page = auditEvents.findPage(orgId, page.nextCursor(), 50);
 * }
 * }</pre>
 *
 * @param <T> item type
 * @param items the items on this page
 * @param nextCursor cursor for the next page, or null if there is none
 * @param hasMore whether more items follow this page
 */
public record Page<T>(
    List<T> items,
    String nextCursor,
    boolean hasMore
) {

    public static <T> Page<T> empty() {
        return new Page<>(List.of(), null, false);
    }

    /**
     * Build a page from a query that fetched {@code limit + 1} rows; the extra row only
     * signals that another page exists.
     */
    public static <T> Page<T> of(List<T> items, int limit, Function<T, String> cursorExtractor) {
        if (items == null || items.isEmpty()) {
            return empty();
        }

        boolean hasMore = items.size() > limit;
        List<T> pageItems = hasMore ? List.copyOf(items.subList(0, limit)) : List.copyOf(items);
        String cursor = hasMore && !pageItems.isEmpty()
            ? cursorExtractor.apply(pageItems.get(pageItems.size() - 1))
            : null;

        return new Page<>(pageItems, cursor, hasMore);
    }
}
