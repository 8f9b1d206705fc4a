package fun.fengwk.mcrawl.core.model;

import java.util.List;

/**
 * One page of a paginated platform listing.
 *
 * @param items   page items, never null
 * @param hasMore whether the platform reports further pages
 * @param cursor  opaque cursor for the next page, may be empty
 * @author fengwk
 */
public record PageResult<T>(List<T> items, boolean hasMore, String cursor) {

    public PageResult {
        items = items == null ? List.of() : List.copyOf(items);
        cursor = cursor == null ? "" : cursor;
    }

    public static <T> PageResult<T> of(List<T> items, boolean hasMore, String cursor) {
        return new PageResult<>(items, hasMore, cursor);
    }

    public static <T> PageResult<T> last(List<T> items) {
        return new PageResult<>(items, false, "");
    }

    public static <T> PageResult<T> empty() {
        return new PageResult<>(List.of(), false, "");
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

}
