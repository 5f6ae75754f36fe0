package io.terraform.tfe;

import java.util.List;

/**
 * One page of resources from an endpoint that reports neighbouring pages but no totals.
 *
 * @param <T> resource model type.
 */
public final class NextPrevList<T> {

    private final List<T> items;
    private final PaginationNextPrev pagination;

    public NextPrevList(List<T> items, PaginationNextPrev pagination) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.pagination = pagination == null ? PaginationNextPrev.EMPTY : pagination;
    }

    public List<T> getItems() {
        return items;
    }

    public PaginationNextPrev getPagination() {
        return pagination;
    }

    public boolean hasNextPage() {
        return pagination.nextPage() > 0;
    }
}
