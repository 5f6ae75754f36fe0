package io.terraform.tfe;

import java.util.List;

/**
 * One page of resources in server order, with its pagination details.
 *
 * @param <T> resource model type.
 */
public final class ResourceList<T> {

    private final List<T> items;
    private final Pagination pagination;

    public ResourceList(List<T> items, Pagination pagination) {
        this.items = items == null ? List.of() : List.copyOf(items);
        this.pagination = pagination == null ? Pagination.EMPTY : pagination;
    }

    public List<T> getItems() {
        return items;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public int getCurrentPage() {
        return pagination.currentPage();
    }

    public int getTotalCount() {
        return pagination.totalCount();
    }

    public boolean hasNextPage() {
        return pagination.nextPage() > 0;
    }
}
