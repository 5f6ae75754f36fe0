package io.terraform.tfe;

/**
 * List options for endpoints that only support pagination.
 */
public final class PageOptions extends ListOptions<PageOptions> {

    public static PageOptions page(int number, int size) {
        return new PageOptions().pageNumber(number).pageSize(size);
    }

    @Override
    protected PageOptions self() {
        return this;
    }
}
