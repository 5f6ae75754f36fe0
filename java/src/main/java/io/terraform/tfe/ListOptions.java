package io.terraform.tfe;

/**
 * Pagination options shared by every list operation. Zero values are left out of the query, letting the server
 * apply its defaults.
 *
 * @param <S> concrete options type, so fluent setters keep returning it.
 */
public abstract class ListOptions<S extends ListOptions<S>> implements QueryOptions {

    private int pageNumber;
    private int pageSize;

    public int getPageNumber() {
        return pageNumber;
    }

    public int getPageSize() {
        return pageSize;
    }

    public S pageNumber(int pageNumber) {
        this.pageNumber = pageNumber;
        return self();
    }

    public S pageSize(int pageSize) {
        this.pageSize = pageSize;
        return self();
    }

    protected abstract S self();

    @Override
    public void appendTo(QueryValues values) {
        values.add("page[number]", pageNumber);
        values.add("page[size]", pageSize);
    }
}
