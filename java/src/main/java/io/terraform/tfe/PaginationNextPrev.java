package io.terraform.tfe;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pagination details for endpoints that skip counting the full result set.
 */
public record PaginationNextPrev(
    @JsonProperty("current-page") int currentPage,
    @JsonProperty("prev-page") int previousPage,
    @JsonProperty("next-page") int nextPage
) {

    public static final PaginationNextPrev EMPTY = new PaginationNextPrev(0, 0, 0);
}
