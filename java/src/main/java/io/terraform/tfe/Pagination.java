package io.terraform.tfe;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Pagination details of a list response, including totals.
 */
public record Pagination(
    @JsonProperty("current-page") int currentPage,
    @JsonProperty("prev-page") int previousPage,
    @JsonProperty("next-page") int nextPage,
    @JsonProperty("total-count") int totalCount,
    @JsonProperty("total-pages") int totalPages
) {

    public static final Pagination EMPTY = new Pagination(0, 0, 0, 0, 0);
}
