package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.PageResult;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.function.Function;

/** A page of items with the pagination block shared by the list endpoints. */
public record PageResponse<T>(
        @JsonProperty("items") List<T> items, @JsonProperty("pagination") Pagination pagination) {

    public record Pagination(
            @JsonProperty("page") int page,
            @JsonProperty("limit") int limit,
            @JsonProperty("total") long total,
            @JsonProperty("total_pages") int totalPages,
            @JsonProperty("has_next") boolean hasNext,
            @JsonProperty("has_prev") boolean hasPrev) {}

    public static <S, T> PageResponse<T> of(PageResult<S> result, Function<S, T> mapper) {
        PageResult<T> mapped = result.map(mapper);
        return new PageResponse<>(
                mapped.items(),
                new Pagination(
                        result.paging().page(),
                        result.paging().limit(),
                        result.total(),
                        result.totalPages(),
                        result.hasNext(),
                        result.hasPrev()));
    }
}
