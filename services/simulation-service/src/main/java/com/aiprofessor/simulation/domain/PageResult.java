package com.aiprofessor.simulation.domain;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * One page of results with the total count behind it.
 */
public record PageResult<T>(List<T> items, Paging paging, long total) {

    public PageResult {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return (int) ((total + paging.limit() - 1) / paging.limit());
    }

    public boolean hasNext() {
        return paging.page() < totalPages();
    }

    public boolean hasPrev() {
        return paging.page() > 1;
    }

    public <R> PageResult<R> map(Function<T, R> mapper) {
        return new PageResult<>(items.stream().map(mapper).collect(Collectors.toList()), paging, total);
    }
}
