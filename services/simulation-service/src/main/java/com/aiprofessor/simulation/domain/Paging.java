package com.aiprofessor.simulation.domain;

/**
 * Normalised page request: pages start at 1, the limit defaults to 10 and is capped at 100.
 */
public record Paging(int page, int limit) {

    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public Paging {
        if (page < 1) {
            page = 1;
        }
        if (limit < 1) {
            limit = DEFAULT_LIMIT;
        }
        if (limit > MAX_LIMIT) {
            limit = MAX_LIMIT;
        }
    }

    public static Paging of(Integer page, Integer limit) {
        return new Paging(page == null ? 1 : page, limit == null ? DEFAULT_LIMIT : limit);
    }

    /** Number of items before this page. */
    public long offset() {
        return (long) (page - 1) * limit;
    }
}
