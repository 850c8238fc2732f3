package com.registry.core.model;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a filtered, ordered result set. Pages are numbered from 1.
 */
public record Page<T>(
    List<T> items,
    long total,
    int page,
    int limit
) {
    public Page {
        items = List.copyOf(items);
    }

    public int totalPages() {
        return limit <= 0 ? 0 : (int) ((total + limit - 1) / limit);
    }

    /**
     * Cut one page out of an already filtered and ordered list.
     */
    public static <T> Page<T> slice(List<T> ordered, int page, int limit) {
        int from = (int) Math.min((long) (page - 1) * limit, ordered.size());
        int to = Math.min(from + limit, ordered.size());
        return new Page<>(ordered.subList(from, to), ordered.size(), page, limit);
    }

    public <R> Page<R> map(Function<? super T, ? extends R> mapper) {
        return new Page<>(items.stream().<R>map(mapper).toList(), total, page, limit);
    }
}
