package com.registry.api.rest;

import com.registry.core.model.Page;

import java.util.List;
import java.util.function.Function;

public record PageResponse<T>(
    List<T> items,
    long total,
    int page,
    int limit,
    int totalPages
) {
    public static <S, T> PageResponse<T> from(Page<S> page, Function<? super S, ? extends T> mapper) {
        Page<T> mapped = page.map(mapper);
        return new PageResponse<>(mapped.items(), mapped.total(), mapped.page(), mapped.limit(), mapped.totalPages());
    }
}
