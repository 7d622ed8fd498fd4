package io.nimbusio.webserver.api.model;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a listing. {@code truncated} is true if and only if more entries exist after the last one returned.
 */
public final class PaginatedList<T> {

    private final ImmutableList<T> items;
    private final boolean truncated;

    public PaginatedList(List<T> items, boolean truncated) {
        this.items = ImmutableList.copyOf(items);
        this.truncated = truncated;
    }

    /**
     * Build a page from a list that was fetched with one extra element beyond {@code limit}.
     */
    public static <T> PaginatedList<T> fromOverfetched(List<T> fetched, int limit) {
        if (fetched.size() > limit) {
            return new PaginatedList<>(fetched.subList(0, limit), true);
        }
        return new PaginatedList<>(fetched, false);
    }

    public List<T> getItems() {
        return items;
    }

    public boolean isTruncated() {
        return truncated;
    }

    public <R> PaginatedList<R> map(Function<? super T, ? extends R> mapper) {
        final ImmutableList.Builder<R> builder = ImmutableList.builder();
        items.forEach(item -> builder.add(mapper.apply(item)));
        return new PaginatedList<>(builder.build(), truncated);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
                .add("items", items.size())
                .add("truncated", truncated)
                .toString();
    }
}
