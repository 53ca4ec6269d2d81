package com.chicu.aiforecast.ml.tuning.space;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Упорядоченный неизменяемый набор гиперпараметров.
 * Валидируется при создании, после этого не меняется.
 */
public final class SearchSpace {

    private final Map<String, ParamSpaceItem> items;

    private SearchSpace(Map<String, ParamSpaceItem> items) {
        this.items = Collections.unmodifiableMap(items);
    }

    public static SearchSpace of(ParamSpaceItem... items) {
        return of(items == null ? null : List.of(items));
    }

    public static SearchSpace of(List<ParamSpaceItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidSearchSpaceException("ParamSpace: пустое пространство");
        }

        Map<String, ParamSpaceItem> ordered = new LinkedHashMap<>();
        for (ParamSpaceItem item : items) {
            ParamSpaceValidator.validateOrThrow(item);
            if (item.values() != null) {
                item = item.toBuilder().values(List.copyOf(item.values())).build();
            }
            if (ordered.putIfAbsent(item.name(), item) != null) {
                throw new InvalidSearchSpaceException("ParamSpace: дубль параметра " + item.name());
            }
        }
        return new SearchSpace(ordered);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, ParamSpaceItem> asMap() {
        return items;
    }

    public List<ParamSpaceItem> items() {
        return List.copyOf(items.values());
    }

    public int size() {
        return items.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchSpace other)) return false;
        return items().equals(other.items());
    }

    @Override
    public int hashCode() {
        return items().hashCode();
    }

    @Override
    public String toString() {
        return "SearchSpace" + items.keySet();
    }

    public static final class Builder {

        private final List<ParamSpaceItem> items = new ArrayList<>();

        private Builder() {}

        public Builder intRange(String name, int min, int max) {
            items.add(ParamSpaceItem.intRange(name, min, max));
            return this;
        }

        public Builder floatRange(String name, double min, double max) {
            items.add(ParamSpaceItem.floatRange(name, min, max));
            return this;
        }

        public Builder categorical(String name, Object... values) {
            items.add(ParamSpaceItem.categorical(name, values));
            return this;
        }

        public SearchSpace build() {
            return SearchSpace.of(items);
        }
    }
}
