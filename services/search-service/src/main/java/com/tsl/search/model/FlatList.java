package com.tsl.search.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class FlatList extends ProfileSection {
    static final FlatList EMPTY = new FlatList(List.of());

    private final List<String> items;

    @JsonCreator
    public FlatList(@JsonProperty("items") List<String> items) {
        List<String> copy = new ArrayList<>();
        if (items != null) {
            for (String item : items) {
                if (item != null && !item.isBlank()) {
                    copy.add(item.trim());
                }
            }
        }
        this.items = List.copyOf(copy);
    }

    public static FlatList of(String... items) {
        return new FlatList(List.of(items));
    }

    public List<String> getItems() {
        return items;
    }

    @Override
    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public String format(List<String> fields) {
        return String.join(", ", items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlatList)) {
            return false;
        }
        return items.equals(((FlatList) o).items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(items);
    }

    @Override
    public String toString() {
        return "FlatList" + items;
    }
}
