package com.tsl.search.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Exact-match and range filters applied before similarity ranking.
 *
 * <p>Presence is explicit: a filter is either present with a value or absent. A blank location is
 * treated as absent; any other location is matched exactly as given, whitespace included.
 * {@code min_experience = 0} is a real lower bound (it excludes profiles with unknown experience).
 */
public final class FilterSet {
    public static final String LOCATION = "location";
    public static final String MIN_EXPERIENCE = "min_experience";

    private static final FilterSet NONE = new FilterSet(null, null);

    private final String location;
    private final Integer minExperience;

    private FilterSet(String location, Integer minExperience) {
        this.location = location;
        this.minExperience = minExperience;
    }

    public static FilterSet none() {
        return NONE;
    }

    public static FilterSet of(String location, Integer minExperience) {
        String normalizedLocation = location == null || location.isBlank() ? null : location;
        if (minExperience != null && minExperience < 0) {
            throw new IllegalArgumentException("min_experience must be >= 0");
        }
        if (normalizedLocation == null && minExperience == null) {
            return NONE;
        }
        return new FilterSet(normalizedLocation, minExperience);
    }

    public static FilterSet location(String location) {
        return of(location, null);
    }

    public static FilterSet minExperience(int minExperience) {
        return of(null, minExperience);
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<Integer> getMinExperience() {
        return Optional.ofNullable(minExperience);
    }

    public boolean isEmpty() {
        return location == null && minExperience == null;
    }

    /**
     * Present filters only, keyed by wire name in lexicographic order.
     */
    public Map<String, Object> asMap() {
        Map<String, Object> map = new TreeMap<>();
        if (location != null) {
            map.put(LOCATION, location);
        }
        if (minExperience != null) {
            map.put(MIN_EXPERIENCE, minExperience);
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FilterSet)) {
            return false;
        }
        FilterSet that = (FilterSet) o;
        return Objects.equals(location, that.location) && Objects.equals(minExperience, that.minExperience);
    }

    @Override
    public int hashCode() {
        return Objects.hash(location, minExperience);
    }

    @Override
    public String toString() {
        return "FilterSet" + asMap();
    }
}
