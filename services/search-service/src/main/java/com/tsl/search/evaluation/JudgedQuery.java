package com.tsl.search.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tsl.search.model.FilterSet;
import java.util.ArrayList;
import java.util.List;

/**
 * A query with the candidate ids a reviewer marked as relevant for it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JudgedQuery {
    private String query;
    private String description;
    private Filters filters;

    @JsonProperty("relevant_candidates")
    private List<String> relevantCandidates = new ArrayList<>();

    public JudgedQuery() {
    }

    public JudgedQuery(String query, FilterSet filters, List<String> relevantCandidates) {
        this.query = query;
        this.filters = Filters.from(filters);
        this.relevantCandidates = relevantCandidates == null ? new ArrayList<>() : new ArrayList<>(relevantCandidates);
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Filters getFilters() {
        return filters;
    }

    public void setFilters(Filters filters) {
        this.filters = filters;
    }

    public List<String> getRelevantCandidates() {
        return relevantCandidates;
    }

    public void setRelevantCandidates(List<String> relevantCandidates) {
        this.relevantCandidates = relevantCandidates;
    }

    @JsonIgnore
    public FilterSet toFilterSet() {
        return filters == null ? FilterSet.none() : FilterSet.of(filters.getLocation(), filters.getMinExperience());
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Filters {
        private String location;

        @JsonProperty("min_experience")
        private Integer minExperience;

        static Filters from(FilterSet filterSet) {
            Filters filters = new Filters();
            if (filterSet != null) {
                filters.setLocation(filterSet.getLocation().orElse(null));
                filters.setMinExperience(filterSet.getMinExperience().orElse(null));
            }
            return filters;
        }

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }

        public Integer getMinExperience() {
            return minExperience;
        }

        public void setMinExperience(Integer minExperience) {
            this.minExperience = minExperience;
        }
    }
}
