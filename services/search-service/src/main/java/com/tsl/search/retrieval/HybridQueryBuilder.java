package com.tsl.search.retrieval;

import com.tsl.search.model.FilterSet;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class HybridQueryBuilder {
    static final String SELECT_COLUMNS = "id, full_name, email, phone, professional_title, years_experience, location, "
        + "spoken_languages, skills, tools, projects, work_history, education, certifications, summary_generated";
    static final String RECENCY_ORDER = "ORDER BY created_at DESC";
    static final String VECTOR_DISTANCE = "embedding <=> ?::vector";

    private final RetrievalProperties properties;

    public HybridQueryBuilder(RetrievalProperties properties) {
        this.properties = properties;
    }

    /**
     * Builds the filter + similarity query.
     *
     * @param queryVector query embedding, or {@code null} to order by recency
     */
    public HybridQuery build(FilterSet filters, List<Double> queryVector, int limit) {
        FilterSet resolved = filters == null ? FilterSet.none() : filters;
        List<String> predicates = new ArrayList<>();
        List<Object> filterArgs = new ArrayList<>();

        resolved.getLocation().ifPresent(location -> {
            predicates.add("location = ?");
            filterArgs.add(location);
        });
        resolved.getMinExperience().ifPresent(minExperience -> {
            predicates.add("years_experience >= ?");
            filterArgs.add(minExperience);
        });

        String vectorLiteral = null;
        String similarity = "0";
        String orderBy = RECENCY_ORDER;
        if (queryVector != null && !queryVector.isEmpty()) {
            vectorLiteral = toVectorLiteral(queryVector);
            similarity = "1 - (" + VECTOR_DISTANCE + ")";
            orderBy = "ORDER BY " + VECTOR_DISTANCE;
        }

        StringBuilder sql = new StringBuilder();
        sql.append("SELECT ").append(SELECT_COLUMNS).append(", ").append(similarity).append(" AS similarity ");
        sql.append("FROM ").append(properties.getTable()).append(' ');
        if (!predicates.isEmpty()) {
            sql.append("WHERE ").append(String.join(" AND ", predicates)).append(' ');
        }
        sql.append(orderBy).append(' ');
        sql.append("LIMIT ?");

        return new HybridQuery(
            sql.toString(),
            predicates,
            filterArgs,
            vectorLiteral,
            similarity,
            orderBy,
            Math.max(1, limit)
        );
    }

    static String toVectorLiteral(List<Double> vector) {
        StringBuilder builder = new StringBuilder(vector.size() * 12);
        builder.append('[');
        for (int i = 0; i < vector.size(); i++) {
            if (i > 0) {
                builder.append(',');
            }
            Double value = vector.get(i);
            builder.append(value == null ? 0.0 : value);
        }
        builder.append(']');
        return builder.toString();
    }
}
