package com.tsl.search.retrieval;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameterized candidate query. {@link #getArgs()} is bound in placeholder order: similarity vector,
 * filter values, ordering vector, limit. The vector entries are only present for similarity queries.
 */
public class HybridQuery {
    private final String sql;
    private final List<String> predicates;
    private final List<Object> filterArgs;
    private final String vectorLiteral;
    private final String similarityExpression;
    private final String orderBy;
    private final int limit;

    HybridQuery(
        String sql,
        List<String> predicates,
        List<Object> filterArgs,
        String vectorLiteral,
        String similarityExpression,
        String orderBy,
        int limit
    ) {
        this.sql = sql;
        this.predicates = List.copyOf(predicates);
        this.filterArgs = List.copyOf(filterArgs);
        this.vectorLiteral = vectorLiteral;
        this.similarityExpression = similarityExpression;
        this.orderBy = orderBy;
        this.limit = limit;
    }

    public String getSql() {
        return sql;
    }

    public List<String> getPredicates() {
        return predicates;
    }

    public List<Object> getFilterArgs() {
        return filterArgs;
    }

    public String getVectorLiteral() {
        return vectorLiteral;
    }

    public boolean isSimilarityQuery() {
        return vectorLiteral != null;
    }

    public String getSimilarityExpression() {
        return similarityExpression;
    }

    public String getOrderBy() {
        return orderBy;
    }

    public int getLimit() {
        return limit;
    }

    public List<Object> getArgs() {
        List<Object> args = new ArrayList<>(filterArgs.size() + 3);
        if (vectorLiteral != null) {
            args.add(vectorLiteral);
        }
        args.addAll(filterArgs);
        if (vectorLiteral != null) {
            args.add(vectorLiteral);
        }
        args.add(limit);
        return args;
    }
}
