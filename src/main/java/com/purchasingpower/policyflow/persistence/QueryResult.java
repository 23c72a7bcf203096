package com.purchasingpower.policyflow.persistence;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Envelope returned by {@link PersistenceGateway#query}; queries never throw.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResult {

    public enum Status {
        OK,
        /**
         * The store failed or was empty and a built-in reference dataset was returned.
         */
        DEFAULTED,
        ERROR
    }

    private Status status;

    @Builder.Default
    private List<Map<String, Object>> data = new ArrayList<>();

    private String message;

    /**
     * Backend that answered: "jpa", "memory" or "defaults".
     */
    private String source;

    public static QueryResult ok(List<Map<String, Object>> data, String source) {
        return QueryResult.builder().status(Status.OK).data(data).source(source).build();
    }

    public static QueryResult defaulted(List<Map<String, Object>> data, String message) {
        return QueryResult.builder().status(Status.DEFAULTED).data(data).message(message).source("defaults").build();
    }

    public static QueryResult error(String message) {
        return QueryResult.builder().status(Status.ERROR).message(message).build();
    }

    public boolean isSuccess() {
        return status != Status.ERROR;
    }
}
