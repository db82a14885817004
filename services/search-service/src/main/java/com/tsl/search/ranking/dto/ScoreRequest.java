package com.tsl.search.ranking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public class ScoreRequest {
    private String model;
    private String task = "cross_encoder";
    private List<Pair> pairs;
    private Options options;

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    public String getTask() {
        return task;
    }

    public void setTask(String task) {
        this.task = task;
    }

    public List<Pair> getPairs() {
        return pairs;
    }

    public void setPairs(List<Pair> pairs) {
        this.pairs = pairs;
    }

    public Options getOptions() {
        return options;
    }

    public void setOptions(Options options) {
        this.options = options;
    }

    public static class Pair {
        @JsonProperty("pair_id")
        private String pairId;

        private String query;
        private String doc;

        public String getPairId() {
            return pairId;
        }

        public void setPairId(String pairId) {
            this.pairId = pairId;
        }

        public String getQuery() {
            return query;
        }

        public void setQuery(String query) {
            this.query = query;
        }

        public String getDoc() {
            return doc;
        }

        public void setDoc(String doc) {
            this.doc = doc;
        }
    }

    public static class Options {
        @JsonProperty("timeout_ms")
        private Integer timeoutMs;

        public Integer getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(Integer timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
