package com.tsl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public class CacheInvalidateResponse {
    private String status;

    @JsonProperty("deleted_keys")
    private long deletedKeys;

    public CacheInvalidateResponse() {
    }

    public CacheInvalidateResponse(String status, long deletedKeys) {
        this.status = status;
        this.deletedKeys = deletedKeys;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public long getDeletedKeys() {
        return deletedKeys;
    }

    public void setDeletedKeys(long deletedKeys) {
        this.deletedKeys = deletedKeys;
    }
}
