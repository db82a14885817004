package com.tsl.search.embed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Client for an OpenAI-compatible {@code /v1/embeddings} endpoint. Inputs are sent in batches of
 * {@code embedding.batch-size}; failures are not retried.
 */
@Component
public class EmbeddingGateway {
    private final RestTemplate restTemplate;
    private final EmbeddingProperties properties;

    public EmbeddingGateway(
        @Qualifier("embeddingRestTemplate") RestTemplate restTemplate,
        EmbeddingProperties properties
    ) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    public List<List<Double>> embedBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new EmbeddingUnavailableException("embed_base_url_missing");
        }
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw new EmbeddingUnavailableException("embed_empty_text");
            }
        }
        int batchSize = Math.max(1, properties.getBatchSize());
        List<List<Double>> vectors = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            vectors.addAll(requestBatch(batch));
        }
        return vectors;
    }

    private List<List<Double>> requestBatch(List<String> batch) {
        EmbeddingRequest request = new EmbeddingRequest();
        request.setModel(properties.getModel());
        request.setInput(new ArrayList<>(batch));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            headers.setBearerAuth(properties.getApiKey());
        }
        HttpEntity<EmbeddingRequest> entity = new HttpEntity<>(request, headers);

        try {
            ResponseEntity<EmbeddingResponse> response = restTemplate.exchange(
                buildUrl("/v1/embeddings"),
                HttpMethod.POST,
                entity,
                EmbeddingResponse.class
            );
            EmbeddingResponse body = response.getBody();
            if (body == null || body.getData() == null || body.getData().size() != batch.size()) {
                throw new EmbeddingUnavailableException("embed_empty_response");
            }
            List<EmbeddingData> data = new ArrayList<>(body.getData());
            data.sort(Comparator.comparingInt(EmbeddingData::getIndex));
            List<List<Double>> vectors = new ArrayList<>(data.size());
            for (EmbeddingData item : data) {
                if (item.getEmbedding() == null || item.getEmbedding().isEmpty()) {
                    throw new EmbeddingUnavailableException("embed_empty_vector");
                }
                vectors.add(item.getEmbedding());
            }
            return vectors;
        } catch (ResourceAccessException e) {
            String reason = "embed_unavailable";
            if (e.getCause() instanceof java.net.SocketTimeoutException) {
                reason = "embed_timeout";
            }
            throw new EmbeddingUnavailableException(reason, e);
        } catch (HttpStatusCodeException e) {
            throw new EmbeddingUnavailableException("embed_http_" + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new EmbeddingUnavailableException("embed_bad_response", e);
        }
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingRequest {
        private String model;
        private List<String> input;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getInput() {
            return input;
        }

        public void setInput(List<String> input) {
            this.input = input;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingResponse {
        private String model;
        private List<EmbeddingData> data;

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<EmbeddingData> getData() {
            return data;
        }

        public void setData(List<EmbeddingData> data) {
            this.data = data;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingData {
        private int index;
        private List<Double> embedding;

        public int getIndex() {
            return index;
        }

        public void setIndex(int index) {
            this.index = index;
        }

        public List<Double> getEmbedding() {
            return embedding;
        }

        public void setEmbedding(List<Double> embedding) {
            this.embedding = embedding;
        }
    }
}
