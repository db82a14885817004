package com.tsl.search.ranking;

import com.tsl.search.ranking.dto.ScoreRequest;
import com.tsl.search.ranking.dto.ScoreResponse;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Scores query/document pairs on a model-inference server ({@code POST /v1/score}).
 */
public class CrossEncoderGateway implements RerankModel {
    private final RestTemplate restTemplate;
    private final RankingProperties properties;

    public CrossEncoderGateway(RestTemplate restTemplate, RankingProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    @Override
    public String modelId() {
        return properties.getModel();
    }

    @Override
    public List<Double> predict(List<ScoringPair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            return List.of();
        }
        if (properties.getBaseUrl() == null || properties.getBaseUrl().isBlank()) {
            throw new RankingUnavailableException("rerank_base_url_missing");
        }

        ScoreRequest request = new ScoreRequest();
        request.setModel(properties.getModel());
        List<ScoreRequest.Pair> requestPairs = new ArrayList<>(pairs.size());
        for (int i = 0; i < pairs.size(); i++) {
            ScoringPair pair = pairs.get(i);
            ScoreRequest.Pair item = new ScoreRequest.Pair();
            item.setPairId(String.valueOf(i));
            item.setQuery(pair.query() == null ? "" : pair.query());
            item.setDoc(pair.text() == null ? "" : pair.text());
            requestPairs.add(item);
        }
        request.setPairs(requestPairs);
        ScoreRequest.Options options = new ScoreRequest.Options();
        options.setTimeoutMs(properties.getTimeoutMs());
        request.setOptions(options);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<ScoreRequest> entity = new HttpEntity<>(request, headers);

        ScoreResponse body;
        try {
            ResponseEntity<ScoreResponse> response = restTemplate.exchange(
                buildUrl("/v1/score"),
                HttpMethod.POST,
                entity,
                ScoreResponse.class
            );
            body = response.getBody();
        } catch (ResourceAccessException e) {
            throw new RankingUnavailableException("rerank_unavailable", e);
        } catch (HttpStatusCodeException e) {
            throw new RankingUnavailableException("rerank_http_" + e.getStatusCode().value(), e);
        }
        if (body == null || body.getScores() == null) {
            throw new RankingUnavailableException("rerank_empty_response");
        }
        if (body.getScores().size() != pairs.size()) {
            throw new RankingUnavailableException("rerank_score_count_mismatch");
        }
        return body.getScores();
    }

    private String buildUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + path;
    }
}
