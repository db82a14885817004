package com.tsl.search.embed;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class EmbeddingGatewayTest {

    @Test
    void restoresInputOrderAndSplitsBatches() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingProperties properties = properties();
        properties.setBatchSize(2);
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties);

        server.expect(requestTo("http://embed.local/v1/embeddings"))
            .andExpect(method(POST))
            .andExpect(header("Authorization", "Bearer secret"))
            .andRespond(withSuccess(
                "{\"data\":[{\"index\":1,\"embedding\":[0.2]},{\"index\":0,\"embedding\":[0.1]}]}",
                MediaType.APPLICATION_JSON
            ));
        server.expect(requestTo("http://embed.local/v1/embeddings"))
            .andRespond(withSuccess("{\"data\":[{\"index\":0,\"embedding\":[0.3]}]}", MediaType.APPLICATION_JSON));

        List<List<Double>> vectors = gateway.embedBatch(List.of("a", "b", "c"));

        assertThat(vectors).containsExactly(List.of(0.1), List.of(0.2), List.of(0.3));
        server.verify();
    }

    @Test
    void httpErrorIsNotRetried() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://embed.local/v1/embeddings")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> gateway.embedBatch(List.of("query")))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_http_429");
        server.verify();
    }

    @Test
    void malformedBodyIsReportedAsUnavailable() {
        RestTemplate restTemplate = new RestTemplate();
        MockRestServiceServer server = MockRestServiceServer.bindTo(restTemplate).build();
        EmbeddingGateway gateway = new EmbeddingGateway(restTemplate, properties());

        server.expect(requestTo("http://embed.local/v1/embeddings"))
            .andRespond(withSuccess("{\"data\":[{\"index\":", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> gateway.embedBatch(List.of("query")))
            .isInstanceOf(EmbeddingUnavailableException.class)
            .hasMessage("embed_bad_response");
        server.verify();
    }

    private static EmbeddingProperties properties() {
        EmbeddingProperties properties = new EmbeddingProperties();
        properties.setBaseUrl("http://embed.local");
        properties.setApiKey("secret");
        return properties;
    }
}
