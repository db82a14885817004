package com.tsl.search.evaluation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.model.FilterSet;
import com.tsl.search.ranking.CandidateReranker;
import com.tsl.search.ranking.CandidateTextBuilder;
import com.tsl.search.ranking.RankingProperties;
import com.tsl.search.ranking.RerankModel;
import com.tsl.search.resilience.SearchResilienceProperties;
import com.tsl.search.resilience.SearchResilienceRegistry;
import com.tsl.search.retrieval.CandidateRepository;
import com.tsl.search.retrieval.CandidateRetriever;
import com.tsl.search.retrieval.CandidateRowDecoder;
import com.tsl.search.retrieval.HybridQueryBuilder;
import com.tsl.search.retrieval.ProfileSectionDecoder;
import com.tsl.search.retrieval.RetrievalProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class RerankEvaluatorTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private EmbeddingProvider embeddingProvider;

    @Mock
    private RerankModel rerankModel;

    private ExecutorService executorService;
    private RerankEvaluator evaluator;

    @BeforeEach
    void setUp() {
        executorService = Executors.newSingleThreadExecutor();
        RetrievalProperties retrievalProperties = new RetrievalProperties();
        CandidateRetriever retriever = new CandidateRetriever(
            new HybridQueryBuilder(retrievalProperties),
            new CandidateRepository(jdbcTemplate),
            new CandidateRowDecoder(new ProfileSectionDecoder(new ObjectMapper())),
            embeddingProvider,
            retrievalProperties
        );
        RankingProperties rankingProperties = new RankingProperties();
        rankingProperties.setTimeoutMs(500);
        lenient().when(rerankModel.modelId()).thenReturn("test-model");
        CandidateReranker reranker = new CandidateReranker(
            rerankModel,
            new CandidateTextBuilder(rankingProperties),
            executorService,
            new SearchResilienceRegistry(new SearchResilienceProperties()),
            rankingProperties
        );
        evaluator = new RerankEvaluator(retriever, reranker);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    void reportsRetrievalAloneAgainstRetrievalPlusRerank() {
        when(embeddingProvider.embed("kafka streaming")).thenReturn(List.of(0.1, 0.2));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(
            row("c1", 0.9),
            row("c2", 0.8),
            row("c3", 0.7),
            row("c4", 0.6)
        ));
        when(rerankModel.predict(anyList())).thenReturn(List.of(0.1, 0.2, 0.9, 0.3));

        RerankEvaluationReport report = evaluator.evaluate(
            List.of(new JudgedQuery("kafka streaming", FilterSet.none(), List.of("c3"))),
            2
        );

        assertThat(report.getQueryCount()).isEqualTo(1);
        assertThat(report.getDetailedWithoutReranker().get(0).retrieved()).containsExactly("c1", "c2");
        assertThat(report.getDetailedWithReranker().get(0).retrieved()).containsExactly("c3", "c4");
        assertThat(report.getWithoutReranker()).containsEntry("precision@1", 0.0).containsEntry("mrr", 0.0);
        assertThat(report.getWithReranker()).containsEntry("precision@1", 1.0).containsEntry("mrr", 1.0);
        assertThat(report.getWithReranker().get("map@5")).isCloseTo(1.0, within(1e-9));
        assertThat(report.getImprovementsPercent()).containsEntry("mrr", 0.0);
        assertThat(report.getWithReranker().keySet()).containsExactly(
            "precision@1", "recall@1", "ndcg@1",
            "precision@3", "recall@3", "ndcg@3",
            "precision@5", "recall@5", "ndcg@5",
            "mrr", "map@5"
        );
    }

    @Test
    void improvementIsRelativeToBaseline() {
        when(embeddingProvider.embed("python")).thenReturn(List.of(0.1));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(
            row("a", 0.9),
            row("b", 0.8)
        ));
        when(rerankModel.predict(anyList())).thenReturn(List.of(0.2, 0.7));

        RerankEvaluationReport report = evaluator.evaluate(
            List.of(new JudgedQuery("python", FilterSet.none(), List.of("b"))),
            2
        );

        assertThat(report.getWithoutReranker().get("mrr")).isCloseTo(0.5, within(1e-9));
        assertThat(report.getWithReranker().get("mrr")).isCloseTo(1.0, within(1e-9));
        assertThat(report.getImprovementsPercent().get("mrr")).isCloseTo(100.0, within(1e-9));
    }

    @Test
    void queryWithoutTextSkipsReranker() {
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(row("c1", 0.0)));

        RerankEvaluationReport report = evaluator.evaluate(
            List.of(new JudgedQuery(" ", FilterSet.location("Berlin"), List.of("c1"))),
            3
        );

        assertThat(report.getDetailedWithReranker()).isEqualTo(report.getDetailedWithoutReranker());
        assertThat(report.getWithReranker()).isEqualTo(report.getWithoutReranker());
        verifyNoInteractions(embeddingProvider);
        verify(rerankModel, never()).predict(anyList());
    }

    @Test
    void noQueriesYieldZeroedMetrics() {
        RerankEvaluationReport report = evaluator.evaluate(List.of(), 5);

        assertThat(report.getQueryCount()).isZero();
        assertThat(report.getWithoutReranker().values()).allMatch(value -> value == 0.0);
        verifyNoInteractions(jdbcTemplate);
    }

    private static Map<String, Object> row(String id, double similarity) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("full_name", "Candidate " + id);
        row.put("professional_title", "Backend Engineer");
        row.put("years_experience", 4);
        row.put("location", "Berlin");
        row.put("skills", "[\"Kafka\",\"Python\"]");
        row.put("similarity", similarity);
        return row;
    }
}
