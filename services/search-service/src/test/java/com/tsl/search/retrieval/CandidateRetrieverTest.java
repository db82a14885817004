package com.tsl.search.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.embed.EmbeddingProvider;
import com.tsl.search.embed.EmbeddingUnavailableException;
import com.tsl.search.model.FilterSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class CandidateRetrieverTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    @Mock
    private EmbeddingProvider embeddingProvider;

    private CandidateRetriever retriever;

    @BeforeEach
    void setUp() {
        RetrievalProperties properties = new RetrievalProperties();
        ProfileSectionDecoder sectionDecoder = new ProfileSectionDecoder(new ObjectMapper());
        retriever = new CandidateRetriever(
            new HybridQueryBuilder(properties),
            new CandidateRepository(jdbcTemplate),
            new CandidateRowDecoder(sectionDecoder),
            embeddingProvider,
            properties
        );
    }

    @Test
    void overFetchesFourTimesTopKForQueries() {
        when(embeddingProvider.embed("backend engineer")).thenReturn(List.of(0.1, 0.2));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(row("c1", 0.9)));

        RetrievalResult result = retriever.retrieve("backend engineer", FilterSet.none(), 5);

        ArgumentCaptor<Object[]> argsCaptor = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).queryForList(anyString(), argsCaptor.capture());
        Object[] args = argsCaptor.getValue();
        assertEquals(20, args[args.length - 1]);
        assertEquals(20, result.getRequestedLimit());
        assertEquals(1, result.getCandidates().size());
        assertEquals(0.9, result.getCandidates().get(0).getSimilarity());
    }

    @Test
    void fetchesExactlyTopKWithoutQuery() {
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of());

        RetrievalResult result = retriever.retrieve(null, FilterSet.location("Lisbon"), 5);

        ArgumentCaptor<String> sqlCaptor = ArgumentCaptor.forClass(String.class);
        ArgumentCaptor<Object[]> argsCaptor = ArgumentCaptor.forClass(Object[].class);
        verify(jdbcTemplate).queryForList(sqlCaptor.capture(), argsCaptor.capture());
        assertTrue(sqlCaptor.getValue().contains("ORDER BY created_at DESC"));
        assertEquals(List.of("Lisbon", 5), List.of(argsCaptor.getValue()));
        verifyNoInteractions(embeddingProvider);
        assertFalse(result.isError());
        assertTrue(result.isEmpty());
    }

    @Test
    void embeddingFailureSkipsStoreAndReturnsEmpty() {
        when(embeddingProvider.embed(anyString())).thenThrow(new EmbeddingUnavailableException("embed_timeout"));

        RetrievalResult result = retriever.retrieve("data scientist", FilterSet.none(), 5);

        assertTrue(result.isSkipped());
        assertTrue(result.isEmpty());
        assertEquals("embed_unavailable", result.getReason());
        verify(jdbcTemplate, never()).queryForList(anyString(), any(Object[].class));
    }

    @Test
    void storeFailureYieldsEmptyError() {
        when(embeddingProvider.embed(anyString())).thenReturn(List.of(0.3));
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class)))
            .thenThrow(new QueryTimeoutException("statement timeout"));

        RetrievalResult result = retriever.retrieve("designer", FilterSet.none(), 3);

        assertTrue(result.isError());
        assertFalse(result.isSkipped());
        assertTrue(result.isEmpty());
        assertEquals("store_unavailable", result.getReason());
        assertEquals(12, result.getRequestedLimit());
    }

    @Test
    void malformedJsonFieldDegradesWithoutDroppingRow() {
        Map<String, Object> row = row("c2", 0.0);
        row.put("skills", "{not json");
        row.put("work_history", "[{\"position\":\"Engineer\",\"company\":\"Acme\"}]");
        when(jdbcTemplate.queryForList(anyString(), any(Object[].class))).thenReturn(List.of(row));

        RetrievalResult result = retriever.retrieve(null, FilterSet.none(), 1);

        assertEquals(1, result.getCandidates().size());
        assertTrue(result.getCandidates().get(0).getSkills().isEmpty());
        assertEquals("Engineer - Acme", result.getCandidates().get(0).getWorkHistory().format(List.of("position", "company")));
    }

    private static Map<String, Object> row(String id, double similarity) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("full_name", "Candidate " + id);
        row.put("professional_title", "Engineer");
        row.put("years_experience", 4);
        row.put("location", "Lisbon");
        row.put("skills", "[\"Java\",\"SQL\"]");
        row.put("similarity", similarity);
        return row;
    }
}
