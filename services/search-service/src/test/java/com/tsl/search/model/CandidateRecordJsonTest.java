package com.tsl.search.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CandidateRecordJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void serializesSnakeCaseWithSectionKinds() throws Exception {
        CandidateRecord candidate = CandidateRecord.builder()
            .id("c1")
            .professionalTitle("Engineer")
            .yearsExperience(4)
            .projects(new StructuredList(List.of(Map.of("name", "Search"))))
            .similarity(0.5)
            .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(candidate));

        assertEquals("Engineer", json.path("professional_title").asText());
        assertEquals(4, json.path("years_experience").asInt());
        assertEquals(0.5, json.path("score").asDouble());
        assertEquals("structured", json.path("projects").path("kind").asText());
        assertEquals("flat", json.path("skills").path("kind").asText());
        assertFalse(json.has("rerank_score"));
    }

    @Test
    void deserializesStructuredSections() throws Exception {
        String json = "{\"id\":\"c2\",\"work_history\":{\"kind\":\"structured\",\"entries\":[{\"position\":\"Lead\"}]},"
            + "\"rerank_score\":1.5}";

        CandidateRecord candidate = objectMapper.readValue(json, CandidateRecord.class);

        StructuredList workHistory = assertInstanceOf(StructuredList.class, candidate.getWorkHistory());
        assertEquals("Lead", workHistory.format(List.of("position")));
        assertEquals(1.5, candidate.getRerankScore());
        assertEquals(ProfileSection.empty(), candidate.getSkills());
    }
}
