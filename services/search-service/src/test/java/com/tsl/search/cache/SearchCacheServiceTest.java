package com.tsl.search.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsl.search.model.CandidateRecord;
import com.tsl.search.model.FilterSet;
import com.tsl.search.model.FlatList;
import com.tsl.search.model.StructuredList;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SearchCacheServiceTest {

    private MutableClock clock;
    private SearchCacheProperties properties;
    private SearchCacheService cacheService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T00:00:00Z"));
        properties = new SearchCacheProperties();
        properties.setStore(CacheStoreType.MEMORY);
        cacheService = new SearchCacheService(
            new InMemorySearchCacheStore(100, clock),
            new ObjectMapper(),
            properties
        );
    }

    @Test
    void fingerprintIgnoresFilterInsertionOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("location", "Berlin");
        first.put("min_experience", 3);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("min_experience", 3);
        second.put("location", "Berlin");

        String key = cacheService.fingerprint("java", first);

        assertEquals(key, cacheService.fingerprint("java", second));
        assertEquals(key, cacheService.fingerprint("java", FilterSet.of("Berlin", 3)));
        assertTrue(key.startsWith("search:"));
        assertEquals("search:".length() + 64, key.length());
    }

    @Test
    void fingerprintChangesWithAnyQueryOrFilterChange() {
        List<String> queries = List.of("", "java", "Java", "java ", "python developer", "data");
        List<String> locations = List.of("", "Berlin", "berlin", "Paris");
        List<Integer> experiences = new java.util.ArrayList<>(List.of(0, 1, 2, 10));
        experiences.add(null);

        Set<String> seen = new HashSet<>();
        int combinations = 0;
        for (String query : queries) {
            for (String location : locations) {
                for (Integer experience : experiences) {
                    seen.add(cacheService.fingerprint(query, FilterSet.of(location, experience)));
                    combinations++;
                }
            }
        }

        assertEquals(combinations, seen.size());
    }

    @Test
    void zeroExperienceDiffersFromNoExperienceFilter() {
        assertNotEquals(
            cacheService.fingerprint("java", FilterSet.minExperience(0)),
            cacheService.fingerprint("java", FilterSet.none())
        );
    }

    @Test
    void roundTripPreservesRecordsAndOrder() {
        List<CandidateRecord> results = List.of(record("c1", 0.91), record("c2", 0.42));

        assertTrue(cacheService.put("java", FilterSet.location("Berlin"), results));
        Optional<List<CandidateRecord>> cached = cacheService.get("java", FilterSet.location("Berlin"));

        assertTrue(cached.isPresent());
        assertEquals(results, cached.get());
        assertEquals(FlatList.of("Java", "Kafka"), cached.get().get(0).getSkills());
        assertEquals(0.8, cached.get().get(0).getRerankScore());
    }

    @Test
    void entriesExpireAfterTtl() {
        cacheService.put("java", FilterSet.none(), List.of(record("c1", 0.5)), Duration.ofSeconds(60));

        clock.advance(Duration.ofSeconds(59));
        assertTrue(cacheService.lookup("java", FilterSet.none()).isHit());

        clock.advance(Duration.ofSeconds(2));
        CacheLookup lookup = cacheService.lookup("java", FilterSet.none());
        assertEquals(CacheLookup.Status.MISS, lookup.getStatus());
    }

    @Test
    void emptyResultsAreNotStored() {
        assertFalse(cacheService.put("java", FilterSet.none(), List.of()));
        assertFalse(cacheService.lookup("java", FilterSet.none()).isHit());
    }

    @Test
    void invalidateRemovesEveryMatchingKey() {
        for (int i = 0; i < 25; i++) {
            cacheService.put("query-" + i, FilterSet.none(), List.of(record("c" + i, 0.1)));
        }

        assertEquals(25, cacheService.stats().getKeyCount());
        assertEquals(25, cacheService.invalidate("search:*"));

        for (int i = 0; i < 25; i++) {
            assertFalse(cacheService.lookup("query-" + i, FilterSet.none()).isHit());
        }
        assertEquals(0, cacheService.stats().getKeyCount());
    }

    @Test
    void invalidateOnlyTouchesMatchingKeys() {
        cacheService.put("java", FilterSet.none(), List.of(record("c1", 0.1)));
        String key = cacheService.fingerprint("java", FilterSet.none());

        assertEquals(0, cacheService.invalidate("other:*"));
        assertEquals(1, cacheService.invalidate(key));
        assertEquals(0, cacheService.invalidate());
    }

    @Test
    void statsReportHitRate() {
        cacheService.put("java", FilterSet.none(), List.of(record("c1", 0.1)));
        cacheService.lookup("java", FilterSet.none());
        cacheService.lookup("java", FilterSet.none());
        cacheService.lookup("go", FilterSet.none());

        CacheStats stats = cacheService.stats();

        assertTrue(stats.isAvailable());
        assertEquals(2, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getKeyCount());
        assertEquals(2.0 / 3.0, stats.getHitRate(), 1e-9);
    }

    @Test
    void disabledCacheAlwaysMisses() {
        properties.setEnabled(false);

        assertFalse(cacheService.put("java", FilterSet.none(), List.of(record("c1", 0.1))));
        assertEquals(CacheLookup.Status.MISS, cacheService.lookup("java", FilterSet.none()).getStatus());
    }

    private static CandidateRecord record(String id, double similarity) {
        return CandidateRecord.builder()
            .id(id)
            .fullName("Name " + id)
            .professionalTitle("Engineer")
            .yearsExperience(5)
            .location("Berlin")
            .languages(List.of("English"))
            .skills(FlatList.of("Java", "Kafka"))
            .workHistory(new StructuredList(List.of(Map.of("position", "Lead", "company", "Acme"))))
            .summary("Summary for " + id)
            .similarity(similarity)
            .rerankScore(0.8)
            .build();
    }
}
