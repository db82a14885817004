package com.tsl.search.ranking;

import com.tsl.search.model.CandidateRecord;
import com.tsl.search.model.ProfileSection;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the document side of a rerank pair from a candidate profile.
 *
 * <p>Segments are emitted in a fixed order (title, experience, location, languages, education,
 * certifications, skills, tools, work history, projects, summary). Segments shorter than the
 * configured minimum are dropped, the rest are joined with {@code ". "}.
 */
@Component
public class CandidateTextBuilder {
    private static final String UNKNOWN = "Unknown";
    private static final List<String> WORK_HISTORY_FIELDS = List.of("position", "company", "description");
    private static final List<String> PROJECT_FIELDS = List.of("name", "description");

    private final int minSegmentLength;

    public CandidateTextBuilder(RankingProperties properties) {
        this(properties.getMinSegmentLength());
    }

    CandidateTextBuilder(int minSegmentLength) {
        this.minSegmentLength = Math.max(0, minSegmentLength);
    }

    public String build(CandidateRecord candidate) {
        List<String> segments = new ArrayList<>();
        addSegment(segments, "Title", orDefault(candidate.getProfessionalTitle(), UNKNOWN));
        Integer years = candidate.getYearsExperience();
        addSegment(segments, "Experience", (years == null ? 0 : years) + " years");
        addSegment(segments, "Location", orDefault(candidate.getLocation(), UNKNOWN));
        addSegment(segments, "Languages", String.join(", ", candidate.getLanguages()));
        addSegment(segments, "Education", format(candidate.getEducation(), List.of()));
        addSegment(segments, "Certifications", format(candidate.getCertifications(), List.of()));
        addSegment(segments, "Skills", format(candidate.getSkills(), List.of()));
        addSegment(segments, "Tools", format(candidate.getTools(), List.of()));
        addSegment(segments, "Work History", format(candidate.getWorkHistory(), WORK_HISTORY_FIELDS));
        addSegment(segments, "Projects", format(candidate.getProjects(), PROJECT_FIELDS));
        addSegment(segments, "Summary", orDefault(candidate.getSummary(), ""));
        return String.join(". ", segments);
    }

    // Segments without a value are skipped regardless of label length.
    private void addSegment(List<String> segments, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String segment = label + ": " + value.trim();
        if (segment.length() >= minSegmentLength) {
            segments.add(segment);
        }
    }

    private static String format(ProfileSection section, List<String> fields) {
        return section == null ? "" : section.format(fields);
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
