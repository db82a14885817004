package com.tsl.search.retrieval;

import com.tsl.search.model.CandidateRecord;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CandidateRowDecoder {
    private final ProfileSectionDecoder sectionDecoder;

    public CandidateRowDecoder(ProfileSectionDecoder sectionDecoder) {
        this.sectionDecoder = sectionDecoder;
    }

    public CandidateRecord decode(Map<String, Object> row) {
        return CandidateRecord.builder()
            .id(asString(row.get("id")))
            .fullName(asString(row.get("full_name")))
            .email(asString(row.get("email")))
            .phone(asString(row.get("phone")))
            .professionalTitle(asString(row.get("professional_title")))
            .yearsExperience(asInteger(row.get("years_experience")))
            .location(asString(row.get("location")))
            .languages(sectionDecoder.decodeStrings(row.get("spoken_languages"), "spoken_languages"))
            .skills(sectionDecoder.decodeJson(row.get("skills"), "skills"))
            .tools(sectionDecoder.decodeJson(row.get("tools"), "tools"))
            .projects(sectionDecoder.decodeJson(row.get("projects"), "projects"))
            .workHistory(sectionDecoder.decodeJson(row.get("work_history"), "work_history"))
            .education(sectionDecoder.decodeText(row.get("education"), "education"))
            .certifications(sectionDecoder.decodeText(row.get("certifications"), "certifications"))
            .summary(asString(row.get("summary_generated")))
            .similarity(asDouble(row.get("similarity")))
            .build();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }

    private static Integer asInteger(Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static double asDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return 0.0;
    }
}
