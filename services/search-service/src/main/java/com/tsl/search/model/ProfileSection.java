package com.tsl.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.List;

/**
 * Semi-structured profile value (skills, tools, projects, work history, education, certifications).
 *
 * <p>A section is either a {@link FlatList} of strings or a {@link StructuredList} of records with
 * named fields. The {@code kind} discriminator keeps the shape across cache round trips.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = FlatList.class, name = "flat"),
    @JsonSubTypes.Type(value = StructuredList.class, name = "structured")
})
public abstract class ProfileSection {

    ProfileSection() {
    }

    public static ProfileSection empty() {
        return FlatList.EMPTY;
    }

    @JsonIgnore
    public abstract boolean isEmpty();

    /**
     * Renders the section as a single line.
     *
     * @param fields record fields to keep, in order; ignored by flat lists. An empty list keeps every
     *     field of a structured record.
     */
    public abstract String format(List<String> fields);
}
