package com.tsl.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import java.util.List;
import java.util.Objects;

/**
 * A candidate profile as returned by search. Profile fields are fixed at construction; only the
 * similarity and rerank scores change afterwards.
 */
@JsonDeserialize(builder = CandidateRecord.Builder.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CandidateRecord {
    @JsonProperty("id")
    private final String id;

    @JsonProperty("full_name")
    private final String fullName;

    @JsonProperty("email")
    private final String email;

    @JsonProperty("phone")
    private final String phone;

    @JsonProperty("professional_title")
    private final String professionalTitle;

    @JsonProperty("years_experience")
    private final Integer yearsExperience;

    @JsonProperty("location")
    private final String location;

    @JsonProperty("languages")
    private final List<String> languages;

    @JsonProperty("skills")
    private final ProfileSection skills;

    @JsonProperty("tools")
    private final ProfileSection tools;

    @JsonProperty("projects")
    private final ProfileSection projects;

    @JsonProperty("work_history")
    private final ProfileSection workHistory;

    @JsonProperty("education")
    private final ProfileSection education;

    @JsonProperty("certifications")
    private final ProfileSection certifications;

    @JsonProperty("summary")
    private final String summary;

    @JsonProperty("score")
    private double similarity;

    @JsonProperty("rerank_score")
    private Double rerankScore;

    private CandidateRecord(Builder builder) {
        this.id = builder.id;
        this.fullName = builder.fullName;
        this.email = builder.email;
        this.phone = builder.phone;
        this.professionalTitle = builder.professionalTitle;
        this.yearsExperience = builder.yearsExperience;
        this.location = builder.location;
        this.languages = builder.languages == null ? List.of() : List.copyOf(builder.languages);
        this.skills = orEmpty(builder.skills);
        this.tools = orEmpty(builder.tools);
        this.projects = orEmpty(builder.projects);
        this.workHistory = orEmpty(builder.workHistory);
        this.education = orEmpty(builder.education);
        this.certifications = orEmpty(builder.certifications);
        this.summary = builder.summary;
        this.similarity = builder.similarity;
        this.rerankScore = builder.rerankScore;
    }

    private static ProfileSection orEmpty(ProfileSection section) {
        return section == null ? ProfileSection.empty() : section;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getFullName() {
        return fullName;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    public String getProfessionalTitle() {
        return professionalTitle;
    }

    public Integer getYearsExperience() {
        return yearsExperience;
    }

    public String getLocation() {
        return location;
    }

    public List<String> getLanguages() {
        return languages;
    }

    public ProfileSection getSkills() {
        return skills;
    }

    public ProfileSection getTools() {
        return tools;
    }

    public ProfileSection getProjects() {
        return projects;
    }

    public ProfileSection getWorkHistory() {
        return workHistory;
    }

    public ProfileSection getEducation() {
        return education;
    }

    public ProfileSection getCertifications() {
        return certifications;
    }

    public String getSummary() {
        return summary;
    }

    public double getSimilarity() {
        return similarity;
    }

    public void setSimilarity(double similarity) {
        this.similarity = similarity;
    }

    public Double getRerankScore() {
        return rerankScore;
    }

    public void setRerankScore(Double rerankScore) {
        this.rerankScore = rerankScore;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CandidateRecord)) {
            return false;
        }
        CandidateRecord that = (CandidateRecord) o;
        return Double.compare(similarity, that.similarity) == 0
            && Objects.equals(id, that.id)
            && Objects.equals(fullName, that.fullName)
            && Objects.equals(email, that.email)
            && Objects.equals(phone, that.phone)
            && Objects.equals(professionalTitle, that.professionalTitle)
            && Objects.equals(yearsExperience, that.yearsExperience)
            && Objects.equals(location, that.location)
            && Objects.equals(languages, that.languages)
            && Objects.equals(skills, that.skills)
            && Objects.equals(tools, that.tools)
            && Objects.equals(projects, that.projects)
            && Objects.equals(workHistory, that.workHistory)
            && Objects.equals(education, that.education)
            && Objects.equals(certifications, that.certifications)
            && Objects.equals(summary, that.summary)
            && Objects.equals(rerankScore, that.rerankScore);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fullName, professionalTitle, yearsExperience, location, similarity, rerankScore);
    }

    @Override
    public String toString() {
        return "CandidateRecord{id=" + id + ", similarity=" + similarity + ", rerankScore=" + rerankScore + "}";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static class Builder {
        private String id;
        private String fullName;
        private String email;
        private String phone;
        private String professionalTitle;
        private Integer yearsExperience;
        private String location;
        private List<String> languages;
        private ProfileSection skills;
        private ProfileSection tools;
        private ProfileSection projects;
        private ProfileSection workHistory;
        private ProfileSection education;
        private ProfileSection certifications;
        private String summary;
        private double similarity;
        private Double rerankScore;

        @JsonProperty("id")
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        @JsonProperty("full_name")
        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        @JsonProperty("email")
        public Builder email(String email) {
            this.email = email;
            return this;
        }

        @JsonProperty("phone")
        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        @JsonProperty("professional_title")
        public Builder professionalTitle(String professionalTitle) {
            this.professionalTitle = professionalTitle;
            return this;
        }

        @JsonProperty("years_experience")
        public Builder yearsExperience(Integer yearsExperience) {
            this.yearsExperience = yearsExperience;
            return this;
        }

        @JsonProperty("location")
        public Builder location(String location) {
            this.location = location;
            return this;
        }

        @JsonProperty("languages")
        public Builder languages(List<String> languages) {
            this.languages = languages;
            return this;
        }

        @JsonProperty("skills")
        public Builder skills(ProfileSection skills) {
            this.skills = skills;
            return this;
        }

        @JsonProperty("tools")
        public Builder tools(ProfileSection tools) {
            this.tools = tools;
            return this;
        }

        @JsonProperty("projects")
        public Builder projects(ProfileSection projects) {
            this.projects = projects;
            return this;
        }

        @JsonProperty("work_history")
        public Builder workHistory(ProfileSection workHistory) {
            this.workHistory = workHistory;
            return this;
        }

        @JsonProperty("education")
        public Builder education(ProfileSection education) {
            this.education = education;
            return this;
        }

        @JsonProperty("certifications")
        public Builder certifications(ProfileSection certifications) {
            this.certifications = certifications;
            return this;
        }

        @JsonProperty("summary")
        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        @JsonProperty("score")
        public Builder similarity(double similarity) {
            this.similarity = similarity;
            return this;
        }

        @JsonProperty("rerank_score")
        public Builder rerankScore(Double rerankScore) {
            this.rerankScore = rerankScore;
            return this;
        }

        public CandidateRecord build() {
            return new CandidateRecord(this);
        }
    }
}
