package com.aiprofessor.simulation.api.dto;

import com.aiprofessor.simulation.domain.StudentRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StudentSummary(
        @JsonProperty("id") String id,
        @JsonProperty("email") String email,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        @JsonProperty("student_code") String studentCode,
        @JsonProperty("year") Integer year) {

    public static StudentSummary of(StudentRecord student) {
        return new StudentSummary(
                student.id(),
                student.email(),
                student.firstName(),
                student.lastName(),
                student.studentCode(),
                student.year());
    }
}
