package com.aiprofessor.simulation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CleanupResponse(
        @JsonProperty("message") String message, @JsonProperty("count") int count) {}
