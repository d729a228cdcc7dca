package com.aiprofessor.simulation.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TenantSummary(@JsonProperty("id") String id, @JsonProperty("name") String name) {}
