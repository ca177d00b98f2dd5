package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class HealthDto {
    private String status;
    private Instant timestamp;
    private Map<String, String> services;
    private String version;
}
