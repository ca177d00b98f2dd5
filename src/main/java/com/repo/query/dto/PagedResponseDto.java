package com.repo.query.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class PagedResponseDto<T> {
    private long total;
    private int limit;
    private long offset;
    private List<T> items;
}
