package com.example.backendtemplate.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of sample entities with the total matching count
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SampleListResponse {

    private List<SampleResponse> items;
    private long total;
    private long skip;
    private int limit;
}
