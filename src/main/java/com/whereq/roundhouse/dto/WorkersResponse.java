package com.whereq.roundhouse.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Registered build workers
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkersResponse {
    private List<String> workers;

    private int count;

    public static WorkersResponse of(List<String> workers) {
        return new WorkersResponse(workers, workers.size());
    }
}
