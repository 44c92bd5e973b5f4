package com.fleetinsight.api.dto;

import java.util.List;

/**
 * List payload with its size, used by the record and heatmap endpoints.
 */
public record DataListResponse<T>(List<T> data, int count) {

    public static <T> DataListResponse<T> of(List<T> data) {
        return new DataListResponse<>(data, data.size());
    }
}
