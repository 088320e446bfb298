package com.questrail.costsource.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record GetRecommendationsResponse(List<Recommendation> recommendations, String nextPageToken) {
    public GetRecommendationsResponse {
        recommendations = (recommendations == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(recommendations));
    }
}
