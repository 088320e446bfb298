package com.questrail.costsource.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record GetActualCostResponse(String currency, List<ActualCostResult> results) {
    public GetActualCostResponse {
        // null elements are kept so that schema checks can report them
        results = (results == null)
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(results));
    }
}
