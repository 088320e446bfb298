package com.questrail.costsource.testkit;

import com.questrail.costsource.api.CostSourceMethod;

/**
 * A request received by a {@link ConfigurableCostSource}, in arrival order.
 *
 * @param sequence zero-based arrival index across all methods
 */
public record RecordedCall(long sequence, CostSourceMethod method, Object request) {
}
