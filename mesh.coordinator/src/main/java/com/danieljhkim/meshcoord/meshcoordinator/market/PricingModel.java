package com.danieljhkim.meshcoord.meshcoordinator.market;

public enum PricingModel {
    /** rate x amount x hours */
    FIXED,
    /** fixed price scaled by current demand for the resource type */
    DYNAMIC,
    /** fixed price with the pay-for-what-you-use discount */
    USAGE_BASED
}
