package com.jay.aurora.model;

import com.jay.aurora.model.enums.GrowthSource;
import com.jay.aurora.model.enums.PegBucket;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PegAssessment {
    PegBucket bucket;
    Double ratio;               // null when growth is non-positive
    Double normalizedGrowthPct;
    GrowthSource growthSource;
    String commentary;
}
