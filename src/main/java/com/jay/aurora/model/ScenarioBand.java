package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScenarioBand {
    ReturnRange expectedReturnPctRange;
    int probabilityPct;
    String description;
}
