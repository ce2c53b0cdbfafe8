package com.jay.aurora.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class PlanningGuidance {
    List<String> positionSizing;
    List<String> timing;
    List<String> riskNotes;
    String languageNotes;
}
