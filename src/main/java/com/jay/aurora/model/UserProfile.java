package com.jay.aurora.model;

import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Investor profile that every analysis is tuned against. All three fields are required. */
@Value
@Builder
@Jacksonized
public class UserProfile {
    RiskTolerance riskTolerance;
    InvestmentHorizon horizon;
    InvestmentObjective objective;
}
