package com.jay.aurora.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.aurora.model.enums.InvestmentHorizon;
import com.jay.aurora.model.enums.InvestmentObjective;
import com.jay.aurora.model.enums.RiskTolerance;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserProfileTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserialize_shouldAcceptWireLabels() throws Exception {
        UserProfile profile = mapper.readValue(
            "{\"riskTolerance\":\"low\",\"horizon\":\"1-3\",\"objective\":\"income\"}", UserProfile.class);

        assertEquals(RiskTolerance.LOW, profile.getRiskTolerance());
        assertEquals(InvestmentHorizon.SHORT, profile.getHorizon());
        assertEquals(InvestmentObjective.INCOME, profile.getObjective());
    }

    @Test
    void serialize_shouldWriteWireLabels() throws Exception {
        UserProfile profile = UserProfile.builder()
            .riskTolerance(RiskTolerance.HIGH)
            .horizon(InvestmentHorizon.LONG)
            .objective(InvestmentObjective.GROWTH)
            .build();

        String json = mapper.writeValueAsString(profile);

        assertTrue(json.contains("\"horizon\":\"10+\""));
        assertTrue(json.contains("\"riskTolerance\":\"high\""));
    }

    @Test
    void deserialize_shouldRejectUnknownHorizon() {
        assertThrows(Exception.class, () -> mapper.readValue(
            "{\"riskTolerance\":\"low\",\"horizon\":\"forever\",\"objective\":\"income\"}", UserProfile.class));
    }
}
