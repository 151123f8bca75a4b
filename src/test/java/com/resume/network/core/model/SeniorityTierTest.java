package com.resume.network.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SeniorityTierTest {

    @Test
    @DisplayName("Distance is symmetric and bounded by maxDistance")
    void testDistance() {
        assertEquals(0, SeniorityTier.MID.distanceTo(SeniorityTier.MID));
        assertEquals(2, SeniorityTier.JUNIOR.distanceTo(SeniorityTier.SENIOR));
        assertEquals(2, SeniorityTier.SENIOR.distanceTo(SeniorityTier.JUNIOR));
        assertEquals(SeniorityTier.maxDistance(), SeniorityTier.JUNIOR.distanceTo(SeniorityTier.LEAD));
    }

    @Test
    @DisplayName("max returns the higher tier")
    void testMax() {
        assertEquals(SeniorityTier.SENIOR, SeniorityTier.MID.max(SeniorityTier.SENIOR));
        assertEquals(SeniorityTier.LEAD, SeniorityTier.LEAD.max(SeniorityTier.JUNIOR));
        assertEquals(SeniorityTier.MID, SeniorityTier.MID.max(null));
    }
}
