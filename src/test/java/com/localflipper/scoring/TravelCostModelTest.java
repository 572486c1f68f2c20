package com.localflipper.scoring;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TravelCostModelTest {
    private final TravelCostModel model = new TravelCostModel();

    @Test
    void roundTripCostShouldUseRoundTripDistance() {
        assertEquals(100.0 / 22.0 * 4.50, model.roundTripCost(50, 22, 4.50), 1e-9);
    }

    @Test
    void zeroRadiusShouldCostNothing() {
        assertEquals(0.0, model.roundTripCost(0, 22, 4.50), 1e-9);
    }

    @Test
    void costShouldIncreaseWithRadiusAndFuelPrice() {
        assertTrue(model.roundTripCost(60, 22, 4.50) > model.roundTripCost(50, 22, 4.50));
        assertTrue(model.roundTripCost(50, 22, 5.00) > model.roundTripCost(50, 22, 4.50));
    }

    @Test
    void costShouldIncreaseForSubCentChanges() {
        assertTrue(model.roundTripCost(50, 22, 4.50001) > model.roundTripCost(50, 22, 4.50));
        assertTrue(model.roundTripCost(2, 1000, 1.0) > model.roundTripCost(1, 1000, 1.0));
        assertTrue(model.roundTripCost(1, 1000, 1.0) > 0.0);
    }

    @Test
    void invalidInputsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> model.roundTripCost(50, 0, 4.50));
        assertThrows(IllegalArgumentException.class, () -> model.roundTripCost(50, -5, 4.50));
        assertThrows(IllegalArgumentException.class, () -> model.roundTripCost(-1, 22, 4.50));
        assertThrows(IllegalArgumentException.class, () -> model.roundTripCost(50, 22, 0));
    }
}
