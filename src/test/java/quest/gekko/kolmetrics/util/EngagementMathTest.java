package quest.gekko.kolmetrics.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EngagementMathTest {

    @Test
    void engagementRate_isInteractionsOverImpressionsRoundedToTwoDecimals() {
        // (10 + 5 + 3 + 2) / 1000 * 100
        assertEquals(2.0, EngagementMath.engagementRate(10, 5, 3, 2, 1000));
        assertEquals(33.33, EngagementMath.engagementRate(1, 0, 0, 0, 3));
    }

    @Test
    void engagementRate_isZeroWithoutImpressions() {
        assertEquals(0.0, EngagementMath.engagementRate(10, 5, 3, 2, 0));
        assertEquals(0.0, EngagementMath.engagementRate(10, 5, 3, 2, -1));
    }

    @Test
    void percentChange_treatsRiseFromZeroAsHundredPercent() {
        assertEquals(100.0, EngagementMath.percentChange(5, 0));
        assertEquals(0.0, EngagementMath.percentChange(0, 0));
    }

    @Test
    void percentChange_roundsToOneDecimal() {
        assertEquals(50.0, EngagementMath.percentChange(150, 100));
        assertEquals(-33.3, EngagementMath.percentChange(2, 3));
    }
}
