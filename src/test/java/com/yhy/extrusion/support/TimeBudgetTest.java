package com.yhy.extrusion.support;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TimeBudgetTest {

    @Test
    void zeroBudgetIsSpentImmediately() {
        TimeBudget budget = TimeBudget.startingNow(0);

        assertTrue(budget.exhausted());
        assertEquals(0, budget.remainingMs());
    }

    @Test
    void hugeBudgetIsClampedInsteadOfWrappingIntoThePast() {
        TimeBudget budget = TimeBudget.startingNow(Long.MAX_VALUE);

        assertFalse(budget.exhausted());
        assertTrue(budget.remainingMs() > TimeBudget.MAX_BUDGET_MS - 60_000);
    }

    @Test
    void budgetsJustAboveTheClampBehaveLikeUnlimited() {
        assertFalse(TimeBudget.startingNow(TimeBudget.MAX_BUDGET_MS + 1).exhausted());
        assertFalse(TimeBudget.unlimited().exhausted());
    }
}
