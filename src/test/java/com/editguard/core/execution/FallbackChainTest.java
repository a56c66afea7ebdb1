package com.editguard.core.execution;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static com.editguard.core.confidence.ChangeApproach.*;
import static org.junit.jupiter.api.Assertions.*;

class FallbackChainTest {

    @Test
    void testChainStartsAtRecommended() {
        FallbackChain chain = FallbackChain.of(HIGH_CONFIDENCE_DIRECT,
                List.of(MEDIUM_CONFIDENCE_GUIDED, LOW_CONFIDENCE_CONSERVATIVE));

        assertEquals(HIGH_CONFIDENCE_DIRECT, chain.current());
        assertEquals(3, chain.remaining().size());
        assertFalse(chain.isExhausted());
    }

    @Test
    void testNonEscalatingFallbacksAreDropped() {
        FallbackChain chain = FallbackChain.of(MEDIUM_CONFIDENCE_GUIDED,
                List.of(HIGH_CONFIDENCE_DIRECT, MEDIUM_CONFIDENCE_GUIDED,
                        VERY_LOW_CONFIDENCE_HUMAN_REVIEW, LOW_CONFIDENCE_CONSERVATIVE));

        assertEquals(List.of(MEDIUM_CONFIDENCE_GUIDED, VERY_LOW_CONFIDENCE_HUMAN_REVIEW), chain.getApproaches());
    }

    @Test
    void testAdvanceIsImmutableAndExhausts() {
        FallbackChain first  = FallbackChain.of(LOW_CONFIDENCE_CONSERVATIVE, List.of(VERY_LOW_CONFIDENCE_HUMAN_REVIEW));
        FallbackChain second = first.advance();
        FallbackChain third  = second.advance();

        assertEquals(LOW_CONFIDENCE_CONSERVATIVE, first.current());
        assertEquals(VERY_LOW_CONFIDENCE_HUMAN_REVIEW, second.current());
        assertTrue(third.isExhausted());
        assertTrue(third.remaining().isEmpty());
        assertTrue(third.advance().isExhausted());
        assertThrows(NoSuchElementException.class, third::current);
    }

    @Test
    void testHumanReviewChainHasSingleEntry() {
        FallbackChain chain = FallbackChain.of(VERY_LOW_CONFIDENCE_HUMAN_REVIEW, List.of());

        assertEquals(List.of(VERY_LOW_CONFIDENCE_HUMAN_REVIEW), chain.getApproaches());
        assertTrue(chain.advance().isExhausted());
    }
}
