package com.scbr.engine;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpiralConfigTest {

    private static SpiralConfig withOverride(String hocon) {
        return new SpiralConfig(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.load()));
    }

    @Test
    public void shouldLoadDefaults() {
        SpiralConfig config = SpiralConfig.load();

        assertEquals(7, config.maxRounds);
        assertEquals(3, config.candidateCount);
        assertEquals(List.of("symptom_terms", "full_text", "chief_complaint"), config.fallbackFields);
        assertEquals(3, config.maxFollowUps);
        assertEquals(Duration.ofMinutes(30), config.passivateAfter);
    }

    @Test
    public void shouldRejectFewerThanThreeFollowUps() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> withOverride("spiral.convergence.max-follow-ups = 2"));

        assertTrue(e.getMessage().contains("max-follow-ups"));
    }

    @Test
    public void shouldAskAtLeastThreeQuestionsInLowBand() {
        ConvergenceEvaluator evaluator = new ConvergenceEvaluator(withOverride("spiral.convergence.max-follow-ups = 5"));

        assertEquals(5, evaluator.followUpCount(0.2, false));
        assertEquals(4, evaluator.followUpCount(0.5, false));
    }

    @Test
    public void shouldRejectEmptyStash() {
        assertThrows(IllegalArgumentException.class, () -> withOverride("spiral.session.stash-capacity = 0"));
    }
}
