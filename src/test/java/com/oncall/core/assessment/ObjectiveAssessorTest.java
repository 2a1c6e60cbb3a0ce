package com.oncall.core.assessment;

import com.oncall.core.model.Assessment;
import com.oncall.core.model.DeviceVerdict;
import com.oncall.core.model.ObjectiveJudgement;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ObjectiveAssessor}.
 */
class ObjectiveAssessorTest {

    private final ObjectiveAssessor assessor = new ObjectiveAssessor();

    // -- Achieved ---------------------------------------------------------------

    @Nested
    @DisplayName("when every device is settled")
    class Achieved {

        @Test
        @DisplayName("all MET achieves the objective with per-device resolutions")
        void allMet() {
            Assessment a = assessor.assess(Map.of(
                    "xrd-1", ObjectiveJudgement.met("interfaces healthy"),
                    "xrd-2", ObjectiveJudgement.met(null)), 0, 3);

            assertTrue(a.objectiveAchieved());
            assertFalse(a.forced());
            assertTrue(a.feedbackPerDevice().isEmpty());
            assertEquals("objective met: interfaces healthy", a.resolutions().get("xrd-1"));
            assertEquals("objective met", a.resolutions().get("xrd-2"));
            assertTrue(a.notes().startsWith("objective met\n"));
        }

        @Test
        @DisplayName("LIMITED counts as settled but is called out in the notes")
        void limitedIsSettled() {
            Assessment a = assessor.assess(Map.of(
                    "xrd-1", ObjectiveJudgement.met("ok"),
                    "srl-1", ObjectiveJudgement.limited("no BGP telemetry on this platform")), 1, 3);

            assertTrue(a.objectiveAchieved());
            assertFalse(a.forced());
            assertEquals("limited by device or tool capability: no BGP telemetry on this platform",
                    a.resolutions().get("srl-1"));
            assertTrue(a.notes().startsWith("objective met within device limitations"));
        }
    }

    // -- Retry ------------------------------------------------------------------

    @Nested
    @DisplayName("when a device is unmet and retries remain")
    class Retry {

        @Test
        @DisplayName("only unmet devices receive feedback")
        void feedbackOnlyForUnmet() {
            var judgements = new LinkedHashMap<String, ObjectiveJudgement>();
            judgements.put("xrd-1", ObjectiveJudgement.met("done"));
            judgements.put("xrd-2", ObjectiveJudgement.unmet("BGP state missing", "Query the BGP neighbor table"));

            Assessment a = assessor.assess(judgements, 0, 3);

            assertFalse(a.objectiveAchieved());
            assertFalse(a.forced());
            assertEquals(Map.of("xrd-2", "Query the BGP neighbor table"), a.feedbackPerDevice());
            assertEquals("objective met: done", a.resolutions().get("xrd-1"));
            assertFalse(a.resolutions().containsKey("xrd-2"));
            assertTrue(a.notes().contains("retry 1 of 3"));
        }

        @Test
        @DisplayName("blank judge feedback falls back to the default guidance")
        void defaultGuidance() {
            Assessment a = assessor.assess(Map.of("xrd-1", ObjectiveJudgement.unmet("n/a", "  ")), 2, 3);

            assertEquals(ObjectiveAssessor.DEFAULT_RETRY_GUIDANCE, a.feedbackPerDevice().get("xrd-1"));
        }

        @Test
        @DisplayName("a missing verdict is treated as unmet")
        void nullVerdictIsUnmet() {
            Assessment a = assessor.assess(Map.of("xrd-1", new ObjectiveJudgement(null, null, null)), 0, 1);

            assertFalse(a.objectiveAchieved());
            assertTrue(a.notes().contains("xrd-1: " + DeviceVerdict.UNMET));
        }
    }

    // -- Forced -----------------------------------------------------------------

    @Nested
    @DisplayName("when the retry bound is reached")
    class Forced {

        @Test
        @DisplayName("acceptance is forced and unmet devices are marked")
        void forcedAcceptance() {
            var judgements = new LinkedHashMap<String, ObjectiveJudgement>();
            judgements.put("xrd-1", ObjectiveJudgement.met("ok"));
            judgements.put("xrd-2", ObjectiveJudgement.unmet("still missing", "try again"));

            Assessment a = assessor.assess(judgements, 2, 2);

            assertTrue(a.objectiveAchieved());
            assertTrue(a.forced());
            assertTrue(a.feedbackPerDevice().isEmpty());
            assertEquals(ObjectiveAssessor.MAX_RETRIES_REACHED, a.resolutions().get("xrd-2"));
            assertTrue(a.notes().startsWith("Objective not achieved after 3 execution pass(es); max retries reached (2)"));
        }

        @Test
        @DisplayName("a zero retry bound forces acceptance after the first pass")
        void zeroRetries() {
            Assessment a = assessor.assess(Map.of("xrd-1", ObjectiveJudgement.unmet("x", "y")), 0, 0);

            assertTrue(a.objectiveAchieved());
            assertTrue(a.forced());
        }
    }
}
