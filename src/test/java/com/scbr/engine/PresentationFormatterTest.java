package com.scbr.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PresentationFormatterTest {

    private final PresentationFormatter formatter = new PresentationFormatter();

    @Test
    public void shouldRenderInterimRoundWithQuestions() {
        DiagnosisResult diagnosis = diagnosis(new ConvergenceDecision(0.45, 0.6, 1, 0.6, false, false, 3));
        ReviewVerdict review = new ReviewVerdict(ReviewVerdict.Outcome.PASSED, "辨證參考：心血虛", List.of(), false);

        Presentation p = formatter.format(1, diagnosis, review, List.of("問一", "問二", "問三"), List.of());

        assertTrue(p.text.startsWith("【第 1 輪】階段性分析"));
        assertTrue(p.text.contains("資訊完整度：45%"));
        assertTrue(p.text.contains("3. 問三"));
        assertFalse(p.text.contains("脈診知識補充"));
        assertTrue(p.text.endsWith(PresentationFormatter.DISCLAIMER));
        assertNull(p.insufficiencyNotice);
        assertFalse(p.converged);
        assertEquals("C2", p.anchorCaseId);
    }

    @Test
    public void shouldAttachNoticeOnForcedConvergence() {
        DiagnosisResult diagnosis = diagnosis(new ConvergenceDecision(0.6, 0.6, 7, 0.6, true, true, 0));
        ReviewVerdict review = new ReviewVerdict(ReviewVerdict.Outcome.PASSED, "辨證參考：心血虛", List.of(), false);

        Presentation p = formatter.format(7, diagnosis, review, List.of(), List.of());

        assertEquals(PresentationFormatter.INSUFFICIENCY_NOTICE, p.insufficiencyNotice);
        assertTrue(p.text.contains(PresentationFormatter.INSUFFICIENCY_NOTICE));
        assertTrue(p.text.startsWith("【第 7 輪】結論"));
        assertFalse(p.text.contains("建議補充"));
        assertTrue(p.converged);
    }

    @Test
    public void shouldListPulseNotesBeforeQuestions() {
        DiagnosisResult diagnosis = diagnosis(new ConvergenceDecision(0.5, 0.6, 2, 0.6, false, false, 2));
        ReviewVerdict review = new ReviewVerdict(ReviewVerdict.Outcome.PASSED, "辨證參考：心血虛", List.of(), false);

        Presentation p = formatter.format(2, diagnosis, review, List.of("問一", "問二"), List.of("脈細：多主血虛"));

        assertEquals(List.of("脈細：多主血虛"), p.pulseNotes);
        assertTrue(p.text.contains("脈診知識補充：\n- 脈細：多主血虛\n"));
        assertTrue(p.text.indexOf("脈診知識補充") < p.text.indexOf("建議補充"));
    }

    private static DiagnosisResult diagnosis(ConvergenceDecision convergence) {
        ScoredCandidate anchor = Fixtures.scored("C2", "心血虛", false, 1.0, 0.8);
        AnchorSelection selection = new AnchorSelection(anchor, List.of(anchor), false, false, null);
        return new DiagnosisResult("C2", "心血虛", "心悸失眠", convergence.coverageRatio, List.of(), List.of(),
            "C2", selection, convergence, false);
    }
}
