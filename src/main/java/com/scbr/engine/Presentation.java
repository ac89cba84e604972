package com.scbr.engine;

import java.util.List;

/**
 * Presentation - What the caller is shown for a completed round
 */
public final class Presentation {

    public final String text;
    public final String anchorCaseId;
    public final String patternLabel;
    public final List<String> followUpQuestions;
    public final List<String> pulseNotes;
    public final String insufficiencyNotice;   // set only on forced convergence
    public final boolean converged;

    public Presentation(String text, String anchorCaseId, String patternLabel, List<String> followUpQuestions,
                        List<String> pulseNotes, String insufficiencyNotice, boolean converged) {
        this.text = text;
        this.anchorCaseId = anchorCaseId;
        this.patternLabel = patternLabel;
        this.followUpQuestions = List.copyOf(followUpQuestions);
        this.pulseNotes = List.copyOf(pulseNotes);
        this.insufficiencyNotice = insufficiencyNotice;
        this.converged = converged;
    }
}
