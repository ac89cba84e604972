package com.scbr.engine;

import java.util.List;

/**
 * PresentationFormatter - Deterministic rendering of a reviewed round
 */
public class PresentationFormatter {

    public static final String INSUFFICIENCY_NOTICE =
        "⚠️ 證據不足：已達對話輪數上限而資訊仍不完整，以下內容僅供參考，並非確定診斷，請由專業中醫師面診確認。";
    public static final String DISCLAIMER = "本結果為輔助參考，不能取代專業醫療診斷。";

    public Presentation format(int round, DiagnosisResult diagnosis, ReviewVerdict review,
                               List<String> followUpQuestions, List<String> pulseNotes) {
        ConvergenceDecision convergence = diagnosis.convergence;
        String notice = convergence.forced ? INSUFFICIENCY_NOTICE : null;

        StringBuilder sb = new StringBuilder();
        sb.append("【第 ").append(round).append(" 輪】");
        sb.append(convergence.converged ? "結論" : "階段性分析").append("\n");
        if (notice != null) {
            sb.append(notice).append("\n");
        }
        sb.append(review.reviewedText).append("\n");
        sb.append("參考案例：").append(diagnosis.anchorCaseId).append("\n");
        sb.append(String.format("資訊完整度：%d%%%n", Math.round(convergence.coverageRatio * 100)));

        if (!pulseNotes.isEmpty()) {
            sb.append("脈診知識補充：\n");
            pulseNotes.forEach(note -> sb.append("- ").append(note).append("\n"));
        }

        if (!followUpQuestions.isEmpty()) {
            sb.append("建議補充：\n");
            for (int i = 0; i < followUpQuestions.size(); i++) {
                sb.append(i + 1).append(". ").append(followUpQuestions.get(i)).append("\n");
            }
        }
        sb.append(DISCLAIMER);

        return new Presentation(sb.toString(), diagnosis.anchorCaseId, diagnosis.patternLabel,
            followUpQuestions, pulseNotes, notice, convergence.converged);
    }
}
