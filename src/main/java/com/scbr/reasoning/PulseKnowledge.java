package com.scbr.reasoning;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PulseKnowledge - Pulse qualities and the pattern tendencies they usually point to.
 *
 * <p>Feeds the pulse note of a presentation. It never takes part in anchor selection.</p>
 */
public final class PulseKnowledge {

    private static final class Quality {
        final String indication;
        final List<String> patternHints;

        Quality(String indication, String... patternHints) {
            this.indication = indication;
            this.patternHints = List.of(patternHints);
        }
    }

    private static final Map<Character, Quality> QUALITIES = new LinkedHashMap<>();

    static {
        QUALITIES.put('浮', new Quality("多主表證，亦見於虛陽外浮", "表", "風", "外感"));
        QUALITIES.put('沉', new Quality("多主裡證，沉而無力多屬陽虛或氣虛", "陽虛", "腎", "寒", "氣虛"));
        QUALITIES.put('遲', new Quality("多主寒證或陽氣不足", "寒", "陽虛"));
        QUALITIES.put('數', new Quality("多主熱證，細數多屬陰虛火旺", "熱", "火", "陰虛"));
        QUALITIES.put('細', new Quality("多主血虛、陰虛或氣血不足", "血虛", "陰虛", "氣血", "兩虛", "心腎"));
        QUALITIES.put('弱', new Quality("多主氣血不足、陽氣虛弱", "氣虛", "血虛", "兩虛", "陽虛", "虛弱"));
        QUALITIES.put('弦', new Quality("多主肝膽病、氣機鬱滯或疼痛", "肝", "膽", "鬱", "滯"));
        QUALITIES.put('滑', new Quality("多主痰濕、食積或實熱", "痰", "濕", "食"));
        QUALITIES.put('緩', new Quality("多見於濕困或脾胃虛弱", "濕", "脾"));
    }

    /**
     * One note per distinct quality named in the pulse terms, in order of first mention, each
     * saying whether it fits the given pattern label. A null label gives the notes without a verdict.
     */
    public static List<String> notesFor(Collection<String> pulseTerms, String patternLabel) {
        Set<Character> seen = new LinkedHashSet<>();
        for (String term : pulseTerms) {
            String normalized = TermLexicon.normalize(term);
            for (int i = 0; i < normalized.length(); i++) {
                char c = normalized.charAt(i);
                if (QUALITIES.containsKey(c)) {
                    seen.add(c);
                }
            }
        }

        List<String> notes = new ArrayList<>();
        for (char c : seen) {
            Quality quality = QUALITIES.get(c);
            StringBuilder note = new StringBuilder("脈").append(c).append("：").append(quality.indication);
            if (patternLabel != null && !patternLabel.isBlank()) {
                boolean fits = quality.patternHints.stream().anyMatch(patternLabel::contains);
                note.append(fits
                    ? "（與「" + patternLabel + "」相合）"
                    : "（與「" + patternLabel + "」關聯不明顯，宜再確認脈象）");
            }
            notes.add(note.toString());
        }
        return notes;
    }

    private PulseKnowledge() {}
}
