package com.scbr.retrieval;

import java.util.List;

/**
 * DomainClassifier - Keyword-family heuristic tagging a query or case with a clinical domain
 */
public class DomainClassifier {

    public static final String DIGESTIVE = "digestive";
    public static final String GYNECOLOGICAL = "gynecological";
    public static final String GENERAL = "general";

    private static final List<String> DIGESTIVE_KEYWORDS =
        List.of("胃", "脘", "脹", "噯氣", "嗳氣", "早飽", "脾胃", "食慾不振", "腹瀉", "便溏", "嘔");
    private static final List<String> GYNECOLOGICAL_KEYWORDS =
        List.of("帶下", "白帶", "陰道", "月經", "經期", "婦科", "痛經", "經血");

    public String classify(String text) {
        if (text == null || text.isBlank()) {
            return GENERAL;
        }
        // gynecological wins: 經期胃脹 is still a gynecology consult
        if (containsAny(text, GYNECOLOGICAL_KEYWORDS)) {
            return GYNECOLOGICAL;
        }
        if (containsAny(text, DIGESTIVE_KEYWORDS)) {
            return DIGESTIVE;
        }
        return GENERAL;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
