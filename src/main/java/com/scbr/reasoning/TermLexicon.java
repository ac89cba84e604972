package com.scbr.reasoning;

import com.scbr.model.RetrievalPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TermLexicon - TCM vocabulary used for local term extraction, information-category checks and
 * follow-up questions
 */
public final class TermLexicon {

    public static final String MISSING_TONGUE = "tongue";
    public static final String MISSING_PULSE = "pulse";
    public static final String MISSING_DURATION = "duration";
    public static final String MISSING_TRIGGERS = "triggers";
    public static final String MISSING_SYMPTOMS = "symptoms";

    private static final List<String> SYMPTOMS = byLength(List.of(
        "失眠", "多夢", "易醒", "心悸", "心慌", "健忘", "頭暈", "頭痛", "乏力", "倦怠", "神疲",
        "食慾不振", "納差", "胃脘痛", "胃痛", "胃脹", "脘腹脹滿", "腹脹", "噯氣", "反酸", "噁心", "嘔吐",
        "便溏", "腹瀉", "便秘", "口乾", "口苦", "咳嗽", "痰多", "氣短", "胸悶", "脅痛", "腰痠",
        "腰膝痠軟", "耳鳴", "盜汗", "自汗", "怕冷", "畏寒", "手足冰冷", "五心煩熱", "潮熱",
        "面色萎黃", "面色蒼白", "月經量少", "月經不調", "痛經", "帶下量多", "白帶", "經期延後",
        "急躁易怒", "情緒低落", "小便頻數", "水腫", "早飽", "咽痛", "發熱", "惡寒", "鼻塞"));

    private static final List<String> TONGUE = byLength(List.of(
        "舌淡紅", "舌淡", "舌紅", "舌暗", "舌紫", "舌胖", "舌邊齒痕", "齒痕", "舌尖紅",
        "苔薄白", "苔白膩", "苔黃膩", "苔白", "苔黃", "苔膩", "苔薄", "苔厚", "少苔"));

    private static final List<String> PULSE = byLength(List.of(
        "脈細弱", "脈弦細", "脈細數", "脈沉細", "脈滑數", "脈弦滑",
        "脈細", "脈弱", "脈弦", "脈滑", "脈數", "脈沉", "脈遲", "脈浮", "脈緩"));

    private static final List<String> ZANGFU = byLength(List.of(
        "心包", "小腸", "大腸", "膀胱", "三焦", "心", "肝", "脾", "肺", "腎", "肾", "胃", "膽", "胆"));

    private static final List<String> DURATION_HINTS = List.of("天", "週", "周", "個月", "月", "年", "久", "最近", "近來");
    private static final List<String> TRIGGER_HINTS = List.of("加重", "減輕", "緩解", "誘因", "之後", "飯後", "勞累", "受涼", "壓力");
    private static final List<String> OUT_OF_SCOPE = List.of(
        "股票", "天氣", "寫程式", "程式碼", "密碼", "password", "ignore previous", "忽略之前", "翻譯", "食譜");

    private static final Map<String, String> QUESTIONS = new LinkedHashMap<>();

    static {
        QUESTIONS.put(MISSING_SYMPTOMS, "請具體描述目前最困擾的症狀？");
        QUESTIONS.put(MISSING_TONGUE, "請描述舌象（舌色、舌苔厚薄與顏色）？");
        QUESTIONS.put(MISSING_PULSE, "請描述脈象（如弦、細、滑、數）？");
        QUESTIONS.put(MISSING_DURATION, "這些症狀持續多久了？");
        QUESTIONS.put(MISSING_TRIGGERS, "症狀在什麼情況下加重或減輕？");
    }

    private static final List<String> GENERIC_QUESTIONS = List.of(
        "睡眠、食慾與二便情況如何？",
        "平時怕冷還是怕熱？是否容易出汗？",
        "是否有其他伴隨症狀或既往病史？");

    public static String normalize(String text) {
        return text == null ? "" : text.replace('脉', '脈').replace('肾', '腎').replace('胆', '膽');
    }

    public static boolean isTongueTerm(String term) {
        return term.contains("舌") || term.contains("苔") || term.equals("齒痕");
    }

    public static boolean isPulseTerm(String term) {
        return term.contains("脈") || term.contains("脉");
    }

    /**
     * Zang-fu organs named in a pattern label, each counted once.
     */
    public static Set<String> organsIn(String label) {
        Set<String> organs = new LinkedHashSet<>();
        String rest = normalize(label);
        for (String organ : ZANGFU) {
            if (rest.contains(organ)) {
                organs.add(organ);
                rest = rest.replace(organ, " ");
            }
        }
        return organs;
    }

    /**
     * Lexicon-only plan: longest matches per category, shorter terms covered by a longer match dropped.
     */
    public static RetrievalPlan extractPlan(String text) {
        String normalized = normalize(text);
        return new RetrievalPlan(
            match(normalized, SYMPTOMS),
            match(normalized, TONGUE),
            match(normalized, PULSE),
            match(normalized, ZANGFU));
    }

    public static boolean looksOutOfScope(String text) {
        String lower = text.toLowerCase();
        return OUT_OF_SCOPE.stream().anyMatch(lower::contains);
    }

    /**
     * Information categories not yet supplied in the accumulated query.
     */
    public static List<String> missingCategories(String text, RetrievalPlan plan) {
        String normalized = normalize(text);
        List<String> missing = new ArrayList<>();
        if (plan.symptomTerms.isEmpty()) missing.add(MISSING_SYMPTOMS);
        if (plan.tongueTerms.isEmpty()) missing.add(MISSING_TONGUE);
        if (plan.pulseTerms.isEmpty()) missing.add(MISSING_PULSE);
        if (DURATION_HINTS.stream().noneMatch(normalized::contains)) missing.add(MISSING_DURATION);
        if (TRIGGER_HINTS.stream().noneMatch(normalized::contains)) missing.add(MISSING_TRIGGERS);
        return missing;
    }

    /**
     * Exactly {@code count} questions: category questions first, then generic ones.
     */
    public static List<String> followUpQuestions(List<String> missing, List<String> proposed, int count) {
        Set<String> questions = new LinkedHashSet<>();
        for (String q : proposed) {
            if (questions.size() >= count) break;
            if (q != null && !q.isBlank()) questions.add(q.trim());
        }
        for (String category : missing) {
            if (questions.size() >= count) break;
            String q = QUESTIONS.get(category);
            questions.add(q != null ? q : "請補充：" + category);
        }
        for (String q : GENERIC_QUESTIONS) {
            if (questions.size() >= count) break;
            questions.add(q);
        }
        return new ArrayList<>(questions);
    }

    public static String clarificationFor(List<String> missing) {
        List<String> questions = followUpQuestions(missing, List.of(), Math.max(1, Math.min(3, missing.size())));
        return "為了提供辨證參考，請補充以下資訊：" + String.join(" ", questions);
    }

    private static Set<String> match(String text, List<String> vocabulary) {
        List<String> found = new ArrayList<>();
        for (String term : vocabulary) {
            if (text.contains(term) && found.stream().noneMatch(longer -> longer.contains(term))) {
                found.add(term);
            }
        }
        return new LinkedHashSet<>(found);
    }

    private static List<String> byLength(List<String> terms) {
        List<String> sorted = new ArrayList<>(terms);
        sorted.sort(Comparator.comparingInt(String::length).reversed());
        return List.copyOf(sorted);
    }

    private TermLexicon() {}
}
