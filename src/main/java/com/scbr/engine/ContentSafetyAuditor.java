package com.scbr.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ContentSafetyAuditor - Deterministic content rules applied to every reviewed draft.
 *
 * <p>Specific dosages and absolute-cure claims are rewritten with fixed phrases. Leaked system
 * text or personal data rejects the draft outright.</p>
 */
public class ContentSafetyAuditor {

    public static final String CONSULT_PROFESSIONAL = "（具體方藥與劑量請諮詢專業中醫師）";
    public static final String SOFTENED_CURE = "有機會改善";
    public static final String SOFTENED_EFFECT = "可能有幫助";

    private static final Pattern HERBAL_DOSAGE = Pattern.compile(
        "(服用|吃|使用)?[\\u4e00-\\u9fff]{1,10}(湯|丸|散|膏|飲)\\s*\\d+(\\.\\d+)?\\s*(公克|克|錢|毫克|g|mg)");
    private static final Pattern BARE_DOSAGE = Pattern.compile(
        "(每次|每日|一日)\\s*\\d+(\\.\\d+)?\\s*(公克|克|錢|毫克|g|mg|顆|包)");
    private static final Pattern ABSOLUTE_CURE = Pattern.compile(
        "(一定|必定|肯定|保證)(能|會|可以)(治癒|治好|康復|根治)");
    private static final Pattern ABSOLUTE_EFFECT = Pattern.compile("(絕對|百分百|100%)(有效|見效)");

    private static final List<Pattern> SYSTEM_LEAKS = List.of(
        Pattern.compile("(?i)system\\s*prompt"),
        Pattern.compile("系統提示"),
        Pattern.compile("(?i)<<SYS>>|\\[INST]"),
        Pattern.compile("(?i)as an ai language model"),
        Pattern.compile("(?i)(gemini|openai)_?api_?key"));

    private static final List<Pattern> PERSONAL_DATA = List.of(
        Pattern.compile("09\\d{2}-?\\d{3}-?\\d{3}"),                      // mobile number
        Pattern.compile("(?<![A-Za-z0-9])[A-Z][12]\\d{8}(?![0-9])"),          // national id
        Pattern.compile("[\\w.+-]+@[\\w-]+\\.[\\w.]+"));                   // email

    public ReviewVerdict audit(String text) {
        List<String> issues = new ArrayList<>();
        if (text == null || text.isBlank()) {
            issues.add("empty draft");
            return new ReviewVerdict(ReviewVerdict.Outcome.REJECTED, null, issues, true);
        }

        for (Pattern leak : SYSTEM_LEAKS) {
            if (leak.matcher(text).find()) {
                issues.add("leaked system text");
                return new ReviewVerdict(ReviewVerdict.Outcome.REJECTED, null, issues, true);
            }
        }
        for (Pattern pii : PERSONAL_DATA) {
            if (pii.matcher(text).find()) {
                issues.add("leaked personal data");
                return new ReviewVerdict(ReviewVerdict.Outcome.REJECTED, null, issues, true);
            }
        }

        String rewritten = text;
        rewritten = replace(rewritten, HERBAL_DOSAGE, CONSULT_PROFESSIONAL, "specific dosage", issues);
        rewritten = replace(rewritten, BARE_DOSAGE, CONSULT_PROFESSIONAL, "specific dosage", issues);
        rewritten = replace(rewritten, ABSOLUTE_CURE, SOFTENED_CURE, "absolute-cure language", issues);
        rewritten = replace(rewritten, ABSOLUTE_EFFECT, SOFTENED_EFFECT, "absolute-effect language", issues);

        ReviewVerdict.Outcome outcome = issues.isEmpty() ? ReviewVerdict.Outcome.PASSED : ReviewVerdict.Outcome.REWRITTEN;
        return new ReviewVerdict(outcome, rewritten, issues, true);
    }

    private static String replace(String text, Pattern pattern, String replacement, String issue, List<String> issues) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            return text;
        }
        if (!issues.contains(issue)) {
            issues.add(issue);
        }
        return matcher.replaceAll(Matcher.quoteReplacement(replacement));
    }
}
