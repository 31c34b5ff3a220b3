package email.labeler.app.service;

import email.labeler.app.model.CategoryConfig;
import email.labeler.app.model.Email;
import email.labeler.app.model.GlobalSettings;
import email.labeler.app.model.ScoringWeights;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Weighted rule score of one message against one category. Pure function of the
 * message text fields, the category rules and the weights.
 */
@Component
public class RuleScorer {

    /**
     * Individual score components, summed by {@link #total()}.
     */
    @Value
    public static class ScoreBreakdown {
        double domain;
        double subject;
        double content;
        double exclusion;
        double negative;
        double priority;

        public double total() {
            return domain + subject + content + exclusion + negative + priority;
        }
    }

    public double score(Email email, CategoryConfig category, ScoringWeights weights, GlobalSettings settings) {
        return breakdown(email, category, weights, settings).total();
    }

    public ScoreBreakdown breakdown(Email email, CategoryConfig category, ScoringWeights weights, GlobalSettings settings) {
        boolean caseSensitive = settings.isCaseSensitive();
        String subject = normalize(email.getSubject(), caseSensitive);
        String content = normalize(email.contentText(), caseSensitive);
        String sender = normalize(email.getSender(), caseSensitive);

        double domain = domainScore(email.senderDomain(), category, weights);
        double subjectScore = keywordScore(subject, category.getSubjectHighKeywords(), weights.getSubjectHigh(), caseSensitive)
                + keywordScore(subject, category.getSubjectMediumKeywords(), weights.getSubjectMedium(), caseSensitive);
        double contentScore = 0.0;
        if (settings.isEnableContentAnalysis()) {
            contentScore = keywordScore(content, category.getContentHighKeywords(), weights.getContentHigh(), caseSensitive)
                    + keywordScore(content, category.getContentMediumKeywords(), weights.getContentMedium(), caseSensitive);
        }
        double exclusion = exclusionPenalty(String.join(" ", subject, content, sender),
                category.getExclusions(), weights.getExclusionPenalty(), caseSensitive);
        double negative = keywordScore(String.join(" ", subject, content),
                category.getNegativeKeywords(), weights.getNegativeKeywordPenalty(), caseSensitive);
        double priority = (10 - category.getPriority()) * weights.getPriorityBonus();

        return new ScoreBreakdown(domain, subjectScore, contentScore, exclusion, negative, priority);
    }

    private double domainScore(String senderDomain, CategoryConfig category, ScoringWeights weights) {
        if (senderDomain.isEmpty()) {
            return 0.0;
        }
        if (containsAny(senderDomain, category.getHighConfidenceDomains())) {
            return weights.getDomainHighConfidence();
        }
        if (containsAny(senderDomain, category.getMediumConfidenceDomains())) {
            return weights.getDomainMediumConfidence();
        }
        return 0.0;
    }

    private static boolean containsAny(String senderDomain, List<String> domains) {
        for (String domain : domains) {
            if (senderDomain.contains(domain.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    // Every matching keyword adds the weight once; matches are not capped.
    private static double keywordScore(String text, List<String> keywords, double weight, boolean caseSensitive) {
        if (text.isEmpty()) {
            return 0.0;
        }
        double score = 0.0;
        for (String keyword : keywords) {
            if (text.contains(normalize(keyword, caseSensitive))) {
                score += weight;
            }
        }
        return score;
    }

    // First matching exclusion applies the penalty; further matches add nothing.
    private static double exclusionPenalty(String text, List<String> exclusions, double penalty, boolean caseSensitive) {
        for (String exclusion : exclusions) {
            if (text.contains(normalize(exclusion, caseSensitive))) {
                return penalty;
            }
        }
        return 0.0;
    }

    private static String normalize(String text, boolean caseSensitive) {
        if (text == null) {
            return "";
        }
        return caseSensitive ? text : text.toLowerCase(Locale.ROOT);
    }
}
