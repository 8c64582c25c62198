package fr.lapetina.lex.core.domain.routing;

import fr.lapetina.lex.core.domain.model.QueryComplexity;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores a prompt against keyword patterns for each complexity class.
 *
 * <p>The score of a class is the total number of keyword matches in the prompt,
 * matched case-insensitively on word boundaries.
 * The highest-scoring class wins; ties go to the more demanding class, and a
 * prompt matching nothing is {@link QueryComplexity#SIMPLE}.
 */
public final class ComplexityClassifier {

    private final Map<QueryComplexity, List<Pattern>> patterns;

    public ComplexityClassifier(Map<QueryComplexity, List<Pattern>> patterns) {
        this.patterns = new EnumMap<>(patterns);
    }

    public static ComplexityClassifier withDefaults() {
        Map<QueryComplexity, List<Pattern>> defaults = new EnumMap<>(QueryComplexity.class);
        defaults.put(QueryComplexity.SIMPLE, compile(
                "what is|define|explain simply",
                "yes|no|true|false",
                "list|name|count",
                "when|where|who"));
        defaults.put(QueryComplexity.MODERATE, compile(
                "how to|explain how|analyze|compare",
                "code|program|function|algorithm",
                "solve|calculate|compute",
                "summarize|outline|describe"));
        defaults.put(QueryComplexity.COMPLEX, compile(
                "design|architect|strategy|plan",
                "evaluate|critique|assess",
                "research|investigate|analyze deeply",
                "optimize|improve|enhance"));
        defaults.put(QueryComplexity.CREATIVE, compile(
                "create|generate|write|compose",
                "story|poem|creative|artistic",
                "imagine|brainstorm|innovate",
                "design something new|invent"));
        return new ComplexityClassifier(defaults);
    }

    public QueryComplexity classify(String prompt) {
        Map<QueryComplexity, Integer> scores = score(prompt);
        QueryComplexity best = QueryComplexity.SIMPLE;
        int bestScore = 0;
        for (QueryComplexity complexity : QueryComplexity.values()) {
            int value = scores.getOrDefault(complexity, 0);
            if (value > 0 && value >= bestScore) {
                best = complexity;
                bestScore = value;
            }
        }
        return best;
    }

    public Map<QueryComplexity, Integer> score(String prompt) {
        Map<QueryComplexity, Integer> scores = new EnumMap<>(QueryComplexity.class);
        if (prompt == null || prompt.isBlank()) {
            return scores;
        }
        patterns.forEach((complexity, list) -> {
            int total = 0;
            for (Pattern pattern : list) {
                Matcher matcher = pattern.matcher(prompt);
                while (matcher.find()) {
                    total++;
                }
            }
            scores.put(complexity, total);
        });
        return scores;
    }

    private static List<Pattern> compile(String... regexes) {
        return Arrays.stream(regexes)
                .map(regex -> Pattern.compile("\\b(?:" + regex + ")\\b", Pattern.CASE_INSENSITIVE))
                .toList();
    }
}
