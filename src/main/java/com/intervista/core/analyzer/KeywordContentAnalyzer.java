package com.intervista.core.analyzer;

import com.intervista.core.model.AnalysisResult;
import com.intervista.core.model.Modality;
import com.intervista.core.state.AnalysisParameters;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Keyword-based scoring of the answer transcript.
 * <ul>
 *   <li>{@code structure}: coverage of the Situation / Task / Action / Result pattern and answer length</li>
 *   <li>{@code relevance}: overlap with the job position and its domain vocabulary</li>
 *   <li>{@code key_points}: concrete facts (numbers, named technologies, collaboration); analysis depth 2+</li>
 * </ul>
 * The text is the written transcript or, for audio-only submissions, the speech-to-text of the audio
 * track. Transcription itself belongs to the extraction step upstream.
 */
@Component
public class KeywordContentAnalyzer implements ContentCapability {

    static final String ANALYSIS_DEPTH = "analysis_depth";

    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern WORD = Pattern.compile("[^a-z0-9+#%]+");
    private static final Pattern NUMBER = Pattern.compile("\\d+(?:[.,]\\d+)?%?");

    private static final Map<String, List<String>> STAR_MARKERS = Map.of(
            "situation", List.of("situation", "context", "background", "when i was", "at my previous", "at my last"),
            "task", List.of("task", "goal", "responsible", "challenge", "needed to", "had to"),
            "action", List.of("i implemented", "i built", "i led", "i designed", "i decided", "i developed",
                    "i introduced", "i wrote", "action"),
            "result", List.of("result", "outcome", "improved", "reduced", "increased", "achieved", "saved"));

    private static final Set<String> TECH_TERMS = Set.of(
            "java", "python", "sql", "kafka", "spring", "kubernetes", "docker", "aws", "microservices",
            "api", "database", "postgresql", "redis", "react", "testing", "architecture", "algorithm",
            "machine", "learning", "cache", "latency", "pipeline");

    private static final Set<String> SOFT_TERMS = Set.of(
            "team", "collaborated", "communication", "mentored", "stakeholders", "led", "ownership");

    private static final Map<String, Set<String>> DOMAIN_VOCABULARY = Map.of(
            "engineer", Set.of("code", "design", "testing", "deploy", "architecture", "api"),
            "developer", Set.of("code", "feature", "testing", "review", "api"),
            "backend", Set.of("api", "database", "service", "latency", "scalability"),
            "frontend", Set.of("ui", "react", "component", "accessibility", "browser"),
            "data", Set.of("data", "model", "analysis", "pipeline", "sql", "statistics"),
            "manager", Set.of("team", "planning", "stakeholders", "roadmap", "hiring"));

    private final Clock clock;

    public KeywordContentAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AnalysisResult analyze(AnalysisInput input, Map<String, Double> params, Deadline deadline) {
        String answer = input.inputs().answerText()
                .orElseThrow(() -> new InputUnavailableException("No transcript available for content analysis"));
        double depth = Scores.param(params, AnalysisParameters.key(Modality.CONTENT, ANALYSIS_DEPTH), 2.0);
        if (depth < 1 || depth > 3) {
            throw new InvalidParamsException("content.analysis_depth must be within [1, 3], got " + depth);
        }

        String text = answer.toLowerCase(Locale.ROOT);
        List<String> words = Arrays.stream(WORD.split(text)).filter(w -> !w.isBlank()).toList();
        long sentences = Arrays.stream(SENTENCE_END.split(text)).filter(s -> !s.isBlank()).count();
        deadline.check("content tokenization");

        var starHits = new ArrayList<String>();
        STAR_MARKERS.forEach((part, markers) -> {
            if (markers.stream().anyMatch(text::contains)) starHits.add(part);
        });
        double lengthScore = Scores.band(sentences, 3, 30, 10);
        double structure = 0.8 * starHits.size() / STAR_MARKERS.size() + 0.2 * lengthScore;

        var wordSet = Set.copyOf(words);
        double relevance = relevance(input.userContext() == null ? null : input.userContext().jobPosition(), wordSet);
        deadline.check("content relevance");

        var scores = new LinkedHashMap<String, Double>();
        scores.put("relevance", Scores.round(relevance));
        scores.put("structure", Scores.round(Scores.clamp(structure)));

        long techTerms = wordSet.stream().filter(TECH_TERMS::contains).count();
        long softTerms = wordSet.stream().filter(SOFT_TERMS::contains).count();
        long numbers = NUMBER.matcher(text).results().count();
        if (depth >= 2) {
            scores.put("key_points", Scores.round(Scores.clamp((numbers + techTerms + softTerms) / 6.0)));
        }
        scores.put(AnalysisResult.OVERALL, Scores.round(Scores.mean(scores.values())));

        double confidence = 0.6 + 0.1 * depth;
        if (words.size() < 30) {
            confidence *= 0.7;
        }

        var raw = new LinkedHashMap<String, Object>();
        raw.put("word_count", words.size());
        raw.put("sentence_count", sentences);
        raw.put("star_parts", List.copyOf(starHits));
        raw.put("tech_terms", techTerms);
        return new AnalysisResult(input.taskId(), Modality.CONTENT, scores, raw,
                Scores.round(Scores.clamp(confidence)), clock.instant());
    }

    private static double relevance(String jobPosition, Set<String> words) {
        if (jobPosition == null || jobPosition.isBlank()) {
            return 0.5;
        }
        var vocabulary = new HashSet<String>();
        for (String token : WORD.split(jobPosition.toLowerCase(Locale.ROOT))) {
            if (token.length() < 3) continue;
            vocabulary.add(token);
            vocabulary.addAll(DOMAIN_VOCABULARY.getOrDefault(token, Set.of()));
        }
        if (vocabulary.isEmpty()) {
            return 0.5;
        }
        long hits = vocabulary.stream().filter(words::contains).count();
        return Scores.clamp(hits / Math.min(5.0, vocabulary.size()));
    }
}
