package org.smileyface.articleextractor.extractor.metadata;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Guesses the language of a text by counting common function words.
 * Only a small set of languages is known; the result is empty when the text is too short or
 * two languages score the same.
 */
public final class LanguageDetector {

    static final int MIN_HITS = 3;
    static final int MAX_TOKENS = 2000;

    private static final Pattern WORD = Pattern.compile("\\p{L}+");

    private static final Map<String, Set<String>> STOPWORDS = new LinkedHashMap<>();

    static {
        STOPWORDS.put("en", Set.of("the", "and", "of", "to", "is", "in", "that", "it", "was", "for",
                "with", "as", "on", "are", "this", "be", "by", "have", "from", "not"));
        STOPWORDS.put("de", Set.of("der", "die", "das", "und", "ist", "nicht", "ein", "eine", "zu", "den",
                "mit", "sich", "auf", "für", "von", "dem", "des", "auch", "wird", "sind"));
        STOPWORDS.put("fr", Set.of("le", "la", "les", "et", "est", "des", "une", "dans", "que", "pour",
                "pas", "sur", "qui", "au", "du", "avec", "ce", "sont", "par", "plus"));
        STOPWORDS.put("es", Set.of("el", "los", "las", "y", "es", "una", "que", "en", "por", "con",
                "para", "del", "se", "su", "al", "lo", "como", "más", "pero", "son"));
        STOPWORDS.put("it", Set.of("il", "di", "che", "è", "la", "per", "una", "sono", "gli", "non",
                "con", "del", "della", "si", "anche", "nel", "alla", "come", "più", "questo"));
        STOPWORDS.put("pt", Set.of("o", "os", "as", "de", "que", "é", "um", "uma", "para", "com",
                "não", "se", "em", "do", "da", "no", "na", "por", "mais", "são"));
        STOPWORDS.put("nl", Set.of("de", "het", "een", "en", "van", "is", "dat", "niet", "op", "te",
                "zijn", "met", "voor", "ook", "aan", "er", "maar", "om", "hij", "wordt"));
    }

    public Optional<String> detect(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        Map<String, Integer> hits = new LinkedHashMap<>();
        STOPWORDS.keySet().forEach(lang -> hits.put(lang, 0));

        Matcher m = WORD.matcher(text.toLowerCase(Locale.ROOT));
        int tokens = 0;
        while (m.find() && tokens < MAX_TOKENS) {
            tokens++;
            String word = m.group();
            for (Map.Entry<String, Set<String>> e : STOPWORDS.entrySet()) {
                if (e.getValue().contains(word)) hits.merge(e.getKey(), 1, Integer::sum);
            }
        }

        String best = null;
        int bestHits = 0;
        int runnerUp = 0;
        for (Map.Entry<String, Integer> e : hits.entrySet()) {
            int n = e.getValue();
            if (n > bestHits) {
                runnerUp = bestHits;
                bestHits = n;
                best = e.getKey();
            } else if (n > runnerUp) {
                runnerUp = n;
            }
        }
        if (best == null || bestHits < MIN_HITS || bestHits == runnerUp) return Optional.empty();
        return Optional.of(best);
    }
}
