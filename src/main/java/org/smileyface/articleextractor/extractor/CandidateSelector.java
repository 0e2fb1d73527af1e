package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.util.ExtractorUtils;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the article root among the scored candidates.
 * <p>
 * Candidates are ordered by final score (descending), then visible text length (descending), then
 * document order (ascending), which makes the choice deterministic for symmetric inputs. When the
 * best candidate is below {@link #SCORE_FLOOR} or has fewer than {@code minWordCount} words, the
 * body is tried once as the only candidate. If the body also misses the word floor, the best
 * candidate is kept and the selection is flagged as low content.
 */
public final class CandidateSelector {

    private static final Logger log = LoggerFactory.getLogger(CandidateSelector.class);

    public static final double SCORE_FLOOR = 5.0;

    public static final Comparator<ScoredCandidate> RANKING =
            Comparator.comparingDouble(ScoredCandidate::contentScore).reversed()
                    .thenComparing(Comparator.comparingInt(ScoredCandidate::textLength).reversed())
                    .thenComparingInt(ScoredCandidate::documentOrder);

    /**
     * @param scoring      result of the scoring pass
     * @param body         fallback element, usually the document body; may be null
     * @param minWordCount word floor a winner has to reach
     */
    public Selection select(ScoringResult scoring, Element body, int minWordCount) {
        Objects.requireNonNull(scoring, "scoring");
        Optional<ScoredCandidate> best = scoring.getCandidates().stream().min(RANKING);

        if (best.isPresent()) {
            ScoredCandidate winner = best.get();
            int words = ExtractorUtils.countWords(winner.element().text());
            if (winner.contentScore() >= SCORE_FLOOR && words >= minWordCount) {
                log.debug("Selected <{}> with score {} ({} words)",
                        winner.element().normalName(), winner.contentScore(), words);
                return new Selection(winner.element(), winner.contentScore(), false, false, words);
            }
        }

        Element fallback = body != null ? body : scoring.getRoot();
        int bodyWords = ExtractorUtils.countWords(fallback.text());
        if (bodyWords >= minWordCount && bodyWords > 0) {
            log.debug("Best candidate missed the floors, falling back to <{}> ({} words)",
                    fallback.normalName(), bodyWords);
            return new Selection(fallback, 0.0, true, false, bodyWords);
        }

        if (best.isPresent()) {
            ScoredCandidate winner = best.get();
            int words = ExtractorUtils.countWords(winner.element().text());
            log.debug("Low content: keeping <{}> with score {} ({} words)",
                    winner.element().normalName(), winner.contentScore(), words);
            return new Selection(winner.element(), winner.contentScore(), false, true, words);
        }
        log.debug("Low content: no candidates, keeping <{}> ({} words)", fallback.normalName(), bodyWords);
        return new Selection(fallback, 0.0, true, true, bodyWords);
    }
}
