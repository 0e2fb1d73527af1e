package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;
import org.smileyface.articleextractor.model.CandidateScore;

/**
 * A candidate container with its score and the measurements the selector tie-breaks on.
 *
 * @param element       the candidate element in the normalized tree
 * @param score         final score and its sub-scores
 * @param textLength    visible text length of the subtree
 * @param documentOrder preorder index of the element within the scored root
 */
public record ScoredCandidate(Element element, CandidateScore score, int textLength, int documentOrder) {

    public double contentScore() {
        return score.contentScore();
    }
}
