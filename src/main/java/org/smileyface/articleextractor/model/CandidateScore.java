package org.smileyface.articleextractor.model;

/**
 * Score of one candidate container together with the terms it was computed from.
 * Produced once by the scorer; the sub-scores are kept so selection decisions can be explained.
 *
 * @param contentScore    final score used for selection
 * @param textDensity     visible text length per element in the subtree
 * @param linkDensity     share of visible text that sits inside anchors
 * @param tagBonus        sum of the rule table deltas matched by tag, class or id
 * @param paragraphCount  paragraphs of at least the minimum length owned by this container
 * @param commaCount      commas in the text owned by this container
 * @param propagatedScore score received from descendant candidates
 */
public record CandidateScore(double contentScore,
                             double textDensity,
                             double linkDensity,
                             double tagBonus,
                             int paragraphCount,
                             int commaCount,
                             double propagatedScore) {
}
