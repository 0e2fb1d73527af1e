package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only outcome of the scoring pass: every candidate in document order plus an identity
 * lookup from element to its score.
 */
public final class ScoringResult {

    private final Element root;
    private final List<ScoredCandidate> candidates;
    private final Map<Element, ScoredCandidate> byElement;

    ScoringResult(Element root, List<ScoredCandidate> candidates) {
        this.root = root;
        this.candidates = List.copyOf(candidates);
        Map<Element, ScoredCandidate> map = new IdentityHashMap<>();
        for (ScoredCandidate c : candidates) {
            map.put(c.element(), c);
        }
        this.byElement = Collections.unmodifiableMap(map);
    }

    public Element getRoot() {
        return root;
    }

    public List<ScoredCandidate> getCandidates() {
        return candidates;
    }

    public Optional<ScoredCandidate> find(Element element) {
        return Optional.ofNullable(byElement.get(element));
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }
}
