package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.smileyface.articleextractor.model.CandidateScore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Scores every plausible content container below a root element.
 * <p>
 * One iterative traversal measures, per element, the visible text length, the text inside
 * anchors, the element count of the subtree, the commas in text owned by the nearest candidate
 * and the paragraphs owned by it. The scores are then derived from those measurements:
 * <pre>
 * own   = rule bonus + min(density / 10, 20) + 3 * paragraphs + 1 * commas
 * total = own + 0.5 * adjusted(own of child candidates) + 0.25 * adjusted(own of grandchild candidates)
 * final = adjusted(total)
 * </pre>
 * where {@code adjusted} scales a positive score by {@code 1 - linkDensity} and subtracts
 * {@code 50 * linkDensity} once the link density exceeds 0.33. "Child" and "grandchild" refer to
 * the candidate hierarchy, so wrappers that are not candidates are skipped over.
 * <p>
 * The traversal also verifies the parent back references; a node whose parent is not the
 * element currently on top of the traversal stack raises {@link TreeInvariantException}.
 */
public final class CandidateScorer {

    private static final Logger log = LoggerFactory.getLogger(CandidateScorer.class);

    public static final Set<String> CANDIDATE_TAGS =
            Set.of("article", "main", "section", "div", "td", "p", "pre", "blockquote");

    public static final double DENSITY_DIVISOR = 10.0;
    public static final double DENSITY_CAP = 20.0;
    public static final double PARAGRAPH_WEIGHT = 3.0;
    public static final double COMMA_WEIGHT = 1.0;
    /** Paragraphs count once their text is longer than 25 characters. */
    public static final int MIN_PARAGRAPH_CHARS = 26;
    public static final double PARENT_DAMPING = 0.5;
    public static final double GRANDPARENT_DAMPING = 0.25;
    public static final double LINK_DENSITY_THRESHOLD = 0.33;
    public static final double LINK_DENSITY_PENALTY = 50.0;

    private final ScoringRules rules;
    private final MinCharacterRule paragraphRule = new MinCharacterRule(MIN_PARAGRAPH_CHARS);

    public CandidateScorer() {
        this(ScoringRules.defaults());
    }

    public CandidateScorer(ScoringRules rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public ScoringRules getRules() {
        return rules;
    }

    public static boolean isCandidate(Element element) {
        return element != null && CANDIDATE_TAGS.contains(element.normalName());
    }

    /**
     * Applies the link-density adjustment to a raw score.
     */
    public static double adjustForLinks(double score, double linkDensity) {
        double adjusted = score >= 0.0 ? score * (1.0 - linkDensity) : score;
        if (linkDensity > LINK_DENSITY_THRESHOLD) {
            adjusted -= LINK_DENSITY_PENALTY * linkDensity;
        }
        return adjusted;
    }

    public ScoringResult score(Element root) {
        Objects.requireNonNull(root, "root");
        Measurements measurements = new Measurements(root, paragraphRule);
        NodeTraversor.traverse(measurements, root);

        List<Frame> frames = measurements.candidates;
        Map<Frame, double[]> scores = new IdentityHashMap<>();
        for (Frame f : frames) {
            double bonus = rules.bonusFor(f.element);
            double density = f.textLength / (double) Math.max(1, f.elementCount);
            double linkDensity = f.anchorLength / (double) Math.max(1, f.textLength);
            double own = bonus
                    + Math.min(density / DENSITY_DIVISOR, DENSITY_CAP)
                    + PARAGRAPH_WEIGHT * f.paragraphs
                    + COMMA_WEIGHT * f.commas;
            // {bonus, density, linkDensity, own, propagated}
            scores.put(f, new double[]{bonus, density, linkDensity, own, 0.0});
        }

        for (Frame f : frames) {
            double[] s = scores.get(f);
            double adjustedOwn = adjustForLinks(s[3], s[2]);
            Frame parent = f.parentCandidate;
            if (parent == null) continue;
            scores.get(parent)[4] += PARENT_DAMPING * adjustedOwn;
            Frame grandparent = parent.parentCandidate;
            if (grandparent != null) {
                scores.get(grandparent)[4] += GRANDPARENT_DAMPING * adjustedOwn;
            }
        }

        List<ScoredCandidate> out = new ArrayList<>(frames.size());
        for (Frame f : frames) {
            double[] s = scores.get(f);
            double contentScore = adjustForLinks(s[3] + s[4], s[2]);
            CandidateScore score = new CandidateScore(contentScore, s[1], s[2], s[0], f.paragraphs, f.commas, s[4]);
            out.add(new ScoredCandidate(f.element, score, f.textLength, f.order));
        }
        log.debug("Scored {} candidates below <{}>", out.size(), root.normalName());
        return new ScoringResult(root, out);
    }

    /**
     * Per-element accumulator. Candidate frames outlive the traversal; others are discarded once
     * their totals are folded into the parent frame.
     */
    private static final class Frame {
        final Element element;
        final boolean candidate;
        final Frame parentCandidate;
        final int order;
        int textLength;
        int anchorLength;
        int elementCount = 1;
        int commas;
        int paragraphs;

        Frame(Element element, boolean candidate, Frame parentCandidate, int order) {
            this.element = element;
            this.candidate = candidate;
            this.parentCandidate = parentCandidate;
            this.order = order;
        }

        Frame ownerCandidate() {
            return candidate ? this : parentCandidate;
        }
    }

    private static final class Measurements implements NodeVisitor {
        private final Element root;
        private final MinCharacterRule paragraphRule;
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final List<Frame> candidates = new ArrayList<>();
        private int order = 0;
        private int anchorDepth = 0;

        Measurements(Element root, MinCharacterRule paragraphRule) {
            this.root = root;
            this.paragraphRule = paragraphRule;
        }

        @Override
        public void head(Node node, int depth) {
            Frame top = stack.peek();
            if (node != root) {
                if (top == null || node.parentNode() != top.element) {
                    throw new TreeInvariantException("Parent reference of <" + node.nodeName()
                            + "> does not match its position in the tree");
                }
            }
            if (node instanceof Element el) {
                boolean candidate = isCandidate(el);
                Frame parentCandidate = top == null ? null : top.ownerCandidate();
                Frame frame = new Frame(el, candidate, parentCandidate, order++);
                if (candidate) candidates.add(frame);
                if ("a".equals(el.normalName())) anchorDepth++;
                stack.push(frame);
            } else if (node instanceof TextNode text && top != null) {
                if (text.isBlank()) return;
                String value = text.text();
                top.textLength += value.length();
                if (anchorDepth > 0) top.anchorLength += value.length();
                Frame owner = top.ownerCandidate();
                if (owner != null) owner.commas += countCommas(value);
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element el)) return;
            Frame frame = stack.pop();
            if ("a".equals(el.normalName())) anchorDepth--;
            if ("p".equals(el.normalName()) && frame.parentCandidate != null
                    && paragraphRule.isLongEnough(frame.textLength)) {
                frame.parentCandidate.paragraphs++;
            }
            Frame parent = stack.peek();
            if (parent != null) {
                parent.textLength += frame.textLength;
                parent.anchorLength += frame.anchorLength;
                parent.elementCount += frame.elementCount;
            }
        }

        private static int countCommas(String text) {
            int n = 0;
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == ',' || c == '\uFF0C' || c == '\u3001') n++;
            }
            return n;
        }
    }
}
