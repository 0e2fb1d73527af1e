package org.smileyface.articleextractor.extractor;

import org.jsoup.nodes.Comment;
import org.jsoup.nodes.DataNode;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.Elements;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.smileyface.articleextractor.util.ExtractorUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * First pipeline stage. Mutates the parsed tree in place so that only content-bearing markup
 * is left for scoring:
 * <ol>
 *     <li>removes non-content tags, comments, navigation/dialog roles and hidden elements;</li>
 *     <li>collapses whitespace in text outside {@code pre}, {@code code} and {@code textarea};</li>
 *     <li>merges adjacent text nodes;</li>
 *     <li>collapses {@code div} wrappers whose only child is another block container;</li>
 *     <li>drops empty elements bottom-up.</li>
 * </ol>
 * All walks are iterative, so arbitrarily deep documents are safe. Elements the normalizer does
 * not recognise are kept.
 */
public final class TreeNormalizer {

    public static final Set<String> DEFAULT_STRIP_TAGS =
            Set.of("script", "style", "noscript", "iframe", "nav", "aside", "form");

    private static final Set<String> PRESERVE_WHITESPACE = Set.of("pre", "code", "textarea");
    private static final Set<String> WRAPPER_TARGETS = Set.of("div", "section", "article", "main");
    private static final Set<String> KEEP_WHEN_EMPTY = Set.of("img", "video", "picture", "source", "br", "hr",
            "audio", "embed", "object", "svg", "canvas", "td", "th");
    private static final Set<String> STRUCTURAL = Set.of("html", "head", "body", "title", "meta", "link", "base");
    private static final Set<String> STRIPPED_ROLES = Set.of("navigation", "dialog");
    private static final List<ContentRule> HIDDEN_STYLE_RULES = List.of(
            new ElementStyleRule("display:none"),
            new ElementStyleRule("visibility:hidden"));

    private final Set<String> stripTags;

    public TreeNormalizer() {
        this(DEFAULT_STRIP_TAGS);
    }

    /**
     * @param stripTags tag names removed together with their subtree; null means the defaults
     */
    public TreeNormalizer(Collection<String> stripTags) {
        Set<String> tags = new LinkedHashSet<>();
        for (String t : stripTags == null ? DEFAULT_STRIP_TAGS : stripTags) {
            if (t != null && !t.isBlank()) tags.add(t.trim().toLowerCase(Locale.ROOT));
        }
        this.stripTags = Set.copyOf(tags);
    }

    public Set<String> getStripTags() {
        return stripTags;
    }

    public void normalize(Element root) {
        if (root == null) return;
        stripNonContent(root);
        collapseWhitespace(root);
        mergeAdjacentText(root);
        collapseWrappers(root);
        dropEmptyElements(root);
    }

    void stripNonContent(Element root) {
        NodeTraversor.filter(new NodeFilter() {
            @Override
            public FilterResult head(Node node, int depth) {
                if (node == root) return FilterResult.CONTINUE;
                if (node instanceof Comment) return FilterResult.REMOVE;
                if (node instanceof Element el && shouldStrip(el)) return FilterResult.REMOVE;
                return FilterResult.CONTINUE;
            }

            @Override
            public FilterResult tail(Node node, int depth) {
                return FilterResult.CONTINUE;
            }
        }, root);
    }

    private boolean shouldStrip(Element el) {
        String tag = el.normalName();
        if (STRUCTURAL.contains(tag)) return false;
        if (stripTags.contains(tag)) return true;
        if (STRIPPED_ROLES.contains(el.attr("role").trim().toLowerCase(Locale.ROOT))) return true;
        if ("true".equalsIgnoreCase(el.attr("aria-hidden").trim())) return true;
        if (el.hasAttr("hidden")) return true;
        for (ContentRule r : HIDDEN_STYLE_RULES) {
            if (r.isMatched(el)) return true;
        }
        return false;
    }

    void collapseWhitespace(Element root) {
        NodeTraversor.traverse(new NodeVisitor() {
            private int preserveDepth = 0;

            @Override
            public void head(Node node, int depth) {
                if (node instanceof Element el && PRESERVE_WHITESPACE.contains(el.normalName())) {
                    preserveDepth++;
                } else if (node instanceof TextNode text && preserveDepth == 0) {
                    String whole = text.getWholeText();
                    String collapsed = ExtractorUtils.collapseWhitespace(whole);
                    if (!collapsed.equals(whole)) text.text(collapsed);
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element el && PRESERVE_WHITESPACE.contains(el.normalName())) {
                    preserveDepth--;
                }
            }
        }, root);
    }

    void mergeAdjacentText(Element root) {
        NodeTraversor.traverse(new NodeVisitor() {
            private int preserveDepth = 0;

            @Override
            public void head(Node node, int depth) {
                if (!(node instanceof Element el)) return;
                if (PRESERVE_WHITESPACE.contains(el.normalName())) preserveDepth++;
                mergeChildren(el, preserveDepth > 0);
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element el && PRESERVE_WHITESPACE.contains(el.normalName())) {
                    preserveDepth--;
                }
            }
        }, root);
    }

    private static void mergeChildren(Element el, boolean preserve) {
        TextNode previous = null;
        for (Node child : new ArrayList<>(el.childNodes())) {
            if (child.getClass() == TextNode.class) {
                TextNode text = (TextNode) child;
                if (previous != null) {
                    String merged = previous.getWholeText() + text.getWholeText();
                    previous.text(preserve ? merged : ExtractorUtils.collapseWhitespace(merged));
                    text.remove();
                } else {
                    previous = text;
                }
            } else {
                previous = null;
            }
        }
    }

    void collapseWrappers(Element root) {
        for (Element div : root.getElementsByTag("div")) {
            if (div == root || div.parent() == null) continue;
            Element only = onlyChildElement(div);
            if (only == null || !WRAPPER_TARGETS.contains(only.normalName())) continue;
            for (String cls : div.classNames()) {
                only.addClass(cls);
            }
            if (only.id().isEmpty() && !div.id().isEmpty()) {
                only.id(div.id());
            }
            if (!only.hasAttr("role") && div.hasAttr("role")) {
                only.attr("role", div.attr("role"));
            }
            div.replaceWith(only);
        }
    }

    void dropEmptyElements(Element root) {
        Elements all = root.getAllElements();
        for (int i = all.size() - 1; i >= 0; i--) {
            Element el = all.get(i);
            if (el == root || el.parent() == null) continue;
            String tag = el.normalName();
            if (STRUCTURAL.contains(tag) || KEEP_WHEN_EMPTY.contains(tag)) continue;
            if (el.childrenSize() == 0 && !hasOwnText(el)) {
                el.remove();
            }
        }
    }

    private static Element onlyChildElement(Element el) {
        Element found = null;
        for (Node child : el.childNodes()) {
            if (child instanceof Element e) {
                if (found != null) return null;
                found = e;
            } else if (child instanceof TextNode t) {
                if (!t.isBlank()) return null;
            } else if (!(child instanceof Comment)) {
                return null;
            }
        }
        return found;
    }

    private static boolean hasOwnText(Element el) {
        for (Node child : el.childNodes()) {
            if (child instanceof TextNode t && !t.isBlank()) return true;
            if (child instanceof DataNode d && !d.getWholeData().isBlank()) return true;
        }
        return false;
    }
}
