package org.smileyface.articleextractor.serializer;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a cleaned subtree as GitHub-flavored Markdown.
 * <p>
 * The walk is iterative. Elements whose output depends on their rendered content (headings,
 * emphasis, links, list items, quotes, tables) open a {@link Frame} on the way down; the frame's
 * buffer is wrapped and appended to the enclosing frame on the way up.
 */
public final class MarkdownSerializer {

    private static final Set<String> BLOCK_TAGS = Set.of("p", "div", "section", "article", "main", "header",
            "footer", "figure", "figcaption", "dl", "dt", "dd", "details", "summary", "address", "caption");
    private static final Set<String> FRAMED_TAGS = Set.of("h1", "h2", "h3", "h4", "h5", "h6", "blockquote",
            "ul", "ol", "li", "code", "strong", "b", "em", "i", "del", "s", "strike", "a", "table", "tr", "td", "th");
    private static final Set<String> EMPHASIS_TAGS = Set.of("strong", "b", "em", "i", "del", "s", "strike");
    private static final Pattern CODE_LANGUAGE = Pattern.compile("(?:^|\\s)(?:language|lang)-([\\w+#.-]+)");
    private static final Pattern BACKTICK_RUN = Pattern.compile("`+");
    private static final Pattern MULTI_NEWLINE = Pattern.compile("\n{2,}");
    private static final Pattern ANY_NEWLINE = Pattern.compile("\\s*\n\\s*");

    public String serialize(Element root) {
        if (root == null) return "";
        Walker walker = new Walker(root);
        NodeTraversor.filter(walker, root);
        return tidy(walker.result());
    }

    /**
     * Collapses three or more newlines into two and trims trailing spaces, leaving fenced code
     * untouched, then trims the whole output.
     */
    static String tidy(String markdown) {
        StringBuilder out = new StringBuilder(markdown.length());
        String fence = null;
        int blankRun = 0;
        for (String line : markdown.split("\n", -1)) {
            String trimmed = line.strip();
            if (fence != null) {
                out.append(line).append('\n');
                if (trimmed.equals(fence)) fence = null;
                continue;
            }
            if (trimmed.startsWith("```") || trimmed.startsWith("~~~")) {
                fence = trimmed.replaceAll("^([`~]+).*$", "$1");
            }
            if (trimmed.isEmpty()) {
                if (++blankRun > 1) continue;
                out.append('\n');
                continue;
            }
            blankRun = 0;
            out.append(line.stripTrailing()).append('\n');
        }
        return out.toString().strip();
    }

    static String escape(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\', '*', '_', '`', '[', ']' -> sb.append('\\').append(c);
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    static String escapeUrl(String url) {
        return url.trim().replace(" ", "%20").replace("(", "%28").replace(")", "%29");
    }

    static String fenceFor(String code) {
        int longest = 0;
        Matcher m = BACKTICK_RUN.matcher(code);
        while (m.find()) {
            longest = Math.max(longest, m.group().length());
        }
        return "`".repeat(Math.max(3, longest + 1));
    }

    static String codeLanguage(Element pre) {
        List<Element> sources = new ArrayList<>();
        sources.add(pre);
        Element code = pre.selectFirst("code");
        if (code != null) sources.add(code);
        for (Element e : sources) {
            Matcher m = CODE_LANGUAGE.matcher(e.className());
            if (m.find()) return m.group(1).toLowerCase(Locale.ROOT);
        }
        return "";
    }

    private static final class Frame {
        final Element element;
        final StringBuilder sb = new StringBuilder();
        final List<String> cells = new ArrayList<>();
        final List<List<String>> rows = new ArrayList<>();
        int itemIndex;

        Frame(Element element) {
            this.element = element;
        }
    }

    private static final class Walker implements NodeFilter {
        private final Element root;
        private final Deque<Frame> frames = new ArrayDeque<>();
        private int literalDepth = 0;

        Walker(Element root) {
            this.root = root;
            frames.push(new Frame(null));
        }

        String result() {
            return frames.getLast().sb.toString();
        }

        private StringBuilder out() {
            return frames.peek().sb;
        }

        @Override
        public FilterResult head(Node node, int depth) {
            if (node instanceof TextNode text) {
                appendText(text);
                return FilterResult.CONTINUE;
            }
            if (!(node instanceof Element el)) return FilterResult.CONTINUE;
            String tag = el.normalName();
            switch (tag) {
                case "pre" -> {
                    writeCodeBlock(el);
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "img" -> {
                    writeImage(el);
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "br" -> {
                    out().append("\\\n");
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "hr" -> {
                    out().append("\n\n---\n\n");
                    return FilterResult.SKIP_ENTIRELY;
                }
                case "script", "style", "video", "audio", "source" -> {
                    return FilterResult.SKIP_ENTIRELY;
                }
                default -> {
                    // fall through to the generic handling below
                }
            }
            if (BLOCK_TAGS.contains(tag) && el != root) out().append("\n\n");
            if (FRAMED_TAGS.contains(tag)) {
                frames.push(new Frame(el));
                if ("code".equals(tag)) literalDepth++;
            }
            return FilterResult.CONTINUE;
        }

        @Override
        public FilterResult tail(Node node, int depth) {
            if (!(node instanceof Element el)) return FilterResult.CONTINUE;
            String tag = el.normalName();
            if (FRAMED_TAGS.contains(tag)) {
                Frame frame = frames.pop();
                if ("code".equals(tag)) literalDepth--;
                close(tag, frame);
            }
            if (BLOCK_TAGS.contains(tag) && el != root) out().append("\n\n");
            return FilterResult.CONTINUE;
        }

        private void close(String tag, Frame frame) {
            String content = frame.sb.toString();
            switch (tag) {
                case "h1", "h2", "h3", "h4", "h5", "h6" -> {
                    String text = inline(content);
                    if (!text.isEmpty()) {
                        out().append("\n\n").append("#".repeat(tag.charAt(1) - '0')).append(' ')
                                .append(text).append("\n\n");
                    }
                }
                case "blockquote" -> {
                    String body = tidy(content);
                    if (body.isEmpty()) return;
                    StringBuilder quoted = new StringBuilder("\n\n");
                    for (String line : body.split("\n", -1)) {
                        quoted.append(line.isEmpty() ? ">" : "> " + line).append('\n');
                    }
                    out().append(quoted).append('\n');
                }
                case "ul", "ol" -> {
                    String body = content.strip();
                    if (!body.isEmpty()) out().append("\n\n").append(body).append("\n\n");
                }
                case "li" -> closeListItem(frame, content);
                case "code" -> {
                    if (content.isEmpty()) return;
                    if (content.contains("`")) {
                        out().append("`` ").append(content).append(" ``");
                    } else {
                        out().append('`').append(content).append('`');
                    }
                }
                case "strong", "b" -> wrapInline(content, "**");
                case "em", "i" -> wrapInline(content, "*");
                case "del", "s", "strike" -> wrapInline(content, "~~");
                case "a" -> closeLink(frame.element, content);
                case "td", "th" -> {
                    Frame row = nearest("tr");
                    String cell = inline(content).replace("|", "\\|");
                    if (row != null) {
                        row.cells.add(cell);
                    } else {
                        appendInline(cell);
                    }
                }
                case "tr" -> {
                    Frame table = nearest("table");
                    if (table != null && !frame.cells.isEmpty()) {
                        table.rows.add(new ArrayList<>(frame.cells));
                    }
                }
                case "table" -> writeTable(frame.rows);
                default -> out().append(content);
            }
        }

        private void closeListItem(Frame item, String content) {
            Frame list = nearestList();
            String marker;
            if (list != null && "ol".equals(list.element.normalName())) {
                marker = (startOf(list.element) + list.itemIndex) + ". ";
            } else {
                marker = "- ";
            }
            if (list != null) list.itemIndex++;

            String body = content.strip();
            if (item.element.getElementsByTag("pre").isEmpty()) {
                body = MULTI_NEWLINE.matcher(body).replaceAll("\n");
            }
            String indent = " ".repeat(marker.length());
            StringBuilder sb = new StringBuilder();
            StringBuilder target = out();
            if (target.length() > 0 && target.charAt(target.length() - 1) != '\n') sb.append('\n');
            sb.append(marker);
            String[] lines = body.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) {
                    sb.append('\n');
                    if (!lines[i].isEmpty()) sb.append(indent);
                }
                sb.append(lines[i]);
            }
            target.append(sb).append('\n');
        }

        private void closeLink(Element a, String content) {
            String text = inline(content);
            String href = a.attr("href").trim();
            if (href.isEmpty()) {
                appendInline(text);
            } else if (!text.isEmpty()) {
                appendInline("[" + text + "](" + escapeUrl(href) + ")");
            }
        }

        private void writeCodeBlock(Element pre) {
            String code = pre.wholeText();
            if (code.startsWith("\n")) code = code.substring(1);
            code = code.stripTrailing();
            if (code.isEmpty()) return;
            String fence = fenceFor(code);
            out().append("\n\n").append(fence).append(codeLanguage(pre)).append('\n')
                    .append(code).append('\n').append(fence).append("\n\n");
        }

        private void writeImage(Element img) {
            String src = img.attr("src").trim();
            if (src.isEmpty()) return;
            String alt = escape(ANY_NEWLINE.matcher(img.attr("alt")).replaceAll(" ").strip());
            appendInline("![" + alt + "](" + escapeUrl(src) + ")");
        }

        private void writeTable(List<List<String>> rows) {
            if (rows.isEmpty()) return;
            int columns = 0;
            for (List<String> r : rows) {
                columns = Math.max(columns, r.size());
            }
            StringBuilder sb = new StringBuilder("\n\n");
            for (int i = 0; i < rows.size(); i++) {
                appendRow(sb, rows.get(i), columns);
                if (i == 0) {
                    sb.append('|');
                    for (int c = 0; c < columns; c++) {
                        sb.append(" --- |");
                    }
                    sb.append('\n');
                }
            }
            out().append(sb).append('\n');
        }

        private static void appendRow(StringBuilder sb, List<String> cells, int columns) {
            sb.append('|');
            for (int c = 0; c < columns; c++) {
                String cell = c < cells.size() ? cells.get(c) : "";
                sb.append(' ').append(cell).append(cell.isEmpty() ? "|" : " |");
            }
            sb.append('\n');
        }

        private void wrapInline(String content, String marker) {
            String inner = inline(content);
            if (inner.isEmpty()) return;
            if (!content.isEmpty() && Character.isWhitespace(content.charAt(0))) appendInline(" ");
            appendInline(marker + inner + marker);
            if (!content.isEmpty() && Character.isWhitespace(content.charAt(content.length() - 1))) {
                out().append(' ');
            }
        }

        private void appendText(TextNode text) {
            if (literalDepth > 0) {
                out().append(text.getWholeText());
                return;
            }
            String value = text.text();
            if (value.isEmpty()) return;
            StringBuilder sb = out();
            // a leading space inside emphasis is moved in front of the marker when the frame closes
            boolean openingEmphasis = sb.length() == 0 && frames.peek().element != null
                    && EMPHASIS_TAGS.contains(frames.peek().element.normalName());
            if (Character.isWhitespace(value.charAt(0)) && endsWithWhitespace(sb) && !openingEmphasis) {
                value = value.stripLeading();
            }
            sb.append(escape(value));
        }

        private void appendInline(String value) {
            StringBuilder sb = out();
            if (value.startsWith(" ") && endsWithWhitespace(sb)) {
                value = value.stripLeading();
            }
            sb.append(value);
        }

        private static boolean endsWithWhitespace(StringBuilder sb) {
            return sb.length() == 0 || Character.isWhitespace(sb.charAt(sb.length() - 1));
        }

        private static String inline(String content) {
            return ANY_NEWLINE.matcher(content.replace("\\\n", " ")).replaceAll(" ").strip();
        }

        private Frame nearest(String tag) {
            for (Frame f : frames) {
                if (f.element != null && tag.equals(f.element.normalName())) return f;
            }
            return null;
        }

        private Frame nearestList() {
            Iterator<Frame> it = frames.iterator();
            while (it.hasNext()) {
                Frame f = it.next();
                if (f.element == null) return null;
                String tag = f.element.normalName();
                if ("ul".equals(tag) || "ol".equals(tag)) return f;
                if ("li".equals(tag)) return null;
            }
            return null;
        }

        private static int startOf(Element ol) {
            try {
                return Integer.parseInt(ol.attr("start").trim());
            } catch (NumberFormatException e) {
                return 1;
            }
        }
    }
}
