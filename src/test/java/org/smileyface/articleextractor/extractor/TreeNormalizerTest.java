package org.smileyface.articleextractor.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TreeNormalizerTest {

    private final TreeNormalizer normalizer = new TreeNormalizer();

    @Test
    void normalize_removesNonContentAndHiddenElements() {
        Document doc = Jsoup.parse("""
                <html><head><title>T</title><script>var x = 1;</script></head><body>
                  <nav>menu</nav>
                  <form><input name='q'></form>
                  <p>Keep <!-- note -->me</p>
                  <div hidden>hidden attr</div>
                  <div style='display: none'>display none</div>
                  <div style='Visibility:Hidden'>visibility hidden</div>
                  <div aria-hidden='true'>aria</div>
                  <div role='navigation'>role nav</div>
                  <div role='dialog'>cookie dialog</div>
                  <p>Visible</p>
                </body></html>
                """);

        normalizer.normalize(doc);

        assertThat(doc.select("script, nav, form")).isEmpty();
        assertThat(doc.body().text()).isEqualTo("Keep me Visible");
        assertThat(doc.title()).as("head metadata is kept").isEqualTo("T");
    }

    @Test
    void normalize_mergesAdjacentTextNodes() {
        Document doc = Jsoup.parse("<p>Keep <!-- note -->me</p>");

        normalizer.normalize(doc);

        Element p = doc.selectFirst("p");
        assertThat(p.childNodeSize()).isEqualTo(1);
        assertThat(((TextNode) p.childNode(0)).getWholeText()).isEqualTo("Keep me");
    }

    @Test
    void normalize_collapsesWhitespace_exceptInPreformattedBlocks() {
        Document doc = Jsoup.parse("<p>a   \n\t  b</p><pre>x\n   y</pre>");

        normalizer.normalize(doc);

        assertThat(((TextNode) doc.selectFirst("p").childNode(0)).getWholeText()).isEqualTo("a b");
        assertThat(doc.selectFirst("pre").wholeText()).isEqualTo("x\n   y");
    }

    @Test
    void normalize_collapsesSingleChildWrappers_mergingClassAndId() {
        Document doc = Jsoup.parse("""
                <div class='outer' id='o'>
                  <div class='inner'><p>First paragraph</p><p>Second paragraph</p></div>
                </div>
                """);

        normalizer.normalize(doc);

        assertThat(doc.body().children()).hasSize(1);
        Element wrapper = doc.body().child(0);
        assertThat(wrapper.classNames()).contains("outer", "inner");
        assertThat(wrapper.id()).isEqualTo("o");
        assertThat(wrapper.children()).hasSize(2);
    }

    @Test
    void normalize_dropsEmptyElementsBottomUp_keepingMedia() {
        Document doc = Jsoup.parse("""
                <div><span></span><p>   </p></div>
                <div><img src='a.png'></div>
                <p>Text<br></p>
                """);

        normalizer.normalize(doc);

        assertThat(doc.select("span")).isEmpty();
        assertThat(doc.body().children()).hasSize(2);
        assertThat(doc.select("img")).hasSize(1);
        assertThat(doc.select("br")).hasSize(1);
    }

    @Test
    void normalize_handlesDeepNesting() {
        int depth = 1000;
        StringBuilder html = new StringBuilder("<html><body>");
        html.append("<div>".repeat(depth)).append("<p>Deep content</p>").append("</div>".repeat(depth));
        html.append("</body></html>");
        Document doc = Jsoup.parse(html.toString());

        normalizer.normalize(doc);

        assertThat(doc.select("div")).hasSize(1);
        assertThat(doc.body().text()).isEqualTo("Deep content");
    }

    @Test
    void customStripTags_replaceTheDefaults() {
        TreeNormalizer custom = new TreeNormalizer(List.of("FIGURE", " "));
        Document doc = Jsoup.parse("<nav>menu</nav><figure>fig</figure><p>body</p>");

        custom.normalize(doc);

        assertThat(custom.getStripTags()).containsExactly("figure");
        assertThat(doc.body().text()).isEqualTo("menu body");
    }
}
