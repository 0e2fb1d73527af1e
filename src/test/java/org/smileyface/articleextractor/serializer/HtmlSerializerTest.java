package org.smileyface.articleextractor.serializer;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class HtmlSerializerTest {

    private final HtmlSerializer serializer = new HtmlSerializer();

    private static Element fragment(String html) {
        return Jsoup.parseBodyFragment(html).body().child(0);
    }

    @Test
    void serialize_dropsScriptsHandlersAndDangerousUrls() {
        Element root = fragment("""
                <div><p onclick="x()" style="color:red">Hi <a href="javascript:alert(1)">x</a>
                <a href="/rel">rel</a></p>
                <img src="data:image/png;base64,AAA" alt="dot">
                <a href="data:text/html,xx">d</a>
                <script>bad()</script><form><input name="q"></form></div>
                """);

        String html = serializer.serialize(root);

        assertThat(html).startsWith("<div>");
        assertThat(html).doesNotContain("onclick", "style=", "javascript", "bad()", "data:text", "<form", "<input");
        assertThat(html).contains("<a href=\"/rel\">rel</a>", "src=\"data:image/png;base64,AAA\"", "<a>x</a>");
    }

    @Test
    void serialize_keepsCodeLanguageClassAndDropsOtherClasses() {
        String html = serializer.serialize(fragment(
                "<div class=\"post\"><pre class=\"highlight\"><code class=\"language-go\">x := 1</code></pre></div>"));

        assertThat(html).isEqualTo("<div><pre class=\"highlight\"><code class=\"language-go\">x := 1</code></pre></div>");
    }

    @Test
    void serialize_isDeterministicAndLeavesInputUntouched() {
        Element root = fragment("<article><h1 id=\"t\">T</h1><p>Body <b>bold</b></p></article>");
        String before = root.outerHtml();

        String first = serializer.serialize(root);
        String second = serializer.serialize(root);

        assertThat(first).isEqualTo(second).isEqualTo("<article><h1>T</h1><p>Body <b>bold</b></p></article>");
        assertThat(root.outerHtml()).isEqualTo(before);
    }

    @Test
    void serialize_nullIsEmpty() {
        assertThat(serializer.serialize(null)).isEmpty();
    }

    @Test
    void serializedLength_ofElementAndText() {
        assertThat(serializer.serializedLength(fragment("<p>abc</p>"))).isEqualTo("<p>abc</p>".length());
        assertThat(serializer.serializedLength(new TextNode("a<b"))).isEqualTo("a&lt;b".length());
    }

    @Test
    void isUnsafeUrl_ignoresWhitespaceAndCase() {
        assertThat(HtmlSerializer.isUnsafeUrl("a", "href", " Java\tScript:alert(1)")).isTrue();
        assertThat(HtmlSerializer.isUnsafeUrl("a", "href", "vbscript:x")).isTrue();
        assertThat(HtmlSerializer.isUnsafeUrl("a", "href", "data:image/png;base64,AA")).isTrue();
        assertThat(HtmlSerializer.isUnsafeUrl("img", "src", "data:image/png;base64,AA")).isFalse();
        assertThat(HtmlSerializer.isUnsafeUrl("a", "href", "https://example.com/")).isFalse();
        assertThat(HtmlSerializer.isUnsafeUrl("a", "href", "../up")).isFalse();
    }
}
