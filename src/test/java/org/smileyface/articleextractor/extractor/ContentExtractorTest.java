package org.smileyface.articleextractor.extractor;

import org.jsoup.Jsoup;
import org.junit.jupiter.api.Test;
import org.smileyface.articleextractor.cache.Fingerprint;
import org.smileyface.articleextractor.model.ArticleResult;
import org.smileyface.articleextractor.model.ExtractionOptions;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ContentExtractorTest {

    private static final String URL = "https://streamweekly.example.com/posts/backpressure";

    private final ContentExtractor extractor = new ContentExtractor();

    @Test
    void extract_samplePage_returnsArticleWithMetadata() throws Exception {
        String html = readClasspathResource("/article-sample.html");
        assertNotNull(html, "fixture must be on the classpath");

        ArticleResult result = extractor.extract(html, URL, ExtractionOptions.defaults());

        assertTrue(result.isSuccess(), () -> "unexpected failure: " + result.getError());
        assertNull(result.getError());
        assertEquals(URL, result.getUrl());
        assertEquals("Understanding Backpressure in Stream Processing", result.getTitle());
        assertEquals("Jane Holloway", result.getAuthor());
        assertEquals("2024-03-18T09:30:00Z", result.getDatePublished());
        assertEquals("en", result.getLanguage());
        assertTrue(result.getWarnings().isEmpty(), () -> "unexpected warnings: " + result.getWarnings());
        assertTrue(result.getWordCount() >= 150, "word count was " + result.getWordCount());

        // Headings are shifted so the article's top heading renders as h1
        assertTrue(result.getMarkdown().startsWith("# Understanding Backpressure in Stream Processing"),
                result.getMarkdown());
        assertTrue(result.getMarkdown().contains("```java\nFlux.range(1, 1_000)"));
        assertTrue(result.getMarkdown().contains("## Choosing a strategy"));

        // Boilerplate around the article is gone
        for (String noise : new String[]{"Tweet", "Related posts", "Great read", "cookies", "pixel.gif", "window.analytics"}) {
            assertFalse(result.getContent().contains(noise), "content still contains " + noise);
            assertFalse(result.getMarkdown().contains(noise), "markdown still contains " + noise);
        }

        // Relative URLs resolved against the page URL
        assertTrue(result.getContent().contains("src=\"https://streamweekly.example.com/posts/images/queue-diagram.png\""));
        assertTrue(result.getContent().contains("href=\"https://streamweekly.example.com/guides/reactive-streams\""));
        assertTrue(result.getMarkdown().contains("](https://streamweekly.example.com/guides/reactive-streams)"));
    }

    @Test
    void extract_isDeterministic() throws Exception {
        String html = readClasspathResource("/article-sample.html");

        ArticleResult first = extractor.extract(html, URL, ExtractionOptions.defaults());
        ArticleResult second = extractor.extract(html, URL, ExtractionOptions.defaults());

        assertEquals(first, second);
        assertEquals(first.getContent(), second.getContent());
        assertEquals(first.getMarkdown(), second.getMarkdown());
    }

    @Test
    void extract_excerptIsPrefixOfVisibleText() throws Exception {
        String html = readClasspathResource("/article-sample.html");
        ExtractionOptions options = ExtractionOptions.builder().excerptLength(80).build();

        ArticleResult result = extractor.extract(html, URL, options);
        String visible = Jsoup.parseBodyFragment(result.getContent()).body().text();

        assertFalse(result.getExcerpt().isEmpty());
        assertTrue(result.getExcerpt().length() <= 80, result.getExcerpt());
        assertTrue(visible.startsWith(result.getExcerpt()));
        assertFalse(result.getExcerpt().endsWith(" "));
        assertEndsOnWordBoundary(visible, result.getExcerpt());
    }

    @Test
    void extract_excerptLimitInsideAWord_backsOffToPreviousWord() {
        String html = "<html><body><article><p>Alpha bravo charlie delta echo foxtrot.</p></article></body></html>";
        ExtractionOptions options = ExtractionOptions.builder().minWordCount(1).excerptLength(14).build();

        ArticleResult result = extractor.extract(html, null, options);
        String visible = Jsoup.parseBodyFragment(result.getContent()).body().text();

        assertEquals("Alpha bravo", result.getExcerpt());
        assertEndsOnWordBoundary(visible, result.getExcerpt());
    }

    @Test
    void extract_lineEndingVariantsSharingAFingerprint_yieldEqualResults() {
        String lf = "<html><body><article><p>Line endings must not change the extracted article text.</p>"
                + "<pre><code>line1\nline2\nline3</code></pre></article></body></html>";
        String crlf = lf.replace("\n", "\r\n");
        String bomAndCr = "\uFEFF" + lf.replace("\n", "\r");
        ExtractionOptions options = ExtractionOptions.builder().minWordCount(1).build();

        assertEquals(Fingerprint.of(lf, URL, options), Fingerprint.of(crlf, URL, options));
        assertEquals(Fingerprint.of(lf, URL, options), Fingerprint.of(bomAndCr, URL, options));

        ArticleResult fromLf = extractor.extract(lf, URL, options);
        assertTrue(fromLf.isSuccess(), () -> "unexpected failure: " + fromLf.getError());
        assertTrue(fromLf.getMarkdown().contains("line1\nline2\nline3"), fromLf.getMarkdown());
        for (String variant : new String[]{crlf, bomAndCr}) {
            ArticleResult other = extractor.extract(variant, URL, options);
            assertEquals(fromLf.getContent(), other.getContent());
            assertEquals(fromLf.getMarkdown(), other.getMarkdown());
            assertEquals(fromLf, other);
        }
    }

    @Test
    void extract_withoutImagesAndCode() throws Exception {
        String html = readClasspathResource("/article-sample.html");
        ExtractionOptions options = ExtractionOptions.builder().includeImages(false).includeCode(false).build();

        ArticleResult result = extractor.extract(html, URL, options);

        assertTrue(result.isSuccess());
        assertFalse(result.getContent().contains("<img"));
        assertFalse(result.getMarkdown().contains("!["));
        assertFalse(result.getContent().contains("<pre"));
        assertFalse(result.getMarkdown().contains("```"));
        assertFalse(result.getMarkdown().contains("onBackpressureBuffer"));
    }

    @Test
    void extract_lowContent_succeedsWithWarning() {
        String html = "<html><body><p>The quick brown fox jumps over the lazy sleeping dog.</p></body></html>";

        ArticleResult result = extractor.extract(html, null, ExtractionOptions.defaults());

        assertTrue(result.isSuccess());
        assertEquals(10, result.getWordCount());
        assertEquals("The quick brown fox jumps over the lazy sleeping dog.", result.getMarkdown());
        assertTrue(result.getWarnings().contains("Low content: 10 words found, minimum is 150"),
                () -> "warnings were " + result.getWarnings());
        assertTrue(result.getWarnings().contains("Missing metadata: title"));
    }

    @Test
    void extract_wordCountKeepsIdentifiersWhole() {
        String html = "<html><body><article><p>Set max_connection_pool_size and user_agent_header before the "
                + "first request, then compare a|b with *starred* text.</p></article></body></html>";

        ArticleResult result = extractor.extract(html, null, ExtractionOptions.builder().minWordCount(1).build());
        String visible = Jsoup.parseBodyFragment(result.getContent()).body().text();

        assertTrue(result.isSuccess());
        assertEquals(visible.split("\\s+").length, result.getWordCount());
        assertEquals(14, result.getWordCount());
    }

    @Test
    void extract_emptyInput_fails() {
        for (String html : new String[]{null, "", "   \n\t"}) {
            ArticleResult result = extractor.extract(html, URL, ExtractionOptions.defaults());
            assertFalse(result.isSuccess());
            assertEquals(ContentExtractor.EMPTY_DOCUMENT, result.getError());
            assertEquals("", result.getContent());
            assertEquals(0, result.getWordCount());
        }
    }

    @Test
    void extract_documentWithoutText_fails() {
        ArticleResult result = extractor.extract("<html><body><div><span> </span></div><img src='x'></body></html>",
                URL, ExtractionOptions.defaults());

        assertFalse(result.isSuccess());
        assertEquals(ContentExtractor.NO_CONTENT, result.getError());
        assertEquals("", result.getMarkdown());
    }

    @Test
    void extract_nullOptionsMeansDefaults() throws Exception {
        String html = readClasspathResource("/article-sample.html");

        assertEquals(extractor.extract(html, URL, ExtractionOptions.defaults()), extractor.extract(html, URL, null));
    }

    @Test
    void extract_deeplyNestedDocument_doesNotOverflow() {
        StringBuilder html = new StringBuilder("<html><body>");
        int depth = 1_000;
        for (int i = 0; i < depth; i++) {
            html.append(i % 2 == 0 ? "<div>" : "<section>");
        }
        html.append("<p>Deep inside the document there is still a sentence, and it should be found.</p>");
        for (int i = depth - 1; i >= 0; i--) {
            html.append(i % 2 == 0 ? "</div>" : "</section>");
        }
        html.append("</body></html>");

        ArticleResult result = extractor.extract(html.toString(), null,
                ExtractionOptions.builder().minWordCount(5).build());

        assertTrue(result.isSuccess(), () -> "unexpected failure: " + result.getError());
        assertTrue(result.getMarkdown().contains("Deep inside the document"));
        assertEquals(14, result.getWordCount());
    }

    @Test
    void extract_outputLimit_truncatesAndWarns() throws Exception {
        String html = readClasspathResource("/article-sample.html");
        ExtractionOptions options = ExtractionOptions.builder().maxOutputChars(600).build();

        ArticleResult result = extractor.extract(html, URL, options);

        assertTrue(result.isSuccess());
        assertTrue(result.getContent().length() <= 600, "content length " + result.getContent().length());
        assertTrue(result.getMarkdown().length() <= 600, "markdown length " + result.getMarkdown().length());
        assertTrue(result.getWarnings().contains("Output truncated to 600 characters"));
        assertTrue(result.getMarkdown().startsWith("# Understanding Backpressure"));
    }

    @Test
    void cutMarkdown_cutsAtWordBoundary() {
        assertEquals("alpha beta", ContentExtractor.cutMarkdown("alpha beta gamma", 12));
        assertEquals("alphabe", ContentExtractor.cutMarkdown("alphabetical", 7));
        assertEquals("short", ContentExtractor.cutMarkdown("short", 10));
    }

    @Test
    void cutMarkdown_closesFenceLeftOpenByTheCut() {
        String md = "Intro text here.\n\n```java\nint a = 1;\nint b = 2;\nint c = 3;\n```\n\nAfter.";

        String cut = ContentExtractor.cutMarkdown(md, 50);

        assertEquals("Intro text here.\n\n```java\nint a = 1;\nint b =\n```", cut);
        assertTrue(cut.length() <= 50);
        assertNull(ContentExtractor.openFence(cut));
    }

    @Test
    void cutMarkdown_dropsCodeBlockWhenNoCodeLineFits() {
        String md = "Intro text here.\n\n```java\nint a = 1;\n```";

        assertEquals("Intro text here.", ContentExtractor.cutMarkdown(md, 30));
        assertEquals(md, ContentExtractor.cutMarkdown(md, 100));
    }

    private static void assertEndsOnWordBoundary(String visible, String excerpt) {
        assertTrue(visible.length() == excerpt.length() || Character.isWhitespace(visible.charAt(excerpt.length())),
                () -> "excerpt ends mid-word: " + excerpt);
    }

    private static String readClasspathResource(String path) throws Exception {
        try (InputStream is = ContentExtractorTest.class.getResourceAsStream(path)) {
            if (is == null) return null;
            try (BufferedReader br = new BufferedReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
                return br.lines().collect(Collectors.joining("\n"));
            }
        }
    }
}
