package org.smileyface.articleextractor.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;
import org.smileyface.articleextractor.model.ExtractionOptions;

import static org.assertj.core.api.Assertions.*;

class ContentCleanerTest {

    private final ContentCleaner cleaner = new ContentCleaner(ScoringRules.defaults(), new TreeNormalizer());

    private static final String ARTICLE = """
            <article>
              <h3>Heading three</h3>
              <p>Body text that is long enough to dominate the whole article block, with several words in it.</p>
              <h4>Heading four</h4>
              <p>More body text <a href='/about'>about us</a> and <a href='mailto:me@example.com'>mail</a>.</p>
              <img src='img/photo.jpg' alt='Photo'>
              <picture><img src='img/hero.png' alt='Hero'></picture>
              <video src='clip.mp4'></video>
              <pre><code>int x = 1;</code></pre>
              <p>Inline <code>call()</code> here.</p>
              <div class='share'>Tweet</div>
            </article>
            """;

    private static Element winner(String html) {
        Document doc = Jsoup.parse(html);
        return doc.selectFirst("article");
    }

    private static ExtractionContext ctx(ExtractionOptions options, String url) {
        return new ExtractionContext(options, url);
    }

    @Test
    void clean_returnsDetachedCopy_leavingWinnerUntouched() {
        Element winner = winner(ARTICLE);

        Element cleaned = cleaner.clean(winner, ctx(ExtractionOptions.builder().includeImages(false).build(),
                "https://example.com/blog/post"));

        assertThat(cleaned.parent()).isNull();
        assertThat(cleaned.select("img")).isEmpty();
        assertThat(winner.select("img")).hasSize(2);
        assertThat(winner.selectFirst("h3")).isNotNull();
    }

    @Test
    void clean_removesMediaAndCode_whenDisabled() {
        ExtractionOptions options = ExtractionOptions.builder().includeImages(false).includeCode(false).build();

        Element cleaned = cleaner.clean(winner(ARTICLE), ctx(options, "https://example.com/"));

        assertThat(cleaned.select("img, picture, video")).isEmpty();
        assertThat(cleaned.select("pre, code")).isEmpty();
        assertThat(cleaned.text()).contains("Inline", "here.");
    }

    @Test
    void clean_keepsMediaAndCode_byDefault() {
        Element cleaned = cleaner.clean(winner(ARTICLE), ctx(ExtractionOptions.defaults(), "https://example.com/"));

        assertThat(cleaned.select("img")).hasSize(2);
        assertThat(cleaned.select("pre")).hasSize(1);
    }

    @Test
    void clean_normalizesHeadingsSoTheHighestBecomesH1() {
        Element cleaned = cleaner.clean(winner(ARTICLE), ctx(ExtractionOptions.defaults(), null));

        assertThat(cleaned.select("h1").text()).isEqualTo("Heading three");
        assertThat(cleaned.select("h2").text()).isEqualTo("Heading four");
        assertThat(cleaned.select("h3, h4")).isEmpty();
    }

    @Test
    void clean_stripsNestedNoise() {
        Element cleaned = cleaner.clean(winner(ARTICLE), ctx(ExtractionOptions.defaults(), null));

        assertThat(cleaned.select(".share")).isEmpty();
        assertThat(cleaned.text()).doesNotContain("Tweet");
    }

    @Test
    void clean_keepsNoiseClassedElementHoldingMostOfTheText() {
        Element winner = winner("""
                <article><div class='comment-body'>Most of the text lives here, in a block with a noisy class
                name, and it must survive the scoped noise pass.</div><p>Short.</p></article>
                """);

        Element cleaned = cleaner.clean(winner, ctx(ExtractionOptions.defaults(), null));

        assertThat(cleaned.select(".comment-body")).hasSize(1);
    }

    @Test
    void clean_resolvesRelativeUrlsAgainstBase() {
        ExtractionContext context = ctx(ExtractionOptions.defaults(), "https://example.com/blog/post");

        Element cleaned = cleaner.clean(winner(ARTICLE), context);

        assertThat(cleaned.selectFirst("a").attr("href")).isEqualTo("https://example.com/about");
        assertThat(cleaned.selectFirst("img").attr("src")).isEqualTo("https://example.com/blog/img/photo.jpg");
        assertThat(cleaned.select("a").get(1).attr("href")).isEqualTo("mailto:me@example.com");
        assertThat(context.getWarnings()).isEmpty();
    }

    @Test
    void clean_resolvesAgainstBaseWithEmptyPath() {
        Element cleaned = cleaner.clean(winner("<article><p><a href='docs/start'>Start here</a></p></article>"),
                ctx(ExtractionOptions.defaults(), "https://example.com"));

        assertThat(cleaned.selectFirst("a").attr("href")).isEqualTo("https://example.com/docs/start");
    }

    @Test
    void clean_keepsUnresolvableUrlAndWarns() {
        ExtractionContext context = ctx(ExtractionOptions.defaults(), "https://example.com/");

        Element cleaned = cleaner.clean(winner("<article><p><a href='//example.com:notaport/a'>Broken</a></p></article>"),
                context);

        assertThat(cleaned.selectFirst("a").attr("href")).isEqualTo("//example.com:notaport/a");
        assertThat(context.getWarnings()).containsExactly("Could not resolve URL: //example.com:notaport/a");
    }

    @Test
    void clean_resolvesQueryEmptyAndFragmentReferencesAgainstTheDocument() {
        ExtractionContext context = ctx(ExtractionOptions.defaults(), "https://ex.com/posts/article");

        Element cleaned = cleaner.clean(winner("""
                <article><p>
                  <a href='?page=2'>Next page</a>
                  <a href=''>This page</a>
                  <a href='#comments'>Comments</a>
                  <a href='//cdn.ex.com/file.pdf'>File</a>
                </p></article>
                """), context);

        assertThat(cleaned.select("a")).extracting(a -> a.attr("href")).containsExactly(
                "https://ex.com/posts/article?page=2",
                "https://ex.com/posts/article",
                "https://ex.com/posts/article#comments",
                "https://cdn.ex.com/file.pdf");
        assertThat(context.getWarnings()).isEmpty();
    }

    @Test
    void clean_withInvalidBase_warnsAndKeepsRelativeLinks() {
        ExtractionContext context = ctx(ExtractionOptions.defaults(), "not a url");

        Element cleaned = cleaner.clean(winner(ARTICLE), context);

        assertThat(cleaned.selectFirst("a").attr("href")).isEqualTo("/about");
        assertThat(context.getWarnings()).containsExactly("Invalid base URL: not a url",
                "Relative URLs left unresolved: invalid base URL");
    }

    @Test
    void clean_withoutBaseUrl_keepsRelativeLinksAndWarnsOnce() {
        ExtractionContext context = ctx(ExtractionOptions.defaults(), null);

        Element cleaned = cleaner.clean(winner(ARTICLE), context);

        assertThat(cleaned.selectFirst("a").attr("href")).isEqualTo("/about");
        assertThat(context.getWarnings()).containsExactly("Relative URLs left unresolved: no base URL");
    }

    @Test
    void clean_sanitizesEmptyLinksTrackingImagesAndEmptyBlocks() {
        Element winner = winner("""
                <article>
                  <p>Real paragraph text.</p>
                  <p><a href='/x'></a></p>
                  <img src='https://tracking.example.com/i.png'>
                  <img src='/assets/1x1.png'>
                  <img src='t.gif'>
                  <img src='diagram.png' alt='Diagram'>
                  <ul><li> </li><li>Item</li></ul>
                </article>
                """);

        Element cleaned = cleaner.clean(winner, ctx(ExtractionOptions.builder().resolveUrls(false).build(), null));

        assertThat(cleaned.select("a")).isEmpty();
        assertThat(cleaned.select("img")).extracting(e -> e.attr("src")).containsExactly("diagram.png");
        assertThat(cleaned.select("li")).hasSize(1);
        assertThat(cleaned.select("p")).hasSize(1);
    }

    @Test
    void clean_bodyWinnerIsRenamedToDiv() {
        Document doc = Jsoup.parse("<p>Only a paragraph in the body.</p>");

        Element cleaned = cleaner.clean(doc.body(), ctx(ExtractionOptions.defaults(), null));

        assertThat(cleaned.normalName()).isEqualTo("div");
        assertThat(doc.body()).isNotNull();
    }

    @Test
    void isUsableImageSource_followsTrackingAndFileNameHeuristics() {
        assertThat(ContentCleaner.isUsableImageSource("https://cdn.example.com/a.jpg")).isTrue();
        assertThat(ContentCleaner.isUsableImageSource("data:image/png;base64,AAAA")).isTrue();
        assertThat(ContentCleaner.isUsableImageSource("../img/a")).isTrue();
        assertThat(ContentCleaner.isUsableImageSource("bg.jpg")).isTrue();
        assertThat(ContentCleaner.isUsableImageSource("t.gif")).isFalse();
        assertThat(ContentCleaner.isUsableImageSource("photo")).isFalse();
        assertThat(ContentCleaner.isUsableImageSource("https://analytics.example.com/a.jpg")).isFalse();
        assertThat(ContentCleaner.isUsableImageSource("/static/spacer.gif")).isFalse();
        assertThat(ContentCleaner.isUsableImageSource("  ")).isFalse();
        assertThat(ContentCleaner.isUsableImageSource(null)).isFalse();
    }
}
