package org.smileyface.articleextractor.extractor;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScoringRulesTest {

    private final ScoringRules rules = ScoringRules.defaults();

    @Test
    void semanticContainers_getBonus() {
        Document doc = Jsoup.parse("""
                <article>a</article>
                <main>b</main>
                <div role='main'>c</div>
                <section>d</section>
                """);

        assertThat(rules.bonusFor(doc.selectFirst("article"))).isEqualTo(ScoringRules.SEMANTIC_BONUS);
        assertThat(rules.bonusFor(doc.selectFirst("main"))).isEqualTo(ScoringRules.SEMANTIC_BONUS);
        assertThat(rules.bonusFor(doc.selectFirst("div[role=main]"))).isEqualTo(ScoringRules.SEMANTIC_BONUS);
        assertThat(rules.bonusFor(doc.selectFirst("section"))).isEqualTo(ScoringRules.SECTION_BONUS);
    }

    @Test
    void bonuses_addUp_forTagAndAttributeMatches() {
        Document doc = Jsoup.parse("<article class='entry-body'>x</article>");
        assertThat(rules.bonusFor(doc.selectFirst("article")))
                .isEqualTo(ScoringRules.SEMANTIC_BONUS + ScoringRules.PATTERN_WEIGHT);
        assertThat(rules.matchedRules(doc.selectFirst("article"))).hasSize(2);
    }

    @Test
    void isNoise_trueForPenalizedElementsOnly() {
        Document doc = Jsoup.parse("""
                <div class='sidebar'>a</div>
                <footer>b</footer>
                <div class='content'>c</div>
                <div>d</div>
                """);

        assertThat(rules.isNoise(doc.selectFirst(".sidebar"))).isTrue();
        assertThat(rules.isNoise(doc.selectFirst("footer"))).isTrue();
        assertThat(rules.isNoise(doc.selectFirst(".content"))).isFalse();
        assertThat(rules.isNoise(doc.selectFirst("div:not([class])"))).isFalse();
    }

    @Test
    void customTable_isUsedAsGiven() {
        ScoringRules custom = new ScoringRules(List.of(ScoreRule.attribute("promo", -40)));
        Document doc = Jsoup.parse("<article class='promo'>x</article>");

        assertThat(custom.getRules()).hasSize(1);
        assertThat(custom.bonusFor(doc.selectFirst("article"))).isEqualTo(-40.0);
        assertThat(new ScoringRules(null).getRules()).isEmpty();
    }
}
