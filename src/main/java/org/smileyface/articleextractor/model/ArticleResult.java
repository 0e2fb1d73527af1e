package org.smileyface.articleextractor.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one extraction call: the cleaned article as HTML and Markdown plus its metadata.
 * Failures are represented by {@code success=false} and an error message, never by exceptions.
 * Serializes to a fixed JSON field set; absent values are emitted as {@code null}.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({"title", "content", "markdown", "excerpt", "word_count", "success", "error",
        "url", "author", "date_published", "language", "warnings"})
public final class ArticleResult {

    private final String url;
    private final String title;
    private final String content;          // Sanitized HTML of the winning region
    private final String markdown;         // GFM rendering of the same tree
    private final String excerpt;          // Prefix of the visible text, cut at a word boundary
    private final int wordCount;
    private final boolean success;
    private final String error;
    private final String author;
    private final String datePublished;
    private final String language;
    private final List<String> warnings;

    private ArticleResult(Builder b) {
        this.url = b.url;
        this.title = b.title == null ? "" : b.title;
        this.content = b.content == null ? "" : b.content;
        this.markdown = b.markdown == null ? "" : b.markdown;
        this.excerpt = b.excerpt == null ? "" : b.excerpt;
        this.wordCount = Math.max(0, b.wordCount);
        this.success = b.success;
        this.error = b.error;
        this.author = b.author;
        this.datePublished = b.datePublished;
        this.language = b.language;
        this.warnings = b.warnings == null ? List.of() : List.copyOf(b.warnings);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds an unsuccessful result carrying only the source URL, the error and any warnings
     * collected before the failure.
     */
    public static ArticleResult failure(String url, String error, List<String> warnings) {
        return builder().url(url).success(false).error(error).warnings(warnings).build();
    }

    @JsonProperty("url")
    public String getUrl() { return url; }

    @JsonProperty("title")
    public String getTitle() { return title; }

    @JsonProperty("content")
    public String getContent() { return content; }

    @JsonProperty("markdown")
    public String getMarkdown() { return markdown; }

    @JsonProperty("excerpt")
    public String getExcerpt() { return excerpt; }

    @JsonProperty("word_count")
    public int getWordCount() { return wordCount; }

    @JsonProperty("success")
    public boolean isSuccess() { return success; }

    @JsonProperty("error")
    public String getError() { return error; }

    @JsonProperty("author")
    public String getAuthor() { return author; }

    @JsonProperty("date_published")
    public String getDatePublished() { return datePublished; }

    @JsonProperty("language")
    public String getLanguage() { return language; }

    @JsonProperty("warnings")
    public List<String> getWarnings() { return warnings; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ArticleResult that = (ArticleResult) o;
        return wordCount == that.wordCount
                && success == that.success
                && Objects.equals(url, that.url)
                && Objects.equals(title, that.title)
                && Objects.equals(content, that.content)
                && Objects.equals(markdown, that.markdown)
                && Objects.equals(excerpt, that.excerpt)
                && Objects.equals(error, that.error)
                && Objects.equals(author, that.author)
                && Objects.equals(datePublished, that.datePublished)
                && Objects.equals(language, that.language)
                && Objects.equals(warnings, that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, title, content, markdown, excerpt, wordCount, success, error,
                author, datePublished, language, warnings);
    }

    @Override
    public String toString() {
        return "ArticleResult{" +
                "url='" + url + '\'' +
                ", title='" + title + '\'' +
                ", wordCount=" + wordCount +
                ", success=" + success +
                ", error='" + error + '\'' +
                ", author='" + author + '\'' +
                ", datePublished='" + datePublished + '\'' +
                ", language='" + language + '\'' +
                ", contentLength=" + content.length() +
                ", warnings=" + warnings.size() +
                '}';
    }

    public static final class Builder {
        private String url;
        private String title;
        private String content;
        private String markdown;
        private String excerpt;
        private int wordCount;
        private boolean success;
        private String error;
        private String author;
        private String datePublished;
        private String language;
        private List<String> warnings;

        private Builder() {
        }

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder markdown(String markdown) { this.markdown = markdown; return this; }
        public Builder excerpt(String excerpt) { this.excerpt = excerpt; return this; }
        public Builder wordCount(int wordCount) { this.wordCount = wordCount; return this; }
        public Builder success(boolean success) { this.success = success; return this; }
        public Builder error(String error) { this.error = error; return this; }
        public Builder author(String author) { this.author = author; return this; }
        public Builder datePublished(String datePublished) { this.datePublished = datePublished; return this; }
        public Builder language(String language) { this.language = language; return this; }
        public Builder warnings(List<String> warnings) { this.warnings = warnings; return this; }

        public ArticleResult build() {
            return new ArticleResult(this);
        }
    }
}
