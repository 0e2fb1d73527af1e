package org.smileyface.articleextractor.extractor.metadata;

/**
 * Document-level metadata of an extracted article. Absent values are null.
 */
public record ArticleMetadata(String title, String author, String datePublished, String language) {
}
