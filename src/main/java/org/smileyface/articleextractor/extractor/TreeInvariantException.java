package org.smileyface.articleextractor.extractor;

/**
 * Thrown when the DOM handed to the pipeline breaks the parser contract (a node whose parent
 * pointer disagrees with its position in the tree). This is never caused by bad markup, only
 * by a broken tree, so it is not converted into a failed result.
 */
public class TreeInvariantException extends IllegalStateException {

    public TreeInvariantException(String message) {
        super(message);
    }
}
