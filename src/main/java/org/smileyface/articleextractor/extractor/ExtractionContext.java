package org.smileyface.articleextractor.extractor;

import org.smileyface.articleextractor.model.ExtractionOptions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * State of a single extraction call: the options, the base URL used for link resolution and
 * the warnings collected along the way. Confined to the calling thread.
 */
public final class ExtractionContext {

    private final ExtractionOptions options;
    private final String baseUrl;
    private final Set<String> warnings = new LinkedHashSet<>();

    public ExtractionContext(ExtractionOptions options, String baseUrl) {
        this.options = Objects.requireNonNull(options, "options");
        this.baseUrl = (baseUrl == null || baseUrl.isBlank()) ? null : baseUrl.trim();
    }

    public ExtractionOptions getOptions() {
        return options;
    }

    /**
     * @return the base URL for link resolution, or null when none was supplied
     */
    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Records a warning once; repeated messages keep their first position.
     */
    public void warn(String message) {
        if (message != null && !message.isBlank()) {
            warnings.add(message);
        }
    }

    public List<String> getWarnings() {
        return new ArrayList<>(warnings);
    }
}
