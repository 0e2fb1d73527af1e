package org.smileyface.articleextractor.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.smileyface.articleextractor.model.ExtractionOptions;
import org.smileyface.articleextractor.util.ExtractorUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Objects;

/**
 * Cache key of one extraction: a SHA-256 hex digest over the normalized HTML, the base URL and
 * the serialized options. Normalization only strips a leading byte order mark and unifies line
 * endings, so byte-identical documents always map to the same key.
 *
 * @param value 64 lower-case hex characters
 */
public record Fingerprint(String value) {

    private static final ObjectMapper OPTIONS_MAPPER = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .build();

    public Fingerprint {
        Objects.requireNonNull(value, "value");
    }

    public static Fingerprint of(String html, String url, ExtractionOptions options) {
        ExtractionOptions opts = options == null ? ExtractionOptions.defaults() : options;
        String u = url == null ? "" : url.trim();
        String data = ExtractorUtils.normalizeSource(html) + '\0' + u + '\0' + serialize(opts);
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return new Fingerprint(toHex(md.digest(data.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String serialize(ExtractionOptions options) {
        try {
            return OPTIONS_MAPPER.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize extraction options", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >>> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return value;
    }
}
