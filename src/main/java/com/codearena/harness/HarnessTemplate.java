package com.codearena.harness;

import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A source template with named slots written as {@code {{NAME}}}.
 *
 * <p>All slots are filled in a single left-to-right pass over the template, so
 * slot values (which include user code) are copied verbatim and never scanned
 * for further placeholders.
 */
public final class HarnessTemplate {

    private static final Pattern SLOT = Pattern.compile("\\{\\{([A-Z_]+)}}");

    private final String text;

    private HarnessTemplate(String text) {
        this.text = text;
    }

    public static HarnessTemplate of(String text) {
        return new HarnessTemplate(text);
    }

    /**
     * Loads a template from the classpath.
     *
     * @throws UncheckedIOException if the resource is missing
     */
    public static HarnessTemplate fromClasspath(String resource) {
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            return new HarnessTemplate(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Missing harness template " + resource, e);
        }
    }

    /**
     * Fills every slot.
     *
     * @throws IllegalArgumentException if the template names a slot with no value
     */
    public String render(Map<String, String> values) {
        Matcher matcher = SLOT.matcher(text);
        var out = new StringBuilder(text.length() + 256);
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = values.get(name);
            if (value == null) {
                throw new IllegalArgumentException("No value for template slot " + name);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
