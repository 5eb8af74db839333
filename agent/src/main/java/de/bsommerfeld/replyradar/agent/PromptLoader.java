package de.bsommerfeld.replyradar.agent;

import com.google.common.io.Resources;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Prompt templates under {@code prompts/<name>.txt} on the classpath.
 *
 * <p>
 * Templates use {@code {{KEY}}} placeholders. {@link #render(String, Map)}
 * refuses to hand out a prompt that still contains one, so a placeholder
 * without a value never reaches a provider as literal braces.
 */
final class PromptLoader {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{([A-Z0-9_]+)}}");
    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private PromptLoader() {
    }

    /** Raw template text, cached after the first read. */
    static String template(String name) {
        return CACHE.computeIfAbsent(name, PromptLoader::readResource);
    }

    /**
     * Substitutes every placeholder of the template.
     *
     * @throws IllegalStateException if a placeholder has no value in
     *                               {@code vars}
     */
    static String render(String name, Map<String, String> vars) {
        String prompt = template(name);
        for (Map.Entry<String, String> entry : vars.entrySet()) {
            prompt = prompt.replace("{{" + entry.getKey() + "}}", entry.getValue());
        }
        Set<String> unresolved = placeholders(prompt);
        if (!unresolved.isEmpty()) {
            throw new IllegalStateException("Prompt '" + name + "' has no value for " + unresolved);
        }
        return prompt;
    }

    /** Placeholder keys occurring in {@code text}, sorted. */
    static Set<String> placeholders(String text) {
        Set<String> keys = new TreeSet<>();
        Matcher m = PLACEHOLDER.matcher(text);
        while (m.find()) {
            keys.add(m.group(1));
        }
        return keys;
    }

    private static String readResource(String name) {
        String path = "prompts/" + name + ".txt";
        URL url = PromptLoader.class.getClassLoader().getResource(path);
        if (url == null) {
            throw new IllegalStateException("Prompt resource not found: " + path);
        }
        try {
            return Resources.toString(url, StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read prompt resource: " + path, e);
        }
    }
}
