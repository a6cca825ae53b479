package org.javalua.lowering.template;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.javalua.TemplateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A parsed native-code template.
 * <p>
 * A placeholder is a brace-delimited key, optionally preceded by a comma and/or whitespace:
 * {@code {this}}, {@code {class}}, {@code {^N}}, {@code {*N}} or {@code {N}}. Brace text that does not
 * have the shape of a key, such as the Lua table constructor {@code { x = 1 }}, is plain text; a key
 * of the right shape that is none of the above is rejected when the template is parsed.
 */
public final class CodeTemplate {

    private static final Logger logger = LoggerFactory.getLogger(CodeTemplate.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("(,?\\s*)\\{(\\*?[\\w|^]+)\\}");
    private static final Pattern NUMBER = Pattern.compile("\\d+");

    // template texts come from annotations, so the set is finite per code base
    static final int CACHE_LIMIT = 4096;

    private static final Map<String, CodeTemplate> CACHE = new ConcurrentHashMap<>();

    private final String text;
    private final List<TemplateToken> tokens;

    private CodeTemplate(String text, List<TemplateToken> tokens) {
        this.text = text;
        this.tokens = Collections.unmodifiableList(tokens);
    }

    /**
     * Parsed form of {@code text}, shared by every caller that uses the same template.
     */
    public static CodeTemplate of(String text) {
        CodeTemplate cached = CACHE.get(text);
        if (cached != null) {
            return cached;
        }
        if (CACHE.size() >= CACHE_LIMIT) {
            logger.debug("Code template cache reached {} entries, clearing it", CACHE_LIMIT);
            CACHE.clear();
        }
        return CACHE.computeIfAbsent(text, CodeTemplate::parse);
    }

    static int cacheSize() {
        return CACHE.size();
    }

    /**
     * @throws TemplateSyntaxException if a placeholder key is not recognized
     */
    public static CodeTemplate parse(String text) {
        List<TemplateToken> tokens = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(text);
        int prevIndex = 0;
        while (matcher.find()) {
            if (matcher.start() > prevIndex) {
                tokens.add(new TemplateToken.Text(text.substring(prevIndex, matcher.start())));
            }
            tokens.add(placeholder(text, matcher.group(1), matcher.group(2), matcher.start(2) - 1));
            prevIndex = matcher.end();
        }
        if (prevIndex < text.length()) {
            tokens.add(new TemplateToken.Text(text.substring(prevIndex)));
        }
        logger.debug("Parsed code template '{}' into {} tokens", text, tokens.size());
        return new CodeTemplate(text, tokens);
    }

    public String getText() {
        return text;
    }

    public List<TemplateToken> getTokens() {
        return tokens;
    }

    private static TemplateToken.Placeholder placeholder(String text, String separator, String key, int offset) {
        if (key.equals("this")) {
            return new TemplateToken.Placeholder(separator, PlaceholderKind.THIS, -1);
        }
        if (key.equals("class")) {
            return new TemplateToken.Placeholder(separator, PlaceholderKind.CLASS, -1);
        }
        switch (key.charAt(0)) {
            case '^':
                return new TemplateToken.Placeholder(separator, PlaceholderKind.TYPE_ARGUMENT, index(text, key.substring(1), offset));
            case '*':
                return new TemplateToken.Placeholder(separator, PlaceholderKind.PARAMS, index(text, key.substring(1), offset));
            default:
                return new TemplateToken.Placeholder(separator, PlaceholderKind.ARGUMENT, index(text, key, offset));
        }
    }

    private static int index(String text, String digits, int offset) {
        if (!NUMBER.matcher(digits).matches()) {
            throw new TemplateSyntaxException("Unknown placeholder '{" + text.substring(offset + 1, text.indexOf('}', offset)) + "}'", text, offset);
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new TemplateSyntaxException("Placeholder index '" + digits + "' is out of range", text, offset);
        }
    }

    @Override
    public String toString() {
        return "CodeTemplate{" +
               "text='" + text + '\'' +
               '}';
    }
}
