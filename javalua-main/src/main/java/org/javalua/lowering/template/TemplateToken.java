package org.javalua.lowering.template;

import java.util.Objects;

/**
 * Unit of a parsed code template.
 */
public sealed interface TemplateToken permits TemplateToken.Text, TemplateToken.Placeholder {

    /**
     * Native code copied to the output unchanged.
     */
    record Text(String text) implements TemplateToken {

        public Text {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * A substitution point. {@code separator} is the comma and/or whitespace written in front of the
     * placeholder; it is only emitted when the substitution is not empty. {@code index} is unused for
     * {@link PlaceholderKind#THIS} and {@link PlaceholderKind#CLASS}.
     */
    record Placeholder(String separator, PlaceholderKind kind, int index) implements TemplateToken {

        public Placeholder {
            Objects.requireNonNull(separator, "separator");
            Objects.requireNonNull(kind, "kind");
        }
    }
}
