package org.javalua.lowering;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import org.javalua.annotations.CallerFilePath;
import org.javalua.annotations.CallerLineNumber;
import org.javalua.annotations.CallerMemberName;
import org.javalua.annotations.LuaTemplate;
import org.javalua.lowering.naming.LuaReservedWords;

/**
 * Settings shared by every compilation unit of one transpile run.
 */
public final class LoweringOptions {

    /**
     * System property with extra reserved words, comma separated.
     */
    public static final String RESERVED_WORDS_PROPERTY = "javalua.reservedWords";

    private final LuaReservedWords reservedWords;
    private final String callerLineNumberAnnotation;
    private final String callerMemberNameAnnotation;
    private final String callerFilePathAnnotation;
    private final String templateAnnotation;
    private final String sourcePath;

    private LoweringOptions(Builder builder) {
        this.reservedWords = LuaReservedWords.defaults().with(builder.extraReservedWords);
        this.callerLineNumberAnnotation = builder.callerLineNumberAnnotation;
        this.callerMemberNameAnnotation = builder.callerMemberNameAnnotation;
        this.callerFilePathAnnotation = builder.callerFilePathAnnotation;
        this.templateAnnotation = builder.templateAnnotation;
        this.sourcePath = builder.sourcePath;
    }

    public static LoweringOptions defaults() {
        return builder().build();
    }

    /**
     * A builder preset with the built-in annotation names and the reserved words from
     * {@value #RESERVED_WORDS_PROPERTY}.
     */
    public static Builder builder() {
        Builder builder = new Builder();
        String extra = System.getProperty(RESERVED_WORDS_PROPERTY);
        if (extra != null && !extra.isBlank()) {
            Arrays.stream(extra.split(","))
                  .map(String::trim)
                  .filter(word -> !word.isEmpty())
                  .forEach(builder.extraReservedWords::add);
        }
        return builder;
    }

    public LuaReservedWords getReservedWords() {
        return reservedWords;
    }

    public String getCallerLineNumberAnnotation() {
        return callerLineNumberAnnotation;
    }

    public String getCallerMemberNameAnnotation() {
        return callerMemberNameAnnotation;
    }

    public String getCallerFilePathAnnotation() {
        return callerFilePathAnnotation;
    }

    public String getTemplateAnnotation() {
        return templateAnnotation;
    }

    /**
     * Path reported for caller file path arguments, overriding the compilation unit's storage.
     */
    public Optional<String> getSourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    public static final class Builder {

        private final List<String> extraReservedWords = new ArrayList<>();
        private String callerLineNumberAnnotation = CallerLineNumber.class.getName();
        private String callerMemberNameAnnotation = CallerMemberName.class.getName();
        private String callerFilePathAnnotation = CallerFilePath.class.getName();
        private String templateAnnotation = LuaTemplate.class.getName();
        private String sourcePath;

        private Builder() {
        }

        public Builder reservedWords(Collection<String> words) {
            extraReservedWords.addAll(words);
            return this;
        }

        public Builder reservedWords(String... words) {
            return reservedWords(Arrays.asList(words));
        }

        public Builder callerLineNumberAnnotation(String qualifiedName) {
            this.callerLineNumberAnnotation = Objects.requireNonNull(qualifiedName);
            return this;
        }

        public Builder callerMemberNameAnnotation(String qualifiedName) {
            this.callerMemberNameAnnotation = Objects.requireNonNull(qualifiedName);
            return this;
        }

        public Builder callerFilePathAnnotation(String qualifiedName) {
            this.callerFilePathAnnotation = Objects.requireNonNull(qualifiedName);
            return this;
        }

        public Builder templateAnnotation(String qualifiedName) {
            this.templateAnnotation = Objects.requireNonNull(qualifiedName);
            return this;
        }

        public Builder sourcePath(String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public LoweringOptions build() {
            return new LoweringOptions(this);
        }
    }
}
