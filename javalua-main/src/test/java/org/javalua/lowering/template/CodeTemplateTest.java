package org.javalua.lowering.template;

import org.javalua.TemplateSyntaxException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeTemplateTest {

    @Test
    void parse_splitsTextAndPlaceholders() {
        CodeTemplate template = CodeTemplate.parse("{this}:Foo({0}, {*1})");

        assertThat(template.getTokens()).containsExactly(
                new TemplateToken.Placeholder("", PlaceholderKind.THIS, -1),
                new TemplateToken.Text(":Foo("),
                new TemplateToken.Placeholder("", PlaceholderKind.ARGUMENT, 0),
                new TemplateToken.Placeholder(", ", PlaceholderKind.PARAMS, 1),
                new TemplateToken.Text(")"));
    }

    @Test
    void parse_recognizesClassAndTypeArguments() {
        CodeTemplate template = CodeTemplate.parse("System.typeof({class}, {^0})");

        assertThat(template.getTokens()).containsExactly(
                new TemplateToken.Text("System.typeof("),
                new TemplateToken.Placeholder("", PlaceholderKind.CLASS, -1),
                new TemplateToken.Placeholder(", ", PlaceholderKind.TYPE_ARGUMENT, 0),
                new TemplateToken.Text(")"));
    }

    @Test
    void tableConstructorBraces_stayText() {
        CodeTemplate template = CodeTemplate.parse("setmetatable({ n = {0} }, mt)");

        assertThat(template.getTokens()).containsExactly(
                new TemplateToken.Text("setmetatable({ n ="),
                new TemplateToken.Placeholder(" ", PlaceholderKind.ARGUMENT, 0),
                new TemplateToken.Text(" }, mt)"));
    }

    @Test
    void templateWithoutPlaceholders_isOneTextToken() {
        assertThat(CodeTemplate.parse("os.clock()").getTokens())
                .containsExactly(new TemplateToken.Text("os.clock()"));
        assertThat(CodeTemplate.parse("").getTokens()).isEmpty();
    }

    @Test
    void unknownKey_isRejected() {
        assertThatThrownBy(() -> CodeTemplate.parse("{0}:{self}()"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("{self}")
            .satisfies(e -> assertThat(((TemplateSyntaxException) e).getOffset()).isEqualTo(4));
    }

    @Test
    void malformedIndexedKeys_areRejected() {
        assertThatThrownBy(() -> CodeTemplate.parse("f({*x})")).isInstanceOf(TemplateSyntaxException.class);
        assertThatThrownBy(() -> CodeTemplate.parse("f({^})")).isInstanceOf(TemplateSyntaxException.class);
        assertThatThrownBy(() -> CodeTemplate.parse("f({99999999999})"))
            .isInstanceOf(TemplateSyntaxException.class)
            .hasMessageContaining("out of range");
    }

    @Test
    void of_reusesParsedTemplates() {
        assertThat(CodeTemplate.of("{0} .. {1}")).isSameAs(CodeTemplate.of("{0} .. {1}"));
    }

    @Test
    void of_keepsTheCacheBounded() {
        for (int i = 0; i <= CodeTemplate.CACHE_LIMIT; i++) {
            CodeTemplate.of("bounded" + i + "({0})");
        }

        assertThat(CodeTemplate.cacheSize()).isLessThanOrEqualTo(CodeTemplate.CACHE_LIMIT);
        assertThat(CodeTemplate.of("bounded0({0})").getTokens()).hasSize(3);
    }
}
