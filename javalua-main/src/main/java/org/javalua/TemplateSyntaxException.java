package org.javalua;

public class TemplateSyntaxException extends LoweringException {

    private final String template;
    private final int offset;

    public TemplateSyntaxException(String message, String template, int offset) {
        super(message + " at offset " + offset + " in code template '" + template + "'", template);
        this.template = template;
        this.offset = offset;
    }

    public String getTemplate() {
        return template;
    }

    public int getOffset() {
        return offset;
    }
}
