package org.javalua;

public class SymbolResolutionException extends LoweringException {

    private final String symbolName;

    public SymbolResolutionException(String symbolName, Throwable cause) {
        super("Unable to resolve '" + symbolName + "'", symbolName, cause);
        this.symbolName = symbolName;
    }

    public String getSymbolName() {
        return symbolName;
    }
}
