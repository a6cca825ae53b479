package org.javalua;

/**
 * Root of the unchecked exceptions raised while turning Java source into Lua.
 */
public class JavaLuaException extends RuntimeException {

    public JavaLuaException(String message) {
        super(message);
    }

    public JavaLuaException(String message, Throwable cause) {
        super(message, cause);
    }
}
