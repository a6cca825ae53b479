package org.javalua.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Replaces calls to the annotated method with native Lua code.
 * <p>
 * The value is a code template: {@code {this}} is the receiver, {@code {class}} the receiver's type,
 * {@code {N}} the Nth argument, {@code {*N}} every argument from index N on, and {@code {^N}} the Nth
 * type argument. A comma or whitespace directly in front of a placeholder is dropped together with it
 * when the placeholder expands to nothing.
 * <pre>
 * &#64;LuaTemplate("{this}:Format({0}, {*1})")
 * String format(String pattern, Object... args);
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.SOURCE)
@Target({ElementType.METHOD, ElementType.CONSTRUCTOR})
public @interface LuaTemplate {

    String value();
}
