package org.javalua.lowering.template;

public enum PlaceholderKind {

    /** {@code {this}}: the receiver. */
    THIS,
    /** {@code {class}}: the receiver's type. */
    CLASS,
    /** {@code {^N}}: the Nth type argument. */
    TYPE_ARGUMENT,
    /** {@code {*N}}: every argument from index N on. */
    PARAMS,
    /** {@code {N}}: the Nth argument. */
    ARGUMENT
}
