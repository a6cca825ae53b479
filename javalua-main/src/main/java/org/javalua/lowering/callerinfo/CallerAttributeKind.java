package org.javalua.lowering.callerinfo;

/**
 * What a caller-info parameter receives at a call site that leaves it out.
 */
public enum CallerAttributeKind {
    NONE,
    LINE,
    MEMBER,
    FILE_PATH
}
