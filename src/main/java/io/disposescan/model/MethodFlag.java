package io.disposescan.model;

/**
 * Properties of a method that the loader derives from access flags, names and annotations.
 */
public enum MethodFlag {
    PUBLIC,
    STATIC,
    ABSTRACT,
    NATIVE,
    /** Instance or class initializer */
    CONSTRUCTOR,
    /** {@code void finalize()} */
    FINALIZER,
    /** JavaBeans getter or record component accessor */
    PROPERTY_GETTER,
    /** JavaBeans listener add/remove method or fire method */
    EVENT_ACCESSOR,
    /** Synthetic, bridge or annotated as generated */
    GENERATED_CODE
}
