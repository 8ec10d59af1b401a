package io.disposescan.model;

/**
 * Closed set of instruction categories the analysis distinguishes.
 * Every decoded JVM instruction maps onto exactly one category.
 */
public enum OpCode {
    /** Non-virtual call (invokespecial, invokestatic) */
    INVOKE_DIRECT,
    /** Dispatched call (invokevirtual, invokeinterface) */
    INVOKE_VIRTUAL,
    /** Instance field read (getfield) */
    LOAD_FIELD,
    /** Instance field write (putfield) */
    STORE_FIELD,
    /** Address-of-field load. No JVM instruction decodes to this. */
    LOAD_FIELD_ADDRESS,
    /** Object allocation (new) */
    CONSTRUCT_OBJECT,
    /** Load of the implicit receiver, aload_0 in an instance method */
    LOAD_SELF,
    /** Anything else */
    OTHER;
}
