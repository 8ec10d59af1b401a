package io.disposescan.bytecode;

import java.util.ArrayList;
import java.util.List;

/**
 * Utility for parsing JVM type and method descriptors.
 * <p>
 * Method descriptors follow the format: (ParameterTypes)ReturnType
 * <p>
 * Type encodings:
 * <ul>
 *   <li>B - byte</li>
 *   <li>C - char</li>
 *   <li>D - double</li>
 *   <li>F - float</li>
 *   <li>I - int</li>
 *   <li>J - long</li>
 *   <li>S - short</li>
 *   <li>Z - boolean</li>
 *   <li>V - void (return type only)</li>
 *   <li>L&lt;classname&gt;; - object type</li>
 *   <li>[ - array (prefix)</li>
 * </ul>
 */
public final class DescriptorParser {

    private DescriptorParser() {
        // Utility class
    }

    /**
     * Converts an internal name to a fully qualified name.
     * E.g., "java/io/Closeable" -> "java.io.Closeable"
     */
    public static String toFqn(String internalName) {
        return internalName != null ? internalName.replace('/', '.') : null;
    }

    /**
     * Converts a fully qualified name to an internal name.
     * E.g., "java.io.Closeable" -> "java/io/Closeable"
     */
    public static String toInternalName(String fqn) {
        return fqn != null ? fqn.replace('.', '/') : null;
    }

    /**
     * Returns the simple name of a FQN (e.g., "Closeable" from "java.io.Closeable").
     */
    public static String simpleName(String fqn) {
        if (fqn == null) {
            return null;
        }
        int lastDot = fqn.lastIndexOf('.');
        return lastDot >= 0 ? fqn.substring(lastDot + 1) : fqn;
    }

    /**
     * Parses a method descriptor and returns the parameter types as FQNs.
     * Primitive types are returned as their Java names (int, boolean, etc.).
     *
     * @param descriptor The method descriptor (e.g., "(Ljava/lang/String;I)V")
     * @return List of parameter type FQNs in order
     */
    public static List<String> parseParameterTypes(String descriptor) {
        List<String> types = new ArrayList<>();

        if (descriptor == null || !descriptor.startsWith("(")) {
            return types;
        }

        int pos = 1;
        int endParams = descriptor.indexOf(')');

        if (endParams < 0) {
            return types;
        }

        while (pos < endParams) {
            ParseResult result = parseType(descriptor, pos);
            if (result == null) {
                break;
            }
            types.add(result.type);
            pos = result.endPos;
        }

        return types;
    }

    /**
     * Parses the return type from a method descriptor.
     *
     * @param descriptor The method descriptor
     * @return The return type FQN, or null if invalid
     */
    public static String parseReturnType(String descriptor) {
        if (descriptor == null) {
            return null;
        }

        int returnStart = descriptor.indexOf(')');
        if (returnStart < 0 || returnStart + 1 >= descriptor.length()) {
            return null;
        }

        ParseResult result = parseType(descriptor, returnStart + 1);
        return result != null ? result.type : null;
    }

    /**
     * Parses a field descriptor (e.g., "Ljava/io/Writer;" -> "java.io.Writer").
     *
     * @return The field type, or null if invalid
     */
    public static String parseFieldType(String descriptor) {
        if (descriptor == null || descriptor.isEmpty()) {
            return null;
        }
        ParseResult result = parseType(descriptor, 0);
        return result != null ? result.type : null;
    }

    private static ParseResult parseType(String descriptor, int pos) {
        if (pos >= descriptor.length()) {
            return null;
        }

        char c = descriptor.charAt(pos);

        switch (c) {
            case 'B':
                return new ParseResult("byte", pos + 1);
            case 'C':
                return new ParseResult("char", pos + 1);
            case 'D':
                return new ParseResult("double", pos + 1);
            case 'F':
                return new ParseResult("float", pos + 1);
            case 'I':
                return new ParseResult("int", pos + 1);
            case 'J':
                return new ParseResult("long", pos + 1);
            case 'S':
                return new ParseResult("short", pos + 1);
            case 'Z':
                return new ParseResult("boolean", pos + 1);
            case 'V':
                return new ParseResult("void", pos + 1);
        }

        if (c == '[') {
            ParseResult elementType = parseType(descriptor, pos + 1);
            if (elementType == null) {
                return null;
            }
            return new ParseResult(elementType.type + "[]", elementType.endPos);
        }

        if (c == 'L') {
            int semicolon = descriptor.indexOf(';', pos);
            if (semicolon < 0) {
                return null;
            }
            String className = descriptor.substring(pos + 1, semicolon).replace('/', '.');
            return new ParseResult(className, semicolon + 1);
        }

        return null;
    }

    private record ParseResult(String type, int endPos) {
    }
}
