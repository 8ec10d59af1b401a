package io.disposescan.hierarchy;

/**
 * Answers subtype questions about classes known to the analysis.
 */
public interface TypeHierarchy {

    /**
     * Returns true if {@code type} implements {@code interfaceName}, directly, through a super
     * class or through a super interface. An interface counts as implementing itself.
     * Types that cannot be found answer false.
     *
     * @param type          Fully qualified name of the class to test
     * @param interfaceName Fully qualified name of the interface
     */
    boolean implementsInterface(String type, String interfaceName);
}
