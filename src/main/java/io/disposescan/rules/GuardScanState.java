package io.disposescan.rules;

/**
 * What one pass over a method body has seen. Created per method, never shared.
 */
final class GuardScanState {

    boolean sawSelfCall;
    boolean sawSelfField;
    boolean sawGuardExceptionConstruction;
    boolean sawGuardHelperCall;

    /**
     * The method uses its own state and shows no sign of a closed check.
     */
    boolean violates() {
        return (sawSelfCall || sawSelfField) && !sawGuardExceptionConstruction && !sawGuardHelperCall;
    }

    @Override
    public String toString() {
        return "selfCall=" + sawSelfCall
                + ", selfField=" + sawSelfField
                + ", guardException=" + sawGuardExceptionConstruction
                + ", guardHelper=" + sawGuardHelperCall;
    }
}
