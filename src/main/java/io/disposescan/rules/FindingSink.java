package io.disposescan.rules;

import io.disposescan.model.Confidence;
import io.disposescan.model.MethodInfo;
import io.disposescan.model.Severity;

/**
 * Receives reported methods. Implementations must accept concurrent reports.
 */
@FunctionalInterface
public interface FindingSink {

    void report(MethodInfo method, Severity severity, Confidence confidence);
}
