package io.disposescan.model;

/**
 * A method reported by a rule.
 *
 * @param className      Fully qualified name of the declaring class
 * @param methodName     Method name
 * @param descriptor     JVM method descriptor
 * @param signature      Human-readable method signature
 * @param lineNumber     First source line of the method (if available from debug info)
 * @param sourceFile     Source file name (if available)
 * @param severity       How serious the defect is
 * @param confidence     How sure the rule is
 * @param ruleId         ID of the rule that reported the method
 * @param description    What is wrong
 * @param recommendation How to fix it
 */
public record Finding(
        String className,
        String methodName,
        String descriptor,
        String signature,
        int lineNumber,
        String sourceFile,
        Severity severity,
        Confidence confidence,
        String ruleId,
        String description,
        String recommendation
) {
    /**
     * Compact constructor with validation.
     */
    public Finding {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("className cannot be null or blank");
        }
        if (methodName == null || methodName.isBlank()) {
            throw new IllegalArgumentException("methodName cannot be null or blank");
        }
        if (severity == null) {
            throw new IllegalArgumentException("severity cannot be null");
        }
        if (confidence == null) {
            throw new IllegalArgumentException("confidence cannot be null");
        }
        if (descriptor == null) {
            descriptor = "";
        }
        if (signature == null) {
            signature = className + "." + methodName;
        }
    }

    /**
     * Creates a finding for the given method.
     */
    public static Builder forMethod(MethodInfo method) {
        return new Builder()
                .className(method.declaringType())
                .methodName(method.name())
                .descriptor(method.descriptor())
                .signature(method.signature())
                .lineNumber(method.firstLine())
                .sourceFile(method.sourceFile());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String className;
        private String methodName;
        private String descriptor;
        private String signature;
        private int lineNumber = -1;
        private String sourceFile;
        private Severity severity;
        private Confidence confidence;
        private String ruleId;
        private String description;
        private String recommendation;

        public Builder className(String className) {
            this.className = className;
            return this;
        }

        public Builder methodName(String methodName) {
            this.methodName = methodName;
            return this;
        }

        public Builder descriptor(String descriptor) {
            this.descriptor = descriptor;
            return this;
        }

        public Builder signature(String signature) {
            this.signature = signature;
            return this;
        }

        public Builder lineNumber(int lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(Confidence confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder recommendation(String recommendation) {
            this.recommendation = recommendation;
            return this;
        }

        public Finding build() {
            return new Finding(
                    className,
                    methodName,
                    descriptor,
                    signature,
                    lineNumber,
                    sourceFile,
                    severity,
                    confidence,
                    ruleId,
                    description,
                    recommendation
            );
        }
    }

    /**
     * Returns a display-friendly location string.
     */
    public String location() {
        if (sourceFile != null && lineNumber > 0) {
            return className + " (" + sourceFile + ":" + lineNumber + ")";
        }
        return className;
    }

    /**
     * Returns the simple class name (without package).
     */
    public String simpleClassName() {
        int lastDot = className.lastIndexOf('.');
        return lastDot >= 0 ? className.substring(lastDot + 1) : className;
    }
}
