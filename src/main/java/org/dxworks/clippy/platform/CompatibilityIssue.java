package org.dxworks.clippy.platform;

public record CompatibilityIssue(Severity severity, String feature, String message) {

    public enum Severity {
        /** The platform cannot show the feature; the content is not compatible. */
        ERROR,
        /** The feature degrades on the platform. */
        WARNING
    }

    public static CompatibilityIssue error(String feature, String message) {
        return new CompatibilityIssue(Severity.ERROR, feature, message);
    }

    public static CompatibilityIssue warning(String feature, String message) {
        return new CompatibilityIssue(Severity.WARNING, feature, message);
    }
}
