package io.verdict.server.validation;

/// Strips control characters from strings to prevent log injection.
///
/// Session ids, item ids and reviewer reasoning all arrive from callers. A value
/// containing `\r` or `\n` could otherwise forge extra log entries.
///
/// Apply to any caller-supplied value before passing it to a logger:
/// ```
/// LOG.infov("Pass accepted: session={0}", LogSanitizer.sanitize(sessionId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or `"null"` if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }

    /// Sanitizes and shortens free text such as reviewer reasoning.
    ///
    /// @param value the text to sanitize, may be null
    /// @param maxLength longest result before an ellipsis is appended, at least 1
    /// @return sanitized text, never null
    public static String abbreviate(String value, int maxLength) {
        String clean = sanitize(value);
        return clean.length() <= maxLength ? clean : clean.substring(0, maxLength) + "...";
    }
}
