package ai.twinscript.testutil;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/** Line-ending agnostic assertions over generated code. */
public final class AssertionHelperUtil {

    private AssertionHelperUtil() {}

    public static void assertCodeEquals(String expected, String actual) {
        assertCodeEquals(expected, actual, null);
    }

    public static void assertCodeEquals(String expected, String actual, @Nullable String message) {
        var cleanExpected = normalizeLineEndings(expected);
        var cleanActual = normalizeLineEndings(actual);
        if (message == null) {
            assertEquals(cleanExpected, cleanActual);
        } else {
            assertEquals(cleanExpected, cleanActual, message);
        }
    }

    public static void assertCodeContains(String fullContent, String substring) {
        assertCodeContains(fullContent, substring, null);
    }

    public static void assertCodeContains(String fullContent, String substring, @Nullable String message) {
        var cleanFullContent = normalizeLineEndings(fullContent);
        var cleanSubstring = normalizeLineEndings(substring);
        assertTrue(
                cleanFullContent.contains(cleanSubstring),
                Objects.requireNonNullElseGet(
                        message, () -> "Expected code containing:\n" + substring + "\nin:\n" + fullContent));
    }

    public static void assertCodeStartsWith(String fullContent, String expectedPrefix) {
        assertTrue(
                normalizeLineEndings(fullContent).startsWith(normalizeLineEndings(expectedPrefix)),
                "Expected code starting with:\n" + expectedPrefix + "\nbut was:\n" + fullContent);
    }

    public static void assertCodeDoesNotContain(String fullContent, String substring) {
        assertFalse(
                normalizeLineEndings(fullContent).contains(normalizeLineEndings(substring)),
                "Expected code without:\n" + substring + "\nin:\n" + fullContent);
    }

    private static String normalizeLineEndings(String content) {
        return content.replaceAll("\\R", "\n").strip();
    }
}
