package com.editguard.core.execution;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the file body out of a raw model response.
 *
 * Models wrap code in markdown fences even when told not to. The first fenced
 * block wins; an unterminated opening fence is stripped; anything else is
 * taken verbatim apart from leading blank lines. Only fence lines are ever
 * removed: the body keeps its bytes, including indentation and line endings.
 */
public final class ResponseContentExtractor {

    /** Opening fence line, body, then a closing fence at the start of a line. */
    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```[^\\n]*\\n([\\s\\S]*?)^[ \\t]*```", Pattern.MULTILINE);

    private static final Pattern LEADING_BLANK_LINES = Pattern.compile("\\A(?:[ \\t]*\\r?\\n)+");

    private ResponseContentExtractor() {}

    public static String extract(String response) {
        if (response == null || response.isBlank()) {
            return "";
        }

        Matcher m = FENCED_BLOCK.matcher(response);
        if (m.find()) {
            return m.group(1);
        }

        String text = LEADING_BLANK_LINES.matcher(response).replaceFirst("");
        if (text.stripLeading().startsWith("```")) {
            int firstNewline = text.indexOf('\n');
            return firstNewline >= 0 ? text.substring(firstNewline + 1) : "";
        }
        return text;
    }

    /** Extracts the body and gives it the same line ending at end of file as {@code original}. */
    public static String extract(String response, String original) {
        return withFinalNewlineOf(extract(response), original);
    }

    /**
     * Replaces the trailing line breaks of {@code content} with those of {@code original},
     * so a model that drops or adds the final newline does not register as a line change.
     * Content for a new file (empty original) and blank content are returned untouched.
     */
    public static String withFinalNewlineOf(String content, String original) {
        if (content == null || content.isBlank() || original == null || original.isEmpty()) {
            return content == null ? "" : content;
        }
        return stripFinalNewlines(content) + original.substring(stripFinalNewlines(original).length());
    }

    /** Removes every fence line, keeping prose and code alike. Used for proposals. */
    public static String stripFenceLines(String response) {
        if (response == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (String line : response.split("\n", -1)) {
            if (line.trim().startsWith("```")) {
                continue;
            }
            if (!first) {
                sb.append('\n');
            }
            sb.append(line);
            first = false;
        }
        return sb.toString();
    }

    private static String stripFinalNewlines(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }
}
