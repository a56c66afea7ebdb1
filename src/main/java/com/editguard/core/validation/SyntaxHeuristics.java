package com.editguard.core.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * SyntaxHeuristics: shallow structural sanity checks over raw source text.
 *
 * Not a parser: brackets are counted without regard to strings or comments,
 * and an unclosed opener is reported only when openers outnumber closers.
 * Each finding is an ERROR of type SYNTAX.
 */
public final class SyntaxHeuristics {

    private static final String FIX_SUGGESTION = "Fix the syntax error before proceeding";

    private static final Pattern DANGLING_IMPORT = Pattern.compile("import[^\\n]*from\\s*$");
    private static final Pattern DANGLING_EXPORT = Pattern.compile("export\\s*$");

    private SyntaxHeuristics() {}

    public static List<ValidationIssue> check(String content) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (content == null) {
            return issues;
        }

        checkBalance(content, '{', '}', "Unclosed brace detected", issues);
        checkBalance(content, '(', ')', "Unclosed parenthesis detected", issues);
        checkBalance(content, '[', ']', "Unclosed bracket detected", issues);

        String trimmed = content.stripTrailing();
        if (DANGLING_IMPORT.matcher(trimmed).find()) {
            issues.add(ValidationIssue.error(IssueType.SYNTAX, "Incomplete import statement", FIX_SUGGESTION));
        }
        if (DANGLING_EXPORT.matcher(trimmed).find()) {
            issues.add(ValidationIssue.error(IssueType.SYNTAX, "Incomplete export statement", FIX_SUGGESTION));
        }
        return issues;
    }

    private static void checkBalance(String content, char open, char close, String message,
                                     List<ValidationIssue> issues) {
        int opens  = 0;
        int closes = 0;
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == open)  opens++;
            if (c == close) closes++;
        }
        if (opens > closes) {
            issues.add(ValidationIssue.error(IssueType.SYNTAX,
                    message + " (" + (opens - closes) + " unmatched '" + open + "')", FIX_SUGGESTION));
        }
    }
}
