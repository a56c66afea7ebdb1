package com.editguard.core.execution;

import java.util.Objects;

/**
 * One proposed file change. oldContent is empty for CREATE, newContent is
 * empty for DELETE.
 */
public final class GeneratedChange {

    private final String     filePath;
    private final FileAction action;
    private final String     oldContent;
    private final String     newContent;
    private final String     rationale;

    public GeneratedChange(String filePath, FileAction action, String oldContent,
                           String newContent, String rationale) {
        this.filePath   = Objects.requireNonNull(filePath, "filePath");
        this.action     = Objects.requireNonNull(action, "action");
        this.oldContent = oldContent != null ? oldContent : "";
        this.newContent = newContent != null ? newContent : "";
        this.rationale  = rationale  != null ? rationale  : "";
    }

    public String     getFilePath()   { return filePath; }
    public FileAction getAction()     { return action; }
    public String     getOldContent() { return oldContent; }
    public String     getNewContent() { return newContent; }
    public String     getRationale()  { return rationale; }

    public boolean isNoOp() {
        return action == FileAction.MODIFY && oldContent.equals(newContent);
    }

    @Override
    public String toString() {
        return String.format("GeneratedChange{%s %s, %d -> %d chars}",
                action, filePath, oldContent.length(), newContent.length());
    }
}
