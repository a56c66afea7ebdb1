package com.editguard.llm;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.request.PropertyEdit;

import java.util.List;
import java.util.Objects;

/**
 * One call to a generation backend: the rendered instruction plus the file it targets.
 *
 * The original content and the requested edits travel alongside the prompt so
 * that offline backends can produce output without parsing the prompt text.
 */
public final class GenerationRequest {

    private final String             prompt;
    private final ChangeApproach     approach;
    private final String             filePath;
    private final String             originalContent;
    private final List<PropertyEdit> edits;

    public GenerationRequest(String prompt, ChangeApproach approach, String filePath,
                             String originalContent, List<PropertyEdit> edits) {
        this.prompt          = Objects.requireNonNull(prompt, "prompt");
        this.approach        = Objects.requireNonNull(approach, "approach");
        this.filePath        = filePath        != null ? filePath        : "";
        this.originalContent = originalContent != null ? originalContent : "";
        this.edits           = edits           != null ? List.copyOf(edits) : List.of();
    }

    public String             getPrompt()          { return prompt; }
    public ChangeApproach     getApproach()        { return approach; }
    public String             getFilePath()        { return filePath; }
    public String             getOriginalContent() { return originalContent; }
    public List<PropertyEdit> getEdits()           { return edits; }

    @Override
    public String toString() {
        return String.format("GenerationRequest{approach=%s, file=%s, promptLen=%d}",
                approach, filePath, prompt.length());
    }
}
