package com.editguard.llm;

import com.editguard.core.request.PropertyEdit;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Offline backend for the "mock" profile.
 *
 * Applies each edit as a literal before → after replacement on the original
 * content and returns it fenced, the way a well-behaved model would. Human-review
 * requests get a short comment header above the untouched original.
 */
@Component
@Profile("mock")
public class EchoGenerationBackend implements GenerationBackend {

    @Override
    public GenerationResult generate(GenerationRequest request) {
        String original = request.getOriginalContent();

        if (request.getApproach().isHumanReview()) {
            return GenerationResult.success("""
                    // Analysis Summary: requested change could not be mapped with confidence
                    // Recommendation: review the edits below before applying
                    %s""".formatted(original));
        }

        String content = original;
        for (PropertyEdit edit : request.getEdits()) {
            if (!edit.getBefore().isEmpty()) {
                content = content.replace(edit.getBefore(), edit.getAfter());
            }
        }
        return GenerationResult.success("```tsx\n" + content + "\n```");
    }
}
