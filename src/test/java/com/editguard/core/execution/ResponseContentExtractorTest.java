package com.editguard.core.execution;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseContentExtractorTest {

    @Test
    void testFencedBlockIsExtracted() {
        String response = """
                Here is the updated component:
                ```tsx
                const a = 1;
                const b = 2;
                ```
                Let me know if you need anything else.
                """;

        assertEquals("const a = 1;\nconst b = 2;\n", ResponseContentExtractor.extract(response));
    }

    @Test
    void testFencedBodyKeepsIndentationAndBlankLines() {
        String body = "  return (\n\n    <div />\n  );\n";

        assertEquals(body, ResponseContentExtractor.extract("```jsx\n" + body + "```"));
    }

    @Test
    void testFirstFencedBlockWins() {
        String response = "```js\nfirst();\n```\n\n```js\nsecond();\n```";

        assertEquals("first();\n", ResponseContentExtractor.extract(response));
    }

    @Test
    void testUnterminatedFenceIsStripped() {
        assertEquals("const a = 1;\n", ResponseContentExtractor.extract("```typescript\nconst a = 1;\n"));
    }

    @Test
    void testPlainResponseDropsOnlyLeadingBlankLines() {
        assertEquals("  const a = 1;  \n", ResponseContentExtractor.extract("\n\n  const a = 1;  \n"));
    }

    @Test
    void testBlankResponseIsEmpty() {
        assertEquals("", ResponseContentExtractor.extract(null));
        assertEquals("", ResponseContentExtractor.extract("   \n"));
    }

    @Test
    void testMissingFinalNewlineIsRestoredFromOriginal() {
        assertEquals("const a = 1;\nconst b = 3;\n",
                ResponseContentExtractor.extract("const a = 1;\nconst b = 3;", "const a = 1;\nconst b = 2;\n"));
        assertEquals("const b = 3;\n\n",
                ResponseContentExtractor.extract("```js\nconst b = 3;\n```", "const b = 2;\n\n"));
    }

    @Test
    void testExtraFinalNewlineIsDroppedWhenOriginalHasNone() {
        assertEquals("const b = 3;",
                ResponseContentExtractor.extract("```js\nconst b = 3;\n\n```", "const b = 2;"));
    }

    @Test
    void testNewFileKeepsContentAsGenerated() {
        assertEquals("const a = 1;\n", ResponseContentExtractor.withFinalNewlineOf("const a = 1;\n", ""));
    }

    @Test
    void testStripFenceLinesKeepsProse() {
        String response = "Recommendation: rename the prop\n```tsx\n<Button />\n```\nDone";

        assertEquals("Recommendation: rename the prop\n<Button />\nDone",
                ResponseContentExtractor.stripFenceLines(response));
    }

    @Test
    void testStripFenceLinesKeepsFinalNewline() {
        assertEquals("<Button />\n", ResponseContentExtractor.stripFenceLines("```tsx\n<Button />\n```\n"));
    }
}
