package com.editguard.llm;

import com.editguard.core.confidence.ChangeApproach;
import com.editguard.core.request.PropertyEdit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OllamaGenerationBackendTest {

    private static final String URL = "http://ollama.test/api/generate";

    private RestTemplate          restTemplate;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server       = MockRestServiceServer.bindTo(restTemplate).build();
    }

    @Test
    void testSuccessReturnsResponseField() {
        server.expect(requestTo(URL))
              .andExpect(method(HttpMethod.POST))
              .andExpect(jsonPath("$.model").value("llama3:8b"))
              .andExpect(jsonPath("$.stream").value(false))
              .andExpect(jsonPath("$.options.temperature").value(0.2))
              .andRespond(withSuccess("""
                      {"model":"llama3:8b","response":"```tsx\\nconst a = 2;\\n```","done":true}
                      """, MediaType.APPLICATION_JSON));

        GenerationResult result = backend("").generate(request(ChangeApproach.HIGH_CONFIDENCE_DIRECT));

        assertTrue(result.isSuccess());
        assertEquals("```tsx\nconst a = 2;\n```", result.getContent());
        server.verify();
    }

    @Test
    void testTemperatureOverrideWins() {
        server.expect(requestTo(URL))
              .andExpect(jsonPath("$.options.temperature").value(0.7))
              .andRespond(withSuccess("{\"response\":\"ok\"}", MediaType.APPLICATION_JSON));

        backend("0.7").generate(request(ChangeApproach.LOW_CONFIDENCE_CONSERVATIVE));

        server.verify();
    }

    @Test
    void testTooManyRequestsIsRateLimitedWithRetryAfter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.RETRY_AFTER, "7");
        server.expect(requestTo(URL))
              .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(headers));

        GenerationResult result = backend("").generate(request(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED));

        assertTrue(result.isRateLimited());
        assertEquals(Duration.ofSeconds(7), result.getRetryAfter().orElseThrow());
    }

    @Test
    void testTooManyRequestsWithoutRetryAfter() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        GenerationResult result = backend("").generate(request(ChangeApproach.MEDIUM_CONFIDENCE_GUIDED));

        assertTrue(result.isRateLimited());
        assertTrue(result.getRetryAfter().isEmpty());
    }

    @Test
    void testServerErrorIsTransient() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        GenerationResult result = backend("").generate(request(ChangeApproach.HIGH_CONFIDENCE_DIRECT));

        assertEquals(GenerationResult.Status.TRANSIENT_FAILURE, result.getStatus());
        assertTrue(result.getErrorMessage().contains("500"));
    }

    @Test
    void testClientErrorIsPermanent() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.NOT_FOUND));

        GenerationResult result = backend("").generate(request(ChangeApproach.HIGH_CONFIDENCE_DIRECT));

        assertEquals(GenerationResult.Status.PERMANENT_FAILURE, result.getStatus());
        assertTrue(result.getErrorMessage().contains("404"));
    }

    @Test
    void testMissingResponseFieldIsTransient() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"done\":true}", MediaType.APPLICATION_JSON));

        GenerationResult result = backend("").generate(request(ChangeApproach.HIGH_CONFIDENCE_DIRECT));

        assertEquals(GenerationResult.Status.TRANSIENT_FAILURE, result.getStatus());
    }

    @Test
    void testEchoBackendAppliesEditsAndPreservesOriginalForReview() {
        EchoGenerationBackend echo = new EchoGenerationBackend();

        GenerationResult direct = echo.generate(request(ChangeApproach.HIGH_CONFIDENCE_DIRECT));
        GenerationResult review = echo.generate(request(ChangeApproach.VERY_LOW_CONFIDENCE_HUMAN_REVIEW));

        assertEquals("```tsx\nconst a = 2;\n```", direct.getContent());
        assertTrue(review.getContent().startsWith("// Analysis Summary"));
        assertTrue(review.getContent().endsWith("const a = 1;"));
    }

    private OllamaGenerationBackend backend(String temperature) {
        return new OllamaGenerationBackend(restTemplate, "http://ollama.test", "llama3:8b", temperature);
    }

    private static GenerationRequest request(ChangeApproach approach) {
        return new GenerationRequest("Change a to 2", approach, "src/a.ts", "const a = 1;",
                List.of(PropertyEdit.styling("value", "1", "2")));
    }
}
