package com.homework.core.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.llm.oracle.ContentOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ResilientJsonExtractor}.
 */
class ResilientJsonExtractorTest {

    private ResilientJsonExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new ResilientJsonExtractor(new ObjectMapper());
    }

    @Test
    void shouldPreferFencedBlock() {
        JsonExtraction result = extractor.extract("noise {\"x\":0}\n```json\n{\"a\":1}\n```\ntrailing }");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getJson().get("a").asInt()).isEqualTo(1);
        assertThat(result.getJson().has("x")).isFalse();
    }

    @Test
    void shouldIgnoreProseAroundFence() {
        JsonExtraction result = extractor.extract("Sure, here:\n```json\n{\"a\":1}\n```\nThanks");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCandidate()).isEqualTo("{\"a\":1}");
    }

    @Test
    void shouldReadToEnd_whenFenceIsTruncated() {
        JsonExtraction result = extractor.extract("```json\n{\"a\":[1,2]}");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getJson().get("a")).hasSize(2);
    }

    @Test
    void shouldUseOutermostBraces_whenNoFence() {
        JsonExtraction result = extractor.extract("Here you go: {\"a\":{\"b\":2}} hope it helps");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getJson().path("a").path("b").asInt()).isEqualTo(2);
    }

    @Test
    void shouldFail_whenSpanHoldsTwoObjects() {
        JsonExtraction result = extractor.extract("blah {\"a\":1} blah {\"b\":2}");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getCandidate()).isEqualTo("{\"a\":1} blah {\"b\":2}");
        assertThat(result.getFailureReason()).isNotBlank();
    }

    @Test
    void shouldFail_whenTopLevelValueIsNotObject() {
        JsonExtraction result = extractor.extract("```json\n[1,2,3]\n```");

        assertThat(result.isSuccess()).isFalse();
    }

    @Test
    void shouldFailWithoutThrowing_forEmptyOrGarbageInput() {
        assertThat(extractor.extract(null).isSuccess()).isFalse();
        assertThat(extractor.extract("").isSuccess()).isFalse();
        assertThat(extractor.extract("no json here").isSuccess()).isFalse();
        assertThat(extractor.extract("} backwards {").isSuccess()).isFalse();
        assertThat(extractor.extract(ContentOracle.FAILURE_SENTINEL).isSuccess()).isFalse();
    }
}
