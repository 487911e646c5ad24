package com.homework.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.homework.core.answer.AnswerAggregator;
import com.homework.core.config.HomeworkProperties;
import com.homework.core.json.ResilientJsonExtractor;
import com.homework.core.matching.ElementMatcher;
import com.homework.core.model.AnswerRecord;
import com.homework.core.model.Element;
import com.homework.core.model.PipelineResult;
import com.homework.core.model.ProblemResult;
import com.homework.core.structure.PrefixGrouper;
import com.homework.core.structure.RegexQuestionRecognizer;
import com.homework.core.structure.StructureInferenceService;
import com.homework.core.structure.StructureReplyParser;
import com.homework.core.support.Elements;
import com.homework.core.support.ScriptedOracle;
import com.homework.llm.oracle.ContentOracle;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests for {@link HomeworkPipeline} wired with real stages and a scripted oracle.
 */
class HomeworkPipelineTest {

    private static HomeworkPipeline pipeline(ContentOracle oracle) {
        ResilientJsonExtractor extractor = new ResilientJsonExtractor(new ObjectMapper());
        StructureInferenceService structure = new StructureInferenceService(oracle,
            new StructureReplyParser(extractor), new RegexQuestionRecognizer(), new PrefixGrouper());
        AnswerAggregator aggregator = new AnswerAggregator(oracle, extractor, HomeworkProperties.defaults(Path.of("unused")));
        return new HomeworkPipeline(structure, new ElementMatcher(), aggregator);
    }

    private static final List<Element> TWO_PAGES = List.of(
        Elements.text("1. Let f(x) = x^2.\n(a) Find f(2).\n(b) Find f'(x).", 1),
        Elements.raster("PAGE2", 2));

    @Test
    void shouldBackfillSecondSubquestion_whenOracleAnswersOnlyTheFirst() {
        ScriptedOracle oracle = ScriptedOracle.replying(
            """
            {"problems":[{"id":"1","text":"Let f(x) = x^2.","pages":[1],"subquestions":[
              {"id":"1(a)","text":"Find f(2).","pages":[1]},
              {"id":"1(b)","text":"Find f'(x).","pages":[1]}]}]}
            """,
            "```json\n{\"problem_id\":\"1\",\"answers\":[{\"sub_id\":\"1(a)\",\"answer\":\"4\",\"reason\":\"2*2\"}]}\n```");

        PipelineResult result = pipeline(oracle).run(TWO_PAGES);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.getTotalElements()).isEqualTo(2);
        assertThat(result.getTotalProblems()).isEqualTo(1);
        ProblemResult problem = result.getResults().get(0);
        assertThat(problem.getAnswers()).hasSize(2);
        assertThat(problem.getAnswers().get(0).getAnswerText()).isEqualTo("4");
        AnswerRecord second = problem.getAnswers().get(1);
        assertThat(second.getSubquestionId()).isEqualTo("1(b)");
        assertThat(second.getSubquestionText()).isEqualTo("Find f'(x).");
        assertThat(second.getAnswerText()).isEmpty();
        assertThat(second.getReasoningText()).isEmpty();
        // smart inference pulled in the page 2 raster, so it is sent with the answer request
        assertThat(oracle.getRequests().get(1)).anyMatch(part -> part.isImage() && "PAGE2".equals(part.getData()));
    }

    @Test
    void shouldRecoverThroughRegexAndDegradedAnswers_whenOracleIsDown() {
        PipelineResult result = pipeline(ScriptedOracle.replying()).run(List.of(
            Elements.text("1. first\n2. second", 1)));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.getResults()).extracting(ProblemResult::getProblemId).containsExactly("1", "2");
        assertThat(result.getResults().get(0).getAnswers().get(0).getAnswerText())
            .isEqualTo(ContentOracle.FAILURE_SENTINEL);
    }

    @Test
    void shouldStopAtStepOne_whenThereAreNoElements() {
        PipelineResult result = pipeline(ScriptedOracle.replying()).run(List.of());

        assertThat(result.succeeded()).isFalse();
        assertThat(result.getStep()).isEqualTo(1);
        assertThat(result.getError()).isNotBlank();
        assertThat(result.getResults()).isNull();
    }

    @Test
    void shouldStopAtStepTwo_whenNothingIsRecognised() {
        PipelineResult result = pipeline(ScriptedOracle.replying("no structure")).run(List.of(
            Elements.text("just some prose without numbering", 1)));

        assertThat(result.getStep()).isEqualTo(2);
    }

    @Test
    void shouldStopAtStepTwo_whenLegacyListIsEmpty() {
        PipelineResult result = pipeline(ScriptedOracle.replying("{\"questions\":[]}")).run(TWO_PAGES);

        assertThat(result.getStep()).isEqualTo(2);
    }

    @Test
    void shouldStopAtStepThree_whenNoProblemHasSubquestions() {
        PipelineResult result = pipeline(ScriptedOracle.replying(
            "{\"problems\":[{\"id\":\"1\",\"text\":\"stem only\",\"subquestions\":[]}]}")).run(TWO_PAGES);

        assertThat(result.getStep()).isEqualTo(3);
    }

    @Test
    void shouldReportStep_whenStageThrowsUnexpectedly() {
        ContentOracle broken = (instruction, parts) -> {
            throw new IllegalStateException("boom");
        };

        PipelineResult result = pipeline(broken).run(TWO_PAGES);

        assertThat(result.getStep()).isEqualTo(2);
        assertThat(result.getError()).isEqualTo("boom");
    }
}
