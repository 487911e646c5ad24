package com.homework.core.structure;

import com.homework.core.model.QuestionFragment;
import com.homework.core.support.Elements;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link RegexQuestionRecognizer}.
 */
class RegexQuestionRecognizerTest {

    private final RegexQuestionRecognizer recognizer = new RegexQuestionRecognizer();

    @Test
    void shouldRecognizeEachSupportedNumberingStyle() {
        assertThat(RegexQuestionRecognizer.matchId("1. Solve for x")).isEqualTo("1");
        assertThat(RegexQuestionRecognizer.matchId("2、计算下列各式")).isEqualTo("2");
        assertThat(RegexQuestionRecognizer.matchId("3) prove it")).isEqualTo("3");
        assertThat(RegexQuestionRecognizer.matchId("第 4 题 填空")).isEqualTo("4");
        assertThat(RegexQuestionRecognizer.matchId("题5 选择")).isEqualTo("5");
        assertThat(RegexQuestionRecognizer.matchId("2b. second part")).isEqualTo("2b");
    }

    @Test
    void shouldPreferBareNumber_whenSeveralPatternsCouldMatch() {
        // "12." satisfies both the bare-number and the alphanumeric pattern
        assertThat(RegexQuestionRecognizer.matchId("12. text")).isEqualTo("12");
    }

    @Test
    void shouldSkipLinesWithoutNumbering() {
        assertThat(RegexQuestionRecognizer.matchId("Name: ______")).isNull();
        assertThat(RegexQuestionRecognizer.matchId("x = 1.5")).isNull();
    }

    @Test
    void shouldScanTextElementsLineByLine_andCarryElementPage() {
        List<QuestionFragment> fragments = recognizer.recognize(List.of(
            Elements.text("Homework 3\n  1. Compute 2+2  \n\n2. Compute 3+3", 1),
            Elements.image("1. not text", 1),
            Elements.text("3、Explain", 2)));

        assertThat(fragments).extracting(QuestionFragment::getId).containsExactly("1", "2", "3");
        assertThat(fragments.get(0).getText()).isEqualTo("1. Compute 2+2");
        assertThat(fragments.get(2).getPages()).containsExactly("2");
        assertThat(fragments.get(0).getRelatedElementIndices()).isEmpty();
    }

    @Test
    void shouldReturnNothing_whenNoTextElements() {
        assertThat(recognizer.recognize(List.of(Elements.raster("img", 1)))).isEmpty();
    }
}
