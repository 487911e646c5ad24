package com.homework.core.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AnswerRecord {
    String problemId;
    String subquestionId;
    String subquestionText;
    @ToString.Exclude
    List<String> subquestionImages;
    String answerText;
    String reasoningText;

    public static AnswerRecord of(String problemId, Subquestion subquestion, String answerText, String reasoningText) {
        return AnswerRecord.builder()
            .problemId(problemId)
            .subquestionId(subquestion.getId())
            .subquestionText(subquestion.getText())
            .subquestionImages(subquestion.getImages())
            .answerText(answerText)
            .reasoningText(reasoningText)
            .build();
    }

    public static AnswerRecord empty(String problemId, Subquestion subquestion) {
        return of(problemId, subquestion, "", "");
    }
}
