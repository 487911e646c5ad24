package com.homework.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ProblemResult {
    String problemId;
    String problemText;
    int subquestionCount;
    List<AnswerRecord> answers;
}
