package com.homework.llm.prompt;

public final class HomeworkPrompts {

    public static final String STRUCTURE_SYSTEM_PROMPT = """
        You are an expert at analysing the structure of homework and exam papers.
        Work at the level of whole problems. For every problem keep its stem text (may be empty),
        its subquestions, and for every problem and subquestion the pages it appears on and the
        indices of the related input elements. Every input element is introduced by a marker
        such as [#3]; use those numbers as element indices.
        Return strictly JSON in exactly this shape:
        {"problems":[{"id":"1","text":"stem (may be empty)","relatedElementIndices":[0,1],"pages":[1],"subquestions":[{"id":"1(a)","text":"subquestion text","relatedElementIndices":[2],"pages":[1]}]}]}
        Return only the JSON, no explanations.
        """;

    public static final String ANSWER_SYSTEM_PROMPT = """
        You are a professional homework-solving assistant.
        Using the problem stem, answer every subquestion in turn and give detailed steps and
        reasoning for each one. Answer in the language the question is written in.
        Important: finish by returning strictly JSON in exactly this shape:
        {"problem_id":"1","problem_text":"stem text (if any)","answers":[{"sub_id":"1(a)","answer":"...","reason":"..."}]}
        Do not return extra commentary; put derivations and working in the reason field.
        """;

    public static String elementMarker(int index, int pageNumber, String kind) {
        return "[#" + index + "] (page " + pageNumber + ", " + kind + ")";
    }

    public static String stemTurn(String problemId, String stem) {
        return "Problem " + problemId + " stem:\n" + stem;
    }

    public static String subquestionTurn(String subquestionId, String text) {
        return "Subquestion " + subquestionId + ":\n" + (text == null ? "" : text);
    }

    private HomeworkPrompts() {}
}
