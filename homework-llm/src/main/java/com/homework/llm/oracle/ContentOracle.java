package com.homework.llm.oracle;

import com.homework.llm.model.ContentPart;

import java.util.List;

/**
 * Multimodal responder that interprets a system instruction plus a sequence of
 * text and image turns and answers with free-form text.
 *
 * <p>Implementations block until a reply is available and never throw for
 * transport or provider failures: once their retry budget is spent they return
 * {@link #FAILURE_SENTINEL}. Callers must not assume the reply contains valid JSON.
 */
public interface ContentOracle {

    String FAILURE_SENTINEL = "[oracle-failure] content oracle call failed after all retries";

    String respond(String systemInstruction, List<ContentPart> parts);

    static boolean isFailure(String reply) {
        return reply == null || reply.isBlank() || FAILURE_SENTINEL.equals(reply);
    }
}
