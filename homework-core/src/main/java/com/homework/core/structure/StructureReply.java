package com.homework.core.structure;

import com.homework.core.model.ProblemOutline;
import com.homework.core.model.QuestionFragment;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * Decoded structure reply. Exactly one payload is populated, chosen by {@link #kind}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class StructureReply {

    public enum Kind {
        /** Reply carried a non-empty {@code problems} hierarchy. */
        NATIVE_HIERARCHY,
        /** Reply carried a flat {@code questions} list that still needs prefix grouping. */
        LEGACY_FLAT_LIST,
        /** Nothing usable; {@code diagnostic} says why. */
        UNPARSEABLE
    }

    Kind kind;
    List<ProblemOutline> problems;
    List<QuestionFragment> fragments;
    String diagnostic;

    public static StructureReply nativeHierarchy(List<ProblemOutline> problems) {
        return new StructureReply(Kind.NATIVE_HIERARCHY, problems, List.of(), null);
    }

    public static StructureReply legacyFlatList(List<QuestionFragment> fragments) {
        return new StructureReply(Kind.LEGACY_FLAT_LIST, List.of(), fragments, null);
    }

    public static StructureReply unparseable(String diagnostic) {
        return new StructureReply(Kind.UNPARSEABLE, List.of(), List.of(), diagnostic);
    }
}
