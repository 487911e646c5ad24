package com.homework.core.matching;

import com.homework.core.model.Element;
import com.homework.core.model.Problem;
import com.homework.core.model.ProblemOutline;
import com.homework.core.model.Subquestion;
import com.homework.core.model.SubquestionOutline;
import com.homework.core.structure.ElementOrdering;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Resolves outline element indices into elements.
 *
 * <p>Indices outside the element list are dropped. A subquestion that ends up with
 * no elements is matched by page proximity: every image on its pages or the
 * neighbouring ones, plus text elements that contain the subquestion text. If that
 * still finds nothing, the first {@value #SMART_INFERENCE_FALLBACK_LIMIT}
 * candidates in reading order are used.
 */
@Component
@Slf4j
public class ElementMatcher {

    static final int SMART_INFERENCE_FALLBACK_LIMIT = 3;
    private static final int DEFAULT_PAGE = 1;

    public List<Problem> match(List<ProblemOutline> outlines, List<Element> elements) {
        List<Element> ordered = ElementOrdering.sort(elements);
        List<Problem> problems = new ArrayList<>();

        for (ProblemOutline outline : outlines) {
            Set<Integer> problemIndices = new LinkedHashSet<>(resolveIndices(outline.getRelatedElementIndices(), ordered.size()));
            List<Subquestion> subquestions = new ArrayList<>();

            for (SubquestionOutline subOutline : outline.getSubquestions()) {
                List<Integer> indices = resolveIndices(subOutline.getRelatedElementIndices(), ordered.size());
                if (indices.isEmpty()) {
                    indices = inferIndices(subOutline, ordered);
                    log.debug("Smart inference for subquestion {} of problem {} selected {} element(s)",
                        subOutline.getId(), outline.getId(), indices.size());
                }
                problemIndices.addAll(indices);
                subquestions.add(toSubquestion(subOutline, indices, ordered));
            }

            if (subquestions.isEmpty()) {
                log.warn("Dropping problem {}: no subquestions", outline.getId());
                continue;
            }

            problems.add(Problem.builder()
                .id(outline.getId())
                .text(outline.getText())
                .pageNumbers(problemPages(outline))
                .relatedElements(toElements(problemIndices, ordered))
                .subquestions(List.copyOf(subquestions))
                .build());
        }

        log.info("Element matching complete | outlines={} | problems={}", outlines.size(), problems.size());
        return problems;
    }

    private List<Integer> resolveIndices(List<Integer> declared, int elementCount) {
        Set<Integer> resolved = new LinkedHashSet<>();
        for (Integer index : declared) {
            if (index != null && index >= 0 && index < elementCount) {
                resolved.add(index);
            }
        }
        return new ArrayList<>(resolved);
    }

    List<Integer> inferIndices(SubquestionOutline subquestion, List<Element> ordered) {
        Set<Integer> window = pageWindow(subquestion.getPages());
        String text = subquestion.getText() == null ? "" : subquestion.getText();

        List<Integer> candidates = new ArrayList<>();
        List<Integer> selected = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            Element element = ordered.get(i);
            if (!window.contains(element.getPageNumber())) {
                continue;
            }
            candidates.add(i);
            if (element.isImage() || (!text.isBlank() && element.getContent().contains(text))) {
                selected.add(i);
            }
        }

        if (selected.isEmpty()) {
            return candidates.subList(0, Math.min(SMART_INFERENCE_FALLBACK_LIMIT, candidates.size()));
        }
        return selected;
    }

    /**
     * Pages {p-1, p, p+1} for every numeric page token. Non-numeric tokens add
     * nothing; a subquestion with no pages at all is treated as being on page 1.
     */
    static Set<Integer> pageWindow(List<String> pages) {
        Set<Integer> window = new TreeSet<>();
        if (pages == null || pages.isEmpty()) {
            addWindow(window, DEFAULT_PAGE);
            return window;
        }
        for (String page : pages) {
            Integer number = parsePage(page);
            if (number != null) {
                addWindow(window, number);
            }
        }
        return window;
    }

    private static void addWindow(Set<Integer> window, int page) {
        window.add(page - 1);
        window.add(page);
        window.add(page + 1);
    }

    private static Integer parsePage(String page) {
        if (page == null) {
            return null;
        }
        try {
            return Integer.parseInt(page.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric page token '{}'", page);
            return null;
        }
    }

    private Subquestion toSubquestion(SubquestionOutline outline, List<Integer> indices, List<Element> ordered) {
        List<Element> related = toElements(indices, ordered);
        return Subquestion.builder()
            .id(outline.getId())
            .text(outline.getText())
            .images(related.stream().filter(Element::isImage).map(Element::getContent).toList())
            .pageNumbers(outline.getPages())
            .relatedElements(related)
            .build();
    }

    private List<Element> toElements(Iterable<Integer> indices, List<Element> ordered) {
        List<Element> result = new ArrayList<>();
        for (Integer index : indices) {
            result.add(ordered.get(index));
        }
        return List.copyOf(result);
    }

    private List<String> problemPages(ProblemOutline outline) {
        if (!outline.getPages().isEmpty()) {
            return outline.getPages();
        }
        Set<String> pages = new LinkedHashSet<>();
        outline.getSubquestions().forEach(sub -> pages.addAll(sub.getPages()));
        return List.copyOf(pages);
    }
}
