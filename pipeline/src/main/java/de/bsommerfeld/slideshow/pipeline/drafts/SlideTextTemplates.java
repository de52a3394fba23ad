package de.bsommerfeld.slideshow.pipeline.drafts;

import de.bsommerfeld.slideshow.core.domain.SlideRole;
import de.bsommerfeld.slideshow.pipeline.matching.Tokens;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Role specific copy for generated slides. A template set is bound to one
 * draft: the step count of the first hook variant is drawn once on creation.
 */
final class SlideTextTemplates {

    static final List<String> FALLBACK_KEYWORDS = List.of("makeup", "glow");
    private static final int MAX_KEYWORDS = 5;

    private final String topic;
    private final List<String> keywords;
    private final List<String> hookVariants;

    SlideTextTemplates(String topic, Random random) {
        this.topic = topic;
        this.keywords = keywords(topic);
        int steps = 3 + random.nextInt(5);
        this.hookVariants = List.of(
                "Stop scrolling: " + topic + " in " + steps + " steps",
                "Most people mess this up: " + topic,
                "The " + keywords.get(0) + " trick that changes everything");
    }

    /** First five distinct lowercase alphanumeric words of the topic. */
    static List<String> keywords(String topic) {
        List<String> words = new ArrayList<>(Tokens.tokenize(topic));
        if (words.isEmpty())
            return FALLBACK_KEYWORDS;
        return List.copyOf(words.subList(0, Math.min(MAX_KEYWORDS, words.size())));
    }

    List<String> keywords() {
        return keywords;
    }

    /**
     * @param index 1-based slide position
     */
    String textFor(SlideRole role, int index, Random random) {
        switch (role) {
            case HOOK:
                return hookVariants.get(random.nextInt(hookVariants.size()));
            case SETUP:
                return "If you want better " + keywords.get(0) + " results, start here.";
            case REVEAL:
                return "Final transformation: combine " + keywords.get(0) + " + "
                        + keywords.get(keywords.size() - 1) + ".";
            case CTA:
                return "Comment 'guide' and I will post part 2 on " + topic + ".";
            case LIST_ITEM:
                return "Step " + index + ": optimize " + keywordAt(index) + ".";
            case COMPARISON:
                return "Before vs after: " + keywords.get(0) + " with and without this method.";
            case PROOF:
            default:
                return "Do this first: focus on " + keywordAt(index) + ".";
        }
    }

    private String keywordAt(int index) {
        return keywords.get(index % keywords.size());
    }
}
