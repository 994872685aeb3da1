package com.judgmentbell.common.design;

import com.judgmentbell.common.model.Axis;
import com.judgmentbell.common.model.Party;
import com.judgmentbell.common.model.Tense;

/** Substitutes scenario text and axis framing into a language template. */
public final class PromptRenderer {

    private PromptRenderer() {}

    public static String render(LanguagePack pack, ScenarioContent scenario,
                                Tense tense, Axis axis, Party subject) {
        AxisFraming framing = scenario.framing(axis);
        String subjectName = subject.displayName();
        return pack.template()
            .replace("{tense_marker}", pack.marker(tense))
            .replace("{title}", scenario.title())
            .replace("{content}", scenario.content())
            .replace("{axis_name}", framing.name())
            .replace("{axis_question}", framing.question().replace("{subject}", subjectName))
            .replace("{subject}", subjectName)
            .trim();
    }
}
