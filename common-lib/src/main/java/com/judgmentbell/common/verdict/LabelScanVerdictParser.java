package com.judgmentbell.common.verdict;

import com.judgmentbell.common.model.Verdict;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Scans free text for the two canonical labels as standalone tokens.
 *
 * <p>Resolves only when exactly one of the two labels occurs (any number of times).
 * Text naming both, such as an echoed answer template, is ambiguous and stays unresolved.
 */
public class LabelScanVerdictParser implements VerdictParser {

    private static final Pattern NOT_GUILTY = Pattern.compile("\\bNOT[_\\s-]?GUILTY\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern GUILTY     = Pattern.compile("\\bGUILTY\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "label-scan";
    }

    @Override
    public Optional<Verdict> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        boolean notGuilty = NOT_GUILTY.matcher(text).find();
        String remainder = NOT_GUILTY.matcher(text).replaceAll(" ");
        boolean guilty = GUILTY.matcher(remainder).find();

        if (notGuilty && !guilty) return Optional.of(Verdict.NOT_GUILTY);
        if (guilty && !notGuilty) return Optional.of(Verdict.GUILTY);
        return Optional.empty();
    }
}
