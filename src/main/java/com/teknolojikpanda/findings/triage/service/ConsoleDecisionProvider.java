package com.teknolojikpanda.findings.triage.service;

import com.teknolojikpanda.findings.synth.api.DecisionProvider;
import com.teknolojikpanda.findings.synth.api.TriageCanceledException;
import com.teknolojikpanda.findings.synth.model.Finding;
import com.teknolojikpanda.findings.synth.model.FindingCategory;
import com.teknolojikpanda.findings.synth.model.FindingEdit;
import com.teknolojikpanda.findings.synth.model.FindingPresentation;
import com.teknolojikpanda.findings.synth.model.Severity;
import com.teknolojikpanda.findings.synth.model.TriageResponse;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Interactive terminal provider. Prints the whole finding and reads one command per line:
 * {@code a} accept, {@code s} skip, {@code e} edit, {@code q} quit. Quitting or reaching the
 * end of input cancels the session.
 */
public class ConsoleDecisionProvider implements DecisionProvider {

    private static final String PROMPT = "[a]ccept  [s]kip  [e]dit  [q]uit > ";

    private final BufferedReader in;
    private final PrintWriter out;

    public ConsoleDecisionProvider(@Nonnull BufferedReader in, @Nonnull PrintWriter out) {
        this.in = Objects.requireNonNull(in, "in");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Nonnull
    @Override
    public TriageResponse decide(@Nonnull FindingPresentation presentation) {
        out.println();
        out.print(presentation.render());
        while (true) {
            String command = prompt(PROMPT);
            switch (command.trim().toLowerCase(Locale.ENGLISH)) {
                case "a":
                case "accept":
                    return TriageResponse.accept();
                case "s":
                case "skip":
                    return TriageResponse.skip();
                case "e":
                case "edit":
                    return TriageResponse.edit(readEdit(presentation.getFinding()));
                case "q":
                case "quit":
                    throw new TriageCanceledException(null, "Reviewer quit the session");
                default:
                    out.println("Unknown command '" + command.trim() + "'.");
            }
        }
    }

    private FindingEdit readEdit(Finding finding) {
        out.println("Press enter to keep the current value.");
        FindingEdit.Builder edit = FindingEdit.builder()
                .title(prompt("Title [" + finding.getTitle() + "]: "))
                .description(prompt("Description [" + abbreviate(finding.getDescription()) + "]: "));
        while (true) {
            String value = prompt("Severity P1/P2/P3 [" + finding.getSeverity() + "]: ").trim();
            if (value.isEmpty()) {
                break;
            }
            Severity severity = Severity.parse(value);
            if (severity != null) {
                edit.severity(severity);
                break;
            }
            out.println("Severity must be P1, P2 or P3.");
        }
        String category = prompt("Category [" + finding.getCategory().label() + "]: ").trim();
        if (!category.isEmpty()) {
            edit.category(FindingCategory.fromString(category));
        }
        return edit.build();
    }

    private String prompt(String text) {
        out.print(text);
        out.flush();
        String line = readLine();
        if (line == null) {
            throw new TriageCanceledException(null, "End of input");
        }
        return line;
    }

    @Nullable
    private String readLine() {
        try {
            return in.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read triage input", e);
        }
    }

    private static String abbreviate(String text) {
        String oneLine = text.replace('\n', ' ');
        return oneLine.length() > 60 ? oneLine.substring(0, 57) + "..." : oneLine;
    }
}
