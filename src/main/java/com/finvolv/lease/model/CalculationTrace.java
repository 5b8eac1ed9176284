package com.finvolv.lease.model;

import org.slf4j.helpers.MessageFormatter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Human-readable record of how figures were derived. Passed explicitly into each
 * computation; {@link #disabled()} discards everything.
 */
public class CalculationTrace {

    private static final CalculationTrace DISABLED = new CalculationTrace(false);

    private final boolean enabled;
    private final List<String> lines = new ArrayList<>();

    private CalculationTrace(boolean enabled) {
        this.enabled = enabled;
    }

    public static CalculationTrace enabled() {
        return new CalculationTrace(true);
    }

    public static CalculationTrace disabled() {
        return DISABLED;
    }

    public static CalculationTrace orDisabled(CalculationTrace trace) {
        return trace == null ? DISABLED : trace;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Appends a line; placeholders use SLF4J {} syntax.
     */
    public void record(String pattern, Object... args) {
        if (!enabled) {
            return;
        }
        synchronized (lines) {
            lines.add(MessageFormatter.arrayFormat(pattern, args).getMessage());
        }
    }

    public void section(String title) {
        record("");
        record("[{}]", title);
    }

    public List<String> getLines() {
        synchronized (lines) {
            return Collections.unmodifiableList(new ArrayList<>(lines));
        }
    }

    public String toText() {
        return String.join(System.lineSeparator(), getLines());
    }
}
