package com.plotlab.game;

/** Answer to a hint request; {@link #isAvailable()} is false once the budget is spent. */
public final class HintResult {

    public static final String UNAVAILABLE_TEXT = "No hints available!";

    private static final HintResult UNAVAILABLE = new HintResult(false, UNAVAILABLE_TEXT);

    private final boolean available;
    private final String text;

    private HintResult(boolean available, String text) {
        this.available = available;
        this.text = text;
    }

    public static HintResult of(String text) {
        return new HintResult(true, text);
    }

    public static HintResult unavailable() {
        return UNAVAILABLE;
    }

    public boolean isAvailable() {
        return available;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return available ? text : "(unavailable)";
    }
}
