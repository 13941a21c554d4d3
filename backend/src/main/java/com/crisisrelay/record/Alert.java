package com.crisisrelay.record;

/**
 * The counselor-facing alert attached to every record.
 * Content stays empty until the oracle answers a content-reveal request.
 */
public record Alert(String content, RevealState state) {

    private static final Alert EMPTY = new Alert("", RevealState.NOT_REVEALED);

    public Alert {
        content = content == null ? "" : content;
        if (state == null) {
            throw new IllegalArgumentException("Reveal state must not be null");
        }
    }

    public static Alert empty() {
        return EMPTY;
    }

    public boolean revealed() {
        return state == RevealState.REVEALED;
    }

    public Alert requested() {
        return new Alert("", RevealState.REVEAL_REQUESTED);
    }

    public Alert reveal(String revealedContent) {
        return new Alert(revealedContent, RevealState.REVEALED);
    }
}
