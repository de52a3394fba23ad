package de.bsommerfeld.slideshow.core.exception;

public class DraftNotFoundException extends SlideshowException {

    private final String draftId;

    public DraftNotFoundException(String draftId) {
        super("Draft not found: " + draftId);
        this.draftId = draftId;
    }

    public String getDraftId() {
        return draftId;
    }
}
