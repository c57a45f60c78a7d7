package uk.gegc.assessment.shared.exception;

/**
 * Exception thrown when an item id is referenced that is not part of the session's calibrated pool.
 */
public class UnknownItemException extends RuntimeException {

    private final String itemId;

    public UnknownItemException(String itemId) {
        super("Item " + itemId + " is not part of this session's item pool");
        this.itemId = itemId;
    }

    public String getItemId() {
        return itemId;
    }
}
