package io.mockdispatch.core.error;

/** Thrown when a resource exists but holds no record with the requested id. */
public final class ItemNotFoundException extends MockDispatchException {

    private static final long serialVersionUID = 1L;

    private final String resourceName;
    private final String itemId;

    public ItemNotFoundException(String resourceName, String itemId) {
        super("Item not found: " + resourceName + "/" + itemId);
        this.resourceName = resourceName;
        this.itemId = itemId;
    }

    public String resourceName() {
        return resourceName;
    }

    public String itemId() {
        return itemId;
    }
}
