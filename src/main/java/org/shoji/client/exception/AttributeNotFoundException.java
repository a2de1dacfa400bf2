package org.shoji.client.exception;

/**
 * Thrown when a key is neither a member of a document nor linked from any of its
 * navigation collections.
 */
public class AttributeNotFoundException extends ShojiException {

    private final String element;
    private final String key;

    /**
     * @param element Name of the document variant the lookup ran against (e.g. "Catalog").
     * @param key     The key that could not be resolved.
     */
    public AttributeNotFoundException(String element, String key) {
        super(element + " has no attribute " + key);
        this.element = element;
        this.key = key;
    }

    public String getElement() {
        return element;
    }

    public String getKey() {
        return key;
    }
}
