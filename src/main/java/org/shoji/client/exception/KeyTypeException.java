package org.shoji.client.exception;

/**
 * Thrown when a catalog is regrouped by an attribute whose value cannot serve as a map key,
 * i.e. a JSON object or array.
 */
public class KeyTypeException extends ShojiException {

    private final String attribute;
    private final Class<?> valueType;

    public KeyTypeException(String attribute, Class<?> valueType) {
        super("Attribute '" + attribute + "' has a composite value of type "
                + valueType.getSimpleName() + " and cannot be used as a key");
        this.attribute = attribute;
        this.valueType = valueType;
    }

    public String getAttribute() {
        return attribute;
    }

    public Class<?> getValueType() {
        return valueType;
    }
}
