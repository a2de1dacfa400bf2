package org.shoji.client.model;

import org.shoji.client.rest.Session;

import java.util.Map;
import java.util.Optional;

/**
 * Turns decoded JSON payloads into documents.
 */
public final class Documents {

    private Documents() {
    }

    /**
     * Wraps a decoded JSON value: an object whose "element" is a Shoji tag becomes the matching
     * {@link Document} variant bound to {@code session}; anything else is returned unchanged.
     *
     * @param session Session the document will use for further requests
     * @param decoded Decoded JSON value (map, list or scalar)
     * @return A document, or {@code decoded} itself
     */
    public static Object wrap(Session session, Object decoded) {
        if (!(decoded instanceof Map)) {
            return decoded;
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> members = (Map<String, ?>) decoded;
        Optional<Element> element = Element.fromTag(members.get(Document.ELEMENT));
        if (element.isEmpty()) {
            return decoded;
        }
        switch (element.get()) {
            case CATALOG:
                return Catalog.fromMembers(session, members);
            case ENTITY:
                return Entity.fromMembers(session, members);
            case VIEW:
                return View.fromMembers(session, members);
            default:
                throw new IllegalStateException("Unhandled element " + element.get());
        }
    }
}
