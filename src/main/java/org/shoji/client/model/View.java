package org.shoji.client.model;

import org.shoji.client.rest.Session;

import java.util.Map;

/**
 * A Shoji view: navigation links plus opaque content, with no index or body.
 */
public final class View extends Document {

    private View(Session session, Map<String, ?> members) {
        super(session, Element.VIEW, members);
    }

    public static View fromMembers(Session session, Map<String, ?> members) {
        return new View(session, members);
    }
}
