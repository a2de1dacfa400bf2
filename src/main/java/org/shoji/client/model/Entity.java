package org.shoji.client.model;

import org.shoji.client.exception.DocumentParseException;
import org.shoji.client.rest.Session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A Shoji entity: a single resource whose data lives in its "body".
 * <p>
 * Once the entity knows its "self" URL the body is an {@link AttributeTuple} bound to it, so
 * {@code getBodyTuple().get().fetch()} requests the entity again. A stub entity, not yet
 * created on the server, keeps a plain attribute map.
 * </p>
 */
public final class Entity extends Document {

    public static final String BODY = "body";

    private Entity(Session session, Map<String, ?> members) {
        super(session, Element.ENTITY, members);
        put(BODY, containsKey(BODY) ? get(BODY) : new LinkedHashMap<String, Object>());
    }

    /**
     * Builds an entity from decoded wire members; the body is bound to "self" when present.
     */
    public static Entity fromMembers(Session session, Map<String, ?> members) {
        return new Entity(session, members);
    }

    /**
     * @return An entity with no URL and an empty body, ready to be posted
     */
    public static Entity stub(Session session) {
        return stub(session, Map.of());
    }

    /**
     * @param body Attributes to post
     * @return An entity with no URL and the given body
     */
    public static Entity stub(Session session, Map<String, ?> body) {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put(ELEMENT, Element.ENTITY.getTag());
        members.put(BODY, body);
        return new Entity(session, members);
    }

    /**
     * @param selfUrl URL of the entity
     * @param body    Attributes of the entity
     * @return An entity whose body tuple is bound to {@code selfUrl}
     */
    public static Entity located(Session session, String selfUrl, Map<String, ?> body) {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put(ELEMENT, Element.ENTITY.getTag());
        members.put(SELF, selfUrl);
        members.put(BODY, body);
        return new Entity(session, members);
    }

    @Override
    public Object put(String key, Object value) {
        Object previous = super.put(key, value);
        if (SELF.equals(key)) {
            // rebind the body to the new URL
            super.put(BODY, getBody());
        }
        return previous;
    }

    @Override
    protected Object adopt(String key, Object value) {
        if (!BODY.equals(key)) {
            return value;
        }
        if (!(value instanceof Map)) {
            throw new DocumentParseException("Entity body must be a JSON object, got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
        }
        @SuppressWarnings("unchecked")
        Map<String, ?> attributes = (Map<String, ?>) value;
        String self = getSelf();
        return self != null
                ? new AttributeTuple(getSession(), self, attributes)
                : new LinkedHashMap<>(attributes);
    }

    public void setSelf(String url) {
        put(SELF, url);
    }

    /**
     * @return The body attributes; an {@link AttributeTuple} when the entity is located
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getBody() {
        return (Map<String, Object>) get(BODY);
    }

    /**
     * @return The body tuple bound to "self", or empty for a stub entity
     */
    public Optional<AttributeTuple> getBodyTuple() {
        Object body = get(BODY);
        return body instanceof AttributeTuple ? Optional.of((AttributeTuple) body) : Optional.empty();
    }
}
