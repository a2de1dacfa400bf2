package org.shoji.client.model;

import org.shoji.client.exception.DocumentParseException;
import org.shoji.client.rest.RequestOptions;
import org.shoji.client.rest.Response;
import org.shoji.client.rest.Session;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An ordered bag of attributes describing one resource.
 * <p>
 * Catalogs map each member URL to a tuple in their "index"; a located entity keeps its "body"
 * as a tuple bound to its own "self" URL. The bound URL is held apart from the attributes, so
 * {@code entityUrl} never shows up as a key. {@link #fetch()} requests the full resource.
 * </p>
 *
 * <p>Reads follow {@link Map} semantics: {@link #containsKey(Object)} tells an absent key from a
 * key holding {@code null}. So do {@code equals} and {@code hashCode}: two tuples with the same
 * attributes are equal even when bound to different URLs. Compare {@link #getEntityUrl()}
 * separately when the resource matters.</p>
 */
public class AttributeTuple extends LinkedHashMap<String, Object> {

    private static final long serialVersionUID = 1L;

    private final transient Session session;
    private final String entityUrl;

    /**
     * @param session   Session used to fetch the resource; held, not owned
     * @param entityUrl URL of the resource these attributes describe
     * @param members   Attribute values, copied in iteration order
     */
    public AttributeTuple(Session session, String entityUrl, Map<String, ?> members) {
        super(members);
        this.session = Objects.requireNonNull(session, "session");
        this.entityUrl = Objects.requireNonNull(entityUrl, "entityUrl");
    }

    public AttributeTuple(Session session, String entityUrl) {
        this(session, entityUrl, Map.of());
    }

    public Session getSession() {
        return session;
    }

    public String getEntityUrl() {
        return entityUrl;
    }

    /**
     * Returns a shallow copy bound to the same session and URL. Adding or removing attributes
     * on the copy leaves this tuple untouched; nested values are shared.
     *
     * @return Independent copy of this tuple
     */
    public AttributeTuple copy() {
        return new AttributeTuple(session, entityUrl, this);
    }

    public Object fetch() {
        return fetch(RequestOptions.none());
    }

    /**
     * GETs {@link #getEntityUrl()} and returns the parsed payload, usually the complete
     * {@link Entity}. Blocks until the response arrives.
     *
     * @param options Extra headers or query parameters
     * @return Parsed payload
     * @throws DocumentParseException if the response could not be parsed
     */
    public Object fetch(RequestOptions options) {
        Response response = session.get(entityUrl, options);
        if (!response.isParsed()) {
            throw new DocumentParseException(
                    "Response from " + entityUrl + " could not be parsed", response.getStatus());
        }
        return response.getPayload();
    }
}
