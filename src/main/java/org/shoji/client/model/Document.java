package org.shoji.client.model;

import com.google.common.net.HttpHeaders;
import com.google.common.net.MediaType;
import net.minidev.json.JSONValue;
import org.shoji.client.exception.AttributeNotFoundException;
import org.shoji.client.rest.RequestOptions;
import org.shoji.client.rest.Response;
import org.shoji.client.rest.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A Shoji document: one hypermedia resource as an ordered JSON object.
 *
 * <p>Besides its own members a document carries <i>navigation collections</i>, members whose
 * value maps short names to URLs. {@link #lookup(String)} answers from the members first and
 * then follows those links, so a lookup may block on a GET.</p>
 *
 * <p>The set of variants is closed: {@link Catalog}, {@link Entity} and {@link View}.</p>
 *
 * <p><b>Example usage:</b></p>
 * <pre>{@code
 * Catalog datasets = (Catalog) session.get(rootUrl).getPayload();
 * Object self = datasets.resolve("self");        // member, no request
 * Object user = datasets.resolve("user");        // "views" link, one GET
 * }</pre>
 */
public abstract class Document {

    private static final Logger logger = LoggerFactory.getLogger(Document.class);

    public static final String ELEMENT = "element";
    public static final String SELF = "self";

    static final String JSON_CONTENT_TYPE = MediaType.JSON_UTF_8.withoutParameters().toString();

    private final Session session;
    private final Element element;
    private final Map<String, Object> members;

    Document(Session session, Element element, Map<String, ?> members) {
        this.session = Objects.requireNonNull(session, "session");
        this.element = element;
        this.members = new LinkedHashMap<>(members);
        this.members.putIfAbsent(ELEMENT, element.getTag());
    }

    public Session getSession() {
        return session;
    }

    public Element getElement() {
        return element;
    }

    /**
     * @return Navigation collection names of this variant, in lookup order
     */
    public List<String> getNavigationCollections() {
        return element.getNavigationCollections();
    }

    /**
     * @return The "self" URL, or null if this document has not been located yet
     */
    public String getSelf() {
        return Objects.toString(members.get(SELF), null);
    }

    public Object get(String key) {
        return members.get(key);
    }

    public boolean containsKey(String key) {
        return members.containsKey(key);
    }

    /**
     * Sets a member. Variants normalize their protocol members here, e.g. a catalog's "index"
     * is rewrapped into tuples.
     *
     * @param key   Member name
     * @param value New value
     * @return Previous value, or null
     */
    public Object put(String key, Object value) {
        return members.put(key, adopt(key, value));
    }

    /**
     * Converts a raw member value into the form this variant stores.
     */
    protected Object adopt(String key, Object value) {
        return value;
    }

    /**
     * @return Read-only view of all members, in wire order
     */
    public Map<String, Object> getMembers() {
        return Collections.unmodifiableMap(members);
    }

    /**
     * Returns a navigation collection by name.
     *
     * @param name Collection name (e.g., "views")
     * @return The collection, or an empty map if absent or not a JSON object
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getNavigationCollection(String name) {
        Object collection = members.get(name);
        if (collection instanceof Map) {
            return Collections.unmodifiableMap((Map<String, Object>) collection);
        }
        return Collections.emptyMap();
    }

    /**
     * Looks a key up, first among the members and then in each navigation collection of this
     * variant in declaration order. The first collection that links the key is fetched with
     * one GET and no further collections are consulted. Link values that are not strings,
     * such as {@code null}, are skipped.
     *
     * <p><b>Blocking:</b> a key that is not a member may trigger a network request.</p>
     *
     * @param key Member or link name
     * @return LOCAL, REMOTE or NOT_FOUND resolution
     */
    public Resolution lookup(String key) {
        if (members.containsKey(key)) {
            return Resolution.local(members.get(key));
        }

        for (String collectionName : getNavigationCollections()) {
            Object link = getNavigationCollection(collectionName).get(key);
            if (link instanceof String) {
                String url = (String) link;
                logger.debug("Resolving {}.{} through \"{}\": GET {}",
                        getClass().getSimpleName(), key, collectionName, url);
                return Resolution.remote(url, session.get(url).getPayload());
            }
        }

        return Resolution.notFound();
    }

    /**
     * Like {@link #lookup(String)}, but returns the value directly.
     *
     * @param key Member or link name
     * @return Member value or fetched payload
     * @throws AttributeNotFoundException if the key is neither a member nor linked
     */
    public Object resolve(String key) {
        Resolution resolution = lookup(key);
        if (!resolution.isFound()) {
            throw new AttributeNotFoundException(getClass().getSimpleName(), key);
        }
        return resolution.getValue();
    }

    public Response post(String body) {
        return post(RequestOptions.withBody(body));
    }

    /**
     * POSTs to this document's "self" URL. A Content-Type of application/json is sent unless
     * the options already name one; the body is passed through as given.
     *
     * @param options Body, headers and query parameters; not modified
     * @return Transport response
     */
    public Response post(RequestOptions options) {
        return session.post(requireSelf(), withDefaultContentType(options));
    }

    public Response patch(String body) {
        return patch(RequestOptions.withBody(body));
    }

    /**
     * PATCHes this document's "self" URL, with the same header defaults as
     * {@link #post(RequestOptions)}.
     *
     * @param options Body, headers and query parameters; not modified
     * @return Transport response
     */
    public Response patch(RequestOptions options) {
        return session.patch(requireSelf(), withDefaultContentType(options));
    }

    /**
     * @return The members serialized as a JSON object
     */
    public String toJson() {
        return JSONValue.toJSONString(members);
    }

    private static RequestOptions withDefaultContentType(RequestOptions options) {
        return options.copy().headerIfAbsent(HttpHeaders.CONTENT_TYPE, JSON_CONTENT_TYPE);
    }

    private String requireSelf() {
        String self = getSelf();
        if (self == null) {
            throw new IllegalStateException(getClass().getSimpleName() + " has no \"self\" URL");
        }
        return self;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + element.getTag() + ", self=" + getSelf() + "}";
    }
}
