package org.shoji.client.model;

import com.google.common.net.HttpHeaders;
import net.minidev.json.JSONValue;
import org.shoji.client.exception.DocumentParseException;
import org.shoji.client.exception.KeyTypeException;
import org.shoji.client.exception.TransportException;
import org.shoji.client.rest.Response;
import org.shoji.client.rest.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A Shoji catalog: a collection of resources addressed by URL.
 *
 * <p>The "index" member maps each resource URL to an {@link AttributeTuple} holding the
 * catalog's attributes for it, so the members can be listed without fetching each one.</p>
 */
public final class Catalog extends Document {

    private static final Logger logger = LoggerFactory.getLogger(Catalog.class);

    public static final String INDEX = "index";

    private Map<String, AttributeTuple> index = Collections.emptyMap();

    private Catalog(Session session, Map<String, ?> members) {
        super(session, Element.CATALOG, members);
        if (containsKey(INDEX)) {
            put(INDEX, get(INDEX));
        }
    }

    /**
     * Builds a catalog from decoded wire members; index entries become tuples bound to
     * their URLs and to {@code session}.
     *
     * @param session Session shared with every tuple
     * @param members Decoded JSON members
     * @return New catalog
     */
    public static Catalog fromMembers(Session session, Map<String, ?> members) {
        return new Catalog(session, members);
    }

    /**
     * Builds a catalog at a known URL from an index of raw attribute maps.
     *
     * @param session Session shared with every tuple
     * @param selfUrl URL of the catalog
     * @param index   Resource URL to attributes
     * @return New catalog
     */
    public static Catalog located(Session session, String selfUrl, Map<String, ? extends Map<String, ?>> index) {
        Map<String, Object> members = new LinkedHashMap<>();
        members.put(ELEMENT, Element.CATALOG.getTag());
        members.put(SELF, selfUrl);
        members.put(INDEX, index);
        return new Catalog(session, members);
    }

    @Override
    protected Object adopt(String key, Object value) {
        if (INDEX.equals(key)) {
            index = buildIndex(value);
            return Collections.unmodifiableMap(index);
        }
        return value;
    }

    private Map<String, AttributeTuple> buildIndex(Object raw) {
        if (!(raw instanceof Map)) {
            throw new DocumentParseException("Catalog index must be a JSON object, got " + typeName(raw));
        }
        Map<String, AttributeTuple> tuples = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
            String entityUrl = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map)) {
                throw new DocumentParseException(
                        "Index entry " + entityUrl + " must be a JSON object, got " + typeName(entry.getValue()));
            }
            @SuppressWarnings("unchecked")
            Map<String, ?> attributes = (Map<String, ?>) entry.getValue();
            tuples.put(entityUrl, new AttributeTuple(getSession(), entityUrl, attributes));
        }
        return tuples;
    }

    /**
     * @return Read-only view of the index, resource URL to tuple
     */
    public Map<String, AttributeTuple> getIndex() {
        return Collections.unmodifiableMap(index);
    }

    /**
     * @param entityUrl Resource URL
     * @return The tuple for that URL, or null if it is not in the index
     */
    public AttributeTuple getTuple(String entityUrl) {
        return index.get(entityUrl);
    }

    /**
     * Regroups the index by the value of one attribute.
     *
     * <p>Tuples without the attribute are left out. When several tuples share a value only one
     * of them is kept; which one is not defined. The attribute stays in the returned tuples,
     * which are copies.</p>
     *
     * @param attr Attribute to key by
     * @return Attribute value to tuple
     * @throws KeyTypeException if a value is a JSON object or array
     */
    public Map<Object, AttributeTuple> by(String attr) {
        Map<Object, AttributeTuple> grouped = new LinkedHashMap<>();
        for (AttributeTuple tuple : index.values()) {
            if (!tuple.containsKey(attr)) {
                continue;
            }
            Object value = tuple.get(attr);
            if (value instanceof Map || value instanceof List) {
                throw new KeyTypeException(attr, value.getClass());
            }
            grouped.put(value, tuple.copy());
        }
        return grouped;
    }

    public Object create() {
        return create(null, null);
    }

    public Object create(Entity entity) {
        return create(entity, null);
    }

    /**
     * POSTs an entity to this catalog to create a new resource.
     *
     * <p>If {@code refresh} is true the new resource is fetched with an extra GET and its parsed
     * payload is returned: usually a {@link Document}, but a plain map or list when the body has
     * no Shoji element tag. If false, no GET is made: the posted entity gets its "self" set to
     * the new URL and is returned. If null, it is true exactly when no entity was given.</p>
     *
     * @param entity  Entity to post, or null to post an empty one
     * @param refresh Whether to fetch the created resource, or null for the default
     * @return The fetched payload, or the posted entity
     * @throws TransportException     if the response has no Location header
     * @throws DocumentParseException if the refreshed resource could not be parsed
     */
    public Object create(Entity entity, Boolean refresh) {
        boolean fetchCreated = refresh != null ? refresh : entity == null;
        Entity posted = entity != null ? entity : Entity.stub(getSession());

        Response response = post(posted.toJson());
        String newUrl = response.getHeader(HttpHeaders.LOCATION);
        if (newUrl == null) {
            throw new TransportException(
                    "POST " + getSelf() + " returned no " + HttpHeaders.LOCATION + " header", response.getStatus());
        }
        logger.debug("Created {} in {}", newUrl, getSelf());

        if (fetchCreated) {
            Response created = getSession().get(newUrl);
            if (!created.isParsed()) {
                throw new DocumentParseException(
                        "Response from " + newUrl + " could not be parsed", created.getStatus());
            }
            return created.getPayload();
        }

        posted.setSelf(newUrl);
        return posted;
    }

    public Object add(String entityUrl) {
        return add(entityUrl, null);
    }

    /**
     * Adds one resource to this catalog, or updates its catalog attributes, with a PATCH of
     * {@code {entityUrl: attrs}}.
     *
     * @param entityUrl URL of the resource
     * @param attrs     Catalog attributes for it; null sends an empty object
     * @return Payload of the PATCH response
     */
    public Object add(String entityUrl, Map<String, ?> attrs) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(entityUrl, attrs != null ? attrs : new LinkedHashMap<String, Object>());
        return patch(JSONValue.toJSONString(entry)).getPayload();
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
