package org.shoji.client.model;

import com.google.common.collect.ImmutableList;

import java.util.Optional;

/**
 * Wire tags of the Shoji document variants.
 * <p>
 * Each tag carries the navigation collections its variant recognizes, in the order in which
 * {@link Document#lookup(String)} consults them.
 * </p>
 *
 * <table>
 *   <caption>Variants</caption>
 *   <tr><th>Tag</th><th>Navigation collections</th></tr>
 *   <tr><td>shoji:catalog</td><td>catalogs, views, urls</td></tr>
 *   <tr><td>shoji:entity</td><td>catalogs, fragments, views, urls</td></tr>
 *   <tr><td>shoji:view</td><td>views, urls</td></tr>
 * </table>
 */
public enum Element {

    CATALOG("shoji:catalog", ImmutableList.of("catalogs", "views", "urls")),
    ENTITY("shoji:entity", ImmutableList.of("catalogs", "fragments", "views", "urls")),
    VIEW("shoji:view", ImmutableList.of("views", "urls"));

    private final String tag;
    private final ImmutableList<String> navigationCollections;

    Element(String tag, ImmutableList<String> navigationCollections) {
        this.tag = tag;
        this.navigationCollections = navigationCollections;
    }

    public String getTag() {
        return tag;
    }

    public ImmutableList<String> getNavigationCollections() {
        return navigationCollections;
    }

    /**
     * Finds the variant for a wire tag.
     *
     * @param tag Value of a document's "element" member
     * @return Matching variant, or empty for unknown tags
     */
    public static Optional<Element> fromTag(Object tag) {
        for (Element element : values()) {
            if (element.tag.equals(tag)) {
                return Optional.of(element);
            }
        }
        return Optional.empty();
    }
}
