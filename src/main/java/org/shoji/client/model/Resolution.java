package org.shoji.client.model;

import lombok.Getter;

/**
 * Outcome of {@link Document#lookup(String)}: a local member, a payload fetched through a
 * navigation link, or nothing.
 */
@Getter
public final class Resolution {

    public enum Kind {
        /** The key is a member of the document. */
        LOCAL,
        /** The key was found in a navigation collection and its URL was fetched. */
        REMOTE,
        /** Neither a member nor a navigation link. */
        NOT_FOUND
    }

    private static final Resolution NOT_FOUND = new Resolution(Kind.NOT_FOUND, null, null);

    private final Kind kind;
    private final Object value;
    /** URL that was fetched; only set for {@link Kind#REMOTE}. */
    private final String url;

    private Resolution(Kind kind, Object value, String url) {
        this.kind = kind;
        this.value = value;
        this.url = url;
    }

    static Resolution local(Object value) {
        return new Resolution(Kind.LOCAL, value, null);
    }

    static Resolution remote(String url, Object payload) {
        return new Resolution(Kind.REMOTE, payload, url);
    }

    static Resolution notFound() {
        return NOT_FOUND;
    }

    public boolean isFound() {
        return kind != Kind.NOT_FOUND;
    }

    @Override
    public String toString() {
        return kind == Kind.REMOTE ? "REMOTE(" + url + ")" : kind.name();
    }
}
