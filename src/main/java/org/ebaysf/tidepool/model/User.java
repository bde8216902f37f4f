package org.ebaysf.tidepool.model;

import com.google.common.base.Objects;

/**
 * The user on whose behalf local writes are queued. A null uid is the unauthenticated user.
 */
public final class User {

    public static final User UNAUTHENTICATED = new User(null);

    private static final String ANONYMOUS_KEY = "anonymous-user";

    private final String _uid;

    public User(final String uid) {

        _uid = uid;
    }

    public String getUid() {
        return _uid;
    }

    public boolean isAuthenticated() {
        return _uid != null;
    }

    /**
     * @return key under which this user's mutation queue is kept
     */
    public String toKey() {

        return isAuthenticated() ? _uid : ANONYMOUS_KEY;
    }

    public @Override boolean equals(final Object other) {

        return other instanceof User && Objects.equal(_uid, ((User) other)._uid);
    }

    public @Override int hashCode() {

        return Objects.hashCode(_uid);
    }

    public @Override String toString() {

        return toKey();
    }
}
