package com.questrail.coedit.protocol.internal.state;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * SessionIntents
 * -----------------------------------------------------------------------------
 * Immutable, ordered collection of {@link SessionIntent}s emitted by the
 * {@link SessionReducer}.
 *
 * <h2>Role in the architecture</h2>
 * {@code SessionIntents} is the bridge between:
 * <ul>
 *   <li>pure, deterministic state transition logic</li>
 *   <li>impure, side-effecting execution (sockets, editor, user prompts)</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * Order is significant and preserved: a {@code SEND_MESSAGE} followed by a
 * {@code NOTIFY} means the peer is told before the user is.
 */
public final class SessionIntents
{
    private static final SessionIntents NONE = new SessionIntents(List.of());

    private final List<SessionIntent> intents;

    private SessionIntents(List<SessionIntent> intents) {
        this.intents = Collections.unmodifiableList(new ArrayList<>(intents));
    }

    /**
     * Returns the intents in execution order.
     */
    public List<SessionIntent> all() {
        return intents;
    }

    /**
     * Returns the set of intent kinds represented.
     */
    public Set<SessionIntent.Kind> kinds() {
        EnumSet<SessionIntent.Kind> kinds = EnumSet.noneOf(SessionIntent.Kind.class);
        for (SessionIntent intent : intents) {
            kinds.add(intent.kind());
        }
        return Collections.unmodifiableSet(kinds);
    }

    public boolean isEmpty() {
        return intents.isEmpty();
    }

    public boolean contains(SessionIntent.Kind kind) {
        for (SessionIntent intent : intents) {
            if (intent.kind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every intent of the given type, in order.
     */
    public <T extends SessionIntent> List<T> ofType(Class<T> type) {
        List<T> matching = new ArrayList<>();
        for (SessionIntent intent : intents) {
            if (type.isInstance(intent)) {
                matching.add(type.cast(intent));
            }
        }
        return matching;
    }

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    public static SessionIntents none() {
        return NONE;
    }

    public static SessionIntents of(SessionIntent... intents) {
        return intents.length == 0 ? NONE : new SessionIntents(List.of(intents));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<SessionIntent> intents = new ArrayList<>();

        private Builder() {}

        public Builder add(SessionIntent intent) {
            intents.add(Objects.requireNonNull(intent, "intent"));
            return this;
        }

        public SessionIntents build() {
            return intents.isEmpty() ? NONE : new SessionIntents(intents);
        }
    }

    @Override
    public String toString() {
        return "SessionIntents" + intents;
    }
}
