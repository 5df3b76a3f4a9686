package uz.legalclinic.bot.session;

import uz.legalclinic.bot.notify.MessageRef;

import java.util.Objects;

/**
 * Immutable conversation step of one actor. Payload fields are null unless the state uses them:
 * <ul>
 *     <li>{@code categoryId}: chosen category (request flow) or category being renamed</li>
 *     <li>{@code draftText}: request text, answer text or a new category name</li>
 *     <li>{@code requestId}: request the actor is answering or reviewing</li>
 *     <li>{@code origin}: broadcast message a reviewer pressed the action on</li>
 * </ul>
 * Value equality is what {@link SessionStore#compareAndSet} compares.
 */
public final class Session {

    private final SessionState state;
    private final Long categoryId;
    private final String draftText;
    private final Long requestId;
    private final MessageRef origin;

    private Session(SessionState state, Long categoryId, String draftText, Long requestId, MessageRef origin) {
        this.state = Objects.requireNonNull(state, "state");
        this.categoryId = categoryId;
        this.draftText = draftText;
        this.requestId = requestId;
        this.origin = origin;
    }

    public static Session of(SessionState state) {
        return new Session(state, null, null, null, null);
    }

    public static Session forRequest(SessionState state, long requestId) {
        return new Session(state, null, null, requestId, null);
    }

    public SessionState state() { return state; }
    public Flow flow() { return state.flow(); }
    public Long categoryId() { return categoryId; }
    public String draftText() { return draftText; }
    public Long requestId() { return requestId; }
    public MessageRef origin() { return origin; }

    public Session withState(SessionState next) {
        return new Session(next, categoryId, draftText, requestId, origin);
    }

    public Session withCategory(Long id) {
        return new Session(state, id, draftText, requestId, origin);
    }

    public Session withDraft(String text) {
        return new Session(state, categoryId, text, requestId, origin);
    }

    public Session withOrigin(MessageRef ref) {
        return new Session(state, categoryId, draftText, requestId, ref);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Session)) return false;
        Session s = (Session) o;
        return state == s.state
                && Objects.equals(categoryId, s.categoryId)
                && Objects.equals(draftText, s.draftText)
                && Objects.equals(requestId, s.requestId)
                && Objects.equals(origin, s.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, categoryId, draftText, requestId, origin);
    }

    @Override
    public String toString() {
        return "Session{" + state +
                (categoryId != null ? ", category=" + categoryId : "") +
                (requestId != null ? ", request=" + requestId : "") +
                (draftText != null ? ", draft=" + draftText.length() + " chars" : "") +
                (origin != null ? ", origin=" + origin : "") +
                "}";
    }
}
