package uz.legalclinic.bot.session;

public enum SessionState {
    // requester
    SELECTING_CATEGORY(Flow.REQUEST),
    ENTERING_REQUEST(Flow.REQUEST),
    CONFIRMING_REQUEST(Flow.REQUEST),

    // fulfiller, only while an assignment is held
    WRITING_ANSWER(Flow.ANSWER),
    CONFIRMING_ANSWER(Flow.ANSWER),

    // reviewer, waiting for the free-text part of an action
    ENTERING_DECLINE_REASON(Flow.REVIEW),
    ENTERING_ANSWER_COMMENT(Flow.REVIEW),
    ENTERING_CATEGORY_NAME(Flow.REVIEW),
    ENTERING_CATEGORY_TAG(Flow.REVIEW),
    ENTERING_NEW_CATEGORY_NAME(Flow.REVIEW);

    private final Flow flow;

    SessionState(Flow flow) {
        this.flow = flow;
    }

    public Flow flow() {
        return flow;
    }
}
