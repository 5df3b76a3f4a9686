package uz.legalclinic.bot.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.notify.Destination;
import uz.legalclinic.bot.notify.MessageRef;
import uz.legalclinic.bot.service.AssignmentCoordinator;
import uz.legalclinic.bot.service.CategoryService;
import uz.legalclinic.bot.service.ConflictException;
import uz.legalclinic.bot.service.RequestService;
import uz.legalclinic.bot.service.StoreException;
import uz.legalclinic.bot.session.Flow;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;
import uz.legalclinic.bot.session.SessionStore;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.CLEARED;
import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.SET;

/**
 * idle, WRITING_ANSWER, CONFIRMING_ANSWER, idle. Entered by a successful take.
 */
public final class FulfillerFlow {

    private static final Logger log = LoggerFactory.getLogger(FulfillerFlow.class);

    private final AssignmentCoordinator coordinator;
    private final RequestService requests;
    private final CategoryService categories;
    private final SessionStore sessions;
    private final Replies replies;

    FulfillerFlow(AssignmentCoordinator coordinator, RequestService requests, CategoryService categories,
                  SessionStore sessions, Replies replies) {
        this.coordinator = coordinator;
        this.requests = requests;
        this.categories = categories;
        this.sessions = sessions;
        this.replies = replies;
    }

    ConversationOutcome take(Actor actor, long requestId, MessageRef origin) {
        AssignmentCoordinator.Taken taken;
        try {
            taken = coordinator.takeRequest(requestId, actor.tgId);
        } catch (ConflictException e) {
            // a repeated tap by the winner leaves the answer session alone
            if (!holds(actor, requestId)) throw e;
            log.debug("repeated_take requestId={} actor={}", requestId, actor.tgId);
            return ConversationOutcome.conflict(ConflictException.Reason.ALREADY_HANDLED.key())
                    .notice(replies.t(actor, "notices.already_yours"))
                    .build();
        }
        sessions.set(actor.tgId, Session.forRequest(SessionState.WRITING_ANSWER, requestId));

        Map<String, Object> card = Replies.card(taken.request, categoryLabel(taken.request));
        card.put("fulfiller", Replies.name(actor));
        return ConversationOutcome.ok()
                .edit(origin, replies.broadcast("cards.taken", card), List.of())
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.assignment_taken", card),
                        List.of(), replies.options(actor, ActionName.REJECT_ASSIGNMENT, ActionName.BACK))
                .notice(replies.t(actor, "notices.taken"))
                .session(SET)
                .build();
    }

    ConversationOutcome onText(Actor actor, Session session, String text) {
        return switch (session.state()) {
            case WRITING_ANSWER -> writeAnswer(actor, session, text);
            case CONFIRMING_ANSWER,
                    SELECTING_CATEGORY, ENTERING_REQUEST, CONFIRMING_REQUEST,
                    ENTERING_DECLINE_REASON, ENTERING_ANSWER_COMMENT,
                    ENTERING_CATEGORY_NAME, ENTERING_CATEGORY_TAG, ENTERING_NEW_CATEGORY_NAME -> ConversationOutcome.unhandled();
        };
    }

    ConversationOutcome confirmAnswer(Actor actor, Set<Capability> caps, Session session) {
        if (session == null || session.flow() != Flow.ANSWER) {
            if (actor.currentAssignmentId == null) {
                throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT, "Nothing to confirm");
            }
            return answerMissing(actor);
        }
        if (session.state() == SessionState.WRITING_ANSWER) return answerMissing(actor);

        Request r = held(actor, session);
        if (!sessions.compareAndSet(actor.tgId, session, null)) return duplicate(actor);
        try {
            requests.submitAnswer(r.id, actor.tgId, session.draftText());
        } catch (StoreException e) {
            sessions.compareAndSet(actor.tgId, null, session);
            throw e;
        }
        log.info("answer_submitted requestId={} fulfillerId={}", r.id, actor.tgId);

        r.answerText = session.draftText();
        Map<String, Object> card = Replies.card(r, categoryLabel(r));
        card.put("fulfiller", Replies.name(actor));
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "success.answer_sent", card),
                        List.of(), replies.menu(actor, caps))
                .send(Destination.reviewers(), replies.broadcast("cards.answer", card),
                        List.of(replies.button(ActionName.APPROVE_ANSWER, r.id), replies.button(ActionName.DECLINE_ANSWER, r.id)),
                        List.of())
                .session(CLEARED)
                .build();
    }

    /**
     * Drops the draft. Without a session it resumes writing on the assignment the actor holds.
     */
    ConversationOutcome editAnswer(Actor actor, Session session) {
        long requestId;
        if (session != null && session.flow() == Flow.ANSWER) {
            requestId = session.requestId();
        } else if (actor.currentAssignmentId != null) {
            requestId = actor.currentAssignmentId;
        } else {
            throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT, "No assignment to edit");
        }

        Session next = Session.forRequest(SessionState.WRITING_ANSWER, requestId);
        Request r = held(actor, next);
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);
        return writePrompt(actor, r).session(SET).build();
    }

    ConversationOutcome rejectAssignment(Actor actor, Set<Capability> caps, Long targetId, Session session) {
        Long requestId = targetId;
        if (requestId == null) requestId = actor.currentAssignmentId;
        if (requestId == null && session != null && session.flow() == Flow.ANSWER) requestId = session.requestId();
        if (requestId == null) {
            throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT, "No assignment to reject");
        }

        Request r = coordinator.rejectAssignment(requestId, actor.tgId);
        sessions.clear(actor.tgId);
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "success.assignment_rejected", Map.of("id", r.id)),
                        List.of(), replies.menu(actor, caps))
                .send(Destination.fulfillers(), replies.broadcast("cards.offer", Replies.card(r, categoryLabel(r))),
                        List.of(replies.button(ActionName.TAKE, r.id)), List.of())
                .session(CLEARED)
                .build();
    }

    ConversationOutcome back(Actor actor, Set<Capability> caps, Session session) {
        Session next = switch (session.state()) {
            case CONFIRMING_ANSWER -> session.withState(SessionState.WRITING_ANSWER).withDraft(null);
            case WRITING_ANSWER,
                    SELECTING_CATEGORY, ENTERING_REQUEST, CONFIRMING_REQUEST,
                    ENTERING_DECLINE_REASON, ENTERING_ANSWER_COMMENT,
                    ENTERING_CATEGORY_NAME, ENTERING_CATEGORY_TAG, ENTERING_NEW_CATEGORY_NAME -> null;
        };
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);
        if (next == null) {
            // the assignment stays; EDIT_ANSWER or CURRENT_ASSIGNMENT pick it up again
            return ConversationOutcome.ok()
                    .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.assignment_kept"),
                            List.of(), replies.menu(actor, caps))
                    .session(CLEARED)
                    .build();
        }
        return writePrompt(actor, held(actor, next)).session(SET).build();
    }

    private ConversationOutcome writeAnswer(Actor actor, Session session, String text) {
        Request r = held(actor, session);
        String clean = text == null ? "" : text.trim();
        if (clean.isEmpty()) {
            return ConversationOutcome.rejected("empty_answer")
                    .send(Destination.actor(actor.tgId), replies.error(actor, "empty_answer"))
                    .build();
        }
        Session next = session.withState(SessionState.CONFIRMING_ANSWER).withDraft(clean);
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);

        r.answerText = clean;
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.check_answer", Replies.card(r, categoryLabel(r))),
                        List.of(), replies.options(actor, ActionName.CONFIRM_ANSWER, ActionName.EDIT_ANSWER,
                                ActionName.REJECT_ASSIGNMENT, ActionName.BACK))
                .session(SET)
                .build();
    }

    /**
     * The request the session is answering, provided the actor still holds it.
     */
    private Request held(Actor actor, Session session) {
        Optional<Request> r = requests.findById(session.requestId());
        if (r.isEmpty()) throw new StaleSessionException(session, "request " + session.requestId() + " is gone");
        Request req = r.get();
        if (req.status != RequestStatus.ASSIGNED || req.fulfillerId == null || req.fulfillerId != actor.tgId) {
            throw new StaleSessionException(session, "request " + req.id + " is " + req.status + " held by " + req.fulfillerId);
        }
        return req;
    }

    private boolean holds(Actor actor, long requestId) {
        return requests.findById(requestId)
                .filter(r -> r.status == RequestStatus.ASSIGNED && r.fulfillerId != null && r.fulfillerId == actor.tgId)
                .isPresent();
    }

    private ConversationOutcome.Builder writePrompt(Actor actor, Request r) {
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.write_answer", Replies.card(r, categoryLabel(r))),
                        List.of(), replies.options(actor, ActionName.REJECT_ASSIGNMENT, ActionName.BACK));
    }

    private ConversationOutcome answerMissing(Actor actor) {
        return ConversationOutcome.rejected("answer_missing")
                .send(Destination.actor(actor.tgId), replies.error(actor, "answer_missing"))
                .build();
    }

    private ConversationOutcome duplicate(Actor actor) {
        log.debug("duplicate_delivery actor={}", actor.tgId);
        return ConversationOutcome.conflict("duplicate").notice(replies.error(actor, "duplicate")).build();
    }

    private String categoryLabel(Request r) {
        return categories.findById(r.categoryId).map(Category::label).orElse("?");
    }
}
