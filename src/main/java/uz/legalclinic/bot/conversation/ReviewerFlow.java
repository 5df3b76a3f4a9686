package uz.legalclinic.bot.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.notify.Destination;
import uz.legalclinic.bot.notify.MessageRef;
import uz.legalclinic.bot.service.ActorService;
import uz.legalclinic.bot.service.AssignmentCoordinator;
import uz.legalclinic.bot.service.CategoryService;
import uz.legalclinic.bot.service.ConflictException;
import uz.legalclinic.bot.service.NotFoundException;
import uz.legalclinic.bot.service.RequestService;
import uz.legalclinic.bot.service.StoreException;
import uz.legalclinic.bot.service.ValidationException;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;
import uz.legalclinic.bot.session.SessionStore;
import uz.legalclinic.bot.util.Html;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.CLEARED;
import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.SET;

/**
 * Reviewer decisions on requests and answers, plus category upkeep. Decisions that need a reason
 * or comment take two events: the inline action opens a session, the next text completes it.
 */
public final class ReviewerFlow {

    private static final Logger log = LoggerFactory.getLogger(ReviewerFlow.class);

    private final RequestService requests;
    private final CategoryService categories;
    private final ActorService actors;
    private final AssignmentCoordinator coordinator;
    private final SessionStore sessions;
    private final Replies replies;

    ReviewerFlow(RequestService requests, CategoryService categories, ActorService actors,
                 AssignmentCoordinator coordinator, SessionStore sessions, Replies replies) {
        this.requests = requests;
        this.categories = categories;
        this.actors = actors;
        this.coordinator = coordinator;
        this.sessions = sessions;
        this.replies = replies;
    }

    // --- requests ---

    ConversationOutcome approveRequest(Actor reviewer, long requestId, MessageRef origin) {
        requests.approve(requestId);
        log.info("request_approved requestId={} reviewerId={}", requestId, reviewer.tgId);

        Request r = requests.require(requestId);
        Map<String, Object> card = card(r);
        card.put("reviewer", Replies.name(reviewer));
        Optional<Actor> requester = actors.findById(r.requesterId);

        ConversationOutcome.Builder out = ConversationOutcome.ok()
                .edit(origin, replies.broadcast("cards.approved", card), List.of())
                .send(Destination.fulfillers(), replies.broadcast("cards.offer", card),
                        List.of(replies.button(ActionName.TAKE, r.id)), List.of())
                .notice(replies.t(reviewer, "notices.approved"));
        requester.ifPresent(a -> out.send(Destination.actor(a.tgId), replies.t(a, "notify.request_approved", card)));
        return out.build();
    }

    ConversationOutcome startDeclineRequest(Actor reviewer, long requestId, MessageRef origin) {
        expectStatus(requestId, RequestStatus.PENDING);
        sessions.set(reviewer.tgId, Session.forRequest(SessionState.ENTERING_DECLINE_REASON, requestId).withOrigin(origin));
        return ConversationOutcome.ok()
                .send(Destination.reviewers(), replies.broadcast("prompts.decline_reason",
                        Map.of("id", requestId, "reviewer", Replies.name(reviewer))))
                .notice(replies.t(reviewer, "notices.enter_reason"))
                .session(SET)
                .build();
    }

    /**
     * PENDING to DECLINED in one step. Repeating it finds the request no longer pending.
     */
    public ConversationOutcome declineRequest(Actor reviewer, long requestId, String reason) {
        return declineRequestOutcome(reviewer, requestId, reason, null).build();
    }

    // --- answers ---

    ConversationOutcome approveAnswer(Actor reviewer, long requestId, MessageRef origin) {
        long fulfillerId = requests.close(requestId);
        log.info("request_closed requestId={} reviewerId={} fulfillerId={}", requestId, reviewer.tgId, fulfillerId);

        Request r = requests.require(requestId);
        Map<String, Object> card = card(r);
        card.put("reviewer", Replies.name(reviewer));

        ConversationOutcome.Builder out = ConversationOutcome.ok()
                .edit(origin, replies.broadcast("cards.closed", card), List.of())
                .notice(replies.t(reviewer, "notices.approved"));
        actors.findById(r.requesterId)
                .ifPresent(a -> out.send(Destination.actor(a.tgId), replies.t(a, "notify.answer_ready", card)));
        actors.findById(fulfillerId)
                .ifPresent(a -> out.send(Destination.actor(a.tgId), replies.t(a, "notify.answer_approved", card)));
        return out.build();
    }

    ConversationOutcome startDeclineAnswer(Actor reviewer, long requestId, MessageRef origin) {
        expectStatus(requestId, RequestStatus.ANSWERED);
        sessions.set(reviewer.tgId, Session.forRequest(SessionState.ENTERING_ANSWER_COMMENT, requestId).withOrigin(origin));
        return ConversationOutcome.ok()
                .send(Destination.reviewers(), replies.broadcast("prompts.answer_comment",
                        Map.of("id", requestId, "reviewer", Replies.name(reviewer))))
                .notice(replies.t(reviewer, "notices.enter_reason"))
                .session(SET)
                .build();
    }

    /**
     * ANSWERED back to APPROVED with the comment stored; the request is offered again.
     * Repeating it finds the request no longer answered.
     */
    public ConversationOutcome declineAnswer(Actor reviewer, long requestId, String comment) {
        return declineAnswerOutcome(reviewer, requestId, comment, null).build();
    }

    // --- categories ---

    ConversationOutcome categories(Actor reviewer) {
        List<Category> all = categories.listCategories();
        if (all.isEmpty()) {
            return ConversationOutcome.ok()
                    .send(Destination.actor(reviewer.tgId), replies.error(reviewer, "no_categories"))
                    .build();
        }
        StringBuilder sb = new StringBuilder(replies.t(reviewer, "lists.categories_title")).append("\n\n");
        List<ActionButton> buttons = new ArrayList<>();
        for (Category c : all) {
            sb.append("• ").append(Html.esc(c.label())).append('\n');
            buttons.add(new ActionButton(replies.t(reviewer, ActionName.RENAME_CATEGORY.labelKey()) + " " + c.name,
                    ActionName.RENAME_CATEGORY.callbackData(c.id)));
            buttons.add(new ActionButton(replies.t(reviewer, ActionName.DELETE_CATEGORY.labelKey()) + " " + c.name,
                    ActionName.DELETE_CATEGORY.callbackData(c.id)));
        }
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId), sb.toString(), buttons, List.of())
                .build();
    }

    ConversationOutcome addCategory(Actor reviewer) {
        sessions.set(reviewer.tgId, Session.of(SessionState.ENTERING_CATEGORY_NAME));
        return prompt(reviewer, "prompts.category_name").session(SET).build();
    }

    ConversationOutcome renameCategory(Actor reviewer, long categoryId) {
        Category c = categories.findById(categoryId)
                .orElseThrow(() -> new NotFoundException("Category " + categoryId + " not found"));
        sessions.set(reviewer.tgId, Session.of(SessionState.ENTERING_NEW_CATEGORY_NAME).withCategory(c.id));
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId),
                        replies.t(reviewer, "prompts.new_category_name", Map.of("name", Html.esc(c.name))),
                        List.of(), replies.options(reviewer, ActionName.BACK))
                .session(SET)
                .build();
    }

    ConversationOutcome deleteCategory(Actor reviewer, long categoryId) {
        categories.deleteCategory(categoryId);
        log.info("category_deleted categoryId={} reviewerId={}", categoryId, reviewer.tgId);
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId), replies.t(reviewer, "success.category_deleted"))
                .notice(replies.t(reviewer, "success.category_deleted"))
                .build();
    }

    // --- free text ---

    ConversationOutcome onText(Actor reviewer, Set<Capability> caps, Session session, String text) {
        String clean = text == null ? "" : text.trim();
        return switch (session.state()) {
            case ENTERING_DECLINE_REASON -> completeDecline(reviewer, session, clean);
            case ENTERING_ANSWER_COMMENT -> completeAnswerComment(reviewer, session, clean);
            case ENTERING_CATEGORY_NAME -> categoryName(reviewer, session, clean);
            case ENTERING_CATEGORY_TAG -> categoryTag(reviewer, caps, session, clean);
            case ENTERING_NEW_CATEGORY_NAME -> newCategoryName(reviewer, caps, session, clean);
            case SELECTING_CATEGORY, ENTERING_REQUEST, CONFIRMING_REQUEST,
                    WRITING_ANSWER, CONFIRMING_ANSWER -> ConversationOutcome.unhandled();
        };
    }

    /**
     * BACK in any review state abandons it.
     */
    ConversationOutcome cancel(Actor reviewer, Set<Capability> caps, Session session) {
        if (!sessions.compareAndSet(reviewer.tgId, session, null)) return duplicate(reviewer);
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId), replies.t(reviewer, "prompts.cancelled"),
                        List.of(), replies.menu(reviewer, caps))
                .session(CLEARED)
                .build();
    }

    private ConversationOutcome completeDecline(Actor reviewer, Session session, String reason) {
        if (reason.isEmpty()) return emptyReason(reviewer);
        if (!sessions.compareAndSet(reviewer.tgId, session, null)) return duplicate(reviewer);
        try {
            return declineRequestOutcome(reviewer, session.requestId(), reason, session.origin()).session(CLEARED).build();
        } catch (StoreException e) {
            sessions.compareAndSet(reviewer.tgId, null, session);
            throw e;
        }
    }

    private ConversationOutcome completeAnswerComment(Actor reviewer, Session session, String comment) {
        if (comment.isEmpty()) return emptyReason(reviewer);
        if (!sessions.compareAndSet(reviewer.tgId, session, null)) return duplicate(reviewer);
        try {
            return declineAnswerOutcome(reviewer, session.requestId(), comment, session.origin()).session(CLEARED).build();
        } catch (StoreException e) {
            sessions.compareAndSet(reviewer.tgId, null, session);
            throw e;
        }
    }

    private ConversationOutcome categoryName(Actor reviewer, Session session, String name) {
        if (name.length() < 2) throw new ValidationException("category_name_too_short", "Category name is too short");
        if (categories.findByName(name).isPresent()) {
            throw new ValidationException("category_exists", "Category '" + name + "' already exists");
        }
        Session next = session.withState(SessionState.ENTERING_CATEGORY_TAG).withDraft(name);
        if (!sessions.compareAndSet(reviewer.tgId, session, next)) return duplicate(reviewer);
        return prompt(reviewer, "prompts.category_tag").session(SET).build();
    }

    private ConversationOutcome categoryTag(Actor reviewer, Set<Capability> caps, Session session, String hashtag) {
        if (!sessions.compareAndSet(reviewer.tgId, session, null)) return duplicate(reviewer);
        Category c;
        try {
            c = categories.createCategory(session.draftText(), hashtag);
        } catch (ValidationException | StoreException e) {
            sessions.compareAndSet(reviewer.tgId, null, session);
            throw e;
        }
        log.info("category_created categoryId={} name={} reviewerId={}", c.id, c.name, reviewer.tgId);
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId),
                        replies.t(reviewer, "success.category_created", Map.of("name", Html.esc(c.label()))),
                        List.of(), replies.menu(reviewer, caps))
                .session(CLEARED)
                .build();
    }

    private ConversationOutcome newCategoryName(Actor reviewer, Set<Capability> caps, Session session, String name) {
        if (!sessions.compareAndSet(reviewer.tgId, session, null)) return duplicate(reviewer);
        try {
            categories.renameCategory(session.categoryId(), name);
        } catch (ValidationException | StoreException e) {
            sessions.compareAndSet(reviewer.tgId, null, session);
            throw e;
        }
        log.info("category_renamed categoryId={} name={} reviewerId={}", session.categoryId(), name, reviewer.tgId);
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId),
                        replies.t(reviewer, "success.category_renamed", Map.of("name", Html.esc(name))),
                        List.of(), replies.menu(reviewer, caps))
                .session(CLEARED)
                .build();
    }

    private ConversationOutcome.Builder declineRequestOutcome(Actor reviewer, long requestId, String reason, MessageRef origin) {
        requests.decline(requestId, reason);
        log.info("request_declined requestId={} reviewerId={}", requestId, reviewer.tgId);

        Request r = requests.require(requestId);
        Map<String, Object> card = card(r);
        card.put("reviewer", Replies.name(reviewer));
        ConversationOutcome.Builder out = ConversationOutcome.ok()
                .edit(origin, replies.broadcast("cards.declined", card), List.of())
                .notice(replies.t(reviewer, "notices.declined"));
        actors.findById(r.requesterId)
                .ifPresent(a -> out.send(Destination.actor(a.tgId), replies.t(a, "notify.request_declined", card)));
        return out;
    }

    private ConversationOutcome.Builder declineAnswerOutcome(Actor reviewer, long requestId, String comment, MessageRef origin) {
        long former = coordinator.returnToPool(requestId, comment);
        sessions.clear(former);

        Request r = requests.require(requestId);
        Map<String, Object> card = card(r);
        card.put("reviewer", Replies.name(reviewer));
        ConversationOutcome.Builder out = ConversationOutcome.ok()
                .edit(origin, replies.broadcast("cards.answer_declined", card), List.of())
                .send(Destination.fulfillers(), replies.broadcast("cards.offer", card),
                        List.of(replies.button(ActionName.TAKE, r.id)), List.of())
                .notice(replies.t(reviewer, "notices.declined"));
        actors.findById(former)
                .ifPresent(a -> out.send(Destination.actor(a.tgId), replies.t(a, "notify.answer_declined", card)));
        return out;
    }

    private void expectStatus(long requestId, RequestStatus expected) {
        Request r = requests.require(requestId);
        if (r.status != expected) {
            throw new ConflictException(ConflictException.Reason.ALREADY_HANDLED,
                    "Request " + requestId + " is " + r.status + ", expected " + expected);
        }
    }

    private Map<String, Object> card(Request r) {
        return Replies.card(r, categories.findById(r.categoryId).map(Category::label).orElse("?"));
    }

    private ConversationOutcome.Builder prompt(Actor reviewer, String key) {
        return ConversationOutcome.ok()
                .send(Destination.actor(reviewer.tgId), replies.t(reviewer, key),
                        List.of(), replies.options(reviewer, ActionName.BACK));
    }

    private ConversationOutcome emptyReason(Actor reviewer) {
        return ConversationOutcome.rejected("empty_reason")
                .send(Destination.reviewers(), replies.broadcast("errors.empty_reason", Map.of()))
                .build();
    }

    private ConversationOutcome duplicate(Actor reviewer) {
        log.debug("duplicate_delivery actor={}", reviewer.tgId);
        return ConversationOutcome.conflict("duplicate").notice(replies.error(reviewer, "duplicate")).build();
    }
}
