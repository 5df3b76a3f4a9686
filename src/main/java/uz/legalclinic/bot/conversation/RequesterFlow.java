package uz.legalclinic.bot.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.notify.Destination;
import uz.legalclinic.bot.service.CategoryService;
import uz.legalclinic.bot.service.RequestService;
import uz.legalclinic.bot.service.StoreException;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;
import uz.legalclinic.bot.session.SessionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.CLEARED;
import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.SET;

/**
 * idle, SELECTING_CATEGORY, ENTERING_REQUEST, CONFIRMING_REQUEST, idle.
 */
public final class RequesterFlow {

    private static final Logger log = LoggerFactory.getLogger(RequesterFlow.class);

    private final CategoryService categories;
    private final RequestService requests;
    private final SessionStore sessions;
    private final Replies replies;
    private final int minLength;

    RequesterFlow(CategoryService categories, RequestService requests, SessionStore sessions,
                  Replies replies, int minLength) {
        this.categories = categories;
        this.requests = requests;
        this.sessions = sessions;
        this.replies = replies;
        this.minLength = minLength;
    }

    ConversationOutcome ask(Actor actor) {
        List<Category> all = categories.listCategories();
        if (all.isEmpty()) {
            return ConversationOutcome.rejected("no_categories")
                    .send(Destination.actor(actor.tgId), replies.error(actor, "no_categories"))
                    .build();
        }
        // asking again restarts the flow
        sessions.set(actor.tgId, Session.of(SessionState.SELECTING_CATEGORY));
        return selectCategoryPrompt(actor, all).session(SET).build();
    }

    ConversationOutcome onText(Actor actor, Session session, String text) {
        return switch (session.state()) {
            case SELECTING_CATEGORY -> pickCategory(actor, session, text);
            case ENTERING_REQUEST -> enterText(actor, session, text);
            case CONFIRMING_REQUEST,
                    WRITING_ANSWER, CONFIRMING_ANSWER,
                    ENTERING_DECLINE_REASON, ENTERING_ANSWER_COMMENT,
                    ENTERING_CATEGORY_NAME, ENTERING_CATEGORY_TAG, ENTERING_NEW_CATEGORY_NAME -> ConversationOutcome.unhandled();
        };
    }

    ConversationOutcome confirm(Actor actor, Set<Capability> caps, Session session) {
        if (session == null || session.state() != SessionState.CONFIRMING_REQUEST) return ConversationOutcome.unhandled();
        if (!sessions.compareAndSet(actor.tgId, session, null)) return duplicate(actor);

        Optional<Category> category = categories.findById(session.categoryId());
        if (category.isEmpty()) {
            return ConversationOutcome.rejected("category_not_found")
                    .send(Destination.actor(actor.tgId), replies.error(actor, "category_not_found"),
                            List.of(), replies.menu(actor, caps))
                    .session(CLEARED)
                    .build();
        }

        Request r;
        try {
            r = requests.create(actor.tgId, category.get().id, session.draftText());
        } catch (StoreException e) {
            sessions.compareAndSet(actor.tgId, null, session);
            throw e;
        }
        log.info("request_created requestId={} requesterId={} categoryId={}", r.id, actor.tgId, r.categoryId);

        Map<String, Object> card = Replies.card(r, category.get().label());
        card.put("requester", Replies.name(actor));
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "success.request_sent", Map.of("id", r.id)),
                        List.of(), replies.menu(actor, caps))
                .send(Destination.reviewers(), replies.broadcast("cards.new_request", card),
                        List.of(replies.button(ActionName.APPROVE_REQUEST, r.id), replies.button(ActionName.DECLINE_REQUEST, r.id)),
                        List.of())
                .session(CLEARED)
                .build();
    }

    ConversationOutcome edit(Actor actor, Session session) {
        if (session == null || session.state() != SessionState.CONFIRMING_REQUEST) return ConversationOutcome.unhandled();
        Session next = session.withState(SessionState.ENTERING_REQUEST).withDraft(null);
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);
        return enterTextPrompt(actor).session(SET).build();
    }

    /**
     * One step back; chosen fields survive.
     */
    ConversationOutcome back(Actor actor, Set<Capability> caps, Session session) {
        Session next = switch (session.state()) {
            case CONFIRMING_REQUEST -> session.withState(SessionState.ENTERING_REQUEST);
            case ENTERING_REQUEST -> session.withState(SessionState.SELECTING_CATEGORY);
            case SELECTING_CATEGORY,
                    WRITING_ANSWER, CONFIRMING_ANSWER,
                    ENTERING_DECLINE_REASON, ENTERING_ANSWER_COMMENT,
                    ENTERING_CATEGORY_NAME, ENTERING_CATEGORY_TAG, ENTERING_NEW_CATEGORY_NAME -> null;
        };
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);
        if (next == null) {
            return ConversationOutcome.ok()
                    .send(Destination.actor(actor.tgId), replies.t(actor, "menu.main"), List.of(), replies.menu(actor, caps))
                    .session(CLEARED)
                    .build();
        }
        if (next.state() == SessionState.ENTERING_REQUEST) return enterTextPrompt(actor).session(SET).build();
        return selectCategoryPrompt(actor, categories.listCategories()).session(SET).build();
    }

    private ConversationOutcome pickCategory(Actor actor, Session session, String text) {
        Optional<Category> category = categories.findByName(text);
        if (category.isEmpty()) {
            return ConversationOutcome.rejected("category_not_found")
                    .send(Destination.actor(actor.tgId), replies.error(actor, "category_not_found"))
                    .build();
        }
        Session next = session.withState(SessionState.ENTERING_REQUEST).withCategory(category.get().id);
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);
        return enterTextPrompt(actor).session(SET).build();
    }

    private ConversationOutcome enterText(Actor actor, Session session, String text) {
        String clean = text == null ? "" : text.trim();
        if (clean.length() < minLength) {
            return ConversationOutcome.rejected("too_short")
                    .send(Destination.actor(actor.tgId),
                            replies.t(actor, "errors.too_short", Map.of("min", minLength, "length", clean.length())))
                    .build();
        }
        Session next = session.withState(SessionState.CONFIRMING_REQUEST).withDraft(clean);
        if (!sessions.compareAndSet(actor.tgId, session, next)) return duplicate(actor);

        String category = categories.findById(session.categoryId()).map(Category::label).orElse("?");
        Request preview = new Request();
        preview.text = clean;
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.confirm_request", Replies.card(preview, category)),
                        List.of(), replies.options(actor, ActionName.CONFIRM, ActionName.EDIT, ActionName.BACK))
                .session(SET)
                .build();
    }

    private ConversationOutcome.Builder selectCategoryPrompt(Actor actor, List<Category> all) {
        List<String> options = new ArrayList<>();
        for (Category c : all) options.add(c.name);
        options.add(replies.t(actor, ActionName.BACK.labelKey()));
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.select_category"), List.of(), options);
    }

    private ConversationOutcome.Builder enterTextPrompt(Actor actor) {
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "prompts.enter_request", Map.of("min", minLength)),
                        List.of(), replies.options(actor, ActionName.BACK));
    }

    private ConversationOutcome duplicate(Actor actor) {
        log.debug("duplicate_delivery actor={}", actor.tgId);
        return ConversationOutcome.conflict("duplicate").notice(replies.error(actor, "duplicate")).build();
    }
}
