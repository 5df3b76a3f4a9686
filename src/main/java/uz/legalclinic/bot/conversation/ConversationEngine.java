package uz.legalclinic.bot.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.config.Config;
import uz.legalclinic.bot.i18n.Translator;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Role;
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
import uz.legalclinic.bot.session.Flow;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionStore;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static uz.legalclinic.bot.conversation.ConversationOutcome.SessionChange.CLEARED;

/**
 * Entry point of the core. Resolves the actor and its capabilities, picks the flow that owns the
 * event, and turns every expected failure into an outcome. Nothing thrown by a flow escapes except
 * programming errors.
 */
public final class ConversationEngine {

    private static final Logger log = LoggerFactory.getLogger(ConversationEngine.class);

    public static final String LANGUAGE_PREFIX = "lang:";
    public static final String ONBOARDING_PREFIX = "onboard:";
    public static final String OFFER_ACCEPT = "offer:accept";
    public static final String OFFER_DECLINE = "offer:decline";

    private final Translator tr;
    private final SessionStore sessions;
    private final ActorService actors;
    private final RoleResolver roles = new RoleResolver();
    private final Replies replies;

    private final RequesterFlow requester;
    private final FulfillerFlow fulfiller;
    private final ReviewerFlow reviewer;
    private final InfoViews info;

    public ConversationEngine(Config cfg, Translator tr, SessionStore sessions, ActorService actors,
                              CategoryService categories, RequestService requests, AssignmentCoordinator coordinator) {
        this.tr = tr;
        this.sessions = sessions;
        this.actors = actors;
        this.replies = new Replies(tr);
        this.requester = new RequesterFlow(categories, requests, sessions, replies, cfg.minRequestLength());
        this.fulfiller = new FulfillerFlow(coordinator, requests, categories, sessions, replies);
        this.reviewer = new ReviewerFlow(requests, categories, actors, coordinator, sessions, replies);
        this.info = new InfoViews(requests, categories, actors, replies, cfg.maxMessageLen());
    }

    @FunctionalInterface
    private interface Work {
        ConversationOutcome run(Actor actor, EnumSet<Capability> caps);
    }

    /**
     * One typed message. Reply-keyboard labels act as signals; anything else goes to the flow the
     * session is in.
     */
    public ConversationOutcome submitText(long actorId, String text) {
        Session current = sessions.get(actorId).orElse(null);
        return run(actorId, current == null ? null : current.requestId(), true, (actor, caps) -> {
            Optional<ActionName> signal = replies.signal(text);
            if (signal.isPresent()) return dispatch(signal.get(), null, null, actor, caps, current);
            if (current == null) return ConversationOutcome.unhandled();
            if (!caps.contains(required(current.flow()))) return notAllowed(actor, true);
            return switch (current.flow()) {
                case REQUEST -> requester.onText(actor, current, text);
                case ANSWER -> fulfiller.onText(actor, current, text);
                case REVIEW -> reviewer.onText(actor, caps, current, text);
            };
        });
    }

    public ConversationOutcome handleAction(ActionName action, Long targetId, long actorId) {
        return handleAction(action, targetId, actorId, null);
    }

    /**
     * One inline action.
     *
     * @param targetId request id, category id for category actions, or null
     * @param origin   the message the action was pressed on, edited when the action settles it
     */
    public ConversationOutcome handleAction(ActionName action, Long targetId, long actorId, MessageRef origin) {
        Session current = sessions.get(actorId).orElse(null);
        boolean onCategory = action == ActionName.RENAME_CATEGORY || action == ActionName.DELETE_CATEGORY;
        return run(actorId, onCategory ? null : targetId, false,
                (actor, caps) -> dispatch(action, targetId, origin, actor, caps, current));
    }

    /**
     * Welcome text with the role's menu, or the onboarding language picker while the terms are not
     * accepted. Any unfinished conversation is dropped; assignments are kept.
     */
    public ConversationOutcome mainMenu(long actorId) {
        return run(actorId, null, true, (actor, caps) -> {
            boolean had = sessions.get(actorId).isPresent();
            sessions.clear(actorId);
            ConversationOutcome.Builder b;
            if (needsOnboarding(actor)) {
                log.info("onboarding_started tgId={}", actorId);
                b = ConversationOutcome.ok().send(Destination.actor(actorId), onboardingWelcome(), onboardingButtons(), List.of());
            } else {
                b = welcome(actor, caps);
            }
            return b.session(had ? CLEARED : ConversationOutcome.SessionChange.UNCHANGED).build();
        });
    }

    /**
     * First onboarding step: stores the chosen language and offers the terms in it.
     */
    public ConversationOutcome onboardingLanguage(long actorId, String locale) {
        return run(actorId, null, false, (actor, caps) -> {
            if (!tr.isSupported(locale)) {
                return ConversationOutcome.rejected("unsupported_locale")
                        .notice(replies.error(actor, "unsupported_locale"))
                        .build();
            }
            actors.setLanguage(actorId, locale);
            actor.language = locale;
            log.info("language_changed tgId={} locale={}", actorId, locale);
            if (!needsOnboarding(actor)) return welcome(actor, caps).notice(replies.t(actor, "language.changed")).build();
            return ConversationOutcome.ok()
                    .send(Destination.actor(actorId), replies.t(actor, "onboarding.offer_text"), offerButtons(actor), List.of())
                    .notice(replies.t(actor, "language.changed"))
                    .build();
        });
    }

    /**
     * Second onboarding step. Declining repeats the offer; accepting unlocks the menu.
     */
    public ConversationOutcome answerOffer(long actorId, boolean accepted) {
        return run(actorId, null, false, (actor, caps) -> {
            if (actor.offerAccepted) {
                return ConversationOutcome.ok().notice(replies.t(actor, "onboarding.accepted")).build();
            }
            if (!accepted) {
                log.info("offer_declined tgId={}", actorId);
                return ConversationOutcome.ok()
                        .send(Destination.actor(actorId), replies.t(actor, "onboarding.declined"), offerButtons(actor), List.of())
                        .notice(replies.t(actor, "onboarding.declined_notice"))
                        .build();
            }
            actors.acceptOffer(actorId);
            actor.offerAccepted = true;
            log.info("offer_accepted tgId={}", actorId);
            return welcome(actor, caps).notice(replies.t(actor, "onboarding.accepted")).build();
        });
    }

    /**
     * Reply for private text nobody expected. The session, if any, is left alone.
     */
    public ConversationOutcome fallback(long actorId) {
        return run(actorId, null, true, (actor, caps) -> ConversationOutcome.ok()
                .send(Destination.actor(actorId), replies.t(actor, "menu.unknown"), List.of(), replies.menu(actor, caps))
                .build());
    }

    public ConversationOutcome languagePrompt(long actorId) {
        return run(actorId, null, true, (actor, caps) -> {
            List<ActionButton> buttons = new ArrayList<>();
            for (String locale : tr.supportedLocales()) {
                buttons.add(new ActionButton(tr.resolve("language.name", locale), LANGUAGE_PREFIX + locale));
            }
            return ConversationOutcome.ok()
                    .send(Destination.actor(actorId), replies.t(actor, "language.select"), buttons, List.of())
                    .build();
        });
    }

    public ConversationOutcome changeLanguage(long actorId, String locale) {
        return run(actorId, null, false, (actor, caps) -> {
            if (!tr.isSupported(locale)) {
                return ConversationOutcome.rejected("unsupported_locale")
                        .notice(replies.error(actor, "unsupported_locale"))
                        .build();
            }
            actors.setLanguage(actorId, locale);
            actor.language = locale;
            log.info("language_changed tgId={} locale={}", actorId, locale);
            return ConversationOutcome.ok()
                    .send(Destination.actor(actorId), replies.t(actor, "language.changed"), List.of(), replies.menu(actor, caps))
                    .notice(replies.t(actor, "language.changed"))
                    .build();
        });
    }

    /**
     * Reviewer-only. Reviewers themselves cannot be banned.
     */
    public ConversationOutcome setBanned(long reviewerId, long targetId, boolean banned) {
        return run(reviewerId, null, true, (actor, caps) -> {
            if (!caps.contains(Capability.CAN_REVIEW)) return notAllowed(actor, true);
            Actor target = actors.findById(targetId)
                    .orElseThrow(() -> new NotFoundException("Actor " + targetId + " not found"));
            if (target.role == Role.REVIEWER) {
                return ConversationOutcome.rejected("cannot_ban_reviewer")
                        .send(Destination.actor(reviewerId), replies.error(actor, "cannot_ban_reviewer"))
                        .build();
            }
            actors.setBanned(targetId, banned);
            if (banned) sessions.clear(targetId);
            log.info("{} tgId={} reviewerId={}", banned ? "actor_banned" : "actor_unbanned", targetId, reviewerId);
            return ConversationOutcome.ok()
                    .send(Destination.actor(reviewerId), replies.t(actor, banned ? "success.banned" : "success.unbanned",
                            Map.of("name", Replies.name(target))))
                    .build();
        });
    }

    public ConversationOutcome declineRequest(long reviewerId, long requestId, String reason) {
        return run(reviewerId, requestId, false, (actor, caps) -> caps.contains(Capability.CAN_REVIEW)
                ? reviewer.declineRequest(actor, requestId, reason)
                : notAllowed(actor, false));
    }

    public ConversationOutcome declineAnswer(long reviewerId, long requestId, String comment) {
        return run(reviewerId, requestId, false, (actor, caps) -> caps.contains(Capability.CAN_REVIEW)
                ? reviewer.declineAnswer(actor, requestId, comment)
                : notAllowed(actor, false));
    }

    private ConversationOutcome dispatch(ActionName action, Long target, MessageRef origin,
                                         Actor actor, EnumSet<Capability> caps, Session session) {
        Capability needed = required(action);
        if (needed != null && !caps.contains(needed)) return notAllowed(actor, target == null);
        if (action.targeted() && target == null) return ConversationOutcome.unhandled();

        return switch (action) {
            case ASK -> needsOnboarding(actor) ? offerRequired(actor) : requester.ask(actor);
            case BACK -> back(actor, caps, session);
            case CONFIRM -> inFlow(session, Flow.REQUEST) ? requester.confirm(actor, caps, session) : ConversationOutcome.unhandled();
            case EDIT -> inFlow(session, Flow.REQUEST) ? requester.edit(actor, session) : ConversationOutcome.unhandled();
            case TAKE -> fulfiller.take(actor, target, origin);
            case REJECT_ASSIGNMENT -> fulfiller.rejectAssignment(actor, caps, target, session);
            case CONFIRM_ANSWER -> fulfiller.confirmAnswer(actor, caps, session);
            case EDIT_ANSWER -> fulfiller.editAnswer(actor, session);
            case APPROVE_REQUEST -> reviewer.approveRequest(actor, target, origin);
            case DECLINE_REQUEST -> reviewer.startDeclineRequest(actor, target, origin);
            case APPROVE_ANSWER -> reviewer.approveAnswer(actor, target, origin);
            case DECLINE_ANSWER -> reviewer.startDeclineAnswer(actor, target, origin);
            case MY_REQUESTS -> info.myRequests(actor);
            case MY_ANSWERS -> info.myAnswers(actor);
            case CURRENT_ASSIGNMENT -> info.currentAssignment(actor);
            case FULFILLER_STATS -> info.fulfillerStats(actor);
            case HELP -> info.help(actor, caps);
            case REVIEW_STATS -> info.reviewStats(actor);
            case CATEGORIES -> reviewer.categories(actor);
            case ADD_CATEGORY -> reviewer.addCategory(actor);
            case RENAME_CATEGORY -> reviewer.renameCategory(actor, target);
            case DELETE_CATEGORY -> reviewer.deleteCategory(actor, target);
        };
    }

    /**
     * BACK always works: one step back inside a flow, the menu otherwise.
     */
    private ConversationOutcome back(Actor actor, EnumSet<Capability> caps, Session session) {
        if (session == null) {
            return ConversationOutcome.ok()
                    .send(Destination.actor(actor.tgId), replies.t(actor, "menu.main"), List.of(), replies.menu(actor, caps))
                    .build();
        }
        return switch (session.flow()) {
            case REQUEST -> requester.back(actor, caps, session);
            case ANSWER -> fulfiller.back(actor, caps, session);
            case REVIEW -> reviewer.cancel(actor, caps, session);
        };
    }

    private ConversationOutcome.Builder welcome(Actor actor, EnumSet<Capability> caps) {
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId),
                        replies.t(actor, "menu.welcome", Map.of("name", Replies.name(actor))),
                        List.of(), replies.menu(actor, caps));
    }

    private ConversationOutcome offerRequired(Actor actor) {
        String text = replies.error(actor, "offer_not_accepted");
        return ConversationOutcome.rejected("offer_not_accepted")
                .send(Destination.actor(actor.tgId), text + "\n\n" + replies.t(actor, "onboarding.offer_text"),
                        offerButtons(actor), List.of())
                .notice(text)
                .build();
    }

    // one paragraph per language, the actor has not picked one yet
    private String onboardingWelcome() {
        List<String> parts = new ArrayList<>();
        for (String locale : tr.supportedLocales()) parts.add(tr.resolve("onboarding.welcome", locale));
        return String.join("\n\n", parts);
    }

    private List<ActionButton> onboardingButtons() {
        List<ActionButton> buttons = new ArrayList<>();
        for (String locale : tr.supportedLocales()) {
            buttons.add(new ActionButton(tr.resolve("language.name", locale), ONBOARDING_PREFIX + locale));
        }
        return buttons;
    }

    private List<ActionButton> offerButtons(Actor actor) {
        return List.of(
                new ActionButton(replies.t(actor, "onboarding.accept"), OFFER_ACCEPT),
                new ActionButton(replies.t(actor, "onboarding.decline"), OFFER_DECLINE));
    }

    // reviewers are configured staff and skip the terms
    private static boolean needsOnboarding(Actor actor) {
        return !actor.offerAccepted && actor.role != Role.REVIEWER;
    }

    private ConversationOutcome run(long actorId, Long target, boolean typed, Work work) {
        Actor actor;
        try {
            actor = actors.findById(actorId).orElse(null);
        } catch (StoreException e) {
            log.error("store_failure actor={}", actorId, e);
            return ConversationOutcome.rejected("store_failure").build();
        }
        if (actor == null) return ConversationOutcome.rejected("not_found").build();

        EnumSet<Capability> caps = roles.capabilities(actor);
        if (caps.isEmpty()) {
            log.debug("banned_actor_event tgId={}", actorId);
            return failure(ConversationOutcome.rejected("banned"), actor, "banned", typed, false);
        }

        try {
            return work.run(actor, caps);
        } catch (StaleSessionException e) {
            log.warn("stale_session actor={} session={} detail={}", actorId, e.session(), e.getMessage());
            dropSessionFor(actorId, e.session().requestId());
            return failure(ConversationOutcome.conflict("stale_session"), actor, "stale_session", typed, true);
        } catch (ValidationException e) {
            return failure(ConversationOutcome.rejected(e.reason()), actor, e.reason(), typed, false);
        } catch (ConflictException e) {
            String reason = e.reason().key();
            log.info("conflict actor={} reason={} detail={}", actorId, reason, e.getMessage());
            boolean cleared = e.reason() != ConflictException.Reason.ASSIGNMENT_CONFLICT
                    && e.reason() != ConflictException.Reason.CATEGORY_IN_USE
                    && dropSessionFor(actorId, target);
            return failure(ConversationOutcome.conflict(reason), actor, reason, typed, cleared);
        } catch (NotFoundException e) {
            log.info("not_found actor={} detail={}", actorId, e.getMessage());
            boolean cleared = dropSessionFor(actorId, target);
            return failure(ConversationOutcome.rejected("not_found"), actor, "not_found", typed, cleared);
        } catch (StoreException e) {
            log.error("store_failure actor={}", actorId, e);
            return failure(ConversationOutcome.rejected("store_failure"), actor, "general", typed, false);
        }
    }

    /**
     * Clears the actor's session only if it refers to {@code requestId}.
     */
    private boolean dropSessionFor(long actorId, Long requestId) {
        if (requestId == null) return false;
        Optional<Session> s = sessions.get(actorId);
        return s.isPresent()
                && Objects.equals(s.get().requestId(), requestId)
                && sessions.compareAndSet(actorId, s.get(), null);
    }

    private ConversationOutcome failure(ConversationOutcome.Builder b, Actor actor, String errorKey,
                                        boolean typed, boolean cleared) {
        String text = replies.error(actor, errorKey);
        b.notice(text);
        if (typed) b.send(Destination.actor(actor.tgId), text);
        if (cleared) b.session(CLEARED);
        return b.build();
    }

    private ConversationOutcome notAllowed(Actor actor, boolean typed) {
        return failure(ConversationOutcome.rejected("not_allowed"), actor, "not_allowed", typed, false);
    }

    private static boolean inFlow(Session s, Flow flow) {
        return s != null && s.flow() == flow;
    }

    private static Capability required(Flow flow) {
        return switch (flow) {
            case REQUEST -> Capability.CAN_REQUEST;
            case ANSWER -> Capability.CAN_FULFILL;
            case REVIEW -> Capability.CAN_REVIEW;
        };
    }

    /**
     * Null for actions every capability set may use.
     */
    private static Capability required(ActionName action) {
        return switch (action) {
            case BACK, HELP -> null;
            case ASK, CONFIRM, EDIT, MY_REQUESTS -> Capability.CAN_REQUEST;
            case TAKE, REJECT_ASSIGNMENT, CONFIRM_ANSWER, EDIT_ANSWER,
                    MY_ANSWERS, CURRENT_ASSIGNMENT, FULFILLER_STATS -> Capability.CAN_FULFILL;
            case APPROVE_REQUEST, DECLINE_REQUEST, APPROVE_ANSWER, DECLINE_ANSWER,
                    REVIEW_STATS, CATEGORIES, ADD_CATEGORY, RENAME_CATEGORY, DELETE_CATEGORY -> Capability.CAN_REVIEW;
        };
    }
}
