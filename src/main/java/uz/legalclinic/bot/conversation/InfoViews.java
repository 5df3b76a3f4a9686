package uz.legalclinic.bot.conversation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uz.legalclinic.bot.model.Actor;
import uz.legalclinic.bot.model.Capability;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.FulfillerStats;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.model.Role;
import uz.legalclinic.bot.notify.Destination;
import uz.legalclinic.bot.service.ActorService;
import uz.legalclinic.bot.service.CategoryService;
import uz.legalclinic.bot.service.ConflictException;
import uz.legalclinic.bot.service.NotFoundException;
import uz.legalclinic.bot.service.RequestService;
import uz.legalclinic.bot.util.Html;
import uz.legalclinic.bot.util.TextChunker;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only views. None of them touches a session; CURRENT_ASSIGNMENT may repair a dangling back-reference.
 */
public final class InfoViews {

    private static final Logger log = LoggerFactory.getLogger(InfoViews.class);
    private static final int PREVIEW_LEN = 200;

    private final RequestService requests;
    private final CategoryService categories;
    private final ActorService actors;
    private final Replies replies;
    private final int maxMessageLen;

    InfoViews(RequestService requests, CategoryService categories, ActorService actors, Replies replies, int maxMessageLen) {
        this.requests = requests;
        this.categories = categories;
        this.actors = actors;
        this.replies = replies;
        this.maxMessageLen = maxMessageLen;
    }

    ConversationOutcome myRequests(Actor actor) {
        List<Request> mine = requests.findByRequester(actor.tgId);
        if (mine.isEmpty()) return single(actor, replies.t(actor, "lists.no_requests"));

        List<String> blocks = new ArrayList<>();
        for (Request r : mine) {
            StringBuilder sb = new StringBuilder(entry(actor, r));
            if (r.status == RequestStatus.CLOSED && r.answerText != null) {
                sb.append('\n').append(replies.t(actor, "lists.answer_label")).append(' ')
                        .append(Html.esc(Html.truncate(r.answerText, PREVIEW_LEN)));
            }
            if (r.status == RequestStatus.DECLINED && r.reviewerComment != null) {
                sb.append('\n').append(replies.t(actor, "lists.comment_label")).append(' ')
                        .append(Html.esc(r.reviewerComment));
            }
            blocks.add(sb.toString());
        }
        return list(actor, replies.t(actor, "lists.my_requests_title"), blocks);
    }

    ConversationOutcome myAnswers(Actor actor) {
        List<Request> answered = requests.findAnsweredBy(actor.tgId);
        if (answered.isEmpty()) return single(actor, replies.t(actor, "lists.no_answers"));

        List<String> blocks = new ArrayList<>();
        for (Request r : answered) {
            String block = entry(actor, r);
            if (r.answerText != null) {
                block += "\n" + replies.t(actor, "lists.answer_label") + " " + Html.esc(Html.truncate(r.answerText, PREVIEW_LEN));
            }
            blocks.add(block);
        }
        return list(actor, replies.t(actor, "lists.my_answers_title"), blocks);
    }

    /**
     * Shows the held request. A back-reference to a vanished request is cleared on the way.
     */
    ConversationOutcome currentAssignment(Actor actor) {
        Long id = actor.currentAssignmentId;
        if (id == null) {
            throw new ConflictException(ConflictException.Reason.NO_ACTIVE_ASSIGNMENT, "Actor " + actor.tgId + " holds nothing");
        }
        Optional<Request> held = requests.findById(id);
        if (held.isEmpty()) {
            if (actors.clearAssignmentIf(actor.tgId, id)) {
                log.warn("dangling_assignment_repaired tgId={} requestId={}", actor.tgId, id);
            }
            throw new NotFoundException("Request " + id + " not found");
        }

        Request r = held.get();
        Map<String, Object> card = Replies.card(r, categoryLabel(r));
        card.put("status", replies.t(actor, "status." + r.status.key()));
        List<String> options = r.status == RequestStatus.ASSIGNED
                ? replies.options(actor, ActionName.EDIT_ANSWER, ActionName.REJECT_ASSIGNMENT, ActionName.BACK)
                : replies.options(actor, ActionName.BACK);
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, "lists.current_assignment", card), List.of(), options)
                .build();
    }

    ConversationOutcome fulfillerStats(Actor actor) {
        FulfillerStats st = requests.statsFor(actor.tgId);
        Map<String, Object> p = new HashMap<>();
        p.put("total", st.total);
        p.put("in_progress", st.inProgress);
        p.put("awaiting", st.awaitingReview);
        p.put("completed", st.completed);
        p.put("rate", st.completionRate() < 0 ? "-" : String.format(Locale.US, "%.0f%%", st.completionRate()));
        return single(actor, replies.t(actor, "stats.fulfiller", p));
    }

    ConversationOutcome reviewStats(Actor reviewer) {
        Map<RequestStatus, Integer> counts = requests.countByStatus();
        StringBuilder sb = new StringBuilder(replies.t(reviewer, "stats.review_title")).append('\n');
        int total = 0;
        for (Map.Entry<RequestStatus, Integer> e : counts.entrySet()) {
            sb.append("• ").append(replies.t(reviewer, "status." + e.getKey().key()))
                    .append(": <b>").append(e.getValue()).append("</b>\n");
            total += e.getValue();
        }
        sb.append('\n').append(replies.t(reviewer, "stats.review_totals", Map.of(
                "total", total,
                "requesters", actors.listByRole(Role.REQUESTER).size(),
                "fulfillers", actors.listByRole(Role.FULFILLER).size())));
        return single(reviewer, sb.toString());
    }

    ConversationOutcome help(Actor actor, Set<Capability> caps) {
        String key;
        if (caps.contains(Capability.CAN_REVIEW)) key = "help.reviewer";
        else if (caps.contains(Capability.CAN_REQUEST)) key = "help.requester";
        else key = "help.fulfiller";
        return ConversationOutcome.ok()
                .send(Destination.actor(actor.tgId), replies.t(actor, key), List.of(), replies.menu(actor, caps))
                .build();
    }

    private String entry(Actor actor, Request r) {
        Map<String, Object> card = Replies.card(r, categoryLabel(r));
        card.put("text", Html.esc(Html.truncate(r.text, PREVIEW_LEN)));
        card.put("status", replies.t(actor, "status." + r.status.key()));
        return replies.t(actor, "lists.entry", card);
    }

    private ConversationOutcome list(Actor actor, String title, List<String> blocks) {
        ConversationOutcome.Builder out = ConversationOutcome.ok();
        for (String part : TextChunker.pack(title, blocks, maxMessageLen)) {
            out.send(Destination.actor(actor.tgId), part);
        }
        return out.build();
    }

    private ConversationOutcome single(Actor actor, String text) {
        return ConversationOutcome.ok().send(Destination.actor(actor.tgId), text).build();
    }

    private String categoryLabel(Request r) {
        return categories.findById(r.categoryId).map(Category::label).orElse("?");
    }
}
