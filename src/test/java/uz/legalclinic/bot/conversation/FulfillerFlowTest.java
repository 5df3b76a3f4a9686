package uz.legalclinic.bot.conversation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uz.legalclinic.bot.DbFixture;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.model.Role;
import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.notify.Channel;
import uz.legalclinic.bot.notify.MessageRef;
import uz.legalclinic.bot.notify.OutboundMessage;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FulfillerFlowTest {

    private static final long REQUESTER = 1L;
    private static final long FULFILLER = 2L;
    private static final long OTHER = 3L;
    private static final MessageRef OFFER = new MessageRef(DbFixture.FULFILLER_CHAT, 55);

    @TempDir
    Path dir;

    private EngineHarness h;
    private ConversationEngine engine;
    private Category family;
    private Request request;

    @BeforeEach
    void setUp() throws Exception {
        h = new EngineHarness(dir);
        engine = h.engine;
        family = h.fx.category("Family");
        request = h.fx.approved(REQUESTER, family);
        h.fx.actor(FULFILLER);
        h.fx.actor(OTHER);
    }

    @Test
    void takeBindsRequestAndOpensAnswerSession() {
        ConversationOutcome out = engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        assertThat(out.tag()).isEqualTo("ok");
        assertThat(out.notice()).isNotBlank();
        assertThat(EngineHarness.edits(out)).extracting(OutboundMessage::ref).containsExactly(OFFER);
        assertThat(EngineHarness.edits(out).get(0).actions()).isEmpty();
        assertThat(EngineHarness.toActor(out, FULFILLER)).hasSize(1);

        Session s = h.sessions.get(FULFILLER).orElseThrow();
        assertThat(s.state()).isEqualTo(SessionState.WRITING_ANSWER);
        assertThat(s.requestId()).isEqualTo(request.id);
        assertThat(h.fx.reloadRequest(request.id).status).isEqualTo(RequestStatus.ASSIGNED);
        assertThat(h.fx.reload(FULFILLER).role).isEqualTo(Role.FULFILLER);
        assertThat(h.fx.reload(FULFILLER).currentAssignmentId).isEqualTo(request.id);
    }

    @Test
    void answerIsCheckedThenSentForReview() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        ConversationOutcome written = engine.submitText(FULFILLER, "Write a claim to the district court.");
        assertThat(written.isOk()).isTrue();
        assertThat(h.state(FULFILLER)).isEqualTo(SessionState.CONFIRMING_ANSWER);

        ConversationOutcome sent = engine.handleAction(ActionName.CONFIRM_ANSWER, null, FULFILLER);

        assertThat(sent.tag()).isEqualTo("ok");
        assertThat(h.sessions.get(FULFILLER)).isEmpty();
        Request stored = h.fx.reloadRequest(request.id);
        assertThat(stored.status).isEqualTo(RequestStatus.ANSWERED);
        assertThat(stored.answerText).isEqualTo("Write a claim to the district court.");
        assertThat(stored.answeredBy).isEqualTo(FULFILLER);

        List<OutboundMessage> toReviewers = EngineHarness.to(sent, Channel.REVIEWERS);
        assertThat(toReviewers).hasSize(1);
        assertThat(toReviewers.get(0).text()).contains("district court");
        assertThat(toReviewers.get(0).actions()).extracting(ActionButton::data)
                .containsExactly("approve_answer:" + request.id, "decline_answer:" + request.id);
    }

    @Test
    void confirmBeforeWritingAsksForTheAnswer() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        assertThat(engine.handleAction(ActionName.CONFIRM_ANSWER, null, FULFILLER).tag()).isEqualTo("rejected:answer_missing");
        assertThat(engine.submitText(FULFILLER, "   ").tag()).isEqualTo("rejected:empty_answer");
        assertThat(h.state(FULFILLER)).isEqualTo(SessionState.WRITING_ANSWER);
    }

    @Test
    void confirmWithoutAssignmentIsNoActiveAssignment() {
        assertThat(engine.handleAction(ActionName.CONFIRM_ANSWER, null, OTHER).tag())
                .isEqualTo("conflict:no_active_assignment");
    }

    @Test
    void rejectReturnsRequestToPool() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);
        engine.submitText(FULFILLER, "Draft");

        ConversationOutcome out = engine.submitText(FULFILLER, h.label(ActionName.REJECT_ASSIGNMENT));

        assertThat(out.tag()).isEqualTo("ok");
        assertThat(h.sessions.get(FULFILLER)).isEmpty();
        assertThat(h.fx.reloadRequest(request.id).status).isEqualTo(RequestStatus.APPROVED);
        assertThat(h.fx.reload(FULFILLER).currentAssignmentId).isNull();
        List<OutboundMessage> offers = EngineHarness.to(out, Channel.FULFILLERS);
        assertThat(offers).hasSize(1);
        assertThat(offers.get(0).actions()).extracting(ActionButton::data).containsExactly("take:" + request.id);

        // and someone else may take it now
        assertThat(engine.handleAction(ActionName.TAKE, request.id, OTHER, OFFER).isOk()).isTrue();
    }

    @Test
    void lateTakerFindsItHandled() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        ConversationOutcome out = engine.handleAction(ActionName.TAKE, request.id, OTHER, OFFER);

        assertThat(out.tag()).isEqualTo("conflict:already_handled");
        assertThat(out.notice()).isEqualTo(h.en("errors.already_handled"));
        assertThat(out.messages()).isEmpty();
        assertThat(h.sessions.get(OTHER)).isEmpty();
        assertThat(h.fx.reloadRequest(request.id).fulfillerId).isEqualTo(FULFILLER);
        assertThat(h.state(FULFILLER)).isEqualTo(SessionState.WRITING_ANSWER);
    }

    @Test
    void holderCannotTakeAnother() {
        Request second = h.fx.approved(REQUESTER, family);
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        ConversationOutcome out = engine.handleAction(ActionName.TAKE, second.id, FULFILLER, OFFER);

        assertThat(out.tag()).isEqualTo("conflict:assignment_conflict");
        assertThat(h.sessions.get(FULFILLER).map(Session::requestId)).contains(request.id);
        assertThat(h.fx.reloadRequest(second.id).status).isEqualTo(RequestStatus.APPROVED);
    }

    @Test
    void sessionForALostRequestIsStale() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);
        h.fx.requests.release(request.id, FULFILLER);

        ConversationOutcome out = engine.submitText(FULFILLER, "My answer");

        assertThat(out.tag()).isEqualTo("conflict:stale_session");
        assertThat(out.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.CLEARED);
        assertThat(h.sessions.get(FULFILLER)).isEmpty();
        assertThat(h.fx.reloadRequest(request.id).answerText).isNull();
    }

    @Test
    void backKeepsAssignmentAndEditResumesIt() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        ConversationOutcome back = engine.handleAction(ActionName.BACK, null, FULFILLER);
        assertThat(back.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.CLEARED);
        assertThat(h.fx.reload(FULFILLER).currentAssignmentId).isEqualTo(request.id);

        ConversationOutcome resumed = engine.handleAction(ActionName.EDIT_ANSWER, null, FULFILLER);

        assertThat(resumed.isOk()).isTrue();
        Session s = h.sessions.get(FULFILLER).orElseThrow();
        assertThat(s.state()).isEqualTo(SessionState.WRITING_ANSWER);
        assertThat(s.requestId()).isEqualTo(request.id);
    }

    @Test
    void backFromCheckingDropsTheDraft() {
        engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);
        engine.submitText(FULFILLER, "First draft");

        engine.handleAction(ActionName.BACK, null, FULFILLER);

        Session s = h.sessions.get(FULFILLER).orElseThrow();
        assertThat(s.state()).isEqualTo(SessionState.WRITING_ANSWER);
        assertThat(s.draftText()).isNull();
    }

    @Test
    void reviewerCannotTake() {
        h.fx.actor(DbFixture.REVIEWER);

        assertThat(engine.handleAction(ActionName.TAKE, request.id, DbFixture.REVIEWER, OFFER).tag())
                .isEqualTo("rejected:not_allowed");
        assertThat(h.fx.reloadRequest(request.id).status).isEqualTo(RequestStatus.APPROVED);
    }

    @Test
    void repeatedTakeByWinnerKeepsTheAnswerSession() {
        ConversationOutcome first = engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);
        ConversationOutcome second = engine.handleAction(ActionName.TAKE, request.id, FULFILLER, OFFER);

        assertThat(first.isOk()).isTrue();
        assertThat(second.tag()).isEqualTo("conflict:already_handled");
        assertThat(second.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.UNCHANGED);
        assertThat(second.notice()).isEqualTo(h.en("notices.already_yours"));
        assertThat(second.messages()).isEmpty();
        assertThat(h.state(FULFILLER)).isEqualTo(SessionState.WRITING_ANSWER);

        ConversationOutcome written = engine.submitText(FULFILLER, "Ask the landlord for a written receipt.");

        assertThat(written.isOk()).isTrue();
        assertThat(h.state(FULFILLER)).isEqualTo(SessionState.CONFIRMING_ANSWER);
    }
}
