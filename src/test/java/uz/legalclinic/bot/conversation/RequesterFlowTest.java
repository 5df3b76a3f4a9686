package uz.legalclinic.bot.conversation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uz.legalclinic.bot.DbFixture;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.model.RequestStatus;
import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.notify.Channel;
import uz.legalclinic.bot.notify.OutboundMessage;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RequesterFlowTest {

    private static final long REQUESTER = 1L;
    private static final String QUESTION = "My employer has not paid my salary for three months.";

    @TempDir
    Path dir;

    private EngineHarness h;
    private ConversationEngine engine;
    private Category family;

    @BeforeEach
    void setUp() throws Exception {
        h = new EngineHarness(dir);
        engine = h.engine;
        family = h.fx.category("Family");
        h.fx.category("Labour");
        h.fx.actor(REQUESTER);
    }

    @Test
    void roundTripCreatesPendingRequestAndNotifiesReviewers() {
        ConversationOutcome asked = engine.submitText(REQUESTER, h.label(ActionName.ASK));
        assertThat(asked.tag()).isEqualTo("ok");
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.SELECTING_CATEGORY);
        assertThat(EngineHarness.toActor(asked, REQUESTER).get(0).options())
                .contains("Family", "Labour", h.label(ActionName.BACK));

        assertThat(engine.submitText(REQUESTER, "Family").isOk()).isTrue();
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.ENTERING_REQUEST);

        assertThat(engine.submitText(REQUESTER, QUESTION).isOk()).isTrue();
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.CONFIRMING_REQUEST);

        ConversationOutcome confirmed = engine.handleAction(ActionName.CONFIRM, null, REQUESTER);

        assertThat(confirmed.tag()).isEqualTo("ok");
        assertThat(confirmed.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.CLEARED);
        assertThat(h.sessions.get(REQUESTER)).isEmpty();

        List<Request> mine = h.fx.requests.findByRequester(REQUESTER);
        assertThat(mine).hasSize(1);
        Request r = mine.get(0);
        assertThat(r.status).isEqualTo(RequestStatus.PENDING);
        assertThat(r.text).isEqualTo(QUESTION);
        assertThat(r.categoryId).isEqualTo(family.id);

        List<OutboundMessage> toReviewers = EngineHarness.to(confirmed, Channel.REVIEWERS);
        assertThat(toReviewers).hasSize(1);
        assertThat(toReviewers.get(0).text()).contains("#" + r.id).contains("#family");
        assertThat(toReviewers.get(0).actions()).extracting(ActionButton::data)
                .containsExactly("approve:" + r.id, "decline:" + r.id);
        assertThat(EngineHarness.toActor(confirmed, REQUESTER)).hasSize(1);
    }

    @Test
    void tooShortTextKeepsTheStep() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);
        engine.submitText(REQUESTER, "Family");

        ConversationOutcome out = engine.submitText(REQUESTER, "  help me  ");

        assertThat(out.tag()).isEqualTo("rejected:too_short");
        assertThat(EngineHarness.toActor(out, REQUESTER).get(0).text())
                .contains(String.valueOf(DbFixture.MIN_LENGTH)).contains("7");
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.ENTERING_REQUEST);
    }

    @Test
    void unknownCategoryIsRejected() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);

        ConversationOutcome out = engine.submitText(REQUESTER, "Astrology");

        assertThat(out.tag()).isEqualTo("rejected:category_not_found");
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.SELECTING_CATEGORY);
    }

    @Test
    void askWithoutCategoriesIsRejected() throws Exception {
        EngineHarness empty = new EngineHarness(dir.resolve("empty"));
        empty.fx.actor(REQUESTER);

        ConversationOutcome out = empty.engine.handleAction(ActionName.ASK, null, REQUESTER);

        assertThat(out.tag()).isEqualTo("rejected:no_categories");
        assertThat(empty.sessions.get(REQUESTER)).isEmpty();
    }

    @Test
    void editLoopsBackToTextEntry() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);
        engine.submitText(REQUESTER, "Family");
        engine.submitText(REQUESTER, QUESTION);

        ConversationOutcome edited = engine.submitText(REQUESTER, h.label(ActionName.EDIT));

        assertThat(edited.isOk()).isTrue();
        Session s = h.sessions.get(REQUESTER).orElseThrow();
        assertThat(s.state()).isEqualTo(SessionState.ENTERING_REQUEST);
        assertThat(s.draftText()).isNull();
        assertThat(s.categoryId()).isEqualTo(family.id);

        String corrected = QUESTION + " The contract is signed.";
        engine.submitText(REQUESTER, corrected);
        engine.handleAction(ActionName.CONFIRM, null, REQUESTER);

        assertThat(h.fx.requests.findByRequester(REQUESTER)).extracting(r -> r.text).containsExactly(corrected);
    }

    @Test
    void backWalksOneStepAtATime() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);
        engine.submitText(REQUESTER, "Family");
        engine.submitText(REQUESTER, QUESTION);

        engine.handleAction(ActionName.BACK, null, REQUESTER);
        Session s = h.sessions.get(REQUESTER).orElseThrow();
        assertThat(s.state()).isEqualTo(SessionState.ENTERING_REQUEST);
        assertThat(s.categoryId()).isEqualTo(family.id);

        engine.handleAction(ActionName.BACK, null, REQUESTER);
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.SELECTING_CATEGORY);

        ConversationOutcome out = engine.handleAction(ActionName.BACK, null, REQUESTER);
        assertThat(out.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.CLEARED);
        assertThat(h.sessions.get(REQUESTER)).isEmpty();
        assertThat(h.fx.requests.findByRequester(REQUESTER)).isEmpty();
    }

    @Test
    void repeatedConfirmCreatesOneRequest() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);
        engine.submitText(REQUESTER, "Family");
        engine.submitText(REQUESTER, QUESTION);

        assertThat(engine.handleAction(ActionName.CONFIRM, null, REQUESTER).isOk()).isTrue();
        assertThat(engine.handleAction(ActionName.CONFIRM, null, REQUESTER).tag()).isEqualTo("unhandled");

        assertThat(h.fx.requests.findByRequester(REQUESTER)).hasSize(1);
    }

    @Test
    void concurrentConfirmsCreateOneRequest() throws Exception {
        engine.handleAction(ActionName.ASK, null, REQUESTER);
        engine.submitText(REQUESTER, "Family");
        engine.submitText(REQUESTER, QUESTION);

        int threads = 6;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ConversationOutcome>> results = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            results.add(pool.submit(() -> {
                start.await();
                return engine.handleAction(ActionName.CONFIRM, null, REQUESTER);
            }));
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        int ok = 0;
        for (Future<ConversationOutcome> f : results) {
            ConversationOutcome out = f.get();
            if (out.isOk()) ok++;
            else assertThat(out.tag()).isIn("conflict:duplicate", "unhandled");
        }
        assertThat(ok).isEqualTo(1);
        assertThat(h.fx.requests.findByRequester(REQUESTER)).hasSize(1);
    }

    @Test
    void textWithoutSessionIsUnhandled() {
        assertThat(engine.submitText(REQUESTER, "hello").tag()).isEqualTo("unhandled");
        assertThat(engine.fallback(REQUESTER).isOk()).isTrue();
    }

    @Test
    void labelsOfAnyLanguageAreSignals() {
        ConversationOutcome out = engine.submitText(REQUESTER, h.tr.resolve("buttons.ask", "ru"));

        assertThat(out.isOk()).isTrue();
        assertThat(h.state(REQUESTER)).isEqualTo(SessionState.SELECTING_CATEGORY);
    }

    @Test
    void mainMenuDropsUnfinishedConversation() {
        engine.handleAction(ActionName.ASK, null, REQUESTER);

        ConversationOutcome out = engine.mainMenu(REQUESTER);

        assertThat(out.sessionChange()).isEqualTo(ConversationOutcome.SessionChange.CLEARED);
        assertThat(h.sessions.get(REQUESTER)).isEmpty();
        assertThat(EngineHarness.toActor(out, REQUESTER).get(0).options())
                .containsExactly(h.label(ActionName.ASK), h.label(ActionName.MY_REQUESTS), h.label(ActionName.HELP));
    }

    @Test
    void bannedActorIsRejected() {
        h.fx.actors.setBanned(REQUESTER, true);

        assertThat(engine.handleAction(ActionName.ASK, null, REQUESTER).tag()).isEqualTo("rejected:banned");
        assertThat(engine.submitText(REQUESTER, "anything").tag()).isEqualTo("rejected:banned");
    }

    @Test
    void reviewerCannotAsk() {
        h.fx.actor(DbFixture.REVIEWER);

        assertThat(engine.handleAction(ActionName.ASK, null, DbFixture.REVIEWER).tag()).isEqualTo("rejected:not_allowed");
    }

    @Test
    void unknownActorIsNotFound() {
        assertThat(engine.handleAction(ActionName.HELP, null, 777L).tag()).isEqualTo("rejected:not_found");
    }

    @Test
    void languageChangeSwitchesTexts() {
        assertThat(engine.changeLanguage(REQUESTER, "de").tag()).isEqualTo("rejected:unsupported_locale");

        ConversationOutcome out = engine.changeLanguage(REQUESTER, "ru");

        assertThat(out.isOk()).isTrue();
        assertThat(h.fx.reload(REQUESTER).language).isEqualTo("ru");
        assertThat(EngineHarness.toActor(out, REQUESTER).get(0).options())
                .contains(h.tr.resolve("buttons.ask", "ru"));
    }

    @Test
    void newcomerPicksLanguageAndAcceptsTermsBeforeAsking() {
        long newcomer = 4L;
        h.fx.newcomer(newcomer);

        ConversationOutcome start = engine.mainMenu(newcomer);
        OutboundMessage picker = EngineHarness.toActor(start, newcomer).get(0);
        assertThat(picker.actions()).extracting(ActionButton::data)
                .containsExactly("onboard:ru", "onboard:uz", "onboard:en");
        assertThat(picker.text())
                .contains(h.tr.resolve("onboarding.welcome", "ru"))
                .contains(h.tr.resolve("onboarding.welcome", "en"));

        ConversationOutcome early = engine.handleAction(ActionName.ASK, null, newcomer);
        assertThat(early.tag()).isEqualTo("rejected:offer_not_accepted");
        assertThat(EngineHarness.toActor(early, newcomer).get(0).actions()).extracting(ActionButton::data)
                .containsExactly("offer:accept", "offer:decline");
        assertThat(h.sessions.get(newcomer)).isEmpty();

        ConversationOutcome offer = engine.onboardingLanguage(newcomer, "ru");
        assertThat(EngineHarness.toActor(offer, newcomer).get(0).text())
                .isEqualTo(h.tr.resolve("onboarding.offer_text", "ru"));
        assertThat(h.fx.reload(newcomer).language).isEqualTo("ru");

        ConversationOutcome declined = engine.answerOffer(newcomer, false);
        assertThat(declined.isOk()).isTrue();
        assertThat(EngineHarness.toActor(declined, newcomer).get(0).actions()).hasSize(2);
        assertThat(h.fx.reload(newcomer).offerAccepted).isFalse();

        ConversationOutcome accepted = engine.answerOffer(newcomer, true);
        assertThat(accepted.isOk()).isTrue();
        assertThat(h.fx.reload(newcomer).offerAccepted).isTrue();
        assertThat(EngineHarness.toActor(accepted, newcomer).get(0).options())
                .contains(h.tr.resolve("buttons.ask", "ru"));

        assertThat(engine.handleAction(ActionName.ASK, null, newcomer).isOk()).isTrue();
        assertThat(h.state(newcomer)).isEqualTo(SessionState.SELECTING_CATEGORY);
    }

    @Test
    void acceptedActorGetsMenuOnStartAndRepeatedAcceptIsQuiet() {
        ConversationOutcome again = engine.answerOffer(REQUESTER, true);

        assertThat(again.isOk()).isTrue();
        assertThat(again.messages()).isEmpty();
        assertThat(EngineHarness.toActor(engine.mainMenu(REQUESTER), REQUESTER).get(0).actions()).isEmpty();
    }

    @Test
    void reviewersSkipOnboarding() {
        h.fx.newcomer(DbFixture.REVIEWER);

        ConversationOutcome out = engine.mainMenu(DbFixture.REVIEWER);

        assertThat(EngineHarness.toActor(out, DbFixture.REVIEWER).get(0).options())
                .contains(h.label(ActionName.REVIEW_STATS));
    }
}
