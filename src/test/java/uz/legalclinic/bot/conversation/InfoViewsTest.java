package uz.legalclinic.bot.conversation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uz.legalclinic.bot.DbFixture;
import uz.legalclinic.bot.config.Config;
import uz.legalclinic.bot.model.Category;
import uz.legalclinic.bot.model.Request;
import uz.legalclinic.bot.notify.OutboundMessage;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class InfoViewsTest {

    private static final long REQUESTER = 1L;
    private static final long FULFILLER = 2L;

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
        h.fx.actor(REQUESTER);
        h.fx.actor(FULFILLER);
    }

    @Test
    void myRequestsShowsStatusAndDeclineReason() {
        Request declined = h.fx.pending(REQUESTER, family);
        h.fx.requests.decline(declined.id, "Not a legal matter");
        Request open = h.fx.pending(REQUESTER, family);

        ConversationOutcome out = engine.handleAction(ActionName.MY_REQUESTS, null, REQUESTER);

        List<OutboundMessage> msgs = EngineHarness.toActor(out, REQUESTER);
        assertThat(msgs).hasSize(1);
        assertThat(msgs.get(0).text())
                .contains("#" + declined.id, "#" + open.id)
                .contains(h.en("status.declined"), h.en("status.pending"))
                .contains("Not a legal matter");
    }

    @Test
    void emptyListsSayNothingYet() {
        assertThat(EngineHarness.toActor(engine.handleAction(ActionName.MY_REQUESTS, null, REQUESTER), REQUESTER)
                .get(0).text()).isEqualTo(h.en("lists.no_requests"));
        assertThat(EngineHarness.toActor(engine.handleAction(ActionName.MY_ANSWERS, null, FULFILLER), FULFILLER)
                .get(0).text()).isEqualTo(h.en("lists.no_answers"));
    }

    @Test
    void longListsAreSplitAcrossMessages() throws Exception {
        Map<String, String> env = DbFixture.settings(dir.resolve("small"));
        env.put("MAX_MESSAGE_LEN", "300");
        DbFixture small = DbFixture.create(dir.resolve("small"));
        ConversationEngine narrow = new ConversationEngine(Config.from(env::get), h.tr,
                h.sessions, small.actors, small.categories, small.requests, small.coordinator);
        Category c = small.category("Family");
        for (int i = 0; i < 6; i++) small.pending(REQUESTER, c);

        ConversationOutcome out = narrow.handleAction(ActionName.MY_REQUESTS, null, REQUESTER);

        List<OutboundMessage> msgs = EngineHarness.toActor(out, REQUESTER);
        assertThat(msgs.size()).isGreaterThan(1);
        assertThat(msgs).allSatisfy(m -> assertThat(m.text().length()).isLessThanOrEqualTo(300));
    }

    @Test
    void myAnswersListsAnsweredRequests() {
        Request r = h.fx.answered(REQUESTER, family, FULFILLER);

        ConversationOutcome out = engine.handleAction(ActionName.MY_ANSWERS, null, FULFILLER);

        assertThat(EngineHarness.toActor(out, FULFILLER).get(0).text())
                .contains("#" + r.id)
                .contains("claim the deposit");
    }

    @Test
    void currentAssignmentShowsHeldRequest() {
        Request r = h.fx.assigned(REQUESTER, family, FULFILLER);

        ConversationOutcome out = engine.handleAction(ActionName.CURRENT_ASSIGNMENT, null, FULFILLER);

        assertThat(out.isOk()).isTrue();
        OutboundMessage msg = EngineHarness.toActor(out, FULFILLER).get(0);
        assertThat(msg.text()).contains("#" + r.id).contains(h.en("status.assigned"));
        assertThat(msg.options()).contains(h.label(ActionName.EDIT_ANSWER), h.label(ActionName.REJECT_ASSIGNMENT));
    }

    @Test
    void currentAssignmentWithoutOneIsConflict() {
        assertThat(engine.handleAction(ActionName.CURRENT_ASSIGNMENT, null, FULFILLER).tag())
                .isEqualTo("conflict:no_active_assignment");
    }

    @Test
    void danglingAssignmentIsRepaired() throws Exception {
        Request r = h.fx.assigned(REQUESTER, family, FULFILLER);
        h.fx.deleteRequestRow(r.id);

        ConversationOutcome out = engine.handleAction(ActionName.CURRENT_ASSIGNMENT, null, FULFILLER);

        assertThat(out.tag()).isEqualTo("rejected:not_found");
        assertThat(h.fx.reload(FULFILLER).currentAssignmentId).isNull();
    }

    @Test
    void fulfillerStatsReportCompletionRate() {
        Request closed = h.fx.answered(REQUESTER, family, FULFILLER);
        h.fx.requests.close(closed.id);

        ConversationOutcome out = engine.handleAction(ActionName.FULFILLER_STATS, null, FULFILLER);

        assertThat(EngineHarness.toActor(out, FULFILLER).get(0).text()).contains("100%");
    }

    @Test
    void helpDependsOnRole() {
        h.fx.actor(DbFixture.REVIEWER);

        assertThat(EngineHarness.toActor(engine.handleAction(ActionName.HELP, null, REQUESTER), REQUESTER)
                .get(0).text()).isEqualTo(h.en("help.requester"));
        assertThat(EngineHarness.toActor(engine.handleAction(ActionName.HELP, null, DbFixture.REVIEWER), DbFixture.REVIEWER)
                .get(0).text()).isEqualTo(h.en("help.reviewer"));

        h.fx.assigned(REQUESTER, family, FULFILLER);
        assertThat(EngineHarness.toActor(engine.handleAction(ActionName.HELP, null, FULFILLER), FULFILLER)
                .get(0).text()).isEqualTo(h.en("help.fulfiller"));
    }
}
