package uz.legalclinic.bot.conversation;

import uz.legalclinic.bot.DbFixture;
import uz.legalclinic.bot.i18n.JsonTranslator;
import uz.legalclinic.bot.i18n.Translator;
import uz.legalclinic.bot.notify.Channel;
import uz.legalclinic.bot.notify.OutboundMessage;
import uz.legalclinic.bot.session.InMemorySessionStore;
import uz.legalclinic.bot.session.Session;
import uz.legalclinic.bot.session.SessionState;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Engine wired over a temp database with the bundled en/ru/uz texts.
 */
final class EngineHarness {

    final DbFixture fx;
    final Translator tr;
    final InMemorySessionStore sessions = new InMemorySessionStore();
    final ConversationEngine engine;

    EngineHarness(Path dir) throws Exception {
        this.fx = DbFixture.create(dir);
        this.tr = JsonTranslator.load("en");
        this.engine = new ConversationEngine(fx.cfg, tr, sessions, fx.actors, fx.categories, fx.requests, fx.coordinator);
    }

    String en(String key) {
        return tr.resolve(key, "en");
    }

    String label(ActionName action) {
        return en(action.labelKey());
    }

    SessionState state(long actorId) {
        return sessions.get(actorId).map(Session::state).orElse(null);
    }

    static List<OutboundMessage> to(ConversationOutcome out, Channel channel) {
        return out.messages().stream()
                .filter(m -> m.kind() == OutboundMessage.Kind.SEND && m.destination().channel() == channel)
                .collect(Collectors.toList());
    }

    static List<OutboundMessage> toActor(ConversationOutcome out, long actorId) {
        return out.messages().stream()
                .filter(m -> m.kind() == OutboundMessage.Kind.SEND
                        && m.destination().channel() == Channel.PRIVATE
                        && m.destination().actorId() == actorId)
                .collect(Collectors.toList());
    }

    static List<OutboundMessage> edits(ConversationOutcome out) {
        return out.messages().stream()
                .filter(m -> m.kind() == OutboundMessage.Kind.EDIT)
                .collect(Collectors.toList());
    }
}
