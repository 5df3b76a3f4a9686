package uz.legalclinic.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;
import uz.legalclinic.bot.config.Config;
import uz.legalclinic.bot.conversation.ConversationEngine;
import uz.legalclinic.bot.db.Database;
import uz.legalclinic.bot.db.Schema;
import uz.legalclinic.bot.i18n.JsonTranslator;
import uz.legalclinic.bot.i18n.Translator;
import uz.legalclinic.bot.service.ActorService;
import uz.legalclinic.bot.service.AssignmentCoordinator;
import uz.legalclinic.bot.service.CategoryService;
import uz.legalclinic.bot.service.RequestService;
import uz.legalclinic.bot.session.InMemorySessionStore;
import uz.legalclinic.bot.telegram.LegalClinicBot;

import java.util.Set;

public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws Exception {
        Config cfg = Config.load();
        Set<String> missing = cfg.missingRequired();
        if (!missing.isEmpty()) {
            log.error("Missing required configuration: {}", missing);
            System.exit(2);
        }
        log.info("Database at {}", cfg.dbPath().toAbsolutePath());

        Database db = new Database(cfg);
        Schema.migrate(db);

        // --- Services ---
        ActorService actorService = new ActorService(db);
        CategoryService categoryService = new CategoryService(db);
        RequestService requestService = new RequestService(db);
        AssignmentCoordinator coordinator = new AssignmentCoordinator(requestService, actorService);

        Translator translator = JsonTranslator.load(cfg.defaultLocale());
        ConversationEngine engine = new ConversationEngine(
                cfg,
                translator,
                new InMemorySessionStore(),
                actorService,
                categoryService,
                requestService,
                coordinator
        );

        LegalClinicBot bot = new LegalClinicBot(cfg, actorService, engine, translator);

        TelegramBotsApi api = new TelegramBotsApi(DefaultBotSession.class);
        api.registerBot(bot);
        Runtime.getRuntime().addShutdownHook(new Thread(bot::shutdown, "legal-clinic-shutdown"));

        log.info("Legal clinic bot started. Timezone={} locale={} workers={}",
                cfg.zoneId(), cfg.defaultLocale(), cfg.workerThreads());
    }
}
