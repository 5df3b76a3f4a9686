package uz.legalclinic.bot.telegram;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import uz.legalclinic.bot.config.Config;
import uz.legalclinic.bot.conversation.ActionName;
import uz.legalclinic.bot.conversation.ConversationEngine;
import uz.legalclinic.bot.conversation.ConversationOutcome;
import uz.legalclinic.bot.i18n.Translator;
import uz.legalclinic.bot.notify.ActionButton;
import uz.legalclinic.bot.notify.DeliveryException;
import uz.legalclinic.bot.notify.MessageRef;
import uz.legalclinic.bot.notify.NotificationRouter;
import uz.legalclinic.bot.notify.Notifier;
import uz.legalclinic.bot.service.ActorService;
import uz.legalclinic.bot.util.Html;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Long-polling transport. Every update runs as its own task on a fixed pool; the engine copes with
 * overlapping tasks, including two deliveries of the same tap.
 */
public final class LegalClinicBot extends TelegramLongPollingBot implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LegalClinicBot.class);

    private final Config cfg;
    private final ActorService actors;
    private final ConversationEngine engine;
    private final Translator tr;
    private final NotificationRouter router;
    private final ExecutorService workers;

    public LegalClinicBot(Config cfg, ActorService actors, ConversationEngine engine, Translator tr) {
        super(cfg.botToken());
        this.cfg = cfg;
        this.actors = actors;
        this.engine = engine;
        this.tr = tr;
        this.router = new NotificationRouter(cfg, this);

        AtomicInteger n = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(cfg.workerThreads(), r -> {
            Thread t = new Thread(r, "legal-clinic-worker-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            execute(new SetMyCommands(List.of(
                    new BotCommand("/start", "Main menu"),
                    new BotCommand("/help", "Help"),
                    new BotCommand("/language", "Language")
            ), null, null));
        } catch (TelegramApiException e) {
            log.warn("Could not register bot commands: {}", e.getMessage());
        }
    }

    @Override
    public String getBotUsername() {
        return cfg.botUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        workers.submit(() -> {
            try {
                if (update.hasCallbackQuery()) {
                    onCallback(update.getCallbackQuery());
                    return;
                }
                if (update.hasMessage()) {
                    onMessage(update.getMessage());
                }
            } catch (Exception e) {
                log.error("Update {} failed", update.getUpdateId(), e);
            }
        });
    }

    public void shutdown() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) workers.shutdownNow();
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void onMessage(Message msg) {
        if (msg.getFrom() == null) return;
        User from = msg.getFrom();
        long tgId = from.getId();
        long chatId = msg.getChatId();
        actors.getOrCreate(tgId, from.getUserName(), from.getFirstName(), from.getLastName());

        String text = msg.getText();
        if (text == null) return;
        boolean privateChat = msg.isUserMessage();

        if (text.startsWith("/")) {
            onCommand(tgId, privateChat, text.trim());
            return;
        }

        // the fulfillers chat is driven by buttons only
        if (chatId == cfg.fulfillerChatId()) return;
        if (!privateChat && chatId != cfg.reviewerChatId()) return;

        ConversationOutcome out = engine.submitText(tgId, text);
        if (out.result() == ConversationOutcome.Result.UNHANDLED) {
            if (!privateChat) return;
            out = engine.fallback(tgId);
        }
        deliver(tgId, out);
    }

    private void onCommand(long tgId, boolean privateChat, String text) {
        String[] parts = text.split("\\s+", 2);
        String command = parts[0];
        int at = command.indexOf('@');
        if (at > 0) command = command.substring(0, at);
        String arg = parts.length > 1 ? parts[1].trim() : "";

        ConversationOutcome out;
        switch (command) {
            case "/start" -> {
                if (!privateChat) return;
                out = engine.mainMenu(tgId);
            }
            case "/help" -> out = engine.handleAction(ActionName.HELP, null, tgId);
            case "/language" -> out = engine.languagePrompt(tgId);
            case "/add_category" -> out = engine.handleAction(ActionName.ADD_CATEGORY, null, tgId);
            case "/categories" -> out = engine.handleAction(ActionName.CATEGORIES, null, tgId);
            case "/stats" -> out = engine.handleAction(ActionName.REVIEW_STATS, null, tgId);
            case "/ban", "/unban" -> {
                Optional<Long> target = parseId(arg);
                if (target.isEmpty()) return;
                out = engine.setBanned(tgId, target.get(), command.equals("/ban"));
            }
            default -> {
                return;
            }
        }
        deliver(tgId, out);
    }

    private void onCallback(CallbackQuery cb) {
        if (cb.getFrom() == null || cb.getMessage() == null) return;
        User from = cb.getFrom();
        long tgId = from.getId();
        long chatId = cb.getMessage().getChatId();
        MessageRef origin = new MessageRef(chatId, cb.getMessage().getMessageId());
        String data = cb.getData();
        actors.getOrCreate(tgId, from.getUserName(), from.getFirstName(), from.getLastName());

        if (CallbackData.isLanguage(data) || CallbackData.isOnboarding(data) || CallbackData.isOffer(data)) {
            ConversationOutcome out;
            if (CallbackData.isLanguage(data)) out = engine.changeLanguage(tgId, CallbackData.locale(data));
            else if (CallbackData.isOnboarding(data)) out = engine.onboardingLanguage(tgId, CallbackData.locale(data));
            else out = engine.answerOffer(tgId, data.equals(ConversationEngine.OFFER_ACCEPT));
            deliver(tgId, out);
            answer(cb.getId(), out.notice(), false);
            return;
        }

        Optional<CallbackData.Parsed> parsed = CallbackData.parse(data);
        if (parsed.isEmpty()) {
            log.debug("Unknown callback data '{}' from {}", data, tgId);
            answer(cb.getId(), null, false);
            return;
        }
        CallbackData.Parsed p = parsed.get();
        if (p.action == ActionName.TAKE && chatId != cfg.fulfillerChatId()) {
            answer(cb.getId(), tr.resolve("errors.take_outside_fulfiller_chat", tr.defaultLocale()), true);
            return;
        }

        ConversationOutcome out = engine.handleAction(p.action, p.target, tgId, origin);
        deliver(tgId, out);
        answer(cb.getId(), out.notice(), !out.isOk());
    }

    private void deliver(long tgId, ConversationOutcome out) {
        log.debug("outcome actor={} tag={} messages={}", tgId, out.tag(), out.messages().size());
        router.deliver(out.messages());
    }

    // --- Notifier ---

    @Override
    public MessageRef send(long chatId, String text, List<ActionButton> actions, List<String> options) {
        SendMessage m = new SendMessage();
        m.setChatId(chatId);
        m.setText(limit(text));
        m.setParseMode(ParseMode.HTML);
        if (!actions.isEmpty()) m.setReplyMarkup(Keyboards.inline(actions));
        else if (!options.isEmpty()) m.setReplyMarkup(Keyboards.reply(options));
        try {
            Message sent = execute(m);
            return new MessageRef(sent.getChatId(), sent.getMessageId());
        } catch (TelegramApiException e) {
            throw new DeliveryException("Failed to send to chat " + chatId, e);
        }
    }

    @Override
    public void edit(MessageRef ref, String text, List<ActionButton> actions) {
        EditMessageText em = new EditMessageText();
        em.setChatId(ref.chatId());
        em.setMessageId(ref.messageId());
        em.setText(limit(text));
        em.setParseMode(ParseMode.HTML);
        em.setReplyMarkup(Keyboards.inline(actions));
        try {
            execute(em);
        } catch (TelegramApiException e) {
            throw new DeliveryException("Failed to edit " + ref, e);
        }
    }

    // --- small helpers ---

    private void answer(String cbId, String text, boolean alert) {
        AnswerCallbackQuery a = new AnswerCallbackQuery();
        a.setCallbackQueryId(cbId);
        if (text != null) a.setText(Html.truncate(text, 200));
        a.setShowAlert(alert && text != null);
        try {
            execute(a);
        } catch (TelegramApiException e) {
            log.debug("Callback answer failed: {}", e.getMessage());
        }
    }

    private String limit(String text) {
        return Html.truncateHtml(text, cfg.maxMessageLen());
    }

    private static Optional<Long> parseId(String s) {
        try {
            return Optional.of(Long.parseLong(s));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
