package me.golemcore.scheduler.infrastructure.i18n;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageServiceTest {

    private static final String KEY_CANCELED = "command.reminder.canceled";

    private MessageService messageService;

    @BeforeEach
    void setUp() {
        messageService = new MessageService();
    }

    @Test
    void shouldReturnEnglishMessageByDefault() {
        assertEquals("Reminder 42 canceled.", messageService.getMessage(KEY_CANCELED, "42"));
    }

    @Test
    void shouldReturnRussianMessageWhenLanguageSetToRu() {
        messageService.setLanguage("ru");

        String result = messageService.getMessage(KEY_CANCELED, "42");

        assertEquals("\u041D\u0430\u043F\u043E\u043C\u0438\u043D\u0430\u043D\u0438\u0435 42 "
                + "\u043E\u0442\u043C\u0435\u043D\u0435\u043D\u043E.", result);
    }

    @Test
    void shouldReturnKeyWhenMessageNotFound() {
        assertEquals("nonexistent.key", messageService.getMessage("nonexistent.key"));
    }

    @Test
    void shouldKeepApostrophesInFormattedMessages() {
        String result = messageService.getMessage("command.room.unavailable", "en", "ops");

        assertEquals("Sorry, I'm not in the ops room, or maybe you mistyped?", result);
    }

    @Test
    void shouldReturnUnformattedMessageWithoutArguments() {
        assertEquals("Sorry, that's a private room. Its jobs can only be managed from within it.",
                messageService.getMessage("command.room.private"));
    }

    @Test
    void shouldFallBackToEnglishForUnsupportedLanguage() {
        messageService.setLanguage("de");

        assertEquals("en", messageService.getLanguage());
        assertEquals("Reminder 42 canceled.", messageService.getMessage(KEY_CANCELED, "42"));
    }

    @Test
    void shouldReportSupportedLanguages() {
        assertTrue(messageService.isSupported("en"));
        assertTrue(messageService.isSupported("ru"));
        assertFalse(messageService.isSupported("de"));
    }
}
