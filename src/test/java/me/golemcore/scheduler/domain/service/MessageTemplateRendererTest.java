package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.exception.RenderException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MessageTemplateRendererTest {

    private final MessageTemplateRenderer renderer = new MessageTemplateRenderer();

    @Test
    void shouldSubstituteVariables() {
        String result = renderer.render("Hi {{user}}, standup in {{ room }}", Map.of("user", "alice", "room", "general"));

        assertEquals("Hi alice, standup in general", result);
    }

    @Test
    void shouldLeaveUnknownPlaceholders() {
        assertEquals("Hi {{nobody}}", renderer.render("Hi {{nobody}}", Map.of("user", "alice")));
    }

    @Test
    void shouldReturnTemplateWithoutContext() {
        assertEquals("plain {{user}}", renderer.render("plain {{user}}", Map.of()));
        assertEquals("plain", renderer.render("plain", null));
    }

    @Test
    void shouldNotInterpretReplacementCharacters() {
        assertEquals("cost $5 \\o/", renderer.render("cost {{price}}", Map.of("price", "$5 \\o/")));
    }

    @Test
    void shouldRejectUnterminatedPlaceholder() {
        assertThrows(RenderException.class, () -> renderer.render("Hi {{user", Map.of("user", "alice")));
        assertThrows(RenderException.class, () -> renderer.render("{{a}} and {{b", Map.of()));
    }

    @Test
    void shouldRejectNullTemplate() {
        assertThrows(RenderException.class, () -> renderer.render(null, Map.of()));
    }
}
