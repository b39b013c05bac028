package me.golemcore.scheduler.infrastructure.config;

import me.golemcore.scheduler.adapter.outbound.delivery.LoggingDeliveryAdapter;
import me.golemcore.scheduler.infrastructure.i18n.MessageService;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerConfigurationTest {

    @Test
    void shouldUseUtcClock() {
        assertEquals(ZoneOffset.UTC, SchedulerConfiguration.clock().getZone());
    }

    @Test
    void shouldTolerateUnknownJsonProperties() {
        ObjectMapper mapper = SchedulerConfiguration.objectMapper();

        assertFalse(mapper.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    @Test
    void shouldNameDeliveryThreads() throws InterruptedException {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getDelivery().setThreads(2);
        SchedulerConfiguration configuration = new SchedulerConfiguration(properties, new MessageService());

        ExecutorService executor = configuration.deliveryExecutor();
        try {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<String> name = new AtomicReference<>();
            executor.execute(() -> {
                name.set(Thread.currentThread().getName());
                latch.countDown();
            });

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertTrue(name.get().startsWith("job-delivery-"));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void shouldApplyConfiguredLanguage() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.setLanguage("ru");
        MessageService messageService = new MessageService();

        new SchedulerConfiguration(properties, messageService).init();

        assertEquals("ru", messageService.getLanguage());
    }

    @Test
    void shouldFallBackToLoggingDelivery() {
        SchedulerConfiguration configuration = new SchedulerConfiguration(new SchedulerProperties(),
                new MessageService());

        assertInstanceOf(LoggingDeliveryAdapter.class, configuration.deliveryPort());
    }
}
