package me.golemcore.scheduler.adapter.inbound.command;

import me.golemcore.scheduler.domain.model.DeliveryReceipt;
import me.golemcore.scheduler.domain.model.JobNamespace;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.service.JobPersistenceService;
import me.golemcore.scheduler.domain.service.JobRegistry;
import me.golemcore.scheduler.domain.service.MessageTemplateRenderer;
import me.golemcore.scheduler.domain.service.SchedulingEngine;
import me.golemcore.scheduler.domain.service.VisibilityPolicy;
import me.golemcore.scheduler.infrastructure.config.SchedulerConfiguration;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.i18n.MessageService;
import me.golemcore.scheduler.port.inbound.CommandPort;
import me.golemcore.scheduler.port.inbound.CommandPort.CommandResult;
import me.golemcore.scheduler.port.outbound.DeliveryPort;
import me.golemcore.scheduler.port.outbound.RoomDirectoryPort;
import me.golemcore.scheduler.testsupport.InMemoryBrain;
import me.golemcore.scheduler.testsupport.ManualJobTimer;
import me.golemcore.scheduler.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    // Wednesday
    private static final Instant NOW = Instant.parse("2026-02-11T10:00:00Z");
    private static final String GENERAL = "general";
    private static final String OPS = "ops";
    private static final String SECRET = "secret";
    private static final String DM = "dm-alice";

    private JobRegistry reminders;
    private JobRegistry schedules;
    private SchedulerProperties properties;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        ManualJobTimer timer = new ManualJobTimer(clock);
        DeliveryPort deliveryPort = mock(DeliveryPort.class);
        when(deliveryPort.deliver(any()))
                .thenReturn(CompletableFuture.completedFuture(new DeliveryReceipt("d1", null, null)));
        SchedulingEngine engine = new SchedulingEngine(timer, Runnable::run, deliveryPort,
                new MessageTemplateRenderer(), clock);
        JobPersistenceService persistence = new JobPersistenceService(new InMemoryBrain(),
                SchedulerConfiguration.objectMapper());
        reminders = new JobRegistry(JobNamespace.REMINDERS, persistence, engine, new Random(1));
        schedules = new JobRegistry(JobNamespace.SCHEDULES, persistence, engine, new Random(2));

        RoomDirectoryPort rooms = mock(RoomDirectoryPort.class);
        when(rooms.resolveRoomId(anyString())).thenReturn(Optional.empty());
        when(rooms.resolveRoomId(GENERAL)).thenReturn(Optional.of(GENERAL));
        when(rooms.resolveRoomId(OPS)).thenReturn(Optional.of(OPS));
        when(rooms.resolveRoomId(SECRET)).thenReturn(Optional.of(SECRET));
        when(rooms.isNonPublic(anyString())).thenReturn(false);
        when(rooms.isNonPublic(SECRET)).thenReturn(true);
        when(rooms.isNonPublic(DM)).thenReturn(true);
        when(rooms.isBotPresent(anyString(), any())).thenReturn(true);
        when(rooms.publiclyJoinedRoomIds()).thenReturn(new LinkedHashSet<>(List.of(GENERAL, OPS)));
        when(rooms.roomName(anyString())).thenReturn(Optional.empty());

        properties = new SchedulerProperties();
        router = new CommandRouter(List.of(reminders, schedules), new VisibilityPolicy(rooms, properties),
                new JobListFormatter(rooms), new MessageService());
    }

    private static Map<String, Object> context(String room, String userId) {
        Map<String, Object> context = new HashMap<>();
        context.put(CommandPort.CTX_ROOM, room);
        context.put(CommandPort.CTX_USER_ID, userId);
        context.put(CommandPort.CTX_USER_NAME, "U1".equals(userId) ? "alice" : "bob");
        context.put(CommandPort.CTX_MESSAGE_ID, "m1");
        context.put(CommandPort.CTX_DIRECT_MESSAGE, DM.equals(room));
        return context;
    }

    private CommandResult run(String command, String line, Map<String, Object> context) {
        List<String> args = line.isEmpty() ? List.of() : List.of(line.split(" "));
        return router.execute(command, args, context).join();
    }

    private CommandResult run(String command, String line) {
        return run(command, line, context(GENERAL, "U1"));
    }

    // ==================== remind ====================

    @Test
    void shouldCreateThreadedReminderForMe() {
        CommandResult result = run("remind", "me 2026-02-12T09:00:00Z to water the plants");

        assertTrue(result.success());
        String id = (String) result.data();
        assertEquals("Reminder " + id + " set for 2026-02-12 09:00 UTC.", result.output());
        ScheduledJob job = reminders.find(id).orElseThrow();
        assertEquals("@alice, water the plants", job.getMessageTemplate());
        assertEquals(GENERAL, job.getDeliveryRoom());
        assertTrue(job.isPostInThread());
        assertEquals("m1", job.getMetadata().messageId());
    }

    @Test
    void shouldReadTwoTokenDateTime() {
        CommandResult result = run("remind", "team 2026-02-12 09:30 retro starts");

        assertTrue(result.success());
        ScheduledJob job = reminders.find((String) result.data()).orElseThrow();
        assertEquals(Instant.parse("2026-02-12T09:30:00Z"), job.getPattern().fireAt());
        assertEquals("@room, retro starts", job.getMessageTemplate());
    }

    @Test
    void shouldRefuseUnreadableDate() {
        CommandResult result = run("remind", "me tomorrow to call mom");

        assertFalse(result.success());
        assertTrue(result.output().contains("can't extract a date"));
        assertEquals(0, reminders.size());
    }

    @Test
    void shouldRefuseReminderInThePast() {
        CommandResult result = run("remind", "here 2026-02-10T09:00:00Z too late");

        assertFalse(result.success());
        assertEquals("Sorry, that time is already in the past.", result.output());
        assertEquals(0, reminders.size());
    }

    @Test
    void shouldShowRemindUsageForUnknownTarget() {
        CommandResult result = run("remind", "you 2026-02-12T09:00:00Z hello");

        assertTrue(result.output().startsWith("Usage: remind"));
        assertEquals(0, reminders.size());
    }

    // ==================== reminder list ====================

    @Test
    void shouldReportEmptyReminderList() {
        assertEquals("No reminders have been scheduled.", run("reminder", "list").output());
    }

    @Test
    void shouldListRemindersOfCurrentRoom() {
        String id = (String) run("remind", "me 2026-02-12T09:00:00Z standup").data();
        run("remind", "me 2026-02-12T10:00:00Z deploy", context(OPS, "U1"));

        CommandResult result = run("reminder", "list");

        assertTrue(result.success());
        assertEquals("Showing scheduled reminders for THIS room:\n===\n"
                + id + ": [2026-02-12 09:00 UTC] #general: @alice, standup\n", result.output());
    }

    @Test
    void shouldListRemindersOfAllPublicRooms() {
        run("remind", "me 2026-02-12T09:00:00Z standup");
        run("remind", "me 2026-02-12T10:00:00Z deploy", context(OPS, "U1"));
        run("remind", "me 2026-02-12T11:00:00Z hush", context(SECRET, "U1"));

        CommandResult result = run("reminder", "list all");

        assertTrue(result.output().startsWith("Showing scheduled reminders for all public rooms:"));
        assertTrue(result.output().contains("standup"));
        assertTrue(result.output().contains("deploy"));
        assertFalse(result.output().contains("hush"));
    }

    @Test
    void shouldRefuseListingPrivateRoomFromOutside() {
        run("remind", "me 2026-02-12T11:00:00Z hush", context(SECRET, "U1"));

        CommandResult result = run("reminder", "list secret");

        assertFalse(result.success());
        assertFalse(result.output().contains("hush"));
        assertTrue(result.output().contains("private room"));
    }

    @Test
    void shouldRefuseListingUnknownRoom() {
        CommandResult result = run("reminder", "list nowhere");

        assertFalse(result.success());
        assertEquals("Sorry, I'm not in the nowhere room, or maybe you mistyped?", result.output());
    }

    @Test
    void shouldListOnlyOwnJobsInDirectMessage() {
        run("remind", "me 2026-02-12T09:00:00Z mine", context(GENERAL, "U1"));
        run("remind", "me 2026-02-12T09:00:00Z theirs", context(GENERAL, "U2"));

        CommandResult result = run("reminder", "list all", context(DM, "U1"));

        assertTrue(result.output().contains("mine"));
        assertFalse(result.output().contains("theirs"));
    }

    @Test
    void shouldListOnlyCurrentRoomWhenExternalControlDenied() {
        properties.setDenyExternalControl(true);
        run("remind", "me 2026-02-12T10:00:00Z deploy", context(OPS, "U1"));

        CommandResult result = run("reminder", "list ops");

        assertEquals("No reminders have been scheduled.", result.output());
    }

    // ==================== reminder update / cancel ====================

    @Test
    void shouldUpdateReminder() {
        String id = (String) run("remind", "me 2026-02-12T09:00:00Z standup").data();

        CommandResult result = run("reminder", "update " + id + " standup moved to 10");

        assertTrue(result.success());
        assertEquals("Reminder " + id + " updated: standup moved to 10", result.output());
        assertEquals("standup moved to 10", reminders.find(id).orElseThrow().getMessageTemplate());
    }

    @Test
    void shouldCancelReminderWithAnyAlias() {
        String first = (String) run("remind", "me 2026-02-12T09:00:00Z one").data();
        String second = (String) run("remind", "me 2026-02-12T09:00:00Z two").data();

        assertEquals("Reminder " + first + " canceled.", run("reminder", "cancel " + first).output());
        assertTrue(run("reminder", "del " + second).success());
        assertEquals(0, reminders.size());
    }

    @Test
    void shouldReportMissingReminder() {
        CommandResult result = run("reminder", "remove 9999");

        assertFalse(result.success());
        assertEquals("Reminder 9999 does not exist.", result.output());
    }

    @Test
    void shouldRefuseCancelingOthersPrivateReminderFromOutside() {
        String id = (String) run("remind", "me 2026-02-12T11:00:00Z hush", context(SECRET, "U2")).data();

        CommandResult result = run("reminder", "cancel " + id, context(GENERAL, "U1"));

        assertFalse(result.success());
        assertTrue(reminders.find(id).isPresent());
    }

    @Test
    void shouldNotReachAcrossNamespaces() {
        String id = (String) run("schedule", "new \"0 9 * * 1\" standup").data();

        CommandResult result = run("reminder", "cancel " + id);

        assertFalse(result.success());
        assertTrue(schedules.find(id).isPresent());
    }

    // ==================== schedule ====================

    @Test
    void shouldCreateRecurringSchedule() {
        CommandResult result = run("schedule", "new \"0 9 * * 1\" standup time, {{user}}");

        assertTrue(result.success());
        String id = (String) result.data();
        assertEquals("Schedule " + id + " created: \"0 9 * * 1\"", result.output());
        ScheduledJob job = schedules.find(id).orElseThrow();
        assertTrue(job.isRecurring());
        assertFalse(job.isPostInThread());
        assertEquals("standup time, {{user}}", job.getMessageTemplate());
    }

    @Test
    void shouldCreateScheduleForAnotherRoom() {
        CommandResult result = run("schedule", "new #ops \"2026-02-12 09:00\" deploy freeze");

        ScheduledJob job = schedules.find((String) result.data()).orElseThrow();
        assertEquals(OPS, job.getDeliveryRoom());
        assertEquals(GENERAL, job.getOwner().room());
        assertFalse(job.isRecurring());
    }

    @Test
    void shouldRefuseScheduleForPrivateRoomFromOutside() {
        CommandResult result = run("schedule", "new #secret \"0 9 * * 1\" hush");

        assertFalse(result.success());
        assertEquals(0, schedules.size());
    }

    @Test
    void shouldRefuseScheduleForOtherRoomWhenExternalControlDenied() {
        properties.setDenyExternalControl(true);

        CommandResult result = run("schedule", "new #ops \"0 9 * * 1\" deploy");

        assertEquals("Managing jobs of other rooms is disabled.", result.output());
        assertEquals(0, schedules.size());
    }

    @Test
    void shouldRefuseInvalidPattern() {
        CommandResult result = run("schedule", "new \"every monday\" standup");

        assertFalse(result.success());
        assertEquals("Sorry, \"every monday\" is neither a cron pattern nor a date/time.", result.output());
    }

    @Test
    void shouldShowUsageWithoutQuotedPattern() {
        CommandResult result = run("schedule", "new 0 9 * * 1 standup");

        assertTrue(result.output().startsWith("Usage: schedule new"));
        assertEquals(0, schedules.size());
    }

    @Test
    void shouldListSchedules() {
        String id = (String) run("schedule", "new \"0 9 * * 1\" standup").data();

        CommandResult result = run("schedule", "list");

        assertEquals("Showing scheduled messages for THIS room:\n===\n"
                + id + ": [0 9 * * 1] #general: standup\n", result.output());
    }

    @Test
    void shouldCancelSchedule() {
        String id = (String) run("schedule", "new \"0 9 * * 1\" standup").data();

        assertEquals("Schedule " + id + " canceled.", run("schedule", "cancel " + id).output());
        assertEquals(0, schedules.size());
    }

    // ==================== routing ====================

    @Test
    void shouldRejectUnknownCommand() {
        CommandResult result = run("snooze", "");

        assertFalse(result.success());
        assertEquals("Unknown command: snooze", result.output());
    }

    @Test
    void shouldRequireRoomAndUser() {
        CommandResult result = router.execute("reminder", List.of("list"), Map.of()).join();

        assertFalse(result.success());
    }

    @Test
    void shouldDescribeCommands() {
        assertTrue(router.hasCommand("remind"));
        assertTrue(router.hasCommand("reminder"));
        assertTrue(router.hasCommand("schedule"));
        assertFalse(router.hasCommand("help"));
        assertEquals(3, router.listCommands().size());
    }
}
