package me.golemcore.scheduler.adapter.inbound.command;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.scheduler.domain.exception.InThePastException;
import me.golemcore.scheduler.domain.exception.InvalidPatternException;
import me.golemcore.scheduler.domain.exception.JobNotFoundException;
import me.golemcore.scheduler.domain.exception.PersistenceException;
import me.golemcore.scheduler.domain.model.JobKind;
import me.golemcore.scheduler.domain.model.JobNamespace;
import me.golemcore.scheduler.domain.model.JobOwner;
import me.golemcore.scheduler.domain.model.JobPattern;
import me.golemcore.scheduler.domain.model.MessageMetadata;
import me.golemcore.scheduler.domain.model.ScheduledJob;
import me.golemcore.scheduler.domain.model.VisibilityDecision;
import me.golemcore.scheduler.domain.model.VisibilityRequest;
import me.golemcore.scheduler.domain.service.JobRegistry;
import me.golemcore.scheduler.domain.service.VisibilityPolicy;
import me.golemcore.scheduler.infrastructure.i18n.MessageService;
import me.golemcore.scheduler.port.inbound.CommandPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes reminder and schedule chat commands to the job registries.
 *
 * <ul>
 * <li>remind &lt;me|team|here&gt; &lt;date/time&gt; &lt;message&gt; - one-off
 * reminder in the current room, replied in the request's thread
 * <li>reminder list [all|&lt;room&gt;] - list reminders
 * <li>reminder update &lt;id&gt; &lt;message&gt; - change a reminder's message
 * <li>reminder cancel|delete|del|remove &lt;id&gt; - cancel a reminder
 * <li>schedule new [#room] "&lt;pattern&gt;" &lt;message&gt; - cron or one-off
 * schedule, optionally for another room
 * <li>schedule list|update|cancel - as for reminders
 * </ul>
 *
 * <p>
 * Every list, update and cancel is checked by the {@link VisibilityPolicy}
 * before anything is read from or written to a registry.
 *
 * @see me.golemcore.scheduler.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_REMIND = "remind";
    private static final String CMD_REMINDER = "reminder";
    private static final String CMD_SCHEDULE = "schedule";
    private static final String SUBCMD_LIST = "list";
    private static final String SUBCMD_NEW = "new";
    private static final String SUBCMD_ADD = "add";
    private static final String LIST_SEPARATOR = "\n===\n";
    private static final String MSG_PATTERN_PAST = "command.pattern.past";
    private static final int MIN_REMIND_ARGS = 3;
    private static final int MIN_UPDATE_ARGS = 2;

    private static final List<String> KNOWN_COMMANDS = List.of(CMD_REMIND, CMD_REMINDER, CMD_SCHEDULE);
    private static final Set<String> UPDATE_ALIASES = Set.of("update", "upd");
    private static final Set<String> CANCEL_ALIASES = Set.of("cancel", "delete", "del", "remove");

    private final Map<JobNamespace, JobRegistry> registries = new EnumMap<>(JobNamespace.class);
    private final VisibilityPolicy visibilityPolicy;
    private final JobListFormatter listFormatter;
    private final MessageService messageService;

    public CommandRouter(
            List<JobRegistry> registries,
            VisibilityPolicy visibilityPolicy,
            JobListFormatter listFormatter,
            MessageService messageService) {
        for (JobRegistry registry : registries) {
            this.registries.put(registry.namespace(), registry);
        }
        this.visibilityPolicy = visibilityPolicy;
        this.listFormatter = listFormatter;
        this.messageService = messageService;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: {} {}", command, args);
            if (!hasCommand(command)) {
                return CommandResult.failure(msg("command.unknown", command));
            }
            RequestContext request = RequestContext.from(context);
            if (request.room() == null || request.userId() == null) {
                return CommandResult.failure(msg("command.context.missing"));
            }

            return switch (command) {
            case CMD_REMIND -> handleRemind(args, request);
            case CMD_REMINDER -> handleJobCommand(JobNamespace.REMINDERS, args, request);
            case CMD_SCHEDULE -> handleSchedule(args, request);
            default -> CommandResult.failure(msg("command.unknown", command));
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMANDS.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_REMIND, "Create a one-off reminder in this room",
                        "remind <me|team|here> <date/time> <message>"),
                new CommandDefinition(CMD_REMINDER, "List, update or cancel reminders",
                        "reminder [list [all|<room>]|update <id> <message>|cancel <id>]"),
                new CommandDefinition(CMD_SCHEDULE, "Manage recurring and one-off schedules",
                        "schedule [new [#room] \"<pattern>\" <message>|list [all|<room>]|update <id> <message>"
                                + "|cancel <id>]"));
    }

    // ==================== Remind ====================

    private CommandResult handleRemind(List<String> args, RequestContext request) {
        if (args.size() < MIN_REMIND_ARGS) {
            return CommandResult.success(msg("command.remind.usage"));
        }

        String mention = switch (args.get(0).toLowerCase(Locale.ROOT)) {
        case "me" -> "@" + request.displayName() + ", ";
        case "here" -> "@here, ";
        case "team" -> "@room, ";
        default -> null;
        };
        if (mention == null) {
            return CommandResult.success(msg("command.remind.usage"));
        }

        List<String> rest = args.subList(1, args.size());
        Optional<ParsedInstant> parsed = parseInstant(rest);
        if (parsed.isEmpty()) {
            return CommandResult.failure(msg("command.remind.bad-date", rest.get(0)));
        }

        List<String> messageTokens = rest.subList(parsed.get().tokens(), rest.size());
        if (!messageTokens.isEmpty() && "to".equalsIgnoreCase(messageTokens.get(0)) && messageTokens.size() > 1) {
            messageTokens = messageTokens.subList(1, messageTokens.size());
        }
        String message = String.join(" ", messageTokens).trim();
        if (message.isEmpty()) {
            return CommandResult.success(msg("command.remind.usage"));
        }

        JobPattern pattern = parsed.get().pattern();
        try {
            String id = registry(JobNamespace.REMINDERS).create(
                    request.owner(), request.room(), pattern.raw(), mention + message,
                    MessageMetadata.of(request.messageId()), true);
            return CommandResult.success(msg("command.remind.created", id,
                    JobListFormatter.FIRE_TIME_FORMAT.format(pattern.fireAt())), id);
        } catch (InThePastException e) {
            return CommandResult.failure(msg(MSG_PATTERN_PAST));
        } catch (PersistenceException e) {
            log.error("[Command] Failed to create reminder: {}", e.getMessage(), e);
            return CommandResult.failure(msg("command.remind.error"));
        }
    }

    /**
     * A date and time take one token in ISO form or two as
     * {@code yyyy-MM-dd HH:mm}. The longer reading wins when both parse.
     */
    private Optional<ParsedInstant> parseInstant(List<String> tokens) {
        if (tokens.size() > 2) {
            Optional<JobPattern> twoTokens = oneOff(tokens.get(0) + " " + tokens.get(1));
            if (twoTokens.isPresent()) {
                return Optional.of(new ParsedInstant(twoTokens.get(), 2));
            }
        }
        return oneOff(tokens.get(0)).map(pattern -> new ParsedInstant(pattern, 1));
    }

    private static Optional<JobPattern> oneOff(String text) {
        try {
            JobPattern pattern = JobPattern.classify(text);
            return pattern.kind() == JobKind.ONE_OFF ? Optional.of(pattern) : Optional.empty();
        } catch (InvalidPatternException e) {
            return Optional.empty();
        }
    }

    // ==================== Schedule ====================

    private CommandResult handleSchedule(List<String> args, RequestContext request) {
        if (!args.isEmpty()) {
            String subcommand = args.get(0).toLowerCase(Locale.ROOT);
            if (SUBCMD_NEW.equals(subcommand) || SUBCMD_ADD.equals(subcommand)) {
                return handleScheduleNew(args.subList(1, args.size()), request);
            }
        }
        return handleJobCommand(JobNamespace.SCHEDULES, args, request);
    }

    private CommandResult handleScheduleNew(List<String> args, RequestContext request) {
        String text = String.join(" ", args).trim();

        String roomArgument = null;
        if (text.startsWith("#")) {
            int space = text.indexOf(' ');
            if (space < 0) {
                return CommandResult.success(msg("command.schedule.new.usage"));
            }
            roomArgument = text.substring(1, space);
            text = text.substring(space + 1).trim();
        }

        int close = text.indexOf('"', 1);
        if (!text.startsWith("\"") || close < 0) {
            return CommandResult.success(msg("command.schedule.new.usage"));
        }
        String pattern = text.substring(1, close).trim();
        String message = text.substring(close + 1).trim();
        if (pattern.isEmpty() || message.isEmpty()) {
            return CommandResult.success(msg("command.schedule.new.usage"));
        }

        VisibilityDecision target = visibilityPolicy.resolveTarget(
                new VisibilityRequest(request.room(), request.userId(), request.directMessage(), roomArgument));
        if (!target.allowed()) {
            return CommandResult.failure(denial(target, roomArgument));
        }

        try {
            String id = registry(JobNamespace.SCHEDULES).create(
                    request.owner(), target.singleRoomId(), pattern, message,
                    MessageMetadata.of(request.messageId()), false);
            return CommandResult.success(msg("command.schedule.created", id, pattern), id);
        } catch (InvalidPatternException e) {
            return CommandResult.failure(msg("command.pattern.invalid", pattern));
        } catch (InThePastException e) {
            return CommandResult.failure(msg(MSG_PATTERN_PAST));
        } catch (PersistenceException e) {
            log.error("[Command] Failed to create schedule: {}", e.getMessage(), e);
            return CommandResult.failure(msg("command.schedule.error"));
        }
    }

    // ==================== List / update / cancel ====================

    private CommandResult handleJobCommand(JobNamespace namespace, List<String> args, RequestContext request) {
        if (args.isEmpty()) {
            return CommandResult.success(nsMsg(namespace, "usage"));
        }

        String subcommand = args.get(0).toLowerCase(Locale.ROOT);
        List<String> subArgs = args.subList(1, args.size());

        if (SUBCMD_LIST.equals(subcommand)) {
            return handleList(namespace, subArgs, request);
        }
        if (UPDATE_ALIASES.contains(subcommand)) {
            return handleUpdate(namespace, subArgs, request);
        }
        if (CANCEL_ALIASES.contains(subcommand)) {
            return handleCancel(namespace, subArgs, request);
        }
        return CommandResult.success(nsMsg(namespace, "usage"));
    }

    private CommandResult handleList(JobNamespace namespace, List<String> args, RequestContext request) {
        String roomArgument = args.isEmpty() ? null : String.join(" ", args).trim();
        VisibilityDecision decision = visibilityPolicy.resolve(
                new VisibilityRequest(request.room(), request.userId(), request.directMessage(), roomArgument));
        if (!decision.allowed()) {
            return CommandResult.failure(denial(decision, roomArgument));
        }

        List<ScheduledJob> jobs = visibilityPolicy.visibleJobs(registry(namespace), decision);
        if (jobs.isEmpty()) {
            return CommandResult.success(nsMsg(namespace, "list.empty"));
        }

        String title = switch (decision.scope()) {
        case CURRENT_ROOM -> nsMsg(namespace, "list.title.current");
        case ALL -> decision.includesRequestingRoom()
                ? nsMsg(namespace, "list.title.all-and-current")
                : nsMsg(namespace, "list.title.all");
        case EXPLICIT_ROOM -> nsMsg(namespace, "list.title.room", roomArgument);
        };
        return CommandResult.success(title + LIST_SEPARATOR + listFormatter.format(jobs), jobs);
    }

    private CommandResult handleUpdate(JobNamespace namespace, List<String> args, RequestContext request) {
        if (args.size() < MIN_UPDATE_ARGS) {
            return CommandResult.success(nsMsg(namespace, "update.usage"));
        }
        String id = args.get(0);
        String message = String.join(" ", args.subList(1, args.size())).trim();
        if (message.isEmpty()) {
            return CommandResult.success(nsMsg(namespace, "update.usage"));
        }

        JobRegistry registry = registry(namespace);
        Optional<CommandResult> refused = checkMutation(namespace, registry, id, request);
        if (refused.isPresent()) {
            return refused.get();
        }

        try {
            registry.update(id, message);
            return CommandResult.success(nsMsg(namespace, "updated", id, message));
        } catch (JobNotFoundException e) {
            return CommandResult.failure(nsMsg(namespace, "not-found", id));
        } catch (InThePastException e) {
            return CommandResult.failure(msg(MSG_PATTERN_PAST));
        } catch (PersistenceException e) {
            log.error("[Command] Failed to update {} job {}: {}", namespace, id, e.getMessage(), e);
            return CommandResult.failure(nsMsg(namespace, "error"));
        }
    }

    private CommandResult handleCancel(JobNamespace namespace, List<String> args, RequestContext request) {
        if (args.isEmpty()) {
            return CommandResult.success(nsMsg(namespace, "cancel.usage"));
        }
        String id = args.get(0);

        JobRegistry registry = registry(namespace);
        Optional<CommandResult> refused = checkMutation(namespace, registry, id, request);
        if (refused.isPresent()) {
            return refused.get();
        }

        try {
            registry.cancel(id);
            return CommandResult.success(nsMsg(namespace, "canceled", id));
        } catch (JobNotFoundException e) {
            return CommandResult.failure(nsMsg(namespace, "not-found", id));
        } catch (PersistenceException e) {
            log.error("[Command] Failed to cancel {} job {}: {}", namespace, id, e.getMessage(), e);
            return CommandResult.failure(nsMsg(namespace, "error"));
        }
    }

    private Optional<CommandResult> checkMutation(JobNamespace namespace, JobRegistry registry, String id,
            RequestContext request) {
        Optional<ScheduledJob> job = registry.find(id);
        if (job.isEmpty()) {
            return Optional.of(CommandResult.failure(nsMsg(namespace, "not-found", id)));
        }
        VisibilityDecision decision = visibilityPolicy.checkMutation(job.get(),
                VisibilityRequest.currentRoom(request.room(), request.userId(), request.directMessage()));
        if (!decision.allowed()) {
            return Optional.of(CommandResult.failure(denial(decision, null)));
        }
        return Optional.empty();
    }

    private String denial(VisibilityDecision decision, String roomArgument) {
        return switch (decision.denialReason()) {
        case ROOM_UNAVAILABLE -> msg("command.room.unavailable", roomArgument);
        case PRIVATE_ROOM -> msg("command.room.private");
        case EXTERNAL_CONTROL_DISABLED -> msg("command.room.external-control");
        };
    }

    private JobRegistry registry(JobNamespace namespace) {
        JobRegistry registry = registries.get(namespace);
        if (registry == null) {
            throw new IllegalStateException("No registry for " + namespace);
        }
        return registry;
    }

    private String nsMsg(JobNamespace namespace, String suffix, Object... args) {
        String prefix = namespace == JobNamespace.REMINDERS ? "command.reminder." : "command.schedule.";
        return msg(prefix + suffix, args);
    }

    private String msg(String key, Object... args) {
        return messageService.getMessage(key, args);
    }

    private record ParsedInstant(JobPattern pattern, int tokens) {
    }

    private record RequestContext(String room, String userId, String userName, String messageId,
            boolean directMessage) {

        static RequestContext from(Map<String, Object> context) {
            Object dm = context.get(CTX_DIRECT_MESSAGE);
            return new RequestContext(
                    text(context, CTX_ROOM),
                    text(context, CTX_USER_ID),
                    text(context, CTX_USER_NAME),
                    text(context, CTX_MESSAGE_ID),
                    Boolean.TRUE.equals(dm) || "true".equals(dm));
        }

        JobOwner owner() {
            return new JobOwner(userId, userName, room);
        }

        String displayName() {
            return userName != null ? userName : userId;
        }

        private static String text(Map<String, Object> context, String key) {
            Object value = context.get(key);
            if (value instanceof String s && !s.isBlank()) {
                return s;
            }
            return null;
        }
    }
}
