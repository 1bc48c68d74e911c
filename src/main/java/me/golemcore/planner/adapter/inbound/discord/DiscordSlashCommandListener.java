package me.golemcore.planner.adapter.inbound.discord;

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

import me.golemcore.planner.adapter.outbound.discord.DiscordNotificationAdapter;
import me.golemcore.planner.infrastructure.config.BotProperties;
import me.golemcore.planner.port.inbound.CommandPort;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Bridges Discord slash commands to {@link CommandPort}.
 *
 * <p>
 * Commands are registered with Discord by deployment tooling, each with a
 * single optional {@code args} string option that the router tokenizes.
 * Replies are deferred because execution is asynchronous and may exceed
 * Discord's three second acknowledgement window.
 */
@Component
@ConditionalOnProperty(name = "bot.discord.enabled", havingValue = "true")
@Slf4j
public class DiscordSlashCommandListener extends ListenerAdapter {

    static final String ARGS_OPTION = "args";

    private final JDA jda;
    private final CommandPort commandPort;
    private final BotProperties properties;

    public DiscordSlashCommandListener(JDA jda, CommandPort commandPort, BotProperties properties) {
        this.jda = jda;
        this.commandPort = commandPort;
        this.properties = properties;
    }

    @PostConstruct
    public void register() {
        jda.addEventListener(this);
        log.info("[Discord] Listening for slash commands: {}", commandPort.listCommands().size());
    }

    @Override
    public void onSlashCommandInteraction(SlashCommandInteractionEvent event) {
        String name = event.getName();
        if (!commandPort.hasCommand(name)) {
            event.reply("Unknown command: " + name).setEphemeral(true).queue();
            return;
        }

        Member member = event.getMember();
        CommandPort.CommandContext context = new CommandPort.CommandContext(
                event.getUser().getId(),
                event.isFromGuild() ? event.getChannel().getId() : null,
                isAdmin(member),
                roleIds(member));

        OptionMapping option = event.getOption(ARGS_OPTION);
        List<String> args = option != null ? List.of(option.getAsString()) : List.of();

        event.deferReply().queue();
        InteractionHook hook = event.getHook();
        commandPort.execute(name, args, context).whenComplete((result, error) -> {
            if (error != null) {
                log.error("[Discord] Command /{} failed", name, error);
                hook.sendMessage("Command failed").queue();
                return;
            }
            String output = result.output() == null || result.output().isBlank() ? "OK" : result.output();
            for (String chunk : DiscordNotificationAdapter.split(output)) {
                hook.sendMessage(chunk).queue();
            }
        });
    }

    static Set<String> roleIds(Member member) {
        if (member == null) {
            return Set.of();
        }
        return member.getRoles().stream()
                .map(Role::getId)
                .collect(Collectors.toUnmodifiableSet());
    }

    boolean isAdmin(Member member) {
        if (member == null) {
            return false;
        }
        if (member.hasPermission(Permission.ADMINISTRATOR)) {
            return true;
        }
        List<String> adminRoles = properties.getDiscord().getAdminRoleIds();
        return member.getRoles().stream()
                .map(Role::getId)
                .anyMatch(adminRoles::contains);
    }
}
