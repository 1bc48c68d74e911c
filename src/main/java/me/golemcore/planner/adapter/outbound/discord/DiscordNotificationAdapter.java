package me.golemcore.planner.adapter.outbound.discord;

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

import me.golemcore.planner.domain.exception.NotFoundException;
import me.golemcore.planner.port.outbound.NotificationPort;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers reminders to Discord through JDA: to the reminder's channel when
 * one is set, else as a direct message to the owner. Messages longer than
 * Discord's limit are split and sent in order.
 */
@Component
@ConditionalOnProperty(name = "bot.discord.enabled", havingValue = "true")
@Slf4j
public class DiscordNotificationAdapter implements NotificationPort {

    static final int MAX_MESSAGE_LENGTH = 2000;

    private final JDA jda;

    public DiscordNotificationAdapter(JDA jda) {
        this.jda = jda;
    }

    @Override
    public CompletableFuture<Void> deliver(String ownerId, String channelId, String content) {
        if (channelId != null && !channelId.isBlank()) {
            GuildMessageChannel channel = jda.getChannelById(GuildMessageChannel.class, channelId);
            if (channel == null) {
                return CompletableFuture.failedFuture(new NotFoundException("Channel not found: " + channelId));
            }
            if (!channel.canTalk()) {
                return CompletableFuture.failedFuture(
                        new IllegalStateException("Missing permission to post in channel " + channelId));
            }
            return send(channel, content);
        }
        return jda.retrieveUserById(ownerId)
                .flatMap(User::openPrivateChannel)
                .submit()
                .thenCompose(channel -> send(channel, content));
    }

    private CompletableFuture<Void> send(MessageChannel channel, String content) {
        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (String chunk : split(content)) {
            chain = chain.thenCompose(ignored -> channel.sendMessage(chunk).submit().thenAccept(message -> log
                    .debug("[Discord] Sent message {} to {}", message.getId(), channel.getId())));
        }
        return chain;
    }

    public static List<String> split(String content) {
        List<String> chunks = new ArrayList<>();
        String remaining = content;
        while (remaining.length() > MAX_MESSAGE_LENGTH) {
            int cut = remaining.lastIndexOf('\n', MAX_MESSAGE_LENGTH);
            boolean atNewline = cut > 0;
            if (!atNewline) {
                cut = MAX_MESSAGE_LENGTH;
                // Keep surrogate pairs together
                if (Character.isHighSurrogate(remaining.charAt(cut - 1))) {
                    cut--;
                }
            }
            chunks.add(remaining.substring(0, cut));
            remaining = remaining.substring(atNewline ? cut + 1 : cut);
        }
        if (!remaining.isEmpty()) {
            chunks.add(remaining);
        }
        return chunks;
    }
}
