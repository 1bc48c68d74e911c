package me.golemcore.planner.infrastructure.config;

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

import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Connects to Discord when {@code bot.discord.enabled=true}.
 *
 * <p>
 * The connection is established eagerly and blocks until the gateway reports
 * ready, so notification delivery never runs against a half-started client.
 */
@Configuration
@ConditionalOnProperty(name = "bot.discord.enabled", havingValue = "true")
@Slf4j
public class DiscordConfiguration {

    @Bean(destroyMethod = "shutdown")
    public JDA jda(BotProperties properties) {
        String token = properties.getDiscord().getToken();
        if (token == null || token.isBlank()) {
            throw new BeanCreationException("jda", "bot.discord.token is required when Discord is enabled");
        }
        try {
            JDA jda = JDABuilder.createLight(token).build().awaitReady();
            log.info("[Discord] Connected as {}", jda.getSelfUser().getName());
            return jda;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BeanCreationException("jda", "Interrupted while connecting to Discord", e);
        }
    }
}
