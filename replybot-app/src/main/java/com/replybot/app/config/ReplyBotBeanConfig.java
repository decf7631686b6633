package com.replybot.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.replybot.agent.models.ProviderFactory;
import com.replybot.agent.runtime.ResponseGenerator;
import com.replybot.analytics.AnalyticsAggregator;
import com.replybot.app.broadcast.LoggingEventBroadcaster;
import com.replybot.app.pipeline.PipelineOrchestrator;
import com.replybot.app.store.JsonFileMessageStore;
import com.replybot.app.store.MessageStore;
import com.replybot.app.transport.UnconfiguredTransportFactory;
import com.replybot.autoreply.AutoReplyGate;
import com.replybot.autoreply.ratelimit.RateLimiter;
import com.replybot.autoreply.schedule.BusinessHours;
import com.replybot.channel.events.EventBroadcaster;
import com.replybot.channel.supervisor.ConnectionSupervisor;
import com.replybot.channel.transport.ChatTransportFactory;
import com.replybot.common.config.ConfigService;
import com.replybot.common.config.ReplyBotConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Spring configuration for ReplyBot beans.
 * <p>
 * The chat transport, store and broadcaster have defaults that back off when
 * the application context provides its own.
 */
@Slf4j
@Configuration
public class ReplyBotBeanConfig {

    @Value("${replybot.config-path:~/.replybot/replybot.json}")
    private String configPath;

    @Bean
    public ConfigService configService() {
        return new ConfigService(Path.of(configPath));
    }

    @Bean
    public ReplyBotConfig replyBotConfig(ConfigService configService) {
        return configService.loadConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService replyBotScheduler() {
        return Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "replybot-scheduler");
            t.setDaemon(true);
            return t;
        });
    }

    // ── Collaborators ───────────────────────────────────────────────────

    @Bean
    @ConditionalOnMissingBean
    public MessageStore messageStore(ReplyBotConfig config) {
        if (!config.getPersistence().isEnabled()) {
            log.info("Persistence disabled, keeping messages in memory");
            return new JsonFileMessageStore();
        }
        return new JsonFileMessageStore(Path.of(config.getDataPath()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBroadcaster eventBroadcaster(ObjectMapper objectMapper) {
        return new LoggingEventBroadcaster(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public ChatTransportFactory chatTransportFactory() {
        return new UnconfiguredTransportFactory();
    }

    // ── Pipeline components ─────────────────────────────────────────────

    @Bean
    public ConnectionSupervisor connectionSupervisor(ChatTransportFactory transportFactory,
            ReplyBotConfig config,
            ScheduledExecutorService replyBotScheduler,
            EventBroadcaster eventBroadcaster,
            Clock clock) {
        return new ConnectionSupervisor(transportFactory, config.getConnection(),
                replyBotScheduler, eventBroadcaster, clock);
    }

    @Bean
    public ProviderFactory providerFactory() {
        return new ProviderFactory();
    }

    @Bean
    public ResponseGenerator responseGenerator(ProviderFactory providerFactory, Clock clock) {
        return new ResponseGenerator(providerFactory, clock);
    }

    @Bean
    public RateLimiter rateLimiter(ResponseGenerator responseGenerator, Clock clock) {
        return new RateLimiter(clock, () -> responseGenerator.getSettings().getRateLimitPerHour());
    }

    @Bean
    public BusinessHours businessHours() {
        return new BusinessHours();
    }

    @Bean
    public AutoReplyGate autoReplyGate(RateLimiter rateLimiter, ResponseGenerator responseGenerator,
            BusinessHours businessHours, Clock clock) {
        return new AutoReplyGate(rateLimiter, responseGenerator, businessHours, clock);
    }

    @Bean
    public AnalyticsAggregator analyticsAggregator(ReplyBotConfig config, Clock clock) {
        ReplyBotConfig.AnalyticsConfig analytics = config.getAnalytics();
        return new AnalyticsAggregator(resolveZone(analytics.getZone()),
                analytics.getErrorLogCapacity(), analytics.getContactCapacity(), clock);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(ReplyBotConfig config,
            MessageStore messageStore,
            EventBroadcaster eventBroadcaster,
            ConnectionSupervisor connectionSupervisor,
            AutoReplyGate autoReplyGate,
            ResponseGenerator responseGenerator,
            RateLimiter rateLimiter,
            AnalyticsAggregator analyticsAggregator,
            ScheduledExecutorService replyBotScheduler,
            Clock clock) {
        return new PipelineOrchestrator(config, messageStore, eventBroadcaster, connectionSupervisor,
                autoReplyGate, responseGenerator, rateLimiter, analyticsAggregator, replyBotScheduler, clock);
    }

    static ZoneId resolveZone(String zone) {
        try {
            return zone == null || zone.isBlank() ? ZoneOffset.UTC : ZoneId.of(zone);
        } catch (DateTimeException e) {
            log.warn("Unknown analytics zone '{}', using UTC", zone);
            return ZoneOffset.UTC;
        }
    }
}
