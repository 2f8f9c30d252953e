package com.punchwheel.core.notify.provider;

import com.punchwheel.config.PunchGuardProperties;
import com.punchwheel.config.PunchNotifierProperties;
import com.punchwheel.core.backoff.FixedBackoffPolicy;
import com.punchwheel.core.failure.RouterFailureDecider;
import com.punchwheel.core.guard.CircuitGuard;
import com.punchwheel.core.metric.PunchMetrics;
import com.punchwheel.core.notify.ratelimit.MinIntervalRateLimiter;
import com.punchwheel.core.retry.RetryExecutor;
import com.punchwheel.core.serializer.JacksonPayloadSerializer;
import com.punchwheel.exception.PunchConfigException;
import com.punchwheel.model.NotificationEvent;
import com.punchwheel.model.ProviderResult;
import com.punchwheel.model.enums.DeliveryStatus;
import com.punchwheel.model.enums.NotificationLevel;
import com.punchwheel.model.enums.ProviderKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withNoContent;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

class DiscordWebhookProviderTest {

    private static final String URL = "https://discord.com/api/webhooks/123/token";

    private static PunchNotifierProperties.Provider cfg() {
        PunchNotifierProperties.Provider cfg = new PunchNotifierProperties.Provider();
        cfg.setName("discord-main");
        cfg.setKind(ProviderKind.DISCORD);
        cfg.setUrl(URL);
        cfg.setUsername("Punch Bot");
        cfg.setMaxRetries(3);
        cfg.setAttachmentMaxBytes(1024);
        return cfg;
    }

    private static Fixture newFixture(PunchNotifierProperties.Provider cfg) {
        RestClient.Builder builder = RestClient.builder();
        MockRestServiceServer server = MockRestServiceServer.bindTo(builder).build();
        RetryExecutor retry = new RetryExecutor(new CircuitGuard(new PunchGuardProperties()),
                RouterFailureDecider.defaults(), PunchMetrics.create(new SimpleMeterRegistry()), d -> { });
        DiscordWebhookProvider provider = new DiscordWebhookProvider(cfg, builder.build(),
                new JacksonPayloadSerializer(), retry, new FixedBackoffPolicy(),
                new MinIntervalRateLimiter(Duration.ZERO));
        return new Fixture(provider, server);
    }

    private static NotificationEvent success() {
        return NotificationEvent.builder()
                .level(NotificationLevel.SUCCESS)
                .title("签到成功")
                .message("clock-in done")
                .field("Job", "clock-in")
                .field("Attempts", "1")
                .timestamp(Instant.parse("2024-01-02T01:00:00Z"))
                .build();
    }

    @Test
    void sendsEmbedPayload() {
        Fixture f = newFixture(cfg());
        f.server.expect(requestTo(URL))
                .andExpect(method(POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.username").value("Punch Bot"))
                .andExpect(jsonPath("$.embeds[0].title").value("签到成功"))
                .andExpect(jsonPath("$.embeds[0].description").value("clock-in done"))
                .andExpect(jsonPath("$.embeds[0].color").value(0x00FF00))
                .andExpect(jsonPath("$.embeds[0].timestamp").value("2024-01-02T01:00:00Z"))
                .andExpect(jsonPath("$.embeds[0].fields[0].name").value("Job"))
                .andExpect(jsonPath("$.embeds[0].fields[0].value").value("clock-in"))
                .andExpect(jsonPath("$.embeds[0].fields[1].inline").value(true))
                .andExpect(jsonPath("$.embeds[0].footer.text").value("Punch Wheel"))
                .andRespond(withNoContent());

        ProviderResult result = f.provider.send(success());

        assertThat(result.isSent()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(1);
        f.server.verify();
    }

    @Test
    void rateLimitedResponseIsRetried() {
        Fixture f = newFixture(cfg());
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.RETRY_AFTER, "0");
        f.server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).headers(headers));
        f.server.expect(requestTo(URL)).andRespond(withNoContent());

        ProviderResult result = f.provider.send(success());

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.SENT);
        assertThat(result.getAttempts()).isEqualTo(2);
        f.server.verify();
    }

    @Test
    void unauthorizedIsTerminal() {
        Fixture f = newFixture(cfg());
        f.server.expect(ExpectedCount.once(), requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        ProviderResult result = f.provider.send(success());

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getStatusCode()).isEqualTo(401);
        assertThat(result.getErrorMessage()).contains("AUTH");
        f.server.verify();
    }

    @Test
    void serverErrorsAreRetriedUpToMaxRetries() {
        Fixture f = newFixture(cfg());
        f.server.expect(ExpectedCount.times(3), requestTo(URL)).andRespond(withServerError());

        ProviderResult result = f.provider.send(success());

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.FAILED);
        assertThat(result.getAttempts()).isEqualTo(3);
        assertThat(result.getStatusCode()).isEqualTo(500);
        f.server.verify();
    }

    @Test
    void belowMinLevelIsSkipped() {
        PunchNotifierProperties.Provider cfg = cfg();
        cfg.setMinLevel(NotificationLevel.ERROR);
        Fixture f = newFixture(cfg);

        ProviderResult result = f.provider.send(success());

        assertThat(result.getStatus()).isEqualTo(DeliveryStatus.SKIPPED);
        f.server.verify();
    }

    @Test
    void testConnectionIgnoresMinLevel() {
        PunchNotifierProperties.Provider cfg = cfg();
        cfg.setMinLevel(NotificationLevel.ERROR);
        Fixture f = newFixture(cfg);
        f.server.expect(requestTo(URL))
                .andExpect(jsonPath("$.embeds[0].color").value(0x0099FF))
                .andRespond(withNoContent());

        assertThat(f.provider.testConnection().isSent()).isTrue();
        f.server.verify();
    }

    @Test
    void switchedOffLevelIsSkippedButOtherLevelsSend() {
        PunchNotifierProperties.Provider cfg = cfg();
        cfg.setNotifySuccess(false);
        Fixture f = newFixture(cfg);
        f.server.expect(ExpectedCount.once(), requestTo(URL))
                .andExpect(jsonPath("$.embeds[0].color").value(0xFF0000))
                .andRespond(withNoContent());

        ProviderResult skipped = f.provider.send(success());
        ProviderResult sent = f.provider.send(success().toBuilder().level(NotificationLevel.ERROR).build());

        assertThat(skipped.getStatus()).isEqualTo(DeliveryStatus.SKIPPED);
        assertThat(skipped.getErrorMessage()).isEqualTo("level SUCCESS switched off");
        assertThat(sent.isSent()).isTrue();
        f.server.verify();
    }

    @Test
    void attachmentIsSentAsMultipart(@TempDir Path dir) throws Exception {
        Path shot = Files.write(dir.resolve("shot.png"), new byte[]{1, 2, 3});
        Fixture f = newFixture(cfg());
        f.server.expect(requestTo(URL))
                .andExpect(content().contentTypeCompatibleWith(MediaType.MULTIPART_FORM_DATA))
                .andExpect(content().string(containsString("name=\"payload_json\"")))
                .andExpect(content().string(containsString("name=\"files[0]\"")))
                .andExpect(content().string(containsString("filename=\"shot.png\"")))
                .andRespond(withNoContent());

        ProviderResult result = f.provider.send(success().toBuilder().attachment(shot).build());

        assertThat(result.isSent()).isTrue();
        f.server.verify();
    }

    @Test
    void oversizedAttachmentIsDropped(@TempDir Path dir) throws Exception {
        Path big = Files.write(dir.resolve("big.png"), new byte[2048]);
        Fixture f = newFixture(cfg());
        f.server.expect(requestTo(URL))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andRespond(withNoContent());

        assertThat(f.provider.send(success().toBuilder().attachment(big).build()).isSent()).isTrue();
        f.server.verify();
    }

    @Test
    void missingAttachmentIsDropped(@TempDir Path dir) {
        Fixture f = newFixture(cfg());
        f.server.expect(requestTo(URL))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andRespond(withNoContent());

        assertThat(f.provider.send(success().toBuilder().attachment(dir.resolve("gone.png")).build()).isSent()).isTrue();
        f.server.verify();
    }

    @Test
    void rejectsNonDiscordUrl() {
        PunchNotifierProperties.Provider cfg = cfg();
        cfg.setUrl("https://example.com/hook");

        assertThatThrownBy(() -> newFixture(cfg)).isInstanceOf(PunchConfigException.class);
    }

    private static final class Fixture {
        final DiscordWebhookProvider provider;
        final MockRestServiceServer server;

        Fixture(DiscordWebhookProvider provider, MockRestServiceServer server) {
            this.provider = provider;
            this.server = server;
        }
    }
}
