package com.demo.triage.infrastructure;

import com.demo.triage.config.JacksonConfig;
import com.demo.triage.domain.IssueEvent;
import com.demo.triage.domain.RelayEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.connection.DefaultMessage;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisEventRelayTest {

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private StringRedisTemplate redisTemplate;
    private RedisMessageListenerContainer container;
    private IssueEventBroadcaster broadcaster;
    private ExecutorService relayExecutor;
    private RedisEventRelay relay;

    @BeforeEach
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        container = mock(RedisMessageListenerContainer.class);
        broadcaster = mock(IssueEventBroadcaster.class);
        relayExecutor = Executors.newSingleThreadExecutor();
        relay = new RedisEventRelay(redisTemplate, container, broadcaster, objectMapper, "node-a", relayExecutor);
    }

    @AfterEach
    void tearDown() {
        relayExecutor.shutdownNow();
    }

    @Test
    @DisplayName("start subscribes to the channel and hooks into local publishes")
    void startRegistersListeners() {
        relay.start();

        verify(container).addMessageListener(eq(relay), eq(new ChannelTopic(RedisEventRelay.CHANNEL)));
        verify(broadcaster).addPublishListener(any());
    }

    @Test
    @DisplayName("local events are sent with this node as origin")
    void relaysLocalEvent() throws Exception {
        IssueEvent event = IssueEvent.newMessage(4L, 11L).toBuilder()
                .sequence(3L)
                .timestamp(Instant.parse("2024-05-01T10:00:00Z"))
                .build();

        relay.relay(event);

        ArgumentCaptor<String> payload = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate).convertAndSend(eq(RedisEventRelay.CHANNEL), payload.capture());
        RelayEnvelope envelope = objectMapper.readValue(payload.getValue(), RelayEnvelope.class);
        assertThat(envelope.getOriginNode()).isEqualTo("node-a");
        assertThat(envelope.getEvent()).isEqualTo(event);
    }

    @Test
    @DisplayName("publish does not wait for Redis and relays in publish order")
    void publishDoesNotBlockOnRedis() throws Exception {
        // given
        IssueEventBroadcaster realBroadcaster = new IssueEventBroadcaster(16,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC), Executors.newCachedThreadPool());
        RedisEventRelay wired = new RedisEventRelay(redisTemplate, container, realBroadcaster, objectMapper,
                "node-a", relayExecutor);
        wired.start();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(redisTemplate.convertAndSend(eq(RedisEventRelay.CHANNEL), anyString())).thenAnswer(invocation -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return 1L;
        });

        // when
        long started = System.nanoTime();
        realBroadcaster.publish(IssueEvent.newMessage(1L, 1L));
        realBroadcaster.publish(IssueEvent.issueResolved(1L));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // then
        assertThat(elapsedMs).isLessThan(1000L);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        ArgumentCaptor<String> payloads = ArgumentCaptor.forClass(String.class);
        verify(redisTemplate, timeout(5000).times(2)).convertAndSend(eq(RedisEventRelay.CHANNEL), payloads.capture());
        List<Long> sequences = new ArrayList<>();
        for (String payload : payloads.getAllValues()) {
            sequences.add(objectMapper.readValue(payload, RelayEnvelope.class).getEvent().getSequence());
        }
        assertThat(sequences).containsExactly(1L, 2L);
        realBroadcaster.shutdown();
    }

    @Test
    @DisplayName("a full relay backlog drops events without failing the publisher")
    void fullBacklogDrops() throws Exception {
        ExecutorService tiny = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(1));
        RedisEventRelay bounded = new RedisEventRelay(redisTemplate, container, broadcaster, objectMapper,
                "node-a", tiny);
        CountDownLatch release = new CountDownLatch(1);
        when(redisTemplate.convertAndSend(eq(RedisEventRelay.CHANNEL), anyString())).thenAnswer(invocation -> {
            release.await(5, TimeUnit.SECONDS);
            return 1L;
        });

        bounded.enqueue(IssueEvent.newMessage(1L, 1L));
        bounded.enqueue(IssueEvent.newMessage(1L, 2L));
        bounded.enqueue(IssueEvent.newMessage(1L, 3L));
        release.countDown();

        verify(redisTemplate, timeout(5000).times(2)).convertAndSend(eq(RedisEventRelay.CHANNEL), anyString());
        tiny.shutdown();
        assertThat(tiny.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        verify(redisTemplate, times(2)).convertAndSend(eq(RedisEventRelay.CHANNEL), anyString());
    }

    @Test
    @DisplayName("events from other nodes go to local viewers")
    void deliversRemoteEvent() throws Exception {
        IssueEvent event = IssueEvent.issueResolved(9L);

        relay.onMessage(message(RelayEnvelope.builder().originNode("node-b").event(event).build()), null);

        verify(broadcaster).deliverRelayed(event);
    }

    @Test
    @DisplayName("events this node sent are not delivered twice")
    void ignoresOwnEcho() throws Exception {
        relay.onMessage(message(RelayEnvelope.builder()
                .originNode("node-a").event(IssueEvent.issueResolved(9L)).build()), null);

        verify(broadcaster, never()).deliverRelayed(any());
    }

    @Test
    @DisplayName("garbage on the channel is dropped")
    void ignoresGarbage() {
        relay.onMessage(new DefaultMessage(
                RedisEventRelay.CHANNEL.getBytes(StandardCharsets.UTF_8),
                "{oops".getBytes(StandardCharsets.UTF_8)), null);

        verify(broadcaster, never()).deliverRelayed(any());
    }

    @Test
    @DisplayName("a blank node id is replaced by a random one")
    void generatesNodeId() {
        RedisEventRelay anonymous = new RedisEventRelay(redisTemplate, container, broadcaster, objectMapper, " ",
                relayExecutor);

        assertThat(anonymous.getNodeId()).isNotBlank().isNotEqualTo(relay.getNodeId());
    }

    private DefaultMessage message(RelayEnvelope envelope) throws Exception {
        return new DefaultMessage(
                RedisEventRelay.CHANNEL.getBytes(StandardCharsets.UTF_8),
                objectMapper.writeValueAsBytes(envelope));
    }
}
