package com.tokengate.service;

import com.tokengate.config.GateProperties;
import com.tokengate.config.MetricsConfig;
import com.tokengate.gateway.InviteHandle;
import com.tokengate.gateway.MessagingException;
import com.tokengate.gateway.MessagingGateway;
import com.tokengate.model.InviteRecord;
import com.tokengate.testutil.InMemoryStore;
import com.tokengate.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InviteLinkManagerTest {

    @Mock private MessagingGateway gateway;
    @Mock private MetricsConfig metricsConfig;

    private InMemoryStore store;
    private MutableClock clock;
    private InviteLinkManager manager;
    private final AtomicInteger linkCounter = new AtomicInteger();

    @BeforeEach
    void setUp() {
        store = new InMemoryStore();
        clock = MutableClock.startingAt("2026-03-01T10:00:00Z");
        GateProperties properties = new GateProperties();

        manager = new InviteLinkManager(store.inviteRepository(), gateway, new KeyLockService(), properties,
                metricsConfig, clock);

        lenient().when(gateway.createOneTimeInvite(anyString(), anyString(), anyLong())).thenAnswer(inv ->
                new InviteHandle(inv.getArgument(0), "https://t.me/+link" + linkCounter.incrementAndGet(),
                        inv.getArgument(2)));
    }

    @Test
    void issue_storesInviteWithTtl() {
        InviteHandle handle = manager.issue("G1", "42");

        InviteRecord record = store.invite("G1", "42");
        assertThat(record.getInviteLink()).isEqualTo(handle.link());
        assertThat(record.getExpiresAt() - record.getIssuedAt()).isEqualTo(Duration.ofMinutes(10).toMillis());
        verify(gateway).createOneTimeInvite("G1", "Verified 42", record.getExpiresAt());
        verify(metricsConfig).recordInvite("issued");
    }

    @Test
    void issue_twice_revokesPreviousInvite() {
        InviteHandle first = manager.issue("G1", "42");
        InviteHandle second = manager.issue("G1", "42");

        assertThat(store.invites).hasSize(1);
        assertThat(store.invite("G1", "42").getInviteLink()).isEqualTo(second.link());
        verify(gateway).revokeInvite("G1", first.link());
        verify(gateway, never()).revokeInvite("G1", second.link());
    }

    @Test
    void issue_transportFailure_propagatesAndStoresNothing() {
        doThrow(new MessagingException("chat not found"))
                .when(gateway).createOneTimeInvite(eq("G1"), anyString(), anyLong());

        assertThatThrownBy(() -> manager.issue("G1", "42")).isInstanceOf(MessagingException.class);
        assertThat(store.invites).isEmpty();
    }

    @Test
    void onMemberJoined_revokesAndForgetsInvite() {
        InviteHandle handle = manager.issue("G1", "42");

        manager.onMemberJoined("G1", "42");

        assertThat(store.invites).isEmpty();
        verify(gateway).revokeInvite("G1", handle.link());
        verify(metricsConfig).recordInvite("consumed");
    }

    @Test
    void onMemberJoined_withoutInvite_doesNothing() {
        manager.onMemberJoined("G1", "42");

        verify(gateway, never()).revokeInvite(anyString(), anyString());
    }

    @Test
    void invalidate_revokeFailure_stillForgetsInvite() {
        manager.issue("G1", "42");
        doThrow(new MessagingException("INVITE_HASH_EXPIRED")).when(gateway).revokeInvite(eq("G1"), anyString());

        manager.invalidate("G1", "42");

        assertThat(store.invites).isEmpty();
        verify(metricsConfig, never()).recordInvite("invalidated");
    }

    @Test
    void purgeExpired_removesOnlyExpiredInvites() {
        manager.issue("G1", "41");
        clock.advance(Duration.ofMinutes(6));
        manager.issue("G1", "42");
        clock.advance(Duration.ofMinutes(5));

        int purged = manager.purgeExpired();

        assertThat(purged).isEqualTo(1);
        assertThat(store.invite("G1", "41")).isNull();
        assertThat(store.invite("G1", "42")).isNotNull();
        verify(metricsConfig).recordInvite("expired");
    }
}
