package io.parley.core.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.parley.core.model.Turn;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private SessionRegistry registry = registry(10);

    @AfterEach
    void tearDown() {
        registry.close();
    }

    @Test
    void shouldReuseSessionForSameOwner() {
        Session first = registry.getOrCreate("alice");
        Session second = registry.getOrCreate("alice");
        Session other = registry.getOrCreate("bob");

        assertThat(second).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(registry.size()).isEqualTo(2);
    }

    @Test
    void shouldCreateFreshSessionForAnonymousCallers() {
        Session first = registry.getOrCreate(null);
        Session second = registry.getOrCreate("  ");

        assertThat(second).isNotSameAs(first);
        assertThat(first.ownerId()).isEmpty();
    }

    @Test
    void shouldResolveByIdOnlyForMatchingOwner() {
        Session alice = registry.getOrCreate("alice");

        assertThat(registry.resolve("alice", alice.sessionId())).isSameAs(alice);
        assertThat(registry.resolve(null, alice.sessionId())).isSameAs(alice);
        assertThat(registry.resolve("mallory", alice.sessionId())).isNotSameAs(alice);
        assertThat(registry.resolve("alice", "unknown")).isSameAs(alice);
    }

    @Test
    void shouldExpireIdleSessions() {
        Session idle = registry.getOrCreate("idle");
        idle.appendTurn(Turn.user("hello"));
        clock.advance(Duration.ofMinutes(20));
        Session active = registry.getOrCreate("active");
        clock.advance(Duration.ofMinutes(11));

        int expired = registry.expireIdle();

        assertThat(expired).isEqualTo(1);
        assertThat(registry.find(idle.sessionId())).isEmpty();
        assertThat(registry.find(active.sessionId())).contains(active);
        assertThat(idle.isClosed()).isTrue();
        assertThat(idle.history()).isEmpty();
    }

    @Test
    void shouldReplaceExpiredOwnerSession() {
        Session original = registry.getOrCreate("alice");
        clock.advance(Duration.ofMinutes(31));

        Session replacement = registry.getOrCreate("alice");

        assertThat(replacement).isNotSameAs(original);
        assertThat(original.isClosed()).isTrue();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void shouldNotFindSessionPastTimeoutBeforeSweep() {
        Session anonymous = registry.getOrCreate(null);
        Session owned = registry.getOrCreate("alice");
        clock.advance(Duration.ofMinutes(31));

        assertThat(registry.find(anonymous.sessionId())).isEmpty();
        assertThat(anonymous.isClosed()).isTrue();
        assertThat(registry.resolve("alice", owned.sessionId())).isNotSameAs(owned);
        assertThat(owned.isClosed()).isTrue();
        assertThatThrownBy(() -> registry.enter(anonymous)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldNotExpirePinnedSession() {
        Session session = registry.getOrCreate("busy");
        try (SessionScope ignored = registry.enter(session)) {
            clock.advance(Duration.ofHours(2));

            assertThat(registry.expireIdle()).isZero();
            assertThat(session.isClosed()).isFalse();
        }
        clock.advance(Duration.ofHours(2));
        assertThat(registry.expireIdle()).isEqualTo(1);
    }

    @Test
    void shouldEvictLeastRecentlyUsedAtCapacity() {
        registry.close();
        registry = registry(2);
        Session oldest = registry.getOrCreate("a");
        clock.advance(Duration.ofSeconds(1));
        Session newer = registry.getOrCreate("b");
        clock.advance(Duration.ofSeconds(1));
        registry.find(oldest.sessionId());
        clock.advance(Duration.ofSeconds(1));

        Session third = registry.getOrCreate("c");

        assertThat(registry.size()).isEqualTo(2);
        assertThat(newer.isClosed()).isTrue();
        assertThat(registry.sessions()).containsExactly(oldest, third);
    }

    @Test
    void shouldNotEvictPinnedSessions() {
        registry.close();
        registry = registry(1);
        Session busy = registry.getOrCreate("busy");

        try (SessionScope ignored = registry.enter(busy)) {
            Session extra = registry.getOrCreate("extra");

            assertThat(busy.isClosed()).isFalse();
            assertThat(extra.isClosed()).isFalse();
            assertThat(registry.size()).isEqualTo(2);
        }
    }

    @Test
    void shouldRefuseScopeForRetiredSession() {
        Session session = registry.getOrCreate("gone");
        registry.remove(session.sessionId());

        assertThatThrownBy(() -> registry.enter(session)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldLoadOwnerCredentialsOnCreation() {
        registry.close();
        registry = new SessionRegistry(
            SessionSettings.defaults(),
            new ConfigCredentialProvider(Map.of("alice", Map.of("crm_token", "secret"))),
            clock
        );

        Session alice = registry.getOrCreate("alice");
        alice.updateCredentials(new SessionCredentials(Map.of("mail_token", "m")));

        assertThat(alice.credentials().get("crm_token")).contains("secret");
        assertThat(alice.credentials().get("mail_token")).contains("m");
        assertThat(registry.getOrCreate("bob").credentials().isEmpty()).isTrue();
        assertThat(alice.credentials().toString()).doesNotContain("secret");
    }

    @Test
    void shouldCloseSessionClientsOnCleanup() {
        Session session = registry.getOrCreate("alice");
        List<String> closed = new ArrayList<>();
        AutoCloseable client = session.client("crm", () -> (AutoCloseable) () -> closed.add("crm"));

        assertThat(session.client("crm", () -> (AutoCloseable) () -> closed.add("other"))).isSameAs(client);
        registry.remove(session.sessionId());

        assertThat(closed).containsExactly("crm");
    }

    @Test
    void shouldIsolateConcurrentSessions() throws Exception {
        int owners = 8;
        Map<String, Map<String, String>> tokens = new HashMap<>();
        for (int i = 0; i < owners; i++) {
            tokens.put("owner-" + i, Map.of("crm_token", "crm-" + i));
        }
        registry.close();
        registry = new SessionRegistry(
            new SessionSettings(Duration.ofMinutes(30), 10, Duration.ofMinutes(10)),
            new ConfigCredentialProvider(tokens),
            clock
        );
        ExecutorService pool = Executors.newFixedThreadPool(owners);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < owners; i++) {
                String owner = "owner-" + i;
                String ownToken = "crm-" + i;
                String mailToken = "mail-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    Session session = registry.getOrCreate(owner);
                    for (int turn = 0; turn < 50; turn++) {
                        try (SessionScope ignored = registry.enter(session)) {
                            if (SessionContext.current() != session) {
                                return false;
                            }
                            session.updateCredentials(new SessionCredentials(Map.of("mail_token", mailToken)));
                            session.appendTurn(Turn.user(owner + " " + turn));
                            SessionCredentials seen = SessionContext.current().credentials();
                            if (!seen.get("crm_token").equals(Optional.of(ownToken))
                                || !seen.get("mail_token").equals(Optional.of(mailToken))) {
                                return false;
                            }
                        }
                    }
                    return session.history().stream().allMatch(t -> t.text().startsWith(owner + " "));
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(registry.sessions()).hasSize(owners).allMatch(session -> session.historySize() == 50);
        for (Session session : registry.sessions()) {
            String suffix = session.ownerId().orElseThrow().substring("owner-".length());
            assertThat(session.credentials().get("crm_token")).contains("crm-" + suffix);
            assertThat(session.credentials().get("mail_token")).contains("mail-" + suffix);
        }
    }

    private SessionRegistry registry(int maxSessions) {
        return new SessionRegistry(
            new SessionSettings(Duration.ofMinutes(30), maxSessions, Duration.ofMinutes(10)),
            CredentialProvider.none(),
            clock
        );
    }
}
