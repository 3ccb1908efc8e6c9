package com.flagship.bridge_ledger.lock;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@Testcontainers(disabledWithoutDocker = true)
class RedisLockBackendTest {

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    private static LettuceConnectionFactory connectionFactory;
    private static StringRedisTemplate redisTemplate;

    private RedisLockBackend backend;

    @BeforeAll
    static void connect() {
        connectionFactory = new LettuceConnectionFactory(
            new RedisStandaloneConfiguration(redis.getHost(), redis.getMappedPort(6379)));
        connectionFactory.afterPropertiesSet();
        connectionFactory.start();
        redisTemplate = new StringRedisTemplate(connectionFactory);
    }

    @AfterAll
    static void disconnect() {
        connectionFactory.destroy();
    }

    @BeforeEach
    void setUp() {
        backend = new RedisLockBackend(redisTemplate);
        backend.clear("*");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Only the owner value releases a lock")
    void testOwnerRelease() throws Exception {
        printTestHeader("Owner Release");

        assertTrue(backend.acquire("op_lock:g1", "owner-a", Duration.ofSeconds(30), Duration.ofMillis(100)));
        assertEquals("owner-a", backend.holder("op_lock:g1").orElseThrow());

        assertFalse(backend.release("op_lock:g1", "owner-b"));
        assertTrue(backend.exists("op_lock:g1"));
        assertTrue(backend.release("op_lock:g1", "owner-a"));
        assertFalse(backend.exists("op_lock:g1"));
        printSuccess("Release checked against the owner value");
    }

    @Test
    @DisplayName("A held lock blocks a second owner until the wait runs out")
    void testSecondOwnerWaits() throws Exception {
        printTestHeader("Second Owner Waits");

        assertTrue(backend.acquire("cust_id_lock:alice", "a", Duration.ofSeconds(30), Duration.ofMillis(100)));

        long start = System.nanoTime();
        assertFalse(backend.acquire("cust_id_lock:alice", "b", Duration.ofSeconds(30), Duration.ofMillis(300)));
        assertTrue((System.nanoTime() - start) / 1_000_000 >= 250);
        printSuccess("Second owner refused after waiting");
    }

    @Test
    @DisplayName("A lock left behind expires after its time-to-live")
    void testExpiry() throws Exception {
        printTestHeader("Lock Expiry");

        assertTrue(backend.acquire("op_lock:crashed", "gone", Duration.ofMillis(300), Duration.ofMillis(100)));
        assertTrue(backend.acquire("op_lock:crashed", "next", Duration.ofSeconds(30), Duration.ofSeconds(3)));
        assertEquals("next", backend.holder("op_lock:crashed").orElseThrow());
        printSuccess("Expired lock taken over");
    }

    @Test
    @DisplayName("Active locks are listed with their remaining time and can be cleared")
    void testActiveAndClear() throws Exception {
        printTestHeader("Active Locks");

        backend.acquire("op_lock:g1", "a", Duration.ofSeconds(30), Duration.ofMillis(100));
        backend.acquire("op_lock:g2", "b", Duration.ofSeconds(30), Duration.ofMillis(100));
        backend.acquire("cust_id_lock:alice", "c", Duration.ofSeconds(30), Duration.ofMillis(100));

        assertEquals(2, backend.activeLocks("op_lock:*").size());
        assertTrue(backend.activeLocks("op_lock:*").get("op_lock:g1").toSeconds() > 0);
        assertEquals(2, backend.clear("op_lock:*"));
        assertTrue(backend.exists("cust_id_lock:alice"));
        printSuccess("Listed and cleared by pattern");
    }
}
