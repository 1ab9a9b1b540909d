package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.model.BrowserSession;
import com.socialgenius.browseruse.backend.repository.BrowserSessionRepository;
import com.socialgenius.browseruse.backend.support.FakeBrowsingContext;
import com.socialgenius.browseruse.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.socialgenius.browseruse.backend.support.FakeBrowsingContext.cookie;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionStoreTest {

    @Mock
    private BrowserSessionRepository repository;

    private MutableClock clock;
    private SessionStore sessionStore;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        sessionStore = new SessionStore(repository, clock, Duration.ofDays(7));
    }

    @Test
    void shouldSaveToDatabaseThenMemory() {
        // When
        boolean saved = sessionStore.save("biz-1", List.of(cookie("SID", "abc")),
                Map.of("theme", "dark"), Map.of(), Map.of("associated_session_id", "s-1"));

        // Then
        assertTrue(saved);
        verify(repository).save(any(BrowserSession.class));
        Optional<BrowserSession> loaded = sessionStore.load("biz-1");
        assertTrue(loaded.isPresent());
        assertEquals(clock.instant(), loaded.get().getLastUpdated());
        assertEquals("s-1", loaded.get().getMetadata().get("associated_session_id"));
        verify(repository, never()).findById(any());
    }

    @Test
    void shouldHandOutCopiesThatCannotAlterCachedSession() {
        // Given
        sessionStore.save("biz-1", List.of(cookie("SID", "abc")), Map.of("theme", "dark"), Map.of(), Map.of());

        // When
        BrowserSession loaded = sessionStore.load("biz-1").orElseThrow();
        loaded.getCookies().get(0).setValue("tampered");
        loaded.getCookies().add(cookie("HSID", "extra"));
        loaded.getLocalStorage().clear();

        // Then
        BrowserSession reloaded = sessionStore.load("biz-1").orElseThrow();
        assertEquals(1, reloaded.cookieCount());
        assertEquals("abc", reloaded.getCookies().get(0).getValue());
        assertEquals(Map.of("theme", "dark"), reloaded.getLocalStorage());
    }

    @Test
    void shouldNotSaveSessionWithoutCookies() {
        assertFalse(sessionStore.save("biz-1", List.of(), Map.of(), Map.of(), Map.of()));
        verifyNoInteractions(repository);
        assertEquals(0, sessionStore.cachedCount());
    }

    @Test
    void shouldReportDatabaseFailureOnSave() {
        when(repository.save(any(BrowserSession.class))).thenThrow(new IllegalStateException("mongo down"));

        boolean saved = sessionStore.save("biz-1", List.of(cookie("SID", "abc")), null, null, null);

        assertFalse(saved);
        assertEquals(0, sessionStore.cachedCount());
    }

    @Test
    void shouldLoadFromDatabaseOnColdCache() {
        // Given
        BrowserSession stored = session("biz-2", clock.instant());
        when(repository.findById("biz-2")).thenReturn(Optional.of(stored));

        // When
        Optional<BrowserSession> first = sessionStore.load("biz-2");
        Optional<BrowserSession> second = sessionStore.load("biz-2");

        // Then
        assertTrue(first.isPresent());
        assertTrue(second.isPresent());
        verify(repository, times(1)).findById("biz-2");
        assertEquals(1, sessionStore.cachedCount());
    }

    @Test
    void shouldTreatCookielessDocumentAsAbsent() {
        BrowserSession empty = BrowserSession.builder().accountKey("biz-3").lastUpdated(clock.instant()).build();
        when(repository.findById("biz-3")).thenReturn(Optional.of(empty));

        assertTrue(sessionStore.load("biz-3").isEmpty());
    }

    @Test
    void shouldDegradeWhenDatabaseFailsOnLoad() {
        when(repository.findById("biz-4")).thenThrow(new IllegalStateException("mongo down"));

        assertTrue(sessionStore.load("biz-4").isEmpty());
    }

    @Test
    void shouldApplyCookiesAndStorageSkippingFailures() {
        // Given
        FakeBrowsingContext context = new FakeBrowsingContext().rejectCookie("BAD");
        BrowserSession session = session("biz-1", clock.instant());
        session.getCookies().add(cookie("BAD", "x"));
        session.getLocalStorage().put("theme", "dark");
        session.getSessionStorage().put("tab", "1");

        // When
        boolean applied = sessionStore.apply(session, context);

        // Then
        assertTrue(applied);
        assertEquals(1, context.cookies().size());
        assertEquals("dark", context.localStorage().get("theme"));
        assertEquals("1", context.sessionStorage().get("tab"));
    }

    @Test
    void shouldNotApplySessionWithoutCookies() {
        BrowserSession empty = BrowserSession.builder().accountKey("biz-1").build();

        assertFalse(sessionStore.apply(empty, new FakeBrowsingContext()));
        assertFalse(sessionStore.apply(null, new FakeBrowsingContext()));
    }

    @Test
    void shouldExtractCookiesWhenStorageUnavailable() {
        FakeBrowsingContext context = new FakeBrowsingContext();
        context.addCookie(cookie("SID", "abc"));
        context.failStorageReads();

        BrowserSession extracted = sessionStore.extract("biz-1", context);

        assertEquals(1, extracted.cookieCount());
        assertTrue(extracted.getLocalStorage().isEmpty());
        assertTrue(extracted.getSessionStorage().isEmpty());
        assertEquals(clock.instant(), extracted.getLastUpdated());
    }

    @Test
    void shouldExpireAfterRetention() {
        Instant saved = clock.instant();
        BrowserSession session = session("biz-1", saved);

        clock.advance(Duration.ofDays(6).plusHours(23));
        assertFalse(sessionStore.isExpired(session));

        clock.advance(Duration.ofHours(1).plusSeconds(1));
        assertTrue(sessionStore.isExpired(session));
    }

    @Test
    void shouldReadThroughAfterCacheCleared() {
        sessionStore.save("biz-1", List.of(cookie("SID", "abc")), Map.of(), Map.of(), Map.of());
        sessionStore.clearCache();
        when(repository.findById("biz-1")).thenReturn(Optional.of(session("biz-1", clock.instant())));

        assertTrue(sessionStore.load("biz-1").isPresent());
        verify(repository).findById("biz-1");
    }

    private static BrowserSession session(String accountKey, Instant lastUpdated) {
        BrowserSession session = BrowserSession.builder()
                .accountKey(accountKey)
                .lastUpdated(lastUpdated)
                .build();
        session.getCookies().add(cookie("SID", "abc"));
        return session;
    }
}
