package com.socialgenius.browseruse.backend.service;

import com.socialgenius.browseruse.backend.agent.BrowsingContext;
import com.socialgenius.browseruse.backend.config.AutomationProperties;
import com.socialgenius.browseruse.backend.model.BrowserCookie;
import com.socialgenius.browseruse.backend.model.BrowserSession;
import com.socialgenius.browseruse.backend.repository.BrowserSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Two-tier store of per-account browser sessions.
 * <p>
 * The in-memory index answers reads when it has the account; otherwise MongoDB is consulted
 * and the index filled from it. Saves go to MongoDB first and then to memory, so after a
 * restart the database alone is the source of truth.
 */
@Service
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final BrowserSessionRepository repository;
    private final Clock clock;
    private final Duration retention;
    private final Map<String, BrowserSession> cache = new ConcurrentHashMap<>();

    @Autowired
    public SessionStore(BrowserSessionRepository repository, Clock clock, AutomationProperties properties) {
        this(repository, clock, properties.getSessions().getRetention());
    }

    SessionStore(BrowserSessionRepository repository, Clock clock, Duration retention) {
        this.repository = repository;
        this.clock = clock;
        this.retention = retention;
    }

    /**
     * Stores the session for an account, replacing any previous one.
     *
     * @return true once both tiers hold the new session; false if there was nothing worth
     *         saving or the database write failed
     */
    public boolean save(String accountKey, List<BrowserCookie> cookies, Map<String, String> localStorage,
            Map<String, String> sessionStorage, Map<String, String> metadata) {
        if (cookies == null || cookies.isEmpty()) {
            log.warn("[SESSION] Not saving session for business {}: no cookies", accountKey);
            return false;
        }
        BrowserSession session = BrowserSession.builder()
                .accountKey(accountKey)
                .cookies(new ArrayList<>(cookies))
                .localStorage(copyOf(localStorage))
                .sessionStorage(copyOf(sessionStorage))
                .metadata(copyOf(metadata))
                .lastUpdated(clock.instant())
                .build();
        try {
            repository.save(session);
            cache.put(accountKey, session);
        } catch (RuntimeException e) {
            log.error("[SESSION] Error saving browser session for business {}: {}", accountKey, e.getMessage());
            return false;
        }

        log.info("[SESSION] Saved browser session for business {} with {} cookies, {} storage items{}",
                accountKey, session.cookieCount(), session.storageItemCount(),
                session.getMetadata().isEmpty() ? "" : " and metadata: " + session.getMetadata());
        return true;
    }

    public boolean save(BrowserSession session) {
        return save(session.getAccountKey(), session.getCookies(), session.getLocalStorage(),
                session.getSessionStorage(), session.getMetadata());
    }

    /**
     * Looks up the session for an account. Sessions without cookies count as absent.
     * The returned session is a copy; changing it leaves the stored one untouched.
     */
    public Optional<BrowserSession> load(String accountKey) {
        BrowserSession cached = cache.get(accountKey);
        if (cached != null) {
            log.debug("[SESSION] Loaded browser session from memory for business {}", accountKey);
            return Optional.of(cached).filter(BrowserSession::hasCookies).map(SessionStore::detach);
        }
        try {
            Optional<BrowserSession> stored = repository.findById(accountKey)
                    .filter(BrowserSession::hasCookies);
            if (stored.isEmpty()) {
                log.info("[SESSION] No saved browser session found for business {}", accountKey);
                return Optional.empty();
            }
            cache.put(accountKey, stored.get());
            log.info("[SESSION] Loaded browser session from database for business {}", accountKey);
            return stored.map(SessionStore::detach);
        } catch (RuntimeException e) {
            log.error("[SESSION] Error loading browser session for business {}: {}", accountKey, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Pushes a stored session into a browsing context. Each cookie and storage item is applied
     * on its own; a failing item is logged and skipped.
     *
     * @return false if the session has no cookies, true otherwise
     */
    public boolean apply(BrowserSession session, BrowsingContext context) {
        if (session == null || !session.hasCookies()) {
            return false;
        }
        int applied = 0;
        for (BrowserCookie cookie : session.getCookies()) {
            try {
                context.addCookie(cookie);
                applied++;
            } catch (RuntimeException e) {
                log.warn("[SESSION] Error setting cookie {}: {}", cookie.getName(), e.getMessage());
            }
        }
        session.getLocalStorage().forEach((key, value) -> {
            try {
                context.setLocalStorageItem(key, value);
            } catch (RuntimeException e) {
                log.warn("[SESSION] Error setting localStorage item {}: {}", key, e.getMessage());
            }
        });
        session.getSessionStorage().forEach((key, value) -> {
            try {
                context.setSessionStorageItem(key, value);
            } catch (RuntimeException e) {
                log.warn("[SESSION] Error setting sessionStorage item {}: {}", key, e.getMessage());
            }
        });
        log.info("[SESSION] Applied browser session for business {} ({}/{} cookies)",
                session.getAccountKey(), applied, session.cookieCount());
        return true;
    }

    /**
     * Captures the current cookies and web storage of a context. Storage read failures leave
     * the corresponding map empty; a cookie read failure propagates because cookies are what
     * makes a session usable.
     */
    public BrowserSession extract(String accountKey, BrowsingContext context) {
        List<BrowserCookie> cookies = context.cookies();

        Map<String, String> localStorage = new LinkedHashMap<>();
        try {
            localStorage.putAll(context.localStorage());
        } catch (RuntimeException e) {
            log.warn("[SESSION] Error getting localStorage: {}", e.getMessage());
        }

        Map<String, String> sessionStorage = new LinkedHashMap<>();
        try {
            sessionStorage.putAll(context.sessionStorage());
        } catch (RuntimeException e) {
            log.warn("[SESSION] Error getting sessionStorage: {}", e.getMessage());
        }

        return BrowserSession.builder()
                .accountKey(accountKey)
                .cookies(cookies == null ? new ArrayList<>() : new ArrayList<>(cookies))
                .localStorage(localStorage)
                .sessionStorage(sessionStorage)
                .lastUpdated(clock.instant())
                .build();
    }

    /**
     * Advisory staleness: true once the session is older than the retention window.
     * Expired sessions are reported, never purged.
     */
    public boolean isExpired(BrowserSession session) {
        if (session.getLastUpdated() == null) {
            return true;
        }
        return Duration.between(session.getLastUpdated(), clock.instant()).compareTo(retention) > 0;
    }

    public int cachedCount() {
        return cache.size();
    }

    /**
     * Forgets the in-memory tier; subsequent loads read from the database.
     */
    public void clearCache() {
        cache.clear();
    }

    private static BrowserSession detach(BrowserSession session) {
        List<BrowserCookie> cookies = new ArrayList<>();
        for (BrowserCookie cookie : session.getCookies()) {
            cookies.add(cookie.toBuilder().build());
        }
        return session.toBuilder()
                .cookies(cookies)
                .localStorage(copyOf(session.getLocalStorage()))
                .sessionStorage(copyOf(session.getSessionStorage()))
                .metadata(copyOf(session.getMetadata()))
                .build();
    }

    private static Map<String, String> copyOf(Map<String, String> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }
}
