package com.questrail.vault.protocol.observability;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.questrail.vault.api.TransportFailure;
import com.questrail.vault.api.VaultTransportException;
import com.questrail.vault.protocol.model.VaultMethod;
import com.questrail.vault.session.SessionState;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class Slf4jVaultObservabilitySinkTest {

    @Test
    void logsEachEventKindAtItsLevel() {
        Slf4jVaultObservabilitySink sink = new Slf4jVaultObservabilitySink();

        Logger logger = (Logger) LoggerFactory.getLogger(Slf4jVaultObservabilitySink.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Level originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);

        try {
            sink.onExchange(new VaultExchangeEvent(Instant.now(), VaultMethod.GET_SOURCES, 0, 10,
                Duration.ofMillis(3)));
            sink.onSessionTransition(new VaultSessionTransitionEvent(Instant.now(), "alice",
                SessionState.ANONYMOUS, SessionState.AWAITING_CHALLENGE));
            sink.onError(new VaultErrorEvent(Instant.now(), VaultMethod.LOGIN_REQUEST, "refused",
                new VaultTransportException(TransportFailure.CONNECTION_REFUSED, "refused")));
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(originalLevel);
            appender.stop();
        }

        List<ILoggingEvent> events = appender.list;
        assertEquals(3, events.size());
        assertEquals(Level.DEBUG, events.get(0).getLevel());
        assertTrue(events.get(0).getFormattedMessage().contains("get_sources"));
        assertEquals(Level.INFO, events.get(1).getLevel());
        assertTrue(events.get(1).getFormattedMessage().contains("ANONYMOUS -> AWAITING_CHALLENGE"));
        assertEquals(Level.ERROR, events.get(2).getLevel());
        assertNotNull(events.get(2).getThrowableProxy());
    }
}
