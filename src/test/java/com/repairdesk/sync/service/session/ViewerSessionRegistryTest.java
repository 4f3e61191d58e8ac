package com.repairdesk.sync.service.session;

import com.repairdesk.sync.exception.SessionNotFoundException;
import com.repairdesk.sync.exception.TransportException;
import com.repairdesk.sync.model.domain.EntityKind;
import com.repairdesk.sync.model.domain.ViewScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ViewerSessionRegistry Tests")
class ViewerSessionRegistryTest {

    @Mock
    private ViewerSessionFactory factory;

    private SimpleMeterRegistry meterRegistry;
    private ViewerSessionRegistry registry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        registry = new ViewerSessionRegistry(factory, meterRegistry);
    }

    private static ViewerSession mockSession(ViewScope scope, long epoch) {
        ViewerSession session = mock(ViewerSession.class);
        AtomicBoolean active = new AtomicBoolean(true);
        lenient().when(session.scope()).thenReturn(scope);
        lenient().when(session.epoch()).thenReturn(epoch);
        lenient().when(session.isActive()).thenAnswer(invocation -> active.get());
        lenient().doAnswer(invocation -> {
            active.set(false);
            return null;
        }).when(session).stop();
        return session;
    }

    @Test
    @DisplayName("Starting the same scope twice should reuse the running session")
    void sameScopeReusesSession() {
        ViewScope scope = ViewScope.standard("u1");
        ViewerSession session = mockSession(scope, 1);
        when(factory.create(eq(scope), anyLong())).thenReturn(session);

        ViewerSession first = registry.start(scope);
        ViewerSession second = registry.start(scope);

        assertThat(second).isSameAs(first);
        verify(factory, times(1)).create(any(), anyLong());
        verify(session, times(1)).start();
        assertThat(meterRegistry.get("sync.sessions.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("A role change should stop the old session and build a new one")
    void roleChangeRebuildsSession() {
        ViewScope standard = ViewScope.standard("u1");
        ViewScope admin = ViewScope.admin("u1");
        ViewerSession old = mockSession(standard, 1);
        ViewerSession promoted = mockSession(admin, 2);
        when(factory.create(eq(standard), anyLong())).thenReturn(old);
        when(factory.create(eq(admin), anyLong())).thenReturn(promoted);

        registry.start(standard);
        ViewerSession current = registry.start(admin);

        assertThat(current).isSameAs(promoted);
        verify(old).stop();
        assertThat(registry.require("u1")).isSameAs(promoted);
    }

    @Test
    @DisplayName("A session that fails to start should not be registered")
    void failedStartIsRemoved() {
        ViewScope scope = ViewScope.standard("u1");
        ViewerSession session = mockSession(scope, 1);
        when(factory.create(eq(scope), anyLong())).thenReturn(session);
        doThrow(new TransportException(EntityKind.BOOKING, "down")).when(session).start();

        assertThatThrownBy(() -> registry.start(scope)).isInstanceOf(TransportException.class);

        verify(session).stop();
        assertThat(registry.find("u1")).isEmpty();
    }

    @Test
    @DisplayName("Stopping should remove the session")
    void stopRemovesSession() {
        ViewScope scope = ViewScope.admin("admin-1");
        ViewerSession session = mockSession(scope, 1);
        when(factory.create(eq(scope), anyLong())).thenReturn(session);
        registry.start(scope);

        assertThat(registry.stop("admin-1")).isTrue();
        assertThat(registry.stop("admin-1")).isFalse();
        assertThat(registry.activeSessions()).isEmpty();
        assertThatThrownBy(() -> registry.require("admin-1"))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    @DisplayName("Epochs should increase with every new session")
    void epochsIncrease() {
        ViewScope first = ViewScope.standard("u1");
        ViewScope second = ViewScope.standard("u2");
        ViewerSession firstSession = mockSession(first, 1);
        ViewerSession secondSession = mockSession(second, 2);
        when(factory.create(eq(first), eq(1L))).thenReturn(firstSession);
        when(factory.create(eq(second), eq(2L))).thenReturn(secondSession);

        assertThat(registry.start(first).epoch()).isEqualTo(1L);
        assertThat(registry.start(second).epoch()).isEqualTo(2L);
    }
}
