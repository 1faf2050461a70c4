package com.tencent.hpcflow.app.session;

import com.tencent.hpcflow.domain.exception.NotFoundException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionRegistryTest {

    private final SessionRegistry registry = new SessionRegistry(Clock.systemUTC());

    @Test
    void testFocusIsPerSession() {
        SessionContext first = registry.open();
        SessionContext second = registry.open();
        assertNotEquals(first.getId(), second.getId());

        registry.focus(first.getId(), "io_test");

        assertEquals(Optional.of("io_test"), registry.focused(first.getId()));
        assertTrue(registry.focused(second.getId()).isEmpty());
        assertEquals(List.of(first.getId()), registry.focusedElsewhere("io_test", second.getId()));
        assertTrue(registry.focusedElsewhere("io_test", first.getId()).isEmpty());
        // 没有会话标识时所有聚焦都算在别处
        assertEquals(List.of(first.getId()), registry.focusedElsewhere("io_test", null));
    }

    @Test
    void testReleaseClearsFocusEverywhere() {
        SessionContext first = registry.open();
        SessionContext second = registry.open();
        registry.focus(first.getId(), "io_test");
        registry.focus(second.getId(), "io_test");

        registry.release("io_test");

        assertTrue(registry.focused(first.getId()).isEmpty());
        assertTrue(registry.focused(second.getId()).isEmpty());
    }

    @Test
    void testUnknownSession() {
        assertThrows(NotFoundException.class, () -> registry.get("missing"));
        assertThrows(NotFoundException.class, () -> registry.focus(null, "io_test"));

        SessionContext session = registry.open();
        registry.close(session.getId());
        assertThrows(NotFoundException.class, () -> registry.close(session.getId()));
    }
}
