package com.questrail.expectations.api;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EnvironmentDescriptorTest
{
    @Test
    void nonFiniteNumbersRejected()
    {
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentDescriptor.builder().with("scale", Double.NaN));
        assertThrows(IllegalArgumentException.class,
                () -> EnvironmentDescriptor.of(Map.of("scale", Float.POSITIVE_INFINITY)));
        assertDoesNotThrow(() -> EnvironmentDescriptor.builder().with("scale", 1.0E-5));
    }

    @Test
    void unsupportedValuesRejected()
    {
        Map<String, Object> withNull = new HashMap<>();
        withNull.put("os", null);

        assertThrows(IllegalArgumentException.class, () -> EnvironmentDescriptor.of(withNull));
        assertThrows(IllegalArgumentException.class, () -> EnvironmentDescriptor.of(Map.of("os", new Object())));
        assertThrows(IllegalArgumentException.class, () -> EnvironmentDescriptor.of(Map.of(" ", "x")));
    }

    @Test
    void equalityIgnoresInsertionOrder()
    {
        EnvironmentDescriptor a = EnvironmentDescriptor.builder().with("os", "linux").with("debug", true).build();
        EnvironmentDescriptor b = EnvironmentDescriptor.builder().with("debug", true).with("os", "linux").build();

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
    }
}
