package com.contrastsecurity.depupdate.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class RequestSetTest {

    @Test
    public void testBuilderOnlyAddsAbsentNames() {
        RequestSet.Builder builder = RequestSet.builder().put("a", VersionToken.exact("2.0.0"));

        assertFalse(builder.addIfAbsent("a", VersionToken.tag("latest")));
        assertTrue(builder.addIfAbsent("b", VersionToken.tag("latest")));

        RequestSet requests = builder.build();
        assertEquals(VersionToken.exact("2.0.0"), requests.get("a"));
        assertEquals(Arrays.asList("a", "b"), new ArrayList<>(requests.names()));
    }

    @Test
    public void testToBuilderLeavesOriginalUntouched() {
        RequestSet original = RequestSet.builder().put("a", VersionToken.tag("latest")).build();

        RequestSet grown = original.toBuilder().put("b", VersionToken.range("^1.0.0")).build();

        assertEquals(1, original.size());
        assertEquals(2, grown.size());
        assertThrows(UnsupportedOperationException.class, () -> grown.asMap().remove("a"));
    }

    @Test
    public void testEmpty() {
        assertTrue(RequestSet.builder().build().isEmpty());
        assertEquals(RequestSet.empty(), RequestSet.builder().build());
    }
}
