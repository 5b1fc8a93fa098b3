package io.github.eutro.exnorm.test;

import io.github.eutro.exnorm.analysis.TokenScan;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.junit.jupiter.api.Assertions.*;

public class TokenScanTest {
    @Test
    void wholeTokensOnly() {
        assertTrue(TokenScan.containsIdentifier("foo(bar)", "bar"));
        assertTrue(TokenScan.containsIdentifier("bar", "bar"));
        assertTrue(TokenScan.containsIdentifier("<%= @bar %>", "bar"));
        assertFalse(TokenScan.containsIdentifier("foobar", "bar"));
        assertFalse(TokenScan.containsIdentifier("bar_1 + bar2", "bar"));
        assertTrue(TokenScan.containsIdentifier("bar_1 + bar", "bar"));
        assertFalse(TokenScan.containsIdentifier("", "x"));
        assertFalse(TokenScan.containsIdentifier("x", ""));
    }

    @Test
    void identifierRuns() {
        assertEquals(new LinkedHashSet<>(Arrays.asList("a", "b", "c_1", "2")),
                TokenScan.identifiers("a.b(c_1) + 2 - a"));
        assertTrue(TokenScan.identifiers("  ++ ").isEmpty());
    }

    @Test
    void attributeAccess() {
        assertTrue(TokenScan.hasAttributeAccess("<%= @user.name %>"));
        assertTrue(TokenScan.hasAttributeAccess("@_private"));
        assertFalse(TokenScan.hasAttributeAccess("x@Y"));
        assertFalse(TokenScan.hasAttributeAccess("a @ b"));
    }
}
