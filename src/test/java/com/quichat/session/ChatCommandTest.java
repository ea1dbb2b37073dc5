package com.quichat.session;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChatCommandTest {

    @Test
    void testParse_KnownNamesAndAliases() {
        assertEquals(ChatCommand.LIST, ChatCommand.parse("list").orElseThrow());
        assertEquals(ChatCommand.PING, ChatCommand.parse("ping").orElseThrow());
        assertEquals(ChatCommand.HELP, ChatCommand.parse("?").orElseThrow());
        assertEquals(ChatCommand.HELP, ChatCommand.parse("h").orElseThrow());
        assertEquals(ChatCommand.QUIT, ChatCommand.parse("exit").orElseThrow());
        assertEquals(ChatCommand.QUIT, ChatCommand.parse("q").orElseThrow());
    }

    @Test
    void testParse_IgnoresCaseAndWhitespace() {
        assertEquals(ChatCommand.QUIT, ChatCommand.parse("  QuIt ").orElseThrow());
    }

    @Test
    void testParse_UnknownOrEmpty() {
        assertTrue(ChatCommand.parse("dance").isEmpty());
        assertTrue(ChatCommand.parse("").isEmpty());
        assertTrue(ChatCommand.parse("list all").isEmpty());
    }
}
