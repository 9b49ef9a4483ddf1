package com.tcpchat;

import com.tcpchat.command.Command;
import com.tcpchat.command.CommandProcessor;
import com.tcpchat.protocol.ChatFrameEncoder;
import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.MessageType;
import com.tcpchat.session.BroadcastEngine;
import com.tcpchat.session.ConnectionRegistry;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the Command Processor:
 * - Verb parsing
 * - Responses go to the issuer only
 */
@DisplayName("Command Processor Tests")
class CommandProcessorTest {

    private ConnectionRegistry registry;
    private CommandProcessor processor;
    private EmbeddedChannel alice;
    private EmbeddedChannel bob;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        processor = new CommandProcessor(registry, new BroadcastEngine(registry));
        alice = new EmbeddedChannel(new ChatFrameEncoder());
        bob = new EmbeddedChannel(new ChatFrameEncoder());
        registry.register(alice, "alice");
        registry.register(bob, "bob");
    }

    // ==========================================
    // Test: Parsing
    // ==========================================

    @Test
    @DisplayName("Verbs are case-insensitive and arguments are ignored")
    void testParse() {
        assertEquals(Command.QUIT, Command.parse("/quit"));
        assertEquals(Command.QUIT, Command.parse("/QUIT"));
        assertEquals(Command.USERS, Command.parse("/Users now please"));
        assertEquals(Command.HELP, Command.parse("  /help  "));
        assertEquals(Command.UNKNOWN, Command.parse("/"));
        assertEquals(Command.UNKNOWN, Command.parse("/quitnow"));
        assertEquals(Command.UNKNOWN, Command.parse("/send file.txt"));
    }

    // ==========================================
    // Test: Responses
    // ==========================================

    @Test
    @DisplayName("/users lists online users in join order")
    void testUsers() {
        processor.process(alice, "alice", "/users");

        assertEquals(List.of(ChatMessage.of(MessageType.TEXT, "[Server] Online users: alice, bob")),
                Frames.drain(alice));
        assertEquals(List.of(), Frames.drain(bob));
    }

    @Test
    @DisplayName("/help lists the commands")
    void testHelp() {
        processor.process(bob, "bob", "/HELP");

        List<ChatMessage> received = Frames.drain(bob);
        assertEquals(1, received.size());
        assertEquals(MessageType.TEXT, received.get(0).getType());
        String help = received.get(0).payloadText();
        assertTrue(help.startsWith("[Server] Commands:"));
        assertTrue(help.contains("/users"));
        assertTrue(help.contains("/send <filepath>"));
        assertTrue(help.contains("/quit"));
    }

    @Test
    @DisplayName("Unknown commands get an ERROR")
    void testUnknown() {
        processor.process(alice, "alice", "/dance");

        assertEquals(List.of(ChatMessage.of(MessageType.ERROR, "Unknown command. Type /help.")),
                Frames.drain(alice));
        assertTrue(alice.isOpen());
    }

    @Test
    @DisplayName("/quit acks then closes without touching the registry")
    void testQuit() {
        processor.process(alice, "alice", "/quit");

        assertEquals(List.of(ChatMessage.of(MessageType.COMMAND, "/quit_ack")), Frames.drain(alice));
        assertFalse(alice.isOpen());
        assertTrue(registry.isRegistered(alice), "Unregistering is left to the session teardown");
        assertEquals(List.of(), Frames.drain(bob));
    }
}
