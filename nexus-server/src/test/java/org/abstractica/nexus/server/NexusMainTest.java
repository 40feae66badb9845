package org.abstractica.nexus.server;

import org.abstractica.nexus.CloseReason;
import org.abstractica.nexus.NexusServer;
import org.abstractica.nexus.impl.session.DefaultNexusServerFactory;
import org.abstractica.nexus.impl.transport.SimulatedConnection;
import org.abstractica.nexus.impl.transport.SimulatedTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NexusMain}'s console commands.
 */
class NexusMainTest
{
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final List<CloseReason> leftReasons = new CopyOnWriteArrayList<>();

    private SimulatedTransport transport;
    private NexusServer server;
    private NexusMain main;

    @BeforeEach
    void setUp()
    {
        transport = new SimulatedTransport();
        server = new DefaultNexusServerFactory().builder()
                .transport(transport)
                .build();
        server.onParticipantLeft((participant, reason) -> leftReasons.add(reason));
        main = new NexusMain(server, new PrintStream(output, true, StandardCharsets.UTF_8));
        server.start();
    }

    @AfterEach
    void tearDown()
    {
        server.close();
    }

    private String console()
    {
        return output.toString(StandardCharsets.UTF_8);
    }

    @Test
    void list_withoutParticipants()
    {
        main.runCommandLoop(new StringReader("list\n"));

        assertTrue(console().contains("No participants connected"));
    }

    @Test
    void list_showsNamesAndPositions()
    {
        SimulatedConnection alice = transport.connect();
        alice.receive("{\"type\":\"join\",\"payload\":{\"name\":\"Alice\"}}");

        main.runCommandLoop(new StringReader("list\n"));

        assertTrue(console().contains("Alice ("), console());
    }

    @Test
    void kick_byName_closesConnection()
    {
        SimulatedConnection alice = transport.connect();
        alice.receive("{\"type\":\"join\",\"payload\":{\"name\":\"Alice\"}}");

        main.runCommandLoop(new StringReader("kick alice\n"));

        assertFalse(alice.isOpen());
        assertEquals(new CloseReason.Kicked("Kicked by server"), leftReasons.get(0));
    }

    @Test
    void kick_unknownName_reportsNotFound()
    {
        main.runCommandLoop(new StringReader("kick nobody\n"));

        assertTrue(console().contains("Participant not found: nobody"));
    }

    @Test
    void quit_stopsLoop()
    {
        boolean quit = main.runCommandLoop(new StringReader("quit\nlist\n"));

        assertTrue(quit);
        assertFalse(console().contains("No participants connected"), "commands after quit are not read");
    }

    @Test
    void endOfInput_returnsFalse()
    {
        assertFalse(main.runCommandLoop(new StringReader("")));
    }

    @Test
    void unknownCommand_isReported()
    {
        main.runCommandLoop(new StringReader("dance\n\n"));

        assertTrue(console().contains("Unknown command: dance"));
    }
}
