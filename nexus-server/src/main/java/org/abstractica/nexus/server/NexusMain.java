package org.abstractica.nexus.server;

import org.abstractica.nexus.NexusServer;
import org.abstractica.nexus.Participant;
import org.abstractica.nexus.impl.config.NexusConfig;
import org.abstractica.nexus.impl.session.DefaultNexusServerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;

/**
 * Runs the Nexus server from the command line.
 *
 * <p>Settings come from environment variables and system properties (see
 * {@link NexusConfig}). A port given as the first argument overrides both.
 * The console accepts {@code list}, {@code kick <name>} and {@code quit}.
 * When standard input is closed the server keeps running until the JVM is
 * shut down.</p>
 */
public class NexusMain
{
    private static final Logger LOG = LoggerFactory.getLogger(NexusMain.class);

    private final NexusServer server;
    private final PrintStream out;

    public NexusMain(NexusServer server, PrintStream out)
    {
        this.server = server;
        this.out = out;

        registerLifecycleCallbacks();
    }

    private void registerLifecycleCallbacks()
    {
        server.onParticipantJoined(participant ->
                LOG.info("Participant joined: {} ({})", participant.name(), participant.id()));

        server.onParticipantLeft((participant, reason) ->
                LOG.info("Participant left: {} ({})", participant.name(), reason));

        server.onError((participantId, frameType, exception) ->
                LOG.error("Error handling frame: participant={}, type={}", participantId, frameType, exception));
    }

    /**
     * Reads console commands until {@code quit} or end of input.
     *
     * @param input console input
     * @return true if the operator asked to quit, false on end of input
     */
    public boolean runCommandLoop(Reader input)
    {
        BufferedReader reader = new BufferedReader(input);
        out.println("Server commands: list, kick <name>, quit");

        try
        {
            String line;
            while ((line = reader.readLine()) != null)
            {
                String[] parts = line.trim().split("\\s+", 2);
                String command = parts[0].toLowerCase();

                switch (command)
                {
                    case "list" -> listParticipants();
                    case "kick" ->
                    {
                        if (parts.length > 1)
                        {
                            kickParticipant(parts[1]);
                        }
                        else
                        {
                            out.println("Usage: kick <name>");
                        }
                    }
                    case "quit", "exit", "q" ->
                    {
                        out.println("Shutting down...");
                        return true;
                    }
                    case "" ->
                    {
                        // Ignore empty input
                    }
                    default -> out.println("Unknown command: " + command);
                }
            }
        }
        catch (IOException e)
        {
            LOG.error("Error reading console input", e);
        }
        return false;
    }

    private void listParticipants()
    {
        List<Participant> participants = server.getParticipants();
        if (participants.isEmpty())
        {
            out.println("No participants connected");
            return;
        }

        out.println("Connected participants:");
        for (Participant participant : participants)
        {
            out.printf("  %s (%s) at (%d, %d)%n",
                    participant.name(), participant.id(), participant.x(), participant.y());
        }
    }

    private void kickParticipant(String nameOrId)
    {
        Optional<Participant> target = server.getParticipants().stream()
                .filter(p -> p.id().equals(nameOrId) || p.name().equalsIgnoreCase(nameOrId))
                .findFirst();

        if (target.isPresent() && server.kick(target.get().id(), "Kicked by server"))
        {
            LOG.info("Kicked participant: {}", target.get().name());
            return;
        }
        out.println("Participant not found: " + nameOrId);
    }

    public static void main(String[] args)
    {
        NexusConfig config;
        try
        {
            config = NexusConfig.fromEnvironment();
        }
        catch (IllegalArgumentException e)
        {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return;
        }

        DefaultNexusServerFactory.DefaultBuilder builder = new DefaultNexusServerFactory().builder();
        config.applyTo(builder);

        if (args.length > 0)
        {
            try
            {
                builder.port(Integer.parseInt(args[0]));
            }
            catch (IllegalArgumentException e)
            {
                System.err.println("Invalid port number: " + args[0]);
                System.exit(1);
                return;
            }
        }

        NexusServer server = builder.build();
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() ->
        {
            server.close();
            stopped.countDown();
        }, "nexus-shutdown"));

        server.start();

        NexusMain main = new NexusMain(server, System.out);
        boolean quit = main.runCommandLoop(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        if (quit)
        {
            server.close();
            return;
        }

        try
        {
            stopped.await();
        }
        catch (InterruptedException e)
        {
            Thread.currentThread().interrupt();
            server.close();
        }
    }
}
