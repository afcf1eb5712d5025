package com.questrail.coedit.cli;

import com.questrail.coedit.protocol.codec.FramingException;
import com.questrail.coedit.protocol.codec.impl.DefaultCollabFrameDecoder;
import com.questrail.coedit.protocol.codec.impl.DefaultCollabFrameEncoder;
import com.questrail.coedit.protocol.config.CollabRuntimeConfig;
import com.questrail.coedit.protocol.model.CollabMessage;
import com.questrail.coedit.protocol.transport.FakePeerConnection;
import com.questrail.coedit.protocol.transport.FakePeerTransport;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CollabConsoleTest
{
    private final CollabRuntimeConfig config = CollabRuntimeConfig.defaults();
    private final FakePeerTransport transport = new FakePeerTransport();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();
    private final CollabConsole console =
            new CollabConsole(config, transport, new PrintStream(output, true, StandardCharsets.UTF_8));

    // -------------------------------------------------------------------------
    // Arguments
    // -------------------------------------------------------------------------

    @Test
    void hostWithoutPortUsesConfiguredDefault()
    {
        assertTrue(console.start(new String[] { "host" }, config));

        assertEquals(List.of(new InetSocketAddress(config.bindHost(), config.defaultPort())), transport.listenRequests());
    }

    @Test
    void hostWithExplicitPort()
    {
        assertTrue(console.start(new String[] { "host", "6000" }, config));

        assertEquals(6000, transport.listenRequests().get(0).getPort());
    }

    @Test
    void connectDialsTheGivenHost()
    {
        assertTrue(console.start(new String[] { "connect", "10.0.0.5", "6000" }, config));

        InetSocketAddress dialed = transport.connectRequests().get(0);
        assertEquals("10.0.0.5", dialed.getHostString());
        assertEquals(6000, dialed.getPort());
    }

    @Test
    void badArgumentsStartNothing()
    {
        assertFalse(console.start(new String[0], config));
        assertFalse(console.start(new String[] { "host", "seventy" }, config));
        assertFalse(console.start(new String[] { "host", "70000" }, config));
        assertFalse(console.start(new String[] { "connect", "10.0.0.5" }, config));
        assertFalse(console.start(new String[] { "join", "10.0.0.5", "6000" }, config));

        assertTrue(transport.listenRequests().isEmpty());
        assertTrue(transport.connectRequests().isEmpty());
    }

    // -------------------------------------------------------------------------
    // Input lines
    // -------------------------------------------------------------------------

    @Test
    void linesAreEditsAndEscapedNewlinesAreUnescaped()
    {
        FakePeerConnection client = hostWithClient();
        client.clear();

        assertTrue(console.handle("a = 1\\nb = 2"));

        assertEquals("a = 1\nb = 2", console.editor().text());
        assertEquals(List.of(CollabMessage.textUpdate("a = 1\nb = 2")), sent(client));
    }

    @Test
    void approvalFlowAndReclaimByTyping()
    {
        FakePeerConnection client = hostWithClient();
        console.editor().edit("shared");
        client.clear();

        transport.deliver(client.linkId(), new DefaultCollabFrameEncoder().encode(CollabMessage.requestControl()));
        assertTrue(printed().contains("requests editing control"));

        console.handle(":approve");
        assertEquals(List.of(CollabMessage.grantControl()), sent(client));
        assertFalse(console.session().status().hasControl());

        // Typing while read-only takes control back without applying the line.
        console.handle("typed while viewer");
        assertTrue(console.session().status().hasControl());
        assertEquals("shared", console.editor().text());
        assertEquals(List.of(CollabMessage.grantControl(), CollabMessage.revokeControl()), sent(client));
    }

    @Test
    void answerWithoutPendingRequestIsReported()
    {
        console.handle(":decline");

        assertTrue(printed().contains("No control request is pending"));
    }

    @Test
    void readOnlyClientIsToldToRequest()
    {
        console.start(new String[] { "connect", "127.0.0.1", "6000" }, config);
        transport.completeConnect();

        console.handle("hello");

        assertTrue(printed().contains("Read-only"));
        assertEquals("", console.editor().text());
        assertTrue(transport.connections().get(0).written().isEmpty());
    }

    @Test
    void statusAndShowPrintTheSession()
    {
        console.editor().edit("doc");

        console.handle(":status");
        console.handle(":show");

        String text = printed();
        assertTrue(text.contains("Idle"));
        assertTrue(text.contains("doc"));
    }

    @Test
    void quitStopsTheLoop() throws IOException
    {
        hostWithClient();

        console.run(new BufferedReader(new StringReader("first\n:quit\nnever\n")));

        assertEquals("first", console.editor().text());
        assertFalse(console.session().status().isConnected());
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    private FakePeerConnection hostWithClient()
    {
        console.start(new String[] { "host", "6000" }, config);
        transport.completeListen(6000);
        return transport.acceptPeer();
    }

    private String printed()
    {
        return output.toString(StandardCharsets.UTF_8);
    }

    private static List<CollabMessage> sent(FakePeerConnection connection)
    {
        DefaultCollabFrameDecoder decoder = new DefaultCollabFrameDecoder();
        List<CollabMessage> messages = new ArrayList<>();
        for (byte[] frame : connection.written()) {
            try {
                messages.add(decoder.decode(frame).message().orElseThrow());
            } catch (FramingException e) {
                fail("console wrote an undecodable frame: " + e.getMessage());
            }
        }
        return messages;
    }
}
