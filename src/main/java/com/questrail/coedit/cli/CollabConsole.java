package com.questrail.coedit.cli;

import com.questrail.coedit.api.ControlDecision;
import com.questrail.coedit.api.SessionListener;
import com.questrail.coedit.api.SessionNotification;
import com.questrail.coedit.api.SessionRole;
import com.questrail.coedit.api.SessionStatus;
import com.questrail.coedit.editor.InMemoryDocumentEditor;
import com.questrail.coedit.protocol.config.CollabRuntimeConfig;
import com.questrail.coedit.protocol.observability.Slf4jCollabObservabilitySink;
import com.questrail.coedit.protocol.runtime.CollabSessionRuntime;
import com.questrail.coedit.protocol.transport.PeerTransport;
import com.questrail.coedit.protocol.transport.tcp.netty.NettyTcpPeerTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Line-oriented front end for one collaboration session.
 *
 * <pre>
 *   CollabConsole host [port]
 *   CollabConsole connect &lt;ip&gt; &lt;port&gt;
 * </pre>
 *
 * Every input line replaces the shared document. Lines starting with
 * {@code :} are commands: {@code :request}, {@code :reclaim},
 * {@code :approve}, {@code :decline}, {@code :status}, {@code :show},
 * {@code :quit}.
 */
public final class CollabConsole
{
    private static final Logger log = LoggerFactory.getLogger(CollabConsole.class);

    private final CollabSessionRuntime session;
    private final InMemoryDocumentEditor editor;
    private final AtomicReference<ControlDecision> pendingDecision = new AtomicReference<>();
    private final PrintStream out;

    CollabConsole(CollabRuntimeConfig config, PrintStream out)
    {
        this(config, new NettyTcpPeerTransport(), out);
    }

    CollabConsole(CollabRuntimeConfig config, PeerTransport transport, PrintStream out)
    {
        this.out = out;
        this.editor = new InMemoryDocumentEditor();
        this.session = CollabSessionRuntime.builder()
                .withConfig(config)
                .withEditor(editor)
                .withControlRequestHandler(this::onControlRequested)
                .withListener(new ConsoleListener())
                .withObservabilitySink(new Slf4jCollabObservabilitySink())
                .withTransport(transport)
                .build();
        editor.setChangeListener(session::onLocalDocumentChanged);
    }

    CollabSessionRuntime session()
    {
        return session;
    }

    InMemoryDocumentEditor editor()
    {
        return editor;
    }

    public static void main(String[] args) throws IOException
    {
        CollabRuntimeConfig config;
        try {
            config = CollabRuntimeConfig.fromProperties(System.getProperties());
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        CollabConsole console = new CollabConsole(config, System.out);
        if (!console.start(args, config)) {
            usage();
            console.session.shutdown();
            System.exit(2);
            return;
        }

        try (BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            console.run(in);
        } finally {
            console.session.shutdown();
        }
    }

    boolean start(String[] args, CollabRuntimeConfig config)
    {
        if (args.length >= 1 && args[0].equals("host") && args.length <= 2) {
            int port = args.length == 2 ? parsePort(args[1]) : config.defaultPort();
            if (port < 0) {
                return false;
            }
            session.startHosting(port);
            return true;
        }
        if (args.length == 3 && args[0].equals("connect")) {
            int port = parsePort(args[2]);
            if (port < 0) {
                return false;
            }
            session.connectToHost(args[1], port);
            return true;
        }
        return false;
    }

    void run(BufferedReader in) throws IOException
    {
        String line;
        while ((line = in.readLine()) != null) {
            if (!handle(line)) {
                return;
            }
        }
    }

    /**
     * @return {@code false} once the user asked to quit
     */
    boolean handle(String line)
    {
        switch (line.trim()) {
            case ":quit":
                session.stopSession();
                return false;
            case ":request":
                session.requestControl();
                return true;
            case ":reclaim":
                session.onUserRequestedReclaim();
                return true;
            case ":approve":
                answer(true);
                return true;
            case ":decline":
                answer(false);
                return true;
            case ":status":
                out.println(describe(session.status()));
                return true;
            case ":show":
                out.println(editor.text());
                return true;
            default:
                break;
        }

        SessionStatus status = session.status();
        if (status.isConnected() && !status.isWriter()) {
            if (status.role() == SessionRole.HOST) {
                // Typing while read-only takes control back; the keystroke itself is not applied.
                session.onUserRequestedReclaim();
            } else {
                out.println("Read-only: use :request to ask for control");
            }
            return true;
        }

        editor.edit(line.replace("\\n", "\n"));
        return true;
    }

    private void onControlRequested(ControlDecision decision)
    {
        ControlDecision previous = pendingDecision.getAndSet(decision);
        if (previous != null && !previous.isDecided()) {
            previous.decline();
        }
        out.println("The client requests editing control. Answer with :approve or :decline");
    }

    private void answer(boolean approve)
    {
        ControlDecision decision = pendingDecision.getAndSet(null);
        if (decision == null || decision.isDecided()) {
            out.println("No control request is pending");
            return;
        }
        if (approve) {
            decision.approve();
        } else {
            decision.decline();
        }
    }

    private static int parsePort(String text)
    {
        try {
            int port = Integer.parseInt(text);
            return port >= 0 && port <= 0xFFFF ? port : -1;
        } catch (NumberFormatException e) {
            log.debug("Not a port number: {}", text);
            return -1;
        }
    }

    private static String describe(SessionStatus status)
    {
        if (status.role() == SessionRole.NONE) {
            return "Idle";
        }
        return status.role() + " " + status.linkState() + (status.hasControl() ? " (editing)" : " (read-only)");
    }

    private static void usage()
    {
        System.err.println("usage: CollabConsole host [port] | connect <ip> <port>");
    }

    private final class ConsoleListener implements SessionListener
    {
        @Override
        public void onStatusChanged(SessionStatus previous, SessionStatus current)
        {
            out.println("[status] " + describe(current));
        }

        @Override
        public void onNotification(SessionNotification notification)
        {
            out.println((notification.isError() ? "[error] " : "[info] ") + notification.message());
        }
    }
}
