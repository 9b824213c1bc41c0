package com.salachat.controladores.conexion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salachat.servicios.eventos.SessionEventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ChatSocketIntegrationTest {

    private static final int MAX_FRAME_BYTES = 1024;

    private final ObjectMapper mapper = new ObjectMapper();
    private ExecutorService executor;
    private ServerSocket server;
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() throws IOException {
        SessionEventBus eventBus = new SessionEventBus();
        registry = new ConnectionRegistry(eventBus);
        FrameCodec codec = new FrameCodec();
        BroadcastEngine broadcastEngine = new BroadcastEngine(registry, codec);
        new PresenceTracker(registry, broadcastEngine, eventBus);
        CountingChatStore store = new CountingChatStore();
        store.createUser("alice", "secret", true);
        store.createUser("bob", "secret", false);
        ProtocolDispatcher dispatcher = new ProtocolDispatcher(store, registry, broadcastEngine, codec,
                new AccessPolicy(), eventBus, 80);
        ConnectionHandlerPool pool = new ConnectionHandlerPool(4,
                () -> new ConnectionHandler(registry, dispatcher, MAX_FRAME_BYTES, 64));

        executor = Executors.newCachedThreadPool();
        server = new ServerSocket(0);
        executor.submit(() -> {
            while (!server.isClosed()) {
                try {
                    Socket socket = server.accept();
                    ConnectionHandler handler = pool.acquire(socket);
                    if (handler == null) {
                        socket.close();
                        continue;
                    }
                    executor.execute(handler);
                } catch (SocketException e) {
                    return;
                } catch (IOException e) {
                    throw new IllegalStateException(e);
                }
            }
        });
    }

    @AfterEach
    void tearDown() throws IOException {
        server.close();
        registry.closeAll();
        executor.shutdownNow();
    }

    @Test
    void dosClientesConversanYVenLaPresencia() throws Exception {
        try (Client alice = connect(); Client bob = connect()) {
            alice.send("{\"type\":\"login\",\"username\":\"alice\",\"password\":\"secret\"}");
            assertEquals("login_ok", alice.next().get("type").asText());
            assertEquals("history", alice.next().get("type").asText());
            assertEquals("[\"alice\"]", alice.nextOfType("presence").get("online").toString());

            bob.send("{\"type\":\"login\",\"username\":\"bob\",\"password\":\"secret\"}");
            assertEquals("login_ok", bob.nextOfType("login_ok").get("type").asText());
            assertEquals("history", bob.next().get("type").asText());
            assertEquals("[\"alice\",\"bob\"]", bob.next().get("online").toString());
            assertEquals("[\"alice\",\"bob\"]", alice.nextOfType("presence").get("online").toString());

            alice.send("{\"type\":\"send\",\"content\":\"hi\"}");
            JsonNode paraAlice = alice.nextOfType("message").get("message");
            JsonNode paraBob = bob.nextOfType("message").get("message");
            assertEquals("hi", paraAlice.get("content").asText());
            assertEquals("alice", paraBob.get("username").asText());
            assertEquals(paraAlice.get("id").asLong(), paraBob.get("id").asLong());

            bob.close();
            assertEquals("[\"alice\"]", alice.nextOfType("presence").get("online").toString());
        }
    }

    @Test
    void frameDemasiadoGrandeNoCierraLaConexion() throws Exception {
        try (Client client = connect()) {
            client.send("{\"type\":\"login\",\"pad\":\"" + "x".repeat(MAX_FRAME_BYTES * 2) + "\"}");
            JsonNode error = client.next();
            assertEquals("error", error.get("type").asText());
            assertEquals("Frame too large", error.get("message").asText());

            client.send("{\"type\":\"login\",\"username\":\"alice\",\"password\":\"secret\"}");
            assertEquals("login_ok", client.next().get("type").asText());
        }
    }

    @Test
    void jsonInvalidoPorSocketRespondeError() throws Exception {
        try (Client client = connect()) {
            client.send("esto no es json");
            JsonNode error = client.next();
            assertEquals("Invalid JSON", error.get("message").asText());

            client.send("{\"type\":\"send\",\"content\":\"hola\"}");
            assertEquals("Please login first", client.next().get("message").asText());
        }
    }

    private Client connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", server.getLocalPort());
        socket.setSoTimeout(3000);
        return new Client(socket);
    }

    private class Client implements AutoCloseable {
        private final Socket socket;
        private final BufferedReader reader;
        private final OutputStream out;

        private Client(Socket socket) throws IOException {
            this.socket = socket;
            this.reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            this.out = socket.getOutputStream();
        }

        void send(String line) throws IOException {
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        JsonNode next() throws IOException {
            String line = reader.readLine();
            assertNotNull(line, "El servidor cerró la conexión");
            return mapper.readTree(line);
        }

        JsonNode nextOfType(String type) throws IOException {
            while (true) {
                JsonNode node = next();
                if (type.equals(node.path("type").asText())) {
                    return node;
                }
            }
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
