package com.salachat.bootstrap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.salachat.bootstrap.config.ServerConfig;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServidorApplicationTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private JdbcDataSource dataSource;
    private ServidorApplication application;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("server.maxConnections");
        if (application != null) {
            application.shutdown();
        }
    }

    @Test
    void flujoCompletoSobreSocket() throws Exception {
        application = new ServidorApplication(ServerConfig.load("/properties/server-it.properties"), dataSource,
                AdminProvisioner.PasswordPrompt.none());
        application.start();

        try (Client root = connect()) {
            root.send("{\"type\":\"login\",\"username\":\"root\",\"password\":\"rootpass\"}");
            JsonNode loginOk = root.next();
            assertEquals("login_ok", loginOk.get("type").asText());
            assertTrue(loginOk.get("is_admin").asBoolean());
            assertEquals(0, root.next().get("messages").size());
            assertEquals("[\"root\"]", root.nextOfType("presence").get("online").toString());

            root.send("{\"type\":\"admin_create_user\",\"username\":\" carol \",\"password\":\"secret\"}");
            assertEquals("carol", root.nextOfType("admin_create_user_ok").get("username").asText());

            for (int i = 1; i <= 7; i++) {
                root.send("{\"type\":\"send\",\"content\":\"m" + i + "\"}");
                assertEquals("m" + i, root.nextOfType("message").get("message").get("content").asText());
            }

            try (Client carol = connect()) {
                carol.send("{\"type\":\"login\",\"username\":\"carol\",\"password\":\"secret\"}");
                JsonNode carolOk = carol.next();
                assertEquals("carol", carolOk.get("username").asText());
                assertFalse(carolOk.get("is_admin").asBoolean());

                JsonNode history = carol.next().get("messages");
                assertEquals(5, history.size());
                assertEquals("m3", history.get(0).get("content").asText());
                assertEquals("m7", history.get(4).get("content").asText());
                assertEquals("root", history.get(0).get("username").asText());

                assertEquals("[\"carol\",\"root\"]", carol.nextOfType("presence").get("online").toString());
                assertEquals("[\"carol\",\"root\"]", root.nextOfType("presence").get("online").toString());

                long replyTo = history.get(4).get("id").asLong();
                carol.send("{\"type\":\"send\",\"kind\":\"sticker\",\"sticker\":\"wave\",\"reply_to\":" + replyTo + "}");
                JsonNode sticker = root.nextOfType("message").get("message");
                assertEquals("sticker", sticker.get("kind").asText());
                assertEquals("wave", sticker.get("sticker").asText());
                assertEquals(replyTo, sticker.get("reply_to").asLong());

                carol.send("{\"type\":\"admin_create_user\",\"username\":\"dave\",\"password\":\"secret\"}");
                assertEquals("Admin only", carol.nextOfType("admin_create_user_error").get("message").asText());
            }

            assertEquals("[\"root\"]", root.nextOfType("presence").get("online").toString());
            assertTrue(application.getChatStore().findUser("dave").isEmpty());

            application.shutdown();
            root.assertClosedByServer();
        }
        assertFalse(application.getTcpServer().isRunning());
    }

    @Test
    void rechazaConexionesCuandoElPoolEstaLleno() throws Exception {
        System.setProperty("server.maxConnections", "1");
        application = new ServidorApplication(ServerConfig.load("/properties/server-it.properties"), dataSource,
                AdminProvisioner.PasswordPrompt.none());
        application.start();

        try (Client first = connect()) {
            first.send("{\"type\":\"who_online\"}");
            assertEquals("Please login first", first.next().get("message").asText());

            try (Client second = connect()) {
                JsonNode rejected = second.next();
                assertEquals("error", rejected.get("type").asText());
                assertEquals("Server is full", rejected.get("message").asText());
                second.assertClosedByServer();
            }
        }
    }

    @Test
    void reinicioConservaAdministradorYMensajes() throws Exception {
        ServerConfig config = ServerConfig.load("/properties/server-it.properties");
        ServidorApplication primera = new ServidorApplication(config, dataSource,
                AdminProvisioner.PasswordPrompt.none());
        long adminId = primera.getChatStore().findUser("root").orElseThrow().getId();
        primera.shutdown();

        application = new ServidorApplication(config, dataSource, username -> {
            throw new AssertionError("El administrador ya existe");
        });

        assertEquals(adminId, application.getChatStore().findUser("root").orElseThrow().getId());
    }

    private Client connect() throws IOException {
        Socket socket = new Socket("127.0.0.1", application.getTcpServer().getLocalPort());
        socket.setSoTimeout(5000);
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

        void assertClosedByServer() throws IOException {
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    assertFalse(line.isBlank());
                }
                assertNull(line);
            } catch (SocketException e) {
                // reset del par: también cuenta como cierre
            }
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
