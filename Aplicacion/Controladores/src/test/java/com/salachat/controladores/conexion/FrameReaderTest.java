package com.salachat.controladores.conexion;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class FrameReaderTest {

    @Test
    void leeLineasUtf8SinTerminador() throws IOException {
        FrameReader reader = reader("{\"a\":1}\r\nñandú 🙂\n\nultima", 1024);

        assertEquals("{\"a\":1}", reader.readFrame());
        assertEquals("ñandú 🙂", reader.readFrame());
        assertEquals("", reader.readFrame());
        assertEquals("ultima", reader.readFrame());
        assertNull(reader.readFrame());
    }

    @Test
    void lineaDemasiadoLargaSeDescartaYLaSiguienteSeLee() throws IOException {
        FrameReader reader = reader("x".repeat(50) + "\n{\"type\":\"login\"}\n", 20);

        FrameTooLargeException ex = assertThrows(FrameTooLargeException.class, reader::readFrame);
        assertEquals(20, ex.getLimit());
        assertEquals("{\"type\":\"login\"}", reader.readFrame());
        assertNull(reader.readFrame());
    }

    @Test
    void lineaDeExactamenteElMaximoSeAcepta() throws IOException {
        FrameReader reader = reader("y".repeat(20) + "\n", 20);

        assertEquals("y".repeat(20), reader.readFrame());
    }

    @Test
    void lineaLargaSinTerminadorAlFinalDelStream() throws IOException {
        FrameReader reader = reader("z".repeat(30), 20);

        assertNull(reader.readFrame());
    }

    @Test
    void rechazaMaximoNoPositivo() {
        assertThrows(IllegalArgumentException.class, () -> reader("", 0));
    }

    private static FrameReader reader(String content, int max) {
        return new FrameReader(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)), max);
    }
}
