package com.salachat.controladores.conexion;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Lector de líneas UTF-8 con tamaño máximo por línea.
 */
public class FrameReader implements Closeable {

    private final InputStream in;
    private final int maxFrameBytes;
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream(256);

    public FrameReader(InputStream in, int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes debe ser positivo");
        }
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.maxFrameBytes = maxFrameBytes;
    }

    /**
     * Lee la siguiente línea sin el terminador.
     *
     * @return la línea, o {@code null} al llegar al fin del stream
     * @throws FrameTooLargeException si la línea excede el máximo; el lector queda posicionado
     *                                al inicio de la línea siguiente
     */
    public String readFrame() throws IOException {
        buffer.reset();
        boolean overflow = false;
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                if (overflow) {
                    throw new FrameTooLargeException(maxFrameBytes);
                }
                return decode();
            }
            if (overflow) {
                continue;
            }
            if (buffer.size() >= maxFrameBytes) {
                overflow = true;
                buffer.reset();
                continue;
            }
            buffer.write(b);
        }
        if (overflow || buffer.size() == 0) {
            return null;
        }
        return decode();
    }

    private String decode() {
        byte[] bytes = buffer.toByteArray();
        int length = bytes.length;
        if (length > 0 && bytes[length - 1] == '\r') {
            length--;
        }
        return new String(bytes, 0, length, StandardCharsets.UTF_8);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
