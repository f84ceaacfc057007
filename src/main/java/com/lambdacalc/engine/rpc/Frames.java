package com.lambdacalc.engine.rpc;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/** Wire framing shared by server and client: uint32_be length + payload. */
final class Frames {

    static final int MAX_FRAME = 32 * 1024 * 1024;

    private Frames() {}

    /** Next frame, or null on a clean EOF before any header byte. */
    static byte[] read(InputStream in) throws IOException {
        byte[] lenBuf = in.readNBytes(4);
        if (lenBuf.length == 0) return null;
        if (lenBuf.length < 4) throw new EOFException("partial length header");

        int len = ByteBuffer.wrap(lenBuf).order(ByteOrder.BIG_ENDIAN).getInt();
        if (len < 0 || len > MAX_FRAME) {
            throw new IOException("bad frame length: " + len);
        }
        byte[] payload = in.readNBytes(len);
        if (payload.length < len) throw new EOFException("partial frame payload");
        return payload;
    }

    static void write(OutputStream out, byte[] payload) throws IOException {
        if (payload.length > MAX_FRAME) throw new IOException("frame too large: " + payload.length);
        byte[] lenBuf = ByteBuffer.allocate(4).order(ByteOrder.BIG_ENDIAN).putInt(payload.length).array();
        out.write(lenBuf);
        out.write(payload);
    }
}
