package cn.edu.zju.daily.policyflux.trainer;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * A duplex byte pipe carrying length-prefixed frames: a big-endian 4-byte length followed by a
 * pickled {@link TrainerMessage}.
 */
public class FramedPipe implements Closeable {

    private static final int MAX_FRAME_BYTES = 1 << 30;

    private final DataInputStream in;
    private final DataOutputStream out;
    private final PickleMessageCodec codec = new PickleMessageCodec();

    public FramedPipe(InputStream in, OutputStream out) {
        this.in = new DataInputStream(new BufferedInputStream(in));
        this.out = new DataOutputStream(new BufferedOutputStream(out));
    }

    public void send(TrainerMessage message) throws IOException {
        byte[] payload = codec.encode(message);
        synchronized (out) {
            out.writeInt(payload.length);
            out.write(payload);
            out.flush();
        }
    }

    /**
     * Blocks until the next frame arrives.
     *
     * @throws EOFException if the other end closed the pipe
     */
    public TrainerMessage receive() throws IOException {
        byte[] payload;
        synchronized (in) {
            int length = in.readInt();
            if (length < 0 || length > MAX_FRAME_BYTES) {
                throw new IOException("Invalid frame length " + length);
            }
            payload = new byte[length];
            in.readFully(payload);
        }
        return codec.decode(payload);
    }

    @Override
    public void close() throws IOException {
        try {
            out.close();
        } finally {
            in.close();
        }
    }
}
