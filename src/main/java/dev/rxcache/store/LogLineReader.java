package dev.rxcache.store;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;

/**
 * Buffered UTF-8 line reader over a {@link RandomAccessFile} that tracks the byte offset of
 * the next unread byte, so callers can record where each line starts.
 *
 * <p>{@link RandomAccessFile#readLine()} decodes bytes as Latin-1 and reads one byte per
 * system call, so it is not used here.
 */
final class LogLineReader {
    private final RandomAccessFile file;
    private final byte[] buffer;
    private final ByteArrayOutputStream line = new ByteArrayOutputStream(512);
    private int bufferPos;
    private int bufferLimit;
    private long position;
    private boolean lastTerminated;

    LogLineReader(RandomAccessFile file, long start, int bufferSize) throws IOException {
        this.file = file;
        this.buffer = new byte[bufferSize];
        file.seek(start);
        this.position = start;
    }

    /**
     * @return byte offset of the next line's first byte
     */
    long position() {
        return position;
    }

    /**
     * @return whether the line most recently returned ended with a newline
     */
    boolean lastLineTerminated() {
        return lastTerminated;
    }

    /**
     * Reads the next line without its terminator (a trailing CR is dropped too).
     *
     * @return the line, or null at end of file
     */
    String readLine() throws IOException {
        line.reset();
        boolean sawBytes = false;
        while (true) {
            if (bufferPos == bufferLimit) {
                int n = file.read(buffer);
                if (n <= 0) {
                    if (!sawBytes) {
                        return null;
                    }
                    lastTerminated = false;
                    return decode();
                }
                bufferPos = 0;
                bufferLimit = n;
            }
            sawBytes = true;
            byte b = buffer[bufferPos++];
            position++;
            if (b == '\n') {
                lastTerminated = true;
                return decode();
            }
            line.write(b);
        }
    }

    private String decode() {
        String s = line.toString(StandardCharsets.UTF_8);
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }
}
