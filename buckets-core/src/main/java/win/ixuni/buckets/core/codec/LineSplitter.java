package win.ixuni.buckets.core.codec;

import lombok.Value;
import win.ixuni.buckets.core.exception.DecodeException;
import win.ixuni.buckets.core.exception.InvalidArgumentException;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Splits a chunked byte stream into LF-terminated lines
 * <p>
 * Works on bytes, so a multi-byte UTF-8 character cut by a chunk boundary is reassembled before
 * anything is decoded. A partial line is held back until its terminator arrives or the stream
 * ends. Not thread-safe: one instance per stream.
 */
public class LineSplitter {

    private static final byte LF = '\n';
    private static final byte CR = '\r';
    private static final long MAX_BUFFER = Integer.MAX_VALUE - 8;

    private final int maxLineLength;

    private byte[] pending = new byte[256];
    private int pendingLength;
    private long lineNumber;
    private boolean finished;

    public LineSplitter(int maxLineLength) {
        if (maxLineLength <= 0) {
            throw new InvalidArgumentException("maxLineLength must be positive: " + maxLineLength);
        }
        this.maxLineLength = maxLineLength;
    }

    /**
     * Consume one chunk
     *
     * @param chunk next slice of the body; its position is not modified
     * @return complete, non-blank lines found so far, in order
     * @throws DecodeException when a line grows past the configured maximum
     */
    public List<Line> feed(ByteBuffer chunk) {
        if (finished) {
            throw new IllegalStateException("Splitter already finished");
        }
        ByteBuffer view = chunk.duplicate();
        byte[] data = new byte[view.remaining()];
        view.get(data);

        List<Line> lines = null;
        int start = 0;
        for (int i = 0; i < data.length; i++) {
            if (data[i] != LF) {
                continue;
            }
            byte[] line = assemble(data, start, i);
            lineNumber++;
            start = i + 1;
            if (line != null) {
                if (lines == null) {
                    lines = new ArrayList<>();
                }
                lines.add(new Line(lineNumber, line));
            }
        }
        append(data, start, data.length);
        return lines == null ? Collections.emptyList() : lines;
    }

    /**
     * Flush the unterminated tail at end of stream
     *
     * @return the final line if it is not blank
     */
    public List<Line> finish() {
        if (finished) {
            return Collections.emptyList();
        }
        finished = true;
        if (pendingLength == 0) {
            return Collections.emptyList();
        }
        lineNumber++;
        byte[] line = trim(pending, 0, pendingLength);
        pendingLength = 0;
        return line == null ? Collections.emptyList() : List.of(new Line(lineNumber, line));
    }

    /**
     * Lines seen so far, blank ones included
     */
    public long getLineNumber() {
        return lineNumber;
    }

    private byte[] assemble(byte[] data, int from, int to) {
        if (pendingLength == 0) {
            checkLength(to - from);
            return trim(data, from, to);
        }
        append(data, from, to);
        byte[] line = trim(pending, 0, pendingLength);
        pendingLength = 0;
        return line;
    }

    private void append(byte[] data, int from, int to) {
        int count = to - from;
        if (count == 0) {
            return;
        }
        checkLength((long) pendingLength + count);
        if ((long) pendingLength + count > MAX_BUFFER) {
            throw new DecodeException("Listing line exceeds " + MAX_BUFFER + " buffered bytes", lineNumber + 1);
        }
        if (pendingLength + count > pending.length) {
            long grown = Math.max(pending.length * 2L, (long) pendingLength + count);
            pending = Arrays.copyOf(pending, (int) Math.min(grown, Math.min((long) maxLineLength + 1, MAX_BUFFER)));
        }
        System.arraycopy(data, from, pending, pendingLength, count);
        pendingLength += count;
    }

    /**
     * Checks the line being assembled, which is always {@code lineNumber + 1}
     */
    private void checkLength(long length) {
        // CR before the LF is not counted
        if (length > (long) maxLineLength + 1) {
            throw new DecodeException("Listing line exceeds " + maxLineLength + " bytes", lineNumber + 1);
        }
    }

    /**
     * Copy a line without its trailing CR; null when it holds only whitespace
     */
    private static byte[] trim(byte[] data, int from, int to) {
        int end = to;
        if (end > from && data[end - 1] == CR) {
            end--;
        }
        boolean blank = true;
        for (int i = from; i < end; i++) {
            byte b = data[i];
            if (b != ' ' && b != '\t' && b != CR) {
                blank = false;
                break;
            }
        }
        return blank ? null : Arrays.copyOfRange(data, from, end);
    }

    /**
     * One complete line with its 1-based position in the stream
     */
    @Value
    public static class Line {
        long number;
        byte[] bytes;
    }
}
