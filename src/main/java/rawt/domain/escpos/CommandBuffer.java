package rawt.domain.escpos;

import java.util.Arrays;

/**
 * Immutable sequence of encoded printer commands
 * @since 19/10/2026
 */
public final class CommandBuffer {
    private static final CommandBuffer EMPTY = new CommandBuffer(new byte[0]);

    private final byte[] bytes;

    private CommandBuffer(byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Wrap caller supplied bytes (raw jobs); the array is copied
     */
    public static CommandBuffer of(byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("Command bytes cannot be null");
        }
        return bytes.length == 0 ? EMPTY : new CommandBuffer(Arrays.copyOf(bytes, bytes.length));
    }

    public static CommandBuffer empty() {
        return EMPTY;
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    public byte byteAt(int index) {
        return bytes[index];
    }

    /**
     * Copy of bytes in [from, to)
     */
    public byte[] copyRange(int from, int to) {
        return Arrays.copyOfRange(bytes, from, to);
    }

    public byte[] toByteArray() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public CommandBuffer concat(CommandBuffer other) {
        byte[] joined = Arrays.copyOf(bytes, bytes.length + other.bytes.length);
        System.arraycopy(other.bytes, 0, joined, bytes.length, other.bytes.length);
        return new CommandBuffer(joined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CommandBuffer)) return false;
        return Arrays.equals(bytes, ((CommandBuffer) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "CommandBuffer{" + bytes.length + " bytes}";
    }
}
