package rawt.domain.job;

import rawt.common.EContentType;
import rawt.domain.escpos.CommandBuffer;

/**
 * Pre-encoded command bytes, written as they are
 * @since 19/10/2026
 */
public final class RawContent implements IPrintContent {
    private final CommandBuffer buffer;

    public RawContent(CommandBuffer buffer) {
        if (buffer == null || buffer.isEmpty()) {
            throw new IllegalArgumentException("Raw content cannot be empty");
        }
        this.buffer = buffer;
    }

    public CommandBuffer getBuffer() {
        return buffer;
    }

    @Override
    public EContentType getType() {
        return EContentType.RAW;
    }

    @Override
    public String getMimeType() {
        return "application/octet-stream";
    }
}
