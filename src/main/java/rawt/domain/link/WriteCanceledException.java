package rawt.domain.link;

/**
 * A write stopped between chunks because its caller asked it to
 * @since 19/10/2026
 */
public class WriteCanceledException extends LinkException {
    private final int chunksWritten;

    public WriteCanceledException(int chunksWritten) {
        super("Write canceled after " + chunksWritten + " chunk(s)");
        this.chunksWritten = chunksWritten;
    }

    public int getChunksWritten() {
        return chunksWritten;
    }
}
