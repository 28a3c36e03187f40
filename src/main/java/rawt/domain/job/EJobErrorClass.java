package rawt.domain.job;

/**
 * Where a job failure originated
 * @since 19/10/2026
 */
public enum EJobErrorClass {
    INPUT,        // Content rejected by the quantizer or encoder
    CONNECTION,   // Endpoint unreachable, no usable interface, link disabled
    TRANSPORT,    // Chunk write failed or the link dropped mid-job
    RENDER,       // Document page could not be rendered
    PERSISTENCE,  // Content could not be stored for later printing
    INTERNAL      // Unexpected error
}
