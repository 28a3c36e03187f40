package rawt.domain.job;

import rawt.common.EContentType;

/**
 * Payload of a print job
 * @since 19/10/2026
 */
public interface IPrintContent {
    EContentType getType();

    String getMimeType();
}
