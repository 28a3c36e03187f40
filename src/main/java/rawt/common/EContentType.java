package rawt.common;

/**
 * Kind of payload carried by a print job
 * @since 19/10/2026
 */
public enum EContentType {
    TEXT,      // Styled text, encoded at print time
    RAW,       // Pre-encoded ESC/POS bytes, sent verbatim
    DOCUMENT   // PDF or image, rendered page by page
}
