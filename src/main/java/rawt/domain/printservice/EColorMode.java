package rawt.domain.printservice;

/**
 * @since 19/10/2026
 */
public enum EColorMode {
    MONOCHROME,
    COLOR
}
