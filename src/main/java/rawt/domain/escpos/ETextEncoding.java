package rawt.domain.escpos;

import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;

/**
 * Character encodings for printed text. Conversion is strict: a character the target
 * encoding cannot represent is rejected instead of being replaced with '?'.
 * @since 19/10/2026
 */
public enum ETextEncoding {
    UTF_8(StandardCharsets.UTF_8),
    GB2312(Charset.forName("GB2312")),
    CP437(Charset.forName("IBM437"));

    private final Charset charset;

    ETextEncoding(Charset charset) {
        this.charset = charset;
    }

    public Charset getCharset() {
        return charset;
    }

    public byte[] encode(String text) {
        CharsetEncoder encoder = charset.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            ByteBuffer buffer = encoder.encode(CharBuffer.wrap(text));
            return Arrays.copyOfRange(buffer.array(), buffer.arrayOffset() + buffer.position(),
                    buffer.arrayOffset() + buffer.limit());
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("Text cannot be encoded as " + this + ": " + e.getMessage(), e);
        }
    }

    /**
     * Accepts "UTF-8", "utf8", "GB2312", "CP437"
     */
    public static ETextEncoding fromName(String name) {
        if (name == null || name.isBlank()) {
            return UTF_8;
        }
        String normalized = name.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (ETextEncoding encoding : values()) {
            if (encoding.name().replace("_", "").equals(normalized)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unsupported text encoding: " + name);
    }
}
