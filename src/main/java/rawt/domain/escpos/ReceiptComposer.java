package rawt.domain.escpos;

import rawt.common.EPaperWidth;
import rawt.domain.raster.ThermalRaster;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Builds complete command streams for the standard print templates.
 * Every template starts with initialize and density, and ends with the configured
 * feed followed by a full cut when auto-cut is on.
 * @since 19/10/2026
 */
public class ReceiptComposer {
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final ETextEncoding encoding;
    private final EPaperWidth paperWidth;
    private final EPrintDensity density;
    private final int feedLines;
    private final boolean autoCut;

    public ReceiptComposer(ETextEncoding encoding, EPaperWidth paperWidth, EPrintDensity density,
                           int feedLines, boolean autoCut) {
        this.encoding = encoding;
        this.paperWidth = paperWidth;
        this.density = density;
        this.feedLines = feedLines;
        this.autoCut = autoCut;
    }

    public CommandBuffer text(String text, TextStyle style) {
        EscPosEncoder encoder = start();

        encoder.align(style.alignment());
        if (style.bold()) {
            encoder.bold(true);
        }
        if (style.underline()) {
            encoder.underline(true);
        }
        if (style.doubleSize()) {
            encoder.fontSize(EFontSize.DOUBLE);
        }

        encoder.line(text)
                .bold(false)
                .underline(false)
                .fontSize(EFontSize.NORMAL)
                .align(EAlignment.LEFT);

        return finish(encoder);
    }

    public CommandBuffer testPage(LocalDateTime printedAt) {
        int width = paperWidth.getColumns();
        EscPosEncoder encoder = start()
                .align(EAlignment.CENTER)
                .fontSize(EFontSize.DOUBLE)
                .bold(true)
                .line("Raw Thermal")
                .fontSize(EFontSize.NORMAL)
                .bold(false)
                .line("Test Print")
                .horizontalRule('=', width)
                .newline()
                .align(EAlignment.LEFT)
                .line("Normal text")
                .bold(true).line("Bold text").bold(false)
                .underline(true).line("Underlined text").underline(false)
                .newline()
                .fontSize(EFontSize.DOUBLE_HEIGHT).line("Double Height")
                .fontSize(EFontSize.DOUBLE_WIDTH).line("Double Width")
                .fontSize(EFontSize.DOUBLE).line("Double Size")
                .fontSize(EFontSize.NORMAL)
                .newline()
                .line("Left aligned")
                .align(EAlignment.CENTER).line("Center aligned")
                .align(EAlignment.RIGHT).line("Right aligned")
                .align(EAlignment.LEFT)
                .newline()
                .horizontalRule('-', width)
                .keyValue("Item 1", "$10.00", width)
                .keyValue("Item 2", "$25.50", width)
                .keyValue("Item 3", "$5.25", width)
                .horizontalRule('-', width)
                .bold(true).keyValue("TOTAL", "$40.75", width).bold(false)
                .newline()
                .align(EAlignment.CENTER)
                .line(TIMESTAMP.format(printedAt))
                .newline()
                .line("Printer is working!")
                .newline();
        return finish(encoder);
    }

    public CommandBuffer receipt(Receipt receipt) {
        int width = paperWidth.getColumns();
        EscPosEncoder encoder = start()
                .header(receipt.header(), receipt.subheader(), width)
                .newline();

        for (Receipt.Item item : receipt.items()) {
            encoder.keyValue(item.name(), item.price(), width);
        }

        encoder.horizontalRule('-', width)
                .bold(true)
                .keyValue("TOTAL", receipt.total(), width)
                .bold(false)
                .newline();

        if (receipt.footer() != null && !receipt.footer().isEmpty()) {
            encoder.align(EAlignment.CENTER).line(receipt.footer()).align(EAlignment.LEFT);
        }
        return finish(encoder);
    }

    public CommandBuffer qrCode(String content, int moduleSize) {
        EscPosEncoder encoder = start()
                .align(EAlignment.CENTER)
                .qrCode(content, moduleSize)
                .newline();
        return finish(encoder);
    }

    /**
     * QR code drawn as a raster image, for printers without native QR support
     */
    public CommandBuffer qrCodeImage(ThermalRaster qrRaster) {
        EscPosEncoder encoder = start()
                .align(EAlignment.CENTER)
                .raster(qrRaster)
                .newline();
        return finish(encoder);
    }

    public CommandBuffer barcode(String content, EBarcodeSymbology symbology, int height) {
        EscPosEncoder encoder = start()
                .align(EAlignment.CENTER)
                .barcode(content, symbology, height)
                .newline();
        return finish(encoder);
    }

    /**
     * One document page; the cut between pages is appended by the caller
     */
    public CommandBuffer page(ThermalRaster raster, boolean cutAfter) {
        EscPosEncoder encoder = start()
                .raster(raster)
                .feed(feedLines);
        if (cutAfter) {
            encoder.cut(ECutMode.FULL);
        }
        return encoder.encode();
    }

    /**
     * Closing feed and cut after the last document page, empty when auto-cut is off
     */
    public CommandBuffer documentTrailer(int trailingFeedLines) {
        if (!autoCut) {
            return CommandBuffer.empty();
        }
        return new EscPosEncoder(encoding).feed(trailingFeedLines).cut(ECutMode.FULL).encode();
    }

    public boolean isAutoCut() {
        return autoCut;
    }

    private EscPosEncoder start() {
        EscPosEncoder encoder = new EscPosEncoder(encoding).initialize();
        if (density != null) {
            encoder.density(density);
        }
        return encoder;
    }

    private CommandBuffer finish(EscPosEncoder encoder) {
        encoder.feed(feedLines);
        if (autoCut) {
            encoder.cut(ECutMode.FULL);
        }
        return encoder.encode();
    }
}
