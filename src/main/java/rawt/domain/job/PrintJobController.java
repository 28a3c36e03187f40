package rawt.domain.job;

import io.javalin.http.Context;
import io.javalin.http.UploadedFile;
import io.javalin.http.sse.SseClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.AppSettings;
import rawt.dal.PendingJob;
import rawt.dal.PrintSettingsSnapshot;
import rawt.dal.PrinterSettingsStore;
import rawt.dal.StoreException;
import rawt.domain.ApiResponse;
import rawt.domain.SSEClient;
import rawt.domain.SSEManager;
import rawt.domain.escpos.CommandBuffer;
import rawt.domain.escpos.EAlignment;
import rawt.domain.escpos.EBarcodeSymbology;
import rawt.domain.escpos.Receipt;
import rawt.domain.escpos.ReceiptComposer;
import rawt.domain.escpos.TextStyle;
import rawt.domain.raster.FloydSteinbergQuantizer;
import rawt.domain.raster.GraphUtils;
import rawt.domain.raster.PixelBuffer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.stream.Collectors;

import static io.javalin.apibuilder.ApiBuilder.*;

/**
 * REST Controller for print jobs
 * @since 19/10/2026
 */
public class PrintJobController {
    private static final Logger logger = LoggerFactory.getLogger(PrintJobController.class);

    private final PrintJobOrchestrator orchestrator;
    private final PrinterSettingsStore settingsStore;
    private final FloydSteinbergQuantizer quantizer;
    private final SSEManager sseManager;
    private final Path spoolDirectory;

    public PrintJobController(PrintJobOrchestrator orchestrator, PrinterSettingsStore settingsStore,
                              FloydSteinbergQuantizer quantizer, SSEManager sseManager, Path spoolDirectory) {
        this.orchestrator = orchestrator;
        this.settingsStore = settingsStore;
        this.quantizer = quantizer;
        this.sseManager = sseManager;
        this.spoolDirectory = spoolDirectory;
    }

    /**
     * Register all print job REST API routes
     */
    public void registerRoutes() {
        path("/api/print", () -> {
            post("/text", this::printText);
            post("/raw", this::printRaw);
            post("/document", this::printDocument);
            post("/test", this::printTestPage);
            post("/receipt", this::printReceipt);
            post("/qr", this::printQrCode);
            post("/barcode", this::printBarcode);
        });

        path("/api/jobs", () -> {
            get(this::listJobs);
            get("/{id}", this::getJob);
            post("/{id}/cancel", this::cancelJob);
            delete("/{id}", this::dequeueJob);
        });

        path("/api/pending", () -> {
            get(this::listPendingJobs);
            delete("/{id}", this::discardPendingJob);
        });

        path("/api/events", () -> {
            sse("/jobs", this::sseJobUpdates);
        });
    }

    private void printText(Context ctx) {
        TextPrintRequest request = ctx.bodyAsClass(TextPrintRequest.class);
        if (request == null || request.getText() == null || request.getText().isEmpty()) {
            ctx.status(400).json(ApiResponse.error("Text content is required"));
            return;
        }
        submit(ctx, () -> {
            EAlignment alignment = EAlignment.valueOf(request.getAlignment().trim().toUpperCase(Locale.ROOT));
            TextStyle style = new TextStyle(alignment, request.isBold(), request.isUnderline(), request.isDoubleSize());
            return orchestrator.submit(new TextContent(request.getText(), style), titleOr(request.getTitle(), "Text"));
        });
    }

    private void printRaw(Context ctx) {
        CodePrintRequest request = ctx.bodyAsClass(CodePrintRequest.class);
        if (request == null || request.getContent() == null || request.getContent().isEmpty()) {
            ctx.status(400).json(ApiResponse.error("Base64 command data is required"));
            return;
        }
        submit(ctx, () -> {
            byte[] data = Base64.getDecoder().decode(request.getContent());
            return orchestrator.submit(new RawContent(CommandBuffer.of(data)), titleOr(request.getTitle(), "Raw"));
        });
    }

    private void printTestPage(Context ctx) {
        submit(ctx, () -> orchestrator.submit(new RawContent(composer().testPage(LocalDateTime.now())), "Test page"));
    }

    private void printReceipt(Context ctx) {
        Receipt receipt;
        try {
            receipt = ctx.bodyAsClass(Receipt.class);
        } catch (RuntimeException e) {
            // record constructor failures come back wrapped
            logger.warn("Invalid receipt request: {}", e.getMessage());
            receipt = null;
        }
        if (receipt == null) {
            ctx.status(400).json(ApiResponse.error("Receipt with header and total is required"));
            return;
        }
        Receipt content = receipt;
        submit(ctx, () -> orchestrator.submit(new RawContent(composer().receipt(content)), "Receipt"));
    }

    private void printQrCode(Context ctx) {
        CodePrintRequest request = ctx.bodyAsClass(CodePrintRequest.class);
        if (request == null || request.getContent() == null || request.getContent().isEmpty()) {
            ctx.status(400).json(ApiResponse.error("QR content is required"));
            return;
        }
        submit(ctx, () -> {
            ReceiptComposer composer = composer();
            CommandBuffer buffer;
            if (request.isAsImage()) {
                int sizeDots = settingsStore.snapshot().paperWidth().getDots() / 2;
                PixelBuffer pixels = PixelBuffer.fromImage(GraphUtils.generateQRCode(request.getContent(), sizeDots));
                buffer = composer.qrCodeImage(quantizer.quantize(pixels));
            } else {
                buffer = composer.qrCode(request.getContent(), request.getSize());
            }
            return orchestrator.submit(new RawContent(buffer), titleOr(request.getTitle(), "QR code"));
        });
    }

    private void printBarcode(Context ctx) {
        CodePrintRequest request = ctx.bodyAsClass(CodePrintRequest.class);
        if (request == null || request.getContent() == null || request.getContent().isEmpty()) {
            ctx.status(400).json(ApiResponse.error("Barcode content is required"));
            return;
        }
        submit(ctx, () -> {
            EBarcodeSymbology symbology = EBarcodeSymbology.fromName(request.getSymbology());
            CommandBuffer buffer = composer().barcode(request.getContent(), symbology, request.getHeight());
            return orchestrator.submit(new RawContent(buffer), titleOr(request.getTitle(), "Barcode"));
        });
    }

    /**
     * Multipart upload: field {@code file}, optional {@code title}
     */
    private void printDocument(Context ctx) {
        UploadedFile file = ctx.uploadedFile("file");
        if (file == null) {
            ctx.status(400).json(ApiResponse.error("Document file is required"));
            return;
        }
        Path spoolFile;
        try {
            spoolFile = spoolUpload(file);
        } catch (IOException e) {
            logger.error("Cannot spool uploaded document {}", file.filename(), e);
            ctx.status(500).json(ApiResponse.error("Cannot store document: " + e.getMessage()));
            return;
        }
        String title = titleOr(ctx.formParam("title"), file.filename());
        submit(ctx, () -> orchestrator.submit(new DocumentContent(spoolFile, file.contentType(), true), title));
    }

    private Path spoolUpload(UploadedFile file) throws IOException {
        Files.createDirectories(spoolDirectory);
        String name = file.filename() == null ? "" : file.filename();
        int dot = name.lastIndexOf('.');
        String extension = dot >= 0 ? name.substring(dot).replaceAll("[^A-Za-z0-9.]", "") : ".dat";
        Path target = spoolDirectory.resolve("upload_" + UUID.randomUUID() + extension);
        try (InputStream in = file.content()) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    private interface JobSubmission {
        PrintJob submit();
    }

    private void submit(Context ctx, JobSubmission submission) {
        try {
            PrintJob job = submission.submit();
            String message = job.getStatus() == EJobStatus.BLOCKED
                    ? "Print job waiting: " + PrintJobOrchestrator.PRINTER_NOT_CONFIGURED
                    : "Print job accepted";
            ctx.status(job.getStatus() == EJobStatus.FAILED ? 500 : 202).json(ApiResponse.success(message, job.toInfo()));
        } catch (IllegalArgumentException e) {
            logger.warn("Print request rejected: {}", e.getMessage());
            ctx.status(400).json(ApiResponse.error(e.getMessage()));
        } catch (Exception e) {
            logger.error("Error submitting print job", e);
            ctx.status(500).json(ApiResponse.error("Print failed: " + e.getMessage()));
        }
    }

    private ReceiptComposer composer() {
        PrintSettingsSnapshot snapshot = settingsStore.snapshot();
        AppSettings settings = snapshot.settings();
        return new ReceiptComposer(settings.encoding(), snapshot.paperWidth(), settings.printDensity(),
                settings.feedLinesAfterPrint(), settings.autoCut());
    }

    private static String titleOr(String title, String fallback) {
        return title == null || title.isBlank() ? fallback : title;
    }

    private void listJobs(Context ctx) {
        List<PrintJobInfo> jobs = orchestrator.getJobs().stream().map(PrintJob::toInfo).collect(Collectors.toList());
        ctx.json(ApiResponse.success(jobs));
    }

    private void getJob(Context ctx) {
        String id = ctx.pathParam("id");
        orchestrator.getJob(id).ifPresentOrElse(
                job -> ctx.json(ApiResponse.success(job.toInfo())),
                () -> ctx.status(404).json(ApiResponse.error("Job not found: " + id)));
    }

    private void cancelJob(Context ctx) {
        String id = ctx.pathParam("id");
        if (orchestrator.getJob(id).isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Job not found: " + id));
        } else if (orchestrator.cancel(id)) {
            ctx.json(ApiResponse.success("Cancel requested", id));
        } else {
            ctx.status(409).json(ApiResponse.error("Job already finished: " + id));
        }
    }

    private void dequeueJob(Context ctx) {
        String id = ctx.pathParam("id");
        if (orchestrator.getJob(id).isEmpty()) {
            ctx.status(404).json(ApiResponse.error("Job not found: " + id));
        } else if (orchestrator.dequeue(id)) {
            ctx.json(ApiResponse.success("Job removed", id));
        } else {
            ctx.status(409).json(ApiResponse.error("Job is still active: " + id));
        }
    }

    private void listPendingJobs(Context ctx) {
        List<PendingJob> pending = orchestrator.getPendingJobs();
        ctx.json(ApiResponse.success(pending));
    }

    private void discardPendingJob(Context ctx) {
        String id = ctx.pathParam("id");
        try {
            if (orchestrator.discardPendingJob(id)) {
                ctx.json(ApiResponse.success("Pending job discarded", id));
            } else {
                ctx.status(404).json(ApiResponse.error("Pending job not found: " + id));
            }
        } catch (StoreException e) {
            logger.error("Error discarding pending job {}", id, e);
            ctx.status(500).json(ApiResponse.error("Discard failed: " + e.getMessage()));
        }
    }

    private void sseJobUpdates(SseClient client) {
        String clientId = "jobs_" + UUID.randomUUID();
        logger.info("New job SSE client connecting: {}", clientId);

        if (!sseManager.canAcceptClient()) {
            logger.warn("Maximum SSE client limit reached, rejecting connection");
            client.sendEvent("error", "Maximum number of SSE clients reached");
            client.close();
            return;
        }

        SSEClient wrappedClient = new SSEClient(clientId, client);
        sseManager.registerClient(wrappedClient);
        client.onClose(() -> {
            logger.info("Job SSE client {} closed", clientId);
            sseManager.unregisterClient(clientId);
        });
        client.keepAlive();
    }
}
