package rawt.domain.printservice;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.PrinterSettingsStore;
import rawt.dal.StoreConfig;
import rawt.domain.job.DocumentContent;
import rawt.domain.job.PrintJob;
import rawt.domain.job.PrintJobOrchestrator;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for the host print subsystem. Spools each host document and prints it
 * through the {@link PrintJobOrchestrator}, reporting the outcome back on the host job.
 * @since 19/10/2026
 */
public class VirtualPrinterService {
    private static final Logger logger = LoggerFactory.getLogger(VirtualPrinterService.class);
    private static final String DEFAULT_MIME_TYPE = "application/pdf";

    private final PrintJobOrchestrator orchestrator;
    private final PrinterSettingsStore settingsStore;
    private final Path spoolDirectory;
    // host job id -> orchestrator job id
    private final Map<String, String> activeJobs = new ConcurrentHashMap<>();

    public VirtualPrinterService(PrintJobOrchestrator orchestrator, PrinterSettingsStore settingsStore,
                                 StoreConfig storeConfig) {
        this.orchestrator = orchestrator;
        this.settingsStore = settingsStore;
        this.spoolDirectory = storeConfig.spoolDirectory();
    }

    public VirtualPrinterDiscoverySession createDiscoverySession(IPrinterDiscoveryListener listener) {
        logger.debug("Creating printer discovery session");
        return new VirtualPrinterDiscoverySession(settingsStore, listener);
    }

    /**
     * Accept a host job. Failures to read the host document fail the host job right away.
     * @return the orchestrator job, empty when the host job was failed before submission
     */
    public Optional<PrintJob> onPrintJobQueued(IHostPrintJob hostJob) {
        logger.info("Host print job queued: {} '{}'", hostJob.getId(), hostJob.getTitle());
        HostJobListener listener = new HostJobListener(hostJob);
        String mimeType = hostJob.getMimeType() != null ? hostJob.getMimeType() : DEFAULT_MIME_TYPE;

        Path spoolFile;
        try {
            spoolFile = spool(hostJob, mimeType);
        } catch (IOException e) {
            logger.error("Cannot spool host job {}: {}", hostJob.getId(), e.getMessage());
            listener.failBeforeSubmit("Failed to queue job: " + e.getMessage());
            return Optional.empty();
        }
        if (spoolFile == null) {
            logger.error("Host job {} has no document data", hostJob.getId());
            listener.failBeforeSubmit("No document data");
            return Optional.empty();
        }

        try {
            PrintJob job = orchestrator.submit(new DocumentContent(spoolFile, mimeType, true), hostJob.getTitle(), listener);
            activeJobs.put(hostJob.getId(), job.getId());
            job.completion().thenRun(() -> activeJobs.remove(hostJob.getId()));
            return Optional.of(job);
        } catch (IllegalArgumentException e) {
            logger.error("Host job {} rejected: {}", hostJob.getId(), e.getMessage());
            deleteSpool(spoolFile);
            listener.failBeforeSubmit(e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Cancel the orchestrator job behind a host job; a host job we never accepted is canceled directly
     */
    public void onRequestCancelPrintJob(IHostPrintJob hostJob) {
        logger.info("Cancel requested for host job: {}", hostJob.getId());
        String jobId = activeJobs.get(hostJob.getId());
        if (jobId == null || !orchestrator.cancel(jobId)) {
            hostJob.cancel();
        }
    }

    public int getActiveJobCount() {
        return activeJobs.size();
    }

    private Path spool(IHostPrintJob hostJob, String mimeType) throws IOException {
        try (InputStream in = hostJob.openDocument()) {
            if (in == null) {
                return null;
            }
            Files.createDirectories(spoolDirectory);
            Path target = spoolDirectory.resolve("host_" + sanitize(hostJob.getId()) + extensionFor(mimeType));
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Spooled host job {} to {}", hostJob.getId(), target);
            return target;
        }
    }

    private void deleteSpool(Path spoolFile) {
        try {
            Files.deleteIfExists(spoolFile);
        } catch (IOException e) {
            logger.warn("Cannot delete spool file {}: {}", spoolFile, e.getMessage());
        }
    }

    private static String sanitize(String id) {
        return id.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    static String extensionFor(String mimeType) {
        switch (mimeType.toLowerCase(Locale.ROOT)) {
            case "application/pdf":
                return ".pdf";
            case "image/png":
                return ".png";
            case "image/jpeg":
            case "image/jpg":
                return ".jpg";
            default:
                return ".dat";
        }
    }
}
