package rawt.domain.job;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.Subscribe;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.common.EscPosConstants;
import rawt.dal.AppSettings;
import rawt.dal.JobConfig;
import rawt.dal.PendingJob;
import rawt.dal.PendingJobStore;
import rawt.dal.PrintSettingsSnapshot;
import rawt.dal.PrinterConfiguredEvent;
import rawt.dal.PrinterSettingsStore;
import rawt.dal.SavedPrinter;
import rawt.dal.StoreException;
import rawt.domain.escpos.CommandBuffer;
import rawt.domain.escpos.ReceiptComposer;
import rawt.domain.link.ConnectionException;
import rawt.domain.link.ILinkTransport;
import rawt.domain.link.LinkException;
import rawt.domain.link.WriteCanceledException;
import rawt.domain.link.WriteException;
import rawt.domain.raster.FloydSteinbergQuantizer;
import rawt.domain.raster.IDocumentRendererFactory;
import rawt.domain.raster.IPageRenderer;
import rawt.domain.raster.PixelBuffer;
import rawt.domain.raster.RenderException;
import rawt.domain.raster.ThermalRaster;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Print job queue and lifecycle.
 *
 * <p>Jobs run one at a time on a single worker thread in submission order, which makes the
 * worker the only writer to the transport. A job submitted while no printer is configured is
 * copied into the {@link PendingJobStore} and blocked; when a printer gets configured every
 * pending job is replayed in creation order and its record is removed once it printed.</p>
 *
 * <p>Settings are read once when a job starts. The transport is disconnected after every job.</p>
 *
 * @since 19/10/2026
 */
public class PrintJobOrchestrator implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PrintJobOrchestrator.class);
    public static final String PRINTER_NOT_CONFIGURED = "Printer not configured";

    private final ILinkTransport transport;
    private final PrinterSettingsStore settingsStore;
    private final PendingJobStore pendingStore;
    private final IDocumentRendererFactory rendererFactory;
    private final FloydSteinbergQuantizer quantizer;
    private final EventBus eventBus;
    private final JobConfig jobConfig;
    private final Gson gson = new Gson();

    private final ExecutorService worker;
    private final ReentrantLock submissionLock = new ReentrantLock();
    private final Map<String, PrintJob> jobs = new LinkedHashMap<>();
    private final Map<String, PrintJob> blockedJobs = new ConcurrentHashMap<>();
    private final Set<String> replaying = ConcurrentHashMap.newKeySet();

    public PrintJobOrchestrator(ILinkTransport transport,
                                PrinterSettingsStore settingsStore,
                                PendingJobStore pendingStore,
                                IDocumentRendererFactory rendererFactory,
                                FloydSteinbergQuantizer quantizer,
                                EventBus eventBus,
                                JobConfig jobConfig) {
        this.transport = transport;
        this.settingsStore = settingsStore;
        this.pendingStore = pendingStore;
        this.rendererFactory = rendererFactory;
        this.quantizer = quantizer;
        this.eventBus = eventBus;
        this.jobConfig = jobConfig;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "print-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Subscribe to configuration events and replay leftovers when a printer is already selected
     */
    public void start() {
        eventBus.register(this);
        int pending = pendingStore.size();
        logger.info("✓ Print job orchestrator started, {} pending job(s)", pending);
        if (pending > 0 && settingsStore.getCurrentPrinter().isPresent()) {
            resumePendingJobs();
        }
    }

    public PrintJob submit(IPrintContent content, String title) {
        return submit(content, title, null);
    }

    /**
     * Queue a job.
     * @throws IllegalArgumentException if the content can never be printed (e.g. text the encoding cannot represent)
     */
    public PrintJob submit(IPrintContent content, String title, IPrintJobListener listener) {
        if (content == null) {
            throw new IllegalArgumentException("Print content is required");
        }
        PrintSettingsSnapshot snapshot = settingsStore.snapshot();
        if (content instanceof TextContent) {
            snapshot.settings().encoding().encode(((TextContent) content).text());
        }

        PrintJob job = new PrintJob(UUID.randomUUID().toString(), title, content, listener);
        register(job);
        logger.info("Job submitted: {}", job);

        submissionLock.lock();
        try {
            if (settingsStore.getCurrentPrinter().isEmpty()) {
                holdForPrinter(job);
            } else {
                // a printer may have been selected before its configured event reached us
                if (pendingStore.size() > 0) {
                    resumePendingJobs();
                }
                publish(job, "queued");
                worker.execute(() -> runJob(job, null));
            }
        } finally {
            submissionLock.unlock();
        }
        return job;
    }

    /**
     * Persist the job content and block until a printer is configured
     */
    private void holdForPrinter(PrintJob job) {
        IPrintContent content = job.getContent();
        try (InputStream in = openContent(content)) {
            pendingStore.add(job.getId(), job.getTitle(), content.getType(), content.getMimeType(), in);
        } catch (StoreException | IOException e) {
            logger.error("Cannot store job {} for later printing: {}", job.getId(), e.getMessage());
            finishFailed(job, JobFailure.beforePrinting(EJobErrorClass.PERSISTENCE,
                    "Cannot store job for later printing: " + e.getMessage()));
            return;
        }
        releaseSpool(content);

        if (job.block(PRINTER_NOT_CONFIGURED)) {
            blockedJobs.put(job.getId(), job);
            logger.info("Job {} blocked: {}", job.getId(), PRINTER_NOT_CONFIGURED);
            notifyListener(job, l -> l.onBlocked(job, PRINTER_NOT_CONFIGURED));
            publish(job, "blocked");
            eventBus.post(new PrinterSetupRequiredEvent(job.getId(), job.getTitle(), PRINTER_NOT_CONFIGURED));
        }
    }

    private InputStream openContent(IPrintContent content) throws IOException {
        switch (content.getType()) {
            case TEXT:
                return new ByteArrayInputStream(gson.toJson(content).getBytes(StandardCharsets.UTF_8));
            case RAW:
                return new ByteArrayInputStream(((RawContent) content).getBuffer().toByteArray());
            default:
                return Files.newInputStream(((DocumentContent) content).getFile());
        }
    }

    @Subscribe
    public void onPrinterConfigured(PrinterConfiguredEvent event) {
        logger.info("Printer configured: {}", event.printer());
        resumePendingJobs();
    }

    /**
     * Queue every pending job, oldest first. Jobs already queued for replay are skipped.
     * @return number of jobs queued
     */
    public int resumePendingJobs() {
        submissionLock.lock();
        try {
            int resumed = 0;
            for (PendingJob record : pendingStore.list()) {
                if (!replaying.add(record.id())) {
                    continue;
                }
                PrintJob job = blockedJobs.remove(record.id());
                if (job == null) {
                    job = restoreJob(record);
                    if (job == null) {
                        replaying.remove(record.id());
                        continue;
                    }
                }
                PrintJob queued = job;
                worker.execute(() -> runJob(queued, record));
                resumed++;
            }
            if (resumed > 0) {
                logger.info("Resuming {} pending job(s)", resumed);
            }
            return resumed;
        } finally {
            submissionLock.unlock();
        }
    }

    /**
     * Rebuild a job from its stored record (after a restart or an earlier failed replay)
     */
    private PrintJob restoreJob(PendingJob record) {
        try {
            PrintJob job = new PrintJob(record.id(), record.title(), loadContent(record), null);
            register(job);
            logger.info("Restored pending job {}", job);
            return job;
        } catch (StoreException | JsonParseException | IllegalArgumentException e) {
            logger.error("Pending job {} cannot be restored: {}", record.id(), e.getMessage());
            return null;
        }
    }

    private IPrintContent loadContent(PendingJob record) throws StoreException {
        switch (record.contentType()) {
            case TEXT:
                String json = new String(pendingStore.readContent(record), StandardCharsets.UTF_8);
                return gson.fromJson(json, TextContent.class);
            case RAW:
                return new RawContent(CommandBuffer.of(pendingStore.readContent(record)));
            default:
                return new DocumentContent(pendingStore.contentPath(record), record.mimeType(), false);
        }
    }

    /**
     * Worker body; {@code record} is set when the job is replayed from the pending store
     */
    private void runJob(PrintJob job, PendingJob record) {
        try {
            if (job.isTerminal()) {
                logger.debug("Skipping job {}: already {}", job.getId(), job.getStatus());
                return;
            }

            PrintSettingsSnapshot snapshot = settingsStore.snapshot();
            Optional<SavedPrinter> printer = snapshot.printer();
            if (printer.isEmpty()) {
                handleMissingPrinter(job, record);
                return;
            }

            if (!job.tryTransition(EJobStatus.PRINTING)) {
                return;
            }
            publish(job, "printing");
            notifyListener(job, l -> l.onStarted(job));

            IPrintContent content = contentFor(job, record);
            JobFailure failure = null;
            boolean canceled = false;
            try {
                transport.connect(printer.get().address(), snapshot.paperWidth());
                deliver(job, content, snapshot);
            } catch (WriteCanceledException e) {
                logger.info("Job {} canceled while printing: {}", job.getId(), e.getMessage());
                canceled = true;
            } catch (ConnectionException e) {
                failure = failure(job, EJobErrorClass.CONNECTION, e.getMessage());
            } catch (LinkException e) {
                failure = failure(job, EJobErrorClass.TRANSPORT, e.getMessage());
            } catch (RenderException e) {
                failure = failure(job, EJobErrorClass.RENDER, e.getMessage());
            } catch (IllegalArgumentException e) {
                failure = failure(job, EJobErrorClass.INPUT, e.getMessage());
            } finally {
                transport.disconnect();
                releaseSpool(content);
            }

            // link is closed before anyone hears about the outcome
            if (canceled) {
                removePendingRecord(job.getId());
                finishCanceled(job);
            } else if (failure != null) {
                finishFailed(job, failure);
            } else {
                finishCompleted(job, record);
            }
        } catch (RuntimeException e) {
            logger.error("Unexpected error processing job {}", job.getId(), e);
            finishFailed(job, JobFailure.atPage(EJobErrorClass.INTERNAL, String.valueOf(e.getMessage()), job.getPagesPrinted()));
        } finally {
            if (record != null) {
                replaying.remove(record.id());
            }
        }
    }

    /**
     * A replayed document prints from the pending store copy; its spool file is gone
     */
    private IPrintContent contentFor(PrintJob job, PendingJob record) {
        IPrintContent content = job.getContent();
        if (record != null && content instanceof DocumentContent) {
            return new DocumentContent(pendingStore.contentPath(record), record.mimeType(), false);
        }
        return content;
    }

    /**
     * The printer was deselected between submission and start
     */
    private void handleMissingPrinter(PrintJob job, PendingJob record) {
        submissionLock.lock();
        try {
            if (record == null) {
                holdForPrinter(job);
                return;
            }
            if (job.getStatus() == EJobStatus.BLOCKED || job.block(PRINTER_NOT_CONFIGURED)) {
                blockedJobs.put(job.getId(), job);
                publish(job, "blocked");
                logger.info("Job {} blocked again: {}", job.getId(), PRINTER_NOT_CONFIGURED);
            }
        } finally {
            submissionLock.unlock();
        }
    }

    private void deliver(PrintJob job, IPrintContent content, PrintSettingsSnapshot snapshot)
            throws LinkException, RenderException {
        AppSettings settings = snapshot.settings();
        ReceiptComposer composer = new ReceiptComposer(settings.encoding(), snapshot.paperWidth(),
                settings.printDensity(), settings.feedLinesAfterPrint(), settings.autoCut());

        switch (content.getType()) {
            case TEXT: {
                TextContent text = (TextContent) content;
                job.setTotalPages(1);
                transport.write(composer.text(text.text(), text.style()), job::isCancelRequested);
                job.pagePrinted();
                break;
            }
            case RAW: {
                job.setTotalPages(1);
                transport.write(((RawContent) content).getBuffer(), job::isCancelRequested);
                job.pagePrinted();
                break;
            }
            default:
                printDocument(job, (DocumentContent) content, composer, snapshot);
        }
    }

    private void printDocument(PrintJob job, DocumentContent document, ReceiptComposer composer,
                               PrintSettingsSnapshot snapshot) throws LinkException, RenderException {
        int targetWidth = snapshot.paperWidth().getDots();
        try (IPageRenderer renderer = rendererFactory.open(document.getFile(), document.getMimeType())) {
            int pageCount = renderer.getPageCount();
            if (pageCount == 0) {
                throw new RenderException("Document has no pages", 0);
            }
            job.setTotalPages(pageCount);
            logger.info("Printing job {}: {} page(s) at {} dots", job.getId(), pageCount, targetWidth);

            for (int page = 0; page < pageCount; page++) {
                if (job.isCancelRequested()) {
                    throw new WriteCanceledException(0);
                }
                PixelBuffer pixels = renderer.renderPage(page, targetWidth);
                ThermalRaster raster = quantizer.quantize(pixels);
                boolean lastPage = page == pageCount - 1;

                transport.write(composer.page(raster, composer.isAutoCut() && !lastPage), job::isCancelRequested);
                job.pagePrinted();
                logger.debug("Job {} page {}/{} sent", job.getId(), page + 1, pageCount);

                if (!lastPage) {
                    pauseBetweenPages(page);
                }
            }

            CommandBuffer trailer = composer.documentTrailer(EscPosConstants.TRAILING_FEED_LINES);
            if (!trailer.isEmpty()) {
                transport.write(trailer, job::isCancelRequested);
            }
        }
    }

    private static JobFailure failure(PrintJob job, EJobErrorClass errorClass, String message) {
        return JobFailure.whilePrinting(errorClass, message, job.getPagesPrinted(), job.getTotalPages());
    }

    private void pauseBetweenPages(int page) throws WriteException {
        if (jobConfig.pageDelayMs() <= 0) {
            return;
        }
        try {
            Thread.sleep(jobConfig.pageDelayMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WriteException("Interrupted after page " + page, -1, e);
        }
    }

    /**
     * Cancel a job. Queued and blocked jobs end at once; a printing job stops before its next chunk.
     * @return false if the job is unknown or already finished
     */
    public boolean cancel(String jobId) {
        PrintJob job = getJobInternal(jobId);
        if (job == null || job.isTerminal()) {
            return false;
        }
        job.requestCancel();

        submissionLock.lock();
        try {
            if (job.cancelIfWaiting()) {
                blockedJobs.remove(jobId);
                removePendingRecord(jobId);
                logger.info("Job {} canceled", jobId);
                notifyListener(job, l -> l.onCanceled(job));
                publish(job, "canceled");
                job.completeFuture();
                return true;
            }
        } finally {
            submissionLock.unlock();
        }
        logger.info("Cancel requested for printing job {}", jobId);
        return true;
    }

    private void removePendingRecord(String jobId) {
        try {
            pendingStore.remove(jobId);
        } catch (StoreException e) {
            logger.error("Pending record of job {} could not be removed and will be replayed again: {}",
                    jobId, e.getMessage());
        }
    }

    private void finishCompleted(PrintJob job, PendingJob record) {
        if (record != null) {
            removePendingRecord(record.id());
        }
        if (job.tryTransition(EJobStatus.COMPLETED)) {
            logger.info("✓ Job {} completed ({} page(s))", job.getId(), job.getPagesPrinted());
            notifyListener(job, l -> l.onCompleted(job));
            publish(job, "completed");
            job.completeFuture();
        }
    }

    private void finishFailed(PrintJob job, JobFailure failure) {
        if (job.fail(failure)) {
            logger.error("Job {} failed: {}", job.getId(), failure);
            notifyListener(job, l -> l.onFailed(job, failure));
            publish(job, "failed");
            job.completeFuture();
        }
    }

    private void finishCanceled(PrintJob job) {
        if (job.tryTransition(EJobStatus.CANCELED)) {
            logger.info("Job {} canceled", job.getId());
            notifyListener(job, l -> l.onCanceled(job));
            publish(job, "canceled");
            job.completeFuture();
        }
    }

    private void releaseSpool(IPrintContent content) {
        if (content instanceof DocumentContent && ((DocumentContent) content).isTemporary()) {
            try {
                Files.deleteIfExists(((DocumentContent) content).getFile());
            } catch (IOException e) {
                logger.warn("Cannot delete spool file {}: {}", ((DocumentContent) content).getFile(), e.getMessage());
            }
        }
    }

    private interface ListenerCall {
        void accept(IPrintJobListener listener);
    }

    private void notifyListener(PrintJob job, ListenerCall call) {
        IPrintJobListener listener = job.getListener();
        if (listener == null) {
            return;
        }
        try {
            call.accept(listener);
        } catch (Exception e) {
            logger.error("Error notifying listener of job {}: {}", job.getId(), e.getMessage());
        }
    }

    private void publish(PrintJob job, String source) {
        eventBus.post(new PrintJobEvent(job.toInfo(), source));
    }

    private void register(PrintJob job) {
        synchronized (jobs) {
            jobs.put(job.getId(), job);
            trimFinishedJobs();
        }
    }

    private void trimFinishedJobs() {
        int excess = jobs.size() - jobConfig.retainedJobs();
        Iterator<PrintJob> iterator = jobs.values().iterator();
        while (excess > 0 && iterator.hasNext()) {
            if (iterator.next().isTerminal()) {
                iterator.remove();
                excess--;
            }
        }
    }

    private PrintJob getJobInternal(String jobId) {
        synchronized (jobs) {
            return jobs.get(jobId);
        }
    }

    public Optional<PrintJob> getJob(String jobId) {
        return Optional.ofNullable(getJobInternal(jobId));
    }

    /**
     * Known jobs in submission order
     */
    public List<PrintJob> getJobs() {
        synchronized (jobs) {
            return new ArrayList<>(jobs.values());
        }
    }

    /**
     * Forget a finished job
     * @return false if the job is unknown or still active
     */
    public boolean dequeue(String jobId) {
        synchronized (jobs) {
            PrintJob job = jobs.get(jobId);
            if (job == null || !job.isTerminal()) {
                return false;
            }
            jobs.remove(jobId);
            return true;
        }
    }

    public List<PendingJob> getPendingJobs() {
        return pendingStore.list();
    }

    /**
     * Drop a pending job without printing it
     */
    public boolean discardPendingJob(String jobId) throws StoreException {
        PrintJob job = getJobInternal(jobId);
        if (job != null && !job.isTerminal()) {
            return cancel(jobId);
        }
        return pendingStore.remove(jobId);
    }

    @Override
    public void close() {
        try {
            eventBus.unregister(this);
        } catch (IllegalArgumentException e) {
            logger.debug("Orchestrator was not registered on the event bus");
        }
        worker.shutdownNow();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Print worker did not terminate in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.info("Print job orchestrator stopped");
    }
}
