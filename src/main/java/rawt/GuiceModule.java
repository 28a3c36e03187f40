package rawt;

import com.google.common.eventbus.EventBus;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.ConfigurationService;
import rawt.dal.JobConfig;
import rawt.dal.LinkConfig;
import rawt.dal.PendingJobStore;
import rawt.dal.PrinterSettingsStore;
import rawt.dal.ServerConfig;
import rawt.dal.StoreConfig;
import rawt.dal.StoreException;
import rawt.domain.AppController;
import rawt.domain.SSEManager;
import rawt.domain.job.PrintJobController;
import rawt.domain.job.PrintJobOrchestrator;
import rawt.domain.link.DummyLinkDriver;
import rawt.domain.link.ILinkDriver;
import rawt.domain.link.ILinkTransport;
import rawt.domain.link.LinkTransport;
import rawt.domain.link.SerialLinkDriver;
import rawt.domain.link.TcpLinkDriver;
import rawt.domain.orchestration.WebServerManager;
import rawt.domain.printservice.VirtualPrinterDiscoverySession;
import rawt.domain.printservice.VirtualPrinterService;
import rawt.domain.raster.DocumentRendererFactory;
import rawt.domain.raster.FloydSteinbergQuantizer;
import rawt.domain.raster.IDocumentRendererFactory;
import rawt.domain.setup.PrinterSetupController;

/**
 * @since 19/10/2026
 */
public class GuiceModule extends AbstractModule {
    private static final Logger logger = LoggerFactory.getLogger(GuiceModule.class);

    private final ConfigurationService configService;

    public GuiceModule(ConfigurationService configService) {
        this.configService = configService;
    }

    @Override
    protected void configure() {
        bind(LinkConfig.class).toInstance(configService.getLinkConfiguration());
        bind(ServerConfig.class).toInstance(configService.getServerConfiguration());
        bind(StoreConfig.class).toInstance(configService.getStoreConfiguration());
        bind(JobConfig.class).toInstance(configService.getJobConfiguration());

        bind(EventBus.class).toInstance(new EventBus("rawthermal"));
        bind(FloydSteinbergQuantizer.class).toInstance(new FloydSteinbergQuantizer());
        bind(IDocumentRendererFactory.class).to(DocumentRendererFactory.class).in(Singleton.class);
        bind(SSEManager.class).in(Singleton.class);
    }

    @Provides
    @Singleton
    public ILinkDriver provideLinkDriver(LinkConfig linkConfig) {
        switch (linkConfig.linkType()) {
            case SERIAL:
                return new SerialLinkDriver(linkConfig);
            case NETWORK:
                return new TcpLinkDriver(linkConfig);
            default:
                logger.warn("⚠ No printer link configured, using dummy link (MTU {})", linkConfig.dummyMtu());
                return new DummyLinkDriver(linkConfig.dummyMtu());
        }
    }

    @Provides
    @Singleton
    public ILinkTransport provideLinkTransport(ILinkDriver driver, LinkConfig linkConfig) {
        return new LinkTransport(driver, linkConfig);
    }

    @Provides
    @Singleton
    public PrinterSettingsStore providePrinterSettingsStore(StoreConfig storeConfig, EventBus eventBus) throws StoreException {
        return new PrinterSettingsStore(storeConfig, eventBus);
    }

    @Provides
    @Singleton
    public PendingJobStore providePendingJobStore(StoreConfig storeConfig) throws StoreException {
        return new PendingJobStore(storeConfig);
    }

    @Provides
    @Singleton
    public PrintJobOrchestrator providePrintJobOrchestrator(ILinkTransport transport,
                                                            PrinterSettingsStore settingsStore,
                                                            PendingJobStore pendingStore,
                                                            IDocumentRendererFactory rendererFactory,
                                                            FloydSteinbergQuantizer quantizer,
                                                            EventBus eventBus,
                                                            JobConfig jobConfig) {
        return new PrintJobOrchestrator(transport, settingsStore, pendingStore, rendererFactory, quantizer,
                eventBus, jobConfig);
    }

    @Provides
    @Singleton
    public VirtualPrinterService provideVirtualPrinterService(PrintJobOrchestrator orchestrator,
                                                              PrinterSettingsStore settingsStore,
                                                              StoreConfig storeConfig) {
        return new VirtualPrinterService(orchestrator, settingsStore, storeConfig);
    }

    @Provides
    @Singleton
    public VirtualPrinterDiscoverySession provideDiscoverySession(VirtualPrinterService printService) {
        return printService.createDiscoverySession(printers ->
                logger.debug("Virtual printer advertised: {}", printers));
    }

    @Provides
    @Singleton
    public WebServerManager provideWebServerManager(ServerConfig serverConfig,
                                                    PrintJobOrchestrator orchestrator,
                                                    PrinterSettingsStore settingsStore,
                                                    FloydSteinbergQuantizer quantizer,
                                                    SSEManager sseManager,
                                                    StoreConfig storeConfig,
                                                    ILinkTransport transport,
                                                    VirtualPrinterDiscoverySession discoverySession) {
        PrintJobController printJobController = new PrintJobController(orchestrator, settingsStore, quantizer,
                sseManager, storeConfig.spoolDirectory());
        PrinterSetupController setupController = new PrinterSetupController(settingsStore, transport,
                discoverySession, sseManager);
        return new WebServerManager(serverConfig, printJobController, setupController);
    }

    @Provides
    @Singleton
    public AppController provideAppController(ServerConfig serverConfig, EventBus eventBus,
                                              PrintJobOrchestrator orchestrator, ILinkTransport transport,
                                              SSEManager sseManager, WebServerManager webServerManager) {
        return new AppController(serverConfig, eventBus, orchestrator, transport, sseManager, webServerManager);
    }
}
