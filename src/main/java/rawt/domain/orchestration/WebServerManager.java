package rawt.domain.orchestration;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.javalin.Javalin;
import io.javalin.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import rawt.dal.ServerConfig;
import rawt.domain.ApiResponse;
import rawt.domain.job.PrintJobController;
import rawt.domain.setup.PrinterSetupController;

import java.lang.reflect.Type;

import static io.javalin.apibuilder.ApiBuilder.get;

/**
 * Manages web server (Javalin) configuration and lifecycle
 * @since 19/10/2026
 */
public class WebServerManager {
    private static final Logger logger = LoggerFactory.getLogger(WebServerManager.class);

    private final ServerConfig serverConfig;
    private final PrintJobController printJobController;
    private final PrinterSetupController printerSetupController;

    // Pretty-printing Gson for API responses
    private final Gson gson;

    private Javalin javalinApp;

    public WebServerManager(ServerConfig serverConfig,
                            PrintJobController printJobController,
                            PrinterSetupController printerSetupController) {
        this.serverConfig = serverConfig;
        this.printJobController = printJobController;
        this.printerSetupController = printerSetupController;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
    }

    public void start() {
        logger.info("Starting web server on {}:{}...", serverConfig.host(), serverConfig.port());
        javalinApp = createJavalinApp();
        logger.info("✓ Web server started successfully");
    }

    public void stop() {
        if (javalinApp != null) {
            javalinApp.stop();
            javalinApp = null;
        }
    }

    private Javalin createJavalinApp() {
        Javalin app = Javalin.create(config -> {
            config.jsonMapper(createGsonMapper());

            config.bundledPlugins.enableCors(cors -> {
                cors.addRule(corsRule -> {
                    corsRule.anyHost();
                    corsRule.allowCredentials = false;
                });
            });

            config.router.apiBuilder(() -> {
                get("/api/health", ctx -> ctx.json(ApiResponse.success("RawThermal is running", null)));
                printJobController.registerRoutes();
                printerSetupController.registerRoutes();
            });
        });

        app.exception(JsonParseException.class, (exception, ctx) -> {
            logger.warn("Malformed request body: {}", exception.getMessage());
            ctx.status(400).json(ApiResponse.error("Malformed request body: " + exception.getMessage()));
        });

        app.exception(Exception.class, (exception, ctx) -> {
            logger.error("Unhandled exception", exception);
            ctx.status(500).json(ApiResponse.error("Internal server error: " + exception.getMessage()));
        });

        return app.start(serverConfig.host(), serverConfig.port());
    }

    private JsonMapper createGsonMapper() {
        return new JsonMapper() {
            @Override
            public String toJsonString(Object obj, Type type) {
                return gson.toJson(obj, type);
            }

            @Override
            public <T> T fromJsonString(String json, Type targetType) {
                return gson.fromJson(json, targetType);
            }
        };
    }
}
