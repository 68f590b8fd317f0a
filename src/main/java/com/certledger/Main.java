package com.certledger;

import com.certledger.controllers.CertificationController;
import com.certledger.controllers.Controller;
import com.certledger.controllers.EpochController;
import com.certledger.errors.AllocationFailedException;
import com.certledger.errors.ConflictingOnChainRefException;
import com.certledger.errors.EpochClosedException;
import com.certledger.errors.InvalidMetricRangeException;
import com.certledger.errors.LedgerPersistenceException;
import com.certledger.errors.NotRegisteredException;
import com.certledger.errors.ScoringUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.util.List;
import java.util.Map;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode());
            logger = AppLogger.get();

            printBanner(config);

            TokenomicsPolicyStore policyStore =
                new TokenomicsPolicyStore(objectMapper, config.getDataPath().resolve("policy.json"));
            TokenomicsPolicy policy = policyStore.loadOrDefault(new TokenomicsPolicy());

            TokenomicsCoordinator coordinator = TokenomicsCoordinator.open(config.getDataPath(), policy);
            logger.info("Ledger opened at " + config.getDataPath() + ", active epoch "
                + coordinator.getEpochStatus().getIndex() + " (" + coordinator.getEpochStatus().getName() + ")");

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new CertificationController(coordinator, objectMapper),
                new EpochController(coordinator, policy, objectMapper)
            );
            for (Controller controller : controllers) {
                controller.registerRoutes(app);
            }

            registerExceptionHandlers(app);

            app.start(config.getPort());

            String url = "http://localhost:" + config.getPort() + "/";
            logger.info("Server started on " + url);
            logger.console("");
            logger.console("  Listening on " + url);
            logger.console("  Data: " + config.getDataPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Cert Ledger: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Cert Ledger v" + VERSION);
        logger.console("========================================");
        logger.console("  Starting server...");
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    static void registerExceptionHandlers(Javalin app) {
        app.exception(InvalidMetricRangeException.class, (e, ctx) -> {
            logger.warn("Rejected metrics: " + e.getMessage());
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) ->
            ctx.status(400).json(Controller.errorBody(e)));

        app.exception(AllocationFailedException.class, (e, ctx) -> {
            logger.warn("Allocation failed: " + e.getMessage());
            ctx.status(503).json(Map.of("error", e.getMessage(), "retryable", e.isRetryable()));
        });

        app.exception(NotRegisteredException.class, (e, ctx) ->
            ctx.status(409).json(Controller.errorBody(e)));

        app.exception(ConflictingOnChainRefException.class, (e, ctx) -> {
            logger.warn("Conflicting anchor: " + e.getMessage());
            ctx.status(409).json(Controller.errorBody(e));
        });

        app.exception(EpochClosedException.class, (e, ctx) ->
            ctx.status(409).json(Controller.errorBody(e)));

        app.exception(ScoringUnavailableException.class, (e, ctx) -> {
            logger.warn("Scorer unavailable: " + e.getMessage());
            ctx.status(502).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(LedgerPersistenceException.class, (e, ctx) -> {
            logger.error("Ledger write failed: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });

        app.exception(IllegalStateException.class, (e, ctx) ->
            ctx.status(409).json(Controller.errorBody(e)));

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
