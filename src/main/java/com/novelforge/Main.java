package com.novelforge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.novelforge.controllers.Controller;
import com.novelforge.controllers.GenerationController;
import com.novelforge.controllers.ProjectController;
import com.novelforge.controllers.WebSocketObserver;
import com.novelforge.output.CompositeObserver;
import com.novelforge.output.ConsoleObserver;
import com.novelforge.pipeline.AgentLoop;
import com.novelforge.pipeline.ApprovalService;
import com.novelforge.pipeline.GenerationManager;
import com.novelforge.pipeline.LoopOutcome;
import com.novelforge.providers.chat.ChatProviderFactory;
import com.novelforge.providers.chat.ModelProvider;
import com.novelforge.providers.chat.OpenAiCompatibleChatProvider;
import com.novelforge.providers.tokens.CharacterTokenEstimator;
import com.novelforge.providers.tokens.MoonshotTokenEstimator;
import com.novelforge.providers.tokens.TokenEstimator;
import com.novelforge.settings.ApiSettings;
import com.novelforge.storage.CheckpointStore;
import com.novelforge.storage.ConfigStore;
import com.novelforge.storage.JsonStorage;
import com.novelforge.storage.StateStore;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;

import java.io.FileNotFoundException;
import java.util.List;

public class Main {

    private static final String VERSION = "1.0.0";
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static AppLogger logger;

    public static void main(String[] args) {
        try {
            AppConfig config = new AppConfig.Builder()
                    .parseArgs(args)
                    .build();

            AppLogger.initialize(config.getLogPath(), config.isDevMode() || config.getRunProjectId() != null,
                config.isDevMode());
            logger = AppLogger.get();
            printBanner(config);

            JsonStorage storage = new JsonStorage(objectMapper);
            StateStore stateStore = new StateStore(storage);
            CheckpointStore checkpointStore = new CheckpointStore(storage);
            ProjectService projects = new ProjectService(config.getOutputPath(), new ConfigStore(storage), stateStore);
            ChatProviderFactory providers = new ChatProviderFactory(objectMapper);

            if (config.getRunProjectId() != null) {
                int code = runForeground(config, projects, stateStore, checkpointStore, providers);
                logger.close();
                System.exit(code);
                return;
            }

            WebSocketObserver sockets = new WebSocketObserver();
            CompositeObserver observers = new CompositeObserver()
                .add(new ConsoleObserver(config.isShowReasoning()))
                .add(sockets);
            GenerationManager generation = new GenerationManager(projects,
                project -> buildLoop(project, stateStore, checkpointStore, providers, observers));
            ApprovalService approvals = new ApprovalService(projects, checkpointStore);

            Javalin app = Javalin.create(cfg -> {
                cfg.jsonMapper(new JavalinJackson(objectMapper));
                cfg.http.defaultContentType = "application/json";
            });

            List<Controller> controllers = List.of(
                new ProjectController(projects, generation, objectMapper),
                new GenerationController(projects, generation, approvals, objectMapper),
                sockets
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
            logger.console("  Projects: " + config.getOutputPath());
            logger.console("  Log file: " + config.getLogPath());
            logger.console("");
            logger.console("========================================");
            logger.console("  Press Ctrl+C to stop");
            logger.console("========================================");

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                logger.info("Shutting down...");
                generation.shutdown();
                app.stop();
                logger.close();
            }));

        } catch (Exception e) {
            System.err.println("Failed to start Novel Forge: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Generate one project on the calling thread, printing to the terminal.
     * Approvals still go through the HTTP API of a running server, or by editing the state file.
     */
    private static int runForeground(AppConfig config, ProjectService projects, StateStore stateStore,
                                     CheckpointStore checkpointStore, ChatProviderFactory providers) throws Exception {
        String projectId = config.getRunProjectId();
        ProjectContext project = projects.open(projectId);
        ConsoleObserver console = new ConsoleObserver(config.isShowReasoning());
        CompositeObserver observers = new CompositeObserver().add(console);
        AgentLoop loop = buildLoop(project, stateStore, checkpointStore, providers, observers);
        LoopOutcome outcome = loop.run();
        logger.info("Run finished: " + outcome);
        return outcome == LoopOutcome.COMPLETED ? 0 : 2;
    }

    static AgentLoop buildLoop(ProjectContext project, StateStore stateStore, CheckpointStore checkpointStore,
                               ChatProviderFactory providers, CompositeObserver observers) {
        ApiSettings api = project.getConfig().getApi();
        ModelProvider provider = providers.getProvider(api);
        TokenEstimator estimator = new CharacterTokenEstimator();
        if (provider instanceof OpenAiCompatibleChatProvider && "moonshot".equals(provider.getProviderName())) {
            estimator = new MoonshotTokenEstimator(objectMapper, providers.getHttpClient(),
                ((OpenAiCompatibleChatProvider) provider).getBaseUrl(),
                providers.resolveApiKey("moonshot", api.getApiKey()));
        }
        return AgentLoop.builder()
            .project(project)
            .provider(provider)
            .estimator(estimator)
            .stateStore(stateStore)
            .checkpointStore(checkpointStore)
            .observer(observers)
            .approvals(observers)
            .mapper(objectMapper)
            .build();
    }

    private static void printBanner(AppConfig config) {
        logger.console("");
        logger.console("========================================");
        logger.console("  Novel Forge v" + VERSION);
        logger.console("========================================");
        if (config.getRunProjectId() != null) {
            logger.console("  Running project: " + config.getRunProjectId());
        } else {
            logger.console("  Starting server...");
        }
        if (config.isDevMode()) {
            logger.console("  Mode: Development");
        }
    }

    private static void registerExceptionHandlers(Javalin app) {
        app.exception(FileNotFoundException.class, (e, ctx) -> {
            logger.warn("Not found: " + e.getMessage());
            ctx.status(404).json(Controller.errorBody(e));
        });

        app.exception(SecurityException.class, (e, ctx) -> {
            logger.warn("Security violation: " + e.getMessage());
            ctx.status(403).json(Controller.errorBody(e));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400).json(Controller.errorBody(e));
        });

        app.exception(Exception.class, (e, ctx) -> {
            logger.error("Unhandled exception: " + e.getMessage(), e);
            ctx.status(500).json(Controller.errorBody(e));
        });
    }
}
