package work.lcod.envbase.api;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.aws.AwsCloudServices;
import work.lcod.envbase.cloud.CloudServices;
import work.lcod.envbase.config.ConfigLoader;
import work.lcod.envbase.config.ConfigTrees;
import work.lcod.envbase.config.DatabaseConfigHandler;
import work.lcod.envbase.config.EnvironmentOverrides;
import work.lcod.envbase.deploy.DeployOutcome;
import work.lcod.envbase.deploy.DeploymentOrchestrator;
import work.lcod.envbase.deploy.DeploymentReport;
import work.lcod.envbase.deploy.NotificationSession;
import work.lcod.envbase.deploy.TemplateStore;
import work.lcod.envbase.monitor.StackEventHandler;
import work.lcod.envbase.monitor.StackEventMonitor;
import work.lcod.envbase.shared.HandlerRegistrationException;
import work.lcod.envbase.template.AmiCatalog;
import work.lcod.envbase.template.ComposerSettings;
import work.lcod.envbase.template.Parameter;
import work.lcod.envbase.template.Resource;
import work.lcod.envbase.template.Template;
import work.lcod.envbase.template.TemplateComposer;
import work.lcod.envbase.template.TemplateRenderer;
import work.lcod.envbase.template.UploadTarget;

/**
 * Controller behind the {@code init}, {@code create}, {@code deploy} and {@code delete} actions.
 *
 * <p>Projects subclass it and override {@link #buildTemplate()} to add resources and child templates to the root
 * template. Handler lists, manual bindings and deploy parameters are per instance.
 */
public class EnvironmentBase implements AutoCloseable {
    public static final String DEFAULT_DESCRIPTION = "No Description Specified";

    private static final Logger log = LoggerFactory.getLogger(EnvironmentBase.class);

    private final EnvironmentOptions options;
    private final ConfigLoader configLoader;
    private final Function<Map<String, Object>, CloudServices> cloudFactory;
    private final TemplateRenderer renderer;
    private final Clock clock;
    private final List<StackEventHandler> stackEventHandlers = new ArrayList<>();
    private final Map<String, Object> manualParameterBindings = new LinkedHashMap<>();
    private final Map<String, String> deployParameterBindings = new LinkedHashMap<>();

    private Map<String, Object> config;
    private Template template;
    private TemplateComposer composer;
    private CloudServices cloud;

    public EnvironmentBase(EnvironmentOptions options) {
        this(options, AwsCloudServices::fromConfig, Clock.systemUTC());
    }

    public EnvironmentBase(
        EnvironmentOptions options,
        Function<Map<String, Object>, CloudServices> cloudFactory,
        Clock clock
    ) {
        this.options = Objects.requireNonNull(options, "options");
        this.cloudFactory = Objects.requireNonNull(cloudFactory, "cloudFactory");
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.configLoader = new ConfigLoader(options.createMissingFiles());
        this.renderer = new TemplateRenderer(this.clock);
    }

    public EnvironmentOptions options() {
        return options;
    }

    /** Must be called before the configuration is loaded, the handler's schema takes part in validation. */
    public EnvironmentBase addConfigHandler(Object handler) {
        if (config != null) {
            throw new IllegalStateException("Config handlers must be registered before the configuration is loaded");
        }
        configLoader.registerHandler(handler);
        return this;
    }

    public EnvironmentBase addStackEventHandler(Object handler) {
        if (handler == null) {
            throw new HandlerRegistrationException("Stack event handler must not be null");
        }
        if (!(handler instanceof StackEventHandler eventHandler)) {
            throw new HandlerRegistrationException(
                "Class " + handler.getClass().getName()
                    + " cannot be a stack event handler, it must implement handle(StackEvent)"
            );
        }
        stackEventHandlers.add(eventHandler);
        return this;
    }

    public List<StackEventHandler> stackEventHandlers() {
        return Collections.unmodifiableList(stackEventHandlers);
    }

    /** Binding used for a child parameter of the same name, ahead of any other source. */
    public EnvironmentBase addManualParameterBinding(String parameterName, Object value) {
        manualParameterBindings.put(parameterName, value);
        return this;
    }

    /** Parameter value passed to the root stack on deploy. */
    public EnvironmentBase addDeployParameter(String parameterName, String value) {
        deployParameterBindings.put(parameterName, value);
        return this;
    }

    public Map<String, String> deployParameters() {
        return Collections.unmodifiableMap(deployParameterBindings);
    }

    public Map<String, Object> loadConfig() {
        if (config == null) {
            config = options.config()
                .map(supplied -> configLoader.validate(ConfigTrees.deepCopy(supplied)))
                .orElseGet(() -> configLoader.load(options.configFile()));
        }
        return config;
    }

    public Map<String, Object> config() {
        return loadConfig();
    }

    public String environmentName() {
        return ConfigTrees.string(ConfigTrees.section(loadConfig(), "global"), "environment_name", null);
    }

    public boolean printDebug() {
        return ConfigTrees.flag(ConfigTrees.section(loadConfig(), "global"), "print_debug");
    }

    /** Writes the factory defaults, including registered handlers' sections, unless the file already exists. */
    public Path initAction() {
        Path configFile = options.configFile();
        if (Files.exists(configFile)) {
            log.info("{} already exists, leaving it untouched", configFile);
            return configFile;
        }
        configLoader.writeDefaults(configFile, configLoader.factoryDefaults());
        log.info("Wrote default configuration to {}", configFile);
        return configFile;
    }

    /** Builds the root template and writes it to {@code templates/<global.output>}. */
    public Path createAction() {
        initializeTemplate();
        buildTemplate();
        return writeTemplateToFile();
    }

    /** Hook for subclasses; the root template is initialized when it runs. */
    protected void buildTemplate() {}

    public Template initializeTemplate() {
        var cfg = loadConfig();
        var templateConfig = ConfigTrees.section(cfg, "template");
        var globals = ConfigTrees.section(cfg, "global");

        var root = new Template(ConfigTrees.string(globals, "output", "environmentbase.template"));
        root.setDescription(ConfigTrees.string(templateConfig, "description", DEFAULT_DESCRIPTION));
        root.addParameterIdempotent(
            TemplateComposer.ec2KeyParameter(ConfigTrees.string(templateConfig, "ec2_key_default", "default-key"))
        );
        root.addParameterIdempotent(remoteAccessLocationParameter());
        addUtilityBucket(root, ConfigTrees.string(templateConfig, "utility_bucket", ""));

        var amiMap = AmiCatalog.load(options.projectDirectory(), options.createMissingFiles());
        root.addAmiMapping(amiMap);

        // storage is resolved on first upload so templates without children never touch the cloud
        this.composer = new TemplateComposer(
            root,
            ComposerSettings.fromConfig(cfg, amiMap),
            (bucket, key, body, acl) -> cloud().storage().putObject(bucket, key, body, acl),
            renderer,
            manualParameterBindings,
            clock
        );
        this.template = root;
        return root;
    }

    public Template template() {
        requireTemplate();
        return template;
    }

    public TemplateComposer composer() {
        requireTemplate();
        return composer;
    }

    public Resource addChildTemplate(Template child) {
        return composer().addChildTemplate(child);
    }

    public Resource addChildTemplate(Template child, UploadTarget target, Collection<String> dependsOn) {
        return composer().addChildTemplate(child, target, dependsOn);
    }

    public Path writeTemplateToFile() {
        var store = templateStore();
        store.write(renderer.normalize(renderer.render(template())));
        log.info("Wrote template {}", store.file());
        return store.file();
    }

    /**
     * Updates or creates the environment stack from the written template. With at least one stack event handler a
     * notification channel is opened and events are dispatched until the handlers are satisfied, the stack reaches a
     * terminal status or the monitor times out; the channel is always torn down.
     */
    public DeploymentReport deployAction() {
        var cfg = loadConfig();
        String stackName = environmentName();
        var orchestrator = new DeploymentOrchestrator(cloud().stacks(), templateStore());
        if (stackEventHandlers.isEmpty()) {
            var outcome = orchestrator.ensureDeployed(stackName, deployParameterBindings, Optional.empty());
            return new DeploymentReport(stackName, outcome, Optional.empty());
        }
        try (var session = NotificationSession.open(cloud().notifications(), stackName)) {
            var outcome = orchestrator.ensureDeployed(stackName, deployParameterBindings, Optional.of(session));
            if (outcome == DeployOutcome.UNCHANGED) {
                return new DeploymentReport(stackName, outcome, Optional.empty());
            }
            var settings = options.monitorSettings().withVerbose(
                options.monitorSettings().verbose() || ConfigTrees.flag(ConfigTrees.section(cfg, "global"), "print_debug")
            );
            var monitor = new StackEventMonitor(
                session.provider(), session.queue(), stackName, stackEventHandlers, settings, clock
            );
            return new DeploymentReport(stackName, outcome, Optional.of(monitor.run()));
        }
    }

    public String deleteAction() {
        String stackName = environmentName();
        new DeploymentOrchestrator(cloud().stacks(), templateStore()).delete(stackName);
        return stackName;
    }

    public void loadDatabasePasswordsFromEnv() {
        EnvironmentOverrides.apply(loadConfig(), DatabaseConfigHandler.SECTION, "password", System::getenv, printDebug());
    }

    /** Root stack parameter restricting remote access; overridable to change the default CIDR. */
    protected Parameter remoteAccessLocationParameter() {
        return Parameter.of("remoteAccessLocation", "String")
            .withDefault("0.0.0.0/0")
            .withDescription("CIDR block identifying the network address space that will be allowed to ingress into "
                + "public access points within this solution")
            .with("MinLength", 9)
            .with("MaxLength", 18)
            .with("AllowedPattern", "(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})/(\\d{1,2})")
            .with("ConstraintDescription", "must be a valid IP CIDR range of the form x.x.x.x/x");
    }

    protected CloudServices cloud() {
        if (cloud == null) {
            cloud = cloudFactory.apply(loadConfig());
        }
        return cloud;
    }

    TemplateStore templateStore() {
        String output = ConfigTrees.string(ConfigTrees.section(loadConfig(), "global"), "output", "environmentbase.template");
        return new TemplateStore(options.projectDirectory().resolve(TemplateStore.TEMPLATES_DIRECTORY), output);
    }

    @Override
    public void close() {
        if (cloud != null) {
            try {
                cloud.close();
            } catch (Exception ex) {
                log.warn("Failed to release cloud clients: {}", ex.getMessage());
            } finally {
                cloud = null;
            }
        }
    }

    private static void addUtilityBucket(Template root, String bucketName) {
        var properties = new LinkedHashMap<String, Object>();
        if (bucketName != null && !bucketName.isBlank()) {
            properties.put("BucketName", bucketName);
        }
        root.addResource(Resource.of("utilityBucket", "AWS::S3::Bucket", properties));
    }

    private void requireTemplate() {
        if (template == null) {
            throw new IllegalStateException("Root template not initialized, call initializeTemplate() first");
        }
    }
}
