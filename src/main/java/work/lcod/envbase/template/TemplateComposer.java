package work.lcod.envbase.template;

import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.envbase.cloud.ObjectStorage;

/**
 * Attaches child templates to a root template: each child is completed with the common parameters, uploaded as
 * its own document and linked through an {@code AWS::CloudFormation::Stack} resource whose parameters are bound
 * by {@link ParameterBindingResolver}.
 */
public final class TemplateComposer {
    private static final Logger log = LoggerFactory.getLogger(TemplateComposer.class);

    private final Template root;
    private final ComposerSettings settings;
    private final ObjectStorage storage;
    private final TemplateRenderer renderer;
    private final Map<String, Object> manualBindings;
    private final StackOutputRegistry outputRegistry = new StackOutputRegistry();
    private final Clock clock;

    public TemplateComposer(
        Template root,
        ComposerSettings settings,
        ObjectStorage storage,
        TemplateRenderer renderer,
        Map<String, Object> manualBindings,
        Clock clock
    ) {
        this.root = Objects.requireNonNull(root, "root");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.manualBindings = manualBindings == null ? Map.of() : manualBindings;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public static String stackResourceName(String templateName) {
        return templateName + "Stack";
    }

    public static Parameter ec2KeyParameter(String defaultKey) {
        return Parameter.of("ec2Key", "String")
            .withDefault(defaultKey)
            .withDescription("Name of an existing EC2 KeyPair to enable SSH access to the instances")
            .with("AllowedPattern", "[\\x20-\\x7E]*")
            .with("MinLength", 1)
            .with("MaxLength", 255)
            .with("ConstraintDescription", "can contain only ASCII characters.");
    }

    public Resource addChildTemplate(Template child) {
        return addChildTemplate(child, UploadTarget.defaults(), List.of());
    }

    /**
     * Attaches {@code child} as a nested stack. A child whose stack resource is already in the root is left as it is
     * and its existing resource is returned.
     */
    public Resource addChildTemplate(Template child, UploadTarget target, Collection<String> dependsOn) {
        var attached = root.resources().get(stackResourceName(child.name()));
        if (attached != null) {
            log.debug("Child template {} already attached as {}", child.name(), attached.name());
            return attached;
        }
        child.addCommonParameters(settings.subnetTypes(), settings.azCount());
        child.addParameterIdempotent(ec2KeyParameter(settings.ec2KeyDefault()));
        if (!settings.amiMap().isEmpty()) {
            child.addAmiMapping(settings.amiMap());
        }
        child.buildHook();

        String templateUrl = uploadTemplate(child, target == null ? UploadTarget.defaults() : target);

        var result = ParameterBindingResolver.resolve(child, manualBindings, root, outputRegistry);
        outputRegistry.record(child.name(), child.outputs().keySet());

        var properties = new LinkedHashMap<String, Object>();
        properties.put("TemplateURL", templateUrl);
        properties.put("Parameters", new LinkedHashMap<>(result.bindings()));
        properties.put("TimeoutInMinutes", settings.timeoutInMinutes());

        var allDependencies = new LinkedHashSet<String>();
        if (dependsOn != null) {
            allDependencies.addAll(dependsOn);
        }
        allDependencies.addAll(result.dependsOn());

        var stack = new Resource(stackResourceName(child.name()), Resource.STACK_TYPE, properties, allDependencies);
        log.debug("Attached child template {} as {} ({} parameters)", child.name(), stack.name(), result.bindings().size());
        return root.addResource(stack);
    }

    /** Uploads {@code <prefix>/<name>.<epochSeconds>.template} and returns its URL. */
    public String uploadTemplate(Template template, UploadTarget target) {
        var effective = target.orElse(settings);
        if (effective.bucket() == null || effective.bucket().isBlank()) {
            throw new IllegalStateException("No template bucket configured for " + template.name());
        }
        String keySerial = String.valueOf(clock.instant().getEpochSecond());
        String fileName = template.name() + "." + keySerial + ".template";
        String key = effective.prefix() == null || effective.prefix().isBlank()
            ? fileName
            : effective.prefix() + "/" + fileName;
        String url = storage.putObject(effective.bucket(), key, renderer.render(template), effective.acl());
        log.info("Uploaded template {} to {}", template.name(), url);
        return url;
    }

    public Template root() {
        return root;
    }

    public StackOutputRegistry outputRegistry() {
        return outputRegistry;
    }
}
