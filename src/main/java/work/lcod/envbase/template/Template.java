package work.lcod.envbase.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory CloudFormation template graph. Subclasses describe child stacks and add their resources in
 * {@link #buildHook()}, which runs after the composer has attached the common parameters.
 */
public class Template {
    public static final String AMI_MAPPING = "RegionMap";

    private final String name;
    private String description;
    private final Map<String, Parameter> parameters = new LinkedHashMap<>();
    private final Map<String, Resource> resources = new LinkedHashMap<>();
    private final Map<String, Output> outputs = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> mappings = new LinkedHashMap<>();

    public Template(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    /** Declares a new parameter; declaring the same name twice is an error. */
    public Parameter addParameter(Parameter parameter) {
        if (parameters.containsKey(parameter.name())) {
            throw new IllegalArgumentException("Duplicate parameter '" + parameter.name() + "' in template " + name);
        }
        parameters.put(parameter.name(), parameter);
        return parameter;
    }

    /** Declares the parameter unless one with the same name exists; returns the declaration in effect. */
    public Parameter addParameterIdempotent(Parameter parameter) {
        var existing = parameters.putIfAbsent(parameter.name(), parameter);
        return existing != null ? existing : parameter;
    }

    public Resource addResource(Resource resource) {
        if (resources.containsKey(resource.name())) {
            throw new IllegalArgumentException("Duplicate resource '" + resource.name() + "' in template " + name);
        }
        resources.put(resource.name(), resource);
        return resource;
    }

    public Output addOutput(Output output) {
        if (outputs.containsKey(output.name())) {
            throw new IllegalArgumentException("Duplicate output '" + output.name() + "' in template " + name);
        }
        outputs.put(output.name(), output);
        return output;
    }

    public void addMapping(String mappingName, Map<String, Object> mapping) {
        mappings.put(mappingName, new LinkedHashMap<>(mapping));
    }

    public void addAmiMapping(Map<String, Object> amiMap) {
        addMapping(AMI_MAPPING, amiMap);
    }

    /**
     * Declares the network parameters every child stack can bind to: VPC identity, the common security group, the
     * utility bucket and, per availability zone, the zone name and one subnet per subnet type.
     */
    public void addCommonParameters(List<String> subnetTypes, int azCount) {
        addParameterIdempotent(Parameter.of("vpcCidr", "String")
            .withDescription("CIDR block claimed by the VPC")
            .with("AllowedPattern", "(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})/(\\d{1,2})"));
        addParameterIdempotent(Parameter.of("vpcId", "String").withDescription("ID of the VPC"));
        addParameterIdempotent(Parameter.of("commonSecurityGroup", "String")
            .withDescription("Security group shared by every instance of the environment"));
        addParameterIdempotent(Parameter.of("utilityBucket", "String")
            .withDescription("S3 bucket receiving the environment logs"));
        for (int index = 1; index <= azCount; index++) {
            addParameterIdempotent(Parameter.of("availabilityZone" + index, "String")
                .withDescription("Availability zone " + index));
            for (var subnetType : subnetTypes) {
                addParameterIdempotent(Parameter.of(subnetType + "Subnet" + index, "String")
                    .withDescription(subnetType + " subnet in availability zone " + index));
            }
        }
    }

    protected void buildHook() {}

    public Map<String, Parameter> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public Map<String, Resource> resources() {
        return Collections.unmodifiableMap(resources);
    }

    public Map<String, Output> outputs() {
        return Collections.unmodifiableMap(outputs);
    }

    public Map<String, Map<String, Object>> mappings() {
        return Collections.unmodifiableMap(mappings);
    }
}
