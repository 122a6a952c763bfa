package work.lcod.envbase.template;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Binds every parameter declared by a child template to a value available in the parent. Rules, first match wins:
 * <ol>
 *     <li>manual binding supplied for the whole composition;</li>
 *     <li>{@code availabilityZone<N>} reads the {@code AvailabilityZone} attribute of {@code privateSubnet<N>};</li>
 *     <li>parent parameter of the same name;</li>
 *     <li>parent resource of the same name;</li>
 *     <li>output of the same name recorded by a sibling child, which the new stack then depends on;</li>
 *     <li>otherwise the declaration is copied onto the parent and passed through.</li>
 * </ol>
 * Rule 6 mutates the parent. Callers composing children concurrently must serialize calls.
 */
public final class ParameterBindingResolver {
    private static final Pattern AVAILABILITY_ZONE = Pattern.compile("availabilityZone(\\d+)");

    private ParameterBindingResolver() {}

    public static BindingResult resolve(
        Template child,
        Map<String, ?> manualBindings,
        Template parent,
        StackOutputRegistry outputRegistry
    ) {
        Objects.requireNonNull(child, "child");
        Objects.requireNonNull(parent, "parent");
        var manual = manualBindings == null ? Map.<String, Object>of() : manualBindings;
        var registry = outputRegistry == null ? new StackOutputRegistry() : outputRegistry;

        var bindings = new LinkedHashMap<String, ValueRef>();
        var dependsOn = new LinkedHashSet<String>();
        for (var declaration : child.parameters().values()) {
            String name = declaration.name();
            if (manual.containsKey(name)) {
                bindings.put(name, ValueRef.of(manual.get(name)));
                continue;
            }
            var zone = AVAILABILITY_ZONE.matcher(name);
            if (zone.matches()) {
                bindings.put(name, ValueRef.getAtt("privateSubnet" + zone.group(1), "AvailabilityZone"));
                continue;
            }
            if (parent.parameters().containsKey(name) || parent.resources().containsKey(name)) {
                bindings.put(name, ValueRef.ref(name));
                continue;
            }
            var producer = registry.producerOf(name, child.name());
            if (producer.isPresent()) {
                String siblingStack = TemplateComposer.stackResourceName(producer.get());
                bindings.put(name, ValueRef.getAtt(siblingStack, "Outputs." + name));
                dependsOn.add(siblingStack);
                continue;
            }
            var declared = parent.addParameterIdempotent(declaration.copy());
            bindings.put(name, ValueRef.ref(declared.name()));
        }
        return new BindingResult(bindings, dependsOn);
    }
}
