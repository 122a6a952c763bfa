package work.lcod.envbase.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record Output(String name, Object value, String description) {
    public Output {
        Objects.requireNonNull(name, "name");
    }

    public static Output of(String name, Object value) {
        return new Output(name, value, null);
    }

    Map<String, Object> toJson() {
        var json = new LinkedHashMap<String, Object>();
        if (description != null && !description.isBlank()) {
            json.put("Description", description);
        }
        json.put("Value", ValueRef.expand(value));
        return json;
    }
}
