package solidrail.ir;

import java.util.List;

public record EventSpec(String name, List<Parameter> parameters) {
    public EventSpec {
        parameters = List.copyOf(parameters);
    }
}
