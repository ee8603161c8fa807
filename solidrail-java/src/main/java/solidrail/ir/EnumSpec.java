package solidrail.ir;

import java.util.List;

public record EnumSpec(String name, List<String> members) {
    public EnumSpec {
        members = List.copyOf(members);
    }
}
