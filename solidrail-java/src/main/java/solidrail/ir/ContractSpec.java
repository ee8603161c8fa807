package solidrail.ir;

import java.util.List;

/**
 * One contract as it will be rendered, built from a single Ruby class.
 *
 * @param parentNames primary parent first, then included capability sets in inclusion order
 */
public record ContractSpec(
        String name,
        List<String> parentNames,
        List<EnumSpec> enums,
        List<StateVariable> stateVariables,
        List<EventSpec> events,
        List<FunctionSpec> functions
) {
    public ContractSpec {
        parentNames = List.copyOf(parentNames);
        enums = List.copyOf(enums);
        stateVariables = List.copyOf(stateVariables);
        events = List.copyOf(events);
        functions = List.copyOf(functions);
    }

    public StateVariable stateVariable(String name) {
        for (StateVariable v : stateVariables) {
            if (v.name().equals(name)) return v;
        }
        return null;
    }

    public FunctionSpec function(String name) {
        for (FunctionSpec f : functions) {
            if (f.name().equals(name)) return f;
        }
        return null;
    }
}
