package it.unimib.datai.clout.controlplane.registry;

import it.unimib.datai.clout.common.model.FunctionRegistration;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory index of registrations by function id. Persistence is handled by {@link FunctionService}.
 */
@Component
public class FunctionRegistry {
    private final Map<String, FunctionRegistration> functions = new ConcurrentHashMap<>();

    public Collection<FunctionRegistration> list() {
        List<FunctionRegistration> all = new ArrayList<>(functions.values());
        all.sort(Comparator.comparing(FunctionRegistration::name).thenComparing(FunctionRegistration::id));
        return all;
    }

    public Optional<FunctionRegistration> get(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(functions.get(id));
    }

    public void put(FunctionRegistration registration) {
        functions.put(registration.id(), registration);
    }

    public FunctionRegistration remove(String id) {
        return functions.remove(id);
    }
}
