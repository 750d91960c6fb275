package io.meteofetch.runtime;

import io.meteofetch.core.FetchRequest;
import io.meteofetch.core.ProviderClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Known providers and the order in which a request tries them.
 */
public class ProviderRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderClient> clients = new LinkedHashMap<>();
    private final List<String> defaultOrder;

    public ProviderRegistry(Collection<ProviderClient> clients) {
        this(clients, List.of());
    }

    /**
     * @param defaultOrder ids in preferred order for {@code auto}; providers not listed follow in registration order
     */
    public ProviderRegistry(Collection<ProviderClient> clients, List<String> defaultOrder) {
        for (ProviderClient c : clients) this.clients.put(c.id(), c);
        List<String> order = new ArrayList<>();
        for (String id : defaultOrder) {
            if (this.clients.containsKey(id) && !order.contains(id)) order.add(id);
        }
        for (String id : this.clients.keySet()) {
            if (!order.contains(id)) order.add(id);
        }
        this.defaultOrder = List.copyOf(order);
    }

    public Collection<ProviderClient> clients() { return clients.values(); }

    public Optional<ProviderClient> get(String id) { return Optional.ofNullable(clients.get(id)); }

    public List<String> availableIds() {
        return defaultOrder.stream().filter(id -> clients.get(id).isAvailable()).toList();
    }

    /**
     * Candidate order for a preference: {@code auto} yields every available provider in default order; an explicit
     * id puts that provider first, or falls back to the automatic order when it is unavailable.
     *
     * @throws IllegalArgumentException for an unknown provider id
     */
    public List<ProviderClient> order(String preference) {
        List<ProviderClient> available = new ArrayList<>();
        for (String id : availableIds()) available.add(clients.get(id));
        if (preference == null || preference.isBlank() || FetchRequest.AUTO.equalsIgnoreCase(preference)) {
            return available;
        }
        ProviderClient preferred = clients.get(preference);
        if (preferred == null) throw new IllegalArgumentException("unknown provider: " + preference);
        if (!preferred.isAvailable()) {
            LOG.warn("Preferred provider {} is not available, using automatic order", preference);
            return available;
        }
        available.remove(preferred);
        available.add(0, preferred);
        return available;
    }
}
