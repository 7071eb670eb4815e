package metalcc.coordinator.dns;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local zone for development setups and tests.
 */
public class InMemoryDnsZone implements DnsZone {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDnsZone.class);

    private final String domain;
    private final Map<String, String> records = new ConcurrentHashMap<>();

    public InMemoryDnsZone(String domain) {
        this.domain = domain;
    }

    @Override
    public String domain() {
        return domain;
    }

    @Override
    public void createRecord(String name, String target, RecordType type) {
        records.put(key(name, type), target);
        log.info("DNS {} record {} -> {}", type, qualify(name), target);
    }

    @Override
    public boolean deleteRecord(String name, RecordType type) {
        boolean removed = records.remove(key(name, type)) != null;
        if (removed) {
            log.info("DNS {} record {} removed", type, qualify(name));
        }
        return removed;
    }

    public Optional<String> lookup(String name, RecordType type) {
        return Optional.ofNullable(records.get(key(name, type)));
    }

    public int size() {
        return records.size();
    }

    private static String key(String name, RecordType type) {
        return type + ":" + name;
    }
}
