package metalcc.coordinator.dns;

/**
 * A DNS zone the control plane manages records in.
 * Record names are relative to {@link #domain()}.
 */
public interface DnsZone {

    /**
     * Zone apex, e.g. {@code workloads.example.com}.
     */
    String domain();

    /**
     * Create or overwrite a record.
     */
    void createRecord(String name, String target, RecordType type);

    /**
     * Remove a record.
     *
     * @return false if no such record existed
     */
    boolean deleteRecord(String name, RecordType type);

    /**
     * Fully qualified name of a record in this zone.
     */
    default String qualify(String name) {
        return name + "." + domain();
    }
}
