package metalcc.coordinator.dns;

public enum RecordType {
    A,
    CNAME
}
