package ed.inf.adbs.querysync.synth;

public enum SortDirection {
    ASC,
    DESC
}
