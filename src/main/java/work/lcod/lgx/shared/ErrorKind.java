package work.lcod.lgx.shared;

/**
 * Failure categories surfaced by the package engine.
 */
public enum ErrorKind {
    /** Malformed tar/gzip bytes or an unparsable manifest. */
    FORMAT,
    /** Manifest fields, archive paths or variant layout break a rule. */
    VALIDATION,
    /** The caller asked for something impossible (missing main path, unknown variant). */
    USAGE,
    /** Operation on a closed or missing package handle. */
    STATE,
    /** Filesystem read or write failed. */
    IO
}
