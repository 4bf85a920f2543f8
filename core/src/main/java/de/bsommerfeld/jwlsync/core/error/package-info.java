/**
 * Checked error taxonomy shared by all modules.
 *
 * <pre>
 *   SyncException (phase)
 *    ├── IncompatibleInputException     schema mismatch, missing/malformed input
 *    ├── ArchiveIoException             archive / workspace / store I/O
 *    ├── MergeFailureException          (database) one entity kind failed
 *    └── ConstraintViolationException   (database) transaction rejected
 * </pre>
 *
 * Recoverable per-record conditions (duplicate conflicts, unresolved foreign
 * keys) never appear here; they are returned as merge warnings.
 */
package de.bsommerfeld.jwlsync.core.error;
