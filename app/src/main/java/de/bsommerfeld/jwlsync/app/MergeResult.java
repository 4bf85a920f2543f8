package de.bsommerfeld.jwlsync.app;

import de.bsommerfeld.jwlsync.archive.manifest.Manifest;
import de.bsommerfeld.jwlsync.db.MergeReport;

/**
 * Outcome of a successful merge.
 *
 * @param fileName suggested file name of the archive, {@code merged_...jwlibrary}
 * @param archive  the merged backup archive
 * @param manifest the manifest packed into {@code archive}
 * @param report   per-table counts and recovered warnings
 */
public record MergeResult(String fileName, byte[] archive, Manifest manifest, MergeReport report) {
}
