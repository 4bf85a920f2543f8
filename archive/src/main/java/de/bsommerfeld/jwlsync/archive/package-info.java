/**
 * Backup archive handling: unpacking into a per-run {@link de.bsommerfeld.jwlsync.archive.Workspace},
 * packing the merged result, and the manifest that travels with it.
 */
package de.bsommerfeld.jwlsync.archive;
