/**
 * Relational merge of two JW Library user stores.
 *
 * <p>
 * {@link de.bsommerfeld.jwlsync.db.EntityKind} describes the tables,
 * {@link de.bsommerfeld.jwlsync.db.MergeSchedule} fixes the order they are
 * merged in, {@link de.bsommerfeld.jwlsync.db.TableMerger} reconciles a single
 * table and {@link de.bsommerfeld.jwlsync.db.MergeOrchestrator} runs the whole
 * schedule inside one destination transaction.
 */
package de.bsommerfeld.jwlsync.db;
