/**
 * Disruptor-based batching of low-priority cache misses.
 */
package fr.lapetina.lex.core.optimizer.batch;
