/**
 * Runtime wiring package.
 *
 * <p>{@link io.tradeloop.runtime.TradeLoopRuntime} binds a data root to its
 * event log, summary file and settings, and exposes the operations the CLI
 * maps to: running a session, reading events, reading the summary, and
 * validating the recorded files.
 */
package io.tradeloop.runtime;
