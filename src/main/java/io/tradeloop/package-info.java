/**
 * TradeLoop source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.tradeloop.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.tradeloop.cli.TradeLoopCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.tradeloop.engine.SessionOrchestrator} runs phases, heartbeats and recovery.</li>
 *   <li>{@code io.tradeloop.store} holds the append-only event log and the summary file.</li>
 * </ul>
 */
package io.tradeloop;
