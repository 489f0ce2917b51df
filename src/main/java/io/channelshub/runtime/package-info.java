/**
 * Daemon runtime.
 *
 * <p>{@link io.channelshub.runtime.ServiceOrchestrator} owns the service state and one
 * {@link io.channelshub.runtime.ChannelRunner} per channel. Runners keep their SSH session
 * alive with {@link io.channelshub.runtime.BackoffPolicy} driven reconnects and hand accepted
 * connections to {@link io.channelshub.runtime.RelayEngine}. Everything runs on named daemon
 * threads; {@link io.channelshub.runtime.CancellationSignal} is the only stop mechanism.
 */
package io.channelshub.runtime;
