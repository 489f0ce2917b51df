/**
 * SSH Channels Hub source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.channelshub.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.channelshub.cli.ChannelsHubCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.channelshub.runtime.ServiceOrchestrator} starts, supervises and stops channels.</li>
 *   <li>{@code io.channelshub.control.ControlPlaneServer} answers status and stop requests from other invocations.</li>
 * </ul>
 */
package io.channelshub;
