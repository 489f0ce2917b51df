/**
 * picocli front end. {@link io.channelshub.cli.ChannelsHubCommand} maps each subcommand to
 * the config, runtime and control-plane APIs; results go to stdout, errors to stderr with
 * exit code 1.
 */
package io.channelshub.cli;
