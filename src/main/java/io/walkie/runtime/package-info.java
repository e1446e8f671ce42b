/**
 * Daemon core.
 *
 * <p>{@link io.walkie.runtime.WalkieDaemon} wires the {@link io.walkie.runtime.ChannelRegistry},
 * {@link io.walkie.runtime.PeerRegistry} and {@link io.walkie.runtime.MessageRouter} onto one
 * {@link io.walkie.runtime.EventLoop}. All channel and peer state changes happen on that loop.
 */
package io.walkie.runtime;
