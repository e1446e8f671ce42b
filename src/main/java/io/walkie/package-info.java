/**
 * Walkie daemon source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.walkie.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.walkie.cli.WalkieCommand} maps commands to the daemon or to control requests.</li>
 *   <li>{@code io.walkie.runtime.WalkieDaemon} owns channels, peers and the event loop they share.</li>
 *   <li>{@code io.walkie.ipc.IpcServer} serves the local control protocol.</li>
 *   <li>{@code io.walkie.lifecycle.DaemonLifecycle} enforces one daemon per directory.</li>
 * </ul>
 */
package io.walkie;
