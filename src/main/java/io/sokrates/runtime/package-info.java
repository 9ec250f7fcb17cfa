/**
 * Runtime wiring package.
 *
 * <p>{@link io.sokrates.runtime.SokratesRuntime} opens the store and builds the
 * queue service, the daemon loop and the daemon manager from one configuration.
 */
package io.sokrates.runtime;
