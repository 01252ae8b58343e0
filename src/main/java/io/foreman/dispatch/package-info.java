/**
 * Dispatch pass and the pieces it is built from.
 *
 * <p>{@link io.foreman.dispatch.Dispatcher} owns the pass order; liveness, slot and phase decisions live in
 * their own classes so they can be tested against a plain store.
 */
package io.foreman.dispatch;
