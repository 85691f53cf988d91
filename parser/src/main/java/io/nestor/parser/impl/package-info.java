/**
 * Scanner and tree builder behind {@link io.nestor.parser.api.NestedParser}.
 *
 * <p><b>WARNING: This entire package is internal and subject to change without notice.</b>
 *
 * <p>The scanner's event stream is exposed so the two stages can be tested in isolation. Use {@link
 * io.nestor.parser.api.NestedParser} to obtain parse trees.
 */
@io.nestor.parser.api.Internal(
    "Scanner internals. Use io.nestor.parser.api.NestedParser instead.")
package io.nestor.parser.impl;
