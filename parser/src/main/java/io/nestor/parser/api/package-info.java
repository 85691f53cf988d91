/**
 * Public API of the nestor parser.
 *
 * <p>Build a {@link io.nestor.parser.api.TokenRegistry} once from the delimiter pairs to recognize,
 * then call {@link io.nestor.parser.api.NestedParser#parse} for each input. The result is a tree of
 * {@link io.nestor.parser.api.Node}s whose spans map back to the input exactly; failures are
 * reported as {@link io.nestor.parser.api.NestorParseException} carrying a structured {@link
 * io.nestor.parser.api.ParseError}.
 */
package io.nestor.parser.api;
