/**
 * How the mapper classifies Java types.
 */
package works.tagtree.mapper.types;
