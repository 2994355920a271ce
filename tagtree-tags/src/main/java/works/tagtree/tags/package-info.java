/**
 * The tag tree: a generic labeled tree of {@link works.tagtree.tags.CompoundTag compound},
 * {@link works.tagtree.tags.ListTag list}, and {@link works.tagtree.tags.ScalarTag scalar} nodes.
 * <p>
 * This package knows nothing about Java objects; see the {@code works.tagtree.mapper} package
 * for the mapping between objects and tags.
 */
package works.tagtree.tags;
