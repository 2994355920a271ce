/**
 * Maps Java objects to and from tag trees.
 * <p>
 * The entry point is {@link works.tagtree.mapper.TagMapper}, or the static
 * {@link works.tagtree.mapper.TagSerializer} for default settings.
 * Which members of a type take part is decided by {@link works.tagtree.mapper.MemberSelector},
 * either from {@link works.tagtree.annotations.TagProperty TagProperty} annotations
 * or from explicitly registered {@link works.tagtree.mapper.TypeMapping}s.
 */
package works.tagtree.mapper;
