/**
 * The {@link works.tagtree.mapper.exceptions.TagMappingException} family.
 * All are unchecked.
 */
package works.tagtree.mapper.exceptions;
