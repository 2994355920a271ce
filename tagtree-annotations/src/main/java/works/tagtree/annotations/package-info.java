/**
 * Annotations that opt members into tag mapping.
 */
package works.tagtree.annotations;
