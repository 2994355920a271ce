package works.tagtree.mapper;

/**
 * How deserialization may update a member.
 */
public enum MemberCapability {
	/**
	 * The member has a writer: its value is deserialized and assigned.
	 */
	REPLACEABLE,

	/**
	 * The member has no writer: its current value is read and populated in place.
	 * A scalar or null current value is left untouched.
	 */
	IN_PLACE_ONLY,
}
