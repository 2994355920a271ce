package works.tagtree.tags;

public enum TagType {
	COMPOUND,
	LIST,
	BYTE,
	SHORT,
	INT,
	LONG,
	FLOAT,
	DOUBLE,
	STRING,
	BYTE_ARRAY,
	INT_ARRAY;

	public boolean isScalar() {
		return this != COMPOUND && this != LIST;
	}
}
