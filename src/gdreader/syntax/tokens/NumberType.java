package gdreader.syntax.tokens;

public enum NumberType {
	LONG_DECIMAL,
	LONG_BINARY,
	LONG_HEXADECIMAL,
	DOUBLE
}
