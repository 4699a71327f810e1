package gdreader.syntax.tokens;

public enum KeywordKind {
	TOOL("tool"),
	CLASS_NAME("class_name"),
	EXTENDS("extends"),
	CLASS("class"),
	FUNC("func"),
	STATIC("static"),
	VAR("var"),
	CONST("const"),
	SIGNAL("signal"),
	ENUM("enum"),
	IF("if"),
	ELIF("elif"),
	ELSE("else"),
	WHILE("while"),
	FOR("for"),
	IN("in"),
	MATCH("match"),
	RETURN("return"),
	PASS("pass"),
	BREAK("break"),
	CONTINUE("continue"),
	BREAKPOINT("breakpoint"),
	NULL("null"),
	SELF("self"),
	TRUE("true"),
	FALSE("false"),
	ARROW("->");

	private final String sequence;

	KeywordKind(String sequence) {
		this.sequence = sequence;
	}

	public String getSequence() {
		return sequence;
	}

	public static KeywordKind bySequence(String sequence) {
		for (KeywordKind kind : values()) {
			if (kind.sequence.equals(sequence)) {
				return kind;
			}
		}
		return null;
	}
}
