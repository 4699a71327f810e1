package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.statements.ExpressionStatement;
import gdreader.syntax.statements.ForStatement;
import gdreader.syntax.statements.IfStatement;
import gdreader.syntax.statements.MatchStatement;
import gdreader.syntax.statements.Statement;
import gdreader.syntax.statements.VariableDeclarationStatement;
import gdreader.syntax.statements.WhileStatement;
import gdreader.syntax.tokens.KeywordKind;

/**
 * A body of statements. Lines that start with a control keyword or a declaration open the
 * matching statement; anything else that can start an expression is an expression statement.
 */
public final class StatementsList extends IntendedTokensList<Statement> {

	private final String closingChars;

	public StatementsList(int parentColumn) {
		this(parentColumn, "");
	}

	/**
	 * @param closingChars characters that end the body where a statement would start, such as the
	 * bracket closing a call around a lambda
	 */
	public StatementsList(int parentColumn, String closingChars) {
		super(parentColumn);
		this.closingChars = closingChars;
	}

	@Override
	protected boolean isClosingChar(char c) {
		return closingChars.indexOf(c) >= 0;
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		if (Chars.isIdentifierStart(c)) {
			startWord(c, state);
		} else if (Chars.isExpressionStart(c)) {
			pushItem(new ExpressionStatement(), c, state);
		} else {
			readInvalidLine(c, state);
		}
	}

	@Override
	protected void startItemWithWord(String word, ReadingState state) {
		KeywordKind kind = KeywordKind.bySequence(word);
		if (kind == null) {
			pushItem(new ExpressionStatement(), word, state);
			return;
		}
		switch (kind) {
			case IF:
				pushItem(new IfStatement(getLineColumn()), word, state);
				break;
			case WHILE:
				pushItem(new WhileStatement(getLineColumn()), word, state);
				break;
			case FOR:
				pushItem(new ForStatement(getLineColumn()), word, state);
				break;
			case MATCH:
				pushItem(new MatchStatement(getLineColumn()), word, state);
				break;
			case VAR:
			case CONST:
				pushItem(new VariableDeclarationStatement(), word, state);
				break;
			default:
				pushItem(new ExpressionStatement(), word, state);
				break;
		}
	}
}
