package gdreader.syntax.lists;

import gdreader.reader.Chars;
import gdreader.reader.NextWordResolver;
import gdreader.reader.ReadingState;
import gdreader.syntax.declarations.ClassMember;
import gdreader.syntax.declarations.ClassNameAttribute;
import gdreader.syntax.declarations.CustomAttribute;
import gdreader.syntax.declarations.EnumDeclaration;
import gdreader.syntax.declarations.ExtendsAttribute;
import gdreader.syntax.declarations.InnerClassDeclaration;
import gdreader.syntax.declarations.MethodDeclaration;
import gdreader.syntax.declarations.SignalDeclaration;
import gdreader.syntax.declarations.ToolAttribute;
import gdreader.syntax.declarations.VariableDeclaration;
import gdreader.syntax.tokens.KeywordKind;

/**
 * The members of a class body. A member is picked by the first word of its line, or by the word
 * after <code>static</code>; a line that no member starts with is kept as an invalid token.
 */
public final class ClassMembersList extends IntendedTokensList<ClassMember> {

	public ClassMembersList(int parentColumn) {
		super(parentColumn);
	}

	@Override
	protected void startItem(char c, ReadingState state) {
		if (c == '@') {
			pushItem(new CustomAttribute(), c, state);
		} else if (Chars.isIdentifierStart(c)) {
			startWord(c, state);
		} else {
			readInvalidLine(c, state);
		}
	}

	@Override
	protected void startItemWithWord(String word, ReadingState state) {
		KeywordKind kind = KeywordKind.bySequence(word);
		if (kind == null) {
			readInvalidLine(word, state);
			return;
		}
		switch (kind) {
			case TOOL:
				pushItem(new ToolAttribute(), word, state);
				break;
			case CLASS_NAME:
				pushItem(new ClassNameAttribute(), word, state);
				break;
			case EXTENDS:
				pushItem(new ExtendsAttribute(), word, state);
				break;
			case VAR:
			case CONST:
				pushItem(new VariableDeclaration(), word, state);
				break;
			case FUNC:
				pushItem(new MethodDeclaration(getLineColumn()), word, state);
				break;
			case STATIC:
				state.push(new NextWordResolver((next, s) -> startStatic(word, next, s)));
				break;
			case SIGNAL:
				pushItem(new SignalDeclaration(), word, state);
				break;
			case ENUM:
				pushItem(new EnumDeclaration(), word, state);
				break;
			case CLASS:
				pushItem(new InnerClassDeclaration(getLineColumn()), word, state);
				break;
			default:
				readInvalidLine(word, state);
				break;
		}
	}

	private void startStatic(String modifier, String next, ReadingState state) {
		if (next.equals(KeywordKind.VAR.getSequence())) {
			pushItem(new VariableDeclaration(), modifier, state);
		} else {
			pushItem(new MethodDeclaration(getLineColumn()), modifier, state);
		}
	}
}
