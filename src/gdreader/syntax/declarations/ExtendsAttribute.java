package gdreader.syntax.declarations;

import gdreader.reader.Chars;
import gdreader.reader.ReadingState;
import gdreader.syntax.Slot;
import gdreader.syntax.TokensForm;
import gdreader.syntax.expressions.Expression;
import gdreader.syntax.expressions.ExpressionResolver;
import gdreader.syntax.tokens.Keyword;
import gdreader.syntax.tokens.KeywordKind;

/**
 * <code>extends Base</code>, where the base is a name, a member chain or a script path string.
 */
public final class ExtendsAttribute extends ClassMember {

	public enum State {
		EXTENDS,
		PATH,
		COMPLETED
	}

	public static final Slot<State, Keyword> EXTENDS = Slot.of(State.EXTENDS, Keyword.class);
	public static final Slot<State, Expression> PATH = Slot.of(State.PATH, Expression.class);

	private final TokensForm<State> form = new TokensForm<>(this, State.class);

	@Override
	public TokensForm<State> getForm() {
		return form;
	}

	public Expression getPath() {
		return form.get(PATH);
	}

	public void setPath(Expression value) {
		form.set(PATH, value);
	}

	@Override
	public void handleChar(char c, ReadingState state) {
		switch (form.getState()) {
			case EXTENDS:
				readKeyword(KeywordKind.EXTENDS, form.receiver(EXTENDS), c, state);
				return;
			case PATH:
				if (Chars.isSpace(c)) {
					readSpace(c, state);
					return;
				}
				if (Chars.isExpressionStart(c)) {
					state.push(new ExpressionResolver(form.receiver(PATH)));
					state.passChar(c);
					return;
				}
				form.skip(PATH);
				break;
			default:
				break;
		}
		state.popAndPass(c);
	}
}
